package tw.gc.auto.token.trader.services.protection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.RugAnalysis;
import tw.gc.auto.token.trader.enums.RugUrgency;
import tw.gc.auto.token.trader.util.RollingWindow;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Scores every tick for signs of a rug pull using a bounded window of recent samples per token.
 *
 * Rules:
 * - Extreme drop: price fell by at least the configured share from the previous sample (urgent)
 * - Volume collapse: volume fell by at least the configured share from the recent average
 * - Repeated drops: several consecutive ticks each fell by more than the configured share
 */
@Service
@Slf4j
public class RugDetector {

    public static final String REASON_EXTREME_DROP = "extreme price drop";
    public static final String REASON_VOLUME_COLLAPSE = "volume collapse";
    public static final String REASON_REPEATED_DROPS = "repeated price drops";

    static final double URGENT_SEVERITY = 0.7;
    static final double VOLUME_COLLAPSE_SEVERITY = 0.4;
    static final double REPEATED_DROP_SEVERITY = 0.5;

    private final Map<String, RollingWindow<Sample>> windows = new ConcurrentHashMap<>();
    private final Map<String, Instant> lastAlerts = new ConcurrentHashMap<>();
    private final TradingProperties.Rug config;
    private final Clock clock;

    public RugDetector(TradingProperties properties, Clock clock) {
        this.config = properties.getRug();
        this.clock = clock;
    }

    record Sample(double price, double volume, Instant observedAt) {
    }

    public RugAnalysis analyzeTick(String mint, double price, double volume) {
        RollingWindow<Sample> window = windows.computeIfAbsent(mint,
                key -> new RollingWindow<>(config.getWindowSize()));
        synchronized (window) {
            List<Sample> prior = window.toList();
            window.add(new Sample(price, volume, clock.instant()));
            if (prior.isEmpty()) {
                return RugAnalysis.clear();
            }
            RugAnalysis analysis = evaluate(prior, price, volume);
            if (analysis.isRugPull()) {
                lastAlerts.put(mint, clock.instant());
                log.warn("🚨 Rug signal on {}: {} (confidence {}, urgency {})", mint, analysis.reasons(),
                        String.format("%.2f", analysis.confidence()), analysis.urgency());
            }
            return analysis;
        }
    }

    private RugAnalysis evaluate(List<Sample> prior, double price, double volume) {
        Set<String> reasons = new LinkedHashSet<>();
        double confidence = 0.0;
        boolean urgent = false;

        double previousPrice = prior.get(prior.size() - 1).price();
        double drop = dropFraction(previousPrice, price);
        double extremeDrop = config.getExtremeDropPercent() / 100.0;
        if (drop >= extremeDrop) {
            double severity = Math.min(1.0, URGENT_SEVERITY + (drop - extremeDrop));
            reasons.add(REASON_EXTREME_DROP);
            confidence += severity;
            urgent = severity >= URGENT_SEVERITY;
        }

        double averageVolume = averageVolume(prior);
        if (averageVolume > 0 && dropFraction(averageVolume, volume) >= config.getVolumeCollapsePercent() / 100.0) {
            reasons.add(REASON_VOLUME_COLLAPSE);
            confidence += VOLUME_COLLAPSE_SEVERITY;
        }

        if (consecutiveDrops(prior, price) >= config.getRepeatedDropCount()) {
            reasons.add(REASON_REPEATED_DROPS);
            confidence += REPEATED_DROP_SEVERITY;
        }

        if (reasons.isEmpty()) {
            return RugAnalysis.clear();
        }
        RugUrgency urgency = urgent ? RugUrgency.HIGH : RugUrgency.MEDIUM;
        return new RugAnalysis(true, Math.min(1.0, confidence), urgency, reasons);
    }

    private double averageVolume(List<Sample> prior) {
        int samples = Math.min(config.getVolumeAverageSamples(), prior.size());
        double sum = 0.0;
        for (int i = prior.size() - samples; i < prior.size(); i++) {
            sum += prior.get(i).volume();
        }
        return sum / samples;
    }

    private int consecutiveDrops(List<Sample> prior, double price) {
        double threshold = config.getRepeatedDropPercent() / 100.0;
        int count = 0;
        double later = price;
        for (int i = prior.size() - 1; i >= 0; i--) {
            double earlier = prior.get(i).price();
            if (dropFraction(earlier, later) <= threshold) {
                break;
            }
            count++;
            later = earlier;
        }
        return count;
    }

    private static double dropFraction(double from, double to) {
        if (from <= 0) {
            return 0.0;
        }
        return (from - to) / from;
    }

    /**
     * True while a token is within the alert cooldown after any rug verdict.
     */
    public boolean isRecentAlert(String mint) {
        Instant alertedAt = lastAlerts.get(mint);
        return alertedAt != null
                && alertedAt.plusMillis(config.getAlertCooldownMs()).isAfter(clock.instant());
    }

    /**
     * Evicts samples and alerts older than the retention window.
     */
    public void cleanup() {
        Instant cutoff = clock.instant().minusMillis(config.getRetentionMs());
        int evicted = 0;
        for (Map.Entry<String, RollingWindow<Sample>> entry : windows.entrySet()) {
            RollingWindow<Sample> window = entry.getValue();
            synchronized (window) {
                evicted += window.evictWhile(sample -> sample.observedAt().isBefore(cutoff));
                if (window.isEmpty()) {
                    windows.remove(entry.getKey(), window);
                }
            }
        }
        Instant alertCutoff = clock.instant().minusMillis(config.getAlertCooldownMs());
        lastAlerts.values().removeIf(alertedAt -> alertedAt.isBefore(alertCutoff));
        if (evicted > 0) {
            log.debug("🧹 Rug detector evicted {} stale samples", evicted);
        }
    }

    public void forget(String mint) {
        windows.remove(mint);
    }

    public int trackedCount() {
        return windows.size();
    }
}
