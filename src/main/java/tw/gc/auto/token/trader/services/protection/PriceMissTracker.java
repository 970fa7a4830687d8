package tw.gc.auto.token.trader.services.protection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Counts consecutive cycles without a usable price per token. Held tokens that keep missing
 * prices cannot be protected by price-based exits, so they are sold once the strike limit is
 * reached inside the window.
 */
@Service
@Slf4j
public class PriceMissTracker {

    private final Map<String, Strikes> misses = new ConcurrentHashMap<>();
    private final TradingProperties.PriceMiss config;
    private final Clock clock;

    public PriceMissTracker(TradingProperties properties, Clock clock) {
        this.config = properties.getPriceMiss();
        this.clock = clock;
    }

    record Strikes(int count, Instant firstMissAt) {
    }

    /**
     * @return consecutive misses inside the current window, this one included
     */
    public int recordMiss(String mint) {
        Instant now = clock.instant();
        Strikes strikes = misses.compute(mint, (key, existing) -> {
            if (existing == null || isOutsideWindow(existing, now)) {
                return new Strikes(1, now);
            }
            return new Strikes(existing.count() + 1, existing.firstMissAt());
        });
        return strikes.count();
    }

    public void recordSuccess(String mint) {
        misses.remove(mint);
    }

    public boolean shouldForceSell(String mint) {
        if (!config.isSellOnMissing()) {
            return false;
        }
        Strikes strikes = misses.get(mint);
        if (strikes == null || isOutsideWindow(strikes, clock.instant())) {
            return false;
        }
        return strikes.count() >= config.getMaxStrikes();
    }

    public int missCount(String mint) {
        Strikes strikes = misses.get(mint);
        return strikes == null ? 0 : strikes.count();
    }

    /**
     * Drops strike counts whose window ran out twice over.
     */
    public void cleanup() {
        Instant cutoff = clock.instant().minusMillis(config.getWindowMs() * 2);
        int before = misses.size();
        misses.values().removeIf(strikes -> strikes.firstMissAt().isBefore(cutoff));
        if (misses.size() < before) {
            log.debug("🧹 Dropped {} stale price-miss counters", before - misses.size());
        }
    }

    public void forget(String mint) {
        misses.remove(mint);
    }

    private boolean isOutsideWindow(Strikes strikes, Instant now) {
        return strikes.firstMissAt().plusMillis(config.getWindowMs()).isBefore(now);
    }
}
