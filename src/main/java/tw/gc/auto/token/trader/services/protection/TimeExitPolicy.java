package tw.gc.auto.token.trader.services.protection;

import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.ExitRecommendation;
import tw.gc.auto.token.trader.services.position.Position;

import java.time.Clock;
import java.time.Duration;

/**
 * Recommends closing positions that stayed unprofitable for too long. Profitable positions are
 * never closed by age alone.
 */
@Service
public class TimeExitPolicy {

    public static final String NO_EXIT = "No time-based exit needed";

    private final TradingProperties.TimeExit config;
    private final Clock clock;

    public TimeExitPolicy(TradingProperties properties, Clock clock) {
        this.config = properties.getTimeExit();
        this.clock = clock;
    }

    public ExitRecommendation analyzeTimeBasedExit(Position position) {
        if (!config.isEnabled()) {
            return ExitRecommendation.hold("Time-based exit disabled");
        }
        Duration age = position.getHoldDuration(clock.instant());
        if (age.toMillis() < config.getMinAgeMs()) {
            return ExitRecommendation.hold(NO_EXIT);
        }
        double pnl = position.getUnrealizedPnlPercent();
        if (age.toMillis() >= config.getMaxHoldUnprofitableMs() && pnl < 0) {
            return ExitRecommendation.exit(String.format("Held %d min while unprofitable (%.2f%%)",
                    age.toMinutes(), pnl * 100));
        }
        return ExitRecommendation.hold(NO_EXIT);
    }
}
