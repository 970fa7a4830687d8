package tw.gc.auto.token.trader.services.protection;

import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.ExitRecommendation;
import tw.gc.auto.token.trader.services.position.Position;

/**
 * Hard stop loss plus a trailing stop that follows the peak once the position has been armed.
 */
@Service
public class TrailingStopPolicy {

    private final TradingProperties.TrailingStop config;

    public TrailingStopPolicy(TradingProperties properties) {
        this.config = properties.getTrailingStop();
    }

    public ExitRecommendation evaluate(Position position) {
        if (!config.isEnabled()) {
            return ExitRecommendation.hold("Trailing stop disabled");
        }
        double pnl = position.getUnrealizedPnlPercent();
        if (pnl <= -config.getHardStopLossPercent() / 100.0) {
            return ExitRecommendation.exit(String.format("Hard stop loss hit (%.2f%%)", pnl * 100));
        }
        if (position.isTrailingStopArmed()) {
            double stopPrice = position.getPeakPrice() * (1.0 - config.getTrailPercent() / 100.0);
            if (position.getCurrentPrice() <= stopPrice) {
                return ExitRecommendation.exit(String.format("Trailing stop hit: %.8f <= %.8f (peak %.8f)",
                        position.getCurrentPrice(), stopPrice, position.getPeakPrice()));
            }
        }
        return ExitRecommendation.hold("Within stop limits");
    }
}
