package tw.gc.auto.token.trader.strategy.impl;

import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.auto.token.trader.strategy.ModelVerdict;
import tw.gc.auto.token.trader.strategy.TokenScoringModel;

import java.util.List;
import java.util.Optional;

/**
 * Local stand-in for the external model used in paper mode: scores short-term momentum.
 */
public class MomentumScoringModel implements TokenScoringModel {

    private static final int PERIOD = 5;
    // Rate of change that maps to full confidence
    private static final double FULL_CONFIDENCE_MOVE = 0.10;

    @Override
    public ModelVerdict evaluate(String mint, TokenMeta meta, List<Double> prices, boolean held) {
        Optional<Double> roc = TechnicalIndicatorCalculator.rateOfChange(prices, Math.min(PERIOD, Math.max(1, prices.size() - 1)));
        if (prices.size() < 2 || roc.isEmpty()) {
            return ModelVerdict.hold("Not enough prices");
        }
        double change = roc.get();
        double confidence = Math.min(1.0, Math.abs(change) / FULL_CONFIDENCE_MOVE);
        if (change > 0 && !held) {
            return new ModelVerdict(ModelVerdict.Recommendation.BUY, confidence,
                    String.format("momentum +%.2f%%", change * 100));
        }
        if (change < 0 && held) {
            return new ModelVerdict(ModelVerdict.Recommendation.SELL, confidence,
                    String.format("momentum %.2f%%", change * 100));
        }
        return new ModelVerdict(ModelVerdict.Recommendation.HOLD, confidence, "no edge");
    }
}
