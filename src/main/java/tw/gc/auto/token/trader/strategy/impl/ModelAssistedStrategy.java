package tw.gc.auto.token.trader.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.strategy.ModelVerdict;
import tw.gc.auto.token.trader.strategy.StrategyEvent;
import tw.gc.auto.token.trader.strategy.TokenScoringModel;
import tw.gc.auto.token.trader.strategy.TradingRuntime;
import tw.gc.auto.token.trader.strategy.TokenStrategy;

import java.util.Optional;

/**
 * Delegates decisions to an external scoring model and acts only above a confidence threshold.
 *
 * <p>With {@code bypass-validation} on (the default) discoveries skip the basic validation gate,
 * since the model does its own due diligence on every token it scores.
 */
@Slf4j
public class ModelAssistedStrategy implements TokenStrategy {

    private final TradingProperties.Model config;
    private final TokenScoringModel model;

    public ModelAssistedStrategy(TradingProperties.Model config, TokenScoringModel model) {
        this.config = config;
        this.model = model;
    }

    @Override
    public boolean requiresValidation() {
        return !config.isBypassValidation();
    }

    @Override
    public Optional<TradeIntent> decide(StrategyEvent event, TradingRuntime runtime) {
        String mint = event.mint();
        boolean held = runtime.isHeld(mint);
        if (!event.isDiscovery() && !config.isEvaluateOnTick()) {
            return Optional.empty();
        }
        if (!held && !runtime.hasCapacity()) {
            return Optional.empty();
        }

        ModelVerdict verdict;
        try {
            verdict = model.evaluate(mint, event.meta(), event.prices(), held);
        } catch (RuntimeException e) {
            log.warn("⚠️ Scoring model failed for {}: {}", mint, e.getMessage());
            return Optional.empty();
        }
        if (verdict == null || verdict.confidence() < config.getConfidenceThreshold()) {
            return Optional.empty();
        }

        String reason = String.format("Model %s (confidence %.2f): %s",
                verdict.recommendation(), verdict.confidence(), verdict.reasoning());
        if (verdict.recommendation() == ModelVerdict.Recommendation.BUY && !held) {
            return Optional.of(TradeIntent.buy(mint, reason));
        }
        if (verdict.recommendation() == ModelVerdict.Recommendation.SELL && held) {
            return Optional.of(TradeIntent.sell(mint, reason));
        }
        return Optional.empty();
    }

    @Override
    public StrategyType getType() {
        return StrategyType.MODEL_ASSISTED;
    }
}
