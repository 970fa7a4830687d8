package tw.gc.auto.token.trader.strategy;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.strategy.impl.ModelAssistedStrategy;
import tw.gc.auto.token.trader.strategy.impl.OscillatorStrategy;
import tw.gc.auto.token.trader.strategy.impl.PriorityWhitelistStrategy;

/**
 * Builds the configured strategy variant.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StrategyFactory {

    private final TradingProperties properties;
    private final ObjectProvider<TokenScoringModel> scoringModel;

    public TokenStrategy create(StrategyType type) {
        TradingProperties.Strategy config = properties.getStrategy();
        TokenStrategy strategy = switch (type) {
            case OSCILLATOR -> new OscillatorStrategy(config.getOscillator());
            case PRIORITY -> new PriorityWhitelistStrategy(config.getPriority());
            case MODEL_ASSISTED -> {
                TokenScoringModel model = scoringModel.getIfAvailable();
                if (model == null) {
                    throw new IllegalStateException("MODEL_ASSISTED strategy needs a TokenScoringModel bean");
                }
                yield new ModelAssistedStrategy(config.getModel(), model);
            }
        };
        log.info("🧠 Strategy {} selected (validation gate {})", strategy.getName(),
                strategy.requiresValidation() ? "on" : "bypassed");
        return strategy;
    }
}
