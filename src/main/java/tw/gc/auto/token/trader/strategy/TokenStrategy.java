package tw.gc.auto.token.trader.strategy;

import tw.gc.auto.token.trader.entities.MarketTick;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.StrategyType;

import java.util.List;
import java.util.Optional;

/**
 * A trading decision unit. Implementations keep no per-token state: the same event and runtime
 * always give the same intent.
 */
public interface TokenStrategy {

    Optional<TradeIntent> decide(StrategyEvent event, TradingRuntime runtime);

    StrategyType getType();

    default String getName() {
        return getClass().getSimpleName();
    }

    /**
     * Whether discoveries must pass the basic token validation gate before reaching this strategy.
     */
    default boolean requiresValidation() {
        return true;
    }

    default Optional<TradeIntent> onDiscovered(TokenMeta meta, TradingRuntime runtime) {
        return decide(StrategyEvent.discovered(meta, runtime.priceHistory(meta.mint())), runtime);
    }

    default Optional<TradeIntent> onTick(MarketTick tick, List<Double> prices, TradingRuntime runtime) {
        return decide(StrategyEvent.tick(tick, prices), runtime);
    }
}
