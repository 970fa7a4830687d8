package tw.gc.auto.token.trader.strategy;

import tw.gc.auto.token.trader.entities.MarketTick;
import tw.gc.auto.token.trader.entities.TokenMeta;

import java.util.List;

/**
 * What a strategy is asked to decide on: a fresh discovery or a new tick.
 *
 * @param meta   discovery metadata, null for ticks of tokens that were never discovered via the feed
 * @param tick   latest tick, null for discoveries
 * @param prices observed prices oldest first, including the latest tick
 */
public record StrategyEvent(Type type, String mint, TokenMeta meta, MarketTick tick, List<Double> prices) {

    public enum Type {
        DISCOVERED,
        TICK
    }

    public StrategyEvent {
        prices = List.copyOf(prices);
    }

    public static StrategyEvent discovered(TokenMeta meta, List<Double> prices) {
        return new StrategyEvent(Type.DISCOVERED, meta.mint(), meta, null, prices);
    }

    public static StrategyEvent tick(MarketTick tick, List<Double> prices) {
        return new StrategyEvent(Type.TICK, tick.mint(), null, tick, prices);
    }

    public boolean isDiscovery() {
        return type == Type.DISCOVERED;
    }
}
