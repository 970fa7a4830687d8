package tw.gc.auto.token.trader.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.strategy.StrategyEvent;
import tw.gc.auto.token.trader.strategy.TokenStrategy;
import tw.gc.auto.token.trader.strategy.TradingRuntime;

import java.util.Optional;

/**
 * Buys tokens from preferred discovery sources or on the whitelist as soon as they appear.
 * Never sells; exits are left to the protective layers.
 */
@Slf4j
public class PriorityWhitelistStrategy implements TokenStrategy {

    private final TradingProperties.Priority config;

    public PriorityWhitelistStrategy(TradingProperties.Priority config) {
        this.config = config;
    }

    @Override
    public Optional<TradeIntent> decide(StrategyEvent event, TradingRuntime runtime) {
        String mint = event.mint();
        if (runtime.isHeld(mint)) {
            return Optional.empty();
        }
        if (!runtime.hasCapacity()) {
            log.debug("⏸️ {} skipped, capacity {} reached", mint, runtime.maxConcurrentTokens());
            return Optional.empty();
        }
        boolean whitelisted = runtime.isWhitelisted(mint);
        if (config.isRequireWhitelist() && !whitelisted) {
            return Optional.empty();
        }
        if (event.isDiscovery()) {
            TokenMeta meta = event.meta();
            if (whitelisted) {
                return Optional.of(TradeIntent.buy(mint, "Whitelisted token discovered"));
            }
            if (config.getPreferredSources().contains(meta.source())) {
                return Optional.of(TradeIntent.buy(mint, "Preferred source " + meta.source()));
            }
            return Optional.empty();
        }
        // Whitelisted tokens are also monitored without any discovery event
        if (whitelisted) {
            return Optional.of(TradeIntent.buy(mint, "Whitelisted token not yet held"));
        }
        return Optional.empty();
    }

    @Override
    public StrategyType getType() {
        return StrategyType.PRIORITY;
    }
}
