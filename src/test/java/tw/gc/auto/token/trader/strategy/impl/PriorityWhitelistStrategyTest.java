package tw.gc.auto.token.trader.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.TokenSource;
import tw.gc.auto.token.trader.enums.TradeAction;
import tw.gc.auto.token.trader.testutil.StubTradingRuntime;

import static org.assertj.core.api.Assertions.assertThat;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_A;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_B;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.T0;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.meta;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.prices;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.properties;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.tick;

class PriorityWhitelistStrategyTest {

    private TradingProperties.Priority config;
    private PriorityWhitelistStrategy strategy;
    private StubTradingRuntime runtime;

    @BeforeEach
    void setUp() {
        config = properties().getStrategy().getPriority();
        strategy = new PriorityWhitelistStrategy(config);
        runtime = new StubTradingRuntime();
    }

    @Test
    void onDiscovered_whenPreferredSource_shouldBuy() {
        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.PUMP_FUN, T0), runtime))
                .map(TradeIntent::action).contains(TradeAction.BUY);
    }

    @Test
    void onDiscovered_whenOtherSourceAndNotWhitelisted_shouldSkip() {
        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.DEX_SCREENER, T0), runtime)).isEmpty();
    }

    @Test
    void onDiscovered_whenWhitelisted_shouldBuyFromAnySource() {
        runtime.whitelist(MINT_A);

        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.RAYDIUM_POOL, T0), runtime))
                .map(TradeIntent::reason).hasValueSatisfying(r -> assertThat(r).contains("Whitelisted"));
    }

    @Test
    void onDiscovered_whenWhitelistRequiredAndMissing_shouldSkipPreferredSource() {
        config.setRequireWhitelist(true);

        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.PUMP_FUN, T0), runtime)).isEmpty();
    }

    @Test
    void onDiscovered_whenAtCapacity_shouldSkip() {
        runtime.maxConcurrent(1).hold(MINT_B).whitelist(MINT_A);

        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.PUMP_FUN, T0), runtime)).isEmpty();
    }

    @Test
    void onDiscovered_whenAlreadyHeld_shouldSkip() {
        runtime.hold(MINT_A);

        assertThat(strategy.onDiscovered(meta(MINT_A, TokenSource.PUMP_FUN, T0), runtime)).isEmpty();
    }

    @Test
    void onTick_whenHeld_shouldNeverSell() {
        runtime.hold(MINT_A).whitelist(MINT_A);

        assertThat(strategy.onTick(tick(MINT_A, 0.1), prices(1.0, 0.5, 0.1), runtime)).isEmpty();
    }

    @Test
    void onTick_whenWhitelistedAndNotHeld_shouldBuy() {
        runtime.whitelist(MINT_A);

        assertThat(strategy.onTick(tick(MINT_A, 1.0), prices(1.0), runtime))
                .map(TradeIntent::action).contains(TradeAction.BUY);
    }

    @Test
    void onTick_whenNotWhitelisted_shouldSkip() {
        assertThat(strategy.onTick(tick(MINT_A, 1.0), prices(1.0), runtime)).isEmpty();
    }
}
