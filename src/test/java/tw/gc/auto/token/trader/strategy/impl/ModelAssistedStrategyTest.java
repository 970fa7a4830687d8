package tw.gc.auto.token.trader.strategy.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.TokenSource;
import tw.gc.auto.token.trader.enums.TradeAction;
import tw.gc.auto.token.trader.strategy.ModelVerdict;
import tw.gc.auto.token.trader.strategy.TokenScoringModel;
import tw.gc.auto.token.trader.testutil.StubTradingRuntime;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_A;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_B;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.T0;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.meta;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.prices;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.properties;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.tick;

@ExtendWith(MockitoExtension.class)
class ModelAssistedStrategyTest {

    @Mock
    private TokenScoringModel model;

    private TradingProperties.Model config;
    private ModelAssistedStrategy strategy;
    private StubTradingRuntime runtime;
    private TokenMeta discovered;

    @BeforeEach
    void setUp() {
        config = properties().getStrategy().getModel();
        strategy = new ModelAssistedStrategy(config, model);
        runtime = new StubTradingRuntime();
        discovered = meta(MINT_A, TokenSource.PUMP_FUN, T0);
    }

    @Test
    void requiresValidation_shouldBeBypassedByDefault() {
        assertThat(strategy.requiresValidation()).isFalse();

        config.setBypassValidation(false);
        assertThat(strategy.requiresValidation()).isTrue();
    }

    @Test
    void onDiscovered_whenConfidentBuy_shouldBuy() {
        when(model.evaluate(eq(MINT_A), eq(discovered), anyList(), eq(false)))
                .thenReturn(new ModelVerdict(ModelVerdict.Recommendation.BUY, 0.85, "strong launch"));

        Optional<TradeIntent> intent = strategy.onDiscovered(discovered, runtime);

        assertThat(intent).hasValueSatisfying(i -> {
            assertThat(i.action()).isEqualTo(TradeAction.BUY);
            assertThat(i.reason()).contains("strong launch");
        });
    }

    @Test
    void onDiscovered_whenConfidenceBelowThreshold_shouldSkip() {
        when(model.evaluate(any(), any(), anyList(), anyBoolean()))
                .thenReturn(new ModelVerdict(ModelVerdict.Recommendation.BUY, 0.6, "maybe"));

        assertThat(strategy.onDiscovered(discovered, runtime)).isEmpty();
    }

    @Test
    void onDiscovered_whenModelFails_shouldSkip() {
        when(model.evaluate(any(), any(), anyList(), anyBoolean())).thenThrow(new IllegalStateException("timeout"));

        assertThat(strategy.onDiscovered(discovered, runtime)).isEmpty();
    }

    @Test
    void onDiscovered_whenAtCapacity_shouldNotAskModel() {
        runtime.maxConcurrent(1).hold(MINT_B);

        assertThat(strategy.onDiscovered(discovered, runtime)).isEmpty();
        verifyNoInteractions(model);
    }

    @Test
    void onTick_whenHeldAndConfidentSell_shouldSell() {
        runtime.hold(MINT_A);
        when(model.evaluate(eq(MINT_A), any(), anyList(), eq(true)))
                .thenReturn(new ModelVerdict(ModelVerdict.Recommendation.SELL, 0.9, "liquidity draining"));

        assertThat(strategy.onTick(tick(MINT_A, 0.9), prices(1.0, 0.9), runtime))
                .map(TradeIntent::action).contains(TradeAction.SELL);
    }

    @Test
    void onTick_whenSellRecommendedButNotHeld_shouldSkip() {
        when(model.evaluate(any(), any(), anyList(), anyBoolean()))
                .thenReturn(new ModelVerdict(ModelVerdict.Recommendation.SELL, 0.9, "bad"));

        assertThat(strategy.onTick(tick(MINT_A, 0.9), prices(1.0, 0.9), runtime)).isEmpty();
    }

    @Test
    void onTick_whenTickEvaluationDisabled_shouldNotAskModel() {
        config.setEvaluateOnTick(false);

        assertThat(strategy.onTick(tick(MINT_A, 1.0), prices(1.0), runtime)).isEmpty();
        verifyNoInteractions(model);
    }
}
