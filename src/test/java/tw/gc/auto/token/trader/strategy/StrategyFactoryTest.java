package tw.gc.auto.token.trader.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.strategy.impl.ModelAssistedStrategy;
import tw.gc.auto.token.trader.strategy.impl.MomentumScoringModel;
import tw.gc.auto.token.trader.strategy.impl.OscillatorStrategy;
import tw.gc.auto.token.trader.strategy.impl.PriorityWhitelistStrategy;
import tw.gc.auto.token.trader.testutil.TokenTestFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StrategyFactoryTest {

    @Mock
    private ObjectProvider<TokenScoringModel> scoringModel;

    private TradingProperties properties;
    private StrategyFactory factory;

    @BeforeEach
    void setUp() {
        properties = TokenTestFactory.properties();
        factory = new StrategyFactory(properties, scoringModel);
    }

    @Test
    void create_oscillator_shouldRequireValidation() {
        TokenStrategy strategy = factory.create(StrategyType.OSCILLATOR);

        assertThat(strategy).isInstanceOf(OscillatorStrategy.class);
        assertThat(strategy.getType()).isEqualTo(StrategyType.OSCILLATOR);
        assertThat(strategy.requiresValidation()).isTrue();
    }

    @Test
    void create_priority_shouldBuildWhitelistStrategy() {
        TokenStrategy strategy = factory.create(StrategyType.PRIORITY);

        assertThat(strategy).isInstanceOf(PriorityWhitelistStrategy.class);
        assertThat(strategy.getName()).isEqualTo("PriorityWhitelistStrategy");
    }

    @Test
    void create_modelAssisted_shouldUseAvailableModel() {
        when(scoringModel.getIfAvailable()).thenReturn(new MomentumScoringModel());

        TokenStrategy strategy = factory.create(StrategyType.MODEL_ASSISTED);

        assertThat(strategy).isInstanceOf(ModelAssistedStrategy.class);
        assertThat(strategy.requiresValidation()).isFalse();
    }

    @Test
    void create_modelAssisted_withValidationKept_shouldRequireValidation() {
        properties.getStrategy().getModel().setBypassValidation(false);
        when(scoringModel.getIfAvailable()).thenReturn(new MomentumScoringModel());

        assertThat(factory.create(StrategyType.MODEL_ASSISTED).requiresValidation()).isTrue();
    }

    @Test
    void create_modelAssisted_withoutModel_shouldFail() {
        when(scoringModel.getIfAvailable()).thenReturn(null);

        assertThatThrownBy(() -> factory.create(StrategyType.MODEL_ASSISTED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("TokenScoringModel");
    }
}
