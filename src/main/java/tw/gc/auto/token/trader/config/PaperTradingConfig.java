package tw.gc.auto.token.trader.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.auto.token.trader.market.paper.PaperMarketDataPort;
import tw.gc.auto.token.trader.market.paper.PaperSigner;
import tw.gc.auto.token.trader.strategy.TokenScoringModel;
import tw.gc.auto.token.trader.strategy.impl.MomentumScoringModel;

import java.time.Clock;

/**
 * In-memory chain used when {@code trading.mode=PAPER}.
 */
@Configuration
@ConditionalOnProperty(prefix = "trading", name = "mode", havingValue = "PAPER", matchIfMissing = true)
public class PaperTradingConfig {

    @Bean
    public PaperMarketDataPort paperMarketDataPort(TradingProperties properties, Clock clock) {
        return new PaperMarketDataPort(properties, clock);
    }

    @Bean
    public PaperSigner paperSigner(PaperMarketDataPort market, Clock clock) {
        return new PaperSigner(market, clock);
    }

    @Bean
    @ConditionalOnMissingBean(TokenScoringModel.class)
    public MomentumScoringModel momentumScoringModel() {
        return new MomentumScoringModel();
    }
}
