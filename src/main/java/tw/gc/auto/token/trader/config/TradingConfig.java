package tw.gc.auto.token.trader.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tw.gc.auto.token.trader.market.DiscoveryFeed;
import tw.gc.auto.token.trader.market.paper.QueueDiscoveryFeed;
import tw.gc.auto.token.trader.strategy.StrategyFactory;
import tw.gc.auto.token.trader.strategy.TokenStrategy;

import java.time.Clock;

@Configuration
public class TradingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenStrategy tokenStrategy(StrategyFactory strategyFactory, TradingProperties properties) {
        return strategyFactory.create(properties.getStrategy().getType());
    }

    @Bean
    @ConditionalOnMissingBean(DiscoveryFeed.class)
    public QueueDiscoveryFeed queueDiscoveryFeed() {
        return new QueueDiscoveryFeed();
    }
}
