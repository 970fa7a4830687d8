package tw.gc.auto.token.trader.strategy.impl;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.auto.token.trader.strategy.StrategyEvent;
import tw.gc.auto.token.trader.strategy.TokenStrategy;
import tw.gc.auto.token.trader.strategy.TradingRuntime;

import java.util.List;
import java.util.Optional;

/**
 * RSI strategy.
 *
 * Entry: oscillator at or below oversold while not held. A fresh discovery without enough
 * history may be entered directly.
 * Exit: oscillator at or above overbought, bearish divergence (price up, oscillator down), or
 * oscillator crossing up through the neutral level. Signals depend on prices only, never on
 * how long the position has been open.
 */
@Slf4j
public class OscillatorStrategy implements TokenStrategy {

    private final TradingProperties.Oscillator config;

    public OscillatorStrategy(TradingProperties.Oscillator config) {
        this.config = config;
    }

    @Override
    public Optional<TradeIntent> decide(StrategyEvent event, TradingRuntime runtime) {
        String mint = event.mint();
        boolean held = runtime.isHeld(mint);
        List<Double> prices = event.prices();
        Optional<Double> current = TechnicalIndicatorCalculator.relativeStrengthIndex(prices, config.getPeriod());

        if (!held) {
            return decideEntry(event, runtime, current);
        }
        if (event.isDiscovery() || current.isEmpty()) {
            return Optional.empty();
        }

        double rsi = current.get();
        if (rsi >= config.getOverbought()) {
            return Optional.of(TradeIntent.sell(mint, String.format("RSI overbought (%.1f)", rsi)));
        }
        Optional<Double> previous = previousRsi(prices);
        if (previous.isEmpty()) {
            return Optional.empty();
        }
        double prevRsi = previous.get();
        double lastPrice = prices.get(prices.size() - 1);
        double prevPrice = prices.get(prices.size() - 2);
        double priceRise = (lastPrice - prevPrice) / prevPrice * 100.0;
        if (priceRise > config.getDivergencePriceRisePercent()
                && prevRsi - rsi > config.getDivergenceOscillatorDrop()) {
            return Optional.of(TradeIntent.sell(mint, String.format(
                    "Bearish divergence (price +%.2f%%, RSI %.1f -> %.1f)", priceRise, prevRsi, rsi)));
        }
        if (prevRsi <= config.getNeutral() && rsi > config.getNeutral()) {
            return Optional.of(TradeIntent.sell(mint, String.format(
                    "RSI crossed above neutral (%.1f -> %.1f)", prevRsi, rsi)));
        }
        return Optional.empty();
    }

    private Optional<TradeIntent> decideEntry(StrategyEvent event, TradingRuntime runtime, Optional<Double> current) {
        String mint = event.mint();
        if (!runtime.hasCapacity()) {
            log.debug("⏸️ {} skipped, {} of {} slots in use", mint, runtime.heldCount(), runtime.maxConcurrentTokens());
            return Optional.empty();
        }
        if (current.isEmpty()) {
            if (event.isDiscovery() && config.isEnterWithoutHistory()) {
                return Optional.of(TradeIntent.buy(mint, "Fresh discovery without RSI history"));
            }
            return Optional.empty();
        }
        double rsi = current.get();
        if (rsi <= config.getOversold()) {
            return Optional.of(TradeIntent.buy(mint, String.format("RSI oversold (%.1f)", rsi)));
        }
        return Optional.empty();
    }

    private Optional<Double> previousRsi(List<Double> prices) {
        if (prices.size() < 2) {
            return Optional.empty();
        }
        return TechnicalIndicatorCalculator.relativeStrengthIndex(prices.subList(0, prices.size() - 1),
                config.getPeriod());
    }

    @Override
    public StrategyType getType() {
        return StrategyType.OSCILLATOR;
    }
}
