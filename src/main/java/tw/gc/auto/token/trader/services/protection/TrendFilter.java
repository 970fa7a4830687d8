package tw.gc.auto.token.trader.services.protection;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.enums.MarketState;
import tw.gc.auto.token.trader.indicators.TechnicalIndicatorCalculator;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies a token's recent prices as trending or choppy and gates new entries on choppy
 * markets. Choppy means frequent sign reversals; a flat or weakly drifting window is unknown.
 */
@Service
@Slf4j
public class TrendFilter {

    private static final double FLAT_RANGE = 1e-12;

    private final Map<String, MarketState> lastStates = new ConcurrentHashMap<>();
    private final TradingProperties.Trend config;

    public TrendFilter(TradingProperties properties) {
        this.config = properties.getTrend();
    }

    public MarketState analyzeMarket(String mint, List<Double> prices) {
        MarketState state = classify(prices);
        MarketState previous = lastStates.put(mint, state);
        if (previous != null && previous != state) {
            log.debug("📈 {} market state {} -> {}", mint, previous, state);
        }
        return state;
    }

    /**
     * Net directional movement over total movement across the lookback window, in [0, 1].
     */
    public double calculateTrendStrength(List<Double> prices) {
        return TechnicalIndicatorCalculator.directionalEfficiency(lookback(prices));
    }

    /**
     * Permissive unless the last classification was choppy and choppy markets are blocked.
     */
    public boolean shouldAllowTrade(String mint) {
        MarketState state = lastStates.getOrDefault(mint, MarketState.UNKNOWN);
        return state != MarketState.CHOPPY || !config.isBlockWhenChoppy();
    }

    public MarketState lastState(String mint) {
        return lastStates.getOrDefault(mint, MarketState.UNKNOWN);
    }

    public void forget(String mint) {
        lastStates.remove(mint);
    }

    private MarketState classify(List<Double> prices) {
        if (prices == null || prices.size() < config.getMinSamples()) {
            return MarketState.UNKNOWN;
        }
        List<Double> window = lookback(prices);
        if (isFlat(window)) {
            return MarketState.UNKNOWN;
        }
        double reversals = TechnicalIndicatorCalculator.reversalRatio(window);
        if (reversals >= config.getMaxReversalRatio()) {
            return MarketState.CHOPPY;
        }
        double strength = TechnicalIndicatorCalculator.directionalEfficiency(window);
        return strength >= config.getTrendingStrength() ? MarketState.TRENDING : MarketState.UNKNOWN;
    }

    private static boolean isFlat(List<Double> window) {
        double min = window.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double max = window.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
        return max - min < FLAT_RANGE;
    }

    private List<Double> lookback(List<Double> prices) {
        int size = prices.size();
        int lookback = Math.max(config.getLookback(), 2);
        return size <= lookback ? prices : prices.subList(size - lookback, size);
    }
}
