package tw.gc.auto.token.trader.indicators;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Utility class for calculating indicators over token price series.
 */
public final class TechnicalIndicatorCalculator {

    private static final double EPSILON = 1e-12;

    private TechnicalIndicatorCalculator() {
        throw new AssertionError("Utility class");
    }

    public static Optional<Double> simpleMovingAverage(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period) {
            return Optional.empty();
        }
        return Optional.of(average(prices.subList(prices.size() - period, prices.size())));
    }

    /**
     * Oscillator in [0, 100] from simple averages of the last {@code period} gains and losses.
     * A perfectly flat window reads as neutral (50).
     */
    public static Optional<Double> relativeStrengthIndex(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period + 1) {
            return Optional.empty();
        }
        double gainSum = 0.0;
        double lossSum = 0.0;
        for (int i = prices.size() - period; i < prices.size(); i++) {
            double change = prices.get(i) - prices.get(i - 1);
            if (change > 0) {
                gainSum += change;
            } else {
                lossSum += Math.abs(change);
            }
        }
        double avgGain = gainSum / period;
        double avgLoss = lossSum / period;
        if (avgLoss < EPSILON && avgGain < EPSILON) {
            return Optional.of(50.0);
        }
        if (avgLoss < EPSILON) {
            return Optional.of(100.0);
        }
        if (avgGain < EPSILON) {
            return Optional.of(0.0);
        }
        double rs = avgGain / avgLoss;
        return Optional.of(100.0 - (100.0 / (1.0 + rs)));
    }

    /**
     * Simple returns between consecutive prices; empty for fewer than two prices.
     */
    public static List<Double> simpleReturns(List<Double> prices) {
        Objects.requireNonNull(prices, "prices");
        List<Double> returns = new ArrayList<>(Math.max(0, prices.size() - 1));
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            returns.add(Math.abs(previous) < EPSILON ? 0.0 : prices.get(i) / previous - 1.0);
        }
        return returns;
    }

    /**
     * Population standard deviation of simple returns, 0 when there are fewer than two prices.
     */
    public static double returnVolatility(List<Double> prices) {
        List<Double> returns = simpleReturns(prices);
        if (returns.isEmpty()) {
            return 0.0;
        }
        return standardDeviation(returns, average(returns));
    }

    /**
     * Net directional movement divided by total absolute movement, in [0, 1].
     */
    public static double directionalEfficiency(List<Double> prices) {
        Objects.requireNonNull(prices, "prices");
        if (prices.size() < 2) {
            return 0.0;
        }
        double totalMovement = 0.0;
        for (int i = 1; i < prices.size(); i++) {
            totalMovement += Math.abs(prices.get(i) - prices.get(i - 1));
        }
        if (totalMovement < EPSILON) {
            return 0.0;
        }
        double net = Math.abs(prices.get(prices.size() - 1) - prices.get(0));
        return Math.min(1.0, net / totalMovement);
    }

    /**
     * Share of consecutive non-zero deltas that flip sign, in [0, 1].
     */
    public static double reversalRatio(List<Double> prices) {
        Objects.requireNonNull(prices, "prices");
        int previousSign = 0;
        int comparisons = 0;
        int reversals = 0;
        for (int i = 1; i < prices.size(); i++) {
            double delta = prices.get(i) - prices.get(i - 1);
            if (Math.abs(delta) < EPSILON) {
                continue;
            }
            int sign = delta > 0 ? 1 : -1;
            if (previousSign != 0) {
                comparisons++;
                if (sign != previousSign) {
                    reversals++;
                }
            }
            previousSign = sign;
        }
        return comparisons == 0 ? 0.0 : (double) reversals / comparisons;
    }

    public static Optional<Double> rateOfChange(List<Double> prices, int period) {
        Objects.requireNonNull(prices, "prices");
        validatePositive(period, "period");
        if (prices.size() < period + 1) {
            return Optional.empty();
        }
        double base = prices.get(prices.size() - 1 - period);
        if (Math.abs(base) < EPSILON) {
            return Optional.empty();
        }
        return Optional.of(prices.get(prices.size() - 1) / base - 1.0);
    }

    public static double average(List<Double> values) {
        if (values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.size();
    }

    private static void validatePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    private static double standardDeviation(List<Double> values, double mean) {
        double variance = 0.0;
        for (double value : values) {
            double diff = value - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / values.size());
    }
}
