package tw.gc.auto.token.trader.services.position;

import tw.gc.auto.token.trader.indicators.TechnicalIndicatorCalculator;
import tw.gc.auto.token.trader.util.RollingWindow;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * An open position in one token. Only {@link PositionBook} mutates it; a removed position is
 * never reused.
 */
public class Position {

    private final String mint;
    private final double entryPrice;
    private final double notionalValue;
    private final Instant openedAt;
    private final RollingWindow<Double> priceHistory;

    private double currentPrice;
    private double peakPrice;
    private double troughPrice;
    private boolean trailingStopArmed;
    private double volatility;
    private Instant lastUpdatedAt;

    Position(String mint, double entryPrice, double notionalValue, Instant openedAt, int historyCapacity) {
        this.mint = mint;
        this.entryPrice = entryPrice;
        this.notionalValue = notionalValue;
        this.openedAt = openedAt;
        this.priceHistory = new RollingWindow<>(historyCapacity);
        this.priceHistory.add(entryPrice);
        this.currentPrice = entryPrice;
        this.peakPrice = entryPrice;
        this.troughPrice = entryPrice;
        this.lastUpdatedAt = openedAt;
    }

    void applyPrice(double price, Instant observedAt, double trailingActivationPercent) {
        currentPrice = price;
        priceHistory.add(price);
        if (price > peakPrice) {
            peakPrice = price;
        }
        if (price < troughPrice) {
            troughPrice = price;
        }
        if (!trailingStopArmed && getUnrealizedPnlPercent() * 100.0 >= trailingActivationPercent) {
            trailingStopArmed = true;
        }
        volatility = TechnicalIndicatorCalculator.returnVolatility(priceHistory.toList());
        lastUpdatedAt = observedAt;
    }

    public String getMint() {
        return mint;
    }

    public double getEntryPrice() {
        return entryPrice;
    }

    public double getNotionalValue() {
        return notionalValue;
    }

    public Instant getOpenedAt() {
        return openedAt;
    }

    public Instant getLastUpdatedAt() {
        return lastUpdatedAt;
    }

    public double getCurrentPrice() {
        return currentPrice;
    }

    public double getPeakPrice() {
        return peakPrice;
    }

    public double getTroughPrice() {
        return troughPrice;
    }

    public boolean isTrailingStopArmed() {
        return trailingStopArmed;
    }

    public double getVolatility() {
        return volatility;
    }

    public List<Double> getPriceHistory() {
        return priceHistory.toList();
    }

    /**
     * Fractional gain or loss against entry, from the latest price only.
     */
    public double getUnrealizedPnlPercent() {
        return currentPrice / entryPrice - 1.0;
    }

    public double getUnrealizedPnl() {
        return notionalValue * getUnrealizedPnlPercent();
    }

    public double getMarketValue() {
        return notionalValue + getUnrealizedPnl();
    }

    /**
     * Fractional distance of the current price below the peak.
     */
    public double getDrawdownFromPeak() {
        return 1.0 - currentPrice / peakPrice;
    }

    public Duration getHoldDuration(Instant now) {
        return Duration.between(openedAt, now);
    }

    @Override
    public String toString() {
        return String.format("Position[%s entry=%.8f current=%.8f peak=%.8f pnl=%.2f%%]",
                mint, entryPrice, currentPrice, peakPrice, getUnrealizedPnlPercent() * 100);
    }
}
