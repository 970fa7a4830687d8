package tw.gc.auto.token.trader.entities;

import java.time.Instant;

/**
 * One price/volume observation for a token.
 */
public record MarketTick(String mint, double price, double volume, Instant observedAt) {

    /**
     * A tick is usable only with a finite positive price and a finite non-negative volume.
     */
    public boolean isValid() {
        return Double.isFinite(price) && price > 0
                && Double.isFinite(volume) && volume >= 0;
    }
}
