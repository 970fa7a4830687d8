package tw.gc.auto.token.trader.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;

/**
 * A swap quote from the aggregator. Amounts are in whole units of each mint.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapQuote {
    private String inputMint;
    private String outputMint;
    private BigDecimal inAmount;
    private BigDecimal outAmount;
    private Instant expiresAt;
    /** Serialized route handed back to the signer as-is. */
    private String route;

    public boolean isExpired(Instant now) {
        return expiresAt != null && now.isAfter(expiresAt);
    }

    /**
     * Price of {@code tokenMint} in the other mint of the pair.
     */
    public double pricePer(String tokenMint) {
        if (tokenMint.equals(outputMint)) {
            return inAmount.divide(outAmount, MathContext.DECIMAL64).doubleValue();
        }
        return outAmount.divide(inAmount, MathContext.DECIMAL64).doubleValue();
    }
}
