package tw.gc.auto.token.trader.entities;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import tw.gc.auto.token.trader.enums.TradeAction;

/**
 * Outcome of one execution. A failed result always carries a failure reason.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SwapResult {
    private String mint;
    private TradeAction action;
    private boolean success;
    private double executedPrice;
    private String signature;
    private String failureReason;
    private int attempts;

    public static SwapResult succeeded(String mint, TradeAction action, double executedPrice,
                                       String signature, int attempts) {
        return SwapResult.builder()
                .mint(mint)
                .action(action)
                .success(true)
                .executedPrice(executedPrice)
                .signature(signature)
                .attempts(attempts)
                .build();
    }

    public static SwapResult failed(String mint, TradeAction action, String failureReason, int attempts) {
        return SwapResult.builder()
                .mint(mint)
                .action(action)
                .success(false)
                .failureReason(failureReason)
                .attempts(attempts)
                .build();
    }
}
