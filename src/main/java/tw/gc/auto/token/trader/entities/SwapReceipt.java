package tw.gc.auto.token.trader.entities;

import java.time.Instant;

public record SwapReceipt(String signature, Instant confirmedAt) {
}
