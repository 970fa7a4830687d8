package tw.gc.auto.token.trader.entities;

import java.math.BigDecimal;

public record TokenHolding(String mint, BigDecimal amount) {
}
