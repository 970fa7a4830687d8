package tw.gc.auto.token.trader.entities;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Snapshot handed to the control layer.
 */
@Value
@Builder
public class BotStatus {
    boolean running;
    Duration uptime;
    int activeTokenCount;
    int heldPositionCount;
    long buys;
    long sells;
    long failedTrades;
    long forcedExits;
    long rugExits;
    long cycles;
    /** Null when the balance could not be fetched. */
    BigDecimal balance;
    double portfolioValue;
    double unrealizedPnl;
}
