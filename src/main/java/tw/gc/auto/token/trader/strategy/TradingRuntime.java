package tw.gc.auto.token.trader.strategy;

import java.time.Instant;
import java.util.List;

/**
 * Read-only view of the bot that strategies decide against. Strategies never act through it;
 * they return intents and the orchestrator executes them.
 */
public interface TradingRuntime {

    boolean isHeld(String mint);

    int heldCount();

    int maxConcurrentTokens();

    boolean isWhitelisted(String mint);

    /** Observed prices for the token, oldest first. Empty when none were recorded yet. */
    List<Double> priceHistory(String mint);

    Instant now();

    default boolean hasCapacity() {
        return heldCount() < maxConcurrentTokens();
    }
}
