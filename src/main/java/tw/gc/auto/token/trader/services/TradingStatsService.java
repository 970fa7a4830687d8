package tw.gc.auto.token.trader.services;

import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Trade counters since startup.
 */
@Service
public class TradingStatsService {

    private final AtomicLong buys = new AtomicLong();
    private final AtomicLong sells = new AtomicLong();
    private final AtomicLong failedTrades = new AtomicLong();
    private final AtomicLong forcedExits = new AtomicLong();
    private final AtomicLong rugExits = new AtomicLong();
    private final AtomicLong cycles = new AtomicLong();

    public void recordBuy() {
        buys.incrementAndGet();
    }

    public void recordSell(boolean forced) {
        sells.incrementAndGet();
        if (forced) {
            forcedExits.incrementAndGet();
        }
    }

    public void recordFailure() {
        failedTrades.incrementAndGet();
    }

    public void recordRugExit() {
        rugExits.incrementAndGet();
    }

    public long recordCycle() {
        return cycles.incrementAndGet();
    }

    public long getBuys() {
        return buys.get();
    }

    public long getSells() {
        return sells.get();
    }

    public long getFailedTrades() {
        return failedTrades.get();
    }

    public long getForcedExits() {
        return forcedExits.get();
    }

    public long getRugExits() {
        return rugExits.get();
    }

    public long getCycles() {
        return cycles.get();
    }
}
