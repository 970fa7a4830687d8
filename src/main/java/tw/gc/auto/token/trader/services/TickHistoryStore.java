package tw.gc.auto.token.trader.services;

import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.util.RollingWindow;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Bounded price history for every monitored token, held or not.
 */
@Service
public class TickHistoryStore {

    private final Map<String, RollingWindow<Double>> histories = new ConcurrentHashMap<>();
    private final int capacity;

    public TickHistoryStore(TradingProperties properties) {
        this.capacity = properties.getPositions().getHistoryCapacity();
    }

    public void record(String mint, double price) {
        RollingWindow<Double> window = histories.computeIfAbsent(mint, key -> new RollingWindow<>(capacity));
        synchronized (window) {
            window.add(price);
        }
    }

    public List<Double> prices(String mint) {
        RollingWindow<Double> window = histories.get(mint);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return window.toList();
        }
    }

    public void forget(String mint) {
        histories.remove(mint);
    }

    public int trackedCount() {
        return histories.size();
    }
}
