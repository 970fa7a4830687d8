package tw.gc.auto.token.trader.testutil;

import tw.gc.auto.token.trader.strategy.TradingRuntime;

import java.time.Instant;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hand-driven runtime for strategy tests.
 */
public class StubTradingRuntime implements TradingRuntime {

    private final Set<String> held = new HashSet<>();
    private final Set<String> whitelist = new HashSet<>();
    private final Map<String, List<Double>> histories = new HashMap<>();
    private int maxConcurrentTokens = 5;
    private Instant now = TokenTestFactory.T0;

    public StubTradingRuntime hold(String mint) {
        held.add(mint);
        return this;
    }

    public StubTradingRuntime whitelist(String mint) {
        whitelist.add(mint);
        return this;
    }

    public StubTradingRuntime history(String mint, List<Double> prices) {
        histories.put(mint, prices);
        return this;
    }

    public StubTradingRuntime maxConcurrent(int max) {
        this.maxConcurrentTokens = max;
        return this;
    }

    public StubTradingRuntime at(Instant instant) {
        this.now = instant;
        return this;
    }

    @Override
    public boolean isHeld(String mint) {
        return held.contains(mint);
    }

    @Override
    public int heldCount() {
        return held.size();
    }

    @Override
    public int maxConcurrentTokens() {
        return maxConcurrentTokens;
    }

    @Override
    public boolean isWhitelisted(String mint) {
        return whitelist.contains(mint);
    }

    @Override
    public List<Double> priceHistory(String mint) {
        return histories.getOrDefault(mint, List.of());
    }

    @Override
    public Instant now() {
        return now;
    }
}
