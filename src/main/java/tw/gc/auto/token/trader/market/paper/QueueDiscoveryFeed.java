package tw.gc.auto.token.trader.market.paper;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.market.DiscoveryFeed;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Discovery feed backed by an in-memory queue that producers publish into.
 */
@Slf4j
public class QueueDiscoveryFeed implements DiscoveryFeed {

    private final Queue<TokenMeta> pending = new ConcurrentLinkedQueue<>();

    public void publish(TokenMeta meta) {
        pending.add(meta);
        log.debug("🛰️ Queued discovery {} from {}", meta.mint(), meta.source());
    }

    @Override
    public List<TokenMeta> poll(int maxTokens) {
        List<TokenMeta> batch = new ArrayList<>();
        TokenMeta next;
        while (batch.size() < maxTokens && (next = pending.poll()) != null) {
            batch.add(next);
        }
        return batch;
    }

    public int pendingCount() {
        return pending.size();
    }
}
