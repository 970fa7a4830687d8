package tw.gc.auto.token.trader.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.enums.TokenLifecycleState;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Lifecycle of every known token plus the per-token locks that keep a single writer per mint.
 */
@Service
@Slf4j
public class TokenStateService {

    private final Map<String, TokenRecord> tokens = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final TradingProperties properties;
    private final Clock clock;

    public TokenStateService(TradingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    static final class TokenRecord {
        private final TokenMeta meta;
        private final Instant trackedSince;
        private volatile TokenLifecycleState state = TokenLifecycleState.DISCOVERED;
        private volatile Instant disposedAt;

        TokenRecord(TokenMeta meta, Instant trackedSince) {
            this.meta = meta;
            this.trackedSince = trackedSince;
        }
    }

    /**
     * Starts a lifecycle for a token that is not tracked yet.
     *
     * @return false when the token already has a lifecycle (including a disposed one in cooldown)
     */
    public boolean discover(TokenMeta meta) {
        boolean[] created = new boolean[1];
        tokens.computeIfAbsent(meta.mint(), key -> {
            created[0] = true;
            return new TokenRecord(meta, clock.instant());
        });
        if (created[0]) {
            log.info("🔎 Discovered {} via {}", meta.mint(), meta.source());
        }
        return created[0];
    }

    public Optional<TokenLifecycleState> stateOf(String mint) {
        TokenRecord record = tokens.get(mint);
        return record == null ? Optional.empty() : Optional.of(record.state);
    }

    public Optional<TokenMeta> metaOf(String mint) {
        TokenRecord record = tokens.get(mint);
        return record == null ? Optional.empty() : Optional.of(record.meta);
    }

    public void markHeld(String mint) {
        transition(mint, TokenLifecycleState.DISCOVERED, TokenLifecycleState.HELD);
    }

    public void markDisposed(String mint) {
        transition(mint, TokenLifecycleState.HELD, TokenLifecycleState.DISPOSED);
    }

    private void transition(String mint, TokenLifecycleState from, TokenLifecycleState to) {
        TokenRecord record = tokens.get(mint);
        if (record == null) {
            throw new IllegalStateException("Unknown token " + mint);
        }
        if (record.state != from) {
            throw new IllegalStateException(String.format("%s cannot move %s -> %s", mint, record.state, to));
        }
        record.state = to;
        if (to == TokenLifecycleState.DISPOSED) {
            record.disposedAt = clock.instant();
        }
        log.info("🔁 {} {} -> {}", mint, from, to);
    }

    /**
     * Drops a token that never got past discovery, e.g. after failing validation.
     */
    public void forget(String mint) {
        TokenRecord removed = tokens.computeIfPresent(mint, (key, record) ->
                record.state == TokenLifecycleState.DISCOVERED ? null : record);
        if (removed == null) {
            locks.remove(mint);
        }
    }

    /**
     * Tokens under evaluation: discovered or held.
     */
    public List<String> monitoredTokens() {
        return tokens.entrySet().stream()
                .filter(e -> e.getValue().state != TokenLifecycleState.DISPOSED)
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public long countIn(TokenLifecycleState state) {
        return tokens.values().stream().filter(record -> record.state == state).count();
    }

    /**
     * Forgets disposed tokens whose re-entry cooldown has passed, so a later discovery starts a
     * fresh lifecycle. Must not run while token tasks are in flight.
     */
    public int purgeDisposed() {
        Instant cutoff = clock.instant().minusMillis(properties.getScheduler().getReentryCooldownMs());
        List<String> expired = tokens.entrySet().stream()
                .filter(e -> e.getValue().state == TokenLifecycleState.DISPOSED
                        && !e.getValue().disposedAt.isAfter(cutoff))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        for (String mint : expired) {
            tokens.remove(mint);
            locks.remove(mint);
        }
        if (!expired.isEmpty()) {
            log.debug("🧹 Re-entry cooldown elapsed for {}", expired);
        }
        return expired.size();
    }

    /**
     * Forgets tokens that stayed DISCOVERED longer than the discovery TTL without being bought.
     * Mints in {@code keep} (the whitelist) are never expired. Must not run while token tasks are
     * in flight.
     *
     * @return the expired mints
     */
    public List<String> purgeExpiredDiscoveries(Set<String> keep) {
        Instant cutoff = clock.instant().minusMillis(properties.getScheduler().getDiscoveredTtlMs());
        List<String> expired = tokens.entrySet().stream()
                .filter(e -> e.getValue().state == TokenLifecycleState.DISCOVERED
                        && !keep.contains(e.getKey())
                        && !e.getValue().trackedSince.isAfter(cutoff))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
        for (String mint : expired) {
            forget(mint);
        }
        if (!expired.isEmpty()) {
            log.info("⌛ {} unbought tokens expired", expired.size());
        }
        return expired;
    }

    public int lockCount() {
        return locks.size();
    }

    public ReentrantLock lockFor(String mint) {
        return locks.computeIfAbsent(mint, key -> new ReentrantLock());
    }
}
