package tw.gc.auto.token.trader.entities;

import tw.gc.auto.token.trader.enums.TokenSource;

import java.time.Instant;

/**
 * A token as reported by the discovery feed.
 */
public record TokenMeta(String mint, TokenSource source, Instant discoveredAt, String symbol) {

    public TokenMeta(String mint, TokenSource source, Instant discoveredAt) {
        this(mint, source, discoveredAt, null);
    }
}
