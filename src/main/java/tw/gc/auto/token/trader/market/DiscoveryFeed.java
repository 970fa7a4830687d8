package tw.gc.auto.token.trader.market;

import tw.gc.auto.token.trader.entities.TokenMeta;

import java.util.List;

/**
 * Pull-based source of newly discovered tokens. Each poll returns what arrived since the last.
 */
public interface DiscoveryFeed {

    List<TokenMeta> poll(int maxTokens);
}
