package tw.gc.auto.token.trader.enums;

/**
 * Where a token was discovered.
 */
public enum TokenSource {
    PUMP_FUN,
    RAYDIUM_POOL,
    DEX_SCREENER,
    WHITELIST,
    UNKNOWN
}
