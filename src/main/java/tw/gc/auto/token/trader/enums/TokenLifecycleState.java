package tw.gc.auto.token.trader.enums;

/**
 * Per-token lifecycle. DISPOSED is terminal for that lifecycle; a re-entered token starts
 * over at DISCOVERED with a fresh record.
 */
public enum TokenLifecycleState {
    DISCOVERED,
    HELD,
    DISPOSED
}
