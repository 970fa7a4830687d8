package tw.gc.auto.token.trader;

/**
 * Application-wide constants
 */
public final class AppConstants {

    // Wrapped SOL, the quote currency every swap is priced in
    public static final String WRAPPED_SOL_MINT = "So11111111111111111111111111111111111111112";

    // Base58 alphabet used by on-chain addresses
    public static final String BASE58_ALPHABET = "123456789ABCDEFGHJKLMNPQRSTUVWXYZabcdefghijkmnopqrstuvwxyz";

    public static final String WORKER_THREAD_PREFIX = "token-worker-";

    private AppConstants() {
        // Utility class
    }
}
