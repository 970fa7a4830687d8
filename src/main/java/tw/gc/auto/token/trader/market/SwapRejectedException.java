package tw.gc.auto.token.trader.market;

/**
 * The signer or the chain refused the swap. Not retried.
 */
public class SwapRejectedException extends RuntimeException {

    public SwapRejectedException(String message) {
        super(message);
    }

    public SwapRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
