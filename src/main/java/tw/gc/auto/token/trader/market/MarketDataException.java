package tw.gc.auto.token.trader.market;

/**
 * Transient RPC or quote-service failure.
 */
public class MarketDataException extends RuntimeException {

    public MarketDataException(String message) {
        super(message);
    }

    public MarketDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
