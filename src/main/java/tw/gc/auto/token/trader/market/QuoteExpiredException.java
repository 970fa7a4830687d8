package tw.gc.auto.token.trader.market;

public class QuoteExpiredException extends RuntimeException {

    public QuoteExpiredException(String message) {
        super(message);
    }
}
