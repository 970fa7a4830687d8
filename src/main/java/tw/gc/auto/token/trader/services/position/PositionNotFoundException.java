package tw.gc.auto.token.trader.services.position;

public class PositionNotFoundException extends IllegalStateException {

    public PositionNotFoundException(String mint) {
        super("No open position for " + mint);
    }
}
