package tw.gc.auto.token.trader.services.position;

public class PositionAlreadyHeldException extends IllegalStateException {

    public PositionAlreadyHeldException(String mint) {
        super("Position already held for " + mint);
    }
}
