package tw.gc.auto.token.trader.strategy;

/**
 * Answer of an external scoring model.
 */
public record ModelVerdict(Recommendation recommendation, double confidence, String reasoning) {

    public enum Recommendation {
        BUY,
        SELL,
        HOLD
    }

    public static ModelVerdict hold(String reasoning) {
        return new ModelVerdict(Recommendation.HOLD, 0.0, reasoning);
    }
}
