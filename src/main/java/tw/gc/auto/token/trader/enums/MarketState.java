package tw.gc.auto.token.trader.enums;

/**
 * Shape of a token's recent price series.
 */
public enum MarketState {
    TRENDING("Directional movement, few reversals"),
    CHOPPY("Frequent reversals, little net movement"),
    UNKNOWN("Not enough samples");

    private final String description;

    MarketState(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
