package tw.gc.auto.token.trader.entities;

public record ExitRecommendation(boolean shouldExit, String reason) {

    public static ExitRecommendation exit(String reason) {
        return new ExitRecommendation(true, reason);
    }

    public static ExitRecommendation hold(String reason) {
        return new ExitRecommendation(false, reason);
    }
}
