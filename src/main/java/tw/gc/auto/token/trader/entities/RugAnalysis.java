package tw.gc.auto.token.trader.entities;

import tw.gc.auto.token.trader.enums.RugUrgency;

import java.util.Set;

/**
 * Verdict of one rug evaluation. Recomputed on every tick, never stored.
 */
public record RugAnalysis(boolean isRugPull, double confidence, RugUrgency urgency, Set<String> reasons) {

    public RugAnalysis {
        reasons = Set.copyOf(reasons);
    }

    public static RugAnalysis clear() {
        return new RugAnalysis(false, 0.0, RugUrgency.LOW, Set.of());
    }

    public boolean isUrgent() {
        return isRugPull && urgency == RugUrgency.HIGH;
    }
}
