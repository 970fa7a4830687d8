package tw.gc.auto.token.trader.enums;

public enum RugUrgency {
    LOW,
    MEDIUM,
    HIGH
}
