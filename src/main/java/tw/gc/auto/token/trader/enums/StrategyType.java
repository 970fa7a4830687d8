package tw.gc.auto.token.trader.enums;

public enum StrategyType {
    OSCILLATOR,
    PRIORITY,
    MODEL_ASSISTED
}
