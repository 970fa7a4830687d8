package tw.gc.auto.token.trader.enums;

public enum TradingMode {
    PAPER,
    LIVE
}
