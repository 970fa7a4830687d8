package tw.gc.auto.token.trader.enums;

public enum TradeAction {
    BUY,
    SELL
}
