package tw.gc.auto.token.trader.entities;

import tw.gc.auto.token.trader.enums.TradeAction;

/**
 * A request to buy or sell a token. Forced intents come from the protective layers and
 * bypass strategy discretion.
 */
public record TradeIntent(String mint, TradeAction action, boolean forced, String reason) {

    public static TradeIntent buy(String mint, String reason) {
        return new TradeIntent(mint, TradeAction.BUY, false, reason);
    }

    public static TradeIntent sell(String mint, String reason) {
        return new TradeIntent(mint, TradeAction.SELL, false, reason);
    }

    public static TradeIntent forcedSell(String mint, String reason) {
        return new TradeIntent(mint, TradeAction.SELL, true, reason);
    }

    public boolean isBuy() {
        return action == TradeAction.BUY;
    }
}
