package tw.gc.auto.token.trader.market;

import tw.gc.auto.token.trader.entities.MarketTick;
import tw.gc.auto.token.trader.entities.SwapQuote;
import tw.gc.auto.token.trader.entities.TokenHolding;

import java.math.BigDecimal;
import java.util.List;

/**
 * Chain RPC and swap-quote access. Every method may throw {@link MarketDataException} on a
 * transient failure.
 */
public interface MarketDataPort {

    /** Quote-currency balance of the wallet. */
    BigDecimal balance(String address);

    List<TokenHolding> holdings(String address);

    SwapQuote quote(String inputMint, String outputMint, BigDecimal amount);

    MarketTick tick(String mint);
}
