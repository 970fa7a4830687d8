package tw.gc.auto.token.trader.market;

import tw.gc.auto.token.trader.entities.SwapReceipt;
import tw.gc.auto.token.trader.entities.UnsignedSwap;

public interface Signer {

    /**
     * Signs and submits the swap, returning once it is confirmed.
     *
     * @throws QuoteExpiredException when the quote went stale before submission
     * @throws SwapRejectedException when the signer or the chain refuses the swap
     */
    SwapReceipt signAndSubmit(UnsignedSwap swap);
}
