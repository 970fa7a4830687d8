package tw.gc.auto.token.trader.market.paper;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.entities.SwapReceipt;
import tw.gc.auto.token.trader.entities.UnsignedSwap;
import tw.gc.auto.token.trader.market.QuoteExpiredException;
import tw.gc.auto.token.trader.market.Signer;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Confirms swaps instantly against the paper market.
 */
@Slf4j
@RequiredArgsConstructor
public class PaperSigner implements Signer {

    private final PaperMarketDataPort market;
    private final Clock clock;

    @Override
    public SwapReceipt signAndSubmit(UnsignedSwap swap) {
        Instant now = clock.instant();
        if (swap.quote().isExpired(now)) {
            throw new QuoteExpiredException("Quote expired at " + swap.quote().getExpiresAt());
        }
        market.settle(swap.quote());
        String signature = "paper-" + UUID.randomUUID();
        log.debug("✍️ Paper swap confirmed {}", signature);
        return new SwapReceipt(signature, now);
    }
}
