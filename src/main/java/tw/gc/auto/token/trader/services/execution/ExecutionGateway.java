package tw.gc.auto.token.trader.services.execution;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.SwapQuote;
import tw.gc.auto.token.trader.entities.SwapReceipt;
import tw.gc.auto.token.trader.entities.SwapResult;
import tw.gc.auto.token.trader.entities.TokenHolding;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.entities.UnsignedSwap;
import tw.gc.auto.token.trader.enums.TradeAction;
import tw.gc.auto.token.trader.market.MarketDataException;
import tw.gc.auto.token.trader.market.MarketDataPort;
import tw.gc.auto.token.trader.market.QuoteExpiredException;
import tw.gc.auto.token.trader.market.Signer;
import tw.gc.auto.token.trader.market.SwapRejectedException;

import java.math.BigDecimal;

/**
 * Turns an intent into a confirmed swap.
 *
 * Every attempt fetches a fresh quote. Stale quotes and transient quote failures are retried
 * with exponential backoff up to {@code max-attempts}; a rejection by the signer or the chain
 * ends the execution. The gateway never touches positions or lifecycle state.
 */
@Service
@Slf4j
public class ExecutionGateway {

    private final MarketDataPort marketData;
    private final Signer signer;
    private final TradingProperties properties;

    public ExecutionGateway(MarketDataPort marketData, Signer signer, TradingProperties properties) {
        this.marketData = marketData;
        this.signer = signer;
        this.properties = properties;
    }

    public SwapResult execute(TradeIntent intent) {
        String mint = intent.mint();
        TradeAction action = intent.action();
        String wallet = properties.getWallet().getPublicKey();
        String quoteMint = properties.getWallet().getQuoteMint();
        TradingProperties.Execution config = properties.getExecution();
        int maxAttempts = Math.max(1, config.getMaxAttempts());
        String lastFailure = "no attempt made";

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                String inputMint = action == TradeAction.BUY ? quoteMint : mint;
                String outputMint = action == TradeAction.BUY ? mint : quoteMint;
                BigDecimal amount = action == TradeAction.BUY ? config.getSwapAmount() : holdingOf(wallet, mint);
                if (amount.signum() <= 0) {
                    log.error("❌ No {} holdings to sell", mint);
                    return SwapResult.failed(mint, action, "No holdings to sell", attempt);
                }

                log.info("📤 {} {} (attempt {}, forced={}): {}", action, mint, attempt, intent.forced(), intent.reason());
                SwapQuote quote = marketData.quote(inputMint, outputMint, amount);
                double price = priceOf(quote, mint);
                SwapReceipt receipt = signer.signAndSubmit(new UnsignedSwap(quote, wallet, config.getSlippageBps()));
                log.info("✅ {} {} filled @ {} ({})", action, mint, price, receipt.signature());
                return SwapResult.succeeded(mint, action, price, receipt.signature(), attempt);

            } catch (QuoteExpiredException e) {
                lastFailure = "Quote expired: " + e.getMessage();
                log.warn("⏳ Quote for {} {} expired (attempt {}), refreshing", action, mint, attempt);
            } catch (MarketDataException e) {
                lastFailure = "Market data unavailable: " + e.getMessage();
                log.warn("⚠️ Quote for {} {} failed (attempt {}): {}", action, mint, attempt, e.getMessage());
            } catch (SwapRejectedException e) {
                log.error("❌ {} {} rejected: {}", action, mint, e.getMessage());
                return SwapResult.failed(mint, action, "Swap rejected: " + e.getMessage(), attempt);
            } catch (RuntimeException e) {
                log.error("❌ {} {} failed in signer: {}", action, mint, e.getMessage(), e);
                return SwapResult.failed(mint, action, "Signer failure: " + e.getMessage(), attempt);
            }

            if (attempt < maxAttempts) {
                try {
                    Thread.sleep(config.getRetryBackoffMs() * (1L << (attempt - 1)));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return SwapResult.failed(mint, action, "Interrupted while retrying: " + lastFailure, attempt);
                }
            }
        }

        log.error("🚨 {} {} failed after {} attempts: {}", action, mint, maxAttempts, lastFailure);
        return SwapResult.failed(mint, action, "Gave up after " + maxAttempts + " attempts: " + lastFailure, maxAttempts);
    }

    /**
     * Priced before submission: once the signer returns a receipt the swap is final.
     */
    private static double priceOf(SwapQuote quote, String mint) {
        if (quote == null || !isPositive(quote.getInAmount()) || !isPositive(quote.getOutAmount())) {
            throw new MarketDataException("Unusable quote for " + mint + ": " + quote);
        }
        return quote.pricePer(mint);
    }

    private static boolean isPositive(BigDecimal amount) {
        return amount != null && amount.signum() > 0;
    }

    private BigDecimal holdingOf(String wallet, String mint) {
        return marketData.holdings(wallet).stream()
                .filter(holding -> mint.equals(holding.mint()))
                .map(TokenHolding::amount)
                .findFirst()
                .orElse(BigDecimal.ZERO);
    }
}
