package tw.gc.auto.token.trader.market.paper;

import lombok.extern.slf4j.Slf4j;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.MarketTick;
import tw.gc.auto.token.trader.entities.SwapQuote;
import tw.gc.auto.token.trader.entities.TokenHolding;
import tw.gc.auto.token.trader.market.MarketDataException;
import tw.gc.auto.token.trader.market.MarketDataPort;
import tw.gc.auto.token.trader.market.SwapRejectedException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory market for paper trading. Prices follow a seeded random walk unless set explicitly;
 * swaps settle against a simulated wallet.
 */
@Slf4j
public class PaperMarketDataPort implements MarketDataPort {

    private static final double DEFAULT_VOLUME = 10_000.0;

    private final TradingProperties properties;
    private final Clock clock;
    private final Random random;
    private final Map<String, Double> prices = new ConcurrentHashMap<>();
    private final Map<String, Double> volumes = new ConcurrentHashMap<>();
    private final Map<String, BigDecimal> holdings = new ConcurrentHashMap<>();
    private final Set<String> pinned = ConcurrentHashMap.newKeySet();
    private BigDecimal balance;

    public PaperMarketDataPort(TradingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        this.random = new Random(properties.getPaper().getSeed());
        this.balance = properties.getPaper().getStartingBalance();
    }

    /**
     * Pins the next observed price and volume of a token; the walk continues from there.
     */
    public void setPrice(String mint, double price, double volume) {
        prices.put(mint, price);
        volumes.put(mint, volume);
        pinned.add(mint);
    }

    @Override
    public synchronized BigDecimal balance(String address) {
        return balance;
    }

    @Override
    public List<TokenHolding> holdings(String address) {
        return holdings.entrySet().stream()
                .filter(e -> e.getValue().signum() > 0)
                .map(e -> new TokenHolding(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public SwapQuote quote(String inputMint, String outputMint, BigDecimal amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new MarketDataException("Quote amount must be positive");
        }
        String quoteMint = properties.getWallet().getQuoteMint();
        boolean buying = quoteMint.equals(inputMint);
        String tokenMint = buying ? outputMint : inputMint;
        BigDecimal price = BigDecimal.valueOf(currentPrice(tokenMint));
        BigDecimal outAmount = buying
                ? amount.divide(price, MathContext.DECIMAL64)
                : amount.multiply(price, MathContext.DECIMAL64);
        return SwapQuote.builder()
                .inputMint(inputMint)
                .outputMint(outputMint)
                .inAmount(amount)
                .outAmount(outAmount)
                .expiresAt(clock.instant().plusMillis(properties.getPaper().getQuoteTtlMs()))
                .route("paper:" + inputMint + "->" + outputMint)
                .build();
    }

    @Override
    public MarketTick tick(String mint) {
        double price = pinned.remove(mint)
                ? prices.get(mint)
                : prices.compute(mint, (key, previous) -> previous == null
                        ? properties.getPaper().getInitialPrice()
                        : walk(previous));
        double volume = volumes.getOrDefault(mint, DEFAULT_VOLUME);
        return new MarketTick(mint, price, volume, clock.instant());
    }

    /**
     * Moves funds for a confirmed swap.
     */
    synchronized void settle(SwapQuote quote) {
        debit(quote.getInputMint(), quote.getInAmount());
        credit(quote.getOutputMint(), quote.getOutAmount());
        log.debug("📝 Paper settle {} {} -> {} {}", quote.getInAmount(), quote.getInputMint(),
                quote.getOutAmount(), quote.getOutputMint());
    }

    private void debit(String mint, BigDecimal amount) {
        if (isQuoteMint(mint)) {
            if (balance.compareTo(amount) < 0) {
                throw new SwapRejectedException("Insufficient balance: " + balance + " < " + amount);
            }
            balance = balance.subtract(amount);
            return;
        }
        BigDecimal held = holdings.getOrDefault(mint, BigDecimal.ZERO);
        if (held.compareTo(amount) < 0) {
            throw new SwapRejectedException("Insufficient " + mint + " holdings: " + held + " < " + amount);
        }
        holdings.put(mint, held.subtract(amount));
    }

    private void credit(String mint, BigDecimal amount) {
        if (isQuoteMint(mint)) {
            balance = balance.add(amount);
        } else {
            holdings.merge(mint, amount, BigDecimal::add);
        }
    }

    private boolean isQuoteMint(String mint) {
        return properties.getWallet().getQuoteMint().equals(mint);
    }

    private double currentPrice(String mint) {
        return prices.computeIfAbsent(mint, key -> properties.getPaper().getInitialPrice());
    }

    private synchronized double walk(double previous) {
        double step = random.nextGaussian() * properties.getPaper().getVolatilityPercent() / 100.0;
        return Math.max(previous * (1.0 + step), Double.MIN_NORMAL);
    }
}
