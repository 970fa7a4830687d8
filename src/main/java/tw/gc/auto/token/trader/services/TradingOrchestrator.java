package tw.gc.auto.token.trader.services;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.AppConstants;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.ExitRecommendation;
import tw.gc.auto.token.trader.entities.MarketTick;
import tw.gc.auto.token.trader.entities.RugAnalysis;
import tw.gc.auto.token.trader.entities.SwapResult;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.entities.TradeIntent;
import tw.gc.auto.token.trader.enums.TokenLifecycleState;
import tw.gc.auto.token.trader.enums.TokenSource;
import tw.gc.auto.token.trader.market.DiscoveryFeed;
import tw.gc.auto.token.trader.market.MarketDataException;
import tw.gc.auto.token.trader.market.MarketDataPort;
import tw.gc.auto.token.trader.services.execution.ExecutionGateway;
import tw.gc.auto.token.trader.services.position.Position;
import tw.gc.auto.token.trader.services.position.PositionAlreadyHeldException;
import tw.gc.auto.token.trader.services.position.PositionBook;
import tw.gc.auto.token.trader.services.position.PositionNotFoundException;
import tw.gc.auto.token.trader.services.protection.PriceMissTracker;
import tw.gc.auto.token.trader.services.protection.RugDetector;
import tw.gc.auto.token.trader.services.protection.TimeExitPolicy;
import tw.gc.auto.token.trader.services.protection.TrailingStopPolicy;
import tw.gc.auto.token.trader.services.protection.TrendFilter;
import tw.gc.auto.token.trader.strategy.TokenStrategy;
import tw.gc.auto.token.trader.strategy.TradingRuntime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Main trading loop.
 *
 * Every cycle drains the discovery feed, adds whitelisted tokens that are not tracked yet, then
 * fans out one task per monitored token onto a fixed worker pool. Per token:
 * tick -> history -> rug/trend analysis -> (held) position update and protective exits
 * -> strategy decision -> execution -> commit to PositionBook and lifecycle.
 * Held tokens that keep missing prices are force-sold; unbought discoveries expire after a TTL.
 *
 * A per-mint lock keeps one writer per token; different tokens run in parallel.
 */
@Service
@Slf4j
public class TradingOrchestrator {

    private final TradingProperties properties;
    private final Clock clock;
    private final MarketDataPort marketData;
    private final DiscoveryFeed discoveryFeed;
    private final PositionBook positionBook;
    private final TickHistoryStore tickHistory;
    private final RugDetector rugDetector;
    private final TrendFilter trendFilter;
    private final TimeExitPolicy timeExitPolicy;
    private final TrailingStopPolicy trailingStopPolicy;
    private final PriceMissTracker priceMissTracker;
    private final TokenStrategy strategy;
    private final TokenValidationService validationService;
    private final ExecutionGateway executionGateway;
    private final TokenStateService tokenState;
    private final WhitelistService whitelistService;
    private final TradingStatsService stats;

    private final ExecutorService workers;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final Object capacityLock = new Object();
    private int pendingBuys;
    private volatile Instant startedAt;

    public TradingOrchestrator(TradingProperties properties, Clock clock, MarketDataPort marketData,
                               DiscoveryFeed discoveryFeed, PositionBook positionBook, TickHistoryStore tickHistory,
                               RugDetector rugDetector, TrendFilter trendFilter, TimeExitPolicy timeExitPolicy,
                               TrailingStopPolicy trailingStopPolicy, PriceMissTracker priceMissTracker,
                               TokenStrategy strategy,
                               TokenValidationService validationService, ExecutionGateway executionGateway,
                               TokenStateService tokenState, WhitelistService whitelistService,
                               TradingStatsService stats) {
        this.properties = properties;
        this.clock = clock;
        this.marketData = marketData;
        this.discoveryFeed = discoveryFeed;
        this.positionBook = positionBook;
        this.tickHistory = tickHistory;
        this.rugDetector = rugDetector;
        this.trendFilter = trendFilter;
        this.timeExitPolicy = timeExitPolicy;
        this.trailingStopPolicy = trailingStopPolicy;
        this.priceMissTracker = priceMissTracker;
        this.strategy = strategy;
        this.validationService = validationService;
        this.executionGateway = executionGateway;
        this.tokenState = tokenState;
        this.whitelistService = whitelistService;
        this.stats = stats;

        AtomicInteger threadCounter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(Math.max(1, properties.getScheduler().getWorkerThreads()), r -> {
            Thread thread = new Thread(r, AppConstants.WORKER_THREAD_PREFIX + threadCounter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            startedAt = clock.instant();
            log.info("🚀 Trading started ({} strategy, {} mode)", strategy.getName(), properties.getMode());
        }
    }

    /**
     * Stops scheduling new cycles. Swaps already in flight run to completion.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("🛑 Trading stopped, in-flight swaps will complete");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration uptime() {
        Instant started = startedAt;
        if (!running.get() || started == null) {
            return Duration.ZERO;
        }
        return Duration.between(started, clock.instant());
    }

    @Scheduled(fixedDelayString = "${trading.scheduler.interval-ms:30000}")
    public void tradingLoop() {
        if (!running.get()) {
            return;
        }
        try {
            runCycle();
        } catch (RuntimeException e) {
            log.error("❌ Trading cycle failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Runs one full evaluation cycle and waits for every token task to finish.
     */
    public void runCycle() {
        long cycle = stats.recordCycle();
        Set<String> whitelist = whitelistService.snapshot();
        tokenState.purgeDisposed();
        tokenState.purgeExpiredDiscoveries(whitelist).forEach(this::forgetMarketState);
        rugDetector.cleanup();
        priceMissTracker.cleanup();
        TradingRuntime runtime = new CycleRuntime(whitelist);

        List<TokenMeta> discoveries = new ArrayList<>(pollDiscovery());
        Instant now = clock.instant();
        for (String mint : whitelist) {
            if (tokenState.stateOf(mint).isEmpty()) {
                discoveries.add(new TokenMeta(mint, TokenSource.WHITELIST, now));
            }
        }
        runAll(discoveries.stream()
                .map(meta -> (Runnable) () -> handleDiscovery(meta, runtime))
                .toList());

        List<String> universe = tokenState.monitoredTokens();
        runAll(universe.stream()
                .map(mint -> (Runnable) () -> evaluateToken(mint, runtime))
                .toList());

        log.debug("🔄 Cycle {} done: {} discoveries, {} monitored, {} held", cycle, discoveries.size(),
                universe.size(), positionBook.count());
    }

    private List<TokenMeta> pollDiscovery() {
        try {
            return discoveryFeed.poll(properties.getScheduler().getDiscoveryBatchSize());
        } catch (RuntimeException e) {
            log.warn("⚠️ Discovery feed poll failed: {}", e.getMessage());
            return List.of();
        }
    }

    void handleDiscovery(TokenMeta meta, TradingRuntime runtime) {
        withTokenLock(meta.mint(), () -> {
            if (!tokenState.discover(meta)) {
                return;
            }
            if (strategy.requiresValidation()) {
                if (!validationService.validate(meta).valid()) {
                    tokenState.forget(meta.mint());
                    return;
                }
            } else {
                log.debug("🔓 Validation gate bypassed by {} for {}", strategy.getName(), meta.mint());
            }
            strategy.onDiscovered(meta, runtime).ifPresent(intent -> apply(intent, null));
        });
    }

    void evaluateToken(String mint, TradingRuntime runtime) {
        withTokenLock(mint, () -> {
            Optional<TokenLifecycleState> state = tokenState.stateOf(mint);
            if (state.isEmpty() || state.get() == TokenLifecycleState.DISPOSED) {
                return;
            }

            MarketTick tick;
            try {
                tick = marketData.tick(mint);
            } catch (MarketDataException e) {
                log.warn("⚠️ No tick for {} this cycle: {}", mint, e.getMessage());
                onPriceMissing(mint, state.get());
                return;
            }
            if (tick == null || !tick.isValid()) {
                log.warn("⚠️ Invalid tick for {} skipped: {}", mint, tick);
                onPriceMissing(mint, state.get());
                return;
            }
            priceMissTracker.recordSuccess(mint);

            tickHistory.record(mint, tick.price());
            List<Double> prices = tickHistory.prices(mint);
            RugAnalysis rug = rugDetector.analyzeTick(mint, tick.price(), tick.volume());
            trendFilter.analyzeMarket(mint, prices);

            if (state.get() == TokenLifecycleState.HELD) {
                Position position;
                try {
                    position = positionBook.update(mint, tick.price());
                } catch (PositionNotFoundException e) {
                    log.error("❌ {} is HELD without a position: {}", mint, e.getMessage());
                    return;
                }
                Optional<TradeIntent> forced = protectiveExit(position, rug);
                if (forced.isPresent()) {
                    if (sell(forced.get()) && rug.isUrgent()) {
                        stats.recordRugExit();
                    }
                    return;
                }
            } else if (rug.isRugPull()) {
                log.info("🚫 {} not entered, rug signal {}", mint, rug.reasons());
                return;
            }

            Optional<TradeIntent> intent = strategy.onTick(tick, prices, runtime);
            if (intent.isPresent()) {
                apply(intent.get(), tick.price());
            } else {
                log.debug("⏸️ {} hold @ {}", mint, tick.price());
            }
        });
    }

    private Optional<TradeIntent> protectiveExit(Position position, RugAnalysis rug) {
        String mint = position.getMint();
        if (rug.isUrgent()) {
            log.warn("🚨 Forced exit {}: rug pull {} (confidence {})", mint, rug.reasons(),
                    String.format("%.2f", rug.confidence()));
            return Optional.of(TradeIntent.forcedSell(mint, "Rug pull: " + rug.reasons()));
        }
        ExitRecommendation timeExit = timeExitPolicy.analyzeTimeBasedExit(position);
        if (timeExit.shouldExit()) {
            log.warn("⏰ Forced exit {}: {}", mint, timeExit.reason());
            return Optional.of(TradeIntent.forcedSell(mint, timeExit.reason()));
        }
        ExitRecommendation stop = trailingStopPolicy.evaluate(position);
        if (stop.shouldExit()) {
            log.warn("🛡️ Forced exit {}: {}", mint, stop.reason());
            return Optional.of(TradeIntent.forcedSell(mint, stop.reason()));
        }
        return Optional.empty();
    }

    private void onPriceMissing(String mint, TokenLifecycleState state) {
        int strikes = priceMissTracker.recordMiss(mint);
        if (state == TokenLifecycleState.HELD && priceMissTracker.shouldForceSell(mint)) {
            log.error("🚨 Forced exit {}: no price for {} consecutive cycles", mint, strikes);
            sell(TradeIntent.forcedSell(mint, "No price data for " + strikes + " cycles"));
        }
    }

    private void apply(TradeIntent intent, Double referencePrice) {
        if (intent.isBuy()) {
            buy(intent, referencePrice);
        } else {
            sell(intent);
        }
    }

    private void buy(TradeIntent intent, Double referencePrice) {
        String mint = intent.mint();
        if (tokenState.stateOf(mint).orElse(null) != TokenLifecycleState.DISCOVERED || positionBook.contains(mint)) {
            log.debug("⏸️ Buy {} ignored, token not in DISCOVERED state", mint);
            return;
        }
        if (!trendFilter.shouldAllowTrade(mint)) {
            log.info("🌀 Buy {} blocked by chop filter", mint);
            return;
        }
        if (rugDetector.isRecentAlert(mint)) {
            log.info("🚫 Buy {} blocked by recent rug alert", mint);
            return;
        }
        if (!reserveSlot()) {
            log.info("⏸️ Buy {} skipped, {} positions already open", mint, positionBook.count());
            return;
        }
        try {
            SwapResult result = executionGateway.execute(intent);
            if (!result.isSuccess()) {
                stats.recordFailure();
                log.error("🚨 Buy {} failed: {}", mint, result.getFailureReason());
                return;
            }
            double entryPrice = result.getExecutedPrice() > 0 ? result.getExecutedPrice()
                    : referencePrice == null ? 0.0 : referencePrice;
            if (entryPrice <= 0) {
                stats.recordFailure();
                log.error("🚨 Buy {} confirmed ({}) without a usable price", mint, result.getSignature());
                return;
            }
            positionBook.open(mint, entryPrice, properties.getExecution().getSwapAmount().doubleValue());
            tokenState.markHeld(mint);
            stats.recordBuy();
            log.info("🟢 Bought {} @ {} ({})", mint, entryPrice, intent.reason());
        } catch (PositionAlreadyHeldException e) {
            log.error("❌ {}", e.getMessage());
        } finally {
            releaseSlot();
        }
    }

    /**
     * @return true once the position is closed and the token disposed
     */
    private boolean sell(TradeIntent intent) {
        String mint = intent.mint();
        if (tokenState.stateOf(mint).orElse(null) != TokenLifecycleState.HELD) {
            log.debug("⏸️ Sell {} ignored, token not held", mint);
            return false;
        }
        SwapResult result = executionGateway.execute(intent);
        if (!result.isSuccess()) {
            stats.recordFailure();
            log.error("🚨 Sell {} failed, position kept: {}", mint, result.getFailureReason());
            return false;
        }
        Optional<Position> closed = positionBook.remove(mint);
        tokenState.markDisposed(mint);
        stats.recordSell(intent.forced());
        forgetMarketState(mint);
        log.info("🔴 Sold {} @ {} ({}{}) P&L {}%", mint, result.getExecutedPrice(), intent.forced() ? "forced: " : "",
                intent.reason(), closed.map(p -> String.format("%.2f", (result.getExecutedPrice() / p.getEntryPrice() - 1) * 100))
                        .orElse("n/a"));
        return true;
    }

    private void forgetMarketState(String mint) {
        tickHistory.forget(mint);
        trendFilter.forget(mint);
        rugDetector.forget(mint);
        priceMissTracker.forget(mint);
    }

    private boolean reserveSlot() {
        synchronized (capacityLock) {
            if (positionBook.count() + pendingBuys >= properties.getStrategy().getMaxConcurrentTokens()) {
                return false;
            }
            pendingBuys++;
            return true;
        }
    }

    private void releaseSlot() {
        synchronized (capacityLock) {
            pendingBuys--;
        }
    }

    private void withTokenLock(String mint, Runnable task) {
        ReentrantLock lock = tokenState.lockFor(mint);
        if (!lock.tryLock()) {
            log.debug("⏳ {} still busy, skipping", mint);
            return;
        }
        try {
            task.run();
        } finally {
            lock.unlock();
        }
    }

    private void runAll(List<Runnable> tasks) {
        if (tasks.isEmpty()) {
            return;
        }
        List<CompletableFuture<Void>> futures = new ArrayList<>(tasks.size());
        for (Runnable task : tasks) {
            try {
                futures.add(CompletableFuture.runAsync(() -> runSafely(task), workers));
            } catch (RejectedExecutionException e) {
                log.warn("⚠️ Worker pool is shut down, task dropped");
            }
        }
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            log.error("❌ Token task failed: {}", e.getMessage(), e);
        }
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("❌ Token task failed: {}", e.getMessage(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        running.set(false);
        workers.shutdown();
        try {
            if (!workers.awaitTermination(properties.getScheduler().getShutdownAwaitSeconds(), TimeUnit.SECONDS)) {
                log.warn("⚠️ Token workers still busy after {}s", properties.getScheduler().getShutdownAwaitSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("🛑 Trading orchestrator shut down");
    }

    public int monitoredTokenCount() {
        return tokenState.monitoredTokens().size();
    }

    /**
     * Strategy view over the current cycle. The whitelist is frozen for the whole cycle.
     */
    private final class CycleRuntime implements TradingRuntime {

        private final Set<String> whitelist;

        private CycleRuntime(Set<String> whitelist) {
            this.whitelist = whitelist;
        }

        @Override
        public boolean isHeld(String mint) {
            return positionBook.contains(mint);
        }

        @Override
        public int heldCount() {
            return positionBook.count();
        }

        @Override
        public int maxConcurrentTokens() {
            return properties.getStrategy().getMaxConcurrentTokens();
        }

        @Override
        public boolean isWhitelisted(String mint) {
            return whitelist.contains(mint);
        }

        @Override
        public List<Double> priceHistory(String mint) {
            return tickHistory.prices(mint);
        }

        @Override
        public Instant now() {
            return clock.instant();
        }
    }
}
