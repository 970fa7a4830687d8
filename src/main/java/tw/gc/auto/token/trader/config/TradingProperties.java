package tw.gc.auto.token.trader.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import tw.gc.auto.token.trader.AppConstants;
import tw.gc.auto.token.trader.enums.StrategyType;
import tw.gc.auto.token.trader.enums.TokenSource;
import tw.gc.auto.token.trader.enums.TradingMode;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Component
@ConfigurationProperties(prefix = "trading")
public class TradingProperties {

    /**
     * PAPER runs against the in-memory market; LIVE needs real MarketDataPort and Signer beans.
     */
    private TradingMode mode = TradingMode.PAPER;

    private Wallet wallet = new Wallet();
    @Data
    public static class Wallet {
        private String publicKey = "";
        private String quoteMint = AppConstants.WRAPPED_SOL_MINT;
    }

    private Scheduler scheduler = new Scheduler();
    @Data
    public static class Scheduler {
        private long intervalMs = 30_000;
        private int workerThreads = 8;
        private int discoveryBatchSize = 50;
        private long shutdownAwaitSeconds = 30;
        private long reentryCooldownMs = 600_000;
        /** Discovered tokens that were never bought are dropped after this; whitelisted tokens are kept. */
        private long discoveredTtlMs = 1_800_000;
        private boolean autoStart = true;
    }

    private Execution execution = new Execution();
    @Data
    public static class Execution {
        /** Quote currency spent per buy. */
        private BigDecimal swapAmount = new BigDecimal("0.05");
        private int maxAttempts = 3;
        private long retryBackoffMs = 500;
        private int slippageBps = 300;
    }

    private Positions positions = new Positions();
    @Data
    public static class Positions {
        private int historyCapacity = 40;
        private double trailingActivationPercent = 5.0;
    }

    private Rug rug = new Rug();
    @Data
    public static class Rug {
        private int windowSize = 20;
        private double extremeDropPercent = 40.0;
        private double volumeCollapsePercent = 90.0;
        private int volumeAverageSamples = 3;
        private double repeatedDropPercent = 8.0;
        private int repeatedDropCount = 3;
        private long retentionMs = 300_000;
        /** How long a token stays blocked for entry after a rug verdict. */
        private long alertCooldownMs = 3_600_000;
    }

    private PriceMiss priceMiss = new PriceMiss();
    @Data
    public static class PriceMiss {
        private boolean sellOnMissing = true;
        private int maxStrikes = 5;
        private long windowMs = 300_000;
    }

    private Trend trend = new Trend();
    @Data
    public static class Trend {
        private int minSamples = 3;
        private int lookback = 10;
        private double trendingStrength = 0.6;
        private double maxReversalRatio = 0.5;
        private boolean blockWhenChoppy = true;
    }

    private TimeExit timeExit = new TimeExit();
    @Data
    public static class TimeExit {
        private boolean enabled = true;
        private long minAgeMs = 300_000;
        private long maxHoldUnprofitableMs = 1_800_000;
    }

    private TrailingStop trailingStop = new TrailingStop();
    @Data
    public static class TrailingStop {
        private boolean enabled = true;
        private double trailPercent = 3.0;
        private double hardStopLossPercent = 15.0;
    }

    private Validation validation = new Validation();
    @Data
    public static class Validation {
        private long maxTokenAgeMs = 600_000;
        private int minAddressLength = 32;
        private int maxAddressLength = 44;
        private List<String> blockedTokens = new ArrayList<>();
    }

    private Strategy strategy = new Strategy();
    @Data
    public static class Strategy {
        private StrategyType type = StrategyType.OSCILLATOR;
        private int maxConcurrentTokens = 5;
        private Oscillator oscillator = new Oscillator();
        private Priority priority = new Priority();
        private Model model = new Model();
    }

    @Data
    public static class Oscillator {
        private int period = 14;
        private double oversold = 30.0;
        private double overbought = 70.0;
        private double neutral = 50.0;
        /** Minimum price rise between the last two ticks for a bearish divergence. */
        private double divergencePriceRisePercent = 1.0;
        /** Minimum oscillator fall between the last two ticks for a bearish divergence. */
        private double divergenceOscillatorDrop = 2.0;
        /** Buy a freshly discovered token before there is enough history to compute the oscillator. */
        private boolean enterWithoutHistory = true;
    }

    @Data
    public static class Priority {
        private List<TokenSource> preferredSources = new ArrayList<>(List.of(TokenSource.PUMP_FUN));
        private boolean requireWhitelist = false;
    }

    @Data
    public static class Model {
        private double confidenceThreshold = 0.7;
        /** The scoring model does its own due diligence, so the basic validation gate is skipped. */
        private boolean bypassValidation = true;
        private boolean evaluateOnTick = true;
    }

    private Whitelist whitelist = new Whitelist();
    @Data
    public static class Whitelist {
        private List<String> tokens = new ArrayList<>();
        /** Optional JSON file with the curated coin list. */
        private String file = "";
    }

    private Paper paper = new Paper();
    @Data
    public static class Paper {
        private BigDecimal startingBalance = new BigDecimal("10");
        private double initialPrice = 0.0001;
        private double volatilityPercent = 2.0;
        private long quoteTtlMs = 10_000;
        private long seed = 42L;
    }
}
