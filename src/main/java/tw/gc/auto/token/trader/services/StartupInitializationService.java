package tw.gc.auto.token.trader.services;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.enums.TradingMode;

/**
 * Fails fast on missing live credentials and starts trading once the context is ready.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StartupInitializationService {

    private final TradingProperties properties;
    private final TradingOrchestrator orchestrator;

    @PostConstruct
    public void validateConfiguration() {
        String publicKey = properties.getWallet().getPublicKey();
        if (properties.getMode() == TradingMode.LIVE && (publicKey == null || publicKey.isBlank())) {
            throw new IllegalStateException("trading.wallet.public-key is required in LIVE mode");
        }
        log.info("🔧 Mode {}, strategy {}, max {} concurrent tokens, cycle every {} ms",
                properties.getMode(), properties.getStrategy().getType(),
                properties.getStrategy().getMaxConcurrentTokens(), properties.getScheduler().getIntervalMs());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (properties.getScheduler().isAutoStart()) {
            orchestrator.start();
        } else {
            log.info("⏸️ Auto-start disabled, waiting for start command");
        }
    }
}
