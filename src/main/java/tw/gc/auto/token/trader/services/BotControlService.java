package tw.gc.auto.token.trader.services;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.BotStatus;
import tw.gc.auto.token.trader.market.MarketDataException;
import tw.gc.auto.token.trader.market.MarketDataPort;
import tw.gc.auto.token.trader.services.position.PositionBook;

import java.math.BigDecimal;

/**
 * Control surface for the HTTP layer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BotControlService {

    private final TradingOrchestrator orchestrator;
    private final WhitelistService whitelistService;
    private final PositionBook positionBook;
    private final TradingStatsService stats;
    private final MarketDataPort marketData;
    private final TradingProperties properties;

    public void start() {
        orchestrator.start();
    }

    public void stop() {
        orchestrator.stop();
    }

    public BotStatus status() {
        return BotStatus.builder()
                .running(orchestrator.isRunning())
                .uptime(orchestrator.uptime())
                .activeTokenCount(orchestrator.monitoredTokenCount())
                .heldPositionCount(positionBook.count())
                .buys(stats.getBuys())
                .sells(stats.getSells())
                .failedTrades(stats.getFailedTrades())
                .forcedExits(stats.getForcedExits())
                .rugExits(stats.getRugExits())
                .cycles(stats.getCycles())
                .balance(currentBalance())
                .portfolioValue(positionBook.totalMarketValue())
                .unrealizedPnl(positionBook.totalUnrealizedPnl())
                .build();
    }

    public boolean addToWhitelist(String mint) {
        if (mint == null || mint.isBlank()) {
            throw new IllegalArgumentException("mint must not be blank");
        }
        return whitelistService.add(mint.trim());
    }

    public boolean removeFromWhitelist(String mint) {
        return mint != null && whitelistService.remove(mint.trim());
    }

    private BigDecimal currentBalance() {
        try {
            return marketData.balance(properties.getWallet().getPublicKey());
        } catch (MarketDataException e) {
            log.warn("⚠️ Balance unavailable: {}", e.getMessage());
            return null;
        }
    }
}
