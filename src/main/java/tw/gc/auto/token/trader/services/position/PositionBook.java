package tw.gc.auto.token.trader.services.position;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * The only shared mutable structure: open positions keyed by mint.
 */
@Service
@Slf4j
public class PositionBook {

    private final Map<String, Position> positions = new ConcurrentHashMap<>();
    private final TradingProperties properties;
    private final Clock clock;

    public PositionBook(TradingProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    public Position open(String mint, double entryPrice, double notionalValue) {
        if (!(entryPrice > 0) || !(notionalValue > 0)) {
            throw new IllegalArgumentException("entryPrice and notionalValue must be positive");
        }
        Position position = new Position(mint, entryPrice, notionalValue, clock.instant(),
                properties.getPositions().getHistoryCapacity());
        Position existing = positions.putIfAbsent(mint, position);
        if (existing != null) {
            throw new PositionAlreadyHeldException(mint);
        }
        log.info("📥 Opened position {} at {} (notional {})", mint, entryPrice, notionalValue);
        return position;
    }

    public Position update(String mint, double price) {
        double activation = properties.getPositions().getTrailingActivationPercent();
        Position updated = positions.computeIfPresent(mint, (key, position) -> {
            position.applyPrice(price, clock.instant(), activation);
            return position;
        });
        if (updated == null) {
            throw new PositionNotFoundException(mint);
        }
        return updated;
    }

    public Optional<Position> remove(String mint) {
        Position removed = positions.remove(mint);
        if (removed != null) {
            log.info("📤 Closed position {} at {} ({}%)", mint, removed.getCurrentPrice(),
                    String.format("%.2f", removed.getUnrealizedPnlPercent() * 100));
        }
        return Optional.ofNullable(removed);
    }

    public Optional<Position> get(String mint) {
        return Optional.ofNullable(positions.get(mint));
    }

    public boolean contains(String mint) {
        return positions.containsKey(mint);
    }

    public int count() {
        return positions.size();
    }

    public List<Position> all() {
        return new ArrayList<>(positions.values());
    }

    public double totalMarketValue() {
        return positions.values().stream().mapToDouble(Position::getMarketValue).sum();
    }

    public double totalUnrealizedPnl() {
        return positions.values().stream().mapToDouble(Position::getUnrealizedPnl).sum();
    }
}
