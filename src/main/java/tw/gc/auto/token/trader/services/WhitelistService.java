package tw.gc.auto.token.trader.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.WhitelistFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Operator-curated set of mints eligible for automated trading. Writes may happen at any time;
 * the orchestrator takes a snapshot at the start of every cycle.
 */
@Service
@Slf4j
public class WhitelistService {

    private final Set<String> whitelist = ConcurrentHashMap.newKeySet();
    private final TradingProperties properties;
    private final ObjectMapper objectMapper;

    public WhitelistService(TradingProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        TradingProperties.Whitelist config = properties.getWhitelist();
        config.getTokens().stream()
                .filter(mint -> mint != null && !mint.isBlank())
                .forEach(whitelist::add);
        if (config.getFile() != null && !config.getFile().isBlank()) {
            whitelist.addAll(loadFile(Path.of(config.getFile())));
        }
        log.info("📋 Whitelist initialized with {} tokens", whitelist.size());
    }

    /**
     * Reads enabled coins from a whitelist JSON file, highest priority first.
     * A missing or unreadable file yields an empty list.
     */
    public List<String> loadFile(Path file) {
        if (!Files.isReadable(file)) {
            log.warn("⚠️ Whitelist file {} not readable, skipping", file);
            return List.of();
        }
        try {
            WhitelistFile parsed = objectMapper.readValue(file.toFile(), WhitelistFile.class);
            List<String> mints = parsed.getCoins().stream()
                    .filter(WhitelistFile.Coin::isEnabled)
                    .filter(coin -> coin.getMint() != null && !coin.getMint().isBlank())
                    .sorted(Comparator.comparingInt(WhitelistFile.Coin::getPriority).reversed())
                    .map(WhitelistFile.Coin::getMint)
                    .collect(Collectors.toList());
            log.info("📋 Loaded {} whitelisted coins from {} (version {})", mints.size(), file, parsed.getVersion());
            return mints;
        } catch (IOException e) {
            log.error("❌ Failed to parse whitelist file {}: {}", file, e.getMessage());
            return List.of();
        }
    }

    public boolean add(String mint) {
        boolean added = whitelist.add(mint);
        if (added) {
            log.info("➕ Whitelisted {}", mint);
        }
        return added;
    }

    public boolean remove(String mint) {
        boolean removed = whitelist.remove(mint);
        if (removed) {
            log.info("➖ Removed {} from whitelist", mint);
        }
        return removed;
    }

    public boolean contains(String mint) {
        return whitelist.contains(mint);
    }

    public Set<String> snapshot() {
        return Set.copyOf(whitelist);
    }
}
