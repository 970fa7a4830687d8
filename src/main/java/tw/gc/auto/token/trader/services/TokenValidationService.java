package tw.gc.auto.token.trader.services;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import tw.gc.auto.token.trader.AppConstants;
import tw.gc.auto.token.trader.config.TradingProperties;
import tw.gc.auto.token.trader.entities.TokenMeta;
import tw.gc.auto.token.trader.services.protection.RugDetector;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Basic gate for discovered tokens: address shape, freshness, block list and recent rug alerts.
 */
@Service
@Slf4j
public class TokenValidationService {

    private final TradingProperties.Validation config;
    private final RugDetector rugDetector;
    private final Clock clock;

    public TokenValidationService(TradingProperties properties, RugDetector rugDetector, Clock clock) {
        this.config = properties.getValidation();
        this.rugDetector = rugDetector;
        this.clock = clock;
    }

    public record ValidationResult(boolean valid, List<String> reasons) {

        public ValidationResult {
            reasons = List.copyOf(reasons);
        }
    }

    public ValidationResult validate(TokenMeta meta) {
        List<String> reasons = new ArrayList<>();
        String mint = meta.mint();
        if (mint == null || mint.isBlank()) {
            return new ValidationResult(false, List.of("blank mint"));
        }
        if (mint.length() < config.getMinAddressLength() || mint.length() > config.getMaxAddressLength()) {
            reasons.add("address length " + mint.length());
        }
        if (!isBase58(mint)) {
            reasons.add("address is not base58");
        }
        if (config.getBlockedTokens().contains(mint)) {
            reasons.add("blocked token");
        }
        if (meta.discoveredAt() != null) {
            Duration age = Duration.between(meta.discoveredAt(), clock.instant());
            if (age.toMillis() > config.getMaxTokenAgeMs()) {
                reasons.add("stale discovery (" + age.toSeconds() + "s old)");
            }
        }
        if (rugDetector.isRecentAlert(mint)) {
            reasons.add("recent rug alert");
        }
        if (!reasons.isEmpty()) {
            log.info("🚫 {} rejected: {}", mint, reasons);
        }
        return new ValidationResult(reasons.isEmpty(), reasons);
    }

    private static boolean isBase58(String value) {
        for (int i = 0; i < value.length(); i++) {
            if (AppConstants.BASE58_ALPHABET.indexOf(value.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
