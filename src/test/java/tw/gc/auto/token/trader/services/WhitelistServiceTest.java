package tw.gc.auto.token.trader.services;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tw.gc.auto.token.trader.config.TradingProperties;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_A;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_B;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_C;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.properties;

class WhitelistServiceTest {

    private TradingProperties properties;
    private WhitelistService whitelistService;

    @BeforeEach
    void setUp() {
        properties = properties();
        whitelistService = new WhitelistService(properties, new ObjectMapper());
    }

    private static Path fixture() throws URISyntaxException {
        return Path.of(WhitelistServiceTest.class.getResource("/whitelist-test.json").toURI());
    }

    @Test
    void loadFile_shouldReturnEnabledCoinsByPriority() throws Exception {
        List<String> mints = whitelistService.loadFile(fixture());

        assertThat(mints).containsExactly(MINT_C, MINT_B);
    }

    @Test
    void loadFile_whenMissing_shouldReturnEmpty(@TempDir Path dir) {
        assertThat(whitelistService.loadFile(dir.resolve("missing.json"))).isEmpty();
    }

    @Test
    void loadFile_whenMalformed_shouldReturnEmpty(@TempDir Path dir) throws IOException {
        Path broken = Files.writeString(dir.resolve("broken.json"), "{ not json");

        assertThat(whitelistService.loadFile(broken)).isEmpty();
    }

    @Test
    void init_shouldMergePropertiesAndFile() throws Exception {
        properties.getWhitelist().setTokens(List.of(MINT_A, " "));
        properties.getWhitelist().setFile(fixture().toString());

        whitelistService.init();

        assertThat(whitelistService.snapshot()).containsExactlyInAnyOrder(MINT_A, MINT_B, MINT_C);
    }

    @Test
    void addAndRemove_shouldReportChanges() {
        assertThat(whitelistService.add(MINT_A)).isTrue();
        assertThat(whitelistService.add(MINT_A)).isFalse();
        assertThat(whitelistService.contains(MINT_A)).isTrue();

        assertThat(whitelistService.remove(MINT_A)).isTrue();
        assertThat(whitelistService.remove(MINT_A)).isFalse();
    }

    @Test
    void snapshot_shouldNotSeeLaterWrites() {
        whitelistService.add(MINT_A);
        Set<String> snapshot = whitelistService.snapshot();

        whitelistService.add(MINT_B);

        assertThat(snapshot).containsExactly(MINT_A);
    }
}
