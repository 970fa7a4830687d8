package tw.gc.auto.token.trader.entities;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON layout of the curated coin list.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WhitelistFile {
    private String version;
    private String lastUpdated;
    private List<Coin> coins = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Coin {
        private String symbol;
        private String mint;
        private String name;
        private boolean enabled = true;
        private int priority;
        private List<String> tags = new ArrayList<>();
    }
}
