package tw.gc.auto.token.trader.services.position;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import tw.gc.auto.token.trader.config.TradingProperties;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_A;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.MINT_B;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.T0;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.fixedClock;
import static tw.gc.auto.token.trader.testutil.TokenTestFactory.properties;

class PositionBookTest {

    private TradingProperties properties;
    private PositionBook positionBook;

    @BeforeEach
    void setUp() {
        properties = properties();
        properties.getPositions().setHistoryCapacity(5);
        properties.getPositions().setTrailingActivationPercent(10.0);
        positionBook = new PositionBook(properties, fixedClock(T0));
    }

    @Nested
    @DisplayName("open")
    class Open {

        @Test
        void open_shouldSeedPricesFromEntry() {
            Position position = positionBook.open(MINT_A, 2.0, 0.05);

            assertThat(position.getEntryPrice()).isEqualTo(2.0);
            assertThat(position.getCurrentPrice()).isEqualTo(2.0);
            assertThat(position.getPeakPrice()).isEqualTo(2.0);
            assertThat(position.getTroughPrice()).isEqualTo(2.0);
            assertThat(position.getPriceHistory()).containsExactly(2.0);
            assertThat(position.getOpenedAt()).isEqualTo(T0);
            assertThat(position.isTrailingStopArmed()).isFalse();
            assertThat(positionBook.count()).isEqualTo(1);
        }

        @Test
        void open_whenAlreadyHeld_shouldThrowAlreadyHeld() {
            positionBook.open(MINT_A, 1.0, 0.05);

            assertThatThrownBy(() -> positionBook.open(MINT_A, 1.5, 0.05))
                    .isInstanceOf(PositionAlreadyHeldException.class)
                    .hasMessageContaining(MINT_A);
            assertThat(positionBook.get(MINT_A)).get().extracting(Position::getEntryPrice).isEqualTo(1.0);
        }

        @Test
        void open_whenPriceNotPositive_shouldThrow() {
            assertThatThrownBy(() -> positionBook.open(MINT_A, 0.0, 0.05))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThat(positionBook.count()).isZero();
        }
    }

    @Nested
    @DisplayName("update")
    class Update {

        @Test
        void update_whenAbsent_shouldThrowNotFound() {
            assertThatThrownBy(() -> positionBook.update(MINT_A, 1.0))
                    .isInstanceOf(PositionNotFoundException.class);
        }

        @Test
        void update_shouldKeepPeakAtMaximumEverSeen() {
            positionBook.open(MINT_A, 1.0, 0.05);
            double[] prices = {0.8, 1.4, 1.2, 0.5, 1.39, 0.9, 0.7, 0.6};
            double maxSeen = 1.0;
            double lastPeak = 1.0;
            for (double price : prices) {
                Position position = positionBook.update(MINT_A, price);
                maxSeen = Math.max(maxSeen, price);
                assertThat(position.getPeakPrice()).isGreaterThanOrEqualTo(lastPeak);
                assertThat(position.getPeakPrice()).isEqualTo(maxSeen);
                lastPeak = position.getPeakPrice();
            }
            // 1.4 has already been evicted from the bounded history, the peak stays
            assertThat(positionBook.get(MINT_A).orElseThrow().getPriceHistory()).doesNotContain(1.4);
            assertThat(lastPeak).isEqualTo(1.4);
        }

        @Test
        void update_shouldComputePnlFromLatestPriceOnly() {
            positionBook.open(MINT_A, 2.0, 0.05);
            positionBook.update(MINT_A, 3.0);
            Position position = positionBook.update(MINT_A, 2.5);

            assertThat(position.getUnrealizedPnlPercent()).isEqualTo(2.5 / 2.0 - 1);
            assertThat(position.getDrawdownFromPeak()).isEqualTo(1.0 - 2.5 / 3.0);
        }

        @Test
        void update_shouldBoundHistoryAndTrackTrough() {
            positionBook.open(MINT_A, 1.0, 0.05);
            List.of(1.1, 0.9, 1.2, 1.3, 1.25, 1.3).forEach(p -> positionBook.update(MINT_A, p));

            Position position = positionBook.get(MINT_A).orElseThrow();
            assertThat(position.getPriceHistory()).containsExactly(0.9, 1.2, 1.3, 1.25, 1.3);
            assertThat(position.getTroughPrice()).isEqualTo(0.9);
        }

        @Test
        void update_shouldArmTrailingStopOnceActivationReached() {
            positionBook.open(MINT_A, 1.0, 0.05);

            assertThat(positionBook.update(MINT_A, 1.05).isTrailingStopArmed()).isFalse();
            assertThat(positionBook.update(MINT_A, 1.10).isTrailingStopArmed()).isTrue();
            // stays armed after the price falls back
            assertThat(positionBook.update(MINT_A, 0.95).isTrailingStopArmed()).isTrue();
        }

        @Test
        void update_shouldRecomputeVolatility() {
            positionBook.open(MINT_A, 1.0, 0.05);
            positionBook.update(MINT_A, 1.1);
            Position position = positionBook.update(MINT_A, 0.99);

            assertThat(position.getVolatility()).isCloseTo(0.1, org.assertj.core.api.Assertions.within(1e-9));
            assertThat(position.getTroughPrice()).isEqualTo(0.99);
        }
    }

    @Nested
    @DisplayName("remove")
    class Remove {

        @Test
        void remove_whenAbsent_shouldReturnEmpty() {
            assertThat(positionBook.remove(MINT_A)).isEmpty();
            assertThat(positionBook.remove(MINT_A)).isEmpty();
        }

        @Test
        void remove_shouldReturnClosedPositionAndAllowFreshReentry() {
            Position first = positionBook.open(MINT_A, 1.0, 0.05);
            positionBook.update(MINT_A, 1.2);

            assertThat(positionBook.remove(MINT_A)).containsSame(first);
            assertThat(positionBook.contains(MINT_A)).isFalse();

            Position second = positionBook.open(MINT_A, 2.0, 0.05);
            assertThat(second).isNotSameAs(first);
            assertThat(second.getPeakPrice()).isEqualTo(2.0);
        }
    }

    @Test
    void totals_shouldAggregateAcrossPositions() {
        positionBook.open(MINT_A, 1.0, 1.0);
        positionBook.open(MINT_B, 2.0, 2.0);
        positionBook.update(MINT_A, 1.5);
        positionBook.update(MINT_B, 1.0);

        assertThat(positionBook.totalUnrealizedPnl()).isEqualTo(0.5 - 1.0);
        assertThat(positionBook.totalMarketValue()).isEqualTo(1.5 + 1.0);
        assertThat(positionBook.all()).hasSize(2);
    }

    @Test
    void holdDuration_shouldMeasureFromOpen() {
        Position position = positionBook.open(MINT_A, 1.0, 0.05);

        assertThat(position.getHoldDuration(T0.plusSeconds(90))).isEqualTo(Duration.ofSeconds(90));
    }
}
