package tw.gc.auto.token.trader.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RollingWindowTest {

    @Test
    void add_whenFull_shouldEvictOldest() {
        RollingWindow<Integer> window = new RollingWindow<>(3);
        for (int i = 1; i <= 5; i++) {
            window.add(i);
        }

        assertThat(window.toList()).containsExactly(3, 4, 5);
        assertThat(window.size()).isEqualTo(3);
        assertThat(window.last()).contains(5);
    }

    @Test
    void evictWhile_shouldStopAtFirstNonMatching() {
        RollingWindow<Integer> window = new RollingWindow<>(5);
        window.add(1);
        window.add(2);
        window.add(10);
        window.add(1);

        int evicted = window.evictWhile(value -> value < 5);

        assertThat(evicted).isEqualTo(2);
        assertThat(window.toList()).containsExactly(10, 1);
    }

    @Test
    void constructor_whenCapacityNotPositive_shouldThrow() {
        assertThatThrownBy(() -> new RollingWindow<>(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void last_whenEmpty_shouldBeEmpty() {
        assertThat(new RollingWindow<String>(2).last()).isEmpty();
    }
}
