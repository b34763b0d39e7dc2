package dev.holdem.handflow;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EngineConfigTest {

    @Test
    void defaults_when_unset() {
        EngineConfig config = EngineConfig.from(Map.of());

        assertThat(config.actionTimeout()).isEqualTo(Duration.ofSeconds(30));
        assertThat(config.timerThreads()).isEqualTo(1);
        assertThat(config.timersEnabled()).isTrue();
    }

    @Test
    void reads_environment_values() {
        EngineConfig config = EngineConfig.from(Map.of(
            EngineConfig.ACTION_TIMEOUT_ENV, "15",
            EngineConfig.TIMER_THREADS_ENV, "4"));

        assertThat(config.actionTimeout()).isEqualTo(Duration.ofSeconds(15));
        assertThat(config.timerThreads()).isEqualTo(4);
    }

    @Test
    void zero_timeout_disables_timers() {
        assertThat(EngineConfig.from(Map.of(EngineConfig.ACTION_TIMEOUT_ENV, "0")).timersEnabled()).isFalse();
    }

    @Test
    void unparsable_or_out_of_range_values_keep_the_default() {
        EngineConfig config = EngineConfig.from(Map.of(
            EngineConfig.ACTION_TIMEOUT_ENV, "soon",
            EngineConfig.TIMER_THREADS_ENV, "0"));

        assertThat(config).isEqualTo(EngineConfig.defaults());
    }

    @Test
    void rejects_negative_timeout() {
        assertThatThrownBy(() -> new EngineConfig(Duration.ofSeconds(-1), 1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
