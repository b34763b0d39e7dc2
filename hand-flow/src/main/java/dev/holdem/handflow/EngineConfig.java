package dev.holdem.handflow;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Engine settings read from the environment.
 *
 * <ul>
 *   <li>{@code HOLDEM_ACTION_TIMEOUT_SECONDS}: seconds a seat has to act, 0 disables timers (default 30)</li>
 *   <li>{@code HOLDEM_TIMER_THREADS}: threads firing action timers (default 1)</li>
 * </ul>
 *
 * @param actionTimeout default time to act; a table's own setting wins
 * @param timerThreads size of the timer pool
 */
public record EngineConfig(Duration actionTimeout, int timerThreads) {
    private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

    public static final String ACTION_TIMEOUT_ENV = "HOLDEM_ACTION_TIMEOUT_SECONDS";
    public static final String TIMER_THREADS_ENV = "HOLDEM_TIMER_THREADS";
    public static final int DEFAULT_ACTION_TIMEOUT_SECONDS = 30;
    public static final int DEFAULT_TIMER_THREADS = 1;

    public EngineConfig {
        if (actionTimeout == null || actionTimeout.isNegative()) {
            throw new IllegalArgumentException("actionTimeout must be zero or positive");
        }
        if (timerThreads < 1) {
            throw new IllegalArgumentException("timerThreads must be at least 1");
        }
    }

    public static EngineConfig defaults() {
        return new EngineConfig(Duration.ofSeconds(DEFAULT_ACTION_TIMEOUT_SECONDS), DEFAULT_TIMER_THREADS);
    }

    public static EngineConfig fromEnvironment() {
        return from(System.getenv());
    }

    /**
     * Read settings from the given variables. Unparsable values keep the default.
     */
    public static EngineConfig from(Map<String, String> env) {
        int timeoutSeconds = readInt(env, ACTION_TIMEOUT_ENV, DEFAULT_ACTION_TIMEOUT_SECONDS, 0);
        int threads = readInt(env, TIMER_THREADS_ENV, DEFAULT_TIMER_THREADS, 1);
        return new EngineConfig(Duration.ofSeconds(timeoutSeconds), threads);
    }

    public boolean timersEnabled() {
        return !actionTimeout.isZero();
    }

    private static int readInt(Map<String, String> env, String name, int defaultValue, int min) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            int value = Integer.parseInt(raw.trim());
            if (value < min) {
                logger.warn("Invalid {} env var '{}', using default {}", name, raw, defaultValue);
                return defaultValue;
            }
            return value;
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} env var '{}', using default {}", name, raw, defaultValue);
            return defaultValue;
        }
    }
}
