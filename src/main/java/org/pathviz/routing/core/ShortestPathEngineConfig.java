package org.pathviz.routing.core;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Runtime knobs for {@link ShortestPathEngine}.
 */
@Value
@Builder
public class ShortestPathEngineConfig {
    static final String PROP_SLOW_QUERY_THRESHOLD_MILLIS = "pathviz.engine.slowQueryThresholdMillis";
    static final long DEFAULT_SLOW_QUERY_THRESHOLD_MILLIS = 50L;

    /**
     * Queries slower than this are logged at WARN.
     */
    @Builder.Default
    Duration slowQueryThreshold = Duration.ofMillis(DEFAULT_SLOW_QUERY_THRESHOLD_MILLIS);

    /**
     * Monotonic nanosecond clock used to time queries.
     */
    @Builder.Default
    LongSupplier nanoClock = System::nanoTime;

    /**
     * Builds the default config, honouring the {@code pathviz.engine.slowQueryThresholdMillis}
     * system property.
     *
     * @throws IllegalArgumentException if the property is set to a negative value.
     */
    public static ShortestPathEngineConfig defaults() {
        long thresholdMillis = Long.getLong(PROP_SLOW_QUERY_THRESHOLD_MILLIS, DEFAULT_SLOW_QUERY_THRESHOLD_MILLIS);
        if (thresholdMillis < 0L) {
            throw new IllegalArgumentException(
                    PROP_SLOW_QUERY_THRESHOLD_MILLIS + " must be >= 0, got " + thresholdMillis
            );
        }
        return ShortestPathEngineConfig.builder()
                .slowQueryThreshold(Duration.ofMillis(thresholdMillis))
                .build();
    }
}
