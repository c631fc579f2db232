package io.maia.client.prometheus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Picks a range query resolution yielding at most about ten points per series.
 */
public final class StepSizes {

    static final List<Duration> LADDER = List.of(
            Duration.ofSeconds(15), Duration.ofSeconds(30), Duration.ofSeconds(60), Duration.ofSeconds(90),
            Duration.ofMinutes(2), Duration.ofMinutes(3), Duration.ofMinutes(5), Duration.ofMinutes(10),
            Duration.ofMinutes(15), Duration.ofMinutes(20), Duration.ofMinutes(30),
            Duration.ofHours(1), Duration.ofHours(2), Duration.ofHours(3), Duration.ofHours(8),
            Duration.ofHours(12), Duration.ofHours(24),
            Duration.ofDays(2), Duration.ofDays(3), Duration.ofDays(7), Duration.ofDays(14), Duration.ofDays(30));

    private StepSizes() {
    }

    /**
     * The first ladder value strictly greater than a tenth of the range; a tenth of the range itself
     * when it exceeds the whole ladder.
     */
    public static Duration select(Instant start, Instant end) {
        var target = Duration.between(start, end).dividedBy(10);
        for (Duration step : LADDER) {
            if (step.compareTo(target) > 0) {
                return step;
            }
        }
        return target;
    }

    /**
     * Whole seconds with an {@code s} suffix, e.g. {@code 300s}. Empty for {@code null} or zero.
     */
    public static String encode(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return "";
        }
        return duration.getSeconds() + "s";
    }
}
