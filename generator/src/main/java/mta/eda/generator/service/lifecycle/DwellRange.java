package mta.eda.generator.service.lifecycle;

import java.time.Duration;
import java.util.Objects;

/**
 * Minimum and maximum time an order stays in a state before its next transition check.
 */
public record DwellRange(Duration min, Duration max) {

    public DwellRange {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.isNegative() || max.compareTo(min) < 0) {
            throw new IllegalArgumentException("Invalid dwell range: " + min + " - " + max);
        }
    }

    public static DwellRange ofSeconds(long min, long max) {
        return new DwellRange(Duration.ofSeconds(min), Duration.ofSeconds(max));
    }

    public boolean contains(Duration dwell) {
        return dwell.compareTo(min) >= 0 && dwell.compareTo(max) <= 0;
    }
}
