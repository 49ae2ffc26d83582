package mta.eda.generator.service.stats;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Final figures of a session. Rates are fractions in [0, 1] and are zero
 * when nothing was created; throughput is zero when no time elapsed.
 */
public record StatisticsReport(
        long created,
        long statusUpdates,
        long shipped,
        long cancelled,
        long stillActive,
        long dispatchFailures,
        Duration elapsed,
        double successRate,
        double cancellationRate,
        double ordersPerMinute
) {

    public static StatisticsReport of(long created,
                                      long statusUpdates,
                                      long shipped,
                                      long cancelled,
                                      long stillActive,
                                      long dispatchFailures,
                                      Duration elapsed) {
        double successRate = created > 0 ? (double) shipped / created : 0.0;
        double cancellationRate = created > 0 ? (double) cancelled / created : 0.0;
        double minutes = elapsed.toNanos() / 60_000_000_000.0;
        double ordersPerMinute = minutes > 0 ? created / minutes : 0.0;
        return new StatisticsReport(created, statusUpdates, shipped, cancelled, stillActive,
                dispatchFailures, elapsed, successRate, cancellationRate, ordersPerMinute);
    }

    public static StatisticsReport empty() {
        return of(0, 0, 0, 0, 0, 0, Duration.ZERO);
    }

    /**
     * Summary lines as printed at the end of a session.
     */
    public List<String> lines() {
        double seconds = elapsed.toMillis() / 1000.0;
        return List.of(
                "Total new orders created: " + created,
                "Total status updates: " + statusUpdates,
                "Total orders shipped: " + shipped,
                "Total orders cancelled: " + cancelled,
                "Active orders (still in pipeline): " + stillActive,
                "Failed dispatches: " + dispatchFailures,
                String.format(Locale.ROOT, "Success rate: %.1f%%", successRate * 100),
                String.format(Locale.ROOT, "Cancellation rate: %.1f%%", cancellationRate * 100),
                String.format(Locale.ROOT, "Total time elapsed: %.2f seconds (%.2f minutes)", seconds, seconds / 60),
                String.format(Locale.ROOT, "Average rate: %.2f new orders per minute", ordersPerMinute)
        );
    }
}
