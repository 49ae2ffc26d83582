package mta.eda.generator.service.stats;

import java.time.Duration;

/**
 * Counters of one session. Mutated by the session loop only.
 */
public class SessionStatistics {

    private long created;
    private long statusUpdates;
    private long shipped;
    private long cancelled;

    public void recordCreated() {
        created++;
    }

    public void recordStatusUpdate() {
        statusUpdates++;
    }

    public void recordShipped() {
        shipped++;
    }

    public void recordCancelled() {
        cancelled++;
    }

    public long getCreated() {
        return created;
    }

    public long getStatusUpdates() {
        return statusUpdates;
    }

    public long getShipped() {
        return shipped;
    }

    public long getCancelled() {
        return cancelled;
    }

    public StatisticsReport snapshot(int stillActive, long dispatchFailures, Duration elapsed) {
        return StatisticsReport.of(created, statusUpdates, shipped, cancelled, stillActive, dispatchFailures, elapsed);
    }
}
