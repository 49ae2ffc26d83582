package mta.eda.generator.service.stats;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class SessionStatisticsTest {

    @Test
    void snapshotCarriesCountersAndRuntimeFigures() {
        SessionStatistics statistics = new SessionStatistics();
        statistics.recordCreated();
        statistics.recordCreated();
        statistics.recordStatusUpdate();
        statistics.recordStatusUpdate();
        statistics.recordStatusUpdate();
        statistics.recordShipped();
        statistics.recordCancelled();

        StatisticsReport report = statistics.snapshot(0, 2, Duration.ofSeconds(30));

        assertEquals(2, report.created());
        assertEquals(3, report.statusUpdates());
        assertEquals(1, report.shipped());
        assertEquals(1, report.cancelled());
        assertEquals(0, report.stillActive());
        assertEquals(2, report.dispatchFailures());
        assertEquals(Duration.ofSeconds(30), report.elapsed());
        assertEquals(4.0, report.ordersPerMinute(), 1e-9);
    }

    @Test
    void snapshotsDoNotChangeLater() {
        SessionStatistics statistics = new SessionStatistics();
        statistics.recordCreated();
        StatisticsReport first = statistics.snapshot(1, 0, Duration.ofSeconds(1));

        statistics.recordCreated();

        assertEquals(1, first.created());
        assertEquals(2, statistics.getCreated());
    }
}
