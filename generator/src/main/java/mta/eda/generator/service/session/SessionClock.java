package mta.eda.generator.service.session;

import java.time.Duration;

/**
 * Monotonic time source of a session. Dwell times, arrivals and the session
 * deadline are all measured against it, never against wall-clock time.
 */
public interface SessionClock {

    long nanoTime();

    void sleep(Duration duration) throws InterruptedException;

    static SessionClock system() {
        return new SessionClock() {
            @Override
            public long nanoTime() {
                return System.nanoTime();
            }

            @Override
            public void sleep(Duration duration) throws InterruptedException {
                if (!duration.isZero() && !duration.isNegative()) {
                    Thread.sleep(duration.toMillis(), duration.toNanosPart() % 1_000_000);
                } else if (Thread.interrupted()) {
                    throw new InterruptedException();
                }
            }
        };
    }
}
