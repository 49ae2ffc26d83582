package mta.eda.generator.service.sink;

import mta.eda.generator.model.OrderEvent;

/**
 * A destination for order lifecycle events.
 * publish may throw any RuntimeException; the dispatcher isolates it.
 */
public interface EventSink extends AutoCloseable {

    String name();

    void publish(OrderEvent event);

    /**
     * Flushes and releases whatever the sink holds. Called once per session.
     */
    @Override
    default void close() {
    }
}
