package mta.eda.generator.service.sink;

import mta.eda.generator.model.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * SinkDispatcher
 * Fans every event out to all configured sinks. A failing sink is logged and
 * counted; it never stops delivery to the other sinks or reaches the caller.
 */
public class SinkDispatcher implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(SinkDispatcher.class);

    private final List<EventSink> sinks;
    private final Map<String, Long> failuresBySink = new LinkedHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SinkDispatcher(List<EventSink> sinks) {
        this.sinks = List.copyOf(sinks);
        for (EventSink sink : this.sinks) {
            failuresBySink.put(sink.name(), 0L);
        }
    }

    public void dispatch(OrderEvent event) {
        for (EventSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                failuresBySink.merge(sink.name(), 1L, Long::sum);
                logger.warn("Failed to dispatch orderId={} status={} to sink={}: {}",
                        event.orderId(), event.status(), sink.name(), e.getMessage());
            }
        }
    }

    public List<String> sinkNames() {
        return sinks.stream().map(EventSink::name).toList();
    }

    public long failureCount() {
        return failuresBySink.values().stream().mapToLong(Long::longValue).sum();
    }

    public long failureCount(String sinkName) {
        return failuresBySink.getOrDefault(sinkName, 0L);
    }

    /**
     * Closes every sink. Only the first call has an effect.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        for (EventSink sink : sinks) {
            try {
                sink.close();
                logger.info("Closed sink={}", sink.name());
            } catch (RuntimeException e) {
                logger.warn("Failed to close sink={}: {}", sink.name(), e.getMessage(), e);
            }
        }
    }

    public boolean isClosed() {
        return closed.get();
    }
}
