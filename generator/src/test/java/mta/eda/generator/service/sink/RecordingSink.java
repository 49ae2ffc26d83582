package mta.eda.generator.service.sink;

import mta.eda.generator.model.OrderEvent;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps every published event in memory.
 */
public class RecordingSink implements EventSink {

    private final List<OrderEvent> events = new CopyOnWriteArrayList<>();
    private volatile int closeCount;

    @Override
    public String name() {
        return "recording";
    }

    @Override
    public void publish(OrderEvent event) {
        events.add(event);
    }

    @Override
    public void close() {
        closeCount++;
    }

    public List<OrderEvent> events() {
        return events;
    }

    public Map<String, List<OrderEvent>> eventsByOrder() {
        Map<String, List<OrderEvent>> byOrder = new LinkedHashMap<>();
        for (OrderEvent event : events) {
            byOrder.computeIfAbsent(event.orderId(), id -> new ArrayList<>()).add(event);
        }
        return byOrder;
    }

    public int closeCount() {
        return closeCount;
    }
}
