package mta.eda.generator.service.session;

import mta.eda.generator.exception.DuplicateOrderException;
import mta.eda.generator.model.Order;
import mta.eda.generator.service.lifecycle.LifecyclePolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * ActiveOrderRegistry
 * The in-flight orders of one session, keyed by orderId.
 * Holds exactly the non-terminal orders. Not thread-safe: owned by the session loop.
 */
public class ActiveOrderRegistry {

    private final Map<String, Order> activeOrders = new LinkedHashMap<>();

    /**
     * @throws DuplicateOrderException if an order with the same id is already active
     * @throws IllegalArgumentException if the order is already terminal
     */
    public void insert(Order order) {
        if (order.isTerminal()) {
            throw new IllegalArgumentException("Terminal order cannot be registered: " + order.getOrderId());
        }
        Order prev = activeOrders.putIfAbsent(order.getOrderId(), order);
        if (prev != null) {
            throw new DuplicateOrderException(order.getOrderId());
        }
    }

    /**
     * Snapshot of the ids of every order due at the given time. Taken before any
     * order is transitioned so a transition cannot make an order due twice in one tick.
     */
    public List<String> dueOrderIds(LifecyclePolicy policy, long nowNanos) {
        List<String> due = new ArrayList<>();
        for (Order order : activeOrders.values()) {
            if (policy.isDue(order, nowNanos)) {
                due.add(order.getOrderId());
            }
        }
        return due;
    }

    public Optional<Order> get(String orderId) {
        return Optional.ofNullable(activeOrders.get(orderId));
    }

    public Order remove(String orderId) {
        return activeOrders.remove(orderId);
    }

    public boolean contains(String orderId) {
        return activeOrders.containsKey(orderId);
    }

    public int size() {
        return activeOrders.size();
    }

    public boolean isEmpty() {
        return activeOrders.isEmpty();
    }

    public Collection<Order> orders() {
        return Collections.unmodifiableCollection(activeOrders.values());
    }
}
