package mta.eda.generator.service.lifecycle;

import mta.eda.generator.exception.InvalidStatusTransitionException;
import mta.eda.generator.model.CancellationReason;
import mta.eda.generator.model.Order;
import mta.eda.generator.model.OrderStatus;
import mta.eda.generator.service.util.StatusMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Random;

import static mta.eda.generator.service.util.OrderUtils.pickOne;
import static mta.eda.generator.service.util.OrderUtils.uniform;

/**
 * LifecyclePolicy
 * Decides when an order is due and what happens to it when it is:
 * cancel with the configured probability, otherwise advance one step.
 *
 * Holds no state besides its settings and random source. A seeded
 * {@link Random} makes every decision reproducible.
 */
public class LifecyclePolicy {

    private static final Logger logger = LoggerFactory.getLogger(LifecyclePolicy.class);

    private final Map<OrderStatus, DwellRange> dwellRanges;
    private final double cancellationProbability;
    private final Random random;

    public LifecyclePolicy(Map<OrderStatus, DwellRange> dwellRanges, double cancellationProbability, Random random) {
        if (cancellationProbability < 0.0 || cancellationProbability > 1.0) {
            throw new IllegalArgumentException("cancellationProbability must be in [0, 1]: " + cancellationProbability);
        }
        for (OrderStatus status : OrderStatus.values()) {
            if (!status.isTerminal() && !dwellRanges.containsKey(status)) {
                throw new IllegalArgumentException("Missing dwell range for status " + status);
            }
        }
        this.dwellRanges = new EnumMap<>(dwellRanges);
        this.cancellationProbability = cancellationProbability;
        this.random = random;
    }

    public double getCancellationProbability() {
        return cancellationProbability;
    }

    public DwellRange dwellRange(OrderStatus status) {
        DwellRange range = dwellRanges.get(status);
        if (range == null) {
            throw new IllegalArgumentException("No dwell range for terminal status " + status);
        }
        return range;
    }

    /**
     * Draws how long an order entering the given state must stay in it.
     */
    public Duration drawDwell(OrderStatus status) {
        DwellRange range = dwellRange(status);
        return uniform(random, range.min(), range.max());
    }

    /**
     * An order is due once it has spent its dwell time in the current state.
     * Terminal orders are never due.
     */
    public boolean isDue(Order order, long nowNanos) {
        if (order.isTerminal() || order.getNextDueDuration() == null) {
            return false;
        }
        long dwellNanos = nowNanos - order.getLastStatusChangeNanos();
        return dwellNanos >= order.getNextDueDuration().toNanos();
    }

    /**
     * Applies one lifecycle step to a due order.
     *
     * @param order  the order, must not be terminal
     * @param now    wall-clock time stamped on the order
     * @param nowNanos session clock reading the next dwell is measured from
     * @return what happened
     * @throws InvalidStatusTransitionException if the order is already terminal
     */
    public Transition apply(Order order, Instant now, long nowNanos) {
        OrderStatus current = order.getStatus();
        if (current.isTerminal()) {
            throw new InvalidStatusTransitionException(order.getOrderId(), current, null);
        }

        if (random.nextDouble() < cancellationProbability) {
            CancellationReason reason = pickOne(random, current.cancellationReasons());
            StatusMachine.requireValidTransition(order.getOrderId(), current, OrderStatus.CANCELLED);
            order.cancel(reason, now, nowNanos);
            logger.debug("Cancelled orderId={} in status={} reason={}", order.getOrderId(), current, reason);
            return new Transition(order.getOrderId(), current, OrderStatus.CANCELLED, reason);
        }

        OrderStatus next = current.next();
        StatusMachine.requireValidTransition(order.getOrderId(), current, next);
        Duration nextDue = next.isTerminal() ? null : drawDwell(next);
        order.advanceTo(next, now, nowNanos, nextDue);
        logger.debug("Advanced orderId={} {} → {} nextDue={}", order.getOrderId(), current, next, nextDue);
        return new Transition(order.getOrderId(), current, next, null);
    }
}
