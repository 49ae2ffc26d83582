package mta.eda.generator.service.session;

import mta.eda.generator.model.Order;
import mta.eda.generator.model.OrderEvent;
import mta.eda.generator.model.OrderStatus;
import mta.eda.generator.service.lifecycle.LifecyclePolicy;
import mta.eda.generator.service.lifecycle.Transition;
import mta.eda.generator.service.order.OrderFactory;
import mta.eda.generator.service.sink.SinkDispatcher;
import mta.eda.generator.service.stats.SessionStatistics;
import mta.eda.generator.service.stats.StatisticsReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Random;

import static mta.eda.generator.service.util.OrderUtils.uniform;

/**
 * SimulationSession
 * Single-threaded, tick-based loop running one bounded generator session.
 *
 * <p>Each tick: stop if the deadline passed or a stop was requested; admit a new
 * order if its arrival time came; snapshot the due orders; transition each of
 * them exactly once, dispatch the resulting events and retire terminal orders.
 *
 * <p>The registry and counters belong to this object and are only touched from
 * the thread running {@link #run()} or {@link #tick()}. {@link #requestStop()}
 * is the one method safe to call from other threads.
 */
public class SimulationSession {

    private static final Logger logger = LoggerFactory.getLogger(SimulationSession.class);

    private final OrderFactory orderFactory;
    private final LifecyclePolicy lifecyclePolicy;
    private final SinkDispatcher dispatcher;
    private final SessionClock sessionClock;
    private final Clock wallClock;
    private final Random random;
    private final Duration duration;
    private final Duration minDelay;
    private final Duration maxDelay;
    private final Duration tickInterval;

    private final ActiveOrderRegistry registry = new ActiveOrderRegistry();
    private final SessionStatistics statistics = new SessionStatistics();

    private volatile SessionState state = SessionState.NEW;
    private volatile boolean stopRequested;

    private long startNanos;
    private long stopNanos;
    private long nextArrivalNanos;

    public SimulationSession(OrderFactory orderFactory,
                             LifecyclePolicy lifecyclePolicy,
                             SinkDispatcher dispatcher,
                             SessionClock sessionClock,
                             Clock wallClock,
                             Random random,
                             Duration duration,
                             Duration minDelay,
                             Duration maxDelay,
                             Duration tickInterval) {
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be less than minDelay");
        }
        this.orderFactory = orderFactory;
        this.lifecyclePolicy = lifecyclePolicy;
        this.dispatcher = dispatcher;
        this.sessionClock = sessionClock;
        this.wallClock = wallClock;
        this.random = random;
        this.duration = duration;
        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.tickInterval = tickInterval;
    }

    /**
     * Runs the session to completion: until the duration elapses, a stop is
     * requested, or the running thread is interrupted. Sinks are left open,
     * closing them is up to the owner of the dispatcher.
     *
     * @return the final statistics
     */
    public StatisticsReport run() {
        start();
        try {
            while (tick()) {
                sleepUntilNextTick();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Session interrupted, stopping");
        } finally {
            stop();
        }
        return report();
    }

    /**
     * Enters RUNNING and schedules the first arrival.
     */
    public void start() {
        if (state != SessionState.NEW) {
            throw new IllegalStateException("Session already started, state=" + state);
        }
        startNanos = sessionClock.nanoTime();
        nextArrivalNanos = startNanos + uniform(random, minDelay, maxDelay).toNanos();
        state = SessionState.RUNNING;
        logger.info("Session started: duration={} newOrderDelay={}-{}", duration, minDelay, maxDelay);
    }

    /**
     * Performs one tick.
     *
     * @return false once the session has stopped
     */
    public boolean tick() {
        if (state != SessionState.RUNNING) {
            return false;
        }

        long now = sessionClock.nanoTime();
        if (stopRequested) {
            logger.info("Stop requested, ending session");
            stop();
            return false;
        }
        if (now - startNanos >= duration.toNanos()) {
            logger.info("Session duration {} elapsed", duration);
            stop();
            return false;
        }

        Instant wallNow = Instant.now(wallClock);

        if (now >= nextArrivalNanos) {
            admitNewOrder(wallNow, now);
            nextArrivalNanos = now + uniform(random, minDelay, maxDelay).toNanos();
        }

        List<String> dueOrderIds = registry.dueOrderIds(lifecyclePolicy, now);
        for (String orderId : dueOrderIds) {
            registry.get(orderId).ifPresent(order -> transition(order, wallNow, now));
        }
        return true;
    }

    /**
     * Asks the loop to stop at the start of its next tick. Safe from any thread.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public SessionState getState() {
        return state;
    }

    public ActiveOrderRegistry getRegistry() {
        return registry;
    }

    public SessionStatistics getStatistics() {
        return statistics;
    }

    public StatisticsReport report() {
        long end = state == SessionState.STOPPED ? stopNanos : sessionClock.nanoTime();
        Duration elapsed = state == SessionState.NEW ? Duration.ZERO : Duration.ofNanos(end - startNanos);
        return statistics.snapshot(registry.size(), dispatcher.failureCount(), elapsed);
    }

    private void admitNewOrder(Instant wallNow, long now) {
        Order order = orderFactory.create(wallNow, now);
        registry.insert(order);
        dispatcher.dispatch(OrderEvent.from(order));
        statistics.recordCreated();
        logger.info("New orderId={} product={} total={} active={}",
                order.getOrderId(), order.getProductId(), order.getTotal(), registry.size());
    }

    private void transition(Order order, Instant wallNow, long now) {
        Transition transition = lifecyclePolicy.apply(order, wallNow, now);
        dispatcher.dispatch(OrderEvent.from(order));
        statistics.recordStatusUpdate();

        if (transition.isTerminal()) {
            registry.remove(order.getOrderId());
            if (transition.to() == OrderStatus.SHIPPED) {
                statistics.recordShipped();
            } else {
                statistics.recordCancelled();
            }
        }
        logger.debug("orderId={} {} → {}{}", transition.orderId(), transition.from(), transition.to(),
                Optional.ofNullable(transition.reason()).map(r -> " reason=" + r).orElse(""));
    }

    private void sleepUntilNextTick() throws InterruptedException {
        long tickStartNanos = sessionClock.nanoTime();
        long remaining = tickInterval.toNanos() - Math.floorMod(tickStartNanos - startNanos, tickInterval.toNanos());
        sessionClock.sleep(Duration.ofNanos(remaining));
    }

    private void stop() {
        if (state == SessionState.RUNNING) {
            stopNanos = sessionClock.nanoTime();
            state = SessionState.STOPPED;
            logger.info("Session stopped after {} ms: active={}",
                    Duration.ofNanos(stopNanos - startNanos).toMillis(), registry.size());
        }
    }
}
