package mta.eda.generator.runner;

import mta.eda.generator.config.GeneratorProperties;
import mta.eda.generator.service.lifecycle.LifecyclePolicy;
import mta.eda.generator.service.order.OrderFactory;
import mta.eda.generator.service.session.SessionClock;
import mta.eda.generator.service.session.SimulationSession;
import mta.eda.generator.service.sink.SinkDispatcher;
import mta.eda.generator.service.stats.StatisticsReport;
import mta.eda.generator.service.util.StatusMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * GeneratorRunner
 * Runs one generator session on the startup thread once the context is ready,
 * then closes the sinks and reports the statistics.
 *
 * <p>On an operator signal Spring closes the context, which calls {@link #stop()}
 * before any bean is destroyed: the session is asked to stop and the signal
 * thread waits until sinks are flushed and the report is logged.
 */
@Component
public class GeneratorRunner implements ApplicationRunner, SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(GeneratorRunner.class);

    private final GeneratorProperties properties;
    private final OrderFactory orderFactory;
    private final LifecyclePolicy lifecyclePolicy;
    private final SinkDispatcher sinkDispatcher;
    private final SessionClock sessionClock;
    private final Clock wallClock;
    private final Random generatorRandom;

    private final CountDownLatch finished = new CountDownLatch(1);
    private volatile SimulationSession session;
    private volatile StatisticsReport lastReport;
    private volatile boolean running;

    public GeneratorRunner(GeneratorProperties properties,
                           OrderFactory orderFactory,
                           LifecyclePolicy lifecyclePolicy,
                           SinkDispatcher sinkDispatcher,
                           SessionClock sessionClock,
                           Clock wallClock,
                           Random generatorRandom) {
        this.properties = properties;
        this.orderFactory = orderFactory;
        this.lifecyclePolicy = lifecyclePolicy;
        this.sinkDispatcher = sinkDispatcher;
        this.sessionClock = sessionClock;
        this.wallClock = wallClock;
        this.generatorRandom = generatorRandom;
    }

    @Override
    public void run(ApplicationArguments args) {
        runSession();
    }

    /**
     * Runs the session to its end and reports. Sinks are closed and the report
     * logged on every path, including an exception out of the loop.
     */
    public StatisticsReport runSession() {
        logBanner();
        SimulationSession current = new SimulationSession(
                orderFactory,
                lifecyclePolicy,
                sinkDispatcher,
                sessionClock,
                wallClock,
                generatorRandom,
                properties.getDuration(),
                properties.getMinDelay(),
                properties.getMaxDelay(),
                properties.getTick());
        this.session = current;

        try {
            current.run();
        } finally {
            sinkDispatcher.close();
            StatisticsReport report = current.report();
            logReport(report);
            lastReport = report;
            finished.countDown();
        }
        return lastReport;
    }

    public StatisticsReport getLastReport() {
        return lastReport;
    }

    @Override
    public void start() {
        running = true;
    }

    /**
     * Asks a running session to stop and waits for its shutdown sequence.
     */
    @Override
    public void stop() {
        SimulationSession current = session;
        if (current != null && finished.getCount() > 0) {
            logger.info("Shutdown signal received, stopping generator session");
            current.requestStop();
            try {
                if (!finished.await(properties.getShutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.warn("Generator session did not finish within {}", properties.getShutdownTimeout());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for the generator session to finish");
            }
        }
        running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    // Stop before every other lifecycle bean so the sinks are still usable
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }

    private void logBanner() {
        GeneratorProperties.Kafka kafka = properties.getKafka();
        logger.info("Starting e-commerce sales generator with order lifecycle...");
        logger.info("Duration: {} minutes", properties.getDuration().toSeconds() / 60.0);
        logger.info("New order delay range: {}-{} seconds",
                properties.getMinDelay().toMillis() / 1000.0, properties.getMaxDelay().toMillis() / 1000.0);
        logger.info("Order lifecycle: {}", StatusMachine.getStateMachineDescription());
        logger.info("Cancellation probability: {}", lifecyclePolicy.getCancellationProbability());
        if (kafka.isEnabled()) {
            logger.info("Kafka output: ENABLED (bootstrap servers: {}, topic: {})",
                    kafka.getBootstrapServers(), kafka.getTopic());
        } else {
            logger.info("Kafka output: DISABLED");
        }
        logger.info("Console output: {}", properties.isConsoleEnabled() ? "ENABLED" : "DISABLED");
        logger.info("Sinks: {}", sinkDispatcher.sinkNames());
    }

    private void logReport(StatisticsReport report) {
        logger.info("=".repeat(80));
        logger.info("Generator finished.");
        report.lines().forEach(logger::info);
    }
}
