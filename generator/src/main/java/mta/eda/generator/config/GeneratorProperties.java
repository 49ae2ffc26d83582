package mta.eda.generator.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import mta.eda.generator.exception.InvalidConfigurationException;
import mta.eda.generator.model.OrderStatus;
import mta.eda.generator.model.Product;
import mta.eda.generator.service.lifecycle.DwellRange;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Settings of a generator session, bound from the {@code generator.*} properties.
 *
 * <p>Field-level constraints are checked by Spring when binding. Cross-field
 * rules (delay range, Kafka pair, dwell ranges, catalog) are checked by
 * {@link #validate()} before the session starts.
 */
@Validated
@ConfigurationProperties(prefix = "generator")
public class GeneratorProperties {

    @NotNull
    @DurationUnit(ChronoUnit.MINUTES)
    private Duration duration = Duration.ofMinutes(5);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration minDelay = Duration.ofSeconds(1);

    @NotNull
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration maxDelay = Duration.ofSeconds(60);

    @NotNull
    private Duration tick = Duration.ofMillis(100);

    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(30);

    /**
     * Console output toggle. Null means: on unless Kafka is configured.
     */
    private Boolean console;

    /**
     * Seed of the random source. Unset means a different stream every run.
     */
    private Long seed;

    @Valid
    private Kafka kafka = new Kafka();

    @Valid
    private Lifecycle lifecycle = new Lifecycle();

    private List<Product> catalog = new ArrayList<>(Product.DEFAULT_CATALOG);

    public Duration getDuration() {
        return duration;
    }

    public void setDuration(Duration duration) {
        this.duration = duration;
    }

    public Duration getMinDelay() {
        return minDelay;
    }

    public void setMinDelay(Duration minDelay) {
        this.minDelay = minDelay;
    }

    public Duration getMaxDelay() {
        return maxDelay;
    }

    public void setMaxDelay(Duration maxDelay) {
        this.maxDelay = maxDelay;
    }

    public Duration getTick() {
        return tick;
    }

    public void setTick(Duration tick) {
        this.tick = tick;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }

    public Boolean getConsole() {
        return console;
    }

    public void setConsole(Boolean console) {
        this.console = console;
    }

    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public void setKafka(Kafka kafka) {
        this.kafka = kafka;
    }

    public Lifecycle getLifecycle() {
        return lifecycle;
    }

    public void setLifecycle(Lifecycle lifecycle) {
        this.lifecycle = lifecycle;
    }

    public List<Product> getCatalog() {
        return catalog;
    }

    public void setCatalog(List<Product> catalog) {
        this.catalog = catalog;
    }

    /**
     * Console is on by default, off by default when publishing to Kafka.
     * An explicit setting always wins.
     */
    public boolean isConsoleEnabled() {
        if (console != null) {
            return console;
        }
        return !kafka.isEnabled();
    }

    /**
     * Checks the cross-field rules a session depends on.
     *
     * @throws InvalidConfigurationException naming the first offending property
     */
    public void validate() {
        if (duration.isNegative()) {
            throw new InvalidConfigurationException("generator.duration", "must not be negative");
        }
        if (minDelay.isNegative()) {
            throw new InvalidConfigurationException("generator.min-delay", "must not be negative");
        }
        if (maxDelay.compareTo(minDelay) < 0) {
            throw new InvalidConfigurationException("generator.max-delay",
                    "must be greater than or equal to min-delay (" + minDelay + "), got " + maxDelay);
        }
        if (tick.isZero() || tick.isNegative()) {
            throw new InvalidConfigurationException("generator.tick", "must be positive");
        }
        kafka.validate();
        lifecycle.validate();
        validateCatalog();
    }

    private void validateCatalog() {
        if (catalog == null || catalog.isEmpty()) {
            throw new InvalidConfigurationException("generator.catalog", "product catalog must not be empty");
        }
        for (int i = 0; i < catalog.size(); i++) {
            Product product = catalog.get(i);
            String key = "generator.catalog[" + i + "]";
            if (product.id() == null || product.id().isBlank()) {
                throw new InvalidConfigurationException(key + ".id", "is required and must not be blank");
            }
            if (product.name() == null || product.name().isBlank()) {
                throw new InvalidConfigurationException(key + ".name", "is required and must not be blank");
            }
            if (product.minPrice() <= 0) {
                throw new InvalidConfigurationException(key + ".min-price", "must be positive");
            }
            if (product.maxPrice() < product.minPrice()) {
                throw new InvalidConfigurationException(key + ".max-price",
                        "must be greater than or equal to min-price for " + product.id());
            }
        }
    }

    /**
     * Broker endpoint. Both fields or neither.
     */
    public static class Kafka {

        private String bootstrapServers;

        private String topic;

        @NotNull
        private Duration sendTimeout = Duration.ofSeconds(10);

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }

        public Duration getSendTimeout() {
            return sendTimeout;
        }

        public void setSendTimeout(Duration sendTimeout) {
            this.sendTimeout = sendTimeout;
        }

        public boolean isEnabled() {
            return hasText(bootstrapServers) && hasText(topic);
        }

        void validate() {
            if (hasText(bootstrapServers) && !hasText(topic)) {
                throw new InvalidConfigurationException("generator.kafka.topic",
                        "is required when generator.kafka.bootstrap-servers is specified");
            }
            if (hasText(topic) && !hasText(bootstrapServers)) {
                throw new InvalidConfigurationException("generator.kafka.bootstrap-servers",
                        "is required when generator.kafka.topic is specified");
            }
            if (sendTimeout.isZero() || sendTimeout.isNegative()) {
                throw new InvalidConfigurationException("generator.kafka.send-timeout", "must be positive");
            }
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }

    /**
     * Dwell ranges and cancellation odds of the order lifecycle.
     */
    public static class Lifecycle {

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double cancellationProbability = 0.08;

        private Dwell pending = new Dwell(Duration.ofSeconds(10), Duration.ofSeconds(30));

        private Dwell confirmed = new Dwell(Duration.ofSeconds(15), Duration.ofSeconds(45));

        private Dwell processing = new Dwell(Duration.ofSeconds(20), Duration.ofSeconds(60));

        public double getCancellationProbability() {
            return cancellationProbability;
        }

        public void setCancellationProbability(double cancellationProbability) {
            this.cancellationProbability = cancellationProbability;
        }

        public Dwell getPending() {
            return pending;
        }

        public void setPending(Dwell pending) {
            this.pending = pending;
        }

        public Dwell getConfirmed() {
            return confirmed;
        }

        public void setConfirmed(Dwell confirmed) {
            this.confirmed = confirmed;
        }

        public Dwell getProcessing() {
            return processing;
        }

        public void setProcessing(Dwell processing) {
            this.processing = processing;
        }

        public Map<OrderStatus, DwellRange> dwellRanges() {
            Map<OrderStatus, DwellRange> ranges = new EnumMap<>(OrderStatus.class);
            ranges.put(OrderStatus.PENDING, pending.toRange());
            ranges.put(OrderStatus.CONFIRMED, confirmed.toRange());
            ranges.put(OrderStatus.PROCESSING, processing.toRange());
            return ranges;
        }

        void validate() {
            if (cancellationProbability < 0.0 || cancellationProbability > 1.0) {
                throw new InvalidConfigurationException("generator.lifecycle.cancellation-probability",
                        "must be between 0.0 and 1.0, got " + cancellationProbability);
            }
            pending.validate("generator.lifecycle.pending");
            confirmed.validate("generator.lifecycle.confirmed");
            processing.validate("generator.lifecycle.processing");
        }
    }

    /**
     * Dwell time range of one state. Plain numbers are seconds.
     */
    public static class Dwell {

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration min;

        @DurationUnit(ChronoUnit.SECONDS)
        private Duration max;

        public Dwell() {
        }

        public Dwell(Duration min, Duration max) {
            this.min = min;
            this.max = max;
        }

        public Duration getMin() {
            return min;
        }

        public void setMin(Duration min) {
            this.min = min;
        }

        public Duration getMax() {
            return max;
        }

        public void setMax(Duration max) {
            this.max = max;
        }

        DwellRange toRange() {
            return new DwellRange(min, max);
        }

        void validate(String prefix) {
            if (min == null || min.isNegative()) {
                throw new InvalidConfigurationException(prefix + ".min", "is required and must not be negative");
            }
            if (max == null || max.compareTo(min) < 0) {
                throw new InvalidConfigurationException(prefix + ".max",
                        "must be greater than or equal to " + prefix + ".min");
            }
        }
    }
}
