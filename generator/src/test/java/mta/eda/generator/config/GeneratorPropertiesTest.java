package mta.eda.generator.config;

import mta.eda.generator.exception.InvalidConfigurationException;
import mta.eda.generator.model.OrderStatus;
import mta.eda.generator.model.Product;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GeneratorPropertiesTest {

    @Test
    void defaultsAreValid() {
        GeneratorProperties properties = new GeneratorProperties();

        assertDoesNotThrow(properties::validate);
        assertEquals(Duration.ofMinutes(5), properties.getDuration());
        assertEquals(Duration.ofSeconds(1), properties.getMinDelay());
        assertEquals(Duration.ofSeconds(60), properties.getMaxDelay());
        assertEquals(0.08, properties.getLifecycle().getCancellationProbability());
        assertEquals(15, properties.getCatalog().size());
        assertTrue(properties.isConsoleEnabled());
    }

    @Test
    void plainNumbersBindInTheDocumentedUnits() {
        GeneratorProperties properties = bind(Map.of(
                "generator.duration", "2",
                "generator.min-delay", "3",
                "generator.max-delay", "7",
                "generator.lifecycle.pending.min", "1",
                "generator.lifecycle.pending.max", "2",
                "generator.seed", "42"));

        assertEquals(Duration.ofMinutes(2), properties.getDuration());
        assertEquals(Duration.ofSeconds(3), properties.getMinDelay());
        assertEquals(Duration.ofSeconds(7), properties.getMaxDelay());
        assertEquals(Duration.ofSeconds(1), properties.getLifecycle().getPending().getMin());
        assertEquals(Duration.ofSeconds(2), properties.getLifecycle().getPending().getMax());
        assertEquals(42L, properties.getSeed());
        assertEquals(Duration.ofSeconds(2),
                properties.getLifecycle().dwellRanges().get(OrderStatus.PENDING).max());
    }

    @Test
    void maxDelayBelowMinDelayIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setMinDelay(Duration.ofSeconds(10));
        properties.setMaxDelay(Duration.ofSeconds(5));

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.max-delay", ex.getProperty());
    }

    @Test
    void equalDelaysAreAllowed() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setMinDelay(Duration.ofSeconds(5));
        properties.setMaxDelay(Duration.ofSeconds(5));

        assertDoesNotThrow(properties::validate);
    }

    @Test
    void negativeDurationIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setDuration(Duration.ofMinutes(-1));

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.duration", ex.getProperty());
    }

    @Test
    void zeroDurationIsAllowed() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setDuration(Duration.ZERO);

        assertDoesNotThrow(properties::validate);
    }

    @Test
    void bootstrapServersWithoutTopicIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.getKafka().setBootstrapServers("localhost:9092");

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.kafka.topic", ex.getProperty());
        assertTrue(ex.getMessage().contains("required when generator.kafka.bootstrap-servers"));
    }

    @Test
    void topicWithoutBootstrapServersIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.getKafka().setTopic("ecommerce-sales");

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.kafka.bootstrap-servers", ex.getProperty());
    }

    @Test
    void consoleDefaultsOffWhenKafkaIsConfigured() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.getKafka().setBootstrapServers("localhost:9092");
        properties.getKafka().setTopic("ecommerce-sales");

        assertTrue(properties.getKafka().isEnabled());
        assertFalse(properties.isConsoleEnabled());

        properties.setConsole(true);
        assertTrue(properties.isConsoleEnabled());
    }

    @Test
    void consoleCanBeDisabledWithoutKafka() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setConsole(false);

        assertFalse(properties.getKafka().isEnabled());
        assertFalse(properties.isConsoleEnabled());
    }

    @Test
    void cancellationProbabilityOutOfRangeIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.getLifecycle().setCancellationProbability(1.5);

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.lifecycle.cancellation-probability", ex.getProperty());
    }

    @Test
    void invertedDwellRangeIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.getLifecycle().setConfirmed(
                new GeneratorProperties.Dwell(Duration.ofSeconds(30), Duration.ofSeconds(10)));

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.lifecycle.confirmed.max", ex.getProperty());
    }

    @Test
    void emptyCatalogIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setCatalog(List.of());

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.catalog", ex.getProperty());
    }

    @Test
    void productWithInvertedPriceRangeIsRejected() {
        GeneratorProperties properties = new GeneratorProperties();
        properties.setCatalog(List.of(new Product("PROD-900", "Desk Lamp", 40.0, 20.0)));

        InvalidConfigurationException ex = assertThrows(InvalidConfigurationException.class, properties::validate);

        assertEquals("generator.catalog[0].max-price", ex.getProperty());
    }

    @Test
    void failureAnalysisNamesTheProperty() {
        InvalidConfigurationException cause =
                new InvalidConfigurationException("generator.kafka.topic", "is required");

        var analysis = new InvalidConfigurationFailureAnalyzer().analyze(new IllegalStateException(cause), cause);

        assertEquals("Invalid configuration 'generator.kafka.topic': is required", analysis.getDescription());
        assertTrue(analysis.getAction().contains("--generator.kafka.topic="));
    }

    private static GeneratorProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bind("generator", GeneratorProperties.class)
                .get();
    }
}
