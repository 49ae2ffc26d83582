package mta.eda.generator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import mta.eda.generator.model.OrderEvent;
import mta.eda.generator.service.lifecycle.LifecyclePolicy;
import mta.eda.generator.service.order.OrderFactory;
import mta.eda.generator.service.session.SessionClock;
import mta.eda.generator.service.sink.ConsoleEventSink;
import mta.eda.generator.service.sink.EventSink;
import mta.eda.generator.service.sink.KafkaEventSink;
import mta.eda.generator.service.sink.SinkDispatcher;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Wires the simulation engine. Settings are validated here, before any
 * engine bean exists, so a bad configuration never reaches the loop.
 */
@Configuration
public class GeneratorConfig {

    private final GeneratorProperties properties;

    public GeneratorConfig(GeneratorProperties properties) {
        properties.validate();
        this.properties = properties;
    }

    @Bean
    public Random generatorRandom() {
        return properties.getSeed() != null ? new Random(properties.getSeed()) : new Random();
    }

    @Bean
    public SessionClock sessionClock() {
        return SessionClock.system();
    }

    @Bean
    public Clock wallClock() {
        return Clock.systemUTC();
    }

    @Bean
    public LifecyclePolicy lifecyclePolicy(Random generatorRandom) {
        GeneratorProperties.Lifecycle lifecycle = properties.getLifecycle();
        return new LifecyclePolicy(lifecycle.dwellRanges(), lifecycle.getCancellationProbability(), generatorRandom);
    }

    @Bean
    public OrderFactory orderFactory(LifecyclePolicy lifecyclePolicy, Random generatorRandom) {
        return new OrderFactory(properties.getCatalog(), lifecyclePolicy, generatorRandom);
    }

    @Bean
    public SinkDispatcher sinkDispatcher(ObjectMapper objectMapper,
                                         ObjectProvider<KafkaTemplate<String, OrderEvent>> kafkaTemplate) {
        List<EventSink> sinks = new ArrayList<>();
        if (properties.getKafka().isEnabled()) {
            sinks.add(new KafkaEventSink(
                    kafkaTemplate.getObject(),
                    properties.getKafka().getTopic(),
                    properties.getKafka().getSendTimeout()));
        }
        if (properties.isConsoleEnabled()) {
            sinks.add(new ConsoleEventSink(objectMapper, System.out));
        }
        return new SinkDispatcher(sinks);
    }
}
