package mta.eda.generator.config;

import mta.eda.generator.exception.InvalidConfigurationException;
import mta.eda.generator.service.sink.SinkDispatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GeneratorConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(JacksonAutoConfiguration.class))
            .withUserConfiguration(TestConfiguration.class);

    @Test
    void consoleOnlyByDefault() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).doesNotHaveBean(KafkaProducerConfig.class);
            assertThat(context.getBean(SinkDispatcher.class).sinkNames()).isEqualTo(List.of("console"));
        });
    }

    @Test
    void kafkaSinkReplacesConsoleWhenConfigured() {
        contextRunner
                .withPropertyValues(
                        "generator.kafka.bootstrap-servers=localhost:9092",
                        "generator.kafka.topic=ecommerce-sales")
                .run(context -> {
                    assertThat(context).hasNotFailed();
                    assertThat(context.getBean(SinkDispatcher.class).sinkNames())
                            .isEqualTo(List.of("kafka:ecommerce-sales"));
                });
    }

    @Test
    void bothSinksWhenConsoleForced() {
        contextRunner
                .withPropertyValues(
                        "generator.kafka.bootstrap-servers=localhost:9092",
                        "generator.kafka.topic=ecommerce-sales",
                        "generator.console=true")
                .run(context -> assertThat(context.getBean(SinkDispatcher.class).sinkNames())
                        .isEqualTo(List.of("kafka:ecommerce-sales", "console")));
    }

    @Test
    void invalidSettingsFailStartup() {
        contextRunner
                .withPropertyValues("generator.min-delay=10", "generator.max-delay=5")
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure())
                            .hasRootCauseInstanceOf(InvalidConfigurationException.class)
                            .rootCause()
                            .hasMessageContaining("generator.max-delay");
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(GeneratorProperties.class)
    @Import({GeneratorConfig.class, KafkaProducerConfig.class})
    static class TestConfiguration {
    }
}
