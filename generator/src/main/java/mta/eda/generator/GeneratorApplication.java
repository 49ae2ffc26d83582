package mta.eda.generator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * E-commerce sales generator.
 * Simulates orders moving through pending → confirmed → processing → shipped
 * (or cancelled) and emits every lifecycle event to the console and/or Kafka.
 */
@SpringBootApplication(exclude = KafkaAutoConfiguration.class)
@ConfigurationPropertiesScan
public class GeneratorApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(GeneratorApplication.class, args)));
    }
}
