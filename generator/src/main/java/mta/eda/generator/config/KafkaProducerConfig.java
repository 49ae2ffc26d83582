package mta.eda.generator.config;

import mta.eda.generator.model.OrderEvent;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka Producer Configuration
 * Creates the KafkaTemplate used by the Kafka sink. Only active when both
 * generator.kafka.bootstrap-servers and generator.kafka.topic are set.
 * Client tuning comes from the spring.kafka.producer.* properties.
 */
@Configuration
@ConditionalOnProperty(prefix = "generator.kafka", name = {"bootstrap-servers", "topic"})
public class KafkaProducerConfig {

    @Value("${generator.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${spring.kafka.producer.key-serializer:org.apache.kafka.common.serialization.StringSerializer}")
    private String keySerializer;

    @Value("${spring.kafka.producer.value-serializer:org.springframework.kafka.support.serializer.JsonSerializer}")
    private String valueSerializer;

    @Value("${spring.kafka.producer.acks:all}")
    private String acks;

    @Value("${spring.kafka.producer.retries:3}")
    private int retries;

    @Value("${spring.kafka.producer.properties.max.in.flight.requests.per.connection:1}")
    private int maxInFlight;

    @Value("${spring.kafka.producer.properties.retry.backoff.ms:100}")
    private int retryBackoffMs;

    @Value("${spring.kafka.producer.properties.linger.ms:5}")
    private int lingerMs;

    @Value("${spring.kafka.producer.properties.batch.size:16384}")
    private int batchSize;

    @Value("${spring.kafka.producer.properties.compression.type:none}")
    private String compressionType;

    @Value("${spring.kafka.producer.properties.request.timeout.ms:5000}")
    private int requestTimeoutMs;

    @Value("${spring.kafka.producer.properties.delivery.timeout.ms:10000}")
    private int deliveryTimeoutMs;

    @Value("${spring.kafka.producer.properties.max.block.ms:5000}")
    private int maxBlockMs;

    @Value("${spring.kafka.producer.properties.enable.idempotence:false}")
    private boolean enableIdempotence;

    @Value("${spring.kafka.producer.client-id:sales-generator}")
    private String clientId;

    /**
     * Creates the ProducerFactory that configures how Kafka producers are created.
     * Key is String (orderId), Value is OrderEvent (JSON, no type headers).
     */
    @Bean
    public ProducerFactory<String, OrderEvent> producerFactory() {
        Map<String, Object> configProps = new HashMap<>();

        configProps.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);

        configProps.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, keySerializer);
        configProps.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, valueSerializer);
        configProps.put(JsonSerializer.ADD_TYPE_INFO_HEADERS, false);

        // Reliability: one in-flight request keeps per-key order across retries
        configProps.put(ProducerConfig.ACKS_CONFIG, acks);
        configProps.put(ProducerConfig.RETRIES_CONFIG, retries);
        configProps.put(ProducerConfig.MAX_IN_FLIGHT_REQUESTS_PER_CONNECTION, maxInFlight);
        configProps.put(ProducerConfig.RETRY_BACKOFF_MS_CONFIG, retryBackoffMs);

        configProps.put(ProducerConfig.BATCH_SIZE_CONFIG, batchSize);
        configProps.put(ProducerConfig.LINGER_MS_CONFIG, lingerMs);
        configProps.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, compressionType);

        configProps.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, requestTimeoutMs);
        configProps.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, deliveryTimeoutMs);
        configProps.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, maxBlockMs);

        configProps.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, enableIdempotence);

        return new DefaultKafkaProducerFactory<>(configProps);
    }

    @Bean
    public KafkaTemplate<String, OrderEvent> kafkaTemplate(ProducerFactory<String, OrderEvent> producerFactory) {
        return new KafkaTemplate<>(producerFactory);
    }
}
