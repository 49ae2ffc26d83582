package mta.eda.generator.service.sink;

import mta.eda.generator.exception.ProducerSendException;
import mta.eda.generator.model.OrderEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * KafkaEventSink
 * Publishes order events to Kafka.
 * Uses orderId as the Kafka key so every event of an order lands on one
 * partition, in emission order. No retries here: that is the producer's job.
 */
public class KafkaEventSink implements EventSink {

    private static final Logger logger = LoggerFactory.getLogger(KafkaEventSink.class);

    // Payloads that could not be published, for manual replay (logs to failed-orders.log)
    private static final Logger failedOrdersLogger = LoggerFactory.getLogger("FAILED_ORDERS_LOGGER");

    private final KafkaTemplate<String, OrderEvent> kafkaTemplate;
    private final String topicName;
    private final long sendTimeoutMs;

    public KafkaEventSink(KafkaTemplate<String, OrderEvent> kafkaTemplate, String topicName, Duration sendTimeout) {
        this.kafkaTemplate = kafkaTemplate;
        this.topicName = topicName;
        this.sendTimeoutMs = sendTimeout.toMillis();
    }

    @Override
    public String name() {
        return "kafka:" + topicName;
    }

    @Override
    public void publish(OrderEvent event) {
        sendOrder(event.orderId(), event);
    }

    /**
     * Sends an event to Kafka synchronously with bounded timeout.
     *
     * @param orderId The order ID (used as Kafka message key for ordering)
     * @param event   The event to publish
     * @throws ProducerSendException if send fails (classified by type)
     */
    public void sendOrder(String orderId, OrderEvent event) {
        try {

            SendResult<String, OrderEvent> result =
                    kafkaTemplate.send(topicName, orderId, event)
                            .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            logger.debug("Sent orderId={} status={} partition={} offset={}",
                    orderId,
                    event.status(),
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());

        } catch (TimeoutException e) {
            logFailedOrder("TIMEOUT", orderId, event, e.getMessage());
            throw new ProducerSendException("TIMEOUT", orderId,
                    "Send timeout after " + sendTimeoutMs + "ms", e);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logFailedOrder("INTERRUPTED", orderId, event, e.getMessage());
            throw new ProducerSendException("INTERRUPTED", orderId,
                    "Send interrupted", e);

        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logFailedOrder("KAFKA_ERROR", orderId, event, cause.getMessage());
            throw new ProducerSendException("KAFKA_ERROR", orderId,
                    "Kafka send failed: " + cause.getMessage(), cause);
        } catch (org.apache.kafka.common.KafkaException e) {
            logFailedOrder("KAFKA_ERROR", orderId, event, e.getMessage());
            throw new ProducerSendException("KAFKA_ERROR", orderId,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        } catch (Exception e) {
            logFailedOrder("UNEXPECTED", orderId, event, e.getMessage());
            throw new ProducerSendException("UNEXPECTED", orderId,
                    "Unexpected error: " + e.getMessage(), e);
        }
    }

    /**
     * Flushes buffered records and closes the underlying producer.
     */
    @Override
    public void close() {
        logger.info("Flushing and closing Kafka producer for topic={}", topicName);
        try {
            kafkaTemplate.flush();
        } finally {
            kafkaTemplate.getProducerFactory().reset();
        }
        logger.info("Kafka producer closed");
    }

    private void logFailedOrder(String type, String orderId, OrderEvent event, String reason) {
        logger.error("Logging failed orderId={} status={} to failed-orders.log [Type: {}, Reason: {}]",
                orderId, event.status(), type, reason);

        failedOrdersLogger.info("FAILED_ORDER | Type: {} | OrderId: {} | Reason: {} | Payload: {}",
                type, orderId, reason, event);
    }
}
