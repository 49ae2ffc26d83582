package mta.eda.generator.exception;

import lombok.Getter;

/**
 * ProducerSendException
 * Raised when an order event could not be published to Kafka.
 * type is one of TIMEOUT, INTERRUPTED, KAFKA_ERROR, UNEXPECTED.
 */
@Getter
public class ProducerSendException extends RuntimeException {

    private final String type;
    private final String orderId;

    public ProducerSendException(String type, String orderId, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
        this.orderId = orderId;
    }
}
