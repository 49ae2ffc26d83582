package mta.eda.generator.exception;

import lombok.Getter;

/**
 * DuplicateOrderException
 * Thrown when an order is admitted while an order with the same orderId is still active.
 */
@Getter
public class DuplicateOrderException extends RuntimeException {

    private final String orderId;

    public DuplicateOrderException(String orderId) {
        super("Order already active: " + orderId);
        this.orderId = orderId;
    }

}
