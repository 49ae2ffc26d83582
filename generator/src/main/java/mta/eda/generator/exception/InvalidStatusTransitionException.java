package mta.eda.generator.exception;

import lombok.Getter;
import mta.eda.generator.model.OrderStatus;

/**
 * InvalidStatusTransitionException
 *
 * Thrown when a status transition violates the lifecycle rules.
 * Example: moving a SHIPPED order back to CONFIRMED, or evaluating an order
 * that is already terminal.
 */
@Getter
public class InvalidStatusTransitionException extends RuntimeException {

    private final String orderId;
    private final OrderStatus currentStatus;
    private final OrderStatus requestedStatus;

    public InvalidStatusTransitionException(String orderId, OrderStatus currentStatus, OrderStatus requestedStatus) {
        super(String.format(
            "Invalid status transition for order %s: %s → %s. " +
            "Status must progress sequentially (PENDING → CONFIRMED → PROCESSING → SHIPPED) " +
            "or to CANCELLED from any non-terminal state.",
            orderId != null ? orderId : "<unknown>",
            currentStatus,
            requestedStatus != null ? requestedStatus : "<next>"
        ));
        this.orderId = orderId;
        this.currentStatus = currentStatus;
        this.requestedStatus = requestedStatus;
    }
}
