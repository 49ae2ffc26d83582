package mta.eda.generator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import mta.eda.generator.exception.InvalidStatusTransitionException;

import java.util.List;

/**
 * OrderStatus - the lifecycle states of a generated order.
 *
 * Status Progression:
 * PENDING (0) → CONFIRMED (1) → PROCESSING (2) → SHIPPED (3)
 *     ↓              ↓               ↓
 *                CANCELLED (4)
 *
 * SHIPPED and CANCELLED are terminal. Each non-terminal state carries the
 * cancellation reasons that are plausible while an order sits in it.
 */
public enum OrderStatus {

    PENDING("pending", 0, List.of(
            CancellationReason.PAYMENT_FAILED,
            CancellationReason.PAYMENT_DECLINED,
            CancellationReason.CUSTOMER_CANCELLED,
            CancellationReason.FRAUD_SUSPECTED)),

    CONFIRMED("confirmed", 1, List.of(
            CancellationReason.INVENTORY_UNAVAILABLE,
            CancellationReason.CUSTOMER_CANCELLED,
            CancellationReason.PAYMENT_VERIFICATION_FAILED,
            CancellationReason.ADDRESS_INVALID)),

    PROCESSING("processing", 2, List.of(
            CancellationReason.CUSTOMER_CANCELLED,
            CancellationReason.INVENTORY_DAMAGED,
            CancellationReason.SHIPPING_ADDRESS_UNREACHABLE,
            CancellationReason.CUSTOMER_REQUESTED_CANCELLATION)),

    SHIPPED("shipped", 3, List.of()),

    CANCELLED("cancelled", 4, List.of());

    private final String value;
    private final int order;
    private final List<CancellationReason> cancellationReasons;

    OrderStatus(String value, int order, List<CancellationReason> cancellationReasons) {
        this.value = value;
        this.order = order;
        this.cancellationReasons = cancellationReasons;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Position in the progression. Lower number = earlier stage.
     */
    public int order() {
        return order;
    }

    public boolean isTerminal() {
        return this == SHIPPED || this == CANCELLED;
    }

    /**
     * Reasons an order may be cancelled with while it is in this state.
     * Empty for terminal states.
     */
    public List<CancellationReason> cancellationReasons() {
        return cancellationReasons;
    }

    /**
     * The next state in the forward progression.
     *
     * @throws InvalidStatusTransitionException if this state is terminal
     */
    public OrderStatus next() {
        return switch (this) {
            case PENDING -> CONFIRMED;
            case CONFIRMED -> PROCESSING;
            case PROCESSING -> SHIPPED;
            case SHIPPED, CANCELLED -> throw new InvalidStatusTransitionException(null, this, null);
        };
    }

    @JsonCreator
    public static OrderStatus fromValue(String value) {
        for (OrderStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown order status: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
