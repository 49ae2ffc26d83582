package mta.eda.generator.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why an order ended up cancelled. Which reasons apply depends on the state
 * the order was in right before cancellation, see {@link OrderStatus#cancellationReasons()}.
 */
public enum CancellationReason {

    PAYMENT_FAILED("payment_failed"),
    PAYMENT_DECLINED("payment_declined"),
    CUSTOMER_CANCELLED("customer_cancelled"),
    FRAUD_SUSPECTED("fraud_suspected"),
    INVENTORY_UNAVAILABLE("inventory_unavailable"),
    PAYMENT_VERIFICATION_FAILED("payment_verification_failed"),
    ADDRESS_INVALID("address_invalid"),
    INVENTORY_DAMAGED("inventory_damaged"),
    SHIPPING_ADDRESS_UNREACHABLE("shipping_address_unreachable"),
    CUSTOMER_REQUESTED_CANCELLATION("customer_requested_cancellation");

    private final String value;

    CancellationReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CancellationReason fromValue(String value) {
        for (CancellationReason reason : values()) {
            if (reason.value.equalsIgnoreCase(value)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown cancellation reason: '" + value + "'");
    }

    @Override
    public String toString() {
        return value;
    }
}
