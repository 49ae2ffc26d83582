package mta.eda.generator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * OrderEvent - the externally visible snapshot of an order, emitted on
 * creation and on every status change. Sinks publish this, never the
 * {@link Order} itself, so scheduling fields stay internal.
 */
@JsonPropertyOrder({
        "order_id", "timestamp", "product_id", "product_name", "quantity", "price", "total",
        "customer_id", "customer_email", "payment_method", "shipping_address", "status",
        "cancellation_reason"
})
public record OrderEvent(
        @JsonProperty("order_id")
        String orderId,

        @JsonProperty("timestamp")
        String timestamp,

        @JsonProperty("product_id")
        String productId,

        @JsonProperty("product_name")
        String productName,

        @JsonProperty("quantity")
        int quantity,

        @JsonProperty("price")
        double price,

        @JsonProperty("total")
        double total,

        @JsonProperty("customer_id")
        String customerId,

        @JsonProperty("customer_email")
        String customerEmail,

        @JsonProperty("payment_method")
        PaymentMethod paymentMethod,

        @JsonProperty("shipping_address")
        ShippingAddress shippingAddress,

        @JsonProperty("status")
        OrderStatus status,

        @JsonProperty("cancellation_reason")
        @JsonInclude(JsonInclude.Include.NON_NULL)
        CancellationReason cancellationReason
) {

    public static OrderEvent from(Order order) {
        return new OrderEvent(
                order.getOrderId(),
                formatTimestamp(order.getTimestamp()),
                order.getProductId(),
                order.getProductName(),
                order.getQuantity(),
                order.getPrice(),
                order.getTotal(),
                order.getCustomerId(),
                order.getCustomerEmail(),
                order.getPaymentMethod(),
                order.getShippingAddress(),
                order.getStatus(),
                order.getStatus() == OrderStatus.CANCELLED ? order.getCancellationReason() : null
        );
    }

    // ISO-8601 UTC, microsecond precision, always with a Z suffix
    private static String formatTimestamp(Instant instant) {
        return instant.truncatedTo(ChronoUnit.MICROS).toString();
    }
}
