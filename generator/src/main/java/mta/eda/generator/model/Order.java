package mta.eda.generator.model;

import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Order - one simulated purchase tracked through its lifecycle.
 *
 * Commercial attributes are fixed at creation. Only the lifecycle attributes
 * (status, timestamp, scheduling fields, cancellation reason) change, and only
 * through {@link #advanceTo} and {@link #cancel}.
 *
 * lastStatusChangeNanos and nextDueDuration are read against the session clock
 * and never leave the process; see {@link OrderEvent} for what gets emitted.
 */
@Getter
public class Order {

    private final String orderId;
    private final String productId;
    private final String productName;
    private final int quantity;
    private final double price;
    private final double total;
    private final String customerId;
    private final String customerEmail;
    private final PaymentMethod paymentMethod;
    private final ShippingAddress shippingAddress;

    private OrderStatus status;
    private Instant timestamp;
    private long lastStatusChangeNanos;
    private Duration nextDueDuration;
    private CancellationReason cancellationReason;

    public Order(String orderId,
                 Product product,
                 int quantity,
                 double price,
                 double total,
                 String customerId,
                 String customerEmail,
                 PaymentMethod paymentMethod,
                 ShippingAddress shippingAddress,
                 Instant createdAt,
                 long createdAtNanos,
                 Duration pendingDwell) {
        this.orderId = orderId;
        this.productId = product.id();
        this.productName = product.name();
        this.quantity = quantity;
        this.price = price;
        this.total = total;
        this.customerId = customerId;
        this.customerEmail = customerEmail;
        this.paymentMethod = paymentMethod;
        this.shippingAddress = shippingAddress;
        this.status = OrderStatus.PENDING;
        this.timestamp = createdAt;
        this.lastStatusChangeNanos = createdAtNanos;
        this.nextDueDuration = pendingDwell;
    }

    /**
     * Moves the order one step forward. nextDue is null when the new status is terminal.
     */
    public void advanceTo(OrderStatus next, Instant at, long atNanos, Duration nextDue) {
        this.status = next;
        this.timestamp = at;
        this.lastStatusChangeNanos = atNanos;
        this.nextDueDuration = nextDue;
    }

    public void cancel(CancellationReason reason, Instant at, long atNanos) {
        this.status = OrderStatus.CANCELLED;
        this.cancellationReason = reason;
        this.timestamp = at;
        this.lastStatusChangeNanos = atNanos;
        this.nextDueDuration = null;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    @Override
    public String toString() {
        return "Order[orderId=" + orderId + ", status=" + status + ", product=" + productId
                + ", quantity=" + quantity + ", total=" + total + "]";
    }
}
