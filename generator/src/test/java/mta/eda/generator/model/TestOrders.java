package mta.eda.generator.model;

import java.time.Duration;
import java.time.Instant;

public final class TestOrders {

    private TestOrders() {}

    public static Order pending(String orderId, long createdAtNanos, Duration dwell) {
        return new Order(
                orderId,
                Product.DEFAULT_CATALOG.get(0),
                2,
                50.00,
                100.00,
                "CUST-123456",
                "jane.doe@example.com",
                PaymentMethod.PAYPAL,
                new ShippingAddress("1 Main St", "Springfield", "IL", "62701", "USA"),
                Instant.parse("2026-01-01T00:00:00Z"),
                createdAtNanos,
                dwell);
    }
}
