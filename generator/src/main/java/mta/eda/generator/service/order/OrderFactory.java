package mta.eda.generator.service.order;

import mta.eda.generator.model.Order;
import mta.eda.generator.model.OrderStatus;
import mta.eda.generator.model.PaymentMethod;
import mta.eda.generator.model.Product;
import mta.eda.generator.model.ShippingAddress;
import mta.eda.generator.service.lifecycle.LifecyclePolicy;
import net.datafaker.Faker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.Set;

import static mta.eda.generator.service.util.OrderUtils.*;

/**
 * OrderFactory
 * Builds new PENDING orders with random commercial attributes.
 * Touches neither the registry nor any sink.
 */
public class OrderFactory {

    private static final Logger logger = LoggerFactory.getLogger(OrderFactory.class);

    private static final int MAX_QUANTITY = 5;

    private final List<Product> catalog;
    private final LifecyclePolicy lifecyclePolicy;
    private final Random random;
    private final Faker faker;
    private final Set<String> issuedOrderIds = new HashSet<>();

    public OrderFactory(List<Product> catalog, LifecyclePolicy lifecyclePolicy, Random random) {
        if (catalog == null || catalog.isEmpty()) {
            throw new IllegalArgumentException("Product catalog must not be empty");
        }
        this.catalog = List.copyOf(catalog);
        this.lifecyclePolicy = lifecyclePolicy;
        this.random = random;
        this.faker = new Faker(random);
    }

    /**
     * Creates a new order in PENDING status.
     *
     * @param createdAt      wall-clock creation time, used as the event timestamp
     * @param createdAtNanos session clock reading the pending dwell is measured from
     * @return the new order
     */
    public Order create(Instant createdAt, long createdAtNanos) {
        Product product = pickOne(random, catalog);

        int quantity = random.nextInt(MAX_QUANTITY) + 1; // 1-5
        double price = roundToTwoDecimals(uniform(random, product.minPrice(), product.maxPrice()));
        double total = roundToTwoDecimals(quantity * price);

        Duration pendingDwell = lifecyclePolicy.drawDwell(OrderStatus.PENDING);

        Order order = new Order(
                nextOrderId(),
                product,
                quantity,
                price,
                total,
                generateCustomerId(random),
                faker.internet().emailAddress(),
                pickOne(random, List.of(PaymentMethod.values())),
                generateAddress(),
                createdAt,
                createdAtNanos,
                pendingDwell
        );

        logger.debug("Generated orderId={} product={} quantity={} total={}",
                order.getOrderId(), product.id(), quantity, total);
        return order;
    }

    /**
     * Number of distinct order ids handed out so far.
     */
    public int issuedCount() {
        return issuedOrderIds.size();
    }

    private String nextOrderId() {
        String orderId = generateOrderId(random);
        while (!issuedOrderIds.add(orderId)) {
            orderId = generateOrderId(random);
        }
        return orderId;
    }

    private ShippingAddress generateAddress() {
        return new ShippingAddress(
                faker.address().streetAddress(),
                faker.address().city(),
                faker.address().stateAbbr(),
                faker.address().zipCode(),
                faker.country().countryCode3().toUpperCase(Locale.ROOT)
        );
    }
}
