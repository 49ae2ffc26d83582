package mta.eda.generator.service.util;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.List;
import java.util.Random;

public final class OrderUtils {

    /**
     * Private constructor to prevent instantiation
     */
    private OrderUtils() {}

    /**
     * Generates an order id in the format ORD-########.
     */
    public static String generateOrderId(Random random) {
        return "ORD-" + (10_000_000 + random.nextInt(90_000_000));
    }

    /**
     * Generates a customer id in the format CUST-######.
     */
    public static String generateCustomerId(Random random) {
        return "CUST-" + (100_000 + random.nextInt(900_000));
    }

    /**
     * Draws a value uniformly from [min, max].
     */
    public static double uniform(Random random, double min, double max) {
        if (max <= min) {
            return min;
        }
        return min + random.nextDouble() * (max - min);
    }

    /**
     * Draws a duration uniformly from [min, max], millisecond resolution.
     */
    public static Duration uniform(Random random, Duration min, Duration max) {
        long minMs = min.toMillis();
        long maxMs = max.toMillis();
        if (maxMs <= minMs) {
            return min;
        }
        return Duration.ofMillis(minMs + (long) (random.nextDouble() * (maxMs - minMs)));
    }

    public static <T> T pickOne(Random random, List<T> values) {
        return values.get(random.nextInt(values.size()));
    }

    /**
     * Rounds a double to 2 decimal places.
     *
     * @param value Value to round
     * @return Rounded value
     */
    public static double roundToTwoDecimals(double value) {
        return BigDecimal.valueOf(value)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
