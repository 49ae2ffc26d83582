package mta.eda.generator.model;

import java.util.List;

/**
 * Product - a catalog entry orders are generated from.
 * Unit prices are drawn uniformly from [minPrice, maxPrice].
 */
public record Product(
        String id,
        String name,
        double minPrice,
        double maxPrice
) {

    public static final List<Product> DEFAULT_CATALOG = List.of(
            new Product("PROD-001", "Wireless Bluetooth Headphones", 29.99, 199.99),
            new Product("PROD-002", "Smart Watch", 99.99, 499.99),
            new Product("PROD-003", "Laptop Stand", 19.99, 89.99),
            new Product("PROD-004", "USB-C Cable", 9.99, 29.99),
            new Product("PROD-005", "Mechanical Keyboard", 59.99, 299.99),
            new Product("PROD-006", "Wireless Mouse", 19.99, 129.99),
            new Product("PROD-007", "Phone Case", 14.99, 49.99),
            new Product("PROD-008", "Portable Charger", 24.99, 79.99),
            new Product("PROD-009", "LED Desk Lamp", 29.99, 89.99),
            new Product("PROD-010", "Webcam HD", 39.99, 199.99),
            new Product("PROD-011", "External Hard Drive", 49.99, 199.99),
            new Product("PROD-012", "Monitor 27 inch", 199.99, 699.99),
            new Product("PROD-013", "Gaming Chair", 149.99, 499.99),
            new Product("PROD-014", "Desk Organizer", 12.99, 39.99),
            new Product("PROD-015", "Bluetooth Speaker", 29.99, 249.99)
    );
}
