package com.example.inventory;

import java.util.HashMap;
import java.util.Map;

public class StockRepository {

    private static final String FIND_QUANTITY = "SELECT quantity FROM stock WHERE sku = ?";

    private final Map<String, Integer> rows = new HashMap<>();

    public int findQuantity(String sku) {
        log(FIND_QUANTITY);
        return rows.getOrDefault(sku, 0);
    }

    public void updateQuantity(String sku, int quantity) {
        log("UPDATE stock SET quantity = ? WHERE sku = ?");
        rows.put(sku, quantity);
    }

    public long findPrice(String sku) {
        log("""
            SELECT price
              FROM catalog
             WHERE sku = ?
            """);
        return 100L;
    }

    private void log(String statement) {
        System.out.println("sql: " + statement);
    }
}
