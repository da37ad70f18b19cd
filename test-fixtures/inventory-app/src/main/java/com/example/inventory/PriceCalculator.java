package com.example.inventory;

import java.util.List;

public class PriceCalculator {

    public long total(List<String> skus, StockRepository repository) {
        long sum = 0;
        for (String sku : skus) {
            sum += applyDiscount(repository.findPrice(sku));
        }
        return sum;
    }

    private long applyDiscount(long price) {
        return Math.max(0, price - 5);
    }
}
