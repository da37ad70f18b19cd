package com.example.inventory;

import java.util.List;

public class InventoryService {

    private final StockRepository repository;
    private final PriceCalculator calculator;
    private final ReportPrinter printer;

    public InventoryService(StockRepository repository) {
        this.repository = repository;
        this.calculator = new PriceCalculator();
        this.printer = new ReportPrinter();
    }

    public boolean isAvailable(String sku, int quantity) {
        return repository.findQuantity(sku) >= quantity;
    }

    public void restock(String sku, int quantity) {
        int current = repository.findQuantity(sku);
        repository.updateQuantity(sku, current + quantity);
    }

    public void report(List<String> skus) {
        long value = calculator.total(skus, repository);
        printer.total(value);
    }
}
