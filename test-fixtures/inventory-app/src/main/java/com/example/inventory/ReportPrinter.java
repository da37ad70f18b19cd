package com.example.inventory;

public class ReportPrinter {

    public void total(long value) {
        System.out.println("Inventory value: " + format(value));
    }

    private String format(long value) {
        return String.format("%,d", value);
    }
}
