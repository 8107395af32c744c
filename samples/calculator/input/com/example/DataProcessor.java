package com.example;

import java.util.Objects;

public class DataProcessor {

    /**
     * Static method with single parameter - should be modified.
     */
    public static void processData(byte[] data) {
        System.out.println("Processing " + data.length + " bytes");
    }

    // Generic method with single parameter - should be modified
    public <T> T transform(T item) {
        return Objects.requireNonNull(item);
    }

    // Method with single parameter having a modifier - should be modified
    public int updateReference(final int count) {
        return count + 1;
    }

    // Constructor - left alone unless constructors are included
    public DataProcessor(String name) {
    }
}
