package com.example;

public class Calculator {

    // Method with single parameter - should be modified
    public int square(int number) {
        return number * number;
    }

    // Method with single parameter - should be modified
    public String formatText(String value) {
        return value.toUpperCase();
    }

    // Method with no parameters - should remain unchanged
    public void reset() {
        System.out.println("Calculator reset");
    }

    // Method with multiple parameters - should remain unchanged
    public int add(int a, int b) {
        return a + b;
    }

    // Method with single parameter using common naming pattern - should get semantic suggestion
    public boolean validateInput(String input) {
        return input != null && !input.isEmpty();
    }

    // Method with single parameter ending in number - should increment number
    public void processItem1(Object item1) {
        System.out.println("Processing: " + item1);
    }

    // Method with single parameter using "is" prefix - should get semantic suggestion
    public void checkStatus(boolean isActive) {
        if (isActive)
            System.out.println("Status is active");
    }
}
