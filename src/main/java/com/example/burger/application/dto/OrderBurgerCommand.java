package com.example.burger.application.dto;

import java.util.Objects;

/**
 * Command for ordering a burger.
 */
public record OrderBurgerCommand(
        String customer,
        String storeName,
        String burgerType
) {
    public OrderBurgerCommand {
        Objects.requireNonNull(customer, "Customer cannot be null");
        Objects.requireNonNull(storeName, "StoreName cannot be null");
        Objects.requireNonNull(burgerType, "BurgerType cannot be null");
        if (customer.isBlank()) {
            throw new IllegalArgumentException("Customer cannot be blank");
        }
        if (storeName.isBlank()) {
            throw new IllegalArgumentException("StoreName cannot be blank");
        }
        if (burgerType.isBlank()) {
            throw new IllegalArgumentException("BurgerType cannot be blank");
        }
    }
}
