package com.example.burger.application.dto;

import com.example.burger.domain.model.Burger;

import java.util.List;

/**
 * Result of a burger order.
 */
public record BurgerOrderResult(
        String customer,
        String storeName,
        String burgerName,
        String stage,
        List<String> toppings,
        List<String> steps
) {
    /**
     * Creates a result from a served burger.
     */
    public static BurgerOrderResult of(String customer, String storeName, Burger burger) {
        return new BurgerOrderResult(
                customer,
                storeName,
                burger.getName(),
                burger.getStage().name(),
                List.copyOf(burger.getToppings()),
                List.copyOf(burger.getSteps()));
    }
}
