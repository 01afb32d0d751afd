package com.example.burger.domain.model;

import java.util.List;

/**
 * Classic cheeseburger with a single grilled beef patty.
 */
public class CheeseBurger extends AbstractBurger {

    public CheeseBurger() {
        super("CheeseBurger", "sesame bun", "ketchup", List.of("cheddar", "pickles", "onion"));
    }

    @Override
    protected String describeCooking() {
        return "Grilling a beef patty and melting cheddar on top";
    }
}
