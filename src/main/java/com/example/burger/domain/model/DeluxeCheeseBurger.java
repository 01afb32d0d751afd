package com.example.burger.domain.model;

import java.util.List;

/**
 * Double-patty cheeseburger with bacon, served plated.
 */
public class DeluxeCheeseBurger extends AbstractBurger {

    public DeluxeCheeseBurger() {
        super("DeluxeCheeseBurger", "brioche bun", "burger sauce",
                List.of("double cheddar", "bacon", "lettuce", "tomato", "caramelised onion"));
    }

    @Override
    protected String describeCooking() {
        return "Flame-grilling two beef patties and crisping the bacon";
    }

    @Override
    protected String describeServing() {
        return "Serving DeluxeCheeseBurger on a board with fries";
    }
}
