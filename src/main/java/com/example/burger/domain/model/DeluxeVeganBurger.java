package com.example.burger.domain.model;

import java.util.List;

/**
 * Double plant-based patty with vegan cheese and avocado, served plated.
 */
public class DeluxeVeganBurger extends AbstractBurger {

    public DeluxeVeganBurger() {
        super("DeluxeVeganBurger", "pretzel bun", "chipotle vegan mayo",
                List.of("vegan cheese", "avocado", "lettuce", "tomato", "grilled onion"));
    }

    @Override
    protected String describeCooking() {
        return "Smoking two plant-based patties and melting vegan cheese";
    }

    @Override
    protected String describeServing() {
        return "Serving DeluxeVeganBurger on a board with sweet potato fries";
    }
}
