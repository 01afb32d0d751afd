package com.example.burger.domain.model;

import java.util.List;

/**
 * Plant-based burger with a griddled patty.
 */
public class VeganBurger extends AbstractBurger {

    public VeganBurger() {
        super("VeganBurger", "whole-wheat bun", "vegan mayo", List.of("lettuce", "tomato", "pickles"));
    }

    @Override
    protected String describeCooking() {
        return "Griddling a plant-based patty";
    }
}
