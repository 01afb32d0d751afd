package com.example.burger.domain.model;

/**
 * Enum representing the lifecycle stages of a Burger.
 * Stages only move forward, one step at a time.
 */
public enum BurgerStage {

    /**
     * Freshly built by a store, nothing done yet.
     */
    CREATED,

    /**
     * Bun and toppings have been laid out.
     */
    PREPARED,

    /**
     * Patty has been cooked and the burger assembled.
     */
    COOKED,

    /**
     * Handed over to the customer.
     */
    SERVED;

    /**
     * Returns the stage that directly follows this one.
     *
     * @throws IllegalStateException if this is the final stage
     */
    public BurgerStage next() {
        if (this == SERVED) {
            throw new IllegalStateException("SERVED is the final stage");
        }
        return values()[ordinal() + 1];
    }
}
