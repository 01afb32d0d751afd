package com.example.burger.domain.model;

/**
 * Burger types served by the vegan burger store.
 */
public enum VeganBurgerType implements BurgerType {

    VEGAN,

    DELUXE_VEGAN;

    @Override
    public String code() {
        return name();
    }
}
