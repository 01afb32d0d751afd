package com.example.burger.domain.model;

/**
 * Burger types served by the cheese burger store.
 */
public enum CheeseBurgerType implements BurgerType {

    CHEESE,

    DELUXE_CHEESE;

    @Override
    public String code() {
        return name();
    }
}
