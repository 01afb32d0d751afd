package com.example.burger.domain.exception;

import com.example.burger.domain.model.BurgerType;

/**
 * Exception thrown when a store is asked for a burger type it does not make.
 */
public class UnrecognizedBurgerTypeException extends DomainException {

    private final String storeName;
    private final BurgerType burgerType;

    public UnrecognizedBurgerTypeException(String storeName, BurgerType burgerType) {
        super(String.format("Store '%s' does not make burger type %s",
                storeName, burgerType == null ? "null" : burgerType.code()));
        this.storeName = storeName;
        this.burgerType = burgerType;
    }

    public String getStoreName() {
        return storeName;
    }

    public BurgerType getBurgerType() {
        return burgerType;
    }
}
