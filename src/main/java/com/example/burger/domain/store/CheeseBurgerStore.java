package com.example.burger.domain.store;

import com.example.burger.domain.exception.UnrecognizedBurgerTypeException;
import com.example.burger.domain.model.Burger;
import com.example.burger.domain.model.BurgerType;
import com.example.burger.domain.model.CheeseBurger;
import com.example.burger.domain.model.CheeseBurgerType;
import com.example.burger.domain.model.DeluxeCheeseBurger;

import java.util.Set;

/**
 * Store making beef cheeseburgers.
 */
public class CheeseBurgerStore extends BurgerStore {

    public static final String NAME = "cheese";

    public CheeseBurgerStore() {
        super(NAME);
    }

    @Override
    public Burger createBurger(BurgerType type) {
        if (!(type instanceof CheeseBurgerType cheeseType)) {
            throw new UnrecognizedBurgerTypeException(getName(), type);
        }
        return switch (cheeseType) {
            case CHEESE -> new CheeseBurger();
            case DELUXE_CHEESE -> new DeluxeCheeseBurger();
        };
    }

    @Override
    public Set<BurgerType> supportedTypes() {
        return Set.<BurgerType>of(CheeseBurgerType.values());
    }
}
