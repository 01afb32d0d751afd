package com.example.burger.domain.store;

import com.example.burger.domain.exception.UnrecognizedBurgerTypeException;
import com.example.burger.domain.model.Burger;
import com.example.burger.domain.model.BurgerType;
import com.example.burger.domain.model.DeluxeVeganBurger;
import com.example.burger.domain.model.VeganBurger;
import com.example.burger.domain.model.VeganBurgerType;

import java.util.Set;

/**
 * Store making plant-based burgers.
 */
public class VeganBurgerStore extends BurgerStore {

    public static final String NAME = "vegan";

    public VeganBurgerStore() {
        super(NAME);
    }

    @Override
    public Burger createBurger(BurgerType type) {
        if (!(type instanceof VeganBurgerType veganType)) {
            throw new UnrecognizedBurgerTypeException(getName(), type);
        }
        return switch (veganType) {
            case VEGAN -> new VeganBurger();
            case DELUXE_VEGAN -> new DeluxeVeganBurger();
        };
    }

    @Override
    public Set<BurgerType> supportedTypes() {
        return Set.<BurgerType>of(VeganBurgerType.values());
    }
}
