package com.example.burger.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Lookup of burger types by code across every store's type enum.
 */
public final class BurgerTypes {

    private static final List<BurgerType> ALL = collectAll();

    private BurgerTypes() {
    }

    /**
     * Resolves a burger type from its code.
     *
     * @param code type code, case-insensitive (e.g. CHEESE, deluxe_vegan)
     * @return matching burger type
     * @throws IllegalArgumentException if the code is blank or matches no known type
     */
    public static BurgerType of(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("Burger type code cannot be blank");
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        return ALL.stream()
                .filter(type -> type.code().equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown burger type code: " + code));
    }

    public static List<BurgerType> all() {
        return ALL;
    }

    private static List<BurgerType> collectAll() {
        List<BurgerType> types = new ArrayList<>();
        Collections.addAll(types, CheeseBurgerType.values());
        Collections.addAll(types, VeganBurgerType.values());
        return List.copyOf(types);
    }
}
