package com.example.burger.domain.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Base class for burger variants.
 * Owns identity, composition and stage guarding; variants only describe
 * what each lifecycle step does for them.
 */
public abstract class AbstractBurger implements Burger {

    private static final Logger log = LoggerFactory.getLogger(AbstractBurger.class);

    private final String name;
    private final String bread;
    private final String sauce;
    private final Set<String> toppings;
    private final List<String> steps = new ArrayList<>();
    private BurgerStage stage = BurgerStage.CREATED;

    protected AbstractBurger(String name, String bread, String sauce, List<String> toppings) {
        this.name = requireText(name, "Name");
        this.bread = requireText(bread, "Bread");
        this.sauce = requireText(sauce, "Sauce");
        Objects.requireNonNull(toppings, "Toppings cannot be null");

        Set<String> unique = new LinkedHashSet<>();
        for (String topping : toppings) {
            if (!unique.add(requireText(topping, "Topping"))) {
                throw new IllegalArgumentException("Duplicate topping for " + name + ": " + topping);
            }
        }
        this.toppings = Collections.unmodifiableSet(unique);
    }

    @Override
    public final void prepare() {
        advance(BurgerStage.CREATED, this::describePreparation);
    }

    @Override
    public final void cook() {
        advance(BurgerStage.PREPARED, this::describeCooking);
    }

    @Override
    public final void serve() {
        advance(BurgerStage.COOKED, this::describeServing);
    }

    /**
     * Describes how this variant is prepared.
     */
    protected String describePreparation() {
        return "Preparing " + name + " on a " + bread + " with " + sauce
                + " and " + String.join(", ", toppings);
    }

    /**
     * Describes how this variant is cooked.
     */
    protected abstract String describeCooking();

    /**
     * Describes how this variant is served.
     */
    protected String describeServing() {
        return "Serving " + name + " wrapped in paper";
    }

    private void advance(BurgerStage expectedCurrent, Supplier<String> step) {
        BurgerStage newStage = expectedCurrent.next();
        validateStageTransition(expectedCurrent, newStage);
        String description = step.get();
        steps.add(description);
        this.stage = newStage;
        log.debug("[{}] {}", newStage, description);
    }

    private void validateStageTransition(BurgerStage expectedCurrent, BurgerStage newStage) {
        if (this.stage != expectedCurrent) {
            throw new IllegalStateException(
                    "Cannot transition from " + this.stage + " to " + newStage +
                            ". Expected current stage: " + expectedCurrent);
        }
    }

    private static String requireText(String value, String field) {
        Objects.requireNonNull(value, field + " cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException(field + " cannot be blank");
        }
        return value;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public BurgerStage getStage() {
        return stage;
    }

    @Override
    public String getBread() {
        return bread;
    }

    @Override
    public String getSauce() {
        return sauce;
    }

    @Override
    public Set<String> getToppings() {
        return toppings;
    }

    @Override
    public List<String> getSteps() {
        return Collections.unmodifiableList(steps);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" +
                "stage=" + stage +
                ", bread=" + bread +
                ", sauce=" + sauce +
                ", toppings=" + toppings +
                '}';
    }
}
