package com.example.burger.domain.model;

import java.util.List;
import java.util.Set;

/**
 * Product built by a burger store.
 * <p>
 * Lifecycle steps must be called in the order {@link #prepare()}, {@link #cook()},
 * {@link #serve()}, each exactly once.
 */
public interface Burger {

    /**
     * Lays out the bun, sauce and toppings.
     *
     * @throws IllegalStateException if the burger is not in CREATED stage
     */
    void prepare();

    /**
     * Cooks the patty and assembles the burger.
     *
     * @throws IllegalStateException if the burger is not in PREPARED stage
     */
    void cook();

    /**
     * Hands the burger over.
     *
     * @throws IllegalStateException if the burger is not in COOKED stage
     */
    void serve();

    String getName();

    BurgerStage getStage();

    String getBread();

    String getSauce();

    Set<String> getToppings();

    /**
     * Returns the descriptions of the lifecycle steps performed so far, oldest first.
     */
    List<String> getSteps();
}
