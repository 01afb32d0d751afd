package com.example.burger.domain.store;

import com.example.burger.domain.exception.UnrecognizedBurgerTypeException;
import com.example.burger.domain.model.Burger;
import com.example.burger.domain.model.BurgerStage;
import com.example.burger.domain.model.BurgerType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Set;

/**
 * Creator of burgers.
 * Subclasses decide which burger to build for a type; the ordering sequence
 * (create, prepare, cook, serve) is fixed here and shared by every store.
 */
public abstract class BurgerStore {

    private static final Logger log = LoggerFactory.getLogger(BurgerStore.class);

    private final String name;

    protected BurgerStore(String name) {
        this.name = Objects.requireNonNull(name, "Store name cannot be null");
    }

    /**
     * Builds a new, unprepared burger for the given type.
     *
     * @param type the burger type
     * @return a new burger in CREATED stage
     * @throws UnrecognizedBurgerTypeException if this store does not make the type
     */
    public abstract Burger createBurger(BurgerType type);

    /**
     * Returns the burger types this store makes.
     */
    public abstract Set<BurgerType> supportedTypes();

    /**
     * Orders a burger: builds it, then prepares, cooks and serves it.
     *
     * @param type the burger type
     * @return the served burger
     * @throws UnrecognizedBurgerTypeException if this store does not make the type
     * @throws IllegalStateException if the store built no burger or an already-started one
     */
    public final Burger order(BurgerType type) {
        Burger burger = createBurger(type);
        if (burger == null) {
            throw new IllegalStateException("Store '" + name + "' built no burger for " + type);
        }
        if (burger.getStage() != BurgerStage.CREATED) {
            throw new IllegalStateException("Store '" + name + "' built a burger in stage "
                    + burger.getStage() + ". Expected stage: " + BurgerStage.CREATED);
        }

        log.info("---Making a {}", burger.getName());
        burger.prepare();
        burger.cook();
        burger.serve();
        log.debug("Store '{}' served {}", name, burger);
        return burger;
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{name=" + name + ", supportedTypes=" + supportedTypes() + '}';
    }
}
