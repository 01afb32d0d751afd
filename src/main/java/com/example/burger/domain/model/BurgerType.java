package com.example.burger.domain.model;

/**
 * Discriminator selecting which burger a store builds.
 * Each store defines its own closed enum of supported types.
 */
public interface BurgerType {

    /**
     * Stable code of this type, as used in configuration.
     */
    String code();
}
