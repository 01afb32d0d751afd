package com.example.burger.domain.exception;

/**
 * Base class for exceptions raised by the burger domain.
 */
public abstract class DomainException extends RuntimeException {

    protected DomainException(String message) {
        super(message);
    }
}
