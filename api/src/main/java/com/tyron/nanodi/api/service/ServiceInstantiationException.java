package com.tyron.nanodi.api.service;

/**
 * Thrown when a constructor-shaped service cannot be instantiated, or its constructor throws a checked exception.
 */
public class ServiceInstantiationException extends RuntimeException {

    public ServiceInstantiationException(String message, Throwable cause) {
        super(message, cause);
    }
}
