package com.radarsync.core.exception;

/**
 * Thrown by catalog adapters when a collection, album or listing does not exist remotely.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String identifier;

    public ResourceNotFoundException(String identifier) {
        super("Catalog resource not found: " + identifier);
        this.identifier = identifier;
    }

    public String getIdentifier() {
        return identifier;
    }
}
