package com.ardua.ledger.exception;

public class ResourceNotFoundException extends IllegalArgumentException {

    public ResourceNotFoundException(String resource, Object id) {
        super(resource + " not found: " + id);
    }
}
