package com.furniture.workshop.exception;

public class ResourceNotFoundException extends WorkshopException {

    public ResourceNotFoundException(String resource, String id) {
        super("error.not-found", resource, id);
    }
}
