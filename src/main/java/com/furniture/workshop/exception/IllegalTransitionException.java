package com.furniture.workshop.exception;

public class IllegalTransitionException extends WorkshopException {

    public IllegalTransitionException(String entity, Object current, Object requested) {
        super("error.illegal-transition", entity, current, requested);
    }
}
