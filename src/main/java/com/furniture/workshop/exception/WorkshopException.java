package com.furniture.workshop.exception;

/**
 * Expected business failure. Carries a message key resolved against the
 * application's message bundle, never a raw user-facing string.
 */
public class WorkshopException extends RuntimeException {

    private final String messageKey;
    private final transient Object[] args;

    public WorkshopException(String messageKey, Object... args) {
        super(messageKey);
        this.messageKey = messageKey;
        this.args = args;
    }

    public String getMessageKey() {
        return messageKey;
    }

    public Object[] getArgs() {
        return args;
    }
}
