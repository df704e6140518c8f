package com.project.items.exceptions;

/**
 * A request failed on the store side. The message is the generic text shown to the caller;
 * the underlying {@link PersistenceException} stays in the cause and only reaches the logs.
 */
public class ItemOperationException extends RuntimeException {
    public ItemOperationException(String message, PersistenceException cause) { super(message, cause); }
}
