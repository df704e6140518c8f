package com.project.items.exceptions;

/** No pooled connection became free within the configured wait. */
public class PoolExhaustedException extends PersistenceException {
    public PoolExhaustedException(String message, Throwable cause) { super(message, cause); }
}
