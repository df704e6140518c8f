package com.project.items.exceptions;

/** The item store failed: unreachable, constraint violation, timeout. */
public class PersistenceException extends RuntimeException {
    public PersistenceException(String message, Throwable cause) { super(message, cause); }
}
