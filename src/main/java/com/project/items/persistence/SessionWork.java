package com.project.items.persistence;

@FunctionalInterface
public interface SessionWork<T> {
    T apply(Session session);
}
