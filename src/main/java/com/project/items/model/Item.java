package com.project.items.model;

import java.time.OffsetDateTime;

/**
 * Transient copy of one row of the {@code items} table.
 * The store owns the durable state; instances live for a single request.
 */
public record Item(
        long id,
        String name,
        String description,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {}
