package com.project.items.DTOs;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.project.items.model.Item;

import java.time.OffsetDateTime;

/** Public representation of an item; {@code updated_at} is not exposed. */
public record ItemResponse(
        long id,
        String name,
        String description,
        @JsonProperty("created_at") OffsetDateTime createdAt
) {
    public static ItemResponse from(Item item) {
        return new ItemResponse(item.id(), item.name(), item.description(), item.createdAt());
    }
}
