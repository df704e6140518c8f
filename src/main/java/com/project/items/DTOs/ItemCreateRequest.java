package com.project.items.DTOs;

import com.project.items.validation.MaxCodePoints;
import jakarta.validation.constraints.NotBlank;

public record ItemCreateRequest(
        @NotBlank(message = "name must not be blank")
        @MaxCodePoints(value = 255, message = "name must be at most 255 characters")
        String name,
        @MaxCodePoints(value = 1000, message = "description must be at most 1000 characters")
        String description
) {}
