package com.project.items.DTOs;

public record ErrorResponse(String detail) {}
