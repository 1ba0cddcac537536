package dev.vibeshowcase.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ShareRequest(
        @NotBlank(message = "Platform is required")
        @Size(max = 50, message = "Platform must be at most 50 characters")
        String platform
) {}
