package dev.vibeshowcase.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record RoleUpdateRequest(
        @NotBlank(message = "Role is required")
        @Pattern(regexp = "admin|user", message = "Role must be 'admin' or 'user'")
        String role
) {}
