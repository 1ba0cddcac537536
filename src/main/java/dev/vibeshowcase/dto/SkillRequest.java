package dev.vibeshowcase.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record SkillRequest(
        @NotBlank(message = "Category is required")
        @Size(max = 50, message = "Category must be at most 50 characters")
        String category,

        @NotBlank(message = "Skill is required")
        @Size(max = 100, message = "Skill must be at most 100 characters")
        String skill
) {}
