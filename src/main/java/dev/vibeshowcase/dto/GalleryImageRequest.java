package dev.vibeshowcase.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record GalleryImageRequest(
        @NotBlank(message = "Image URL is required")
        @Size(max = 2048, message = "Image URL must be at most 2048 characters")
        String imageUrl,

        @Size(max = 500, message = "Caption must be at most 500 characters")
        String caption
) {}
