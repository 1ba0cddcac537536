package dev.vibeshowcase.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Body of project creation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectRequest {

    @NotBlank(message = "Title is required")
    @Size(max = 255, message = "Title must be at most 255 characters")
    private String title;

    @NotBlank(message = "Description is required")
    @Size(max = 2000, message = "Description must be at most 2000 characters")
    private String description;

    @Size(max = 20000, message = "Long description must be at most 20000 characters")
    private String longDescription;

    @NotBlank(message = "Project URL is required")
    @Size(max = 2048, message = "Project URL must be at most 2048 characters")
    private String projectUrl;

    @Size(max = 2048, message = "Image URL must be at most 2048 characters")
    private String imageUrl;

    @Size(max = 100, message = "Coding tool must be at most 100 characters")
    private String vibeCodingTool;

    @Size(max = 10, message = "At most 10 tags")
    private List<@Size(max = 50, message = "Tags must be at most 50 characters") String> tags;

    private Boolean isPrivate;

    @Valid
    @Size(max = 10, message = "At most 10 gallery images")
    private List<GalleryImageRequest> galleryImages;
}
