package dev.vibeshowcase.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Partial project update: {@code null} leaves a field unchanged. Supplied tags replace the
 * current set, supplied gallery images replace the current gallery.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProjectUpdateRequest {

    // at least one non-whitespace character, across lines
    static final String NOT_BLANK = "(?s).*\\S.*";

    @Size(min = 1, max = 255, message = "Title must be 1-255 characters")
    @Pattern(regexp = NOT_BLANK, message = "Title must not be blank")
    private String title;

    @Size(min = 1, max = 2000, message = "Description must be 1-2000 characters")
    @Pattern(regexp = NOT_BLANK, message = "Description must not be blank")
    private String description;

    @Size(max = 20000, message = "Long description must be at most 20000 characters")
    private String longDescription;

    @Size(min = 1, max = 2048, message = "Project URL must be 1-2048 characters")
    @Pattern(regexp = NOT_BLANK, message = "Project URL must not be blank")
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
