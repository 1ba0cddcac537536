package dev.vibeshowcase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProjectResponse {
    private Long id;
    private String title;
    private String description;
    private String longDescription;
    private String projectUrl;
    private String imageUrl;
    private String vibeCodingTool;
    private AuthorInfo author;
    private List<String> tags;
    private Long likesCount;
    private Long commentsCount;
    private Integer viewsCount;
    private Integer sharesCount;
    private Boolean isLiked;
    private Boolean isBookmarked;
    private Boolean featured;
    private Boolean isPrivate;
    private Instant createdAt;
    private Instant updatedAt;
    // detail view only
    private List<GalleryImageResponse> galleryImages;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AuthorInfo {
        private Long id;
        private String username;
        private String avatarUrl;
    }
}
