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
public class CommentResponse {
    private Long id;
    private Long projectId;
    private String content;
    private ProjectResponse.AuthorInfo author;
    private Long likesCount;
    private Boolean isLiked;
    // comment written by the project's author
    private Boolean isAuthor;
    private List<ReplyResponse> replies;
    private Instant createdAt;
    private Instant updatedAt;
}
