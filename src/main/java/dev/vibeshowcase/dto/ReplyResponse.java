package dev.vibeshowcase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ReplyResponse {
    private Long id;
    private Long commentId;
    private String content;
    private ProjectResponse.AuthorInfo author;
    private Long likesCount;
    private Boolean isLiked;
    private Boolean isAuthor;
    private Instant createdAt;
    private Instant updatedAt;
}
