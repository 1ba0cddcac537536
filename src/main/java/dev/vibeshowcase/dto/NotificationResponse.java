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
public class NotificationResponse {
    private Long id;
    private String type;
    private Boolean read;
    private ProjectResponse.AuthorInfo actor;
    private Long projectId;
    private String projectTitle;
    private Long commentId;
    private Long replyId;
    private Instant createdAt;
}
