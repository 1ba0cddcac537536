package dev.vibeshowcase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.vibeshowcase.entity.Comment;
import dev.vibeshowcase.entity.CommentReply;
import dev.vibeshowcase.entity.Project;

import java.time.Instant;

/**
 * One entry of a member's activity feed. {@code targetData} is {@code null} when the target
 * was deleted or the activity type has none.
 */
public record ActivityResponse(Long id, String type, Instant createdAt, Target targetData) {

    /**
     * What the activity points at. Projects carry title and image; comments and replies carry
     * their content and the project they belong to.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Target(Long id, String title, String imageUrl, String content, Long commentId,
                         ProjectRef project) {

        public static Target project(Project project) {
            return new Target(project.getId(), project.getTitle(), project.getImageUrl(), null, null, null);
        }

        public static Target comment(Comment comment, Project project) {
            return new Target(comment.getId(), null, null, comment.getContent(), null, ProjectRef.of(project));
        }

        public static Target reply(CommentReply reply, Project project) {
            return new Target(reply.getId(), null, null, reply.getContent(), reply.getCommentId(), ProjectRef.of(project));
        }
    }

    public record ProjectRef(Long id, String title) {

        static ProjectRef of(Project project) {
            return new ProjectRef(project.getId(), project.getTitle());
        }
    }
}
