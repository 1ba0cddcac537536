package dev.vibeshowcase.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Table("notifications")
@ToString
@Getter
@Setter
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Notification implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    // recipient
    @Column("user_id")
    private Long userId;

    private String type;

    @Builder.Default
    private Boolean read = false;

    @Column("actor_id")
    private Long actorId;

    @Column("project_id")
    private Long projectId;

    @Column("comment_id")
    private Long commentId;

    @Column("reply_id")
    private Long replyId;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
