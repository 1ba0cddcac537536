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

@Table("projects")
@ToString
@Getter
@Setter
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Project implements Persistable<Long>, NewRecordAware {

    public static final String DEFAULT_IMAGE_URL = "/images/default-project.jpg";

    @Id
    private Long id;

    private String title;

    private String description;

    @Column("long_description")
    private String longDescription;

    @Column("project_url")
    private String projectUrl;

    @Column("image_url")
    private String imageUrl;

    @Column("vibe_coding_tool")
    private String vibeCodingTool;

    @Column("author_id")
    private Long authorId;

    @Column("views_count")
    @Builder.Default
    private Integer viewsCount = 0;

    @Column("shares_count")
    @Builder.Default
    private Integer sharesCount = 0;

    @Builder.Default
    private Boolean featured = false;

    @Column("is_private")
    @Builder.Default
    private Boolean isPrivate = false;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    /**
     * A project is visible to everyone unless private, in which case only its author sees it.
     */
    public boolean isVisibleTo(long viewerId) {
        return !Boolean.TRUE.equals(isPrivate) || (authorId != null && authorId == viewerId);
    }

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
