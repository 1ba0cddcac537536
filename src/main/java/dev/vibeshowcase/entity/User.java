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

@Table("users")
@ToString(exclude = {"password"})
@Getter
@Setter
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User implements Persistable<Long>, NewRecordAware {

    @Id
    private Long id;

    private String username;

    // BCrypt hash
    private String password;

    private String email;

    private String bio;

    @Column("avatar_url")
    private String avatarUrl;

    @Builder.Default
    private String role = UserRole.USER.value();

    @Column("created_at")
    private LocalDateTime createdAt;

    public boolean isAdmin() {
        return UserRole.ADMIN.matches(role);
    }

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }
}
