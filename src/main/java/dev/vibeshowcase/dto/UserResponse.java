package dev.vibeshowcase.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.vibeshowcase.entity.User;
import dev.vibeshowcase.util.DateTimes;
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
public class UserResponse {

    private Long id;
    private String username;
    private String email;
    private String bio;
    private String avatarUrl;
    private String role;
    private Instant createdAt;

    /**
     * Full view, for the user themselves and admins.
     */
    public static UserResponse fromEntity(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .username(user.getUsername())
                .email(user.getEmail())
                .bio(user.getBio())
                .avatarUrl(user.getAvatarUrl())
                .role(user.getRole())
                .createdAt(DateTimes.toInstant(user.getCreatedAt()))
                .build();
    }

    /**
     * What other users may see: no email.
     */
    public static UserResponse publicView(User user) {
        UserResponse response = fromEntity(user);
        response.setEmail(null);
        return response;
    }
}
