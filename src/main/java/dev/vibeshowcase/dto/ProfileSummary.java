package dev.vibeshowcase.dto;

import dev.vibeshowcase.entity.User;

/**
 * Directory entry.
 */
public record ProfileSummary(Long id, String username, String avatarUrl, String bio, String role) {

    public static ProfileSummary fromEntity(User user) {
        return new ProfileSummary(user.getId(), user.getUsername(), user.getAvatarUrl(), user.getBio(), user.getRole());
    }
}
