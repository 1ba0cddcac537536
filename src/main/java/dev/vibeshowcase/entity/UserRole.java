package dev.vibeshowcase.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Account roles as stored in {@code users.role}.
 */
public enum UserRole {
    USER("user"),
    ADMIN("admin");

    private final String value;

    UserRole(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public String authority() {
        return "ROLE_" + name();
    }

    public boolean matches(String role) {
        return value.equalsIgnoreCase(role);
    }

    public static Optional<UserRole> fromValue(String role) {
        return Arrays.stream(values()).filter(r -> r.matches(role)).findFirst();
    }
}
