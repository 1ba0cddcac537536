package dev.vibeshowcase.service;

import java.util.HashSet;
import java.util.Set;

/**
 * Which authors a profile listing may show: everyone, or only the given ids.
 */
public record AuthorScope(boolean restricted, Set<Long> authorIds) {

    public static AuthorScope unrestricted() {
        return new AuthorScope(false, Set.of());
    }

    public static AuthorScope only(Set<Long> authorIds) {
        return new AuthorScope(true, Set.copyOf(authorIds));
    }

    public AuthorScope intersect(AuthorScope other) {
        if (!restricted) {
            return other;
        }
        if (!other.restricted) {
            return this;
        }
        Set<Long> common = new HashSet<>(authorIds);
        common.retainAll(other.authorIds);
        return only(common);
    }

    public boolean isEmpty() {
        return restricted && authorIds.isEmpty();
    }
}
