package dev.vibeshowcase.repository;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * SQL predicate over {@code projects p} with its named bindings. Every filter starts from
 * the visibility rule, so a listing can never include another user's private project.
 * The same filter feeds both the page query and its count.
 */
public final class ProjectFilter {

    private final List<String> conditions;
    private final Map<String, Object> bindings;

    private ProjectFilter(List<String> conditions, Map<String, Object> bindings) {
        this.conditions = Collections.unmodifiableList(conditions);
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static Builder visibleTo(long viewerId) {
        return new Builder(viewerId);
    }

    public String whereClause() {
        return String.join(" AND ", conditions);
    }

    public Map<String, Object> bindings() {
        return bindings;
    }

    public List<String> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "ProjectFilter[" + whereClause() + ", " + bindings + "]";
    }

    public static final class Builder {

        private final List<String> conditions = new ArrayList<>();
        private final Map<String, Object> bindings = new LinkedHashMap<>();

        private Builder(long viewerId) {
            conditions.add("(p.is_private = FALSE OR p.author_id = :viewerId)");
            bindings.put("viewerId", viewerId);
        }

        public Builder tag(long tagId) {
            conditions.add("p.id IN (SELECT pt.project_id FROM project_tags pt WHERE pt.tag_id = :tagId)");
            bindings.put("tagId", tagId);
            return this;
        }

        public Builder author(long authorId) {
            conditions.add("p.author_id = :authorId");
            bindings.put("authorId", authorId);
            return this;
        }

        public Builder search(String term) {
            conditions.add("(p.title ILIKE :search OR p.description ILIKE :search)");
            bindings.put("search", "%" + escapeLike(term) + "%");
            return this;
        }

        public Builder featuredOnly() {
            conditions.add("p.featured = TRUE");
            return this;
        }

        public ProjectFilter build() {
            return new ProjectFilter(new ArrayList<>(conditions), new LinkedHashMap<>(bindings));
        }

        // LIKE wildcards in user input match literally
        static String escapeLike(String term) {
            return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        }
    }
}
