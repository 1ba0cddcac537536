package dev.vibeshowcase.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Display casing for tag names. Known tags map to a fixed spelling regardless of how
 * they were typed ("ai tools" is shown as "AI Tools"); unknown tags pass through unchanged.
 */
public final class TagNames {

    private static final List<String> KNOWN_TAGS = List.of(
            "AI Tools", "Analytics", "Art", "Business", "Chatbots", "Code", "Creative",
            "Data Visualization", "Development", "Education", "GPT Models", "Image Generation",
            "Machine Learning", "Natural Language Processing", "Productivity", "Tools",
            "Collaboration", "Content Creation", "Developer Tools", "Finance", "Gaming", "Health",
            "Lifestyle", "Social", "Utilities", "Web Development", "Mobile", "Design", "Communication");

    private static final Map<String, String> CANONICAL = new LinkedHashMap<>();

    static {
        for (String tag : KNOWN_TAGS) {
            CANONICAL.put(key(tag), tag);
        }
    }

    private TagNames() {
    }

    public static String canonical(String name) {
        if (name == null) {
            return null;
        }
        return CANONICAL.getOrDefault(key(name), name);
    }

    /**
     * Cleans user-supplied tags: trims, drops blanks, applies canonical casing and removes
     * case-insensitive duplicates, keeping the first occurrence in input order.
     */
    public static List<String> normalize(Collection<String> rawTags) {
        if (rawTags == null || rawTags.isEmpty()) {
            return List.of();
        }
        Map<String, String> unique = new LinkedHashMap<>();
        for (String raw : rawTags) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            String name = canonical(raw.trim());
            unique.putIfAbsent(key(name), name);
        }
        return new ArrayList<>(unique.values());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
