package dev.vibeshowcase.repository;

/**
 * Comment list orders accepted by the {@code sort} parameter. Unknown values mean {@link #NEWEST}.
 */
public enum CommentSort {
    NEWEST("newest"),
    OLDEST("oldest"),
    MOST_LIKED("mostLiked");

    private final String param;

    CommentSort(String param) {
        this.param = param;
    }

    public String param() {
        return param;
    }

    public static CommentSort fromParam(String value) {
        if (value == null) {
            return NEWEST;
        }
        for (CommentSort sort : values()) {
            if (sort.param.equalsIgnoreCase(value.trim())) {
                return sort;
            }
        }
        return NEWEST;
    }
}
