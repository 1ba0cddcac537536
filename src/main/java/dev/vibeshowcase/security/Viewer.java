package dev.vibeshowcase.security;

/**
 * The identity behind a request. Anonymous callers are {@link #ANONYMOUS}, whose id 0 never
 * matches a stored user id.
 */
public record Viewer(long id, String username, boolean admin) {

    public static final long ANONYMOUS_ID = 0L;

    public static final Viewer ANONYMOUS = new Viewer(ANONYMOUS_ID, null, false);

    public static Viewer user(long id, String username) {
        return new Viewer(id, username, false);
    }

    public static Viewer admin(long id, String username) {
        return new Viewer(id, username, true);
    }

    public boolean isAnonymous() {
        return id == ANONYMOUS_ID;
    }

    /**
     * Authors and admins may change a resource.
     */
    public boolean canModify(Long ownerId) {
        return admin || (!isAnonymous() && ownerId != null && ownerId == id);
    }
}
