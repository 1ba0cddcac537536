package dev.vibeshowcase.exception;

/**
 * A referenced entity does not exist or is hidden from the viewer. The message is a
 * {@code messages.properties} key.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String messageKey) {
        super(messageKey);
    }

    public static ResourceNotFoundException project() {
        return new ResourceNotFoundException("error.project_not_found");
    }

    public static ResourceNotFoundException comment() {
        return new ResourceNotFoundException("error.comment_not_found");
    }

    public static ResourceNotFoundException reply() {
        return new ResourceNotFoundException("error.reply_not_found");
    }

    public static ResourceNotFoundException user() {
        return new ResourceNotFoundException("error.user_not_found");
    }
}
