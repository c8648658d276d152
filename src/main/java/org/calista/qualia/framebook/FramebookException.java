package org.calista.qualia.framebook;

/**
 * Fatal configuration error: the framebook could not be found, read or parsed.
 */
public final class FramebookException extends RuntimeException {
    public FramebookException(String message, Throwable cause) {
        super(message, cause);
    }

    public FramebookException(String message) {
        super(message);
    }
}
