package org.janelia.darkroom.image;

/**
 * Raised when the pixel buffer of a {@link Negative} cannot be locked or released.
 */
public class NegativeAccessException extends RuntimeException {

    public NegativeAccessException(String message) {
        super(message);
    }

    public NegativeAccessException(String message, Throwable cause) {
        super(message, cause);
    }
}
