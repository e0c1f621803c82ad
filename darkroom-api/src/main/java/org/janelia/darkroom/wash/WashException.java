package org.janelia.darkroom.wash;

/**
 * A wash that did not complete. The washed negative is left as it was before the wash.
 */
public class WashException extends RuntimeException {

    public WashException(String message, Throwable cause) {
        super(message, cause);
    }
}
