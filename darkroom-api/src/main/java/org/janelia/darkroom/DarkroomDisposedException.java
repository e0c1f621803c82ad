package org.janelia.darkroom;

/**
 * Raised by every operation invoked on a closed {@link Darkroom}.
 */
public class DarkroomDisposedException extends IllegalStateException {

    public DarkroomDisposedException(String message) {
        super(message);
    }
}
