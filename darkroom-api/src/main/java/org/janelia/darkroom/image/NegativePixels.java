package org.janelia.darkroom.image;

import com.google.common.base.Preconditions;

/**
 * Exclusive handle to the raw pixel buffer of a {@link Negative}. The buffer stays locked
 * until the handle is closed, so it is meant to be used in a try-with-resources block.
 */
public class NegativePixels implements AutoCloseable {

    private final Negative negative;
    private final byte[] buffer;
    private boolean released;

    NegativePixels(Negative negative, byte[] buffer) {
        this.negative = negative;
        this.buffer = buffer;
    }

    /**
     * @return the live buffer - rows are contiguous and each row is {@link #getStride()} bytes long.
     */
    public byte[] getBuffer() {
        checkNotReleased();
        return buffer;
    }

    public int getWidth() {
        return negative.getWidth();
    }

    public int getHeight() {
        return negative.getHeight();
    }

    public int getStride() {
        return negative.getStride();
    }

    public ChannelOrder getChannelOrder() {
        return negative.getChannelOrder();
    }

    public int pixelOffset(int x, int y) {
        return y * getStride() + x * ChannelOrder.BYTES_PER_PIXEL;
    }

    /**
     * Replace the whole buffer content with the given bytes.
     */
    public void commit(byte[] content) {
        checkNotReleased();
        Preconditions.checkArgument(content.length == buffer.length,
                "Cannot commit %s bytes into a %s bytes buffer", content.length, buffer.length);
        System.arraycopy(content, 0, buffer, 0, buffer.length);
    }

    private void checkNotReleased() {
        if (released) {
            throw new NegativeAccessException("Pixel buffer was already released");
        }
    }

    @Override
    public void close() {
        if (!released) {
            released = true;
            negative.unlockPixels();
        }
    }
}
