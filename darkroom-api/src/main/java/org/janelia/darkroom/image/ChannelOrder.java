package org.janelia.darkroom.image;

/**
 * Physical order of the four channel bytes of a pixel inside a {@link Negative} buffer.
 */
public enum ChannelOrder {
    /**
     * Byte layout of a little endian 32 bit ARGB bitmap.
     */
    BGRA(2, 1, 0, 3),
    RGBA(0, 1, 2, 3),
    ARGB(1, 2, 3, 0);

    public static final int BYTES_PER_PIXEL = 4;

    private final int redOffset;
    private final int greenOffset;
    private final int blueOffset;
    private final int alphaOffset;

    ChannelOrder(int redOffset, int greenOffset, int blueOffset, int alphaOffset) {
        this.redOffset = redOffset;
        this.greenOffset = greenOffset;
        this.blueOffset = blueOffset;
        this.alphaOffset = alphaOffset;
    }

    public PixelColor decode(byte[] buffer, int pixelOffset) {
        return PixelColor.of(
                buffer[pixelOffset + redOffset] & 0xff,
                buffer[pixelOffset + greenOffset] & 0xff,
                buffer[pixelOffset + blueOffset] & 0xff,
                buffer[pixelOffset + alphaOffset] & 0xff
        );
    }

    public void encode(PixelColor pixel, byte[] buffer, int pixelOffset) {
        buffer[pixelOffset + redOffset] = (byte) pixel.getRed();
        buffer[pixelOffset + greenOffset] = (byte) pixel.getGreen();
        buffer[pixelOffset + blueOffset] = (byte) pixel.getBlue();
        buffer[pixelOffset + alphaOffset] = (byte) pixel.getAlpha();
    }
}
