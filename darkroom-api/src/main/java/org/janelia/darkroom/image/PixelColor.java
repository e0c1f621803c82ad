package org.janelia.darkroom.image;

import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;
import org.apache.commons.lang3.builder.ToStringBuilder;

/**
 * Immutable RGBA value of a single pixel. All channels are in the 0..255 range.
 */
public final class PixelColor {

    private final int r;
    private final int g;
    private final int b;
    private final int a;

    public static PixelColor of(int r, int g, int b) {
        return new PixelColor(r, g, b, 255);
    }

    public static PixelColor of(int r, int g, int b, int a) {
        return new PixelColor(r, g, b, a);
    }

    /**
     * Create a pixel from channel values that may be out of range or fractional.
     * The values are rounded half up and clamped to 0..255.
     */
    public static PixelColor clamped(double r, double g, double b, int a) {
        return new PixelColor(PixelOps.clampToByte(r), PixelOps.clampToByte(g), PixelOps.clampToByte(b), a);
    }

    public static PixelColor fromARGB(int argb) {
        return new PixelColor((argb >>> 16) & 0xff, (argb >>> 8) & 0xff, argb & 0xff, argb >>> 24);
    }

    private PixelColor(int r, int g, int b, int a) {
        this.r = checkChannel(r, "red");
        this.g = checkChannel(g, "green");
        this.b = checkChannel(b, "blue");
        this.a = checkChannel(a, "alpha");
    }

    private static int checkChannel(int value, String channel) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Invalid " + channel + " channel value " + value + " - it must be between 0 and 255");
        }
        return value;
    }

    public int getRed() {
        return r;
    }

    public int getGreen() {
        return g;
    }

    public int getBlue() {
        return b;
    }

    public int getAlpha() {
        return a;
    }

    public int toARGB() {
        return (a << 24) | (r << 16) | (g << 8) | b;
    }

    public PixelColor withRGB(int newR, int newG, int newB) {
        return new PixelColor(newR, newG, newB, a);
    }

    public boolean isGray() {
        return r == g && g == b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        PixelColor that = (PixelColor) o;

        return new EqualsBuilder()
                .append(r, that.r)
                .append(g, that.g)
                .append(b, that.b)
                .append(a, that.a)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(r)
                .append(g)
                .append(b)
                .append(a)
                .toHashCode();
    }

    @Override
    public String toString() {
        return new ToStringBuilder(this)
                .append("r", r)
                .append("g", g)
                .append("b", b)
                .append("a", a)
                .toString();
    }
}
