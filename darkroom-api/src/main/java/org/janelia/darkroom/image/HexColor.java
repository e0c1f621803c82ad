package org.janelia.darkroom.image;

import java.awt.Color;
import java.util.Locale;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.EqualsBuilder;
import org.apache.commons.lang3.builder.HashCodeBuilder;

/**
 * An opaque RGB color written as <code>#RRGGBB</code>. The hex digits are case insensitive
 * when parsing and always upper case when formatting.
 */
public final class HexColor {

    private static final Pattern HEX_PATTERN = Pattern.compile("^#[0-9a-fA-F]{6}$");

    private final int red;
    private final int green;
    private final int blue;

    public static HexColor parse(String hex) {
        if (StringUtils.isBlank(hex)) {
            throw new IllegalArgumentException("Empty color value");
        }
        String value = hex.trim();
        if (!HEX_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid color '" + hex + "' - expected #RRGGBB");
        }
        int rgb = Integer.parseInt(value.substring(1), 16);
        return new HexColor((rgb >> 16) & 0xff, (rgb >> 8) & 0xff, rgb & 0xff);
    }

    public static HexColor fromRGB(int red, int green, int blue) {
        return parse(String.format("#%02X%02X%02X", checkChannel(red), checkChannel(green), checkChannel(blue)));
    }

    public static HexColor fromColor(Color color) {
        return fromRGB(color.getRed(), color.getGreen(), color.getBlue());
    }

    private static int checkChannel(int value) {
        if (value < 0 || value > 255) {
            throw new IllegalArgumentException("Invalid channel value " + value + " - it must be between 0 and 255");
        }
        return value;
    }

    private HexColor(int red, int green, int blue) {
        this.red = red;
        this.green = green;
        this.blue = blue;
    }

    public int getRed() {
        return red;
    }

    public int getGreen() {
        return green;
    }

    public int getBlue() {
        return blue;
    }

    public String toHex() {
        return String.format(Locale.ROOT, "#%02X%02X%02X", red, green, blue);
    }

    public Color toColor() {
        return new Color(red, green, blue);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;

        if (o == null || getClass() != o.getClass()) return false;

        HexColor that = (HexColor) o;

        return new EqualsBuilder()
                .append(red, that.red)
                .append(green, that.green)
                .append(blue, that.blue)
                .isEquals();
    }

    @Override
    public int hashCode() {
        return new HashCodeBuilder(17, 37)
                .append(red)
                .append(green)
                .append(blue)
                .toHashCode();
    }

    @Override
    public String toString() {
        return toHex();
    }
}
