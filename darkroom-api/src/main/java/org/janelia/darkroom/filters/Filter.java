package org.janelia.darkroom.filters;

import java.awt.Color;

import com.google.common.base.Preconditions;

import org.apache.commons.lang3.builder.ToStringBuilder;
import org.janelia.darkroom.image.HexColor;

/**
 * An immutable, already normalized filter request. Instances are created through the
 * static factories, which validate the raw value and precompute the canonical one.
 */
public final class Filter {

    private final FilterType type;
    // canonical value consumed by PixelTransforms; lookup tables are never exposed directly
    final Object value;
    private final Object rawValue;

    public static Filter blackAndWhite() {
        return blackAndWhite(BlackAndWhiteMode.REGULAR);
    }

    public static Filter blackAndWhite(BlackAndWhiteMode mode) {
        if (mode == null) {
            throw new InvalidFilterValueException(FilterType.BLACK_AND_WHITE, "no black and white mode");
        }
        return new Filter(FilterType.BLACK_AND_WHITE, mode, mode);
    }

    public static Filter invert() {
        return new Filter(FilterType.INVERT, null, null);
    }

    public static Filter contrast(double value) {
        return new Filter(FilterType.CONTRAST, FilterValues.normalizeContrast(value), value);
    }

    public static Filter brightness(double value) {
        return new Filter(FilterType.BRIGHTNESS, FilterValues.normalizeBrightness(value), value);
    }

    public static Filter saturation(double value) {
        return new Filter(FilterType.SATURATION, FilterValues.normalizeSaturation(value), value);
    }

    public static Filter vibrance(double value) {
        return new Filter(FilterType.VIBRANCE, FilterValues.normalizeVibrance(value), value);
    }

    public static Filter gamma(double value) {
        return new Filter(FilterType.GAMMA, FilterValues.normalizeGamma(value), value);
    }

    public static Filter noise(double value) {
        return noise(value, FilterValues.DEFAULT_NOISE_SEED);
    }

    public static Filter noise(double value, long seed) {
        return new Filter(FilterType.NOISE, FilterValues.normalizeNoise(value, seed), value);
    }

    public static Filter sepia() {
        return sepia(FilterValues.DEFAULT_SEPIA);
    }

    public static Filter sepia(double value) {
        return new Filter(FilterType.SEPIA, FilterValues.normalizeSepia(value), value);
    }

    public static Filter hue(double value) {
        return new Filter(FilterType.HUE, FilterValues.normalizeHue(value), value);
    }

    public static Filter tint(String hex) {
        return tint(FilterValues.parseTintColor(hex));
    }

    public static Filter tint(int red, int green, int blue) {
        return tint(FilterValues.tintColorFromRGB(red, green, blue));
    }

    public static Filter tint(Color color) {
        return tint(FilterValues.tintColorFromColor(color));
    }

    public static Filter tint(HexColor color) {
        return tint(color, FilterValues.DEFAULT_TINT_STRENGTH);
    }

    public static Filter tint(HexColor color, double strength) {
        TintValue tintValue = FilterValues.normalizeTint(color, strength);
        return new Filter(FilterType.TINT, tintValue, color.toHex());
    }

    /**
     * A filter this library does not implement; washing it leaves the pixels unchanged.
     */
    public static Filter unknown(String name) {
        return new Filter(FilterType.UNKNOWN, null, name);
    }

    private Filter(FilterType type, Object value, Object rawValue) {
        this.type = Preconditions.checkNotNull(type);
        this.value = value;
        this.rawValue = rawValue;
    }

    public FilterType getType() {
        return type;
    }

    /**
     * @return the value as supplied when the filter was created (the hex string for tints,
     * the recipe name for unknown filters)
     */
    public Object getRawValue() {
        return rawValue;
    }

    /**
     * @return the canonical value; lookup tables are returned as copies
     */
    public Object getCanonicalValue() {
        if (value instanceof int[]) {
            return ((int[]) value).clone();
        } else if (value instanceof double[]) {
            return ((double[]) value).clone();
        } else {
            return value;
        }
    }

    @Override
    public String toString() {
        ToStringBuilder builder = new ToStringBuilder(this).append("type", type);
        if (rawValue != null) {
            builder.append("value", rawValue);
        }
        if (value instanceof TintValue || value instanceof NoiseValue) {
            builder.append("canonical", value);
        }
        return builder.toString();
    }
}
