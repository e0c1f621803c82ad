package org.janelia.darkroom.filters;

import java.awt.Color;

import org.janelia.darkroom.image.HexColor;
import org.janelia.darkroom.image.PixelOps;

/**
 * Turns raw, user supplied filter values into the canonical values consumed by
 * {@link PixelTransforms}. Everything here runs once per queued filter, never per pixel.
 * <p>
 * Non finite values are always rejected. Finite values outside a filter's range are clamped
 * to the nearest bound, except gamma, which rejects values that are not positive, and hue,
 * which wraps modulo 360.
 */
public class FilterValues {

    public static final double MIN_BRIGHTNESS = -100;
    public static final double MAX_BRIGHTNESS = 100;
    public static final double MIN_CONTRAST = -100;
    public static final double MAX_CONTRAST = 100;
    public static final double MIN_SATURATION = -100;
    public static final double MAX_SATURATION = 100;
    public static final double MIN_VIBRANCE = -100;
    public static final double MAX_VIBRANCE = 100;
    public static final double MIN_GAMMA = 0.1;
    public static final double MAX_GAMMA = 10;
    public static final double MIN_NOISE = 0;
    public static final double MAX_NOISE = 100;
    public static final double MIN_SEPIA = 0;
    public static final double MAX_SEPIA = 100;
    public static final double MIN_TINT_STRENGTH = 0;
    public static final double MAX_TINT_STRENGTH = 100;

    public static final double DEFAULT_SEPIA = 100;
    public static final double DEFAULT_TINT_STRENGTH = 50;
    public static final long DEFAULT_NOISE_SEED = 0x5EED;

    private static final int LOOKUP_SIZE = 256;

    /**
     * @return channel offset in [-255, 255]
     */
    public static double normalizeBrightness(double value) {
        double brightness = clamp(FilterType.BRIGHTNESS, value, MIN_BRIGHTNESS, MAX_BRIGHTNESS);
        return brightness * 255 / 100;
    }

    /**
     * @return lookup table for the contrast correction factor
     * <code>259 (C + 255) / (255 (259 - C))</code> with <code>C = 2.55 * value</code>
     */
    public static int[] normalizeContrast(double value) {
        double contrast = clamp(FilterType.CONTRAST, value, MIN_CONTRAST, MAX_CONTRAST) * 2.55;
        double factor = (259 * (contrast + 255)) / (255 * (259 - contrast));
        int[] lookup = new int[LOOKUP_SIZE];
        for (int c = 0; c < LOOKUP_SIZE; c++) {
            lookup[c] = PixelOps.clampToByte(factor * (c - 128) + 128);
        }
        return lookup;
    }

    /**
     * @return lookup table of <code>c * s</code> where <code>s = 1 + value / 100</code> is the
     * saturation scale, so 0 is the identity and -100 fully desaturates.
     */
    public static double[] normalizeSaturation(double value) {
        double scale = 1 + clamp(FilterType.SATURATION, value, MIN_SATURATION, MAX_SATURATION) / 100;
        double[] lookup = new double[LOOKUP_SIZE];
        for (int c = 0; c < LOOKUP_SIZE; c++) {
            lookup[c] = c * scale;
        }
        return lookup;
    }

    /**
     * @return vibrance amount in [-1, 1]
     */
    public static double normalizeVibrance(double value) {
        return clamp(FilterType.VIBRANCE, value, MIN_VIBRANCE, MAX_VIBRANCE) / 100;
    }

    /**
     * @return lookup table of <code>255 (c / 255)^(1 / gamma)</code>
     */
    public static int[] normalizeGamma(double value) {
        checkFinite(FilterType.GAMMA, value);
        if (value <= 0) {
            throw new InvalidFilterValueException(FilterType.GAMMA, "gamma must be positive but was " + value);
        }
        double gamma = Math.min(Math.max(value, MIN_GAMMA), MAX_GAMMA);
        int[] lookup = new int[LOOKUP_SIZE];
        for (int c = 0; c < LOOKUP_SIZE; c++) {
            lookup[c] = PixelOps.clampToByte(255 * Math.pow(c / 255., 1 / gamma));
        }
        return lookup;
    }

    public static NoiseValue normalizeNoise(double value, long seed) {
        double noise = clamp(FilterType.NOISE, value, MIN_NOISE, MAX_NOISE);
        return new NoiseValue(PixelOps.clampToByte(noise * 2.55), seed);
    }

    /**
     * @return sepia amount in [0, 1]
     */
    public static double normalizeSepia(double value) {
        return clamp(FilterType.SEPIA, value, MIN_SEPIA, MAX_SEPIA) / 100;
    }

    /**
     * @return hue rotation in degrees, in [0, 360)
     */
    public static double normalizeHue(double value) {
        checkFinite(FilterType.HUE, value);
        double hue = value % 360;
        if (hue < 0) {
            hue += 360;
        }
        // -0.0 and values like -1e-20 that round back up to 360
        return hue >= 360 || hue == 0 ? 0 : hue;
    }

    public static TintValue normalizeTint(HexColor color, double strength) {
        if (color == null) {
            throw new InvalidFilterValueException(FilterType.TINT, "no tint color");
        }
        double tintStrength = clamp(FilterType.TINT, strength, MIN_TINT_STRENGTH, MAX_TINT_STRENGTH);
        return new TintValue(color, tintStrength);
    }

    public static HexColor parseTintColor(String hex) {
        try {
            return HexColor.parse(hex);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterValueException(FilterType.TINT, e.getMessage(), e);
        }
    }

    public static HexColor tintColorFromRGB(int red, int green, int blue) {
        try {
            return HexColor.fromRGB(red, green, blue);
        } catch (IllegalArgumentException e) {
            throw new InvalidFilterValueException(FilterType.TINT, e.getMessage(), e);
        }
    }

    public static HexColor tintColorFromColor(Color color) {
        if (color == null) {
            throw new InvalidFilterValueException(FilterType.TINT, "no tint color");
        }
        return HexColor.fromColor(color);
    }

    private static double clamp(FilterType filterType, double value, double min, double max) {
        checkFinite(filterType, value);
        return Math.min(Math.max(value, min), max);
    }

    private static void checkFinite(FilterType filterType, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidFilterValueException(filterType, "value must be a finite number but was " + value);
        }
    }
}
