package org.janelia.darkroom.filters;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import org.janelia.darkroom.image.HexColor;
import org.janelia.darkroom.image.PixelColor;
import org.janelia.darkroom.image.PixelOps;

/**
 * The color transform of every filter type together with the table used to dispatch
 * a {@link Filter} to its transform. Alpha is never modified.
 */
public class PixelTransforms {

    private static final Map<FilterType, PixelTransform> TRANSFORMS = new EnumMap<>(FilterType.class);

    static {
        TRANSFORMS.put(FilterType.BLACK_AND_WHITE, (p, v, i) -> blackAndWhite(p, (BlackAndWhiteMode) v));
        TRANSFORMS.put(FilterType.INVERT, (p, v, i) -> invert(p));
        TRANSFORMS.put(FilterType.CONTRAST, (p, v, i) -> contrast(p, (int[]) v));
        TRANSFORMS.put(FilterType.BRIGHTNESS, (p, v, i) -> brightness(p, (Double) v));
        TRANSFORMS.put(FilterType.SATURATION, (p, v, i) -> saturation(p, (double[]) v));
        TRANSFORMS.put(FilterType.VIBRANCE, (p, v, i) -> vibrance(p, (Double) v));
        TRANSFORMS.put(FilterType.GAMMA, (p, v, i) -> gamma(p, (int[]) v));
        TRANSFORMS.put(FilterType.NOISE, (p, v, i) -> noise(p, (NoiseValue) v, i));
        TRANSFORMS.put(FilterType.SEPIA, (p, v, i) -> sepia(p, (Double) v));
        TRANSFORMS.put(FilterType.HUE, (p, v, i) -> hue(p, (Double) v));
        TRANSFORMS.put(FilterType.TINT, (p, v, i) -> tint(p, (TintValue) v));
    }

    public static boolean isSupported(FilterType filterType) {
        return TRANSFORMS.containsKey(filterType);
    }

    /**
     * Apply a single filter. Filter types without a transform return the pixel unchanged.
     */
    public static PixelColor apply(PixelColor pixel, Filter filter, long pixelIndex) {
        PixelTransform transform = TRANSFORMS.get(filter.getType());
        if (transform == null) {
            return pixel;
        } else {
            return transform.apply(pixel, filter.value, pixelIndex);
        }
    }

    /**
     * Fold all filters into the pixel in list order.
     */
    public static PixelColor applyAll(PixelColor pixel, List<Filter> filters, long pixelIndex) {
        PixelColor current = pixel;
        for (Filter filter : filters) {
            current = apply(current, filter, pixelIndex);
        }
        return current;
    }

    public static PixelColor invert(PixelColor pixel) {
        return pixel.withRGB(255 - pixel.getRed(), 255 - pixel.getGreen(), 255 - pixel.getBlue());
    }

    public static PixelColor blackAndWhite(PixelColor pixel, BlackAndWhiteMode mode) {
        int r = pixel.getRed();
        int g = pixel.getGreen();
        int b = pixel.getBlue();
        int gray;
        switch (mode) {
            case AVERAGE:
                gray = PixelOps.rgbToAverage(r, g, b);
                break;
            case LUMINOSITY:
                gray = PixelOps.rgbToLuminosity(r, g, b);
                break;
            case DESATURATE:
                gray = PixelOps.rgbToLightness(r, g, b);
                break;
            case REGULAR:
            default:
                gray = PixelOps.rgbToLuma(r, g, b);
                break;
        }
        return pixel.withRGB(gray, gray, gray);
    }

    public static PixelColor contrast(PixelColor pixel, int[] lookup) {
        return lookup(pixel, lookup);
    }

    public static PixelColor gamma(PixelColor pixel, int[] lookup) {
        return lookup(pixel, lookup);
    }

    private static PixelColor lookup(PixelColor pixel, int[] lookup) {
        return pixel.withRGB(lookup[pixel.getRed()], lookup[pixel.getGreen()], lookup[pixel.getBlue()]);
    }

    public static PixelColor brightness(PixelColor pixel, double offset) {
        return PixelColor.clamped(
                pixel.getRed() + offset,
                pixel.getGreen() + offset,
                pixel.getBlue() + offset,
                pixel.getAlpha());
    }

    /**
     * @param scaled <code>scaled[c] = c * s</code> for the saturation scale <code>s</code>
     */
    public static PixelColor saturation(PixelColor pixel, double[] scaled) {
        int r = pixel.getRed();
        int g = pixel.getGreen();
        int b = pixel.getBlue();
        int gray = PixelOps.rgbToLuma(r, g, b);
        // gray + (c - gray) * s
        double grayOffset = gray - scaled[gray];
        return PixelColor.clamped(
                scaled[r] + grayOffset,
                scaled[g] + grayOffset,
                scaled[b] + grayOffset,
                pixel.getAlpha());
    }

    /**
     * Saturation boost that is stronger for muted colors and leaves grays alone.
     */
    public static PixelColor vibrance(PixelColor pixel, double amount) {
        int r = pixel.getRed();
        int g = pixel.getGreen();
        int b = pixel.getBlue();
        int max = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        double k = amount * (1 - (max - min) / 255.);
        return PixelColor.clamped(
                r == max ? r : r - (max - r) * k,
                g == max ? g : g - (max - g) * k,
                b == max ? b : b - (max - b) * k,
                pixel.getAlpha());
    }

    public static PixelColor noise(PixelColor pixel, NoiseValue noise, long pixelIndex) {
        int strength = noise.getStrength();
        if (strength == 0) {
            return pixel;
        }
        long h = mix64(noise.getSeed() + pixelIndex * 0x9E3779B97F4A7C15L);
        int offset = (int) Math.floorMod(h, 2L * strength + 1) - strength;
        return pixel.withRGB(
                PixelOps.clampToByte(pixel.getRed() + offset),
                PixelOps.clampToByte(pixel.getGreen() + offset),
                PixelOps.clampToByte(pixel.getBlue() + offset));
    }

    // SplitMix64 finalizer
    private static long mix64(long z) {
        z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
        z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
        return z ^ (z >>> 31);
    }

    public static PixelColor sepia(PixelColor pixel, double amount) {
        int r = pixel.getRed();
        int g = pixel.getGreen();
        int b = pixel.getBlue();
        return PixelColor.clamped(
                r * (1 - 0.607 * amount) + g * 0.769 * amount + b * 0.189 * amount,
                r * 0.349 * amount + g * (1 - 0.314 * amount) + b * 0.168 * amount,
                r * 0.272 * amount + g * 0.534 * amount + b * (1 - 0.869 * amount),
                pixel.getAlpha());
    }

    public static PixelColor hue(PixelColor pixel, double shift) {
        if (shift == 0 || pixel.isGray()) {
            return pixel;
        }
        double[] hsv = PixelOps.rgbToHsv(pixel.getRed(), pixel.getGreen(), pixel.getBlue());
        double h = (hsv[0] + shift) % 360;
        double[] rgb = PixelOps.hsvToRgb(h, hsv[1], hsv[2]);
        return PixelColor.clamped(rgb[0], rgb[1], rgb[2], pixel.getAlpha());
    }

    public static PixelColor tint(PixelColor pixel, TintValue tint) {
        HexColor target = tint.getColor();
        double s = tint.getStrength();
        return PixelColor.clamped(
                pixel.getRed() + (target.getRed() - pixel.getRed()) * s,
                pixel.getGreen() + (target.getGreen() - pixel.getGreen()) * s,
                pixel.getBlue() + (target.getBlue() - pixel.getBlue()) * s,
                pixel.getAlpha());
    }
}
