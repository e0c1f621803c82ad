package org.janelia.darkroom.image;

/**
 * Channel arithmetic shared by the pixel transforms.
 */
public class PixelOps {

    private static final double REC601_R = 0.299;
    private static final double REC601_G = 0.587;
    private static final double REC601_B = 0.114;

    private static final double REC709_R = 0.2126;
    private static final double REC709_G = 0.7152;
    private static final double REC709_B = 0.0722;

    /**
     * Round half up and clamp to the 0..255 byte range.
     */
    public static int clampToByte(double value) {
        if (Double.isNaN(value) || value <= 0) {
            return 0;
        } else if (value >= 255) {
            return 255;
        } else {
            return (int) Math.floor(value + 0.5);
        }
    }

    public static int clampToByte(int value) {
        return value < 0 ? 0 : Math.min(value, 255);
    }

    /**
     * Rec.601 luma - the weights used by analog TV and most photo editors for "grayscale".
     */
    public static int rgbToLuma(int r, int g, int b) {
        return clampToByte(REC601_R * r + REC601_G * g + REC601_B * b);
    }

    /**
     * Rec.709 relative luminance weights applied directly on the non-linear channel values.
     */
    public static int rgbToLuminosity(int r, int g, int b) {
        return clampToByte(REC709_R * r + REC709_G * g + REC709_B * b);
    }

    public static int rgbToAverage(int r, int g, int b) {
        return clampToByte((r + g + b) / 3.);
    }

    public static int rgbToLightness(int r, int g, int b) {
        int max = Math.max(r, Math.max(g, b));
        int min = Math.min(r, Math.min(g, b));
        return clampToByte((max + min) / 2.);
    }

    /**
     * @return {hue in [0, 360), saturation in [0, 1], value in [0, 1]}
     */
    public static double[] rgbToHsv(int r, int g, int b) {
        double rr = r / 255.;
        double gg = g / 255.;
        double bb = b / 255.;
        double max = Math.max(rr, Math.max(gg, bb));
        double min = Math.min(rr, Math.min(gg, bb));
        double delta = max - min;

        double h;
        if (delta == 0) {
            h = 0;
        } else if (max == rr) {
            h = 60 * (((gg - bb) / delta) % 6);
        } else if (max == gg) {
            h = 60 * (((bb - rr) / delta) + 2);
        } else {
            h = 60 * (((rr - gg) / delta) + 4);
        }
        if (h < 0) {
            h += 360;
        }
        double s = max == 0 ? 0 : delta / max;
        return new double[] {h, s, max};
    }

    /**
     * @return {r, g, b} as unrounded values in the 0..255 range
     */
    public static double[] hsvToRgb(double h, double s, double v) {
        double c = v * s;
        double hp = (h % 360) / 60;
        double x = c * (1 - Math.abs(hp % 2 - 1));
        double r1, g1, b1;
        if (hp < 1) {
            r1 = c; g1 = x; b1 = 0;
        } else if (hp < 2) {
            r1 = x; g1 = c; b1 = 0;
        } else if (hp < 3) {
            r1 = 0; g1 = c; b1 = x;
        } else if (hp < 4) {
            r1 = 0; g1 = x; b1 = c;
        } else if (hp < 5) {
            r1 = x; g1 = 0; b1 = c;
        } else {
            r1 = c; g1 = 0; b1 = x;
        }
        double m = v - c;
        return new double[] {(r1 + m) * 255, (g1 + m) * 255, (b1 + m) * 255};
    }
}
