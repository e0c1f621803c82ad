package org.janelia.darkroom.filters;

import java.util.Arrays;

import org.janelia.darkroom.image.PixelColor;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class PixelTransformsTest {

    private static final PixelColor SAMPLE = PixelColor.of(10, 20, 30, 255);

    @Test
    public void blackAndWhiteModes() {
        assertEquals(PixelColor.of(18, 18, 18, 255), apply(Filter.blackAndWhite(), SAMPLE));
        assertEquals(PixelColor.of(18, 18, 18, 255), apply(Filter.blackAndWhite(BlackAndWhiteMode.REGULAR), SAMPLE));
        assertEquals(PixelColor.of(20, 20, 20, 255), apply(Filter.blackAndWhite(BlackAndWhiteMode.AVERAGE), SAMPLE));
        assertEquals(PixelColor.of(19, 19, 19, 255), apply(Filter.blackAndWhite(BlackAndWhiteMode.LUMINOSITY), SAMPLE));
        assertEquals(PixelColor.of(20, 20, 20, 255), apply(Filter.blackAndWhite(BlackAndWhiteMode.DESATURATE), SAMPLE));
    }

    @Test
    public void invert() {
        assertEquals(PixelColor.of(245, 235, 225, 255), apply(Filter.invert(), SAMPLE));
        assertEquals(SAMPLE, apply(Filter.invert(), apply(Filter.invert(), SAMPLE)));
    }

    @Test
    public void tintBlendsHalfWayByDefault() {
        assertEquals(PixelColor.of(128, 128, 0, 255), apply(Filter.tint("#FF0000"), PixelColor.of(0, 255, 0, 255)));
        assertEquals(PixelColor.of(0, 255, 0, 255),
                apply(Filter.tint(FilterValues.parseTintColor("#FF0000"), 0), PixelColor.of(0, 255, 0, 255)));
        assertEquals(PixelColor.of(255, 0, 0, 255),
                apply(Filter.tint(FilterValues.parseTintColor("#FF0000"), 100), PixelColor.of(0, 255, 0, 255)));
    }

    @Test
    public void brightness() {
        assertEquals(PixelColor.of(255, 255, 255, 255), apply(Filter.brightness(100), SAMPLE));
        assertEquals(PixelColor.of(73, 0, 0, 255), apply(Filter.brightness(-50), PixelColor.of(200, 100, 0, 255)));
        assertEquals(SAMPLE, apply(Filter.brightness(0), SAMPLE));
    }

    @Test
    public void saturation() {
        assertEquals(PixelColor.of(18, 18, 18, 255), apply(Filter.saturation(-100), SAMPLE));
        assertEquals(SAMPLE, apply(Filter.saturation(0), SAMPLE));
        // gray 18: 18 + (c - 18) * 2
        assertEquals(PixelColor.of(2, 22, 42, 255), apply(Filter.saturation(100), SAMPLE));
    }

    @Test
    public void vibrance() {
        assertEquals(PixelColor.of(200, 59, 0, 255), apply(Filter.vibrance(100), PixelColor.of(200, 100, 50, 255)));
        assertEquals(PixelColor.of(100, 100, 100, 255), apply(Filter.vibrance(100), PixelColor.of(100, 100, 100, 255)));
        assertEquals(SAMPLE, apply(Filter.vibrance(0), SAMPLE));
    }

    @Test
    public void contrastAndGammaUseLookupTables() {
        assertEquals(SAMPLE, apply(Filter.contrast(0), SAMPLE));
        assertEquals(PixelColor.of(0, 128, 255, 255), apply(Filter.contrast(100), PixelColor.of(100, 128, 200, 255)));
        assertEquals(SAMPLE, apply(Filter.gamma(1), SAMPLE));
        assertEquals(PixelColor.of(0, 255, 0, 255), apply(Filter.gamma(3), PixelColor.of(0, 255, 0, 255)));
    }

    @Test
    public void sepia() {
        assertEquals(PixelColor.of(125, 111, 87, 255), apply(Filter.sepia(), PixelColor.of(50, 100, 150, 255)));
        assertEquals(PixelColor.of(50, 100, 150, 255), apply(Filter.sepia(0), PixelColor.of(50, 100, 150, 255)));
    }

    @Test
    public void hueRotation() {
        assertEquals(PixelColor.of(0, 255, 0, 255), apply(Filter.hue(120), PixelColor.of(255, 0, 0, 255)));
        assertEquals(PixelColor.of(0, 0, 255, 255), apply(Filter.hue(-120), PixelColor.of(255, 0, 0, 255)));
        assertEquals(PixelColor.of(255, 0, 0, 255), apply(Filter.hue(360), PixelColor.of(255, 0, 0, 255)));
        assertEquals(PixelColor.of(90, 90, 90, 255), apply(Filter.hue(45), PixelColor.of(90, 90, 90, 255)));
    }

    @Test
    public void noiseIsDeterministicAndMonochrome() {
        Filter noise = Filter.noise(50, 7);
        PixelColor gray = PixelColor.of(128, 128, 128, 255);
        boolean changed = false;
        for (long i = 0; i < 100; i++) {
            PixelColor p1 = PixelTransforms.apply(gray, noise, i);
            PixelColor p2 = PixelTransforms.apply(gray, noise, i);
            assertEquals(p1, p2);
            assertTrue(p1.isGray());
            assertTrue(Math.abs(p1.getRed() - 128) <= 128);
            changed |= !p1.equals(gray);
        }
        assertTrue(changed);
        assertEquals(gray, PixelTransforms.apply(gray, Filter.noise(0), 3));
    }

    @Test
    public void noiseSeedChangesTheOffsets() {
        PixelColor gray = PixelColor.of(128, 128, 128, 255);
        boolean different = false;
        for (long i = 0; i < 100 && !different; i++) {
            different = !PixelTransforms.apply(gray, Filter.noise(50, 1), i)
                    .equals(PixelTransforms.apply(gray, Filter.noise(50, 2), i));
        }
        assertTrue(different);
    }

    @Test
    public void alphaIsNeverChanged() {
        PixelColor translucent = PixelColor.of(200, 100, 50, 77);
        Filter[] allFilters = {
                Filter.blackAndWhite(), Filter.invert(), Filter.contrast(40), Filter.brightness(30),
                Filter.saturation(60), Filter.vibrance(-40), Filter.gamma(2), Filter.noise(80),
                Filter.sepia(), Filter.hue(200), Filter.tint("#00FFEE")
        };
        for (Filter filter : allFilters) {
            assertEquals(filter.toString(), 77, apply(filter, translucent).getAlpha());
        }
    }

    @Test
    public void unknownFiltersLeavePixelsUnchanged() {
        PixelColor pixel = PixelColor.of(1, 2, 3, 4);
        assertSame(pixel, apply(Filter.unknown("posterize"), pixel));
        assertTrue(PixelTransforms.isSupported(FilterType.TINT));
        assertFalse(PixelTransforms.isSupported(FilterType.UNKNOWN));
    }

    @Test
    public void filtersAreAppliedInOrder() {
        PixelColor green = PixelColor.of(0, 255, 0, 255);
        PixelColor tintThenInvert = PixelTransforms.applyAll(green, Arrays.asList(Filter.tint("#FF0000"), Filter.invert()), 0);
        PixelColor invertThenTint = PixelTransforms.applyAll(green, Arrays.asList(Filter.invert(), Filter.tint("#FF0000")), 0);

        assertEquals(PixelColor.of(127, 127, 255, 255), tintThenInvert);
        assertEquals(PixelColor.of(255, 0, 128, 255), invertThenTint);
        assertNotEquals(tintThenInvert, invertThenTint);
    }

    private PixelColor apply(Filter filter, PixelColor pixel) {
        return PixelTransforms.apply(pixel, filter, 0);
    }
}
