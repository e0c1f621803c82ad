package org.janelia.darkroom.image;

import java.util.Random;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class TestUtils {

    public static Negative randomNegative(int width, int height, long seed) {
        Random random = new Random(seed);
        int[] argb = new int[width * height];
        for (int i = 0; i < argb.length; i++) {
            // keep some pixels translucent to check that alpha survives every filter
            int alpha = random.nextInt(4) == 0 ? random.nextInt(256) : 255;
            argb[i] = (alpha << 24) | (random.nextInt(1 << 24));
        }
        return Negative.fromARGB(argb, width, height);
    }

    public static void assertSamePixels(Negative expected, Negative actual) {
        assertEquals(expected.getWidth(), actual.getWidth());
        assertEquals(expected.getHeight(), actual.getHeight());
        assertEquals(expected.getChannelOrder(), actual.getChannelOrder());
        assertArrayEquals(expected.getPixelBytes(), actual.getPixelBytes());
    }

    public static void assertAllPixels(PixelColor expected, Negative negative) {
        for (int y = 0; y < negative.getHeight(); y++) {
            for (int x = 0; x < negative.getWidth(); x++) {
                assertEquals("Pixel at " + x + "," + y, expected, negative.getPixel(x, y));
            }
        }
    }
}
