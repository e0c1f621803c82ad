package org.janelia.darkroom.image;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import net.imglib2.Cursor;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.ARGBType;
import org.junit.Test;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class NegativeTest {

    @Test
    public void defaultLayoutIsBGRA() {
        Negative negative = Negative.blank(2, 1, PixelColor.of(10, 20, 30, 40));
        negative.setPixel(1, 0, PixelColor.of(1, 2, 3, 4));

        assertEquals(8, negative.getStride());
        assertArrayEquals(new byte[] {30, 20, 10, 40, 3, 2, 1, 4}, negative.getPixelBytes());
    }

    @Test
    public void rgbaLayout() {
        Negative negative = Negative.fromARGB(new int[] {0x80112233}, 1, 1, ChannelOrder.RGBA);

        assertArrayEquals(new byte[] {0x11, 0x22, 0x33, (byte) 0x80}, negative.getPixelBytes());
        assertEquals(PixelColor.of(0x11, 0x22, 0x33, 0x80), negative.getPixel(0, 0));
        assertArrayEquals(new int[] {0x80112233}, negative.toARGB());
    }

    @Test
    public void copyIsIndependent() {
        Negative negative = TestUtils.randomNegative(5, 4, 17);
        Negative copy = negative.copy();
        TestUtils.assertSamePixels(negative, copy);

        copy.setPixel(2, 3, PixelColor.of(0, 0, 0, 0));
        copy.setPixel(0, 0, PixelColor.of(1, 1, 1, 1));

        assertFalse(negative.contentEquals(copy));
        assertNotEquals(negative.getPixel(0, 0), copy.getPixel(0, 0));
    }

    @Test
    public void convertFromAndToImglib2Image() {
        Img<ARGBType> img = ArrayImgs.argbs(3, 2);
        int v = 0;
        Cursor<ARGBType> cursor = img.cursor();
        while (cursor.hasNext()) {
            cursor.next().set(ARGBType.rgba(v, v + 1, v + 2, 255));
            v += 10;
        }
        Negative negative = Negative.fromImage(img);

        assertEquals(3, negative.getWidth());
        assertEquals(2, negative.getHeight());
        assertEquals(PixelColor.of(0, 1, 2), negative.getPixel(0, 0));
        assertEquals(PixelColor.of(30, 31, 32), negative.getPixel(0, 1));
        assertEquals(PixelColor.of(50, 51, 52), negative.getPixel(2, 1));

        Img<ARGBType> convertedImg = negative.toImage();
        Cursor<ARGBType> c1 = img.cursor();
        Cursor<ARGBType> c2 = convertedImg.cursor();
        while (c1.hasNext()) {
            assertEquals(c1.next().get(), c2.next().get());
        }
    }

    @Test
    public void pixelsCanOnlyBeLockedOnce() {
        Negative negative = Negative.blank(2, 2, PixelColor.of(0, 0, 0));
        try (NegativePixels pixels = negative.lockPixels()) {
            assertTrue(negative.isLocked());
            assertEquals(16, pixels.getBuffer().length);
            try {
                negative.lockPixels();
                fail("Expected the second lock to fail");
            } catch (NegativeAccessException expected) {
                // ok
            }
            try {
                negative.getPixel(0, 0);
                fail("Expected pixel read to fail while locked");
            } catch (NegativeAccessException expected) {
                // ok
            }
        }
        assertFalse(negative.isLocked());
        assertEquals(PixelColor.of(0, 0, 0), negative.getPixel(1, 1));
    }

    @Test
    public void lockedPixelsCannotBeReadFromOtherThreads() throws Exception {
        Negative negative = Negative.blank(2, 2, PixelColor.of(5, 6, 7));
        ExecutorService otherThread = Executors.newSingleThreadExecutor();
        try {
            // concurrent readers do not exclude each other
            assertEquals(PixelColor.of(5, 6, 7), otherThread.submit(() -> negative.getPixel(1, 1)).get());
            try (NegativePixels ignored = negative.lockPixels()) {
                try {
                    otherThread.submit(() -> negative.getPixelBytes()).get();
                    fail("Expected the read to fail while the pixels are locked");
                } catch (ExecutionException e) {
                    assertTrue(e.getCause() instanceof NegativeAccessException);
                }
                try {
                    otherThread.submit(() -> negative.lockPixels()).get();
                    fail("Expected the lock to fail while the pixels are locked");
                } catch (ExecutionException e) {
                    assertTrue(e.getCause() instanceof NegativeAccessException);
                }
            }
            assertArrayEquals(negative.getPixelBytes(), otherThread.submit(() -> negative.copy().getPixelBytes()).get());
        } finally {
            otherThread.shutdownNow();
        }
    }

    @Test
    public void releasedPixelsAreNotAccessible() {
        Negative negative = Negative.blank(1, 1, PixelColor.of(0, 0, 0));
        NegativePixels pixels = negative.lockPixels();
        pixels.close();
        pixels.close();
        try {
            pixels.getBuffer();
            fail("Expected released buffer access to fail");
        } catch (NegativeAccessException expected) {
            // ok
        }
        assertFalse(negative.isLocked());
    }

    @Test
    public void closedNegativeRejectsPixelAccess() {
        Negative negative = Negative.blank(1, 1, PixelColor.of(0, 0, 0));
        negative.close();
        negative.close();
        assertTrue(negative.isClosed());
        try {
            negative.getPixelBytes();
            fail("Expected closed negative access to fail");
        } catch (IllegalStateException expected) {
            // ok
        }
        assertFalse(negative.isLocked());
    }

    @Test
    public void lockedNegativeCannotBeClosed() {
        Negative negative = Negative.blank(1, 1, PixelColor.of(0, 0, 0));
        try (NegativePixels ignored = negative.lockPixels()) {
            negative.close();
            fail("Expected close to fail while the pixels are locked");
        } catch (NegativeAccessException expected) {
            // ok
        }
        assertFalse(negative.isClosed());
    }

    @Test
    public void wrapDoesNotCopy() {
        byte[] buffer = new byte[] {1, 2, 3, 4};
        Negative negative = Negative.wrap(buffer, 1, 1, ChannelOrder.ARGB);

        assertEquals(PixelColor.of(2, 3, 4, 1), negative.getPixel(0, 0));
        negative.setPixel(0, 0, PixelColor.of(5, 6, 7, 8));
        assertArrayEquals(new byte[] {8, 5, 6, 7}, buffer);
        assertSame(ChannelOrder.ARGB, negative.getChannelOrder());
    }

    @Test(expected = IllegalArgumentException.class)
    public void rejectEmptyImage() {
        Negative.blank(0, 3, PixelColor.of(0, 0, 0));
    }

    @Test(expected = IndexOutOfBoundsException.class)
    public void rejectPixelOutsideImage() {
        Negative.blank(2, 2, PixelColor.of(0, 0, 0)).getPixel(2, 0);
    }
}
