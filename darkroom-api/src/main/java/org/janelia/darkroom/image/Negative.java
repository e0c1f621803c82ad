package org.janelia.darkroom.image;

import java.util.Arrays;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import com.google.common.base.Preconditions;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.ByteArray;
import net.imglib2.type.numeric.ARGBType;
import net.imglib2.type.numeric.integer.UnsignedByteType;
import net.imglib2.view.Views;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory 4 channel image. The pixels are kept in a <code>channel x width x height</code>
 * byte image so each row occupies <code>4 * width</code> contiguous bytes, with the
 * channels of every pixel stored in the negative's {@link ChannelOrder}.
 * <p>
 * Readers ({@link #getPixel(int, int)}, {@link #getPixelBytes()}, {@link #copy()}, ...) may run
 * concurrently with each other. {@link #lockPixels()} grants exclusive access and while it is
 * held every other access fails with {@link NegativeAccessException} instead of waiting.
 */
public class Negative implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Negative.class);

    private final int width;
    private final int height;
    private final ChannelOrder channelOrder;
    private final ReentrantReadWriteLock pixelsLock = new ReentrantReadWriteLock();
    private volatile ArrayImg<UnsignedByteType, ByteArray> pixels;

    public static Negative blank(int width, int height, PixelColor background) {
        return blank(width, height, background, ChannelOrder.BGRA);
    }

    public static Negative blank(int width, int height, PixelColor background, ChannelOrder channelOrder) {
        Negative negative = new Negative(newBuffer(width, height), width, height, channelOrder);
        byte[] buffer = negative.storage();
        for (int offset = 0; offset < buffer.length; offset += ChannelOrder.BYTES_PER_PIXEL) {
            channelOrder.encode(background, buffer, offset);
        }
        return negative;
    }

    public static Negative fromARGB(int[] argb, int width, int height) {
        return fromARGB(argb, width, height, ChannelOrder.BGRA);
    }

    public static Negative fromARGB(int[] argb, int width, int height, ChannelOrder channelOrder) {
        Preconditions.checkArgument(argb.length == width * height,
                "Expected %s ARGB values for a %sx%s image but got %s", width * height, width, height, argb.length);
        Negative negative = new Negative(newBuffer(width, height), width, height, channelOrder);
        byte[] buffer = negative.storage();
        for (int i = 0; i < argb.length; i++) {
            channelOrder.encode(PixelColor.fromARGB(argb[i]), buffer, i * ChannelOrder.BYTES_PER_PIXEL);
        }
        return negative;
    }

    public static Negative fromImage(RandomAccessibleInterval<ARGBType> img) {
        return fromImage(img, ChannelOrder.BGRA);
    }

    public static Negative fromImage(RandomAccessibleInterval<ARGBType> img, ChannelOrder channelOrder) {
        Preconditions.checkArgument(img.numDimensions() == 2, "Only 2D images are supported");
        int width = (int) img.dimension(0);
        int height = (int) img.dimension(1);
        Negative negative = new Negative(newBuffer(width, height), width, height, channelOrder);
        byte[] buffer = negative.storage();
        Cursor<ARGBType> imgCursor = Views.flatIterable(img).cursor();
        int offset = 0;
        while (imgCursor.hasNext()) {
            channelOrder.encode(PixelColor.fromARGB(imgCursor.next().get()), buffer, offset);
            offset += ChannelOrder.BYTES_PER_PIXEL;
        }
        return negative;
    }

    /**
     * Create a negative that takes ownership of the given buffer without copying it.
     */
    public static Negative wrap(byte[] buffer, int width, int height, ChannelOrder channelOrder) {
        return new Negative(buffer, width, height, channelOrder);
    }

    private static byte[] newBuffer(int width, int height) {
        Preconditions.checkArgument(width > 0 && height > 0, "Invalid image size %sx%s", width, height);
        return new byte[Math.multiplyExact(Math.multiplyExact(width, height), ChannelOrder.BYTES_PER_PIXEL)];
    }

    private Negative(byte[] buffer, int width, int height, ChannelOrder channelOrder) {
        Preconditions.checkArgument(width > 0 && height > 0, "Invalid image size %sx%s", width, height);
        Preconditions.checkArgument(buffer.length == width * height * ChannelOrder.BYTES_PER_PIXEL,
                "Buffer of %s bytes does not match a %sx%s image", buffer.length, width, height);
        this.width = width;
        this.height = height;
        this.channelOrder = Preconditions.checkNotNull(channelOrder);
        this.pixels = ArrayImgs.unsignedBytes(buffer, ChannelOrder.BYTES_PER_PIXEL, width, height);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    /**
     * @return number of bytes of a pixel row
     */
    public int getStride() {
        return width * ChannelOrder.BYTES_PER_PIXEL;
    }

    public ChannelOrder getChannelOrder() {
        return channelOrder;
    }

    public boolean isClosed() {
        return pixels == null;
    }

    public boolean isLocked() {
        return pixelsLock.isWriteLocked();
    }

    /**
     * Lock the pixel buffer for exclusive access. The returned handle must be closed by the
     * thread that acquired it.
     *
     * @throws NegativeAccessException if the pixels are locked or being read by another operation
     * @throws IllegalStateException if the negative was closed
     */
    public NegativePixels lockPixels() {
        Lock writeLock = pixelsLock.writeLock();
        if (pixelsLock.isWriteLockedByCurrentThread() || !writeLock.tryLock()) {
            throw new NegativeAccessException("Pixel buffer of " + this + " is locked by another operation");
        }
        try {
            return new NegativePixels(this, storage());
        } catch (RuntimeException e) {
            writeLock.unlock();
            throw e;
        }
    }

    void unlockPixels() {
        if (!pixelsLock.isWriteLockedByCurrentThread()) {
            throw new NegativeAccessException("Pixel buffer of " + this + " is not locked by the current thread");
        }
        pixelsLock.writeLock().unlock();
    }

    private <T> T readPixels(Function<byte[], T> reader) {
        Lock readLock = pixelsLock.readLock();
        if (pixelsLock.isWriteLockedByCurrentThread() || !readLock.tryLock()) {
            throw new NegativeAccessException("Pixel buffer of " + this + " is locked by another operation");
        }
        try {
            return reader.apply(storage());
        } finally {
            readLock.unlock();
        }
    }

    public PixelColor getPixel(int x, int y) {
        checkPosition(x, y);
        return readPixels(buffer -> channelOrder.decode(buffer, y * getStride() + x * ChannelOrder.BYTES_PER_PIXEL));
    }

    public void setPixel(int x, int y, PixelColor pixel) {
        checkPosition(x, y);
        try (NegativePixels p = lockPixels()) {
            channelOrder.encode(pixel, p.getBuffer(), p.pixelOffset(x, y));
        }
    }

    /**
     * @return a copy of the raw pixel bytes in the physical channel order
     */
    public byte[] getPixelBytes() {
        return readPixels(byte[]::clone);
    }

    public int[] toARGB() {
        return readPixels(buffer -> {
            int[] argb = new int[width * height];
            for (int i = 0; i < argb.length; i++) {
                argb[i] = channelOrder.decode(buffer, i * ChannelOrder.BYTES_PER_PIXEL).toARGB();
            }
            return argb;
        });
    }

    public Img<ARGBType> toImage() {
        return ArrayImgs.argbs(toARGB(), width, height);
    }

    /**
     * @return an independent deep copy of this negative
     */
    public Negative copy() {
        byte[] content = getPixelBytes();
        LOG.debug("Copied {}x{} negative", width, height);
        return new Negative(content, width, height, channelOrder);
    }

    /**
     * Compare size, channel order and pixel bytes.
     */
    public boolean contentEquals(Negative other) {
        if (other == this) {
            return true;
        }
        return other != null &&
                width == other.width &&
                height == other.height &&
                channelOrder == other.channelOrder &&
                Arrays.equals(getPixelBytes(), other.getPixelBytes());
    }

    private byte[] storage() {
        ArrayImg<UnsignedByteType, ByteArray> current = pixels;
        if (current == null) {
            throw new IllegalStateException("Negative " + width + "x" + height + " was closed");
        }
        return current.update(null).getCurrentStorageArray();
    }

    private void checkPosition(int x, int y) {
        if (x < 0 || x >= width || y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Position (" + x + ", " + y + ") is outside of " + width + "x" + height);
        }
    }

    /**
     * Release the pixel buffer. Closing an already closed negative does nothing.
     *
     * @throws NegativeAccessException if the pixels are in use by another operation
     */
    @Override
    public void close() {
        Lock writeLock = pixelsLock.writeLock();
        if (pixelsLock.isWriteLockedByCurrentThread() || !writeLock.tryLock()) {
            throw new NegativeAccessException("Cannot close " + this + " while its pixels are in use");
        }
        try {
            pixels = null;
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public String toString() {
        return "Negative{" + width + "x" + height + ", " + channelOrder + (isClosed() ? ", closed" : "") + "}";
    }
}
