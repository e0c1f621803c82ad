package org.janelia.darkroom.wash;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;

import net.imglib2.parallel.TaskExecutor;
import net.imglib2.parallel.TaskExecutors;
import org.janelia.darkroom.filters.Filter;
import org.janelia.darkroom.filters.FilterType;
import org.janelia.darkroom.filters.PixelTransforms;
import org.janelia.darkroom.image.ChannelOrder;
import org.janelia.darkroom.image.Negative;
import org.janelia.darkroom.image.NegativePixels;
import org.janelia.darkroom.image.PixelColor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies a filter sequence to every pixel of a negative. Rows are split in contiguous ranges
 * that are processed independently; every pixel goes through all filters in sequence order.
 * <p>
 * A wash reads the locked pixel buffer and writes into a scratch buffer that replaces the
 * negative's content only after all row ranges completed, so a failed wash leaves the
 * negative untouched.
 */
public class WashEngine {

    private static final Logger LOG = LoggerFactory.getLogger(WashEngine.class);

    static class RowRange {
        final int startRow; // inclusive
        final int endRow; // exclusive

        RowRange(int startRow, int endRow) {
            this.startRow = startRow;
            this.endRow = endRow;
        }

        @Override
        public String toString() {
            return "[" + startRow + ", " + endRow + ")";
        }
    }

    @Nullable
    private final ExecutorService executorService;
    private final WashParams washParams;

    /**
     * @param executorService pool that runs the row ranges; if null all rows are processed on the calling thread
     * @param washParams      wash settings
     */
    public WashEngine(@Nullable ExecutorService executorService, WashParams washParams) {
        this.executorService = executorService;
        this.washParams = washParams;
    }

    public static WashEngine singleThreaded() {
        return new WashEngine(null, new WashParams().setParam(WashParams.WASH_CONCURRENCY, 1));
    }

    /**
     * Wash the negative in place.
     *
     * @param negative negative to be modified
     * @param filters  filter sequence - a snapshot is taken before any pixel is touched
     * @throws WashException if processing any of the rows failed
     */
    public void wash(Negative negative, List<Filter> filters) {
        List<Filter> snapshot = ImmutableList.copyOf(filters);
        long startTime = System.currentTimeMillis();
        logSkippedFilters(snapshot);
        try (NegativePixels pixels = negative.lockPixels()) {
            if (snapshot.isEmpty()) {
                LOG.debug("No filters to apply to {}", negative);
                return;
            }
            byte[] source = pixels.getBuffer();
            byte[] target = new byte[source.length];
            List<RowRange> rowRanges = splitRows(pixels.getHeight());
            LOG.info("Wash {} with {} filters using {} tasks", negative, snapshot.size(), rowRanges.size());
            TaskExecutor taskExecutor = createTaskExecutor(rowRanges.size());
            try {
                taskExecutor.forEach(rowRanges, rowRange -> washRows(
                        source,
                        target,
                        rowRange,
                        pixels.getWidth(),
                        pixels.getStride(),
                        pixels.getChannelOrder(),
                        snapshot));
            } catch (RuntimeException e) {
                throw new WashException("Error washing " + negative + " - no pixel was changed", e);
            }
            pixels.commit(target);
        }
        LOG.info("Finished washing {} with {} filters in {}s",
                negative, snapshot.size(), (System.currentTimeMillis() - startTime) / 1000.);
    }

    private TaskExecutor createTaskExecutor(int nTasks) {
        if (executorService == null || nTasks == 1) {
            return TaskExecutors.singleThreaded();
        } else {
            return TaskExecutors.forExecutorServiceAndNumTasks(executorService, nTasks);
        }
    }

    List<RowRange> splitRows(int height) {
        int rowsPerTask = washParams.getRowsPerTask();
        if (rowsPerTask == 0) {
            int nTasks = Math.min(height, executorService == null ? 1 : washParams.getWashConcurrency());
            rowsPerTask = (height + nTasks - 1) / nTasks;
        }
        List<RowRange> rowRanges = new ArrayList<>();
        for (int startRow = 0; startRow < height; startRow += rowsPerTask) {
            rowRanges.add(new RowRange(startRow, Math.min(height, startRow + rowsPerTask)));
        }
        return rowRanges;
    }

    private void washRows(byte[] source,
                          byte[] target,
                          RowRange rowRange,
                          int width,
                          int stride,
                          ChannelOrder channelOrder,
                          List<Filter> filters) {
        LOG.debug("Wash rows {}", rowRange);
        for (int y = rowRange.startRow; y < rowRange.endRow; y++) {
            int rowOffset = y * stride;
            long rowIndex = (long) y * width;
            for (int x = 0; x < width; x++) {
                int pixelOffset = rowOffset + x * ChannelOrder.BYTES_PER_PIXEL;
                PixelColor pixel = channelOrder.decode(source, pixelOffset);
                PixelColor washedPixel = PixelTransforms.applyAll(pixel, filters, rowIndex + x);
                channelOrder.encode(washedPixel, target, pixelOffset);
            }
        }
    }

    private void logSkippedFilters(List<Filter> filters) {
        Set<Object> unsupportedFilters = filters.stream()
                .filter(f -> !PixelTransforms.isSupported(f.getType()))
                .map(f -> f.getType() == FilterType.UNKNOWN ? f.getRawValue() : f.getType())
                .collect(Collectors.toSet());
        if (!unsupportedFilters.isEmpty()) {
            LOG.warn("Filters {} are not supported and will leave the pixels unchanged", unsupportedFilters);
        }
    }
}
