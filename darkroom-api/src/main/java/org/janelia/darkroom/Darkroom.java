package org.janelia.darkroom;

import java.awt.Color;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import org.janelia.darkroom.filters.BlackAndWhiteMode;
import org.janelia.darkroom.filters.Filter;
import org.janelia.darkroom.filters.FilterRecipes;
import org.janelia.darkroom.image.HexColor;
import org.janelia.darkroom.image.Negative;
import org.janelia.darkroom.wash.WashEngine;
import org.janelia.darkroom.wash.WashExecutors;
import org.janelia.darkroom.wash.WashParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A filtering session for one image.
 * <p>
 * The session keeps the original negative untouched and works on a copy of it. Filters are
 * queued with the chainable builder methods and nothing is computed until {@link #wash()}
 * runs the whole sequence over every pixel of the working copy:
 * <pre>
 * try (Darkroom darkroom = new Darkroom(negative)) {
 *     Negative print = darkroom.contrast(20).sepia().tint("#FF8800").wash();
 * }
 * </pre>
 * Builder methods validate their value immediately; an invalid value throws
 * {@link org.janelia.darkroom.filters.InvalidFilterValueException} and nothing is queued.
 */
public final class Darkroom implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(Darkroom.class);

    private final UUID sessionId = UUID.randomUUID();
    private final Negative original;
    private final List<Filter> filters = new ArrayList<>();
    private final WashEngine washEngine;
    private final ExecutorService washExecutor;
    private final ExecutorService asyncExecutor;
    private final boolean ownsWashExecutor;
    private Negative working;
    private int activeWashes;
    private volatile boolean disposed;

    public Darkroom(Negative original) {
        this(original, WashParams.fromSystemProperties());
    }

    public Darkroom(Negative original, WashParams washParams) {
        this(original, WashExecutors.createWashExecutor(washParams), washParams, true);
    }

    /**
     * @param original     source image; the session never modifies it and does not close it
     * @param washExecutor pool used for processing rows; the caller remains responsible for shutting it down
     * @param washParams   wash settings
     */
    public Darkroom(Negative original, ExecutorService washExecutor, WashParams washParams) {
        this(original, washExecutor, washParams, false);
    }

    private Darkroom(Negative original, ExecutorService washExecutor, WashParams washParams, boolean ownsWashExecutor) {
        this.original = Preconditions.checkNotNull(original, "Original negative is required");
        this.washExecutor = Preconditions.checkNotNull(washExecutor, "Wash executor is required");
        this.washEngine = new WashEngine(washExecutor, washParams);
        this.ownsWashExecutor = ownsWashExecutor;
        this.asyncExecutor = WashExecutors.createAsyncExecutor();
        this.working = original.copy();
        LOG.debug("Created darkroom {} for {} with {}", sessionId, original, washParams);
    }

    public Darkroom blackAndWhite() {
        checkNotDisposed();
        return append(Filter.blackAndWhite());
    }

    public Darkroom blackAndWhite(BlackAndWhiteMode mode) {
        checkNotDisposed();
        return append(Filter.blackAndWhite(mode));
    }

    public Darkroom invert() {
        checkNotDisposed();
        return append(Filter.invert());
    }

    /**
     * @param value contrast in [-100, 100]
     */
    public Darkroom contrast(double value) {
        checkNotDisposed();
        return append(Filter.contrast(value));
    }

    /**
     * @param value brightness in [-100, 100]
     */
    public Darkroom brightness(double value) {
        checkNotDisposed();
        return append(Filter.brightness(value));
    }

    /**
     * @param value saturation change in [-100, 100]; -100 removes all color
     */
    public Darkroom saturation(double value) {
        checkNotDisposed();
        return append(Filter.saturation(value));
    }

    /**
     * @param value vibrance in [-100, 100]
     */
    public Darkroom vibrance(double value) {
        checkNotDisposed();
        return append(Filter.vibrance(value));
    }

    /**
     * @param value gamma, must be positive; it is clamped to [0.1, 10]
     */
    public Darkroom gamma(double value) {
        checkNotDisposed();
        return append(Filter.gamma(value));
    }

    /**
     * @param value noise amount in [0, 100]
     */
    public Darkroom noise(double value) {
        checkNotDisposed();
        return append(Filter.noise(value));
    }

    public Darkroom noise(double value, long seed) {
        checkNotDisposed();
        return append(Filter.noise(value, seed));
    }

    public Darkroom sepia() {
        checkNotDisposed();
        return append(Filter.sepia());
    }

    /**
     * @param value sepia amount in [0, 100]
     */
    public Darkroom sepia(double value) {
        checkNotDisposed();
        return append(Filter.sepia(value));
    }

    /**
     * @param value hue rotation in degrees; any finite value, wrapped modulo 360
     */
    public Darkroom hue(double value) {
        checkNotDisposed();
        return append(Filter.hue(value));
    }

    /**
     * @param hex tint color as #RRGGBB
     */
    public Darkroom tint(String hex) {
        checkNotDisposed();
        return append(Filter.tint(hex));
    }

    public Darkroom tint(int red, int green, int blue) {
        checkNotDisposed();
        return append(Filter.tint(red, green, blue));
    }

    public Darkroom tint(Color color) {
        checkNotDisposed();
        return append(Filter.tint(color));
    }

    public Darkroom tint(HexColor color) {
        checkNotDisposed();
        return append(Filter.tint(color));
    }

    /**
     * @param strength blend strength in [0, 100]
     */
    public Darkroom tint(HexColor color, double strength) {
        checkNotDisposed();
        return append(Filter.tint(color, strength));
    }

    /**
     * Queue a list of pre-built filters, keeping their order.
     */
    public Darkroom batch(List<Filter> batchFilters) {
        checkNotDisposed();
        Preconditions.checkNotNull(batchFilters, "Filters list is required");
        List<Filter> toAppend = ImmutableList.copyOf(batchFilters); // rejects null elements
        synchronized (this) {
            checkNotDisposed();
            filters.addAll(toAppend);
        }
        LOG.debug("Queued {} filters on darkroom {}", toAppend.size(), sessionId);
        return this;
    }

    /**
     * Queue all filters of a JSON recipe.
     */
    public Darkroom batch(InputStream recipe) {
        checkNotDisposed();
        return batch(FilterRecipes.read(recipe));
    }

    private synchronized Darkroom append(Filter filter) {
        checkNotDisposed();
        filters.add(filter);
        LOG.debug("Queued {} on darkroom {}", filter, sessionId);
        return this;
    }

    /**
     * @return the queued filters in the order in which they will be applied
     */
    public synchronized List<Filter> getFilters() {
        checkNotDisposed();
        return ImmutableList.copyOf(filters);
    }

    public Negative getOriginal() {
        checkNotDisposed();
        return original;
    }

    synchronized Negative getWorking() {
        checkNotDisposed();
        return working;
    }

    public Negative wash() {
        return wash(true);
    }

    /**
     * Apply all queued filters to the working copy.
     *
     * @param resetImage if true the washed negative is handed over to the caller and the session
     *                   starts over from a fresh copy of the original with no filters; if false the
     *                   session keeps the washed negative as the base of the next wash and keeps the filters
     * @return the washed negative
     * @throws DarkroomDisposedException if the session was closed before or during the wash
     */
    public Negative wash(boolean resetImage) {
        Negative target;
        List<Filter> snapshot;
        synchronized (this) {
            checkNotDisposed();
            target = working;
            snapshot = ImmutableList.copyOf(filters);
            activeWashes++;
        }
        try {
            washEngine.wash(target, snapshot);
        } finally {
            synchronized (this) {
                activeWashes--;
                if (disposed) {
                    releaseWorkingIfIdle();
                }
            }
        }
        synchronized (this) {
            checkNotDisposed();
            if (resetImage) {
                reset();
            }
            return target;
        }
    }

    public CompletableFuture<Negative> washAsync() {
        return washAsync(true);
    }

    /**
     * Same as {@link #wash(boolean)} but run in the background.
     */
    public CompletableFuture<Negative> washAsync(boolean resetImage) {
        checkNotDisposed();
        return CompletableFuture.supplyAsync(() -> wash(resetImage), asyncExecutor);
    }

    /**
     * Drop all queued filters and replace the working copy with a fresh copy of the original.
     */
    public synchronized Darkroom reset() {
        checkNotDisposed();
        filters.clear();
        working = original.copy();
        LOG.debug("Reset darkroom {}", sessionId);
        return this;
    }

    public boolean isDisposed() {
        return disposed;
    }

    /**
     * Release the working copy and the session's executors. The original negative is not closed.
     * If a wash is still running the working copy is released when that wash ends, and the wash
     * fails with {@link DarkroomDisposedException}.
     */
    @Override
    public synchronized void close() {
        if (disposed) {
            return;
        }
        disposed = true;
        filters.clear();
        asyncExecutor.shutdown();
        if (ownsWashExecutor) {
            washExecutor.shutdown();
        }
        LOG.debug("Closed darkroom {}", sessionId);
        releaseWorkingIfIdle();
    }

    private void releaseWorkingIfIdle() {
        if (activeWashes > 0) {
            LOG.debug("Darkroom {} still has {} washes running - working copy will be released when they end",
                    sessionId, activeWashes);
        } else if (!working.isClosed()) {
            working.close();
        }
    }

    private void checkNotDisposed() {
        if (disposed) {
            throw new DarkroomDisposedException("Darkroom " + sessionId + " was closed");
        }
    }
}
