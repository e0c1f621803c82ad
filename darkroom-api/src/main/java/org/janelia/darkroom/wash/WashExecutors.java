package org.janelia.darkroom.wash;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class WashExecutors {
    private static final Logger LOG = LoggerFactory.getLogger(WashExecutors.class);

    public static ExecutorService createWashExecutor(WashParams params) {
        int concurrency = params.getWashConcurrency();
        LOG.debug("Create a wash thread pool with {} worker threads ({} available processors)",
                concurrency, Runtime.getRuntime().availableProcessors());
        return Executors.newFixedThreadPool(
                concurrency,
                new ThreadFactoryBuilder()
                        .setNameFormat("DARKROOM-WASH-%d")
                        .setDaemon(true)
                        .build());
    }

    /**
     * Single worker executor for asynchronous washes. It is kept apart from the wash pool
     * because an asynchronous wash blocks until all of its row tasks complete.
     */
    public static ExecutorService createAsyncExecutor() {
        return Executors.newSingleThreadExecutor(
                new ThreadFactoryBuilder()
                        .setNameFormat("DARKROOM-ASYNC-%d")
                        .setDaemon(true)
                        .build());
    }
}
