package com.hwbscan.runner;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed-size pool shared by every batch of a scan. The owner closes it once the
 * scan (or the process) is done.
 */
public final class ScanWorkerPool implements AutoCloseable {
    private static final Logger LOG = LogManager.getLogger(ScanWorkerPool.class);
    private static final long SHUTDOWN_WAIT_SEC = 30L;

    private final int size;
    private final ExecutorService executor;

    public ScanWorkerPool(int size) {
        if (size <= 0) {
            throw new IllegalArgumentException("worker pool size must be > 0, got " + size);
        }
        this.size = size;
        this.executor = Executors.newFixedThreadPool(size);
    }

    public int size() {
        return size;
    }

    ExecutorService executor() {
        return executor;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SEC, TimeUnit.SECONDS)) {
                LOG.warn("scan workers still busy after {}s, forcing shutdown", SHUTDOWN_WAIT_SEC);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
