package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.scan.ScanRequest;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.vfs.DirectoryCursor;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Enumerates directories on a single daemon worker thread.
 * <p>
 * Batches are handed over through a concurrent queue and polled by the owner thread.
 * Cancellation is best-effort: the worker checks the latest requested generation between
 * chunks, so superseded batches may still be delivered and must be filtered by the consumer.
 */
public final class WorkerRuntime implements ScanRuntime {

    private static final Logger LOG = Logger.getLogger(WorkerRuntime.class.getName());

    private static final AtomicInteger THREAD_IDS = new AtomicInteger();
    private static final long CANCELLED = -1L;

    private final FileSystem fs;
    private final int batchSize;
    private final ExecutorService executor;
    private final ConcurrentLinkedQueue<ScanBatch> queue = new ConcurrentLinkedQueue<>();
    private final AtomicLong activeGeneration = new AtomicLong(CANCELLED);

    public WorkerRuntime(FileSystem fs, int batchSize) {
        this.fs = Objects.requireNonNull(fs, "fs");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
        this.executor = Executors.newSingleThreadExecutor(daemonThreads());
    }

    private static ThreadFactory daemonThreads() {
        return r -> {
            Thread t = new Thread(r, "ScanWorker-" + THREAD_IDS.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void request(ScanRequest request) {
        Objects.requireNonNull(request, "request");
        activeGeneration.set(request.generation());
        try {
            executor.execute(() -> scan(request));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("worker runtime is closed", e);
        }
    }

    private void scan(ScanRequest request) {
        long gen = request.generation();
        // If a newer request exists, skip real work.
        if (activeGeneration.get() != gen) {
            return;
        }
        queue.add(ScanBatch.begin(gen));
        try (DirectoryCursor cursor = fs.openDir(request.directory())) {
            while (true) {
                if (activeGeneration.get() != gen) {
                    if (LOG.isLoggable(Level.FINE)) {
                        LOG.fine("generation " + gen + " superseded, stop enumerating " + request.directory());
                    }
                    return;
                }
                List<FsEntry> chunk = cursor.next(batchSize);
                if (chunk.isEmpty()) {
                    break;
                }
                queue.add(ScanBatch.entries(gen, chunk));
            }
            queue.add(ScanBatch.complete(gen, List.of()));
        } catch (IOException e) {
            queue.add(ScanBatch.error(gen, ScanErrors.describe(request.directory(), e)));
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "scan of " + request.directory() + " crashed", e);
            queue.add(ScanBatch.error(gen, "scan failed: " + e));
        }
    }

    @Override
    public @Nullable ScanBatch pollBatch() {
        return queue.poll();
    }

    @Override
    public void cancelGeneration(long generation) {
        activeGeneration.compareAndSet(generation, CANCELLED);
    }

    /**
     * Waits until previously requested scans have finished producing batches.
     */
    public boolean awaitIdle(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            executor.submit(() -> { }).get(timeout, unit);
            return true;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            return false;
        }
    }

    @Override
    public void close() {
        activeGeneration.set(CANCELLED);
        executor.shutdownNow();
        queue.clear();
    }
}
