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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Cooperative runtime: every {@link #pollBatch()} performs at most one bounded read on the
 * caller's thread. No thread is owned.
 */
public final class IncrementalRuntime implements ScanRuntime {

    private static final Logger LOG = Logger.getLogger(IncrementalRuntime.class.getName());

    private enum Phase {
        OPEN,
        READ
    }

    private final FileSystem fs;
    private final int batchSize;

    private @Nullable ScanRequest active;
    private @Nullable DirectoryCursor cursor;
    private Phase phase = Phase.OPEN;

    public IncrementalRuntime(FileSystem fs, int batchSize) {
        this.fs = Objects.requireNonNull(fs, "fs");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.batchSize = batchSize;
    }

    @Override
    public void request(ScanRequest request) {
        Objects.requireNonNull(request, "request");
        finish();
        active = request;
        phase = Phase.OPEN;
    }

    @Override
    public @Nullable ScanBatch pollBatch() {
        ScanRequest request = active;
        if (request == null) {
            return null;
        }
        long gen = request.generation();
        try {
            if (phase == Phase.OPEN) {
                cursor = fs.openDir(request.directory());
                phase = Phase.READ;
                return ScanBatch.begin(gen);
            }
            List<FsEntry> chunk = Objects.requireNonNull(cursor).next(batchSize);
            if (chunk.isEmpty()) {
                finish();
                return ScanBatch.complete(gen, List.of());
            }
            return ScanBatch.entries(gen, chunk);
        } catch (IOException e) {
            finish();
            return ScanBatch.error(gen, ScanErrors.describe(request.directory(), e));
        }
    }

    @Override
    public void cancelGeneration(long generation) {
        if (active != null && active.generation() == generation) {
            finish();
        }
    }

    @Override
    public void close() {
        finish();
    }

    private void finish() {
        active = null;
        DirectoryCursor c = cursor;
        cursor = null;
        if (c != null) {
            try {
                c.close();
            } catch (IOException e) {
                LOG.log(Level.FINE, "failed to close directory cursor", e);
            }
        }
    }
}
