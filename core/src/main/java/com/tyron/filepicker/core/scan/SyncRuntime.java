package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.scan.ScanRequest;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Reads the whole directory inside {@link #request(ScanRequest)} and queues a single
 * {@code COMPLETE} (or {@code ERROR}) batch.
 */
public final class SyncRuntime implements ScanRuntime {

    private final FileSystem fs;
    private final Deque<ScanBatch> ready = new ArrayDeque<>(1);

    public SyncRuntime(FileSystem fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    @Override
    public void request(ScanRequest request) {
        Objects.requireNonNull(request, "request");
        ready.clear();
        try {
            List<FsEntry> entries = fs.readDir(request.directory());
            ready.add(ScanBatch.complete(request.generation(), entries));
        } catch (IOException e) {
            ready.add(ScanBatch.error(request.generation(), ScanErrors.describe(request.directory(), e)));
        }
    }

    @Override
    public @Nullable ScanBatch pollBatch() {
        return ready.poll();
    }

    @Override
    public void cancelGeneration(long generation) {
        // Nothing is ever in flight.
    }

    @Override
    public void close() {
        ready.clear();
    }
}
