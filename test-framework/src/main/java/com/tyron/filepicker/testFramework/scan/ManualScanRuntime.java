package com.tyron.filepicker.testFramework.scan;

import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.scan.ScanRequest;
import com.tyron.filepicker.api.scan.ScanRuntime;
import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * {@link ScanRuntime} whose batches are pushed by the test.
 * <p>
 * Requests and cancellations are only recorded; nothing is read from a filesystem. Tests use
 * this to deliver batches late, out of band, or for superseded generations.
 */
public class ManualScanRuntime implements ScanRuntime {

    private final List<ScanRequest> requests = new ArrayList<>();
    private final List<Long> cancelled = new ArrayList<>();
    private final Deque<ScanBatch> queue = new ArrayDeque<>();
    private boolean closed;

    @Override
    public void request(ScanRequest request) {
        requests.add(request);
    }

    @Override
    public @Nullable ScanBatch pollBatch() {
        return queue.pollFirst();
    }

    @Override
    public void cancelGeneration(long generation) {
        cancelled.add(generation);
    }

    @Override
    public void close() {
        closed = true;
        queue.clear();
    }

    // --- Helpers for tests ---

    public ManualScanRuntime emit(ScanBatch batch) {
        queue.addLast(batch);
        return this;
    }

    public ManualScanRuntime emitBegin(long generation) {
        return emit(ScanBatch.begin(generation));
    }

    public ManualScanRuntime emitEntries(long generation, List<FsEntry> entries) {
        return emit(ScanBatch.entries(generation, entries));
    }

    public ManualScanRuntime emitComplete(long generation, List<FsEntry> trailing) {
        return emit(ScanBatch.complete(generation, trailing));
    }

    public ManualScanRuntime emitError(long generation, String message) {
        return emit(ScanBatch.error(generation, message));
    }

    public List<ScanRequest> getRequests() {
        return List.copyOf(requests);
    }

    public ScanRequest lastRequest() {
        if (requests.isEmpty()) {
            throw new IllegalStateException("no scan was requested");
        }
        return requests.get(requests.size() - 1);
    }

    public List<Long> getCancelledGenerations() {
        return List.copyOf(cancelled);
    }

    public int pendingBatches() {
        return queue.size();
    }

    public boolean isClosed() {
        return closed;
    }
}
