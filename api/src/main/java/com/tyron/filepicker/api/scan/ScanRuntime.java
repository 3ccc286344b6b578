package com.tyron.filepicker.api.scan;

import org.jetbrains.annotations.Nullable;

import java.io.Closeable;

/**
 * Produces {@link ScanBatch}es for {@link ScanRequest}s.
 * <p>
 * A new request supersedes the previous one. Implementations may still deliver batches of
 * superseded generations; consumers must filter by generation.
 */
public interface ScanRuntime extends Closeable {

    void request(ScanRequest request);

    /**
     * @return the next available batch, or null if none is ready right now
     */
    @Nullable
    ScanBatch pollBatch();

    /**
     * Best-effort request to stop work for the given generation.
     */
    void cancelGeneration(long generation);

    @Override
    void close();
}
