package com.tyron.filepicker.api.scan;

import java.util.Objects;

/**
 * How a directory listing is produced. Configuration, not runtime state.
 *
 * @param batchSize          maximum entries per {@link ScanBatch.Kind#ENTRIES} batch (ignored for {@link Kind#SYNC})
 * @param maxBatchesPerTick  maximum batches applied per tick (ignored for {@link Kind#SYNC})
 */
public record ScanPolicy(Kind kind, int batchSize, int maxBatchesPerTick) {

    public static final int DEFAULT_BATCH_SIZE = 512;
    public static final int DEFAULT_MAX_BATCHES_PER_TICK = 4;

    public enum Kind {
        /** Whole directory read inside the request call. */
        SYNC,
        /** Cooperative chunked reads on the polling thread. */
        INCREMENTAL,
        /** Enumeration on a background worker thread. */
        BACKGROUND
    }

    public ScanPolicy {
        Objects.requireNonNull(kind, "kind");
        if (kind != Kind.SYNC) {
            if (batchSize <= 0) {
                throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
            }
            if (maxBatchesPerTick <= 0) {
                throw new IllegalArgumentException("maxBatchesPerTick must be positive: " + maxBatchesPerTick);
            }
        }
    }

    public static ScanPolicy sync() {
        return new ScanPolicy(Kind.SYNC, 0, 0);
    }

    public static ScanPolicy incremental(int batchSize, int maxBatchesPerTick) {
        return new ScanPolicy(Kind.INCREMENTAL, batchSize, maxBatchesPerTick);
    }

    public static ScanPolicy incremental() {
        return incremental(DEFAULT_BATCH_SIZE, DEFAULT_MAX_BATCHES_PER_TICK);
    }

    public static ScanPolicy background(int batchSize, int maxBatchesPerTick) {
        return new ScanPolicy(Kind.BACKGROUND, batchSize, maxBatchesPerTick);
    }

    public static ScanPolicy background() {
        return background(DEFAULT_BATCH_SIZE, DEFAULT_MAX_BATCHES_PER_TICK);
    }
}
