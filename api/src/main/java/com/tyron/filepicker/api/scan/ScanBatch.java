package com.tyron.filepicker.api.scan;

import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A unit of scan output tagged with the generation that produced it.
 * <p>
 * A scan emits {@code BEGIN}, zero or more {@code ENTRIES}, then either {@code COMPLETE}
 * (which may carry trailing entries) or {@code ERROR}. A synchronous scan is a single
 * {@code COMPLETE} batch carrying every entry.
 */
public record ScanBatch(long generation, Kind kind, List<FsEntry> entries, @Nullable String message) {

    public enum Kind {
        BEGIN,
        ENTRIES,
        COMPLETE,
        ERROR
    }

    public ScanBatch {
        Objects.requireNonNull(kind, "kind");
        entries = List.copyOf(entries);
        if (kind == Kind.ERROR) {
            Objects.requireNonNull(message, "message");
        }
    }

    public static ScanBatch begin(long generation) {
        return new ScanBatch(generation, Kind.BEGIN, List.of(), null);
    }

    public static ScanBatch entries(long generation, List<FsEntry> entries) {
        return new ScanBatch(generation, Kind.ENTRIES, entries, null);
    }

    public static ScanBatch complete(long generation, List<FsEntry> trailing) {
        return new ScanBatch(generation, Kind.COMPLETE, trailing, null);
    }

    public static ScanBatch error(long generation, String message) {
        return new ScanBatch(generation, Kind.ERROR, List.of(), message);
    }
}
