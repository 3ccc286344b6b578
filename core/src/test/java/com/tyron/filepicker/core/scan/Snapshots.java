package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.scan.ScanBatch;
import com.tyron.filepicker.api.vfs.FsEntry;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Builds published snapshots for tests.
 */
public final class Snapshots {

    private Snapshots() {
    }

    public static DirSnapshot of(EntryIdRegistry ids, long generation, Path dir, List<FsEntry> entries) {
        SnapshotStore store = new SnapshotStore(ids);
        store.begin(generation, dir);
        store.apply(ScanBatch.complete(generation, entries));
        return Objects.requireNonNull(store.current());
    }

    public static DirSnapshot of(EntryIdRegistry ids, Path dir, String... names) {
        FsEntry[] entries = new FsEntry[names.length];
        for (int i = 0; i < names.length; i++) {
            entries[i] = entry(dir, names[i]);
        }
        return of(ids, 1, dir, List.of(entries));
    }

    /**
     * Names ending with "/" become directories.
     */
    public static FsEntry entry(Path dir, String name) {
        if (name.endsWith("/")) {
            return FsEntry.directory(dir.resolve(name.substring(0, name.length() - 1)), 0);
        }
        return FsEntry.file(dir.resolve(name), name.length(), 0);
    }
}
