package com.tyron.filepicker.api.scan;

import com.tyron.filepicker.api.vfs.FsEntry;
import org.jetbrains.annotations.Nullable;

/**
 * Callback applied to every raw entry before it enters a snapshot.
 */
@FunctionalInterface
public interface ScanHook {

    /**
     * @return the entry to keep (possibly rewritten), or null to drop it
     */
    @Nullable
    FsEntry apply(FsEntry entry);
}
