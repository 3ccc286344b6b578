package com.tyron.filepicker.api.vfs;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forward-only reader over the children of one directory.
 */
public interface DirectoryCursor extends Closeable {

    /**
     * Reads up to {@code max} further entries.
     *
     * @return the next chunk; an empty list once the directory is exhausted
     */
    List<FsEntry> next(int max) throws IOException;

    @Override
    void close() throws IOException;

    /**
     * Cursor over an already materialized listing.
     */
    static DirectoryCursor of(List<FsEntry> entries) {
        Objects.requireNonNull(entries, "entries");
        List<FsEntry> copy = List.copyOf(entries);
        return new DirectoryCursor() {
            private int position;

            @Override
            public List<FsEntry> next(int max) {
                if (max <= 0) {
                    throw new IllegalArgumentException("max must be positive: " + max);
                }
                int end = Math.min(copy.size(), position + max);
                List<FsEntry> out = new ArrayList<>(copy.subList(position, end));
                position = end;
                return out;
            }

            @Override
            public void close() {
                position = copy.size();
            }
        };
    }
}
