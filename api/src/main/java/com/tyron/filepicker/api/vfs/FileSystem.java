package com.tyron.filepicker.api.vfs;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * Storage backend seen by the dialog engine (local disk, in-memory, remote...).
 * <p>
 * Implementations are stateless request handlers and may be shared between dialogs.
 * Paths are always absolute.
 */
public interface FileSystem {

    /**
     * Lists the direct children of a directory. Unreadable children are skipped.
     */
    List<FsEntry> readDir(Path dir) throws IOException;

    /**
     * Opens a cursor over the children of a directory so callers can read them in chunks.
     * <p>
     * The default implementation lists the directory eagerly.
     */
    default DirectoryCursor openDir(Path dir) throws IOException {
        return DirectoryCursor.of(readDir(dir));
    }

    /**
     * Best-effort absolute normalization (symlinks resolved where supported).
     */
    Path canonicalize(Path path) throws IOException;

    /**
     * @throws NoSuchFileException if nothing exists at {@code path}
     */
    FsMetadata metadata(Path path) throws IOException;

    /**
     * @return true if {@link #metadata(Path)} succeeds for this path.
     */
    default boolean exists(Path path) {
        try {
            metadata(path);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    void createDir(Path path) throws IOException;

    void rename(Path from, Path to) throws IOException;

    void removeFile(Path path) throws IOException;

    /**
     * Removes an empty directory.
     */
    void removeDir(Path path) throws IOException;

    /**
     * Removes a directory and everything below it.
     */
    void removeDirAll(Path path) throws IOException;

    /**
     * @return number of bytes copied
     */
    long copyFile(Path from, Path to) throws IOException;
}
