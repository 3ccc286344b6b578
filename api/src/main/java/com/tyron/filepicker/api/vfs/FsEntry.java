package com.tyron.filepicker.api.vfs;

import java.nio.file.Path;
import java.util.Objects;

/**
 * One row of a directory listing as returned by {@link FileSystem#readDir(Path)}.
 */
public final class FsEntry {

    private final String name;
    private final Path path;
    private final boolean directory;
    private final boolean symlink;
    private final long size;
    private final long lastModified;

    /**
     * @param size         byte length, or -1 for directories and when unknown
     * @param lastModified epoch millis, or 0 when unknown
     */
    public FsEntry(String name, Path path, boolean directory, boolean symlink, long size, long lastModified) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = Objects.requireNonNull(path, "path");
        this.directory = directory;
        this.symlink = symlink;
        this.size = directory ? -1 : size;
        this.lastModified = lastModified;
    }

    public static FsEntry file(Path path, long size, long lastModified) {
        return new FsEntry(fileName(path), path, false, false, size, lastModified);
    }

    public static FsEntry directory(Path path, long lastModified) {
        return new FsEntry(fileName(path), path, true, false, -1, lastModified);
    }

    private static String fileName(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    public String getName() {
        return name;
    }

    public Path getPath() {
        return path;
    }

    public boolean isDirectory() {
        return directory;
    }

    public boolean isSymlink() {
        return symlink;
    }

    public long getSize() {
        return size;
    }

    public long getLastModified() {
        return lastModified;
    }

    public FsEntry withName(String newName) {
        return new FsEntry(newName, path, directory, symlink, size, lastModified);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FsEntry that)) return false;
        return directory == that.directory
                && symlink == that.symlink
                && size == that.size
                && lastModified == that.lastModified
                && name.equals(that.name)
                && path.equals(that.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, path, directory, symlink, size, lastModified);
    }

    @Override
    public String toString() {
        return "FsEntry{" +
                "path='" + path + '\'' +
                ", directory=" + directory +
                ", symlink=" + symlink +
                ", size=" + size +
                ", lastModified=" + lastModified +
                '}';
    }
}
