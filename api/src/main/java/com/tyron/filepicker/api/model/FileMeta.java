package com.tyron.filepicker.api.model;

import com.tyron.filepicker.api.vfs.FsEntry;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable entry metadata held by a snapshot, with lower-cased tokens for matching.
 */
public final class FileMeta {

    private final EntryId id;
    private final Path path;
    private final String name;
    private final boolean directory;
    private final boolean symlink;
    private final long size;
    private final long lastModified;

    private final String nameLower;
    private final String extension;
    private final String fullExtension;

    public FileMeta(EntryId id, Path path, String name, boolean directory, boolean symlink, long size, long lastModified) {
        this.id = Objects.requireNonNull(id, "id");
        this.path = Objects.requireNonNull(path, "path");
        this.name = Objects.requireNonNull(name, "name");
        this.directory = directory;
        this.symlink = symlink;
        this.size = size;
        this.lastModified = lastModified;

        this.nameLower = name.toLowerCase(Locale.ROOT);
        this.extension = directory ? "" : lastExtension(nameLower);
        this.fullExtension = directory ? "" : fullExtension(nameLower);
    }

    public static FileMeta of(EntryId id, FsEntry entry) {
        return new FileMeta(id, entry.getPath(), entry.getName(), entry.isDirectory(), entry.isSymlink(),
                entry.getSize(), entry.getLastModified());
    }

    /**
     * "archive.tar.gz" -> "gz"; ".bashrc" -> "".
     */
    static String lastExtension(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1);
    }

    /**
     * "archive.tar.gz" -> "tar.gz"; ".config.yaml" -> "yaml".
     */
    static String fullExtension(String name) {
        int dot = name.indexOf('.', 1);
        if (dot < 0 || dot == name.length() - 1) {
            return "";
        }
        return name.substring(dot + 1);
    }

    public EntryId getId() {
        return id;
    }

    public Path getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public boolean isDirectory() {
        return directory;
    }

    public boolean isSymlink() {
        return symlink;
    }

    /**
     * @return byte length, or -1 when unknown or for directories
     */
    public long getSize() {
        return size;
    }

    public long getLastModified() {
        return lastModified;
    }

    public String getNameLower() {
        return nameLower;
    }

    /**
     * Last extension, lower-case, without the dot. Empty for directories and names without one.
     */
    public String getExtension() {
        return extension;
    }

    /**
     * Everything after the first non-leading dot, lower-case ("tar.gz").
     */
    public String getFullExtension() {
        return fullExtension;
    }

    public boolean isHidden() {
        return name.startsWith(".");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FileMeta that)) return false;
        return directory == that.directory
                && symlink == that.symlink
                && size == that.size
                && lastModified == that.lastModified
                && id.equals(that.id)
                && path.equals(that.path)
                && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, path, name, directory, symlink, size, lastModified);
    }

    @Override
    public String toString() {
        return "FileMeta{" + id + " '" + name + "'" + (directory ? " dir" : "") + '}';
    }
}
