package com.tyron.filepicker.core.vfs;

import com.tyron.filepicker.api.vfs.ExistingTargetPolicy;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.api.vfs.FsEntry;
import com.tyron.filepicker.api.vfs.FsMetadata;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * High-level file operations on top of a {@link FileSystem}: create, rename, delete, copy and move.
 */
public final class FileOperations {

    private static final Logger LOG = Logger.getLogger(FileOperations.class.getName());

    static final int MAX_COPY_SUFFIX = 10_000;

    public enum PasteMode {
        COPY,
        MOVE
    }

    /**
     * @param created paths written by the paste
     * @param skipped sources left alone because of {@link ExistingTargetPolicy#SKIP}
     */
    public record PasteResult(List<Path> created, List<Path> skipped) {
        public PasteResult {
            created = List.copyOf(created);
            skipped = List.copyOf(skipped);
        }
    }

    private final FileSystem fs;

    public FileOperations(FileSystem fs) {
        this.fs = Objects.requireNonNull(fs, "fs");
    }

    public FileSystem getFileSystem() {
        return fs;
    }

    /**
     * @return null if the name is usable for a new child, otherwise the reason it is not
     */
    public static String validateChildName(String name) {
        if (name == null || name.isBlank()) {
            return "name is empty";
        }
        name = name.trim();
        if (name.equals(".") || name.equals("..")) {
            return "invalid name: " + name;
        }
        if (name.indexOf('/') >= 0 || name.indexOf('\\') >= 0) {
            return "name must not contain path separators";
        }
        if (name.indexOf('\0') >= 0) {
            return "name must not contain NUL";
        }
        return null;
    }

    public Path createFolder(Path parent, String name) throws IOException {
        String trimmed = requireValidName(name);
        Path target = parent.resolve(trimmed);
        if (fs.exists(target)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        fs.createDir(target);
        return target;
    }

    /**
     * Renames an entry within its own directory.
     */
    public Path rename(Path from, String newName) throws IOException {
        String trimmed = requireValidName(newName);
        Path to = from.resolveSibling(trimmed);
        if (to.equals(from)) {
            return from;
        }
        if (fs.exists(to)) {
            throw new FileAlreadyExistsException(to.toString());
        }
        fs.rename(from, to);
        return to;
    }

    public void delete(List<Path> paths, boolean recursive) throws IOException {
        for (Path p : paths) {
            FsMetadata meta = fs.metadata(p);
            if (meta.directory() && !meta.symlink()) {
                if (recursive) {
                    fs.removeDirAll(p);
                } else {
                    fs.removeDir(p);
                }
            } else {
                fs.removeFile(p);
            }
        }
    }

    /**
     * Copies a file, or a directory with everything below it, to {@code to}.
     */
    public void copyTree(Path from, Path to) throws IOException {
        FsMetadata meta = fs.metadata(from);
        if (!meta.directory()) {
            fs.copyFile(from, to);
            return;
        }
        if (to.startsWith(from)) {
            throw new IOException("cannot copy " + from + " into itself");
        }
        fs.createDir(to);
        for (FsEntry child : fs.readDir(from)) {
            copyTree(child.getPath(), to.resolve(child.getName()));
        }
    }

    /**
     * Moves by rename when possible, otherwise copies and deletes the source.
     */
    public void moveTree(Path from, Path to) throws IOException {
        try {
            fs.rename(from, to);
            return;
        } catch (FileAlreadyExistsException | NoSuchFileException e) {
            throw e;
        } catch (IOException renameFailed) {
            if (LOG.isLoggable(Level.FINE)) {
                LOG.fine("rename " + from + " -> " + to + " failed (" + renameFailed + "), copying instead");
            }
        }
        copyTree(from, to);
        if (fs.metadata(from).directory()) {
            fs.removeDirAll(from);
        } else {
            fs.removeFile(from);
        }
    }

    /**
     * Returns {@code desired} if it is free in {@code dir}, otherwise the first free
     * "name (copy).ext", "name (copy 2).ext", ... keeping multi-part extensions intact.
     */
    public String uniqueChildName(Path dir, String desired) throws IOException {
        if (!fs.exists(dir.resolve(desired))) {
            return desired;
        }
        String[] parts = splitBaseAndFullExtension(desired);
        for (int i = 1; i <= MAX_COPY_SUFFIX; i++) {
            String suffix = i == 1 ? " (copy)" : " (copy " + i + ")";
            String candidate = parts[0] + suffix + parts[1];
            if (!fs.exists(dir.resolve(candidate))) {
                return candidate;
            }
        }
        throw new FileAlreadyExistsException(dir.resolve(desired).toString(), null, "failed to find a free target name");
    }

    /**
     * "a.tar.gz" -> ["a", ".tar.gz"]; ".bashrc" -> [".bashrc", ""]; ".env.local" -> [".env", ".local"].
     */
    static String[] splitBaseAndFullExtension(String name) {
        int dot = name.indexOf('.', 1);
        if (dot < 0) {
            return new String[]{name, ""};
        }
        return new String[]{name.substring(0, dot), name.substring(dot)};
    }

    public PasteResult paste(List<Path> sources, Path destDir, PasteMode mode, ExistingTargetPolicy policy) throws IOException {
        Objects.requireNonNull(destDir, "destDir");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(policy, "policy");

        List<Path> created = new ArrayList<>();
        List<Path> skipped = new ArrayList<>();
        for (Path src : sources) {
            Path fileName = src.getFileName();
            if (fileName == null) {
                throw new IOException("cannot paste a root: " + src);
            }
            if (destDir.startsWith(src)) {
                throw new IOException("cannot paste a folder into itself: " + src);
            }

            Path target = destDir.resolve(fileName.toString());
            if (target.equals(src)) {
                if (mode == PasteMode.MOVE) {
                    skipped.add(src);
                    continue;
                }
                target = destDir.resolve(uniqueChildName(destDir, fileName.toString()));
            } else if (fs.exists(target)) {
                switch (policy) {
                    case SKIP -> {
                        skipped.add(src);
                        continue;
                    }
                    case OVERWRITE -> {
                        if (fs.metadata(target).directory()) {
                            fs.removeDirAll(target);
                        } else {
                            fs.removeFile(target);
                        }
                    }
                    case KEEP_BOTH -> target = destDir.resolve(uniqueChildName(destDir, fileName.toString()));
                }
            }

            if (mode == PasteMode.COPY) {
                copyTree(src, target);
            } else {
                moveTree(src, target);
            }
            created.add(target);
        }

        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(mode + " into " + destDir + ": created=" + created.size() + " skipped=" + skipped.size());
        }
        return new PasteResult(created, skipped);
    }

    private static String requireValidName(String name) throws IOException {
        String error = validateChildName(name);
        if (error != null) {
            throw new IOException(error);
        }
        return name.trim();
    }
}
