package com.tyron.filepicker.core.vfs;

import com.tyron.filepicker.api.vfs.DirectoryCursor;
import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.api.vfs.FsEntry;
import com.tyron.filepicker.api.vfs.FsMetadata;

import java.io.IOException;
import java.nio.file.DirectoryIteratorException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link FileSystem} backed by the host operating system through {@code java.nio.file}.
 */
public final class LocalFileSystem implements FileSystem {

    private static final Logger LOG = Logger.getLogger(LocalFileSystem.class.getName());

    private static final LocalFileSystem INSTANCE = new LocalFileSystem();

    public static LocalFileSystem getInstance() {
        return INSTANCE;
    }

    private LocalFileSystem() {
    }

    @Override
    public List<FsEntry> readDir(Path dir) throws IOException {
        try (DirectoryCursor cursor = openDir(dir)) {
            List<FsEntry> out = new ArrayList<>();
            List<FsEntry> chunk;
            while (!(chunk = cursor.next(256)).isEmpty()) {
                out.addAll(chunk);
            }
            return out;
        }
    }

    @Override
    public DirectoryCursor openDir(Path dir) throws IOException {
        Objects.requireNonNull(dir, "dir");
        DirectoryStream<Path> stream = Files.newDirectoryStream(dir);
        Iterator<Path> it = stream.iterator();
        return new DirectoryCursor() {
            @Override
            public List<FsEntry> next(int max) throws IOException {
                List<FsEntry> out = new ArrayList<>(Math.min(max, 256));
                try {
                    while (out.size() < max && it.hasNext()) {
                        FsEntry entry = toEntry(it.next());
                        if (entry != null) {
                            out.add(entry);
                        }
                    }
                } catch (DirectoryIteratorException e) {
                    throw e.getCause();
                }
                return out;
            }

            @Override
            public void close() throws IOException {
                stream.close();
            }
        };
    }

    private static FsEntry toEntry(Path child) {
        String name = String.valueOf(child.getFileName());
        boolean symlink = Files.isSymbolicLink(child);
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(child, BasicFileAttributes.class);
        } catch (IOException followFailed) {
            try {
                // Dangling link: list the link itself.
                attrs = Files.readAttributes(child, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
            } catch (IOException e) {
                if (LOG.isLoggable(Level.FINE)) {
                    LOG.fine("skip unreadable entry " + child + ": " + e);
                }
                return null;
            }
        }
        long size = attrs.isDirectory() ? -1 : attrs.size();
        long modified = attrs.lastModifiedTime() != null ? attrs.lastModifiedTime().toMillis() : 0;
        return new FsEntry(name, child, attrs.isDirectory(), symlink, size, modified);
    }

    @Override
    public Path canonicalize(Path path) throws IOException {
        Path abs = path.toAbsolutePath().normalize();
        try {
            return abs.toRealPath();
        } catch (NoSuchFileException e) {
            throw e;
        } catch (IOException e) {
            return abs;
        }
    }

    @Override
    public FsMetadata metadata(Path path) throws IOException {
        boolean symlink = Files.isSymbolicLink(path);
        BasicFileAttributes attrs;
        try {
            attrs = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (NoSuchFileException e) {
            if (!symlink) throw e;
            attrs = Files.readAttributes(path, BasicFileAttributes.class, LinkOption.NOFOLLOW_LINKS);
        }
        return new FsMetadata(attrs.isDirectory(), symlink);
    }

    @Override
    public boolean exists(Path path) {
        return Files.exists(path, LinkOption.NOFOLLOW_LINKS);
    }

    @Override
    public void createDir(Path path) throws IOException {
        Files.createDirectory(path);
    }

    @Override
    public void rename(Path from, Path to) throws IOException {
        Files.move(from, to);
    }

    @Override
    public void removeFile(Path path) throws IOException {
        if (Files.isDirectory(path, LinkOption.NOFOLLOW_LINKS)) {
            throw new IOException("is a directory: " + path);
        }
        Files.delete(path);
    }

    @Override
    public void removeDir(Path path) throws IOException {
        Files.delete(path);
    }

    @Override
    public void removeDirAll(Path path) throws IOException {
        Files.walkFileTree(path, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.delete(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.delete(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    @Override
    public long copyFile(Path from, Path to) throws IOException {
        Files.copy(from, to, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        return Files.size(to);
    }
}
