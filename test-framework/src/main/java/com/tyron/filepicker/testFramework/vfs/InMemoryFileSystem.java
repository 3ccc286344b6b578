package com.tyron.filepicker.testFramework.vfs;

import com.tyron.filepicker.api.vfs.FileSystem;
import com.tyron.filepicker.api.vfs.FsEntry;
import com.tyron.filepicker.api.vfs.FsMetadata;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic in-memory {@link FileSystem} for tests.
 * <p>
 * Listings come back in insertion order (not sorted) so consumers have to normalize ordering
 * themselves. Modification times are a logical clock bumped by every mutation.
 */
public class InMemoryFileSystem implements FileSystem {

    private static final class Node {
        final boolean directory;
        final long size;
        final long modified;

        Node(boolean directory, long size, long modified) {
            this.directory = directory;
            this.size = size;
            this.modified = modified;
        }
    }

    private final Map<Path, Node> nodes = new LinkedHashMap<>();
    private final Map<Path, IOException> failures = new HashMap<>();
    private final Map<Path, Integer> readDirCalls = new HashMap<>();
    private long clock = 1;

    public InMemoryFileSystem() {
        nodes.put(Path.of("/"), new Node(true, -1, 0));
    }

    // --- Helpers for tests ---

    public synchronized InMemoryFileSystem addDir(Path dir) {
        Path p = norm(dir);
        ensureParents(p);
        nodes.putIfAbsent(p, new Node(true, -1, clock++));
        return this;
    }

    public InMemoryFileSystem addDir(String dir) {
        return addDir(Path.of(dir));
    }

    public synchronized InMemoryFileSystem addFile(Path file, long size) {
        Path p = norm(file);
        ensureParents(p);
        nodes.put(p, new Node(false, size, clock++));
        return this;
    }

    public InMemoryFileSystem addFile(String file, long size) {
        return addFile(Path.of(file), size);
    }

    public InMemoryFileSystem addFile(String file) {
        return addFile(Path.of(file), 0);
    }

    /**
     * Makes every operation touching {@code path} throw {@code failure}.
     */
    public synchronized void failOn(Path path, IOException failure) {
        failures.put(norm(path), Objects.requireNonNull(failure, "failure"));
    }

    public synchronized void clearFailures() {
        failures.clear();
    }

    public synchronized int readDirCount(Path dir) {
        return readDirCalls.getOrDefault(norm(dir), 0);
    }

    public synchronized boolean contains(Path path) {
        return nodes.containsKey(norm(path));
    }

    public synchronized boolean isDirectory(Path path) {
        Node node = nodes.get(norm(path));
        return node != null && node.directory;
    }

    // --- FileSystem ---

    @Override
    public synchronized List<FsEntry> readDir(Path dir) throws IOException {
        Path p = norm(dir);
        readDirCalls.merge(p, 1, Integer::sum);
        checkFailure(p);
        Node node = require(p);
        if (!node.directory) {
            throw new NotDirectoryException(p.toString());
        }
        List<FsEntry> out = new ArrayList<>();
        for (Map.Entry<Path, Node> e : nodes.entrySet()) {
            Path child = e.getKey();
            if (!p.equals(child.getParent())) continue;
            Node n = e.getValue();
            out.add(n.directory
                    ? FsEntry.directory(child, n.modified)
                    : FsEntry.file(child, n.size, n.modified));
        }
        return out;
    }

    @Override
    public synchronized Path canonicalize(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        require(p);
        return p;
    }

    @Override
    public synchronized FsMetadata metadata(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        Node node = require(p);
        return new FsMetadata(node.directory, false);
    }

    @Override
    public synchronized void createDir(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        if (nodes.containsKey(p)) {
            throw new FileAlreadyExistsException(p.toString());
        }
        requireParentDir(p);
        nodes.put(p, new Node(true, -1, clock++));
    }

    @Override
    public synchronized void rename(Path from, Path to) throws IOException {
        Path src = norm(from);
        Path dst = norm(to);
        checkFailure(src);
        checkFailure(dst);
        Node node = require(src);
        if (nodes.containsKey(dst)) {
            throw new FileAlreadyExistsException(dst.toString());
        }
        requireParentDir(dst);
        if (node.directory && dst.startsWith(src)) {
            throw new IOException("cannot move " + src + " into itself");
        }

        Map<Path, Node> moved = new LinkedHashMap<>();
        for (Map.Entry<Path, Node> e : nodes.entrySet()) {
            if (e.getKey().startsWith(src)) {
                moved.put(dst.resolve(src.relativize(e.getKey())), e.getValue());
            }
        }
        nodes.keySet().removeIf(k -> k.startsWith(src));
        nodes.putAll(moved);
    }

    @Override
    public synchronized void removeFile(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        Node node = require(p);
        if (node.directory) {
            throw new IOException("is a directory: " + p);
        }
        nodes.remove(p);
    }

    @Override
    public synchronized void removeDir(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        Node node = require(p);
        if (!node.directory) {
            throw new NotDirectoryException(p.toString());
        }
        for (Path k : nodes.keySet()) {
            if (p.equals(k.getParent())) {
                throw new DirectoryNotEmptyException(p.toString());
            }
        }
        nodes.remove(p);
    }

    @Override
    public synchronized void removeDirAll(Path path) throws IOException {
        Path p = norm(path);
        checkFailure(p);
        Node node = require(p);
        if (!node.directory) {
            throw new NotDirectoryException(p.toString());
        }
        nodes.keySet().removeIf(k -> k.startsWith(p));
    }

    @Override
    public synchronized long copyFile(Path from, Path to) throws IOException {
        Path src = norm(from);
        Path dst = norm(to);
        checkFailure(src);
        checkFailure(dst);
        Node node = require(src);
        if (node.directory) {
            throw new IOException("is a directory: " + src);
        }
        Node existing = nodes.get(dst);
        if (existing != null && existing.directory) {
            throw new IOException("is a directory: " + dst);
        }
        requireParentDir(dst);
        nodes.put(dst, new Node(false, node.size, clock++));
        return node.size;
    }

    private static Path norm(Path path) {
        Objects.requireNonNull(path, "path");
        if (!path.isAbsolute()) {
            throw new IllegalArgumentException("path must be absolute: " + path);
        }
        return path.normalize();
    }

    private void ensureParents(Path p) {
        Path parent = p.getParent();
        while (parent != null && !nodes.containsKey(parent)) {
            addDir(parent);
            parent = parent.getParent();
        }
    }

    private void checkFailure(Path p) throws IOException {
        IOException failure = failures.get(p);
        if (failure != null) {
            throw failure;
        }
    }

    private Node require(Path p) throws NoSuchFileException {
        Node node = nodes.get(p);
        if (node == null) {
            throw new NoSuchFileException(p.toString());
        }
        return node;
    }

    private void requireParentDir(Path p) throws IOException {
        Path parent = p.getParent();
        Node node = parent == null ? null : nodes.get(parent);
        if (node == null) {
            throw new NoSuchFileException(String.valueOf(parent));
        }
        if (!node.directory) {
            throw new NotDirectoryException(parent.toString());
        }
    }
}
