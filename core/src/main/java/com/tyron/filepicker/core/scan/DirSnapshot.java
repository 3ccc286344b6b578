package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.model.EntryId;
import com.tyron.filepicker.api.model.FileMeta;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable listing of one directory produced by one scan generation.
 * <p>
 * {@link #orderedIds()} is normalized by lower-case name, then id.
 */
public final class DirSnapshot {

    static final Comparator<FileMeta> NORMAL_ORDER = Comparator
            .comparing(FileMeta::getNameLower)
            .thenComparing(FileMeta::getId);

    private final long generation;
    private final Path directory;
    private final Map<EntryId, FileMeta> entriesById;
    private final List<EntryId> orderedIds;

    DirSnapshot(long generation, Path directory, Map<EntryId, FileMeta> entries) {
        this.generation = generation;
        this.directory = Objects.requireNonNull(directory, "directory");

        List<FileMeta> sorted = new ArrayList<>(entries.values());
        sorted.sort(NORMAL_ORDER);

        Map<EntryId, FileMeta> byId = new LinkedHashMap<>(sorted.size() * 2);
        List<EntryId> ids = new ArrayList<>(sorted.size());
        for (FileMeta meta : sorted) {
            byId.put(meta.getId(), meta);
            ids.add(meta.getId());
        }
        this.entriesById = Collections.unmodifiableMap(byId);
        this.orderedIds = Collections.unmodifiableList(ids);
    }

    public long generation() {
        return generation;
    }

    public Path directory() {
        return directory;
    }

    public Map<EntryId, FileMeta> entriesById() {
        return entriesById;
    }

    public List<EntryId> orderedIds() {
        return orderedIds;
    }

    /**
     * Entries in normalized order.
     */
    public Iterable<FileMeta> entries() {
        return entriesById.values();
    }

    @Nullable
    public FileMeta get(EntryId id) {
        return entriesById.get(id);
    }

    public boolean contains(@Nullable EntryId id) {
        return id != null && entriesById.containsKey(id);
    }

    @Nullable
    public FileMeta findByName(String name) {
        for (FileMeta meta : entriesById.values()) {
            if (meta.getName().equals(name)) {
                return meta;
            }
        }
        return null;
    }

    public int size() {
        return orderedIds.size();
    }

    @Override
    public String toString() {
        return "DirSnapshot{gen=" + generation + ", dir=" + directory + ", size=" + size() + '}';
    }
}
