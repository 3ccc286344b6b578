package com.tyron.filepicker.core.scan;

import com.tyron.filepicker.api.model.EntryId;
import it.unimi.dsi.fastutil.objects.Object2LongOpenHashMap;
import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Set;

/**
 * Allocates {@link EntryId}s per normalized absolute path.
 * <p>
 * A path keeps its id for as long as it stays listed, so selection survives rescans. Paths
 * that drop out of the published listing are forgotten through {@link #retainOnly}; if they
 * show up again they get a new id. Ids are never recycled: a renamed entry is a new path and
 * gets a new id.
 */
public final class EntryIdRegistry {

    private static final long MISSING = -1L;

    private final Object2LongOpenHashMap<Path> ids = new Object2LongOpenHashMap<>();
    private long nextId = 1;

    public EntryIdRegistry() {
        ids.defaultReturnValue(MISSING);
    }

    public synchronized EntryId getOrCreateId(Path path) {
        Path key = normalize(path);
        long id = ids.getLong(key);
        if (id != MISSING) {
            return new EntryId(id);
        }
        id = nextId;
        nextId = Math.addExact(nextId, 1);
        ids.put(key, id);
        return new EntryId(id);
    }

    @Nullable
    public synchronized EntryId find(Path path) {
        long id = ids.getLong(normalize(path));
        return id == MISSING ? null : new EntryId(id);
    }

    /**
     * Forgets every path not in {@code paths}.
     *
     * @return the number of forgotten paths
     */
    public synchronized int retainOnly(Collection<Path> paths) {
        Set<Path> keep = new ObjectOpenHashSet<>(paths.size());
        for (Path path : paths) {
            keep.add(normalize(path));
        }
        int before = ids.size();
        ids.keySet().retainAll(keep);
        return before - ids.size();
    }

    public synchronized int size() {
        return ids.size();
    }

    private static Path normalize(Path path) {
        return path.toAbsolutePath().normalize();
    }
}
