package com.tyron.filepicker.core.places;

import com.tyron.filepicker.api.places.PlacesStore;
import org.jetbrains.annotations.Nullable;
import org.mapdb.DB;
import org.mapdb.DBException;
import org.mapdb.DBMaker;
import org.mapdb.HTreeMap;
import org.mapdb.Serializer;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * MapDB-backed {@link PlacesStore}. Several profiles can share one file under different keys.
 */
public final class MapDbPlacesStore implements PlacesStore, Closeable {

    private static final Logger LOG = Logger.getLogger(MapDbPlacesStore.class.getName());

    public static final String DEFAULT_KEY = "default";

    private final DB db;
    private final HTreeMap<String, String> places;
    private final String key;

    public MapDbPlacesStore(Path dbFile) throws IOException {
        this(dbFile, DEFAULT_KEY);
    }

    public MapDbPlacesStore(Path dbFile, String key) throws IOException {
        Objects.requireNonNull(dbFile, "dbFile");
        this.key = Objects.requireNonNull(key, "key");
        Path parent = dbFile.toAbsolutePath().normalize().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        this.db = openDb(dbFile);
        this.places = db.hashMap("places", Serializer.STRING, Serializer.STRING).createOrOpen();
    }

    private static DB openDb(Path dbFile) throws IOException {
        try {
            return DBMaker
                    .fileDB(dbFile.toFile())
                    .fileMmapEnableIfSupported()
                    .checksumHeaderBypass()
                    .transactionEnable()
                    .closeOnJvmShutdown()
                    .make();
        } catch (DBException.FileLocked locked) {
            if (Boolean.parseBoolean(System.getProperty("filepicker.places.allowInMemoryFallback", "false"))) {
                LOG.warning("places file " + dbFile + " is locked, falling back to memory");
                return DBMaker.memoryDB().closeOnJvmShutdown().make();
            }
            throw new IOException("places file is locked: " + dbFile, locked);
        }
    }

    @Override
    public @Nullable String read() {
        return places.get(key);
    }

    @Override
    public void write(String serialized) throws IOException {
        Objects.requireNonNull(serialized, "serialized");
        try {
            places.put(key, serialized);
            db.commit();
        } catch (DBException e) {
            throw new IOException("failed to persist places", e);
        }
    }

    @Override
    public void close() {
        db.close();
    }
}
