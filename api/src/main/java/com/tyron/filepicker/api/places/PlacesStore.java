package com.tyron.filepicker.api.places;

import org.jetbrains.annotations.Nullable;

import java.io.IOException;

/**
 * Persistence for the serialized places string. The dialog only reads and writes through this.
 */
public interface PlacesStore {

    /**
     * @return the last written value, or null if nothing was stored yet
     */
    @Nullable
    String read() throws IOException;

    void write(String serialized) throws IOException;
}
