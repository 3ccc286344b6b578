package com.tyron.filepicker.core.places;

import com.tyron.filepicker.api.places.PlacesStore;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

public final class InMemoryPlacesStore implements PlacesStore {

    private volatile @Nullable String value;

    public InMemoryPlacesStore() {
    }

    public InMemoryPlacesStore(@Nullable String initial) {
        this.value = initial;
    }

    @Override
    public @Nullable String read() {
        return value;
    }

    @Override
    public void write(String serialized) {
        this.value = Objects.requireNonNull(serialized, "serialized");
    }
}
