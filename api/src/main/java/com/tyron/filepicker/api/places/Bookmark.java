package com.tyron.filepicker.api.places;

import java.nio.file.Path;
import java.util.Objects;

public record Bookmark(String label, Path path) {

    public Bookmark {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(path, "path");
    }
}
