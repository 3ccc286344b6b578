package com.tyron.filepicker.core.thumbnails;

import java.nio.file.Path;
import java.util.Objects;

public record ThumbnailRequest(Path path, int maxSize) {

    public ThumbnailRequest {
        Objects.requireNonNull(path, "path");
        if (maxSize <= 0) {
            throw new IllegalArgumentException("maxSize must be positive: " + maxSize);
        }
    }
}
