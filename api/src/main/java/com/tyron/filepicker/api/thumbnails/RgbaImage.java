package com.tyron.filepicker.api.thumbnails;

import java.util.Objects;

/**
 * Decoded image, 4 bytes per pixel, row-major.
 */
public record RgbaImage(int width, int height, byte[] pixels) {

    public RgbaImage {
        Objects.requireNonNull(pixels, "pixels");
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("invalid size " + width + "x" + height);
        }
        if (pixels.length != width * height * 4) {
            throw new IllegalArgumentException("expected " + (width * height * 4) + " bytes, got " + pixels.length);
        }
    }
}
