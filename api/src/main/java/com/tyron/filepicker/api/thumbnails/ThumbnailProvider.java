package com.tyron.filepicker.api.thumbnails;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Decodes image files into pixels. Supplied by the host.
 */
@FunctionalInterface
public interface ThumbnailProvider {

    RgbaImage decode(Path path, int maxSize) throws IOException;
}
