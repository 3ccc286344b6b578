package com.tyron.filepicker.api.thumbnails;

/**
 * Uploads decoded thumbnails to the host's renderer and releases them.
 */
public interface ThumbnailRenderer {

    /**
     * @return a host texture handle
     */
    long upload(RgbaImage image);

    void destroy(long textureId);
}
