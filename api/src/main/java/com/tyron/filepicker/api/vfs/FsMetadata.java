package com.tyron.filepicker.api.vfs;

/**
 * Minimal metadata for a single path.
 *
 * @param directory whether the path (after following links) is a directory
 * @param symlink   whether the path itself is a symbolic link
 */
public record FsMetadata(boolean directory, boolean symlink) {

    public static FsMetadata ofFile() {
        return new FsMetadata(false, false);
    }

    public static FsMetadata ofDirectory() {
        return new FsMetadata(true, false);
    }
}
