package com.tyron.filepicker.api.scan;

import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Read-only scan progress reported to the host.
 */
public record ScanStatus(Kind kind, long generation, int loaded, @Nullable String message) {

    private static final ScanStatus IDLE = new ScanStatus(Kind.IDLE, 0, 0, null);

    public enum Kind {
        IDLE,
        SCANNING,
        PARTIAL,
        COMPLETE,
        FAILED
    }

    public ScanStatus {
        Objects.requireNonNull(kind, "kind");
    }

    public static ScanStatus idle() {
        return IDLE;
    }

    public static ScanStatus scanning(long generation) {
        return new ScanStatus(Kind.SCANNING, generation, 0, null);
    }

    public static ScanStatus partial(long generation, int loaded) {
        return new ScanStatus(Kind.PARTIAL, generation, loaded, null);
    }

    public static ScanStatus complete(long generation, int loaded) {
        return new ScanStatus(Kind.COMPLETE, generation, loaded, null);
    }

    public static ScanStatus failed(long generation, String message) {
        return new ScanStatus(Kind.FAILED, generation, 0, Objects.requireNonNull(message, "message"));
    }

    /**
     * @return true while a scan for {@link #generation()} has not reached a terminal batch
     */
    public boolean isInProgress() {
        return kind == Kind.SCANNING || kind == Kind.PARTIAL;
    }
}
