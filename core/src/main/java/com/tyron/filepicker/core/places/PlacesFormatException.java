package com.tyron.filepicker.core.places;

import java.io.IOException;

/**
 * Malformed serialized places text.
 */
public class PlacesFormatException extends IOException {

    private final int line;

    public PlacesFormatException(int line, String message) {
        super("line " + line + ": " + message);
        this.line = line;
    }

    /**
     * 1-based line number of the offending line.
     */
    public int getLine() {
        return line;
    }
}
