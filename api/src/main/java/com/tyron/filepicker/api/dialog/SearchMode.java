package com.tyron.filepicker.api.dialog;

public enum SearchMode {
    /** Case-insensitive substring. */
    SUBSTRING,
    /** Substring, else a fuzzy partial match. */
    FUZZY
}
