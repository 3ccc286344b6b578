package com.tyron.filepicker.api.dialog;

public enum SortBy {
    NAME,
    EXTENSION,
    SIZE,
    MODIFIED
}
