package com.tyron.filepicker.api.dialog;

public enum DialogMode {
    OPEN_FILE,
    OPEN_FILES,
    PICK_FOLDER,
    SAVE_FILE;

    public boolean isMultiSelect() {
        return this == OPEN_FILES;
    }

    public boolean isSave() {
        return this == SAVE_FILE;
    }
}
