package com.tyron.filepicker.api.dialog;

public enum HiddenFilePolicy {
    SHOW,
    /** Hide entries whose name starts with a dot. */
    HIDE_DOTFILES
}
