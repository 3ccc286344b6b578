package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ExtensionPolicy;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Save-name validation and extension completion.
 */
public final class SaveTargets {

    public static final String EMPTY_NAME = "empty file name";
    public static final String INVALID_CHARACTERS = "invalid characters in file name";
    public static final String POINTS_TO_DIRECTORY = "file name points to a directory";

    private static final String FORBIDDEN = "/\\:*?\"<>|";

    private SaveTargets() {
    }

    /**
     * @param name trimmed save name
     * @return null if usable, otherwise the validation message
     */
    @Nullable
    public static String validateName(String name) {
        if (name.isEmpty()) {
            return EMPTY_NAME;
        }
        if (name.equals(".") || name.equals("..")) {
            return INVALID_CHARACTERS;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c < 0x20 || c == 0x7f || FORBIDDEN.indexOf(c) >= 0) {
                return INVALID_CHARACTERS;
            }
        }
        return null;
    }

    /**
     * Applies the extension policy to a trimmed, valid save name.
     *
     * @param extension default extension of the active filter (no dot), or null
     */
    public static String normalize(String name, ExtensionPolicy policy, @Nullable String extension) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(policy, "policy");
        if (extension == null || extension.isEmpty()) {
            return name;
        }
        return switch (policy) {
            case KEEP_USER -> name;
            case ADD_IF_MISSING -> hasExtension(name) ? name : name + "." + extension;
            case OVERWRITE_BY_FILTER -> stem(name) + "." + extension;
        };
    }

    /**
     * "notes.txt" and "a.tar.gz" have one, "report" and ".profile" do not.
     */
    static boolean hasExtension(String name) {
        return name.lastIndexOf('.') > 0;
    }

    /**
     * Name without its last extension: "a.tar.gz" -> "a.tar".
     */
    static String stem(String name) {
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
