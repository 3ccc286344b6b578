package com.tyron.filepicker.api.dialog;

/**
 * Keyboard modifiers held during a pointer or key gesture.
 */
public record Modifiers(boolean ctrl, boolean shift) {

    public static final Modifiers NONE = new Modifiers(false, false);
    public static final Modifiers CTRL = new Modifiers(true, false);
    public static final Modifiers SHIFT = new Modifiers(false, true);

    public boolean isNone() {
        return !ctrl && !shift;
    }
}
