package com.tyron.filepicker.core.style;

import org.jetbrains.annotations.Nullable;

/**
 * Presentation hints for an entry. Every field is optional; rendering is up to the host.
 *
 * @param textColor ARGB colour
 * @param icon      icon glyph or host icon key
 */
public record FileStyle(@Nullable Integer textColor, @Nullable String icon, @Nullable String tooltip) {

    public static FileStyle color(int argb) {
        return new FileStyle(argb, null, null);
    }

    public static FileStyle icon(String icon) {
        return new FileStyle(null, icon, null);
    }
}
