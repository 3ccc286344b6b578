package com.tyron.filepicker.api.dialog;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Named group of filter tokens shown as one choice in the dialog.
 * <p>
 * Token forms: plain extension ({@code png}, {@code .png}, {@code tar.gz}), wildcard
 * ({@code *.txt}, {@code report-??.csv}) and regex ({@code ((^img_\d+\.jpe?g$))}).
 * A token matches if any form matches; {@code *} and {@code *.*} match everything.
 */
public record FileFilter(String name, List<String> tokens) {

    public FileFilter {
        Objects.requireNonNull(name, "name");
        tokens = List.copyOf(tokens);
    }

    public static FileFilter of(String name, String... tokens) {
        return new FileFilter(name, List.of(tokens));
    }

    public static boolean isRegexToken(String token) {
        String t = token.trim();
        return t.length() > 4 && t.startsWith("((") && t.endsWith("))");
    }

    public static boolean isWildcardToken(String token) {
        return !isRegexToken(token) && (token.indexOf('*') >= 0 || token.indexOf('?') >= 0);
    }

    /**
     * Extension used when completing a save name: the first plain extension token, or the
     * extension of the first {@code *.ext} token. Lower-case, without a leading dot.
     */
    @Nullable
    public String defaultExtension() {
        for (String raw : tokens) {
            String token = raw.trim();
            if (token.isEmpty() || isRegexToken(token)) continue;
            if (isWildcardToken(token)) {
                if (token.startsWith("*.")) {
                    String ext = token.substring(2);
                    if (!ext.isEmpty() && ext.indexOf('*') < 0 && ext.indexOf('?') < 0) {
                        return ext.toLowerCase(Locale.ROOT);
                    }
                }
                continue;
            }
            String ext = token.startsWith(".") ? token.substring(1) : token;
            if (!ext.isEmpty()) {
                return ext.toLowerCase(Locale.ROOT);
            }
        }
        return null;
    }
}
