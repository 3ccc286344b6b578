package com.tyron.filepicker.core.style;

import com.tyron.filepicker.api.model.FileMeta;
import com.tyron.filepicker.core.view.FilterMatcher;
import com.tyron.filepicker.core.view.Globs;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Predicate selecting the entries a style rule applies to.
 */
@FunctionalInterface
public interface StyleMatcher {

    boolean matches(FileMeta meta);

    static StyleMatcher anyDirectory() {
        return FileMeta::isDirectory;
    }

    static StyleMatcher anyFile() {
        return meta -> !meta.isDirectory();
    }

    /**
     * Files with the given (possibly multi-part) extension, with or without leading dot.
     */
    static StyleMatcher extension(String ext) {
        String e = Objects.requireNonNull(ext, "ext").trim().toLowerCase(Locale.ROOT);
        String bare = e.startsWith(".") ? e.substring(1) : e;
        return meta -> !meta.isDirectory() && FilterMatcher.hasExtensionSuffix(meta.getNameLower(), bare);
    }

    static StyleMatcher nameEquals(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return meta -> meta.getNameLower().equals(lower);
    }

    static StyleMatcher nameContains(String part) {
        String lower = part.toLowerCase(Locale.ROOT);
        return meta -> meta.getNameLower().contains(lower);
    }

    static StyleMatcher nameGlob(String glob) {
        Pattern pattern = Globs.compile(glob);
        return meta -> pattern.matcher(meta.getName()).matches();
    }

    /**
     * Case-insensitive regex over the name; a surrounding {@code ((...))} is stripped.
     *
     * @throws java.util.regex.PatternSyntaxException if the expression is invalid
     */
    static StyleMatcher nameRegex(String regex) {
        String body = regex.trim();
        if (body.length() > 4 && body.startsWith("((") && body.endsWith("))")) {
            body = body.substring(2, body.length() - 2);
        }
        Pattern pattern = Pattern.compile(body, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
        return meta -> pattern.matcher(meta.getName()).find();
    }
}
