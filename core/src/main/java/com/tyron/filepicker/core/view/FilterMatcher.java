package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.model.FileMeta;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Predicate;
import java.util.logging.Logger;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Compiled form of a {@link FileFilter}. Matches file names only; directory handling is up
 * to the caller.
 */
public final class FilterMatcher {

    private static final Logger LOG = Logger.getLogger(FilterMatcher.class.getName());

    private static final FilterMatcher ALL = new FilterMatcher(List.of(), true);

    private final List<Predicate<String>> tokens;
    private final boolean matchAll;

    private FilterMatcher(List<Predicate<String>> tokens, boolean matchAll) {
        this.tokens = tokens;
        this.matchAll = matchAll;
    }

    public static FilterMatcher all() {
        return ALL;
    }

    public static FilterMatcher compile(@Nullable FileFilter filter) {
        if (filter == null || filter.tokens().isEmpty()) {
            return ALL;
        }
        List<Predicate<String>> compiled = new ArrayList<>(filter.tokens().size());
        for (String raw : filter.tokens()) {
            String token = raw.trim();
            if (token.isEmpty()) continue;
            if (token.equals("*") || token.equals("*.*")) {
                return ALL;
            }
            Predicate<String> p = compileToken(token);
            if (p != null) {
                compiled.add(p);
            }
        }
        return new FilterMatcher(List.copyOf(compiled), false);
    }

    @Nullable
    private static Predicate<String> compileToken(String token) {
        if (FileFilter.isRegexToken(token)) {
            String body = token.substring(2, token.length() - 2);
            try {
                Pattern pattern = Pattern.compile(body, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
                return name -> pattern.matcher(name).find();
            } catch (PatternSyntaxException e) {
                LOG.warning("ignoring invalid filter regex " + token + ": " + e.getDescription());
                return null;
            }
        }
        if (FileFilter.isWildcardToken(token)) {
            Pattern pattern = Globs.compile(token);
            return name -> pattern.matcher(name).matches();
        }
        String ext = (token.startsWith(".") ? token.substring(1) : token).toLowerCase(Locale.ROOT);
        if (ext.isEmpty()) {
            return null;
        }
        return nameLower -> hasExtensionSuffix(nameLower, ext);
    }

    /**
     * True if {@code nameLower} ends with "." + {@code extLower} and has a non-empty stem, so
     * "tar.gz" matches "a.tar.gz" but not "a.gz" or ".tar.gz".
     */
    public static boolean hasExtensionSuffix(String nameLower, String extLower) {
        int stem = nameLower.length() - extLower.length() - 1;
        return stem > 0
                && nameLower.endsWith(extLower)
                && nameLower.charAt(stem) == '.';
    }

    public boolean matchesName(String name) {
        if (matchAll) return true;
        String lower = name.toLowerCase(Locale.ROOT);
        for (Predicate<String> token : tokens) {
            if (token.test(lower)) return true;
        }
        return false;
    }

    public boolean matches(FileMeta meta) {
        if (matchAll) return true;
        String lower = meta.getNameLower();
        for (Predicate<String> token : tokens) {
            if (token.test(lower)) return true;
        }
        return false;
    }

    public boolean isMatchAll() {
        return matchAll;
    }
}
