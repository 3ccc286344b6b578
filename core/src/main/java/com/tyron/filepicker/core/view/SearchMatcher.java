package com.tyron.filepicker.core.view;

import com.tyron.filepicker.api.dialog.SearchMode;
import com.tyron.filepicker.api.model.FileMeta;
import me.xdrop.fuzzywuzzy.FuzzySearch;

import java.util.Locale;
import java.util.Objects;

/**
 * Search box matching over lower-cased names.
 */
public final class SearchMatcher {

    /**
     * The minimum partial-ratio score for a fuzzy hit.
     */
    static final int MINIMUM_SCORE = 70;

    private final String query;
    private final SearchMode mode;

    private SearchMatcher(String query, SearchMode mode) {
        this.query = query;
        this.mode = mode;
    }

    public static SearchMatcher of(String text, SearchMode mode) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(mode, "mode");
        return new SearchMatcher(text.trim().toLowerCase(Locale.ROOT), mode);
    }

    public boolean isEmpty() {
        return query.isEmpty();
    }

    public boolean matches(FileMeta meta) {
        return matchesLower(meta.getNameLower());
    }

    boolean matchesLower(String nameLower) {
        if (query.isEmpty() || nameLower.contains(query)) {
            return true;
        }
        return mode == SearchMode.FUZZY && FuzzySearch.partialRatio(query, nameLower) > MINIMUM_SCORE;
    }
}
