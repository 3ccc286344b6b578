package com.tyron.filepicker.core.style;

import com.tyron.filepicker.api.model.FileMeta;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Ordered style rules. The callback, when set and returning a style, wins; otherwise the first
 * matching rule applies.
 */
public final class FileStyleRegistry {

    private record Rule(StyleMatcher matcher, FileStyle style) {
    }

    private final List<Rule> rules = new CopyOnWriteArrayList<>();
    private volatile @Nullable Function<FileMeta, FileStyle> callback;

    public FileStyleRegistry add(StyleMatcher matcher, FileStyle style) {
        rules.add(new Rule(Objects.requireNonNull(matcher, "matcher"), Objects.requireNonNull(style, "style")));
        return this;
    }

    public FileStyleRegistry setCallback(@Nullable Function<FileMeta, FileStyle> callback) {
        this.callback = callback;
        return this;
    }

    public void clear() {
        rules.clear();
        callback = null;
    }

    public int size() {
        return rules.size();
    }

    @Nullable
    public FileStyle styleFor(FileMeta meta) {
        Function<FileMeta, FileStyle> cb = callback;
        if (cb != null) {
            FileStyle style = cb.apply(meta);
            if (style != null) {
                return style;
            }
        }
        for (Rule rule : rules) {
            if (rule.matcher().matches(meta)) {
                return rule.style();
            }
        }
        return null;
    }

    /**
     * Styles for {@code metas}, index-aligned; null where no rule applies.
     */
    public List<FileStyle> stylesFor(List<FileMeta> metas) {
        List<FileStyle> out = new ArrayList<>(metas.size());
        for (FileMeta meta : metas) {
            out.add(styleFor(meta));
        }
        return out;
    }
}
