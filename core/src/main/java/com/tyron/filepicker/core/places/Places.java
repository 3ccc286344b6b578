package com.tyron.filepicker.core.places;

import com.tyron.filepicker.api.places.Bookmark;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered user bookmarks, at most one per path.
 */
public final class Places {

    private final List<Bookmark> bookmarks = new ArrayList<>();

    public static Places of(List<Bookmark> bookmarks) {
        Places places = new Places();
        for (Bookmark b : bookmarks) {
            places.add(b.label(), b.path());
        }
        return places;
    }

    /**
     * @return false if a bookmark for {@code path} already exists
     */
    public boolean add(String label, Path path) {
        Objects.requireNonNull(label, "label");
        Path normalized = normalize(path);
        if (indexOf(normalized) >= 0) {
            return false;
        }
        String effective = label.isBlank() ? defaultLabel(normalized) : label;
        bookmarks.add(new Bookmark(effective, normalized));
        return true;
    }

    public boolean remove(Path path) {
        int i = indexOf(normalize(path));
        if (i < 0) {
            return false;
        }
        bookmarks.remove(i);
        return true;
    }

    public boolean contains(Path path) {
        return indexOf(normalize(path)) >= 0;
    }

    public List<Bookmark> bookmarks() {
        return Collections.unmodifiableList(bookmarks);
    }

    public int size() {
        return bookmarks.size();
    }

    public boolean isEmpty() {
        return bookmarks.isEmpty();
    }

    private int indexOf(Path normalized) {
        for (int i = 0; i < bookmarks.size(); i++) {
            if (bookmarks.get(i).path().equals(normalized)) {
                return i;
            }
        }
        return -1;
    }

    private static Path normalize(Path path) {
        return Objects.requireNonNull(path, "path").normalize();
    }

    private static String defaultLabel(Path path) {
        Path name = path.getFileName();
        return name != null ? name.toString() : path.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof Places that && bookmarks.equals(that.bookmarks);
    }

    @Override
    public int hashCode() {
        return bookmarks.hashCode();
    }

    @Override
    public String toString() {
        return "Places" + bookmarks;
    }
}
