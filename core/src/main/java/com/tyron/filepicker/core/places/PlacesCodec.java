package com.tyron.filepicker.core.places;

import com.tyron.filepicker.api.places.Bookmark;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Compact text format for {@link Places}:
 *
 * <pre>
 * #filepicker-places v1
 * label&lt;TAB&gt;path
 * </pre>
 *
 * Backslash, tab, newline and carriage return inside labels and paths are escaped as
 * {@code \\ \t \n \r}. Text without a header line is read as the same line format.
 */
public final class PlacesCodec {

    public static final String HEADER_PREFIX = "#filepicker-places";
    public static final int VERSION = 1;
    public static final String HEADER = HEADER_PREFIX + " v" + VERSION;

    private PlacesCodec() {
    }

    public static String encode(Places places) {
        StringBuilder out = new StringBuilder(HEADER).append('\n');
        for (Bookmark b : places.bookmarks()) {
            escape(b.label(), out);
            out.append('\t');
            escape(b.path().toString(), out);
            out.append('\n');
        }
        return out.toString();
    }

    public static Places decode(String text) throws PlacesFormatException {
        List<Bookmark> bookmarks = new ArrayList<>();
        String[] lines = text.split("\n", -1);
        boolean sawContent = false;

        for (int i = 0; i < lines.length; i++) {
            int lineNo = i + 1;
            String line = lines[i];
            if (line.endsWith("\r")) {
                line = line.substring(0, line.length() - 1);
            }
            if (line.isBlank()) {
                continue;
            }
            if (line.startsWith(HEADER_PREFIX)) {
                if (sawContent) {
                    throw new PlacesFormatException(lineNo, "header must be the first line");
                }
                checkVersion(lineNo, line.substring(HEADER_PREFIX.length()).trim());
                sawContent = true;
                continue;
            }
            sawContent = true;

            int tab = line.indexOf('\t');
            if (tab < 0) {
                throw new PlacesFormatException(lineNo, "expected label<TAB>path");
            }
            String label = unescape(lineNo, line.substring(0, tab));
            String rawPath = unescape(lineNo, line.substring(tab + 1));
            if (rawPath.isEmpty()) {
                throw new PlacesFormatException(lineNo, "empty path");
            }
            try {
                bookmarks.add(new Bookmark(label, Path.of(rawPath)));
            } catch (InvalidPathException e) {
                throw new PlacesFormatException(lineNo, "invalid path: " + e.getReason());
            }
        }
        return Places.of(bookmarks);
    }

    private static void checkVersion(int lineNo, String version) throws PlacesFormatException {
        if (!version.equals("v" + VERSION)) {
            throw new PlacesFormatException(lineNo, "unsupported places version '" + version + "'");
        }
    }

    static void escape(String s, StringBuilder out) {
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '\t' -> out.append("\\t");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                default -> out.append(c);
            }
        }
    }

    static String unescape(int lineNo, String s) throws PlacesFormatException {
        if (s.indexOf('\\') < 0) {
            return s;
        }
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != '\\') {
                out.append(c);
                continue;
            }
            if (i + 1 >= s.length()) {
                throw new PlacesFormatException(lineNo, "dangling escape");
            }
            char next = s.charAt(++i);
            switch (next) {
                case '\\' -> out.append('\\');
                case 't' -> out.append('\t');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                default -> throw new PlacesFormatException(lineNo, "unknown escape \\" + next);
            }
        }
        return out.toString();
    }
}
