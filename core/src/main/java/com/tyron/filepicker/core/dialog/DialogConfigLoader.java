package com.tyron.filepicker.core.dialog;

import com.tyron.filepicker.api.dialog.ClickAction;
import com.tyron.filepicker.api.dialog.DialogMode;
import com.tyron.filepicker.api.dialog.ExtensionPolicy;
import com.tyron.filepicker.api.dialog.FileFilter;
import com.tyron.filepicker.api.dialog.HiddenFilePolicy;
import com.tyron.filepicker.api.dialog.SavePolicy;
import com.tyron.filepicker.api.dialog.SearchMode;
import com.tyron.filepicker.api.dialog.SortBy;
import com.tyron.filepicker.api.dialog.SortSpec;
import com.tyron.filepicker.api.scan.ScanPolicy;
import com.tyron.filepicker.core.thumbnails.ThumbnailCache;
import org.jetbrains.annotations.Nullable;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.io.StringReader;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads dialog configuration from YAML:
 *
 * <pre>
 * mode: save_file
 * directory: /home/me/reports
 * scan: {policy: background, batchSize: 256, maxBatchesPerTick: 4}
 * selection: {max: 10, clickAction: navigate}
 * view: {showHidden: false, search: fuzzy, sort: {by: name, ascending: true, directoriesFirst: true}}
 * save: {name: report, confirmOverwrite: true, extensionPolicy: add_if_missing}
 * filters:
 *   - {name: CSV, patterns: [csv]}
 * activeFilter: 0
 * thumbnails: {maxEntries: 256, requestsPerFrame: 24}
 * </pre>
 *
 * Unknown keys are ignored. Returns a builder so the host can add collaborators
 * (filesystem, validator, places store) before building.
 */
public final class DialogConfigLoader {

    private DialogConfigLoader() {
    }

    public static DialogConfig.Builder load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return load(in);
        }
    }

    public static DialogConfig.Builder load(InputStream in) {
        Object doc;
        try {
            doc = new Yaml().load(in);
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed dialog config: " + e.getMessage(), e);
        }
        return fromDocument(doc);
    }

    public static DialogConfig.Builder loadString(String yaml) {
        Object doc;
        try {
            doc = new Yaml().load(new StringReader(yaml));
        } catch (YAMLException e) {
            throw new IllegalArgumentException("malformed dialog config: " + e.getMessage(), e);
        }
        return fromDocument(doc);
    }

    static DialogConfig.Builder fromDocument(@Nullable Object doc) {
        if (!(doc instanceof Map<?, ?> map)) {
            throw new IllegalArgumentException("dialog config must be a mapping");
        }

        Object mode = map.get("mode");
        if (mode == null) {
            throw new IllegalArgumentException("mode is required");
        }
        DialogConfig.Builder b = DialogConfig.builder(parseEnum(DialogMode.class, "mode", mode));

        Object directory = map.get("directory");
        if (directory != null) {
            b.directory(Path.of(expandHome(String.valueOf(directory))));
        }

        // scan: {policy, batchSize, maxBatchesPerTick}
        if (map.get("scan") instanceof Map<?, ?> scan) {
            b.scanPolicy(parseScanPolicy(scan));
        }

        // selection: {max, clickAction}
        if (map.get("selection") instanceof Map<?, ?> selection) {
            Object max = selection.get("max");
            if (max != null) b.maxSelection(parseInt("selection.max", max));
            Object click = selection.get("clickAction");
            if (click != null) b.clickAction(parseEnum(ClickAction.class, "selection.clickAction", click));
        }

        // view: {showHidden, search, sort: {...}}
        if (map.get("view") instanceof Map<?, ?> view) {
            Object showHidden = view.get("showHidden");
            if (showHidden != null) {
                b.hiddenPolicy(parseBoolean("view.showHidden", showHidden) ? HiddenFilePolicy.SHOW : HiddenFilePolicy.HIDE_DOTFILES);
            }
            Object search = view.get("search");
            if (search != null) b.searchMode(parseEnum(SearchMode.class, "view.search", search));
            if (view.get("sort") instanceof Map<?, ?> sort) {
                b.sort(parseSort(sort));
            }
        }

        // save: {name, confirmOverwrite, extensionPolicy}
        if (map.get("save") instanceof Map<?, ?> save) {
            Object name = save.get("name");
            if (name != null) b.saveName(String.valueOf(name));
            boolean confirm = SavePolicy.DEFAULT.confirmOverwrite();
            ExtensionPolicy ext = SavePolicy.DEFAULT.extensionPolicy();
            Object c = save.get("confirmOverwrite");
            if (c != null) confirm = parseBoolean("save.confirmOverwrite", c);
            Object e = save.get("extensionPolicy");
            if (e != null) ext = parseEnum(ExtensionPolicy.class, "save.extensionPolicy", e);
            b.savePolicy(new SavePolicy(confirm, ext));
        }

        // filters: [{name, patterns: [...]}, ...]
        if (map.get("filters") instanceof List<?> list) {
            List<FileFilter> filters = new ArrayList<>();
            for (Object item : list) {
                if (!(item instanceof Map<?, ?> f)) {
                    throw new IllegalArgumentException("filters entries must be mappings: " + item);
                }
                Object name = f.get("name");
                List<String> patterns = new ArrayList<>();
                if (f.get("patterns") instanceof List<?> ps) {
                    for (Object p : ps) {
                        if (p != null) patterns.add(String.valueOf(p));
                    }
                }
                filters.add(new FileFilter(name != null ? String.valueOf(name) : String.join(", ", patterns), patterns));
            }
            b.filters(filters);
        }

        if (map.containsKey("activeFilter")) {
            Object active = map.get("activeFilter");
            b.activeFilter(active == null ? null : parseInt("activeFilter", active));
        }

        // thumbnails: {maxEntries, requestsPerFrame}
        if (map.get("thumbnails") instanceof Map<?, ?> thumbs) {
            int maxEntries = optInt(thumbs, "maxEntries", "thumbnails.maxEntries", ThumbnailCache.DEFAULT_MAX_ENTRIES);
            int perFrame = optInt(thumbs, "requestsPerFrame", "thumbnails.requestsPerFrame", ThumbnailCache.DEFAULT_MAX_NEW_REQUESTS_PER_FRAME);
            b.thumbnails(maxEntries, perFrame);
        }
        return b;
    }

    private static ScanPolicy parseScanPolicy(Map<?, ?> scan) {
        Object raw = scan.get("policy");
        ScanPolicy.Kind kind = raw == null ? ScanPolicy.Kind.SYNC : parseEnum(ScanPolicy.Kind.class, "scan.policy", raw);
        if (kind == ScanPolicy.Kind.SYNC) {
            return ScanPolicy.sync();
        }
        int batchSize = optInt(scan, "batchSize", "scan.batchSize", ScanPolicy.DEFAULT_BATCH_SIZE);
        int perTick = optInt(scan, "maxBatchesPerTick", "scan.maxBatchesPerTick", ScanPolicy.DEFAULT_MAX_BATCHES_PER_TICK);
        return new ScanPolicy(kind, batchSize, perTick);
    }

    private static SortSpec parseSort(Map<?, ?> sort) {
        SortSpec d = SortSpec.DEFAULT;
        Object by = sort.get("by");
        Object asc = sort.get("ascending");
        Object dirs = sort.get("directoriesFirst");
        return new SortSpec(
                by != null ? parseEnum(SortBy.class, "view.sort.by", by) : d.by(),
                asc != null ? parseBoolean("view.sort.ascending", asc) : d.ascending(),
                dirs != null ? parseBoolean("view.sort.directoriesFirst", dirs) : d.directoriesFirst());
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String key, Object raw) {
        String name = String.valueOf(raw).trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return Enum.valueOf(type, name);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown " + key + ": " + raw);
        }
    }

    private static int optInt(Map<?, ?> map, String field, String key, int fallback) {
        Object raw = map.get(field);
        return raw == null ? fallback : parseInt(key, raw);
    }

    private static int parseInt(String key, Object raw) {
        try {
            if (raw instanceof BigInteger big) {
                return big.intValueExact();
            }
            if (raw instanceof Number n) {
                long value = n.longValue();
                if (n.doubleValue() != value) {
                    throw new IllegalArgumentException(key + " must be an integer: " + raw);
                }
                return Math.toIntExact(value);
            }
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException(key + " is out of range: " + raw, e);
        }
        try {
            return Integer.parseInt(String.valueOf(raw).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + raw);
        }
    }

    private static boolean parseBoolean(String key, Object raw) {
        if (raw instanceof Boolean bool) {
            return bool;
        }
        String s = String.valueOf(raw).trim().toLowerCase(Locale.ROOT);
        return switch (s) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new IllegalArgumentException(key + " must be a boolean: " + raw);
        };
    }

    private static String expandHome(String path) {
        if (path.equals("~") || path.startsWith("~/")) {
            return System.getProperty("user.home", "") + path.substring(1);
        }
        return path;
    }
}
