package org.dxworks.flaredoc.snippet;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Run-scoped registry of inline snippets.
 *
 * - Every document of a run shares one instance.
 * - A snippet is registered once per name; later references to the same file only return it,
 *   references to another file with the same name are reported as conflicts.
 * - Names listed as known are defined elsewhere and are never registered.
 * - Content is converted on demand, when the definitions are rendered.
 */
public final class SnippetRegistry {

    public static final String SNIPPET_EXTENSION = ".flsnp";

    private static final Pattern SNIPPET_PATH =
            Pattern.compile("^(?:.*/)?([^/]+)\\.flsnp$", Pattern.CASE_INSENSITIVE);
    private static final Pattern INVALID_NAME_CHARS = Pattern.compile("[^A-Za-z0-9_-]");
    private static final Pattern LINE_BREAK = Pattern.compile("\\s*\\n\\s*");

    private final Set<String> knownNames;
    private final Map<String, SnippetEntry> byName = new HashMap<>();
    private final List<SnippetEntry> insertionOrder = new ArrayList<>();

    public SnippetRegistry(Collection<String> knownNames) {
        Objects.requireNonNull(knownNames, "knownNames");
        this.knownNames = Set.copyOf(knownNames);
    }

    public static boolean isSnippetPath(String path) {
        return SNIPPET_PATH.matcher(normalizeSeparators(path)).matches();
    }

    /**
     * Derives the attribute name of a snippet from its reference path. Pure: the same path
     * always yields the same name.
     */
    public static String snippetName(String path) {
        String normalized = normalizeSeparators(path);
        Matcher matcher = SNIPPET_PATH.matcher(normalized);
        String baseName;
        if (matcher.matches()) {
            baseName = matcher.group(1);
        } else {
            baseName = normalized.substring(normalized.lastIndexOf('/') + 1);
            int dot = baseName.lastIndexOf('.');
            if (dot > 0) {
                baseName = baseName.substring(0, dot);
            }
        }
        return INVALID_NAME_CHARS.matcher(baseName).replaceAll("-");
    }

    /**
     * Registers {@code path} for later conversion unless its name is known or already taken,
     * and returns the name it resolves to. Check and insert happen under one lock. A different
     * snippet file with an already registered name is reported as a conflict.
     *
     * @param origin directory of the referencing document, used to resolve the path
     */
    public synchronized SnippetReference reference(String path, Path origin) {
        String name = snippetName(path);
        if (knownNames.contains(name)) {
            return new SnippetReference(name, null);
        }
        Path source = origin == null ? null : origin.resolve(normalizeSeparators(path)).normalize();
        SnippetEntry existing = byName.get(name);
        if (existing != null) {
            return new SnippetReference(name, sameSnippet(existing, path, source) ? null : existing.getPath());
        }
        SnippetEntry entry = new SnippetEntry(path, name, source);
        byName.put(name, entry);
        insertionOrder.add(entry);
        return new SnippetReference(name, null);
    }

    public synchronized List<SnippetEntry> entries() {
        return List.copyOf(insertionOrder);
    }

    /**
     * Converts every pending entry through {@code loader} and renders one attribute entry per
     * snippet, in registration order. Snippets registered by the loader itself (nested
     * references) are picked up in the same pass.
     */
    public synchronized String renderDefinitions(SnippetLoader loader) throws IOException {
        StringBuilder out = new StringBuilder();
        for (int i = 0; i < insertionOrder.size(); i++) {
            SnippetEntry entry = insertionOrder.get(i);
            if (!entry.isPopulated()) {
                String loaded = loader.load(entry);
                entry.populate(loaded == null ? "" : loaded);
            }
            out.append(definitionLine(entry));
        }
        return out.toString();
    }

    static String definitionLine(SnippetEntry entry) {
        // attribute values are single-line
        String value = LINE_BREAK.matcher(entry.getContent().strip()).replaceAll(" ");
        // a bare ] would close the passthrough macro early
        value = value.replace("]", "\\]");
        return ":" + entry.getName() + ": pass:q[" + value + "]\n";
    }

    private static boolean sameSnippet(SnippetEntry entry, String path, Path source) {
        if (entry.getSource() != null && source != null) {
            return entry.getSource().equals(source);
        }
        return normalizeSeparators(entry.getPath()).equals(normalizeSeparators(path));
    }

    private static String normalizeSeparators(String path) {
        return path.trim().replace('\\', '/');
    }
}
