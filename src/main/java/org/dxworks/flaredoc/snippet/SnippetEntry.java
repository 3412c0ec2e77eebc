package org.dxworks.flaredoc.snippet;

import java.nio.file.Path;

public final class SnippetEntry {

    private final String path;
    private final String name;
    private final Path source;
    private String content;

    SnippetEntry(String path, String name, Path source) {
        this.path = path;
        this.name = name;
        this.source = source;
    }

    /** Reference path as written in the referencing document. */
    public String getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    /** Resolved snippet file, or {@code null} if the reference had no document location. */
    public Path getSource() {
        return source;
    }

    public String getContent() {
        return content;
    }

    public boolean isPopulated() {
        return content != null;
    }

    void populate(String content) {
        this.content = content;
    }
}
