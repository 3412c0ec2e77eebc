package org.dxworks.flaredoc.snippet;

import java.io.IOException;

@FunctionalInterface
public interface SnippetLoader {

    /** Converts the snippet behind {@code entry} and returns its AsciiDoc text. */
    String load(SnippetEntry entry) throws IOException;
}
