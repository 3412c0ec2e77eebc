package org.dxworks.flaredoc.snippet;

/**
 * Outcome of {@link SnippetRegistry#reference}.
 *
 * @param name            attribute name the reference resolves to
 * @param conflictingPath path of a different snippet already registered under {@code name},
 *                        or {@code null}; the referenced snippet then gets no definition of its own
 */
public record SnippetReference(String name, String conflictingPath) {

    public boolean isConflict() {
        return conflictingPath != null;
    }
}
