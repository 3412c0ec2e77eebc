package org.dxworks.flaredoc.converter;

import java.util.regex.Pattern;

public final class TextNormalizer {

    private static final Pattern TRAILING_HORIZONTAL_SPACE = Pattern.compile("[ \\t]+$", Pattern.MULTILINE);
    // two or more blank lines in a row
    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n{3,}");

    private TextNormalizer() {
    }

    /**
     * Final whitespace cleanup of a converted document. Blank input yields an empty string,
     * anything else ends with exactly one newline.
     */
    public static String normalize(String text) {
        String result = text.stripLeading();
        result = TRAILING_HORIZONTAL_SPACE.matcher(result).replaceAll("");
        result = EXCESS_BLANK_LINES.matcher(result).replaceAll("\n\n");
        result = result.stripTrailing();
        return result.isEmpty() ? "" : result + "\n";
    }
}
