package org.dxworks.flaredoc.converter;

import java.util.regex.Pattern;

/**
 * Joins converted fragments, keeping AsciiDoc tokens from fusing with preceding content.
 */
public final class FragmentAssembler {

    // Runs of three or more identical delimiter characters, plus the table fences.
    private static final Pattern BLOCK_DELIMITER = Pattern.compile("([=\\-*_.+/])\\1{2,}|[|!]===");

    private FragmentAssembler() {
    }

    public static String append(String accumulated, String addition) {
        StringBuilder out = new StringBuilder(accumulated);
        append(out, addition);
        return out.toString();
    }

    public static void append(StringBuilder accumulated, String addition) {
        if (addition == null || addition.isEmpty()) {
            return;
        }
        if (accumulated.length() > 0) {
            char last = accumulated.charAt(accumulated.length() - 1);
            if (addition.charAt(0) == '[') {
                // attribute lists and anchors must not glue onto a preceding word
                if (last != '(' && last != ' ' && last != '\n') {
                    accumulated.append(' ');
                }
            } else if (last != '\n' && BLOCK_DELIMITER.matcher(addition).lookingAt()) {
                accumulated.append('\n');
            }
        }
        accumulated.append(addition);
    }
}
