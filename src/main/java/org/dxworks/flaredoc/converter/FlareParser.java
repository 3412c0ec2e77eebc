package org.dxworks.flaredoc.converter;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.parser.Parser;

/**
 * Parses Flare XHTML. The XML parser keeps {@code MadCap:} prefixes and self-closing tags intact,
 * which the HTML parser would rewrite.
 */
public final class FlareParser {

    private FlareParser() {
    }

    public static Document parse(String source) {
        String text = source;
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }
        text = text.replace("\r\n", "\n").replace("\r", "\n");
        return Jsoup.parse(text, "", Parser.xmlParser());
    }

    /** The {@code <body>} element if present, otherwise the whole document. */
    public static Node contentRoot(Document document) {
        Element body = document.selectFirst("body");
        return body != null ? body : document;
    }
}
