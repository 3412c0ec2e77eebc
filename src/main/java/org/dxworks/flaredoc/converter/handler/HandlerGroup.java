package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Base for a family of tag handlers. Subclasses register their handlers under the lookup keys
 * produced by {@link AsciidocConverter#handlerKey}.
 */
public abstract class HandlerGroup {

    static final String XHTML_NAMESPACE = "http://www.w3.org/1999/xhtml";

    private static final Pattern BLANK_LINES = Pattern.compile("\n[ \t]*(?:\n[ \t]*)+");

    protected final AsciidocConverter converter;

    protected HandlerGroup(AsciidocConverter converter) {
        this.converter = converter;
    }

    public abstract void register(Map<String, TagHandler> handlers);

    protected String children(Element element, ConversionContext context) {
        return converter.convertChildren(element, context);
    }

    protected static TagHandler passThrough(AsciidocConverter converter) {
        return converter::convertChildren;
    }

    /** Attribute value looked up case-insensitively, or {@code null} when absent. */
    protected static String attr(Element element, String key) {
        if (!element.attributes().hasKeyIgnoreCase(key)) {
            return null;
        }
        return element.attributes().getIgnoreCase(key);
    }

    protected static String key(Attribute attribute) {
        return attribute.getKey().toLowerCase(Locale.ROOT);
    }

    protected static boolean hasChildren(Element element) {
        return element.childNodeSize() > 0;
    }

    /** Inline markup cannot span a paragraph break. */
    protected static String collapseBlankLines(String text) {
        return BLANK_LINES.matcher(text).replaceAll("\n");
    }

    /** AsciiDoc attribute names cannot contain dots. */
    protected static String attributeName(String name) {
        return name.trim().replace('.', '-');
    }
}
