package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Element;

import java.util.Map;

/**
 * Emphasis, monospace and role-styled spans.
 */
public class InlineHandlers extends HandlerGroup {

    static final String STRONG = "*";
    static final String EMPHASIS = "_";
    static final String MONOSPACE = "`";

    public InlineHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("b", (element, context) -> wrap(element, context, STRONG));
        handlers.put("strong", (element, context) -> wrap(element, context, STRONG));
        handlers.put("i", (element, context) -> wrap(element, context, EMPHASIS));
        handlers.put("em", (element, context) -> wrap(element, context, EMPHASIS));
        handlers.put("q", (element, context) -> wrap(element, context, MONOSPACE));
        handlers.put("tt", (element, context) -> wrap(element, context, MONOSPACE));
        handlers.put("sup", (element, context) -> wrap(element, context, "^"));
        handlers.put("sub", (element, context) -> wrap(element, context, "~"));
        handlers.put("span", this::span);
        handlers.put("code", (element, context) -> styled(element, context, "code"));
        handlers.put("small", (element, context) -> styled(element, context, "small"));
        handlers.put("u", (element, context) -> styled(element, context, "underline"));
    }

    String wrap(Element element, ConversionContext context, String delimiter) {
        return delimiter + collapseBlankLines(children(element, context)) + delimiter;
    }

    String span(Element element, ConversionContext context) {
        String cssClass = attr(element, "class");
        if (cssClass == null || cssClass.isBlank()) {
            return children(element, context);
        }
        return styled(element, context, String.join(".", cssClass.trim().split("\\s+")));
    }

    String styled(Element element, ConversionContext context, String role) {
        return "[." + role + "]" + wrap(element, context, MONOSPACE);
    }
}
