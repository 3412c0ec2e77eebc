package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Element;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ListHandlers extends HandlerGroup {

    static final String ORDERED_MARKER = ".";
    static final String UNORDERED_MARKER = "*";

    private static final Pattern BLANK_LINE = Pattern.compile("\n[ \t]*\n");

    public ListHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("ol", (element, context) -> list(element, context, ORDERED_MARKER));
        handlers.put("ul", (element, context) -> list(element, context, UNORDERED_MARKER));
        handlers.put("li", this::listItem);
        handlers.put("dl", this::definitionList);
        handlers.put("dt", this::term);
        handlers.put("dd", this::description);
    }

    // source indentation between items would otherwise leave blank lines inside the list
    String list(Element element, ConversionContext context, String marker) {
        return context.withListMarker(marker,
                () -> "\n" + converter.convertChildren(element, context, true) + "\n");
    }

    /**
     * The first line of an item has to sit next to its marker. Anything after a blank line
     * goes into an open block attached with a list continuation, otherwise the blank line
     * would end the list.
     */
    String listItem(Element element, ConversionContext context) {
        String marker = context.getListMarker();
        if (marker == null) {
            context.warn("List item outside of a list");
            marker = UNORDERED_MARKER;
        }
        String text = children(element, context).stripLeading();
        Matcher blankLine = BLANK_LINE.matcher(text);
        if (blankLine.find()) {
            String first = text.substring(0, blankLine.start());
            String rest = text.substring(blankLine.end()).strip();
            if (!rest.isEmpty()) {
                return marker + " " + first + "\n+\n--\n" + rest + "\n--\n";
            }
            return marker + " " + first + "\n";
        }
        return marker + " " + text.stripTrailing() + "\n";
    }

    String definitionList(Element element, ConversionContext context) {
        return "\n" + converter.convertChildren(element, context, true) + "\n";
    }

    /** The description follows on the same line; a term without one ends its own line. */
    String term(Element element, ConversionContext context) {
        Element next = element.nextElementSibling();
        boolean described = next != null && next.tagName().equalsIgnoreCase("dd");
        return children(element, context).strip() + "::" + (described ? "" : "\n");
    }

    String description(Element element, ConversionContext context) {
        return "  " + children(element, context).strip() + "\n";
    }
}
