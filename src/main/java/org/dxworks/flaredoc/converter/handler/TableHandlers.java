package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class TableHandlers extends HandlerGroup {

    static final String HEADER_OPTION = "header";
    static final String FOOTER_OPTION = "footer";

    private static final String TABLE_DELIMITER = "|===";
    // AsciiDoc supports one level of nesting, fenced and separated with '!'
    private static final String NESTED_TABLE_DELIMITER = "!===";

    public TableHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("table", this::table);
        handlers.put("tr", this::row);
        handlers.put("td", this::cell);
        handlers.put("th", this::headerCell);
        handlers.put("tfoot", this::footer);
        // TODO: carry col widths over into a cols="..." attribute
        for (String wrapper : List.of("thead", "tbody", "colgroup", "col")) {
            handlers.put(wrapper, this::rows);
        }
    }

    /**
     * Options set by cells anywhere in the table are only known once the whole table has been
     * converted, so the attribute line is prepended afterwards.
     */
    String table(Element element, ConversionContext context) {
        if (context.getTableDepth() > 1) {
            context.warn("Table nested more than one level deep");
        }
        String delimiter = context.getTableDepth() > 0 ? NESTED_TABLE_DELIMITER : TABLE_DELIMITER;
        Map<String, Boolean> options = new LinkedHashMap<>();
        ConversionContext.CaptionSlot caption = new ConversionContext.CaptionSlot();
        String body = context.withTableOptions(options,
                () -> context.withCaptionSlot(caption, () -> rows(element, context)));

        StringBuilder out = new StringBuilder("\n");
        if (caption.isFilled() && !caption.getCaption().isBlank()) {
            out.append('.').append(caption.getCaption().strip()).append('\n');
        }
        List<String> flags = options.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(option -> "%" + option.getKey())
                .toList();
        if (!flags.isEmpty()) {
            out.append('[').append(String.join(",", flags)).append("]\n");
        }
        out.append(delimiter).append('\n')
                .append(body.strip()).append('\n')
                .append(delimiter).append('\n');
        return out.toString();
    }

    /** Table bodies hold only rows and cells, so indentation between them is dropped. */
    String rows(Element element, ConversionContext context) {
        return converter.convertChildren(element, context, true);
    }

    String row(Element element, ConversionContext context) {
        return rows(element, context) + "\n";
    }

    /** A cell holding a nested table needs the AsciiDoc content style to render it. */
    String cell(Element element, ConversionContext context) {
        String separator = context.getTableDepth() > 1 ? "!" : "|";
        String style = element.selectFirst("table") != null ? "a" : "";
        return style + separator + children(element, context).stripTrailing();
    }

    String headerCell(Element element, ConversionContext context) {
        setOption(context, HEADER_OPTION, "Header cell outside of a table");
        return cell(element, context);
    }

    String footer(Element element, ConversionContext context) {
        setOption(context, FOOTER_OPTION, "Table footer outside of a table");
        return rows(element, context);
    }

    private static void setOption(ConversionContext context, String option, String warning) {
        Map<String, Boolean> options = context.getTableOptions();
        if (options == null) {
            context.warn(warning);
            return;
        }
        options.put(option, true);
    }
}
