package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Headings, paragraphs, conditional divs and the other block-level tags.
 */
public class BlockHandlers extends HandlerGroup {

    static final String CONDITIONS_ATTRIBUTE = "madcap:conditions";

    private static final Pattern LEADING_ANCHOR = Pattern.compile("^(\\[\\[[^\\]]+\\]\\])\\s*");
    private static final Map<String, String> ADMONITIONS = Map.of(
            "note", "NOTE",
            "important", "IMPORTANT",
            "tip", "TIP");
    // AsciiDoc has one section level fewer than HTML; level 0 is the document title
    private static final int MAX_SECTION_LEVEL = 5;

    public BlockHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        for (int level = 1; level <= 6; level++) {
            int headingLevel = level;
            handlers.put("h" + level, (element, context) -> heading(element, context, headingLevel));
        }
        handlers.put("p", this::paragraph);
        handlers.put("div", this::div);
        handlers.put("br", (element, context) -> " +\n");
        handlers.put("hr", (element, context) -> "\n'''\n");
        handlers.put("pre", this::preformatted);
        handlers.put("blockquote", this::blockquote);
        handlers.put("html", passThrough(converter));
        handlers.put("body", passThrough(converter));
        handlers.put("head", (element, context) -> "");
    }

    String heading(Element element, ConversionContext context, int level) {
        String text = children(element, context).replace('\n', ' ').trim();
        String anchor = "";
        Matcher matcher = LEADING_ANCHOR.matcher(text);
        if (matcher.find()) {
            // an anchor inside the title text is not picked up by AsciiDoc, so it goes on the line above
            anchor = matcher.group(1) + "\n";
            text = text.substring(matcher.end());
        }
        String marker = "=".repeat(Math.min(level, MAX_SECTION_LEVEL) + 1);
        return "\n" + anchor + marker + " " + text + "\n";
    }

    String paragraph(Element element, ConversionContext context) {
        List<String> roles = new ArrayList<>();
        String blockPrefix = "";
        String blockSuffix = "";
        String inlinePrefix = "";
        String inlineSuffix = "";

        for (Attribute attribute : element.attributes()) {
            String key = key(attribute);
            String value = attribute.getValue().trim();
            if (key.equals("class")) {
                String admonition = ADMONITIONS.get(value.toLowerCase(Locale.ROOT));
                if (admonition != null) {
                    blockPrefix = "[" + admonition + "]\n====\n";
                    blockSuffix = "\n====";
                } else if (!value.isEmpty()) {
                    roles.addAll(Arrays.asList(value.split("\\s+")));
                }
            } else if (key.equals("style")) {
                for (String[] declaration : parseStyle(value)) {
                    String property = declaration[0];
                    String propertyValue = declaration[1];
                    switch (property) {
                        case "text-align" -> roles.add("text-" + propertyValue);
                        case "font-style" -> {
                            if (propertyValue.equals("italic")) {
                                inlinePrefix = inlinePrefix + "_";
                                inlineSuffix = "_" + inlineSuffix;
                            } else if (!propertyValue.equals("normal")) {
                                context.warn("Unsupported font-style: " + propertyValue);
                            }
                        }
                        case "font-weight" -> {
                            if (propertyValue.equals("bold")) {
                                inlinePrefix = inlinePrefix + "*";
                                inlineSuffix = "*" + inlineSuffix;
                            } else {
                                context.warn("Unsupported font-weight: " + propertyValue);
                            }
                        }
                        default -> context.warn("Unsupported CSS property on <p>: " + property);
                    }
                }
            } else if (!key.contains(":") && !key.equals("id") && !key.equals("xmlns")) {
                context.warn("Unsupported attribute on <p>: " + attribute.getKey() + "=" + attribute.getValue());
            }
        }

        String roleLine = roles.isEmpty() ? "" : "[." + String.join(".", roles) + "]\n";
        return "\n" + roleLine + blockPrefix + inlinePrefix + children(element, context)
                + inlineSuffix + blockSuffix + "\n";
    }

    String div(Element element, ConversionContext context) {
        String conditions = null;
        for (Attribute attribute : element.attributes()) {
            String key = key(attribute);
            if (key.equals(CONDITIONS_ATTRIBUTE)) {
                conditions = conditionName(attribute.getValue());
            } else if (key.equals("style")) {
                context.warn("Unsupported style on <div>: " + attribute.getValue());
            } else {
                context.warn("Ignored attribute on <div>: " + attribute.getKey() + "=" + attribute.getValue());
            }
        }
        String content = children(element, context);
        if (conditions == null || conditions.isEmpty()) {
            return content;
        }
        return "\nifdef::" + conditions + "[]\n" + content + "\nendif::" + conditions + "[]\n";
    }

    String preformatted(Element element, ConversionContext context) {
        String text = element.wholeText().replaceFirst("^\n", "").stripTrailing();
        return "\n----\n" + text + "\n----\n";
    }

    String blockquote(Element element, ConversionContext context) {
        return "\n____\n" + children(element, context).strip() + "\n____\n";
    }

    /** {@code Default.PrintOnly, Default.Beta} becomes {@code Default-PrintOnly,Default-Beta}. */
    static String conditionName(String conditions) {
        return Arrays.stream(conditions.split(","))
                .map(String::trim)
                .filter(condition -> !condition.isEmpty())
                .map(HandlerGroup::attributeName)
                .collect(Collectors.joining(","));
    }

    /** Minimal {@code property: value; ...} parser; both parts lower-cased and trimmed. */
    static List<String[]> parseStyle(String style) {
        List<String[]> declarations = new ArrayList<>();
        for (String part : style.split(";")) {
            int colon = part.indexOf(':');
            if (colon < 0) {
                continue;
            }
            String property = part.substring(0, colon).trim().toLowerCase(Locale.ROOT);
            String value = part.substring(colon + 1).trim().toLowerCase(Locale.ROOT);
            if (!property.isEmpty()) {
                declarations.add(new String[]{property, value});
            }
        }
        return declarations;
    }
}
