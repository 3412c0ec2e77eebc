package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.dxworks.flaredoc.snippet.SnippetReference;
import org.dxworks.flaredoc.snippet.SnippetRegistry;
import org.jsoup.nodes.Element;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Flare-specific tags from the {@code MadCap:} namespace.
 */
public class MadCapHandlers extends HandlerGroup {

    private static final Pattern TOPIC_EXTENSION = Pattern.compile("\\.html?(?=#|$)", Pattern.CASE_INSENSITIVE);
    private static final Pattern SNIPPET_EXTENSION =
            Pattern.compile(Pattern.quote(SnippetRegistry.SNIPPET_EXTENSION) + "$", Pattern.CASE_INSENSITIVE);
    // generated by Flare for print output, usually with a non-breaking space before the number
    private static final Pattern PAGE_NUMBER =
            Pattern.compile("\\s+on\\s+page(?:\\s|\\{nbsp\\})*\\d*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern SURROUNDING_QUOTES = Pattern.compile("^[\"\u201C\u201D]|[\"\u201C\u201D]$");

    public MadCapHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("madcap_xref", this::crossReference);
        handlers.put("madcap_snippettext", this::snippetText);
        handlers.put("madcap_snippetblock", this::snippetBlock);
        handlers.put("madcap_variable", this::variable);
        handlers.put("madcap_pagebreak", (element, context) -> "\n<<<\n");
        handlers.put("madcap_equation", this::equation);
        handlers.put("madcap_conditionaltext", this::conditionalText);
    }

    String crossReference(Element element, ConversionContext context) {
        String href = attr(element, "href");
        if (href == null) {
            context.warn("Cross-reference without href");
            return children(element, context);
        }
        String target = TOPIC_EXTENSION.matcher(href).replaceFirst(Matcher.quoteReplacement(converter.getOutputExtension()));

        String title = PAGE_NUMBER.matcher(children(element, context).strip()).replaceFirst("").strip();
        title = SURROUNDING_QUOTES.matcher(title).replaceAll("").strip();
        if (title.isEmpty()) {
            int hash = href.indexOf('#');
            if (hash >= 0) {
                title = "see " + href.substring(hash + 1);
            }
        }
        return "xref:" + target + "[" + title + "]";
    }

    String snippetText(Element element, ConversionContext context) {
        if (hasChildren(element)) {
            context.warn("Snippet reference should be empty");
        }
        String src = attr(element, "src");
        if (src == null) {
            context.warn("Snippet reference without src dropped");
            return "";
        }
        if (!SnippetRegistry.isSnippetPath(src)) {
            context.warn("Unexpected snippet path: " + src);
        }
        SnippetReference reference = converter.getSnippets().reference(src, context.getSourceDirectory());
        if (reference.isConflict()) {
            context.warn("Snippet name '" + reference.name() + "' already used by " + reference.conflictingPath()
                    + "; " + src + " resolves to that definition");
        }
        return "{" + reference.name() + "}";
    }

    String snippetBlock(Element element, ConversionContext context) {
        if (hasChildren(element)) {
            context.warn("Snippet block should be empty");
        }
        String src = attr(element, "src");
        if (src == null) {
            context.warn("Snippet block without src dropped");
            return "";
        }
        if (!SNIPPET_EXTENSION.matcher(src).find()) {
            context.warn("Unexpected snippet path: " + src);
        }
        String include = SNIPPET_EXTENSION.matcher(src).replaceFirst(Matcher.quoteReplacement(converter.getOutputExtension()));
        return "\ninclude::" + include + "[]\n";
    }

    String variable(Element element, ConversionContext context) {
        String name = attr(element, "name");
        if (name == null) {
            context.warn("Variable without name dropped");
            return "";
        }
        return "{" + attributeName(name) + "}";
    }

    String equation(Element element, ConversionContext context) {
        String text = element.wholeText().strip();
        if (text.startsWith("$")) {
            text = text.substring(1);
        }
        if (text.endsWith("$")) {
            text = text.substring(0, text.length() - 1);
        }
        return "latexmath:[" + text + "]";
    }

    /**
     * AsciiDoc only has block-level (line based) conditionals, so inline conditional text keeps
     * its content and loses the condition.
     */
    String conditionalText(Element element, ConversionContext context) {
        String conditions = attr(element, BlockHandlers.CONDITIONS_ATTRIBUTE);
        if (conditions != null && !conditions.isBlank()) {
            context.warn("Inline condition dropped: " + BlockHandlers.conditionName(conditions));
        }
        return children(element, context);
    }
}
