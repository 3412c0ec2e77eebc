package org.dxworks.flaredoc.converter;

import org.dxworks.flaredoc.converter.handler.BlockHandlers;
import org.dxworks.flaredoc.converter.handler.FigureHandlers;
import org.dxworks.flaredoc.converter.handler.InlineHandlers;
import org.dxworks.flaredoc.converter.handler.LinkHandlers;
import org.dxworks.flaredoc.converter.handler.ListHandlers;
import org.dxworks.flaredoc.converter.handler.MadCapHandlers;
import org.dxworks.flaredoc.converter.handler.TableHandlers;
import org.dxworks.flaredoc.snippet.SnippetRegistry;
import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Comment;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Converts a Flare XHTML tree into AsciiDoc.
 *
 * Each element is routed by its tag name to a {@link TagHandler}; handlers recurse through
 * {@link #convertChildren}. Nothing in a document aborts the conversion: unsupported input is
 * reported to the warning sink and skipped.
 */
public class AsciidocConverter implements DocumentConverter {

    public static final String DEFAULT_OUTPUT_EXTENSION = ".adoc";

    private static final Pattern INDENTED_LINE_START = Pattern.compile("\n[ \t]+");
    private static final Set<String> PARAGRAPH_BREAK_TAGS = Set.of("br", "p");

    private final Map<String, TagHandler> handlers;
    private final SnippetRegistry snippets;
    private final ConversionWarningSink warnings;
    private final String outputExtension;

    public AsciidocConverter(SnippetRegistry snippets, ConversionWarningSink warnings) {
        this(snippets, warnings, DEFAULT_OUTPUT_EXTENSION);
    }

    public AsciidocConverter(SnippetRegistry snippets, ConversionWarningSink warnings, String outputExtension) {
        this.snippets = snippets;
        this.warnings = warnings;
        this.outputExtension = outputExtension;

        Map<String, TagHandler> registry = new HashMap<>();
        new BlockHandlers(this).register(registry);
        new ListHandlers(this).register(registry);
        new InlineHandlers(this).register(registry);
        new LinkHandlers(this).register(registry);
        new TableHandlers(this).register(registry);
        new FigureHandlers(this).register(registry);
        new MadCapHandlers(this).register(registry);
        this.handlers = Collections.unmodifiableMap(registry);
    }

    @Override
    public ConvertedDocument convert(String documentLabel, Path sourceDirectory, Node root) {
        ConversionContext context = new ConversionContext(documentLabel, sourceDirectory, warnings);
        try {
            String converted = convertChildren(root, context);
            return new ConvertedDocument(TextNormalizer.normalize(converted), context.getWarningCount());
        } catch (RuntimeException e) {
            throw new DocumentConversionException(documentLabel, String.valueOf(e.getMessage()), e);
        }
    }

    public String convertChildren(Node node, ConversionContext context) {
        return convertChildren(node, context, false);
    }

    /**
     * Converts the children of {@code node} in order and joins the results.
     *
     * @param skipBlankText drop whitespace-only text nodes, such as indentation between rows
     */
    public String convertChildren(Node node, ConversionContext context, boolean skipBlankText) {
        StringBuilder out = new StringBuilder();
        for (Node child : node.childNodes()) {
            if (child instanceof Element element) {
                convertElement(element, context, out);
            } else if (child instanceof CDataNode cdata) {
                // CDataNode is a TextNode, so it has to be matched first
                if (!cdata.text().isBlank()) {
                    context.warn("CDATA section dropped: no AsciiDoc equivalent");
                }
            } else if (child instanceof TextNode text) {
                convertText(text, context, skipBlankText, out);
            } else if (child instanceof Comment comment) {
                convertComment(comment, out);
            } else {
                context.warn("Unsupported node kind " + child.nodeName());
            }
        }
        return out.toString();
    }

    private void convertElement(Element element, ConversionContext context, StringBuilder out) {
        String key = handlerKey(element);
        TagHandler handler = handlers.get(key);
        if (handler == null) {
            context.warn("Unsupported tag <" + element.tagName() + ">");
            return;
        }
        FragmentAssembler.append(out, handler.convert(element, context));
        context.setAtParagraphStart(PARAGRAPH_BREAK_TAGS.contains(key));
    }

    private void convertText(TextNode node, ConversionContext context, boolean skipBlankText, StringBuilder out) {
        String text = INDENTED_LINE_START.matcher(node.getWholeText()).replaceAll("\n")
                .replace("\u00A0", "{nbsp}");
        if (!text.isBlank()) {
            context.setAtParagraphStart(false);
        }
        if (skipBlankText && text.isBlank()) {
            return;
        }
        out.append(text);
    }

    private void convertComment(Comment comment, StringBuilder out) {
        String text = comment.getData().trim();
        if (text.contains("\n")) {
            FragmentAssembler.append(out, "////\n" + text + "\n////\n");
            return;
        }
        if (out.length() > 0 && out.charAt(out.length() - 1) != '\n') {
            out.append('\n');
        }
        out.append("// ").append(text).append('\n');
    }

    /**
     * Lookup key of an element: the lower-cased tag name with the namespace separator
     * turned into an underscore, so {@code MadCap:xref} is found under {@code madcap_xref}.
     */
    public static String handlerKey(Element element) {
        return element.tagName().toLowerCase(Locale.ROOT).replace(':', '_');
    }

    public Set<String> supportedTags() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }

    public SnippetRegistry getSnippets() {
        return snippets;
    }

    public String getOutputExtension() {
        return outputExtension;
    }
}
