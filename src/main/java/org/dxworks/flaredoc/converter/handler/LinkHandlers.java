package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Element;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Hyperlinks, anchors and images.
 */
public class LinkHandlers extends HandlerGroup {

    // both are the default placement in AsciiDoc
    private static final Set<String> DEFAULT_ALIGNMENTS = Set.of("middle", "top");
    private static final Set<String> IGNORED_IMAGE_ATTRIBUTES = Set.of("style", "madcap:mediastyle");

    public LinkHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("a", this::anchor);
        handlers.put("img", this::image);
    }

    String anchor(Element element, ConversionContext context) {
        String href = attr(element, "href");
        if (href != null) {
            String text = hasChildren(element) ? children(element, context) : valueOrEmpty(attr(element, "title"));
            return "link:" + href + "[" + text + "]";
        }

        if (hasChildren(element)) {
            context.warn("Anchor without href should be empty: <a " + element.attributes().html().trim() + ">");
        }
        String name = attr(element, "name");
        String id = attr(element, "id");
        if (name == null) {
            context.warn("Anchor without name attribute");
        } else if (id != null && !name.equals(id)) {
            context.warn("Anchor name '" + name + "' does not match id '" + id + "'");
        }
        if (id == null) {
            context.warn("Anchor without id attribute dropped");
            return "";
        }
        return "[[" + id + "]]";
    }

    /**
     * Block image when it opens a paragraph, inline image otherwise. Only the file name is
     * kept; the directory is checked against the first image of the document, since all
     * images are expected to live in one folder.
     */
    String image(Element element, ConversionContext context) {
        String fileName = null;
        String title = "";
        boolean block = context.isAtParagraphStart();

        for (Attribute attribute : element.attributes()) {
            String key = key(attribute);
            String value = attribute.getValue();
            switch (key) {
                case "src" -> fileName = imageFileName(value, context);
                case "alt" -> title = value;
                case "align" -> {
                    if (!DEFAULT_ALIGNMENTS.contains(value.toLowerCase(Locale.ROOT))) {
                        context.warn("Unsupported image alignment: " + value);
                    }
                }
                case "xmlns" -> {
                    if (!value.isEmpty() && !value.equals(XHTML_NAMESPACE)) {
                        context.warn("Unsupported namespace on <img>: " + value);
                    }
                }
                default -> {
                    if (!IGNORED_IMAGE_ATTRIBUTES.contains(key)) {
                        context.warn("Unsupported image attribute " + attribute.getKey() + "=" + value);
                    }
                }
            }
        }

        if (fileName == null) {
            context.warn("Image without src dropped");
            return "";
        }
        if (block) {
            return "\nimage::" + fileName + "[" + title + "]\n";
        }
        return "image:" + fileName + "[" + title + "]";
    }

    private static String imageFileName(String src, ConversionContext context) {
        String path = src.replace('\\', '/');
        int slash = path.lastIndexOf('/');
        String directory = slash >= 0 ? path.substring(0, slash) : "";
        String fileName = path.substring(slash + 1);

        String expected = context.getImageDirectory();
        if (expected == null) {
            context.setImageDirectory(directory);
        } else if (!expected.equalsIgnoreCase(directory)) {
            context.warn("Image directory '" + directory + "' differs from '" + expected + "'");
        }
        return fileName;
    }

    private static String valueOrEmpty(String value) {
        return value == null ? "" : value;
    }
}
