package org.dxworks.flaredoc.converter.handler;

import org.dxworks.flaredoc.converter.AsciidocConverter;
import org.dxworks.flaredoc.converter.ConversionContext;
import org.dxworks.flaredoc.converter.TagHandler;
import org.jsoup.nodes.Element;

import java.util.Map;

public class FigureHandlers extends HandlerGroup {

    public FigureHandlers(AsciidocConverter converter) {
        super(converter);
    }

    @Override
    public void register(Map<String, TagHandler> handlers) {
        handlers.put("figure", this::figure);
        handlers.put("figcaption", this::caption);
        handlers.put("caption", this::caption);
    }

    String figure(Element element, ConversionContext context) {
        ConversionContext.CaptionSlot caption = new ConversionContext.CaptionSlot();
        String body = context.withCaptionSlot(caption, () -> children(element, context));
        if (!caption.isFilled() || caption.getCaption().isBlank()) {
            return body;
        }
        return "\n." + caption.getCaption().strip() + "\n" + body.strip() + "\n";
    }

    /** Stores the caption for the enclosing figure or table; it emits nothing in place. */
    String caption(Element element, ConversionContext context) {
        ConversionContext.CaptionSlot slot = context.getCaptionSlot();
        if (slot == null) {
            context.warn("Caption outside of a figure dropped");
            return "";
        }
        if (slot.isFilled()) {
            context.warn("Second caption in the same figure dropped");
            return "";
        }
        slot.fill(children(element, context).replace('\n', ' ').strip());
        return "";
    }
}
