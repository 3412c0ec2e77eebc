package org.dxworks.flaredoc.converter;

import org.jsoup.nodes.Element;

@FunctionalInterface
public interface TagHandler {
    String convert(Element element, ConversionContext context);
}
