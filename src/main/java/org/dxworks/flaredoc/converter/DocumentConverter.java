package org.dxworks.flaredoc.converter;

import org.jsoup.nodes.Node;

import java.nio.file.Path;

public interface DocumentConverter {
    ConvertedDocument convert(String documentLabel, Path sourceDirectory, Node root);
}
