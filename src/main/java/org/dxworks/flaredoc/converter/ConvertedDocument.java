package org.dxworks.flaredoc.converter;

public record ConvertedDocument(String text, int warnings) {
}
