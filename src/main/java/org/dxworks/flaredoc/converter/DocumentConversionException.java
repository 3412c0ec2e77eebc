package org.dxworks.flaredoc.converter;

/**
 * Fatal fault for a single document. The run reports it and moves on to the next file.
 */
public class DocumentConversionException extends RuntimeException {

    private final String documentLabel;

    public DocumentConversionException(String documentLabel, String message, Throwable cause) {
        super("Failed to convert " + documentLabel + ": " + message, cause);
        this.documentLabel = documentLabel;
    }

    public String getDocumentLabel() {
        return documentLabel;
    }
}
