package org.dxworks.flaredoc.model;

/**
 * One {@code document} line of the JSONL run report.
 */
public class DocumentConversion {
    public String kind = "document";
    public String filePath;
    public String documentType; // topic or snippet
    public String outputPath;
    public int warnings;
}
