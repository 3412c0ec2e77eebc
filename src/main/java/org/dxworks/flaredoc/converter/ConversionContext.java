package org.dxworks.flaredoc.converter;

import java.nio.file.Path;
import java.util.Map;
import java.util.function.Supplier;

/**
 * State threaded through the recursive conversion of one document.
 *
 * A new instance is created for every document so that paragraph and image state never
 * leaks from one file into the next. Scoped values (list marker, table options, caption slot)
 * are set through the {@code with*} methods, which restore the outer value on exit.
 */
public final class ConversionContext {

    private final String documentLabel;
    private final Path sourceDirectory;
    private final ConversionWarningSink warnings;

    private String listMarker;
    private Map<String, Boolean> tableOptions;
    private int tableDepth;
    private CaptionSlot captionSlot;
    private boolean atParagraphStart = true;
    private String imageDirectory;
    private int warningCount;

    public ConversionContext(String documentLabel, Path sourceDirectory, ConversionWarningSink warnings) {
        this.documentLabel = documentLabel;
        this.sourceDirectory = sourceDirectory;
        this.warnings = warnings;
    }

    public void warn(String message) {
        warningCount++;
        warnings.warn(documentLabel, message);
    }

    public int getWarningCount() {
        return warningCount;
    }

    public String getDocumentLabel() {
        return documentLabel;
    }

    /** Directory of the source document, or {@code null} when converting detached markup. */
    public Path getSourceDirectory() {
        return sourceDirectory;
    }

    public String getListMarker() {
        return listMarker;
    }

    public <T> T withListMarker(String marker, Supplier<T> body) {
        String outer = listMarker;
        listMarker = marker;
        try {
            return body.get();
        } finally {
            listMarker = outer;
        }
    }

    public Map<String, Boolean> getTableOptions() {
        return tableOptions;
    }

    /** Number of tables enclosing the current node; 0 outside any table. */
    public int getTableDepth() {
        return tableDepth;
    }

    public <T> T withTableOptions(Map<String, Boolean> options, Supplier<T> body) {
        Map<String, Boolean> outer = tableOptions;
        tableOptions = options;
        tableDepth++;
        try {
            return body.get();
        } finally {
            tableOptions = outer;
            tableDepth--;
        }
    }

    public CaptionSlot getCaptionSlot() {
        return captionSlot;
    }

    public <T> T withCaptionSlot(CaptionSlot slot, Supplier<T> body) {
        CaptionSlot outer = captionSlot;
        captionSlot = slot;
        try {
            return body.get();
        } finally {
            captionSlot = outer;
        }
    }

    public boolean isAtParagraphStart() {
        return atParagraphStart;
    }

    public void setAtParagraphStart(boolean atParagraphStart) {
        this.atParagraphStart = atParagraphStart;
    }

    public String getImageDirectory() {
        return imageDirectory;
    }

    public void setImageDirectory(String imageDirectory) {
        this.imageDirectory = imageDirectory;
    }

    /**
     * Pending caption of the enclosing figure or table. Filled at most once.
     */
    public static final class CaptionSlot {
        private String caption;
        private boolean filled;

        public boolean isFilled() {
            return filled;
        }

        public String getCaption() {
            return caption;
        }

        public void fill(String caption) {
            if (filled) {
                throw new IllegalStateException("Caption already set");
            }
            this.caption = caption;
            this.filled = true;
        }
    }
}
