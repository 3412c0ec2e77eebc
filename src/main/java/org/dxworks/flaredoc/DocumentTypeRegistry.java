package org.dxworks.flaredoc;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

public class DocumentTypeRegistry {

    public static Optional<DocumentType> detectType(Path filePath) {
        String fileName = filePath.getFileName().toString().toLowerCase(Locale.ROOT);
        for (DocumentType type : DocumentType.values()) {
            if (type.matchesFileName(fileName)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    public static boolean isConvertible(Path filePath) {
        return detectType(filePath).isPresent();
    }

    /**
     * Name of the converted file: the source file name with its extension replaced,
     * so {@code Topic.htm} and {@code Topic.flsnp} both map to {@code Topic.adoc}.
     */
    public static String outputFileName(Path filePath, String outputExtension) {
        String fileName = filePath.getFileName().toString();
        int lastDot = fileName.lastIndexOf('.');
        String baseName = lastDot <= 0 ? fileName : fileName.substring(0, lastDot);
        return baseName + outputExtension;
    }
}
