package org.dxworks.flaredoc;

import java.util.List;

public enum DocumentType {
    TOPIC("topic", List.of(".htm", ".html")),
    SNIPPET("snippet", List.of(".flsnp"));

    private final String name;
    private final List<String> extensions;

    DocumentType(String name, List<String> extensions) {
        this.name = name;
        this.extensions = extensions;
    }

    public String getName() {
        return name;
    }

    public List<String> getExtensions() {
        return extensions;
    }

    public boolean matchesFileName(String lowerCaseFileName) {
        for (String extension : extensions) {
            if (lowerCaseFileName.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }
}
