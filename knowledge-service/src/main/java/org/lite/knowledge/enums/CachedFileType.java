package org.lite.knowledge.enums;

import java.util.Locale;

public enum CachedFileType {
    PDF("pdf"),
    TXT("txt"),
    UNKNOWN("unknown");

    private final String id;

    CachedFileType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static CachedFileType fromFilename(String filename) {
        if (filename == null) {
            return UNKNOWN;
        }
        String lower = filename.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".pdf")) {
            return PDF;
        }
        if (lower.endsWith(".txt")) {
            return TXT;
        }
        return UNKNOWN;
    }
}
