package org.lite.knowledge.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Labels, relationship types and index names cannot be passed as Cypher parameters, so anything
 * spliced into a query goes through here first.
 */
public final class CypherNames {

    private static final Pattern NON_IDENTIFIER = Pattern.compile("[^A-Za-z0-9_]+");
    private static final Pattern INDEX_NAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private CypherNames() {
    }

    /**
     * "legal entity" becomes "LegalEntity". Returns null when nothing usable is left.
     */
    public static String label(String raw) {
        if (raw == null) {
            return null;
        }
        StringBuilder label = new StringBuilder();
        for (String part : NON_IDENTIFIER.split(raw.trim())) {
            if (!part.isEmpty()) {
                label.append(Character.toUpperCase(part.charAt(0))).append(part.substring(1));
            }
        }
        return toIdentifier(label.toString());
    }

    /**
     * "works for" becomes "WORKS_FOR". Returns null when nothing usable is left.
     */
    public static String relationshipType(String raw) {
        if (raw == null) {
            return null;
        }
        String type = NON_IDENTIFIER.matcher(raw.trim()).replaceAll("_").toUpperCase(Locale.ROOT);
        type = type.replaceAll("^_+|_+$", "");
        return toIdentifier(type);
    }

    public static String indexName(String raw) {
        if (raw == null || !INDEX_NAME.matcher(raw).matches()) {
            throw new IllegalArgumentException("Invalid index name: '" + raw + "'");
        }
        return raw;
    }

    private static String toIdentifier(String value) {
        if (value.isEmpty()) {
            return null;
        }
        return Character.isDigit(value.charAt(0)) ? "_" + value : value;
    }
}
