package org.lite.knowledge.model;

public record TextStats(int chars, int words, int lines) {

    public static TextStats of(String text) {
        if (text == null || text.isEmpty()) {
            return new TextStats(0, 0, 0);
        }
        String trimmed = text.strip();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        int lines = (int) text.chars().filter(c -> c == '\n').count() + 1;
        return new TextStats(text.length(), words, lines);
    }
}
