package tech.noetzold.waf_api.util;

import java.util.Optional;

/**
 * Pulls the first balanced JSON object or array out of free text, for model replies that wrap
 * their JSON in prose or code fences.
 */
public final class JsonSpans {

    private JsonSpans() {
    }

    public static Optional<String> firstObject(String text) {
        return firstBalanced(text, '{', '}');
    }

    public static Optional<String> firstArray(String text) {
        return firstBalanced(text, '[', ']');
    }

    static Optional<String> firstBalanced(String text, char open, char close) {
        if (text == null) return Optional.empty();
        int start = text.indexOf(open);
        while (start >= 0) {
            int end = matchingClose(text, start, open, close);
            if (end > start) {
                return Optional.of(text.substring(start, end + 1));
            }
            start = text.indexOf(open, start + 1);
        }
        return Optional.empty();
    }

    private static int matchingClose(String text, int start, char open, char close) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == open) {
                depth++;
            } else if (c == close) {
                depth--;
                if (depth == 0) return i;
            }
        }
        return -1;
    }
}
