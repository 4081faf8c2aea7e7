package tech.noetzold.waf_api.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lenient percent-decoding. Unlike {@link java.net.URLDecoder} it never throws on malformed
 * escapes and leaves {@code +} alone: invalid sequences pass through untouched and invalid
 * UTF-8 becomes U+FFFD.
 */
public final class PercentDecoding {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private PercentDecoding() {
    }

    public static String unquote(String text) {
        if (text == null || text.indexOf('%') < 0) {
            return text;
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream(text.length());
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '%' && i + 2 < n && isHex(text.charAt(i + 1)) && isHex(text.charAt(i + 2))) {
                out.write((Character.digit(text.charAt(i + 1), 16) << 4) | Character.digit(text.charAt(i + 2), 16));
                i += 3;
                continue;
            }
            int cp = text.codePointAt(i);
            byte[] bytes = new String(Character.toChars(cp)).getBytes(StandardCharsets.UTF_8);
            out.write(bytes, 0, bytes.length);
            i += Character.charCount(cp);
        }
        return out.toString(StandardCharsets.UTF_8);
    }

    /**
     * Decodes exactly {@code layers} times (or fewer if the text stops changing).
     */
    public static String unquote(String text, int layers) {
        String current = text;
        for (int i = 0; i < layers; i++) {
            String next = unquote(current);
            if (next.equals(current)) break;
            current = next;
        }
        return current;
    }

    /**
     * Canonical form used for fuzzy duplicate detection: percent-decoded until stable,
     * lowercased, whitespace runs collapsed to one space, trimmed. The result is a fixed point,
     * so normalising twice gives the same string.
     */
    public static String normalizePayload(String payload) {
        if (payload == null) return "";
        String current = payload;
        while (true) {
            String next = unquote(current);
            if (next.equals(current)) break;
            current = next;
        }
        current = current.toLowerCase(Locale.ROOT);
        current = WHITESPACE.matcher(current).replaceAll(" ");
        return current.trim();
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0 && c < 128;
    }
}
