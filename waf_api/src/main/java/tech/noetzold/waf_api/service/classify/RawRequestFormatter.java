package tech.noetzold.waf_api.service.classify;

import tech.noetzold.waf_api.model.InspectRequest;

import java.util.Map;
import java.util.StringJoiner;

/**
 * Renders a structured request as the single text blob the pipeline classifies:
 * request line, one {@code Key: value} line per header, blank line, body.
 */
public final class RawRequestFormatter {

    private RawRequestFormatter() {
    }

    public static String format(InspectRequest req) {
        String method = isBlank(req.method()) ? "GET" : req.method();
        String path = isBlank(req.path()) ? "/" : req.path();

        StringBuilder raw = new StringBuilder();
        raw.append(method).append(' ').append(path).append(queryString(req.query_params())).append(" HTTP/1.1");
        if (req.headers() != null) {
            for (Map.Entry<String, String> header : req.headers().entrySet()) {
                raw.append('\n').append(header.getKey()).append(": ").append(header.getValue());
            }
        }
        if (!isBlank(req.body())) {
            raw.append("\n\n").append(req.body());
        }
        return raw.toString();
    }

    private static String queryString(Map<String, String> params) {
        if (params == null || params.isEmpty()) return "";
        StringJoiner joiner = new StringJoiner("&", "?", "");
        params.forEach((k, v) -> joiner.add(k + "=" + v));
        return joiner.toString();
    }

    private static boolean isBlank(String s) {
        return s == null || s.isEmpty();
    }
}
