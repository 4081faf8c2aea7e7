package tech.noetzold.waf_api.model;

import java.util.Map;

public record InspectRequest(
        String method,
        String path,
        Map<String, String> headers,
        String body,
        Map<String, String> query_params
) {}
