package tech.noetzold.waf_api.util;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientAddress {

    private ClientAddress() {
    }

    /**
     * With {@code trustForwarded} the first X-Forwarded-For hop wins, else X-Real-IP, else the socket
     * peer. Without it only the socket peer counts, since any client can set those headers.
     */
    public static String resolve(HttpServletRequest request, boolean trustForwarded) {
        if (!trustForwarded) {
            return request.getRemoteAddr();
        }

        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }

        String xRealIp = request.getHeader("X-Real-IP");
        if (xRealIp != null && !xRealIp.isEmpty()) {
            return xRealIp;
        }

        return request.getRemoteAddr();
    }
}
