package com.ztverify.riskauth.api;

import jakarta.servlet.http.HttpServletRequest;

final class ClientAddresses {

    private ClientAddresses() {
    }

    /** First X-Forwarded-For hop when present, else the socket peer. */
    static String resolve(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return forwarded.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }
}
