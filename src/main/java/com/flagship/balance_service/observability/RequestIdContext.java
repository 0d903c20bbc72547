package com.flagship.balance_service.observability;

import jakarta.servlet.ServletRequest;

import java.security.SecureRandom;
import java.util.Base64;

/**
 * Request id resolution and lookup.
 *
 * The request id flows through:
 * - the X-Request-ID request header (reused when the caller sends one)
 * - a request attribute for the lifetime of the request
 * - the MDC, so every log line of the request carries it
 * - the X-Request-ID response header
 */
public final class RequestIdContext {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_MDC_KEY = "requestId";
    public static final String REQUEST_ID_ATTRIBUTE = RequestIdContext.class.getName() + ".REQUEST_ID";

    static final String FALLBACK_REQUEST_ID = "fallback-id";

    private static final int RANDOM_BYTES = 16;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    private RequestIdContext() {
        // Utility class
    }

    /**
     * Returns the inbound header value if it carries any non-whitespace text,
     * otherwise a freshly generated id.
     */
    public static String resolve(String headerValue) {
        if (headerValue != null && !headerValue.isBlank()) {
            return headerValue;
        }
        return generateRequestId();
    }

    /**
     * Generates a 22 character URL-safe id from 16 random bytes.
     */
    public static String generateRequestId() {
        return generateRequestId(RANDOM);
    }

    static String generateRequestId(SecureRandom random) {
        try {
            byte[] bytes = new byte[RANDOM_BYTES];
            random.nextBytes(bytes);
            return ENCODER.encodeToString(bytes);
        } catch (RuntimeException e) {
            // request tagging is best effort
            return FALLBACK_REQUEST_ID;
        }
    }

    public static void attach(ServletRequest request, String requestId) {
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
    }

    /**
     * Gets the request id attached to this request.
     *
     * @return the id, or an empty string when the request is untagged
     */
    public static String get(ServletRequest request) {
        if (request == null) {
            return "";
        }
        Object value = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return value instanceof String ? (String) value : "";
    }
}
