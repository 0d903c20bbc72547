package com.flagship.balance_service.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

import java.io.IOException;
import java.time.Duration;
import java.util.Locale;

/**
 * Logs one Start and one End event per request.
 * Both carry the request id, as a message field and through the MDC entry
 * set by {@link RequestIdFilter}.
 *
 * The End event carries the status observed by {@link StatusRecordingResponseWrapper},
 * or 500 when an exception escapes the chain, and the wall-clock time spent in the rest of the chain, measured with
 * {@link System#nanoTime()}. Instrumentation never changes the response: any
 * failure while logging or recording metrics is counted and dropped.
 *
 * Order: runs right after {@link RequestIdFilter} so the request id is available.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 1)
@RequiredArgsConstructor
@Slf4j
public class RequestLoggingFilter extends OncePerRequestFilter {

    static final String UNKNOWN_ROUTE = "UNKNOWN";

    private final LedgerMetrics ledgerMetrics;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String method = request.getMethod();
        String path = request.getRequestURI();
        String requestId = RequestIdContext.get(request);

        instrument(() -> log.info("[{}] Start {} {}", requestId, method, path));

        StatusRecordingResponseWrapper recorder = new StatusRecordingResponseWrapper(response);
        long start = System.nanoTime();
        boolean failed = false;
        try {
            filterChain.doFilter(request, recorder);
        } catch (ServletException | IOException | RuntimeException e) {
            failed = true;
            throw e;
        } finally {
            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            int status = finalStatus(recorder.getRecordedStatus(), failed);
            instrument(() -> {
                log.info("[{}] End {} {} - status: {}, duration: {}",
                        requestId, method, path, status, formatDuration(duration));
                ledgerMetrics.recordRequestDuration(routePattern(request), method, status, duration);
            });
        }
    }

    /**
     * An exception escaping the chain is answered by the container with 500
     * unless the handler had already chosen an error status.
     */
    static int finalStatus(int recordedStatus, boolean failed) {
        if (failed && recordedStatus < HttpServletResponse.SC_BAD_REQUEST) {
            return HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        }
        return recordedStatus;
    }

    // Route template, so metric tags stay bounded whatever URIs clients send.
    private static String routePattern(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern instanceof String ? (String) pattern : UNKNOWN_ROUTE;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }

    private void instrument(Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            ledgerMetrics.recordInstrumentationFailure();
        }
    }

    static String formatDuration(Duration duration) {
        long micros = duration.toNanos() / 1_000;
        if (micros < 1_000) {
            return micros + "us";
        }
        return String.format(Locale.ROOT, "%.3fms", micros / 1_000.0);
    }
}
