package com.flagship.balance_service.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Servlet filter that reuses or generates the request id.
 *
 * This filter:
 * 1. Reads X-Request-ID from the incoming request, generating an id if it is missing or blank
 * 2. Attaches it to the request and to the MDC
 * 3. Echoes it in the response header
 * 4. Cleans up the MDC after the request completes
 *
 * Order: HIGHEST_PRECEDENCE so the id exists before request logging starts.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String requestId = RequestIdContext.resolve(request.getHeader(RequestIdContext.REQUEST_ID_HEADER));

        RequestIdContext.attach(request, requestId);
        MDC.put(RequestIdContext.REQUEST_ID_MDC_KEY, requestId);
        response.setHeader(RequestIdContext.REQUEST_ID_HEADER, requestId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(RequestIdContext.REQUEST_ID_MDC_KEY);
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
