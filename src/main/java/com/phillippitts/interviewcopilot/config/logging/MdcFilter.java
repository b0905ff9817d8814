package com.phillippitts.interviewcopilot.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Correlation context for HTTP traffic, including the WebSocket upgrade request that opens a
 * live session.
 *
 * <p>Keys put into Log4j2's ThreadContext:
 * <ul>
 *   <li>{@code requestId}: {@code X-Request-ID} if the caller sent one, otherwise a new UUID.
 *       Echoed back in the response so a client can quote it in a report.</li>
 *   <li>{@code userId}: {@code X-User-ID}, or the {@code user_id} query parameter that local
 *       session clients use. Omitted when neither is present.</li>
 *   <li>{@code method} and {@code uri}</li>
 * </ul>
 *
 * <p>Session work that outlives the request (audio, generation) carries its own
 * {@code sessionId}/{@code userId} context on the session queues.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter extends OncePerRequestFilter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";
    static final String USER_ID_PARAM = "user_id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String requestId = firstNonBlank(request.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        String userId = firstNonBlank(request.getHeader(USER_ID_HEADER), request.getParameter(USER_ID_PARAM));

        ThreadContext.put("requestId", requestId);
        if (userId != null) {
            ThreadContext.put("userId", userId);
        }
        ThreadContext.put("method", request.getMethod());
        ThreadContext.put("uri", request.getRequestURI());
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearMap();
        }
    }

    private static String firstNonBlank(String... candidates) {
        for (String candidate : candidates) {
            if (candidate != null && !candidate.isBlank()) {
                return candidate.strip();
            }
        }
        return null;
    }
}
