package com.phillippitts.selfconsistency.config.logging;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Puts the correlation values of an aggregation request into Log4j2's ThreadContext.
 *
 * <p>{@code requestId} comes from {@code X-Request-ID} when the caller sends a usable one, else a
 * fresh UUID. Either way it is returned in the {@code X-Request-ID} response header so a client
 * can find the log lines of all K samples and the reflection call of its request. The reasoning
 * pool copies the context onto its worker threads.
 *
 * <p>Caller ids end up verbatim in every log line, so only short ids made of letters, digits,
 * {@code .}, {@code _} and {@code -} are taken over. {@code X-User-ID} follows the same rule and
 * is dropped when unusable.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class MdcFilter implements Filter {

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    static final String USER_ID_HEADER = "X-User-ID";

    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        if (!(request instanceof HttpServletRequest http)) {
            chain.doFilter(request, response);
            return;
        }

        String requestId = safeId(http.getHeader(REQUEST_ID_HEADER));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (response instanceof HttpServletResponse httpResponse) {
            httpResponse.setHeader(REQUEST_ID_HEADER, requestId);
        }

        try {
            ThreadContext.put("requestId", requestId);
            String userId = safeId(http.getHeader(USER_ID_HEADER));
            if (userId != null) {
                ThreadContext.put("userId", userId);
            }
            ThreadContext.put("method", http.getMethod());
            ThreadContext.put("uri", http.getRequestURI());
            chain.doFilter(request, response);
        } finally {
            ThreadContext.clearAll();
        }
    }

    static String safeId(String header) {
        if (header == null) {
            return null;
        }
        String trimmed = header.trim();
        return SAFE_ID.matcher(trimmed).matches() ? trimmed : null;
    }
}
