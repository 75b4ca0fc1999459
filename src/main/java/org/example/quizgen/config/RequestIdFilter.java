package org.example.quizgen.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;

/**
 * Tags every request with an id (caller-supplied or generated) that is echoed in the
 * response header and carried in the logging MDC, so dispatch and top-up logs of one
 * generation can be grouped.
 * <p>
 * Handlers may record the answering model and the stored quiz id as request attributes;
 * they are appended to the summary line logged when the request completes. Generation
 * requests are summarized at info, everything else at debug.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String HEADER_NAME = "X-Request-Id";
    public static final String MDC_KEY = "requestId";
    public static final String MODEL_ATTRIBUTE = "quizgen.model";
    public static final String QUIZ_ID_ATTRIBUTE = "quizgen.quizId";

    private static final Logger log = LoggerFactory.getLogger(RequestIdFilter.class);
    private static final int MAX_ID_LENGTH = 80;

    @Override
    protected void doFilterInternal(
            HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain) throws ServletException, IOException {
        String requestId = sanitize(request.getHeader(HEADER_NAME));
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }

        response.setHeader(HEADER_NAME, requestId);
        MDC.put(MDC_KEY, requestId);
        long started = System.nanoTime();
        try {
            filterChain.doFilter(request, response);
        } finally {
            long elapsedMs = (System.nanoTime() - started) / 1_000_000;
            if (request.getAttribute(MODEL_ATTRIBUTE) != null) {
                log.info(summary(request, response.getStatus(), elapsedMs));
            } else if (log.isDebugEnabled()) {
                log.debug(summary(request, response.getStatus(), elapsedMs));
            }
            MDC.remove(MDC_KEY);
        }
    }

    static String summary(HttpServletRequest request, int status, long elapsedMs) {
        StringBuilder line = new StringBuilder()
                .append(request.getMethod()).append(' ')
                .append(request.getRequestURI())
                .append(" -> ").append(status)
                .append(" in ").append(elapsedMs).append(" ms");
        Object model = request.getAttribute(MODEL_ATTRIBUTE);
        if (model != null) {
            line.append(" model=").append(model);
        }
        Object quizId = request.getAttribute(QUIZ_ID_ATTRIBUTE);
        if (quizId != null) {
            line.append(" quizId=").append(quizId);
        }
        return line.toString();
    }

    static String sanitize(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_ID_LENGTH ? trimmed.substring(0, MAX_ID_LENGTH) : trimmed;
    }
}
