package com.example.musicrecommend.common.logging;

import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;
import javax.servlet.FilterChain;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each API request with a request id (reused from {@code X-Request-Id}
 * when the caller sends one) and writes one ACCESS line when it completes.
 */
public class AccessLogFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AccessLogFilter.class);

    public static final String HEADER_REQUEST_ID = "X-Request-Id";
    public static final String MDC_REQUEST_ID = "requestId";
    private static final String MDC_LISTENER_ID = "listenerId";
    private static final int MAX_REQUEST_ID_LENGTH = 64;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();
        String requestId = resolveRequestId(request.getHeader(HEADER_REQUEST_ID));
        String listenerId = listenerIdFromQuery(request.getQueryString());

        response.setHeader(HEADER_REQUEST_ID, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        if (StringUtils.hasText(listenerId)) {
            MDC.put(MDC_LISTENER_ID, listenerId.trim());
        }
        try {
            filterChain.doFilter(request, response);
        } finally {
            long cost = System.currentTimeMillis() - start;
            log.info("ACCESS method={} uri={} status={} costMs={} ip={}",
                    request.getMethod(), request.getRequestURI(), response.getStatus(), cost, request.getRemoteAddr());
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_LISTENER_ID);
        }
    }

    /**
     * Reads {@code listenerId} from the raw query string only; {@code getParameter}
     * would consume a form-encoded body before the controller sees it.
     */
    static String listenerIdFromQuery(String query) {
        if (!StringUtils.hasText(query)) {
            return null;
        }
        for (String pair : query.split("&")) {
            int eq = pair.indexOf('=');
            if (eq > 0 && "listenerId".equals(pair.substring(0, eq))) {
                try {
                    return URLDecoder.decode(pair.substring(eq + 1), StandardCharsets.UTF_8);
                } catch (IllegalArgumentException e) {
                    log.debug("Undecodable listenerId in query, query={}", query, e);
                    return null;
                }
            }
        }
        return null;
    }

    static String resolveRequestId(String header) {
        if (header == null || header.trim().isEmpty()) {
            return UUID.randomUUID().toString().replace("-", "");
        }
        String trimmed = header.trim();
        return trimmed.length() > MAX_REQUEST_ID_LENGTH ? trimmed.substring(0, MAX_REQUEST_ID_LENGTH) : trimmed;
    }
}
