package com.phillippitts.styleswap.config.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Scopes Log4j2's ThreadContext to one HTTP request, so every line a transfer logs on the request
 * thread carries the request's id.
 *
 * <p>Keys:</p>
 * <ul>
 *   <li>{@value #REQUEST_ID}: the {@code X-Request-ID} header or a generated UUID, echoed back on
 *       the response so clients can quote it</li>
 *   <li>{@value #ENDPOINT}: method and path, e.g. {@code POST /api/v1/style-transfer}</li>
 *   <li>{@value #UPLOAD_BYTES}: declared size of the multipart body, when the client sent one</li>
 *   <li>{@value #TRANSFER_OUTCOME}: set by the transfer service when a transfer ends</li>
 * </ul>
 *
 * <p>API requests get one summary line with status, outcome and duration before the context is
 * cleared.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TransferMdcFilter extends OncePerRequestFilter {

    private static final Logger LOG = LogManager.getLogger(TransferMdcFilter.class);

    static final String REQUEST_ID_HEADER = "X-Request-ID";
    private static final String API_PREFIX = "/api/";

    public static final String REQUEST_ID = "requestId";
    public static final String ENDPOINT = "endpoint";
    public static final String UPLOAD_BYTES = "uploadBytes";
    public static final String TRANSFER_OUTCOME = "transferOutcome";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        long start = System.nanoTime();
        String requestId = requestIdOf(request);
        ThreadContext.put(REQUEST_ID, requestId);
        ThreadContext.put(ENDPOINT, request.getMethod() + " " + request.getRequestURI());
        long declaredBytes = request.getContentLengthLong();
        if (declaredBytes >= 0) {
            ThreadContext.put(UPLOAD_BYTES, Long.toString(declaredBytes));
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);
        try {
            chain.doFilter(request, response);
        } finally {
            if (request.getRequestURI().startsWith(API_PREFIX)) {
                String outcome = ThreadContext.get(TRANSFER_OUTCOME);
                LOG.info("Request finished: status={}, outcome={}, uploadBytes={}, durationMs={}",
                        response.getStatus(), outcome == null ? "none" : outcome,
                        ThreadContext.get(UPLOAD_BYTES), TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
            }
            ThreadContext.clearAll();
        }
    }

    private static String requestIdOf(HttpServletRequest request) {
        String header = request.getHeader(REQUEST_ID_HEADER);
        return (header == null || header.isBlank()) ? UUID.randomUUID().toString() : header.trim();
    }
}
