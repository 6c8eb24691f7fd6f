package teranet.mapdev.forge.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every API request with a correlation ID.
 *
 * An inbound X-Correlation-ID header is reused when it is a plain token
 * (letters, digits, '-', '_', '.', at most 64 characters); anything else is
 * replaced by a generated UUID. The ID lives in the SLF4J MDC for the request
 * and is echoed in the response header. Documentation endpoints are not logged.
 */
@Component
@Order(1)
public class CorrelationIdFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(CorrelationIdFilter.class);

    public static final String CORRELATION_ID_KEY = "correlationId";

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        MDC.put(CORRELATION_ID_KEY, correlationId);
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        boolean logged = !isDocumentationRequest(request);
        long startTime = System.currentTimeMillis();
        try {
            if (logged) {
                logger.info("Request started: {} {}", request.getMethod(), request.getRequestURI());
            }
            chain.doFilter(request, response);
            if (logged) {
                logger.info("Request completed: {} {} | Status: {} | Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), response.getStatus(),
                        System.currentTimeMillis() - startTime);
            }

        } catch (IOException | ServletException | RuntimeException e) {
            logger.error("Request failed: {} {}", request.getMethod(), request.getRequestURI(), e);
            throw e;

        } finally {
            MDC.remove(CORRELATION_ID_KEY);
        }
    }

    static String resolveCorrelationId(String header) {
        if (header != null) {
            String candidate = header.trim();
            if (ACCEPTED_ID.matcher(candidate).matches()) {
                return candidate;
            }
            logger.debug("Ignoring malformed correlation ID header");
        }
        return UUID.randomUUID().toString();
    }

    private boolean isDocumentationRequest(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri != null && (uri.startsWith("/api-docs") || uri.startsWith("/swagger-ui"));
    }
}
