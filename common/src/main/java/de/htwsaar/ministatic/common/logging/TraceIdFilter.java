package de.htwsaar.ministatic.common.logging;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.MDC;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet-Filter für die Trace-ID eines Requests.
 *
 * <p>Die ID wird aus {@value #TRACE_ID_HEADER} übernommen oder neu erzeugt, im MDC abgelegt
 * (damit steht sie in jeder Logzeile) und in der Antwort zurückgegeben.</p>
 */
public class TraceIdFilter extends OncePerRequestFilter {

    /** MDC-Schlüssel, wird im Logback-Pattern referenziert */
    public static final String TRACE_ID_KEY = "traceId";

    public static final String TRACE_ID_HEADER = "X-Trace-Id";

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String traceId = request.getHeader(TRACE_ID_HEADER);
        if (traceId == null || traceId.isBlank()) {
            traceId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID_KEY, traceId);
        // vor der Chain setzen, sonst ist die Antwort ggf. schon committed
        response.setHeader(TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID_KEY);
        }
    }
}
