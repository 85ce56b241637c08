package de.htwsaar.ministatic.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import java.io.IOException;
import java.util.UUID;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Tests für {@link TraceIdFilter}: Übernahme, Erzeugung und Aufräumen der Trace-ID.
 */
class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @AfterEach
    void cleanupMdc() {
        MDC.clear();
    }

    @Test
    void shouldReuseAndEchoIncomingTraceId() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/index.html");
        MockHttpServletResponse response = new MockHttpServletResponse();
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "test-trace-123");

        FilterChain chain = (req, resp) -> assertEquals("test-trace-123", MDC.get(TraceIdFilter.TRACE_ID_KEY));

        filter.doFilter(request, response, chain);

        assertEquals("test-trace-123", response.getHeader(TraceIdFilter.TRACE_ID_HEADER));
        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }

    @Test
    void shouldGenerateUuidForMissingOrBlankHeader() throws ServletException, IOException {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/index.html");
        request.addHeader(TraceIdFilter.TRACE_ID_HEADER, "   ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, resp) -> assertNotNull(MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        String echoed = response.getHeader(TraceIdFilter.TRACE_ID_HEADER);
        assertNotNull(UUID.fromString(echoed));
        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }

    @Test
    void shouldReplaceStaleMdcValue() throws ServletException, IOException {
        MDC.put(TraceIdFilter.TRACE_ID_KEY, "stale-trace-id");

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(),
                (req, resp) -> assertNotEquals("stale-trace-id", MDC.get(TraceIdFilter.TRACE_ID_KEY)));

        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }

    /** Auch bei Exceptions in der Chain muss der MDC-Eintrag entfernt werden. */
    @Test
    void shouldClearMdcWhenChainThrows() {
        RuntimeException thrown = assertThrows(
                RuntimeException.class,
                () -> filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), (req, resp) -> {
                    throw new RuntimeException("boom");
                }));

        assertEquals("boom", thrown.getMessage());
        assertNull(MDC.get(TraceIdFilter.TRACE_ID_KEY));
    }
}
