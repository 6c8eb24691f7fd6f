package teranet.mapdev.forge.config;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void testDoFilter_ReusesInboundId() throws Exception {
        // Given
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/forge/transform/preview");
        request.addHeader(CorrelationIdFilter.CORRELATION_ID_HEADER, "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        // When
        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req,
                    HttpServletResponse res) {
                seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            }
        }));

        // Then
        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader(CorrelationIdFilter.CORRELATION_ID_HEADER));
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
    }

    @Test
    void testResolveCorrelationId_ReplacesMalformedHeader() {
        String generated = CorrelationIdFilter.resolveCorrelationId("bad id\r\ninjected");

        assertNotEquals("bad id\r\ninjected", generated);
        assertEquals(36, generated.length());
        assertEquals(36, CorrelationIdFilter.resolveCorrelationId(null).length());
        assertEquals("abc", CorrelationIdFilter.resolveCorrelationId(" abc "));
    }
}
