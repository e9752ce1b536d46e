package com.flagship.ebank_ledger.observability;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @AfterEach
    void tearDown() {
        CorrelationContext.clear();
    }

    @Test
    @DisplayName("Well-formed client correlation ID is echoed and put in the MDC")
    void adoptsWellFormedId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/transactions");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, "req-2024-ABC");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> logged = new AtomicReference<>();
        FilterChain chain = (req, res) -> logged.set(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));

        filter.doFilter(request, response, chain);

        assertEquals("req-2024-ABC", response.getHeader(CorrelationContext.CORRELATION_ID_HEADER));
        assertEquals("req-2024-ABC", logged.get());
        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc\r\nINFO forged line", "id with spaces", "id;drop", "", "été"})
    @DisplayName("Correlation IDs with characters outside letters, digits and dashes are replaced")
    void replacesMalformedId(String supplied) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/transactions");
        request.addHeader(CorrelationContext.CORRELATION_ID_HEADER, supplied);
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String echoed = response.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        assertNotEquals(supplied, echoed);
        assertTrue(echoed.matches("[0-9a-f]{8}"));
    }

    @Test
    @DisplayName("Correlation IDs longer than 64 characters are replaced")
    void replacesOversizedId() {
        String longest = "a".repeat(CorrelationContext.MAX_CORRELATION_ID_LENGTH);

        CorrelationContext.setCorrelationId(longest);
        assertEquals(longest, CorrelationContext.getCorrelationId());

        CorrelationContext.setCorrelationId(longest + "b");
        assertEquals(8, CorrelationContext.getCorrelationId().length());
    }

    @Test
    @DisplayName("Missing header gets a generated ID")
    void generatesWhenAbsent() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/transactions"), response, (req, res) -> { });

        assertTrue(response.getHeader(CorrelationContext.CORRELATION_ID_HEADER).matches("[0-9a-f]{8}"));
    }
}
