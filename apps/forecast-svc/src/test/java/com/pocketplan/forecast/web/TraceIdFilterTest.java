package com.pocketplan.forecast.web;

import static org.assertj.core.api.Assertions.assertThat;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class TraceIdFilterTest {

    private final TraceIdFilter filter = new TraceIdFilter();

    @Test
    void propagatesCallerTraceIdForTheDurationOfTheRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/budgets");
        request.addHeader(TraceIdFilter.TRACE_HEADER, "caller-trace");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenInMdc = new AtomicReference<>();
        AtomicReference<String> seenInContext = new AtomicReference<>();

        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse res) {
                seenInMdc.set(MDC.get(RequestContextHolder.MDC_KEY));
                seenInContext.set(RequestContextHolder.traceId().orElse(null));
            }
        }));

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isEqualTo("caller-trace");
        assertThat(seenInMdc.get()).isEqualTo("caller-trace");
        assertThat(seenInContext.get()).isEqualTo("caller-trace");
        assertThat(MDC.get(RequestContextHolder.MDC_KEY)).isNull();
        assertThat(RequestContextHolder.get()).isEmpty();
    }

    @Test
    void generatesTraceIdWhenHeaderIsBlank() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/budgets");
        request.addHeader(TraceIdFilter.TRACE_HEADER, " ");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, new MockFilterChain());

        assertThat(response.getHeader(TraceIdFilter.TRACE_HEADER)).isNotBlank().isNotEqualTo(" ");
    }
}
