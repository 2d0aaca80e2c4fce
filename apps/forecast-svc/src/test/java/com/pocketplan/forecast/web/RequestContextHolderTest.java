package com.pocketplan.forecast.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

class RequestContextHolderTest {

    @AfterEach
    void tearDown() {
        RequestContextHolder.clear();
    }

    @Test
    void openScopeExposesTraceIdToContextAndMdc() {
        try (RequestContextHolder.Scope ignored = RequestContextHolder.open("trace-1")) {
            assertThat(RequestContextHolder.traceId()).contains("trace-1");
            assertThat(MDC.get(RequestContextHolder.MDC_KEY)).isEqualTo("trace-1");
        }

        assertThat(RequestContextHolder.get()).isEmpty();
        assertThat(MDC.get(RequestContextHolder.MDC_KEY)).isNull();
    }
}
