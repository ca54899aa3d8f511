package com.rentnest.tm30.config;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RequestLoggingInterceptor Tests")
class RequestLoggingInterceptorTest {

    private final RequestLoggingInterceptor interceptor = new RequestLoggingInterceptor();

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should reuse the caller's correlation ID")
    void shouldPropagateIncomingCorrelationId() {
        // Arrange
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/tm30/submit");
        request.addHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER, "corr-42");
        MockHttpServletResponse response = new MockHttpServletResponse();

        // Act
        boolean proceed = interceptor.preHandle(request, response, new Object());

        // Assert
        assertThat(proceed).isTrue();
        assertThat(MDC.get(RequestLoggingInterceptor.TRACE_ID)).isEqualTo("corr-42");
        assertThat(response.getHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER)).isEqualTo("corr-42");
    }

    @Test
    @DisplayName("Should generate a correlation ID and clear it after completion")
    void shouldGenerateAndClearCorrelationId() {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tm30/cron/submit");
        MockHttpServletResponse response = new MockHttpServletResponse();

        interceptor.preHandle(request, response, new Object());
        String generated = response.getHeader(RequestLoggingInterceptor.CORRELATION_ID_HEADER);
        assertThat(generated).isNotBlank();
        assertThat(MDC.get(RequestLoggingInterceptor.TRACE_ID)).isEqualTo(generated);

        response.setStatus(401);
        interceptor.afterCompletion(request, response, new Object(), null);

        assertThat(MDC.get(RequestLoggingInterceptor.TRACE_ID)).isNull();
    }
}
