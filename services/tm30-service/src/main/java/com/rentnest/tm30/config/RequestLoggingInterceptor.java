package com.rentnest.tm30.config;

import com.rentnest.tm30.util.DataMaskingUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;

/**
 * Logs each API request with a correlation ID in the MDC
 * Query strings are masked before logging
 */
@Slf4j
@Component
public class RequestLoggingInterceptor implements HandlerInterceptor {

    static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    static final String TRACE_ID = "traceId";
    private static final String START_TIME = "startTime";
    private static final long SLOW_REQUEST_MILLIS = 5000;

    @Override
    public boolean preHandle(@NonNull HttpServletRequest request,
                             @NonNull HttpServletResponse response,
                             @NonNull Object handler) {
        String correlationId = request.getHeader(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }

        MDC.put(TRACE_ID, correlationId);
        MDC.put(START_TIME, String.valueOf(System.currentTimeMillis()));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);

        String queryString = request.getQueryString();
        log.info("Incoming request: {} {}{}",
                request.getMethod(),
                request.getRequestURI(),
                queryString != null ? "?" + DataMaskingUtil.maskAll(queryString) : "");
        return true;
    }

    @Override
    public void afterCompletion(@NonNull HttpServletRequest request,
                                @NonNull HttpServletResponse response,
                                @NonNull Object handler,
                                Exception ex) {
        String startTimeStr = MDC.get(START_TIME);
        if (startTimeStr != null) {
            long duration = System.currentTimeMillis() - Long.parseLong(startTimeStr);
            int status = response.getStatus();
            if (status >= 500) {
                log.error("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else if (status >= 400) {
                log.warn("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            } else {
                log.info("Request completed: {} {} - Status: {} - Duration: {}ms",
                        request.getMethod(), request.getRequestURI(), status, duration);
            }
            if (duration > SLOW_REQUEST_MILLIS) {
                log.warn("SLOW REQUEST DETECTED: {} {} took {}ms", request.getMethod(), request.getRequestURI(), duration);
            }
        }
        MDC.remove(TRACE_ID);
        MDC.remove(START_TIME);
    }
}
