package com.loadforecast.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.loadforecast.dto.ApiError;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.time.Instant;
import java.util.Arrays;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Tags every API request with a request id (header, request attribute and logging MDC)
 * and, when enabled, rejects requests without a configured API key.
 */
@Slf4j
@Component
public class RequestGuardFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestGuardFilter.class.getName() + ".requestId";
    public static final String MDC_REQUEST_ID = "requestId";

    private final ObjectMapper objectMapper;
    private final boolean apiKeyEnabled;
    private final String apiKeyHeader;
    private final Set<String> apiKeys;

    public RequestGuardFilter(ObjectMapper objectMapper,
                              @Value("${security.api-key.enabled:false}") boolean apiKeyEnabled,
                              @Value("${security.api-key.header:X-API-Key}") String apiKeyHeader,
                              @Value("${security.api-key.values:}") String apiKeyValues) {
        this.objectMapper = objectMapper;
        this.apiKeyEnabled = apiKeyEnabled;
        this.apiKeyHeader = apiKeyHeader;
        this.apiKeys = Arrays.stream(apiKeyValues.split(","))
            .map(String::trim)
            .filter(key -> !key.isEmpty())
            .collect(Collectors.toUnmodifiableSet());
        if (apiKeyEnabled && apiKeys.isEmpty()) {
            log.warn("API key check enabled without configured keys, all API requests will be rejected");
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/api/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {
        String header = request.getHeader(REQUEST_ID_HEADER);
        String requestId = header == null || header.isBlank() ? UUID.randomUUID().toString() : header;

        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);
        try {
            if (apiKeyEnabled && !apiKeys.contains(request.getHeader(apiKeyHeader))) {
                log.warn("Request rejected | reason=missing or invalid API key | path={}", request.getRequestURI());
                reject(request, response, requestId);
                return;
            }
            chain.doFilter(request, response);
        } finally {
            MDC.remove(MDC_REQUEST_ID);
        }
    }

    /** Request id assigned by this filter, or the client's header when the filter did not run. */
    public static String requestId(HttpServletRequest request) {
        Object assigned = request.getAttribute(REQUEST_ID_ATTRIBUTE);
        return assigned != null ? assigned.toString() : request.getHeader(REQUEST_ID_HEADER);
    }

    private void reject(HttpServletRequest request, HttpServletResponse response, String requestId) throws IOException {
        ApiError body = ApiError.builder()
            .status(HttpStatus.UNAUTHORIZED.value())
            .error(HttpStatus.UNAUTHORIZED.getReasonPhrase())
            .message("Missing or invalid API key")
            .errorCode("UNAUTHORIZED")
            .path(request.getRequestURI())
            .requestId(requestId)
            .timestamp(Instant.now())
            .build();
        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(), body);
    }
}
