package com.cardiorecords.infrastructure.security;

import com.cardiorecords.application.exceptions.ApiErrorCatalog;
import com.cardiorecords.interfaces.api.dto.ErrorResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;

/**
 * Writes the JSON error body for failures raised in the filter chain, outside
 * the reach of the controller advice.
 */
@Component
@RequiredArgsConstructor
public class ErrorResponseWriter {

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void write(HttpServletRequest request, HttpServletResponse response, Throwable failure)
            throws IOException {
        ApiErrorCatalog.ApiError error = ApiErrorCatalog.resolve(failure);
        response.setStatus(error.getStatus());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        if (error.getStatus() == HttpServletResponse.SC_UNAUTHORIZED) {
            response.setHeader("WWW-Authenticate", "Bearer");
        }
        objectMapper.writeValue(response.getOutputStream(),
            ErrorResponse.of(error, request.getRequestURI(), clock.instant()));
    }
}
