package com.taskboard.servicebackend.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.servicebackend.web.dto.ApiResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes the 401 envelope for requests that reach a protected route without a usable token.
 */
public class ApiAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public ApiAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object failure = request.getAttribute(JwtAuthenticationFilter.FAILURE_ATTRIBUTE);
        ApiResponse<Void> body = failure instanceof TokenVerificationException.Reason reason
                ? ApiResponse.error(reason.message(), List.of(detailFor(reason)))
                : ApiResponse.error("Access token required", List.of("Send the token as: Authorization: Bearer <token>"));

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), body);
    }

    private static String detailFor(TokenVerificationException.Reason reason) {
        return switch (reason) {
            case EXPIRED -> "The token has expired, please log in again";
            case INVALID -> "The token is malformed or was not issued by this server";
        };
    }
}
