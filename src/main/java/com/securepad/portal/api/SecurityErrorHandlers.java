package com.securepad.portal.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.securepad.portal.api.ApiExceptionHandler.ApiError;
import com.securepad.portal.error.ErrorKind;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** Writes filter-chain rejections in the same body shape as {@link ApiExceptionHandler}. */
@Component
public class SecurityErrorHandlers implements AuthenticationEntryPoint, AccessDeniedHandler {
    private final ObjectMapper objectMapper;

    public SecurityErrorHandlers(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request,
                         HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        // BadCredentialsException carries the identity layer's own message
        String message = authException instanceof BadCredentialsException
                ? authException.getMessage()
                : "Not authorized, no token";
        write(response, ErrorKind.AUTHENTICATION_REQUIRED, message);
    }

    @Override
    public void handle(HttpServletRequest request,
                       HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        write(response, ErrorKind.AUTHORIZATION_ERROR, "Not authorized as an admin");
    }

    private void write(HttpServletResponse response, ErrorKind kind, String message) throws IOException {
        response.setStatus(kind.status().value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), new ApiError(kind, message, null));
    }
}
