package com.bugbounty.api.security;

import com.bugbounty.api.error.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;

import java.io.IOException;

/**
 * Answers 401 for protected routes reached without a trusted identity.
 * The message is the reason recorded by {@link BearerTokenAuthenticationFilter},
 * or the missing-token message when no token was sent.
 */
public class JsonAuthenticationEntryPoint implements AuthenticationEntryPoint {

    static final String NO_TOKEN = "No token provided, authorization denied";

    private final ErrorResponseWriter errorWriter;

    public JsonAuthenticationEntryPoint(ErrorResponseWriter errorWriter) {
        this.errorWriter = errorWriter;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        Object failure = request.getAttribute(BearerTokenAuthenticationFilter.FAILURE_ATTRIBUTE);
        String message = failure != null ? failure.toString() : NO_TOKEN;
        errorWriter.write(response, HttpStatus.UNAUTHORIZED.value(), message);
    }
}
