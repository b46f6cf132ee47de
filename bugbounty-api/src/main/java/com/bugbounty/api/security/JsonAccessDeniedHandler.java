package com.bugbounty.api.security;

import com.bugbounty.api.error.ErrorResponseWriter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.web.access.AccessDeniedHandler;

import java.io.IOException;

/**
 * Answers 403 when an authenticated user's role is not allowed on a route.
 */
public class JsonAccessDeniedHandler implements AccessDeniedHandler {

    static final String PERMISSION_DENIED = "You do not have permission to perform this action";

    private static final Logger log = LoggerFactory.getLogger(JsonAccessDeniedHandler.class);

    private final ErrorResponseWriter errorWriter;

    public JsonAccessDeniedHandler(ErrorResponseWriter errorWriter) {
        this.errorWriter = errorWriter;
    }

    @Override
    public void handle(HttpServletRequest request, HttpServletResponse response,
                       AccessDeniedException accessDeniedException) throws IOException {
        log.warn("Role gate denied {} {} for {}", request.getMethod(), request.getRequestURI(),
                request.getUserPrincipal() != null ? request.getUserPrincipal().getName() : "anonymous");
        errorWriter.write(response, HttpStatus.FORBIDDEN.value(), PERMISSION_DENIED);
    }
}
