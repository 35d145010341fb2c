package com.codeheadsystems.tollgate.springboot.security;

import com.codeheadsystems.tollgate.springboot.controller.ApiError;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.access.AccessDeniedHandler;

/**
 * Writes the fixed 401 and 403 bodies. The 401 body is the same for every rejection reason.
 */
public class JsonErrorResponder implements AuthenticationEntryPoint, AccessDeniedHandler {

  private static final Logger log = LoggerFactory.getLogger(JsonErrorResponder.class);

  private final ObjectMapper objectMapper;

  public JsonErrorResponder(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  @Override
  public void commence(HttpServletRequest request, HttpServletResponse response,
                       AuthenticationException authException) throws IOException {
    log.debug("401 for {} {} (reason={})", request.getMethod(), request.getRequestURI(),
        request.getAttribute(JwtAuthenticationFilter.REJECTION_ATTRIBUTE));
    unauthorized(response);
  }

  @Override
  public void handle(HttpServletRequest request, HttpServletResponse response,
                     AccessDeniedException accessDeniedException) throws IOException {
    forbidden(response);
  }

  public void unauthorized(HttpServletResponse response) throws IOException {
    write(response, HttpStatus.UNAUTHORIZED, ApiError.unauthorized());
  }

  public void forbidden(HttpServletResponse response) throws IOException {
    write(response, HttpStatus.FORBIDDEN, ApiError.forbidden());
  }

  private void write(HttpServletResponse response, HttpStatus status, ApiError body) throws IOException {
    response.setStatus(status.value());
    response.setContentType(MediaType.APPLICATION_JSON_VALUE);
    objectMapper.writeValue(response.getOutputStream(), body);
  }
}
