package com.tuorg.programservice.security;

import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.io.IOException;

/** Shared-secret check on every /api call except the ping endpoint. */
@Component
public class ApiKeyFilter implements Filter {

  public static final String HEADER_NAME = "X-API-KEY";

  private final Logger log = LoggerFactory.getLogger(ApiKeyFilter.class);
  private final Environment env;

  public ApiKeyFilter(Environment env) {
    this.env = env;
  }

  @Override
  public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
          throws IOException, ServletException {

    HttpServletRequest req = (HttpServletRequest) request;
    HttpServletResponse resp = (HttpServletResponse) response;

    if ("OPTIONS".equalsIgnoreCase(req.getMethod())) {
      resp.setHeader("Access-Control-Allow-Origin", "*");
      resp.setHeader("Access-Control-Allow-Methods", "GET,POST,OPTIONS");
      resp.setHeader("Access-Control-Allow-Headers", "Content-Type, X-API-KEY, X-USER-ID");
      resp.setHeader("Access-Control-Max-Age", "3600");
      chain.doFilter(request, response);
      return;
    }

    String path = req.getRequestURI();
    if (path.startsWith("/api/ping")) {
      chain.doFilter(request, response);
      return;
    }

    String apiKey = req.getHeader(HEADER_NAME);
    String expected = env.getProperty("app.api.key", "");

    if (expected == null || expected.isEmpty()) {
      log.error("app.api.key is not configured, rejecting {}", path);
      resp.sendError(HttpServletResponse.SC_INTERNAL_SERVER_ERROR, "API key not configured");
      return;
    }

    if (expected.equals(apiKey)) {
      chain.doFilter(request, response);
    } else {
      log.debug("Rejected {} {}: missing or invalid API key", req.getMethod(), path);
      resp.sendError(HttpServletResponse.SC_UNAUTHORIZED, "Invalid API key");
    }
  }
}
