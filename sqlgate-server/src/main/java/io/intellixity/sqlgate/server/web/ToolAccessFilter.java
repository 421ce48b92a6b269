package io.intellixity.sqlgate.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlgate.tools.GatewayTools;
import io.intellixity.sqlgate.tools.ToolName;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Rejects calls to tools that are unknown or not listed in {@code available_tools} before they
 * reach the controller. The setting is read per request so a reload takes effect immediately.
 */
@Component
public final class ToolAccessFilter extends OncePerRequestFilter {
  private static final String PREFIX = ToolController.BASE_PATH + "/";

  private final GatewayTools tools;
  private final ObjectMapper mapper;

  public ToolAccessFilter(GatewayTools tools, ObjectMapper mapper) {
    this.tools = tools;
    this.mapper = mapper;
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith(request.getContextPath() + PREFIX);
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String tool = request.getRequestURI().substring(request.getContextPath().length() + PREFIX.length());
    int slash = tool.indexOf('/');
    if (slash >= 0) tool = tool.substring(0, slash);

    ToolName name = ToolName.fromId(tool);
    if (name == null || !tools.enabled(name)) {
      ToolNotAvailableException e = new ToolNotAvailableException(tool);
      response.setStatus(HttpServletResponse.SC_NOT_FOUND);
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      response.setCharacterEncoding(StandardCharsets.UTF_8.name());
      mapper.writeValue(response.getOutputStream(), new ApiExceptionHandler.ApiError("ToolNotAvailable", e.getMessage()));
      return;
    }
    filterChain.doFilter(request, response);
  }
}
