package com.protocolguide.api.tracing;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id for every request, including ones the security chains reject.
 *
 * An incoming X-Request-Id (or X-Correlation-Id) is reused when it looks like an id; anything else
 * is replaced by a random UUID so client input never reaches the log pattern unchecked.
 * The id goes to MDC "requestId", to {@link RequestContext}, and back out as X-Request-Id.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestIdFilter extends OncePerRequestFilter {

  public static final String HDR_REQUEST_ID = "X-Request-Id";
  public static final String HDR_CORRELATION_ID = "X-Correlation-Id";
  public static final String MDC_REQUEST_ID = "requestId";

  private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._:-]{1,128}");

  @Override
  protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {

    String reqId = resolve(request);

    MDC.put(MDC_REQUEST_ID, reqId);
    RequestContext.set(reqId);
    response.setHeader(HDR_REQUEST_ID, reqId);

    try {
      filterChain.doFilter(request, response);
    } finally {
      RequestContext.clear();
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  static String resolve(HttpServletRequest request) {
    for (String header : new String[] {HDR_REQUEST_ID, HDR_CORRELATION_ID}) {
      String v = request.getHeader(header);
      if (v != null && SAFE_ID.matcher(v.trim()).matches()) return v.trim();
    }
    return UUID.randomUUID().toString();
  }
}
