package com.ospicorp.pricelogger.config;

import com.ospicorp.pricelogger.ratelimit.ClientIdentity;
import com.ospicorp.pricelogger.ratelimit.RateLimitProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * One access line per request, including requests the security chain or the rate limiter turn
 * away. Liveness probes are logged at DEBUG.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

  private static final Set<String> PROBE_PATHS = Set.of("/", "/ping", "/actuator/health");

  private final String clientIpHeader;

  public RequestLoggingFilter(RateLimitProperties rateLimit) {
    this.clientIpHeader = rateLimit.clientIpHeader();
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    long started = System.nanoTime();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("{} {} from {} aborted: {}", request.getMethod(), describe(request),
          clientIp(request), ex.getMessage(), ex);
      throw ex;
    } finally {
      long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started);
      String rows = response.getHeader("X-Total-Count");
      if (PROBE_PATHS.contains(request.getRequestURI())) {
        log.debug("{} {} -> {} ({} ms)", request.getMethod(), request.getRequestURI(),
            response.getStatus(), elapsedMs);
      } else if (rows != null) {
        log.info("{} {} from {} -> {} ({} ms, {} rows)", request.getMethod(), describe(request),
            clientIp(request), response.getStatus(), elapsedMs, rows);
      } else {
        log.info("{} {} from {} -> {} ({} ms)", request.getMethod(), describe(request),
            clientIp(request), response.getStatus(), elapsedMs);
      }
    }
  }

  String clientIp(HttpServletRequest request) {
    return ClientIdentity.clientIp(request, clientIpHeader);
  }

  static String describe(HttpServletRequest request) {
    String query = request.getQueryString();
    return query == null || query.isBlank()
        ? request.getRequestURI()
        : request.getRequestURI() + "?" + query;
  }
}
