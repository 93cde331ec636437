package com.ospicorp.pricelogger.ratelimit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ospicorp.pricelogger.config.ApiExceptionHandler;
import com.ospicorp.pricelogger.store.ShardException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Rejects requests over the per-identity limit with a 429 problem response. Registered inside the
 * security chain after CORS, so preflight requests never reach it.
 */
public class RateLimitFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

  private final RateLimiter limiter;
  private final RateLimitProperties properties;
  private final ObjectMapper mapper;
  private final Clock clock;

  public RateLimitFilter(RateLimiter limiter, RateLimitProperties properties, ObjectMapper mapper,
      Clock clock) {
    this.limiter = limiter;
    this.properties = properties;
    this.mapper = mapper;
    this.clock = clock;
  }

  @Override
  protected boolean shouldNotFilter(@NonNull HttpServletRequest request) {
    return !properties.enabled() || HttpMethod.OPTIONS.matches(request.getMethod());
  }

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request,
      @NonNull HttpServletResponse response, @NonNull FilterChain filterChain)
      throws ServletException, IOException {
    ClientIdentity identity = ClientIdentity.from(request, properties.clientIpHeader());
    boolean allowed;
    try {
      allowed = limiter.checkAndRecord(identity, clock.millis());
    } catch (ShardException ex) {
      log.error("Rate limit check failed for {}, denying request: {}", identity, ex.getMessage(),
          ex);
      allowed = false;
    }
    if (!allowed) {
      writeTooManyRequests(request, response);
      return;
    }
    filterChain.doFilter(request, response);
  }

  private void writeTooManyRequests(HttpServletRequest request, HttpServletResponse response)
      throws IOException {
    HttpStatus status = HttpStatus.TOO_MANY_REQUESTS;
    ProblemDetail detail = ApiExceptionHandler.problemDetail(status,
        "Rate limit exceeded. Try again later.", request.getRequestURI());
    response.setStatus(status.value());
    response.setHeader(HttpHeaders.RETRY_AFTER, Integer.toString(properties.windowSec()));
    response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
    mapper.writeValue(response.getOutputStream(), detail);
  }
}
