package com.ospicorp.pricelogger.config;

import com.ospicorp.pricelogger.ingest.UpstreamException;
import com.ospicorp.pricelogger.interval.InvalidParameterException;
import com.ospicorp.pricelogger.ratelimit.ClientIdentity;
import com.ospicorp.pricelogger.ratelimit.RateLimitProperties;
import com.ospicorp.pricelogger.store.ShardException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import java.net.URI;
import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.AuthenticationException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotAcceptableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  static final String PROBLEM_TYPE_BASE = "https://api.coststhismuch.au/problems/";

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "invalid-parameter",
      HttpStatus.UNAUTHORIZED, "unauthorized",
      HttpStatus.FORBIDDEN, "forbidden",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.NOT_ACCEPTABLE, "not-acceptable",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.TOO_MANY_REQUESTS, "rate-limit",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  private final String clientIpHeader;

  public ApiExceptionHandler(RateLimitProperties rateLimit) {
    this.clientIpHeader = rateLimit.clientIpHeader();
  }

  @ExceptionHandler({ConstraintViolationException.class, MethodArgumentNotValidException.class,
      MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class,
      HttpMessageNotReadableException.class, IllegalArgumentException.class})
  public ResponseEntity<ProblemDetail> handleBadRequest(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(InvalidParameterException.class)
  public ResponseEntity<Map<String, Object>> handleInvalidParameter(InvalidParameterException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    Map<String, Object> body = new HashMap<>();
    body.put("error", ex.getMessage());
    body.put("errorCode", ex.errorCode());
    body.put("moreInfo", ex.moreInfo());
    body.put("path", request.getRequestURI());
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  /**
   * Framework exceptions that already know their status: unknown routes, wrong method or media
   * type, and {@link ResponseStatusException} raised by controllers.
   */
  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class, HttpMediaTypeNotAcceptableException.class,
      ResponseStatusException.class})
  public ResponseEntity<ProblemDetail> handleErrorResponse(Exception ex,
      HttpServletRequest request) {
    ErrorResponse error = (ErrorResponse) ex;
    HttpStatus status = HttpStatus.resolve(error.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    logException(status, ex, request);
    String detail = error.getBody().getDetail();
    return problem(status, detail != null ? detail : status.getReasonPhrase(), request);
  }

  @ExceptionHandler(AuthenticationException.class)
  public ResponseEntity<ProblemDetail> handleUnauthorized(AuthenticationException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.UNAUTHORIZED, ex, request);
  }

  @ExceptionHandler(AccessDeniedException.class)
  public ResponseEntity<ProblemDetail> handleForbidden(AccessDeniedException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.FORBIDDEN, ex, request);
  }

  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<ProblemDetail> handleUpstream(UpstreamException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  @ExceptionHandler(ShardException.class)
  public ResponseEntity<ProblemDetail> handleStorage(ShardException ex,
      HttpServletRequest request) {
    // storage details stay in the log
    logException(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure", request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    return problem(status, ex.getMessage(), request);
  }

  public static ProblemDetail problemDetail(HttpStatus status, String detail, String path) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
    problem.setTitle(status.getReasonPhrase());
    problem.setInstance(URI.create(path));
    problem.setType(URI.create(PROBLEM_TYPE_BASE
        + TYPE_SLUGS.getOrDefault(status, "internal-error")));
    problem.setProperty("path", path);
    return problem;
  }

  private ResponseEntity<ProblemDetail> problem(HttpStatus status, String detail,
      HttpServletRequest request) {
    return ResponseEntity.status(status)
        .body(problemDetail(status, detail, request.getRequestURI()));
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String message = ex.getMessage() == null || ex.getMessage().isBlank()
        ? ex.getClass().getName()
        : ex.getMessage();
    String where = request.getMethod() + " " + RequestLoggingFilter.describe(request);
    String client = ClientIdentity.clientIp(request, clientIpHeader);
    if (status.is5xxServerError()) {
      log.error("{} from {} failed with {}: {}", where, client, status.value(), message, ex);
    } else {
      log.warn("{} from {} rejected with {}: {}", where, client, status.value(), message);
    }
  }
}
