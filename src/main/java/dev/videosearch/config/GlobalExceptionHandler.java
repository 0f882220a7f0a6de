package dev.videosearch.config;

import dev.videosearch.media.ObjectStoreException;
import dev.videosearch.store.RateLimitedException;
import dev.videosearch.store.UpstreamUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.NestedExceptionUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid input maps to 400 Bad Request; an unreachable embedding service, index store or
 * object store maps to 503 Service Unavailable.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /**
   * Maps an unreadable request body to 400. Request records validate in their constructors, so the
   * root cause carries the message to report.
   */
  @ExceptionHandler(HttpMessageNotReadableException.class)
  ProblemDetail handleUnreadableBody(HttpMessageNotReadableException ex) {
    Throwable cause = NestedExceptionUtils.getMostSpecificCause(ex);
    String detail =
        cause instanceof IllegalArgumentException ? cause.getMessage() : "Malformed request body";
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  /** Maps an unreachable collaborator to 503 Service Unavailable. */
  @ExceptionHandler({
    UpstreamUnavailableException.class,
    ObjectStoreException.class,
    RateLimitedException.class
  })
  ProblemDetail handleUpstreamUnavailable(RuntimeException ex) {
    log.warn("Request failed on an upstream dependency: {}", ex.getMessage());
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}
