package dev.videosearch.store;

/** The store rejected a request because of throttling or temporary lack of capacity. */
public class RateLimitedException extends RuntimeException {

  public RateLimitedException(String message, Throwable cause) {
    super(message, cause);
  }
}
