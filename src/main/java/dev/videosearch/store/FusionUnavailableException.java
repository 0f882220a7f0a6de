package dev.videosearch.store;

/** The store's server-side rank fusion is not available for this collection. */
public class FusionUnavailableException extends RuntimeException {

  public FusionUnavailableException(String message) {
    super(message);
  }

  public FusionUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
