package dev.videosearch.store;

/**
 * A collaborator needed to serve a request (embedding service, index store, object store payload)
 * is unreachable or returned nothing usable.
 */
public class UpstreamUnavailableException extends RuntimeException {

  public UpstreamUnavailableException(String message) {
    super(message);
  }

  public UpstreamUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
