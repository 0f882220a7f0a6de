package dev.videosearch.media;

import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * A parsed {@code s3://bucket/key} reference.
 *
 * @param bucket bucket name
 * @param key object key, without a leading slash
 */
public record S3Uri(String bucket, String key) {

  private static final String SCHEME = "s3://";

  public S3Uri {
    if (bucket == null || bucket.isBlank()) {
      throw new IllegalArgumentException("S3 bucket must not be blank");
    }
    if (key == null) {
      throw new IllegalArgumentException("S3 key must not be null");
    }
  }

  /**
   * Parses an {@code s3://bucket/key} string.
   *
   * @throws IllegalArgumentException when the value is not an S3 URI
   */
  public static S3Uri parse(String uri) {
    return tryParse(uri).orElseThrow(() -> new IllegalArgumentException("Not an S3 URI: " + uri));
  }

  /** Parses an S3 URI, returning empty for any other reference. */
  public static Optional<S3Uri> tryParse(@Nullable String uri) {
    if (uri == null || !uri.startsWith(SCHEME)) {
      return Optional.empty();
    }
    String rest = uri.substring(SCHEME.length());
    int slash = rest.indexOf('/');
    String bucket = slash < 0 ? rest : rest.substring(0, slash);
    String key = slash < 0 ? "" : rest.substring(slash + 1);
    if (bucket.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(new S3Uri(bucket, key));
  }

  /** Returns a URI for a key below this one, e.g. {@code output.json} under an output prefix. */
  public S3Uri resolve(String child) {
    String prefix = key.isEmpty() || key.endsWith("/") ? key : key + "/";
    return new S3Uri(bucket, prefix + child);
  }

  /** Last path segment of the key. */
  public String fileName() {
    String trimmed = key.endsWith("/") ? key.substring(0, key.length() - 1) : key;
    return trimmed.substring(trimmed.lastIndexOf('/') + 1);
  }

  @Override
  public String toString() {
    return SCHEME + bucket + "/" + key;
  }
}
