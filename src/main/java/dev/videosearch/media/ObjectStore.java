package dev.videosearch.media;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Port to the object store holding source videos, embedding payloads and thumbnails.
 *
 * <p>All methods throw {@link ObjectStoreException} when the store call fails.
 */
public interface ObjectStore {

  /** Reads a whole object. */
  byte[] get(S3Uri uri);

  /** Streams an object into a local file, replacing it. */
  void download(S3Uri uri, Path target);

  /** Writes an object and returns its URI. */
  S3Uri put(byte[] content, S3Uri uri, String contentType);

  /** Returns a time-limited HTTPS URL granting read access to the object. */
  String presign(S3Uri uri, Duration ttl);
}
