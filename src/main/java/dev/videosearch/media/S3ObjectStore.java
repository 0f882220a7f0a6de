package dev.videosearch.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;

/** {@link ObjectStore} on Amazon S3 (or an S3-compatible store) through the AWS SDK v2. */
@Component
public class S3ObjectStore implements ObjectStore {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

  private final S3Client s3Client;
  private final S3Presigner presigner;

  public S3ObjectStore(S3Client s3Client, S3Presigner presigner) {
    this.s3Client = s3Client;
    this.presigner = presigner;
  }

  @Override
  public byte[] get(S3Uri uri) {
    try {
      byte[] content = s3Client.getObjectAsBytes(request(uri)).asByteArray();
      log.debug("Read {} ({} bytes)", uri, content.length);
      return content;
    } catch (SdkException e) {
      throw new ObjectStoreException("Failed to read " + uri, e);
    }
  }

  @Override
  public void download(S3Uri uri, Path target) {
    try {
      Files.deleteIfExists(target);
      s3Client.getObject(request(uri), target);
      log.debug("Downloaded {} to {}", uri, target);
    } catch (SdkException | IOException e) {
      throw new ObjectStoreException("Failed to download " + uri, e);
    }
  }

  @Override
  public S3Uri put(byte[] content, S3Uri uri, String contentType) {
    try {
      s3Client.putObject(
          PutObjectRequest.builder()
              .bucket(uri.bucket())
              .key(uri.key())
              .contentType(contentType)
              .contentLength((long) content.length)
              .build(),
          RequestBody.fromBytes(content));
      log.debug("Wrote {} ({} bytes)", uri, content.length);
      return uri;
    } catch (SdkException e) {
      throw new ObjectStoreException("Failed to write " + uri, e);
    }
  }

  @Override
  public String presign(S3Uri uri, Duration ttl) {
    try {
      return presigner
          .presignGetObject(
              GetObjectPresignRequest.builder()
                  .signatureDuration(ttl)
                  .getObjectRequest(request(uri))
                  .build())
          .url()
          .toString();
    } catch (SdkException e) {
      throw new ObjectStoreException("Failed to presign " + uri, e);
    }
  }

  private static GetObjectRequest request(S3Uri uri) {
    return GetObjectRequest.builder().bucket(uri.bucket()).key(uri.key()).build();
  }
}
