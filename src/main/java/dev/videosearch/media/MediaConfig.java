package dev.videosearch.media;

import java.net.URI;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3Configuration;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;

/**
 * Configures the AWS SDK S3 client and presigner.
 *
 * <p>Credentials come from the default provider chain. An endpoint override switches both beans
 * to an S3-compatible store.
 */
@Configuration
public class MediaConfig {

  @Bean(destroyMethod = "close")
  public S3Client s3Client(MediaProperties properties) {
    var builder =
        S3Client.builder()
            .region(Region.of(properties.region()))
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build());
    if (hasEndpoint(properties)) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    return builder.build();
  }

  @Bean(destroyMethod = "close")
  public S3Presigner s3Presigner(MediaProperties properties) {
    var builder =
        S3Presigner.builder()
            .region(Region.of(properties.region()))
            .credentialsProvider(DefaultCredentialsProvider.builder().build())
            .serviceConfiguration(
                S3Configuration.builder()
                    .pathStyleAccessEnabled(properties.pathStyleAccess())
                    .build());
    if (hasEndpoint(properties)) {
      builder.endpointOverride(URI.create(properties.endpoint()));
    }
    return builder.build();
  }

  private static boolean hasEndpoint(MediaProperties properties) {
    return properties.endpoint() != null && !properties.endpoint().isBlank();
  }
}
