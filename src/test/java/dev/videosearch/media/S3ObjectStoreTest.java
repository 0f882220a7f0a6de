package dev.videosearch.media;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.ResponseBytes;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.GetObjectResponse;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.presigner.S3Presigner;
import software.amazon.awssdk.services.s3.presigner.model.GetObjectPresignRequest;
import software.amazon.awssdk.services.s3.presigner.model.PresignedGetObjectRequest;

@ExtendWith(MockitoExtension.class)
class S3ObjectStoreTest {

  private static final S3Uri URI = new S3Uri("embeddings", "jobs/42/output.json");

  @Mock S3Client s3Client;

  @Mock S3Presigner presigner;

  @InjectMocks S3ObjectStore objectStore;

  @Test
  void getReadsObjectBytes() {
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenReturn(
            ResponseBytes.fromByteArray(
                GetObjectResponse.builder().build(), "{}".getBytes(StandardCharsets.UTF_8)));

    assertThat(objectStore.get(URI)).asString(StandardCharsets.UTF_8).isEqualTo("{}");

    ArgumentCaptor<GetObjectRequest> request = ArgumentCaptor.forClass(GetObjectRequest.class);
    verify(s3Client).getObjectAsBytes(request.capture());
    assertThat(request.getValue().bucket()).isEqualTo("embeddings");
    assertThat(request.getValue().key()).isEqualTo("jobs/42/output.json");
  }

  @Test
  void sdkFailureIsWrapped() {
    when(s3Client.getObjectAsBytes(any(GetObjectRequest.class)))
        .thenThrow(NoSuchKeyException.builder().message("missing").build());

    assertThatThrownBy(() -> objectStore.get(URI))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessage("Failed to read s3://embeddings/jobs/42/output.json")
        .hasCauseInstanceOf(NoSuchKeyException.class);
  }

  @Test
  void putSetsContentTypeAndLength() {
    S3Uri target = new S3Uri("video-thumbnails", "thumbnails/a.jpg");

    S3Uri written = objectStore.put(new byte[] {1, 2, 3}, target, "image/jpeg");

    ArgumentCaptor<PutObjectRequest> request = ArgumentCaptor.forClass(PutObjectRequest.class);
    verify(s3Client).putObject(request.capture(), any(RequestBody.class));
    assertThat(written).isEqualTo(target);
    assertThat(request.getValue().contentType()).isEqualTo("image/jpeg");
    assertThat(request.getValue().contentLength()).isEqualTo(3L);
  }

  @Test
  void presignUsesRequestedTtl() throws Exception {
    PresignedGetObjectRequest presigned = mock(PresignedGetObjectRequest.class);
    when(presigned.url())
        .thenReturn(new URL("https://embeddings.s3.amazonaws.com/jobs/42/output.json?sig=1"));
    when(presigner.presignGetObject(any(GetObjectPresignRequest.class))).thenReturn(presigned);

    String url = objectStore.presign(URI, Duration.ofMinutes(10));

    ArgumentCaptor<GetObjectPresignRequest> request =
        ArgumentCaptor.forClass(GetObjectPresignRequest.class);
    verify(presigner).presignGetObject(request.capture());
    assertThat(request.getValue().signatureDuration()).isEqualTo(Duration.ofMinutes(10));
    assertThat(url).startsWith("https://embeddings.s3.amazonaws.com/");
  }
}
