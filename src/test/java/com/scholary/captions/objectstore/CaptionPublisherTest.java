package com.scholary.captions.objectstore;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.net.URL;
import java.nio.file.Path;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class CaptionPublisherTest {

  @Mock private ObjectStoreClient objectStoreClient;

  private static ObjectStoreProperties properties(String keyPrefix) {
    return new ObjectStoreProperties(
        "http://localhost:9000", "admin", "admin123", "captions", "us-east-1", true, keyPrefix, 15);
  }

  @Test
  void publish_shouldUploadUnderPrefixAndPresign() throws Exception {
    CaptionPublisher publisher = new CaptionPublisher(objectStoreClient, properties("out/"));
    Path file = Path.of("/tmp/job-1.ass");
    URL url = new URL("http://localhost:9000/captions/out/job-1.ass?X-Amz-Signature=abc");
    when(objectStoreClient.presignGet("captions", "out/job-1.ass", Duration.ofMinutes(15)))
        .thenReturn(url);

    assertThat(publisher.publish(file)).isEqualTo(url);
    verify(objectStoreClient)
        .putObject("captions", "out/job-1.ass", file, CaptionPublisher.ASS_CONTENT_TYPE);
  }

  @Test
  void publish_shouldNotPresignWhenUploadFails() {
    CaptionPublisher publisher = new CaptionPublisher(objectStoreClient, properties(null));
    Path file = Path.of("/tmp/job-1.ass");
    doThrow(new ObjectStoreException("Failed to upload object"))
        .when(objectStoreClient)
        .putObject(eq("captions"), eq("job-1.ass"), eq(file), any());

    assertThatThrownBy(() -> publisher.publish(file)).isInstanceOf(ObjectStoreException.class);
    verify(objectStoreClient, never()).presignGet(any(), any(), any());
  }

  @Test
  void keyFor_shouldJoinPrefixWithSingleSlash() {
    assertThat(new CaptionPublisher(objectStoreClient, properties("a")).keyFor("x.ass"))
        .isEqualTo("a/x.ass");
    assertThat(new CaptionPublisher(objectStoreClient, properties("a/")).keyFor("x.ass"))
        .isEqualTo("a/x.ass");
    assertThat(new CaptionPublisher(objectStoreClient, properties("")).keyFor("x.ass"))
        .isEqualTo("x.ass");
  }
}
