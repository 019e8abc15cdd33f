package com.scholary.transcriber.objectstore;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class StorageReferenceTest {

  private static final String ENDPOINT = "http://minio:9000";

  @Test
  void parse_shouldReadS3Uri() {
    assertThat(StorageReference.parse("s3://recordings/2024/05/meeting.webm", ENDPOINT))
        .contains(new StorageReference("recordings", "2024/05/meeting.webm"));
  }

  @Test
  void parse_shouldAcceptBucketNamesThatAreNotHostnames() {
    assertThat(StorageReference.parse("s3://my_bucket/a.mp3", null))
        .contains(new StorageReference("my_bucket", "a.mp3"));
  }

  @Test
  void parse_shouldReadPathStyleUrlOnConfiguredEndpoint() {
    assertThat(StorageReference.parse("http://minio:9000/recordings/a/b.wav", ENDPOINT))
        .contains(new StorageReference("recordings", "a/b.wav"));
  }

  @Test
  void parse_shouldReadVirtualHostUrlOnConfiguredEndpoint() {
    assertThat(StorageReference.parse("http://recordings.minio:9000/a/b.wav", ENDPOINT))
        .contains(new StorageReference("recordings", "a/b.wav"));
  }

  @Test
  void parse_shouldLeaveOtherUrlsAlone() {
    assertThat(StorageReference.parse("https://cdn.example.com/recordings/a.mp3", ENDPOINT))
        .isEmpty();
    assertThat(StorageReference.parse("http://minio:9001/recordings/a.mp3", ENDPOINT)).isEmpty();
    assertThat(StorageReference.parse("http://minio:9000/recordings", ENDPOINT)).isEmpty();
    assertThat(StorageReference.parse("s3://recordings", ENDPOINT)).isEmpty();
    assertThat(StorageReference.parse("", ENDPOINT)).isEmpty();
  }

  @Test
  void toString_shouldRenderAsS3Uri() {
    assertThat(new StorageReference("b", "k/x.mp3")).hasToString("s3://b/k/x.mp3");
  }
}
