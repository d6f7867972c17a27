package com.scholary.talkingpet.video;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class VideoJobStatusTest {

  @Test
  void fromProvider_shouldMapKnownStatuses() {
    assertThat(VideoJobStatus.fromProvider("starting")).isEqualTo(VideoJobStatus.QUEUED);
    assertThat(VideoJobStatus.fromProvider("processing")).isEqualTo(VideoJobStatus.PROCESSING);
    assertThat(VideoJobStatus.fromProvider("succeeded")).isEqualTo(VideoJobStatus.SUCCEEDED);
    assertThat(VideoJobStatus.fromProvider("failed")).isEqualTo(VideoJobStatus.FAILED);
    assertThat(VideoJobStatus.fromProvider("canceled")).isEqualTo(VideoJobStatus.CANCELED);
    assertThat(VideoJobStatus.fromProvider("Cancelled")).isEqualTo(VideoJobStatus.CANCELED);
  }

  @Test
  void fromProvider_shouldKeepPollingOnUnknownStatus() {
    assertThat(VideoJobStatus.fromProvider("warming_up")).isEqualTo(VideoJobStatus.PROCESSING);
    assertThat(VideoJobStatus.fromProvider(null)).isEqualTo(VideoJobStatus.PROCESSING);
  }

  @Test
  void canTransitionTo_shouldOnlyMoveForward() {
    assertThat(VideoJobStatus.QUEUED.canTransitionTo(VideoJobStatus.PROCESSING)).isTrue();
    assertThat(VideoJobStatus.QUEUED.canTransitionTo(VideoJobStatus.SUCCEEDED)).isTrue();
    assertThat(VideoJobStatus.PROCESSING.canTransitionTo(VideoJobStatus.QUEUED)).isFalse();
    assertThat(VideoJobStatus.SUCCEEDED.canTransitionTo(VideoJobStatus.FAILED)).isFalse();
    assertThat(VideoJobStatus.CANCELED.canTransitionTo(VideoJobStatus.CANCELED)).isFalse();
  }
}
