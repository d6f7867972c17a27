package com.scholary.talkingpet.media;

import java.time.Duration;

/**
 * Combines a video stream and an audio stream into one MP4.
 *
 * <p>Blocking and CPU-bound; callers run it on the blocking executor. Any failure is a {@link
 * com.scholary.talkingpet.error.MuxFailedException} and is never retried.
 */
public interface Muxer {

  /**
   * @param videoBytes the generated clip
   * @param audioBytes the speech track
   * @param audioLeadDelay how long to delay the audio against the first frame
   * @param audioTailPad silence appended after the speech, zero for none
   * @return the muxed MP4
   */
  byte[] mux(byte[] videoBytes, byte[] audioBytes, Duration audioLeadDelay, Duration audioTailPad);
}
