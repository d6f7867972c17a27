package com.scholary.talkingpet.config;

import com.scholary.talkingpet.media.FfmpegProperties;
import com.scholary.talkingpet.media.MediaProperties;
import com.scholary.talkingpet.tts.TtsProperties;
import com.scholary.talkingpet.video.VideoProviderProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the external collaborators.
 *
 * <p>Enables the TTS, video provider, ffmpeg and media properties to be loaded from
 * application.yml.
 */
@Configuration
@EnableConfigurationProperties({
  TtsProperties.class,
  VideoProviderProperties.class,
  FfmpegProperties.class,
  MediaProperties.class
})
public class ProviderConfig {}
