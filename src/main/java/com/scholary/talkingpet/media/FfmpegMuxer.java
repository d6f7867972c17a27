package com.scholary.talkingpet.media;

import com.scholary.talkingpet.error.MuxFailedException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Muxes speech onto a generated clip with the ffmpeg binary.
 *
 * <p>The command:
 *
 * <pre>
 * ffmpeg -y -i video.mp4 -i audio.mp3
 *   -map 0:v:0 -map 1:a:0
 *   -af adelay=delays=550:all=1[,apad=pad_dur=0.500]
 *   -c:v copy -c:a aac -b:a 192k
 *   -shortest -movflags +faststart out.mp4
 * </pre>
 *
 * <p>Video providers start the mouth moving a little after the first frame, so the speech is
 * delayed to line up. {@code -shortest} clamps the output to whichever stream ends first, so there
 * is no frozen last frame and no trailing silence.
 *
 * <p>Each call works in its own temp directory which is removed on every exit path.
 */
@Component
public class FfmpegMuxer implements Muxer {

  private static final Logger LOGGER = LoggerFactory.getLogger(FfmpegMuxer.class);

  private static final int MAX_LOG_CHARS = 2000;

  private final FfmpegProperties properties;
  private final Path tempRoot;

  public FfmpegMuxer(FfmpegProperties properties) {
    this.properties = properties;
    this.tempRoot = Paths.get(properties.tempDir());
  }

  @Override
  public byte[] mux(
      byte[] videoBytes, byte[] audioBytes, Duration audioLeadDelay, Duration audioTailPad) {
    if (videoBytes == null || videoBytes.length == 0) {
      throw new MuxFailedException("Video input is empty");
    }
    if (audioBytes == null || audioBytes.length == 0) {
      throw new MuxFailedException("Audio input is empty");
    }

    Path workDir = null;
    try {
      Files.createDirectories(tempRoot);
      workDir = Files.createTempDirectory(tempRoot, "mux-");

      Path video = workDir.resolve("video.mp4");
      Path audio = workDir.resolve("audio.mp3");
      Path output = workDir.resolve("final.mp4");
      Path log = workDir.resolve("ffmpeg.log");
      Files.write(video, videoBytes);
      Files.write(audio, audioBytes);

      List<String> command = buildCommand(video, audio, output, audioLeadDelay, audioTailPad);
      LOGGER.debug("Executing: {}", String.join(" ", command));

      long startMs = System.currentTimeMillis();
      run(command, log);

      byte[] result = Files.readAllBytes(output);
      if (result.length == 0) {
        throw new MuxFailedException("ffmpeg produced an empty file");
      }

      LOGGER.info(
          "Muxed video ({} bytes) and audio ({} bytes) into {} bytes in {}ms",
          videoBytes.length,
          audioBytes.length,
          result.length,
          System.currentTimeMillis() - startMs);
      return result;

    } catch (IOException e) {
      throw new MuxFailedException("Mux failed: " + e.getMessage(), e);
    } finally {
      deleteQuietly(workDir);
    }
  }

  List<String> buildCommand(
      Path video, Path audio, Path output, Duration audioLeadDelay, Duration audioTailPad) {
    List<String> command = new ArrayList<>();
    command.add(properties.binary());
    command.add("-y");
    command.add("-i");
    command.add(video.toString());
    command.add("-i");
    command.add(audio.toString());
    command.add("-map");
    command.add("0:v:0");
    command.add("-map");
    command.add("1:a:0");
    command.add("-af");
    command.add(audioFilter(audioLeadDelay, audioTailPad));
    command.add("-c:v");
    command.add("copy");
    command.add("-c:a");
    command.add(properties.audioCodec());
    command.add("-b:a");
    command.add(properties.audioBitrate());
    command.add("-shortest");
    command.add("-movflags");
    command.add("+faststart");
    command.add(output.toString());
    return command;
  }

  static String audioFilter(Duration audioLeadDelay, Duration audioTailPad) {
    long delayMs = audioLeadDelay == null ? 0 : Math.max(0, audioLeadDelay.toMillis());
    StringBuilder filter = new StringBuilder();
    filter.append("adelay=delays=").append(delayMs).append(":all=1");
    if (audioTailPad != null && !audioTailPad.isZero() && !audioTailPad.isNegative()) {
      filter.append(
          String.format(Locale.ROOT, ",apad=pad_dur=%.3f", audioTailPad.toMillis() / 1000.0));
    }
    return filter.toString();
  }

  private void run(List<String> command, Path log) throws IOException {
    ProcessBuilder pb = new ProcessBuilder(command);
    pb.redirectErrorStream(true);
    pb.redirectOutput(log.toFile());

    Process process = pb.start();
    try {
      if (!process.waitFor(properties.timeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new MuxFailedException(
            "ffmpeg did not finish within " + properties.timeoutSeconds() + "s");
      }
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new MuxFailedException("Mux interrupted", e);
    }

    int exitCode = process.exitValue();
    if (exitCode != 0) {
      String output = tail(Files.readString(log, StandardCharsets.UTF_8));
      LOGGER.error("ffmpeg mux failed: exitCode={}, output={}", exitCode, output);
      throw new MuxFailedException("ffmpeg exited with code " + exitCode + ": " + output);
    }
  }

  private static String tail(String output) {
    return output.length() <= MAX_LOG_CHARS
        ? output
        : output.substring(output.length() - MAX_LOG_CHARS);
  }

  private static void deleteQuietly(Path dir) {
    if (dir == null) {
      return;
    }
    try (Stream<Path> paths = Files.walk(dir)) {
      paths.sorted(Comparator.reverseOrder()).forEach(FfmpegMuxer::deleteFile);
    } catch (IOException e) {
      LOGGER.warn("Failed to clean up mux directory {}: {}", dir, e.getMessage());
    }
  }

  private static void deleteFile(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      LOGGER.warn("Failed to delete {}: {}", path, e.getMessage());
    }
  }
}
