package dev.videosearch.media;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * {@link FrameExtractor} running the ffmpeg binary.
 *
 * <p>Each extraction writes a single scaled frame to a temporary file and is killed when it runs
 * past the configured timeout.
 */
@Component
public class FfmpegFrameExtractor implements FrameExtractor {

  private static final Logger log = LoggerFactory.getLogger(FfmpegFrameExtractor.class);

  private final MediaProperties properties;

  public FfmpegFrameExtractor(MediaProperties properties) {
    this.properties = properties;
  }

  @Override
  public byte[] extractFrame(Path video, double timestampSeconds)
      throws FrameExtractionException {
    Path output = null;
    Process process = null;
    try {
      output = Files.createTempFile("frame-", ".jpg");
      List<String> cmd = command(video, timestampSeconds, output);
      log.debug("Extracting frame at {}s from {}", timestampSeconds, video);
      process = start(cmd);
      if (!process.waitFor(properties.frameTimeoutSeconds(), TimeUnit.SECONDS)) {
        process.destroyForcibly();
        throw new FrameExtractionException(
            "ffmpeg timed out after " + properties.frameTimeoutSeconds() + "s at " + timestampSeconds);
      }
      if (process.exitValue() != 0) {
        throw new FrameExtractionException(
            "ffmpeg exited with " + process.exitValue() + " at " + timestampSeconds);
      }
      byte[] frame = Files.readAllBytes(output);
      if (frame.length == 0) {
        throw new FrameExtractionException("ffmpeg produced an empty frame at " + timestampSeconds);
      }
      return frame;
    } catch (IOException e) {
      throw new FrameExtractionException("Failed to run ffmpeg on " + video, e);
    } catch (InterruptedException e) {
      process.destroyForcibly();
      Thread.currentThread().interrupt();
      throw new FrameExtractionException("Interrupted while extracting frame from " + video, e);
    } finally {
      deleteQuietly(output);
    }
  }

  Process start(List<String> cmd) throws IOException {
    return new ProcessBuilder(cmd)
        .redirectErrorStream(true)
        .redirectOutput(ProcessBuilder.Redirect.DISCARD)
        .start();
  }

  List<String> command(Path video, double timestampSeconds, Path output) {
    return List.of(
        properties.ffmpegBinary(),
        "-y",
        "-ss",
        String.format(Locale.ROOT, "%.3f", timestampSeconds),
        "-i",
        video.toAbsolutePath().toString(),
        "-vframes",
        "1",
        "-vf",
        "scale=" + properties.frameWidth() + ":" + properties.frameHeight(),
        "-q:v",
        "2",
        output.toAbsolutePath().toString());
  }

  private static void deleteQuietly(Path file) {
    if (file == null) {
      return;
    }
    try {
      Files.deleteIfExists(file);
    } catch (IOException e) {
      log.warn("Could not delete temporary frame {}", file, e);
    }
  }
}
