package dev.videosearch.media;

import java.nio.file.Path;

/** Grabs a still frame from a local video file. */
public interface FrameExtractor {

  /**
   * Extracts the frame shown at a timestamp as JPEG.
   *
   * @param video local video file
   * @param timestampSeconds position of the frame
   * @return JPEG bytes
   * @throws FrameExtractionException when extraction fails or exceeds its time limit
   */
  byte[] extractFrame(Path video, double timestampSeconds) throws FrameExtractionException;
}
