package dev.videosearch.media;

/** A frame could not be extracted from a video. */
public class FrameExtractionException extends Exception {

  public FrameExtractionException(String message) {
    super(message);
  }

  public FrameExtractionException(String message, Throwable cause) {
    super(message, cause);
  }
}
