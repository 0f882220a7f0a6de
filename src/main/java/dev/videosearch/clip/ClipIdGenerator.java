package dev.videosearch.clip;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Static utility deriving the stable clip identifier shared by every modality document of one
 * {@code (video, time range)} pair.
 *
 * <p>The identifier is {@code clip_} followed by the first 16 hex characters of the SHA-256 of
 * {@code <videoId>_<start>_<end>}, with both timestamps rounded half-even to two decimals. Two
 * ingestions of the same range therefore collide on the same id instead of duplicating.
 */
public final class ClipIdGenerator {

  static final String PREFIX = "clip_";
  static final int HASH_LENGTH = 16;

  private ClipIdGenerator() {
    // utility class
  }

  /**
   * Computes the deterministic clip id.
   *
   * @param videoId the parent video identifier
   * @param startSec clip start in seconds (full precision, rounded here)
   * @param endSec clip end in seconds (full precision, rounded here)
   * @return {@code clip_} plus 16 lowercase hex characters
   */
  public static String clipId(String videoId, double startSec, double endSec) {
    String key = videoId + "_" + format(startSec) + "_" + format(endSec);
    return PREFIX + sha256(key).substring(0, HASH_LENGTH);
  }

  /**
   * Rounds a timestamp to the two-decimal precision used for identity.
   *
   * @param seconds timestamp in seconds
   * @return the timestamp rounded half-even on its exact binary value
   */
  public static double roundForIdentity(double seconds) {
    return toScale(seconds).doubleValue();
  }

  private static String format(double seconds) {
    return toScale(seconds).toPlainString();
  }

  private static BigDecimal toScale(double seconds) {
    if (!Double.isFinite(seconds)) {
      throw new IllegalArgumentException("Timestamp must be finite, got: " + seconds);
    }
    return new BigDecimal(seconds).setScale(2, RoundingMode.HALF_EVEN);
  }

  private static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest(content.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
