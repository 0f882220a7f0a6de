package dev.videosearch.store;

import org.jspecify.annotations.Nullable;

/**
 * Optional constraints applied to every sub-query of a search.
 *
 * @param videoId restricts hits to one video when set
 */
public record SearchFilter(@Nullable String videoId) {

  private static final SearchFilter NONE = new SearchFilter(null);

  public static SearchFilter none() {
    return NONE;
  }

  public static SearchFilter forVideo(@Nullable String videoId) {
    return videoId == null || videoId.isBlank() ? NONE : new SearchFilter(videoId);
  }
}
