package dev.videosearch.embedding;

/**
 * Request body for the embedding service's {@code /embed} endpoint.
 *
 * @param inputType always {@code text} for query embeddings
 * @param inputText the text to embed
 * @param textTruncate truncation mode ({@code none} rejects over-long input instead of cutting)
 */
record EmbedRequest(String inputType, String inputText, String textTruncate) {

  static EmbedRequest text(String text) {
    return new EmbedRequest("text", text, "none");
  }
}
