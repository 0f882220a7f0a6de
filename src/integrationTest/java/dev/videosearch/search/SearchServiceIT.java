package dev.videosearch.search;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.BDDMockito.given;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import dev.videosearch.BaseIntegrationTest;
import dev.videosearch.ingestion.ClipIngestionRequest;
import dev.videosearch.ingestion.EmbeddingSegment;
import dev.videosearch.ingestion.IngestionResult;
import dev.videosearch.ingestion.IngestionService;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

class SearchServiceIT extends BaseIntegrationTest {

  @Autowired SearchService searchService;

  @Autowired IngestionService ingestionService;

  @Autowired ObjectMapper objectMapper;

  @MockitoBean EmbeddingModel embeddingModel;

  @BeforeEach
  void seedTestData() {
    // harbour clip: visual and audio close to axis 0; forest clip: axis 1
    ingest(
        "video-harbour",
        "red boats leave the harbour",
        segment(0, 6, "visual-text", vector(0)),
        segment(0, 6, "audio", vector(0, 2, 0.2f)),
        segment(6, 12, "visual-text", vector(0, 3, 0.5f)));
    ingest(
        "video-forest",
        "a quiet forest at dawn",
        segment(0, 6, "visual-text", vector(1)),
        segment(0, 6, "audio", vector(1, 4, 0.2f)));
    given(embeddingModel.embedAll(anyList()))
        .willReturn(Response.from(List.of(Embedding.from(vector(0)))));
  }

  @Test
  void hybridSearchRanksMatchingVideoFirst() {
    SearchResponse response =
        searchService.search(new SearchRequest("boats in the harbour", 5, "hybrid"));

    assertThat(response.clips()).isNotEmpty();
    assertThat(response.clips().get(0).videoId()).isEqualTo("video-harbour");
    assertThat(response.clips()).allSatisfy(c -> assertThat(c.score()).isBetween(0.0, 1.0));
  }

  @Test
  void textSearchDoesNotNeedEmbedding() {
    given(embeddingModel.embedAll(anyList())).willThrow(new IllegalStateException("down"));

    SearchResponse response = searchService.search(new SearchRequest("forest", 5, "text"));

    assertThat(response.clips()).extracting(ClipResult::videoId).containsOnly("video-forest");
  }

  @Test
  void vectorSearchFusesInStore() {
    SearchResponse response =
        searchService.search(new SearchRequest("boats", null, 5, "vector", true));

    assertThat(response.clips().get(0).videoId()).isEqualTo("video-harbour");
    assertThat(response.clips().get(0).rawScores()).containsKey("rrf");
  }

  @Test
  void visualSearchAppliesScoreFloor() {
    SearchResponse response = searchService.search(new SearchRequest("boats", 10, "visual"));

    assertThat(response.clips()).extracting(ClipResult::videoId).containsOnly("video-harbour");
    assertThat(response.clips()).allSatisfy(c -> assertThat(c.score()).isGreaterThanOrEqualTo(0.6));
  }

  @Test
  void videoFilterRestrictsResults() {
    SearchResponse response =
        searchService.search(new SearchRequest("boats", "video-forest", 5, "multimodal", false));

    assertThat(response.clips()).extracting(ClipResult::videoId).containsOnly("video-forest");
  }

  @Test
  void listingCountsClipsPerVideo() {
    VideoListResponse videos = searchService.listVideos();

    assertThat(videos.total()).isEqualTo(2);
    assertThat(videos.videos())
        .extracting(VideoResult::videoId, VideoResult::clipsCount)
        .containsExactlyInAnyOrder(
            tuple("video-harbour", 2L),
            tuple("video-forest", 1L));
  }

  @Test
  void statisticsReportDocumentCount() {
    assertThat(searchService.statistics().documentCount()).isEqualTo(3);
  }

  private void ingest(String videoId, String text, EmbeddingSegment... segments) {
    IngestionResult result =
        ingestionService.ingest(
            new ClipIngestionRequest(
                "https://cdn.example.com/" + videoId + ".mp4", videoId, 0, text, List.of(segments)));
    assertThat(result.summary().skipped()).isZero();
  }

  private EmbeddingSegment segment(double start, double end, String option, float[] vector) {
    return new EmbeddingSegment(start, end, option, objectMapper.valueToTree(vector));
  }
}
