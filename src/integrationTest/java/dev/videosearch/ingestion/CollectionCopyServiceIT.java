package dev.videosearch.ingestion;

import static org.assertj.core.api.Assertions.assertThat;

import dev.videosearch.BaseIntegrationTest;
import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import dev.videosearch.store.ClipIndexStore;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class CollectionCopyServiceIT extends BaseIntegrationTest {

  private static final String TARGET = "video_clips_copy";

  @Autowired CollectionCopyService copyService;

  @Autowired ClipIndexStore store;

  @BeforeEach
  void dropTarget() {
    jdbcTemplate.execute("DROP TABLE IF EXISTS " + TARGET);
  }

  @Test
  void copiesDocumentsIntoNewCollection() {
    String source = schemaManager.defaultSchema().collection();
    for (int i = 0; i < 7; i++) {
      store.upsert(
          source,
          new ClipDocument(
              "clip_" + i,
              "video-1",
              "s3://videos/video-1.mp4",
              0,
              i,
              i * 6.0,
              i * 6.0 + 6.0,
              "visual-text",
              "clip " + i,
              null,
              Map.of(Modality.VISUAL, vector(i))));
    }

    CopyReport report = copyService.copy(source, TARGET);

    assertThat(report.attempted()).isEqualTo(7);
    assertThat(report.created()).isEqualTo(7);
    assertThat(report.sourceCount()).isEqualTo(7);
    assertThat(report.targetCount()).isEqualTo(7);
    ClipDocument copied = store.findById(TARGET, "clip_3").orElseThrow();
    assertThat(copied.clipText()).isEqualTo("clip 3");
    assertThat(copied.embedding(Modality.VISUAL)[3]).isEqualTo(1.0f);
  }
}
