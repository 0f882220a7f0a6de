package dev.videosearch;

import static org.assertj.core.api.Assertions.assertThat;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.videosearch.embedding.RemoteEmbeddingModel;
import dev.videosearch.mcp.McpToolService;
import dev.videosearch.store.ClipIndexStore;
import dev.videosearch.store.PgVectorClipIndexStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class SmokeIT extends BaseIntegrationTest {

  @Autowired ClipIndexStore store;

  @Autowired EmbeddingModel embeddingModel;

  @Autowired McpToolService mcpToolService;

  @Test
  void contextWiresDefaultAdapters() {
    assertThat(store).isInstanceOf(PgVectorClipIndexStore.class);
    assertThat(embeddingModel).isInstanceOf(RemoteEmbeddingModel.class);
  }

  @Test
  void collectionIsCreatedWithConfiguredFields() {
    String collection = schemaManager.defaultSchema().collection();

    assertThat(store.exists(collection)).isTrue();
    assertThat(
            jdbcTemplate.queryForObject(
                "SELECT format_type(atttypid, atttypmod) FROM pg_attribute"
                    + " WHERE attrelid = to_regclass(?) AND attname = 'emb_visual'",
                String.class,
                collection))
        .isEqualTo("vector(512)");
  }

  @Test
  void emptyIndexListsNoVideos() {
    assertThat(mcpToolService.listVideos()).isEqualTo("No videos indexed yet.");
  }
}
