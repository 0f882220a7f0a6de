package dev.videosearch;

import dev.videosearch.store.IndexSchemaManager;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance with pgvector. The configured clip
 * collection is created on first use and emptied before each test.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  /** Dimension of every vector field in the default configuration. */
  protected static final int DIMENSION = 512;

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(
          DockerImageName.parse("pgvector/pgvector:pg16").asCompatibleSubstituteFor("postgres"));

  static {
    postgres.start();
  }

  @Autowired protected IndexSchemaManager schemaManager;

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void cleanCollection() {
    schemaManager.ensureSchema();
    jdbcTemplate.execute("TRUNCATE TABLE " + schemaManager.defaultSchema().collection());
  }

  /** A unit vector along {@code axis}, optionally tilted towards {@code towards}. */
  protected static float[] vector(int axis, int towards, float tilt) {
    float[] v = new float[DIMENSION];
    v[axis] = 1.0f;
    if (tilt != 0.0f) {
      v[towards] += tilt;
    }
    return v;
  }

  protected static float[] vector(int axis) {
    return vector(axis, axis, 0.0f);
  }
}
