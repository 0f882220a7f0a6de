package dev.videosearch.store;

import com.pgvector.PGvector;
import dev.videosearch.clip.ClipDocument;
import dev.videosearch.clip.Modality;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.SqlParameterValue;
import org.springframework.stereotype.Repository;

/**
 * {@link ClipIndexStore} on PostgreSQL with the pgvector extension.
 *
 * <p>Each collection is a table with one row per clip id: the clip metadata, the keyword text
 * (indexed with a GIN full-text index) and one {@code vector(d)} column per modality (each with
 * an HNSW index using the operator class of its metric). k-NN scores follow the usual k-NN engine
 * conventions: cosine {@code (1 + cos) / 2}, L2 {@code 1 / (1 + d^2)}. Keyword relevance is {@code
 * ts_rank_cd}. Reciprocal-rank fusion is computed in SQL.
 *
 * <p>Table, column and text search configuration names come from validated configuration and are
 * inlined into the SQL; every value is bound as a parameter.
 */
@Repository
public class PgVectorClipIndexStore implements ClipIndexStore {

  private static final Logger log = LoggerFactory.getLogger(PgVectorClipIndexStore.class);

  // undefined_function, undefined_table, undefined_column, undefined_object
  private static final Set<String> FUSION_UNSUPPORTED_STATES =
      Set.of("42883", "42P01", "42703", "42704");

  private static final String METADATA_COLUMNS =
      "clip_id, video_id, video_path, part, segment_index, timestamp_start, timestamp_end,"
          + " embedding_scope, thumbnail_uri";

  private final JdbcTemplate jdbcTemplate;
  private final IndexSchema layout;

  /**
   * @param jdbcTemplate template over the application's data source
   * @param layout field layout shared by every collection this store manages
   */
  public PgVectorClipIndexStore(JdbcTemplate jdbcTemplate, IndexSchema layout) {
    this.jdbcTemplate = jdbcTemplate;
    this.layout = layout;
  }

  @Override
  public void ensureSchema(IndexSchema schema) {
    String table = schema.collection();
    run(
        "ensure schema of " + table,
        () -> {
          jdbcTemplate.execute("CREATE EXTENSION IF NOT EXISTS vector");
          jdbcTemplate.execute(
              """
              CREATE TABLE IF NOT EXISTS %s (
                clip_id TEXT PRIMARY KEY,
                video_id TEXT NOT NULL,
                video_path TEXT NOT NULL,
                part INTEGER NOT NULL,
                segment_index INTEGER NOT NULL,
                timestamp_start DOUBLE PRECISION NOT NULL,
                timestamp_end DOUBLE PRECISION NOT NULL,
                embedding_scope TEXT,
                %s TEXT,
                thumbnail_uri TEXT,
                created_at TIMESTAMPTZ NOT NULL DEFAULT now()
              )
              """
                  .formatted(table, schema.keywordField()));
          for (VectorFieldSpec field : schema.vectorFields()) {
            ensureVectorColumn(table, field);
          }
          jdbcTemplate.execute(
              "CREATE INDEX IF NOT EXISTS %s_%s_fts ON %s USING gin (%s)"
                  .formatted(table, schema.keywordField(), table, tsvector(schema)));
          jdbcTemplate.execute(
              "CREATE INDEX IF NOT EXISTS %s_video_id_idx ON %s (video_id)"
                  .formatted(table, table));
          return null;
        });
  }

  private void ensureVectorColumn(String table, VectorFieldSpec field) {
    String expected = "vector(" + field.dimension() + ")";
    List<String> types =
        jdbcTemplate.queryForList(
            """
            SELECT format_type(a.atttypid, a.atttypmod)
            FROM pg_attribute a
            WHERE a.attrelid = to_regclass(?) AND a.attname = ? AND NOT a.attisdropped
            """,
            String.class,
            table,
            field.name());
    if (types.isEmpty()) {
      jdbcTemplate.execute(
          "ALTER TABLE %s ADD COLUMN IF NOT EXISTS %s %s".formatted(table, field.name(), expected));
    } else if (!expected.equals(types.get(0))) {
      throw new IllegalStateException(
          "Field "
              + table
              + "."
              + field.name()
              + " is "
              + types.get(0)
              + " but "
              + expected
              + " is configured; the collection must be rebuilt to change it");
    }
    jdbcTemplate.execute(
        "CREATE INDEX IF NOT EXISTS %s_%s_hnsw ON %s USING hnsw (%s %s)"
            .formatted(table, field.name(), table, field.name(), field.metric().operatorClass()));
  }

  @Override
  public boolean exists(String collection) {
    return run(
        "check " + collection,
        () ->
            Boolean.TRUE.equals(
                jdbcTemplate.queryForObject(
                    "SELECT to_regclass(?) IS NOT NULL", Boolean.class, collection)));
  }

  @Override
  public void upsert(String collection, ClipDocument document) {
    run(
        "upsert " + document.clipId(),
        () -> {
          jdbcTemplate.update(upsertSql(collection), upsertArgs(document));
          return null;
        });
  }

  private String upsertSql(String table) {
    String vectorColumns =
        layout.vectorFields().stream().map(VectorFieldSpec::name).collect(Collectors.joining(", "));
    String vectorMerge =
        layout.vectorFields().stream()
            .map(f -> "%1$s = COALESCE(EXCLUDED.%1$s, %2$s.%1$s)".formatted(f.name(), table))
            .collect(Collectors.joining(",\n  "));
    String placeholders = "?, ".repeat(10 + layout.vectorFields().size());
    return """
        INSERT INTO %1$s (%2$s, %3$s, %4$s)
        VALUES (%5$s)
        ON CONFLICT (clip_id) DO UPDATE SET
          video_id = EXCLUDED.video_id,
          video_path = EXCLUDED.video_path,
          part = EXCLUDED.part,
          segment_index = LEAST(EXCLUDED.segment_index, %1$s.segment_index),
          timestamp_start = EXCLUDED.timestamp_start,
          timestamp_end = EXCLUDED.timestamp_end,
          embedding_scope = COALESCE(EXCLUDED.embedding_scope, %1$s.embedding_scope),
          %3$s = COALESCE(%1$s.%3$s, EXCLUDED.%3$s),
          thumbnail_uri = COALESCE(EXCLUDED.thumbnail_uri, %1$s.thumbnail_uri),
          %6$s
        """
        .formatted(
            table,
            METADATA_COLUMNS,
            layout.keywordField(),
            vectorColumns,
            placeholders.substring(0, placeholders.length() - 2),
            vectorMerge);
  }

  private Object[] upsertArgs(ClipDocument document) {
    List<Object> args = new ArrayList<>();
    args.add(document.clipId());
    args.add(document.videoId());
    args.add(document.videoPath());
    args.add(document.part());
    args.add(document.segmentIndex());
    args.add(document.timestampStart());
    args.add(document.timestampEnd());
    args.add(new SqlParameterValue(Types.VARCHAR, document.embeddingScope()));
    args.add(new SqlParameterValue(Types.VARCHAR, document.thumbnailUri()));
    args.add(new SqlParameterValue(Types.VARCHAR, document.clipText()));
    for (VectorFieldSpec field : layout.vectorFields()) {
      args.add(vectorParameter(document.embedding(field.modality())));
    }
    return args.toArray();
  }

  @Override
  public List<BulkItemOutcome> bulkUpsert(String collection, List<ClipDocument> documents) {
    String sql = upsertSql(collection);
    List<BulkItemOutcome> outcomes = new ArrayList<>(documents.size());
    for (ClipDocument document : documents) {
      try {
        run(
            "bulk upsert " + document.clipId(),
            () -> jdbcTemplate.update(sql, upsertArgs(document)));
        outcomes.add(BulkItemOutcome.created(document.clipId()));
      } catch (RateLimitedException e) {
        throw e;
      } catch (DataAccessException | UpstreamUnavailableException e) {
        log.debug("Bulk write of {} failed", document.clipId(), e);
        outcomes.add(BulkItemOutcome.failed(document.clipId(), e.getMessage()));
      }
    }
    return outcomes;
  }

  @Override
  public int deleteByVideoId(String collection, String videoId) {
    return run(
        "delete video " + videoId,
        () -> jdbcTemplate.update("DELETE FROM %s WHERE video_id = ?".formatted(collection), videoId));
  }

  @Override
  public boolean updateThumbnail(String collection, String clipId, String thumbnailUri) {
    return run(
            "update thumbnail of " + clipId,
            () ->
                jdbcTemplate.update(
                    "UPDATE %s SET thumbnail_uri = ? WHERE clip_id = ?".formatted(collection),
                    thumbnailUri,
                    clipId))
        > 0;
  }

  @Override
  public boolean updateClipText(String collection, String clipId, String clipText) {
    return run(
            "update clip text of " + clipId,
            () ->
                jdbcTemplate.update(
                    "UPDATE %s SET %s = ? WHERE clip_id = ?"
                        .formatted(collection, layout.keywordField()),
                    clipText,
                    clipId))
        > 0;
  }

  @Override
  public List<ScoredHit> knnQuery(String collection, KnnQuery query, SearchFilter filter) {
    VectorFieldSpec field = query.field();
    String distance = field.name() + " " + field.metric().operator() + " ?";
    List<Object> args = new ArrayList<>();
    args.add(vectorParameter(query.vector()));
    StringBuilder sql =
        new StringBuilder()
            .append("SELECT * FROM (SELECT ")
            .append(selectColumns(false))
            .append(", ")
            .append(field.metric().scoreExpression(distance))
            .append(" AS score FROM ")
            .append(collection)
            .append(" WHERE ")
            .append(field.name())
            .append(" IS NOT NULL");
    appendFilter(sql, args, filter);
    sql.append(" ORDER BY ").append(distance).append(" LIMIT ?) hits");
    args.add(vectorParameter(query.vector()));
    args.add(query.k());
    if (query.minScore() != null) {
      sql.append(" WHERE score >= ?");
      args.add(query.minScore());
    }
    sql.append(" ORDER BY score DESC, clip_id");
    return run(
        "k-NN query on " + collection + "." + field.name(),
        () -> jdbcTemplate.query(sql.toString(), hitMapper(), args.toArray()));
  }

  @Override
  public List<ScoredHit> matchQuery(String collection, MatchQuery query, SearchFilter filter) {
    String config = layout.textSearchConfig();
    List<Object> args = new ArrayList<>();
    args.add(query.text());
    StringBuilder sql =
        new StringBuilder()
            .append("SELECT ")
            .append(selectColumns(false))
            .append(", ts_rank_cd(")
            .append(tsvector(layout))
            .append(", q) AS score FROM ")
            .append(collection)
            .append(", websearch_to_tsquery('")
            .append(config)
            .append("', ?) q WHERE ")
            .append(tsvector(layout))
            .append(" @@ q");
    appendFilter(sql, args, filter);
    sql.append(" ORDER BY score DESC, clip_id LIMIT ?");
    args.add(query.size());
    return run(
        "keyword query on " + collection,
        () -> jdbcTemplate.query(sql.toString(), hitMapper(), args.toArray()));
  }

  @Override
  public List<ScoredHit> rankFusionQuery(
      String collection,
      List<KnnQuery> knnQueries,
      @Nullable MatchQuery matchQuery,
      int rankConstant,
      int size,
      SearchFilter filter) {
    if (knnQueries.isEmpty() && matchQuery == null) {
      return List.of();
    }
    List<Object> args = new ArrayList<>();
    List<String> ranked = new ArrayList<>();
    StringBuilder sql = new StringBuilder("WITH ");
    int i = 0;
    for (KnnQuery query : knnQueries) {
      VectorFieldSpec field = query.field();
      String distance = field.name() + " " + field.metric().operator() + " ?";
      String name = "q" + i++;
      ranked.add(name);
      sql.append(name)
          .append(" AS (SELECT clip_id, ROW_NUMBER() OVER (ORDER BY score DESC, clip_id) AS rank")
          .append(" FROM (SELECT clip_id, ")
          .append(field.metric().scoreExpression(distance))
          .append(" AS score FROM ")
          .append(collection)
          .append(" WHERE ")
          .append(field.name())
          .append(" IS NOT NULL");
      args.add(vectorParameter(query.vector()));
      appendFilter(sql, args, filter);
      sql.append(" ORDER BY ").append(distance).append(" LIMIT ?) k");
      args.add(vectorParameter(query.vector()));
      args.add(query.k());
      if (query.minScore() != null) {
        sql.append(" WHERE score >= ?");
        args.add(query.minScore());
      }
      sql.append("), ");
    }
    if (matchQuery != null) {
      ranked.add("qm");
      sql.append("qm AS (SELECT clip_id, ROW_NUMBER() OVER (ORDER BY ts_rank_cd(")
          .append(tsvector(layout))
          .append(", q) DESC, clip_id) AS rank FROM ")
          .append(collection)
          .append(", websearch_to_tsquery('")
          .append(layout.textSearchConfig())
          .append("', ?) q WHERE ")
          .append(tsvector(layout))
          .append(" @@ q");
      args.add(matchQuery.text());
      appendFilter(sql, args, filter);
      sql.append(" ORDER BY rank LIMIT ?), ");
      args.add(matchQuery.size());
    }
    sql.append("fused AS (SELECT clip_id, SUM(1.0 / (")
        .append(rankConstant)
        .append(" + rank)) AS score, MIN(rank) AS best_rank FROM (")
        .append(
            ranked.stream()
                .map(n -> "SELECT clip_id, rank FROM " + n)
                .collect(Collectors.joining(" UNION ALL ")))
        .append(") r GROUP BY clip_id) SELECT ")
        .append(selectColumns(false).replace("clip_id,", "c.clip_id,"))
        .append(", fused.score FROM fused JOIN ")
        .append(collection)
        .append(" c ON c.clip_id = fused.clip_id")
        .append(" ORDER BY fused.score DESC, fused.best_rank, c.clip_id LIMIT ?");
    args.add(size);
    try {
      return run(
          "rank fusion query on " + collection,
          () -> jdbcTemplate.query(sql.toString(), hitMapper(), args.toArray()));
    } catch (BadSqlGrammarException e) {
      if (!isFusionUnsupported(e)) {
        log.error(
            "Rank fusion query on {} failed with SQL state {}",
            collection,
            e.getSQLException().getSQLState(),
            e);
        throw e;
      }
      throw new FusionUnavailableException("Rank fusion not available on " + collection, e);
    }
  }

  /**
   * Whether a rejected fusion query means the collection cannot serve it (a function, relation,
   * column or type the query needs is missing) rather than a broken statement.
   */
  static boolean isFusionUnsupported(BadSqlGrammarException e) {
    String state = e.getSQLException().getSQLState();
    return state != null && FUSION_UNSUPPORTED_STATES.contains(state);
  }

  @Override
  public List<ClipDocument> page(String collection, @Nullable String afterClipId, int limit) {
    String select = "SELECT " + selectColumns(true) + " FROM " + collection;
    return run(
        "page " + collection,
        () ->
            afterClipId == null
                ? jdbcTemplate.query(
                    select + " ORDER BY clip_id LIMIT ?", documentMapper(true), limit)
                : jdbcTemplate.query(
                    select + " WHERE clip_id > ? ORDER BY clip_id LIMIT ?",
                    documentMapper(true),
                    afterClipId,
                    limit));
  }

  @Override
  public long count(String collection) {
    if (!exists(collection)) {
      return 0;
    }
    Long count =
        run(
            "count " + collection,
            () -> jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + collection, Long.class));
    return count == null ? 0 : count;
  }

  @Override
  public Optional<ClipDocument> findById(String collection, String clipId) {
    return run(
        "find " + clipId,
        () ->
            jdbcTemplate
                .query(
                    "SELECT " + selectColumns(true) + " FROM " + collection + " WHERE clip_id = ?",
                    documentMapper(true),
                    clipId)
                .stream()
                .findFirst());
  }

  @Override
  public List<ClipDocument> findByVideoId(String collection, String videoId) {
    return run(
        "find clips of " + videoId,
        () ->
            jdbcTemplate.query(
                "SELECT "
                    + selectColumns(false)
                    + " FROM "
                    + collection
                    + " WHERE video_id = ? ORDER BY timestamp_start, clip_id",
                documentMapper(false),
                videoId));
  }

  @Override
  public List<VideoSummary> listVideos(String collection) {
    String sql =
        """
        SELECT video_id,
               MIN(video_path) AS video_path,
               (ARRAY_AGG(%s ORDER BY timestamp_start, clip_id))[1] AS title,
               COUNT(*) AS clip_count
        FROM %s
        GROUP BY video_id
        ORDER BY MIN(video_path), video_id
        """
            .formatted(layout.keywordField(), collection);
    return run(
        "list videos of " + collection,
        () ->
            jdbcTemplate.query(
                sql,
                (rs, rowNum) ->
                    new VideoSummary(
                        rs.getString("video_id"),
                        rs.getString("video_path"),
                        rs.getString("title"),
                        rs.getLong("clip_count"))));
  }

  private String selectColumns(boolean includeVectors) {
    StringBuilder columns =
        new StringBuilder(METADATA_COLUMNS)
            .append(", ")
            .append(layout.keywordField())
            .append(" AS keyword_text");
    if (includeVectors) {
      for (VectorFieldSpec field : layout.vectorFields()) {
        columns
            .append(", ")
            .append(field.name())
            .append(" AS vec_")
            .append(field.modality().key());
      }
    }
    return columns.toString();
  }

  private static String tsvector(IndexSchema schema) {
    return "to_tsvector('%s', coalesce(%s, ''))"
        .formatted(schema.textSearchConfig(), schema.keywordField());
  }

  private static void appendFilter(StringBuilder sql, List<Object> args, SearchFilter filter) {
    if (filter.videoId() != null) {
      sql.append(" AND video_id = ?");
      args.add(filter.videoId());
    }
  }

  private static SqlParameterValue vectorParameter(float @Nullable [] vector) {
    return new SqlParameterValue(Types.OTHER, vector == null ? null : new PGvector(vector));
  }

  private RowMapper<ScoredHit> hitMapper() {
    RowMapper<ClipDocument> documents = documentMapper(false);
    return (rs, rowNum) ->
        new ScoredHit(rs.getString("clip_id"), rs.getDouble("score"), documents.mapRow(rs, rowNum));
  }

  private RowMapper<ClipDocument> documentMapper(boolean includeVectors) {
    return (rs, rowNum) -> {
      Map<Modality, float[]> vectors = new EnumMap<>(Modality.class);
      if (includeVectors) {
        for (VectorFieldSpec field : layout.vectorFields()) {
          float[] vector = readVector(rs, "vec_" + field.modality().key());
          if (vector != null) {
            vectors.put(field.modality(), vector);
          }
        }
      }
      return new ClipDocument(
          rs.getString("clip_id"),
          rs.getString("video_id"),
          rs.getString("video_path"),
          rs.getInt("part"),
          rs.getInt("segment_index"),
          rs.getDouble("timestamp_start"),
          rs.getDouble("timestamp_end"),
          rs.getString("embedding_scope"),
          rs.getString("keyword_text"),
          rs.getString("thumbnail_uri"),
          vectors);
    };
  }

  private static float @Nullable [] readVector(ResultSet rs, String column) throws SQLException {
    String text = rs.getString(column);
    return text == null ? null : new PGvector(text).toArray();
  }

  /**
   * Runs a store call, translating throttling and connectivity failures into the port's
   * exceptions. Other data access failures propagate unchanged.
   */
  private <T> T run(String operation, Supplier<T> call) {
    try {
      return call.get();
    } catch (TransientDataAccessException e) {
      throw new RateLimitedException("Store throttled " + operation, e);
    } catch (DataAccessResourceFailureException e) {
      if (isInsufficientResources(e)) {
        throw new RateLimitedException("Store out of capacity during " + operation, e);
      }
      throw new UpstreamUnavailableException("Store unreachable during " + operation, e);
    } catch (DataAccessException e) {
      if (isInsufficientResources(e)) {
        throw new RateLimitedException("Store out of capacity during " + operation, e);
      }
      throw e;
    }
  }

  private static boolean isInsufficientResources(DataAccessException e) {
    Throwable cause = e.getMostSpecificCause();
    if (cause instanceof SQLException sql) {
      String state = sql.getSQLState();
      return state != null && state.startsWith("53");
    }
    return false;
  }
}
