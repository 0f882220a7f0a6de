package dev.videosearch.store;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Makes sure a collection exists with its declared schema before the first write to it.
 *
 * <p>Each collection transitions from absent to present exactly once per process; later calls
 * return without touching the store.
 */
@Component
public class IndexSchemaManager {

  private static final Logger log = LoggerFactory.getLogger(IndexSchemaManager.class);

  private final ClipIndexStore store;
  private final IndexSchema defaultSchema;
  private final Set<String> ensured = ConcurrentHashMap.newKeySet();

  public IndexSchemaManager(ClipIndexStore store, IndexSchema defaultSchema) {
    this.store = store;
    this.defaultSchema = defaultSchema;
  }

  /** Ensures the configured collection. */
  public void ensureSchema() {
    ensureSchema(defaultSchema);
  }

  /** Ensures the given collection, creating it on first use. */
  public void ensureSchema(IndexSchema schema) {
    if (ensured.contains(schema.collection())) {
      return;
    }
    synchronized (this) {
      if (ensured.contains(schema.collection())) {
        return;
      }
      store.ensureSchema(schema);
      ensured.add(schema.collection());
      log.info(
          "Collection {} ready with {} vector fields", schema.collection(), schema.vectorFields().size());
    }
  }

  public IndexSchema defaultSchema() {
    return defaultSchema;
  }
}
