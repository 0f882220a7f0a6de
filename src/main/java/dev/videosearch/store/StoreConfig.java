package dev.videosearch.store;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Resolves the collection schema and store capabilities once at startup. */
@Configuration
public class StoreConfig {

  @Bean
  public IndexSchema indexSchema(IndexProperties properties) {
    return properties.toSchema();
  }

  @Bean
  public StoreCapabilities storeCapabilities(IndexProperties properties) {
    return new StoreCapabilities(properties.isNativeRankFusion());
  }
}
