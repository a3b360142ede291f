package io.github.themoah.breakout.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for ingestion of pushed observation batches.
 *
 * @param maxItemsPerBatch observations beyond this count are ignored
 */
public record IngestionConfig(int maxItemsPerBatch) {

  private static final Logger log = LoggerFactory.getLogger(IngestionConfig.class);

  private static final int DEFAULT_MAX_ITEMS = 200;

  public static IngestionConfig defaults() {
    return new IngestionConfig(DEFAULT_MAX_ITEMS);
  }

  /**
   * Loads configuration from INGEST_MAX_ITEMS (default: 200).
   */
  public static IngestionConfig from(Env env) {
    int maxItems = env.getPositiveInt("INGEST_MAX_ITEMS", DEFAULT_MAX_ITEMS);
    log.info("Ingestion config: maxItemsPerBatch={}", maxItems);
    return new IngestionConfig(maxItems);
  }
}
