package com.ospicorp.pricelogger.ingest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "aemo.ingestion.scheduler-enabled", havingValue = "true",
    matchIfMissing = true)
public class IngestionScheduler {

  private static final Logger log = LoggerFactory.getLogger(IngestionScheduler.class);

  private final IngestionEngine engine;

  public IngestionScheduler(IngestionEngine engine) {
    this.engine = engine;
  }

  @Scheduled(cron = "${aemo.ingestion.cron:0 1/5 * * * *}", zone = "UTC")
  public void scheduledSync() {
    try {
      engine.trySync().ifPresent(summary -> log.info("Scheduled {}", summary.message()));
    } catch (RuntimeException ex) {
      // the next tick retries
      log.error("Scheduled sync failed: {}", ex.getMessage(), ex);
    }
  }
}
