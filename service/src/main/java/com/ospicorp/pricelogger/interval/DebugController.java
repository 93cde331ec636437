package com.ospicorp.pricelogger.interval;

import io.swagger.v3.oas.annotations.Hidden;
import java.time.Clock;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Store round-trip check: writes a synthetic {@code TEST1} row and reads back the newest rows.
 */
@Hidden
@RestController
@ConditionalOnProperty(name = "aemo.debug-routes.enabled", havingValue = "true")
public class DebugController {

  private static final Logger log = LoggerFactory.getLogger(DebugController.class);
  static final String TEST_REGION = "TEST1";
  private static final long FIVE_MINUTES_MS = 5 * 60 * 1000L;

  private final IntervalQueryService queries;
  private final Clock clock;

  public DebugController(IntervalQueryService queries, Clock clock) {
    this.queries = queries;
    this.clock = clock;
  }

  @PostMapping("/testInsertThenRead")
  public List<IntervalView> insertThenRead() {
    long now = clock.millis();
    long boundary = now - now % FIVE_MINUTES_MS;
    Interval probe = new Interval(boundary, TEST_REGION, "Test Region", 42.0, 100.0, "TEST",
        0.0, 0.0, 0.0, 0.0);
    int inserted = queries.insertIfAbsent(probe);
    log.info("Debug insert at {} wrote {} row(s)", boundary, inserted);
    return queries.mostRecent(10).stream().map(IntervalView::of).toList();
  }
}
