package com.ospicorp.pricelogger.interval;

import com.ospicorp.pricelogger.ingest.IngestionEngine;
import com.ospicorp.pricelogger.ingest.SyncSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated routes used by operators and the scheduler's manual counterpart.
 */
@RestController
@Tag(name = "Internal")
@ConditionalOnProperty(name = "aemo.internal-routes.enabled", havingValue = "true",
    matchIfMissing = true)
public class IntervalController {

  private final IntervalQueryService queries;
  private final IngestionEngine ingestion;
  private final Clock clock;

  public IntervalController(IntervalQueryService queries, IngestionEngine ingestion, Clock clock) {
    this.queries = queries;
    this.ingestion = ingestion;
    this.clock = clock;
  }

  @PostMapping("/sync")
  @Operation(summary = "Run one ingestion cycle",
      description = "Pulls the upstream 5MIN report and stores intervals not yet present.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Sync summary",
          content = @Content(mediaType = "text/plain", schema = @Schema(type = "string",
              example = "Sync completed. Received 5 intervals, inserted 5 new intervals."))),
      @ApiResponse(responseCode = "500", description = "Upstream or storage failure",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<String> sync() {
    SyncSummary summary = ingestion.sync();
    // plain text on success only; failures go through the problem handler
    return ResponseEntity.ok()
        .contentType(MediaType.TEXT_PLAIN)
        .body(summary.message());
  }

  @GetMapping("/range")
  @Tag(name = "Data")
  @Operation(summary = "Query intervals",
      description = "Latest row per region by default, a trailing window with lastSec, or an "
          + "explicit window with start and end.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "One page of intervals",
          headers = {
              @Header(name = RangeResponses.TOTAL_COUNT, schema = @Schema(type = "integer")),
              @Header(name = RangeResponses.HAS_NEXT_PAGE, schema = @Schema(type = "boolean"))
          },
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = IntervalView.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid parameters",
          content = @Content(mediaType = "application/json"))
  })
  public ResponseEntity<List<IntervalView>> range(
      @RequestParam(required = false) @Parameter(description = "Trailing window in seconds",
          example = "3600") Long lastSec,
      @RequestParam(required = false) @Parameter(description = "Window start, ms since epoch")
          Long start,
      @RequestParam(required = false) @Parameter(description = "Window end, ms since epoch")
          Long end,
      @RequestParam(name = "regionid", required = false)
          @Parameter(description = "Region filter", example = "NSW1") String regionId,
      @RequestParam(required = false) @Parameter(description = "Page size", example = "100")
          Integer limit,
      @RequestParam(required = false) @Parameter(description = "Rows to skip", example = "0")
          Long offset,
      @RequestParam(required = false) @Parameter(description = "json or csv") String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    RangeQuery query = RangeQuery.of(lastSec, start, end, regionId, limit, offset,
        clock.millis());
    return RangeResponses.render(queries.range(query), format, accept);
  }
}
