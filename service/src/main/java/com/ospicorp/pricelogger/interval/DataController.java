package com.ospicorp.pricelogger.interval;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.time.Clock;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "Data")
public class DataController {

  private final IntervalQueryService queries;
  private final Clock clock;

  public DataController(IntervalQueryService queries, Clock clock) {
    this.queries = queries;
    this.clock = clock;
  }

  @GetMapping("/data")
  @SecurityRequirement(name = "bearerAuth")
  @Operation(summary = "Query intervals (authenticated)",
      description = "Same parameters and paging headers as /range; requires an access token.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "One page of intervals",
          content = {
              @Content(mediaType = "application/json",
                  array = @ArraySchema(schema = @Schema(implementation = IntervalView.class))),
              @Content(mediaType = "text/csv")
          }),
      @ApiResponse(responseCode = "400", description = "Invalid parameters",
          content = @Content(mediaType = "application/json")),
      @ApiResponse(responseCode = "401", description = "Missing or invalid access token"),
      @ApiResponse(responseCode = "429", description = "Too many requests",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public ResponseEntity<List<IntervalView>> data(
      @RequestParam(required = false) @Parameter(description = "Trailing window in seconds")
          Long lastSec,
      @RequestParam(required = false) Long start,
      @RequestParam(required = false) Long end,
      @RequestParam(name = "regionid", required = false) String regionId,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Long offset,
      @RequestParam(required = false) String format,
      @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {
    RangeQuery query = RangeQuery.of(lastSec, start, end, regionId, limit, offset,
        clock.millis());
    return RangeResponses.render(queries.range(query), format, accept);
  }
}
