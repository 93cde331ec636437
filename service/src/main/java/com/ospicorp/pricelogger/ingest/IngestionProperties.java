package com.ospicorp.pricelogger.ingest;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Upstream source and scheduling settings.
 *
 * @param apiUrl endpoint that answers the 5MIN report POST
 * @param apiHeaders JSON object of extra request headers, as supplied in {@code AEMO_API_HEADERS}
 * @param marketOffset offset applied to upstream timestamps that carry none
 */
@ConfigurationProperties("aemo.ingestion")
public record IngestionProperties(
    String apiUrl,
    @DefaultValue("{}") String apiHeaders,
    @DefaultValue("+10:00") String marketOffset,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("30s") Duration readTimeout,
    @DefaultValue("0 1/5 * * * *") String cron,
    @DefaultValue("true") boolean schedulerEnabled) {
}
