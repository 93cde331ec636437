package com.ospicorp.pricelogger.interval;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.pricelogger.support.IntegrationTestSupport;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.web.client.RestTemplate;

class IntervalHttpTest extends IntegrationTestSupport {

  private static final long T0 = 1_714_528_800_000L; // 2024-05-01T02:00:00Z
  private static final long FIVE_MIN = 300_000L;
  private static final ParameterizedTypeReference<List<Map<String, Object>>> ROWS =
      new ParameterizedTypeReference<>() {};

  @Autowired
  private TestRestTemplate rest;

  @Autowired
  private MockMvc mockMvc;

  @Autowired
  @Qualifier("upstreamRestTemplate")
  private RestTemplate upstreamRestTemplate;

  @BeforeEach
  void reset() {
    clearIntervals();
  }

  @Test
  void rangeReturnsRowsWithPagingHeaders() {
    insert(interval(T0, "NSW1", 80.0), interval(T0, "QLD1", 70.0),
        interval(T0 + FIVE_MIN, "NSW1", 81.0));

    ResponseEntity<List<Map<String, Object>>> response = rest.exchange(
        "/range?start={s}&end={e}&limit=2", HttpMethod.GET, null, ROWS, T0, T0 + FIVE_MIN);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    HttpHeaders headers = response.getHeaders();
    assertThat(headers.getFirst("X-Total-Count")).isEqualTo("3");
    assertThat(headers.getFirst("X-Limit")).isEqualTo("2");
    assertThat(headers.getFirst("X-Offset")).isEqualTo("0");
    assertThat(headers.getFirst("X-Page")).isEqualTo("1");
    assertThat(headers.getFirst("X-Total-Pages")).isEqualTo("2");
    assertThat(headers.getFirst("X-Has-Next-Page")).isEqualTo("true");

    List<Map<String, Object>> rows = response.getBody();
    assertThat(rows).hasSize(2);
    assertThat(rows.get(0))
        .containsEntry("settlement", "2024-05-01T02:00:00Z")
        .containsEntry("settlement_ts", T0)
        .containsEntry("regionid", "NSW1")
        .containsEntry("region", "NSW")
        .containsEntry("rrp", 80.0)
        .containsEntry("periodtype", "TRADE")
        .containsKeys("totaldemand", "netinterchange", "scheduledgeneration",
            "semischeduledgeneration", "apcflag");
    assertThat(rows.get(1)).containsEntry("regionid", "QLD1");
  }

  @Test
  void rangeDefaultsToLatestPerRegion() {
    insert(interval(T0, "NSW1", 80.0), interval(T0 + FIVE_MIN, "NSW1", 81.0),
        interval(T0, "VIC1", 60.0));

    ResponseEntity<List<Map<String, Object>>> response =
        rest.exchange("/range", HttpMethod.GET, null, ROWS);

    assertThat(response.getBody()).extracting(row -> row.get("regionid"))
        .containsExactly("NSW1", "VIC1");
    assertThat(response.getBody().get(0)).containsEntry("rrp", 81.0);
    assertThat(response.getHeaders().getFirst("X-Has-Next-Page")).isEqualTo("false");
  }

  @Test
  void emptyResultIsAnEmptyArray() {
    ResponseEntity<String> response = rest.getForEntity("/range?lastSec=60", String.class);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).isEqualTo("[]");
    assertThat(response.getHeaders().getFirst("X-Total-Count")).isEqualTo("0");
  }

  @Test
  void invalidParametersReturnErrorCode() {
    ResponseEntity<Map<String, Object>> response = rest.exchange("/range?lastSec=604801",
        HttpMethod.GET, null, new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody())
        .containsEntry("errorCode", 2002)
        .containsEntry("path", "/range")
        .containsEntry("moreInfo", "https://api.coststhismuch.au/docs/errors/2002");
  }

  @Test
  void rejectsWindowWiderThanALong() {
    insert(interval(T0, "NSW1", 80.0));

    ResponseEntity<Map<String, Object>> response = rest.exchange(
        "/range?start={s}&end={e}", HttpMethod.GET, null, new ParameterizedTypeReference<>() {},
        Long.MIN_VALUE, Long.MAX_VALUE);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    assertThat(response.getBody()).containsEntry("errorCode", 2005);
  }

  @Test
  void rendersCsvOnRequest() {
    insert(interval(T0, "NSW1", 80.0));

    ResponseEntity<String> byFormat = rest.getForEntity("/range?format=csv", String.class);
    HttpHeaders accept = new HttpHeaders();
    accept.setAccept(List.of(MediaType.valueOf("text/csv")));
    ResponseEntity<String> byAccept = rest.exchange("/range", HttpMethod.GET,
        new HttpEntity<>(accept), String.class);

    for (ResponseEntity<String> response : List.of(byFormat, byAccept)) {
      assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
      assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.valueOf("text/csv")))
          .isTrue();
      String[] lines = response.getBody().split("\n");
      assertThat(lines[0]).startsWith("settlement,settlement_ts,regionid,region,rrp");
      assertThat(lines[1]).startsWith("2024-05-01T02:00:00Z,1714528800000,NSW1,NSW,80.0");
    }
  }

  @Test
  void dataRequiresAccessToken() throws Exception {
    insert(interval(T0, "NSW1", 80.0));

    mockMvc.perform(get("/data"))
        .andExpect(status().isUnauthorized())
        .andExpect(header().string(HttpHeaders.WWW_AUTHENTICATE, startsWith("Bearer")));

    HttpHeaders headers = new HttpHeaders();
    headers.setBearerAuth(issueAccessToken());
    ResponseEntity<List<Map<String, Object>>> authorized = rest.exchange("/data?regionid=NSW1",
        HttpMethod.GET, new HttpEntity<>(headers), ROWS);

    assertThat(authorized.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(authorized.getBody()).singleElement()
        .satisfies(row -> assertThat(row).containsEntry("regionid", "NSW1"));
    assertThat(authorized.getHeaders().getFirst("X-Total-Count")).isEqualTo("1");
  }

  @Test
  void syncStoresNewIntervalsOnce() {
    MockRestServiceServer upstream = MockRestServiceServer.bindTo(upstreamRestTemplate).build();
    String report = """
        {"5MIN":[
          {"SETTLEMENTDATE":"2024-05-01T12:00:00","REGIONID":"NSW1","RRP":80.1},
          {"SETTLEMENTDATE":"2024-05-01T12:00:00","REGIONID":"TAS1","RRP":55.0}
        ]}
        """;
    upstream.expect(requestTo(UPSTREAM_URL))
        .andExpect(MockRestRequestMatchers.header("x-api-key", "test-key"))
        .andRespond(withSuccess(report, MediaType.APPLICATION_JSON));
    upstream.expect(requestTo(UPSTREAM_URL))
        .andRespond(withSuccess(report, MediaType.APPLICATION_JSON));

    ResponseEntity<String> first = rest.postForEntity("/sync", null, String.class);
    ResponseEntity<String> second = rest.postForEntity("/sync", null, String.class);

    upstream.verify();
    assertThat(first.getHeaders().getContentType().isCompatibleWith(MediaType.TEXT_PLAIN)).isTrue();
    assertThat(first.getBody())
        .isEqualTo("Sync completed. Received 2 intervals, inserted 2 new intervals.");
    assertThat(second.getBody())
        .isEqualTo("Sync completed. Received 2 intervals, inserted 0 new intervals.");
  }

  @Test
  void syncReportsUpstreamFailureAsServerError() {
    MockRestServiceServer upstream = MockRestServiceServer.bindTo(upstreamRestTemplate).build();
    upstream.expect(requestTo(UPSTREAM_URL)).andRespond(withServerError());

    ResponseEntity<Map<String, Object>> response = rest.exchange("/sync", HttpMethod.POST, null,
        new ParameterizedTypeReference<>() {});

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getHeaders().getContentType().isCompatibleWith(MediaType.APPLICATION_PROBLEM_JSON))
        .isTrue();
    assertThat(response.getBody()).containsEntry("status", 500).containsKey("detail");
  }

  @Test
  void insertThenReadRoundTrips() {
    ResponseEntity<List<Map<String, Object>>> response = rest.exchange("/testInsertThenRead",
        HttpMethod.POST, null, ROWS);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
    assertThat(response.getBody()).anySatisfy(row -> {
      assertThat(row).containsEntry("regionid", "TEST1").containsEntry("rrp", 42.0);
      assertThat(((Number) row.get("settlement_ts")).longValue() % FIVE_MIN).isZero();
    });
  }

  private String issueAccessToken() {
    ResponseEntity<Map<String, Object>> token = rest.exchange("/token", HttpMethod.POST,
        new HttpEntity<>(Map.of("client_id", CLIENT_ID)), new ParameterizedTypeReference<>() {});
    assertThat(token.getStatusCode()).isEqualTo(HttpStatus.OK);
    return (String) token.getBody().get("access_token");
  }
}
