package com.ospicorp.pricelogger.ratelimit;

import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.ospicorp.pricelogger.support.IntegrationTestSupport;
import jakarta.servlet.http.Cookie;
import java.util.UUID;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@TestPropertySource(properties = "aemo.rate-limit.max=3")
class RateLimitHttpTest extends IntegrationTestSupport {

  @Autowired
  private MockMvc mockMvc;

  @Test
  void fourthRequestInWindowIsRejected() throws Exception {
    String ip = uniqueIp();
    for (int i = 0; i < 3; i++) {
      mockMvc.perform(fromIp(get("/range"), ip)).andExpect(status().isOk());
      nextMillisecond();
    }

    mockMvc.perform(fromIp(get("/range"), ip))
        .andExpect(status().isTooManyRequests())
        .andExpect(header().string(HttpHeaders.RETRY_AFTER, "60"))
        .andExpect(header().string(HttpHeaders.CONTENT_TYPE,
            startsWith(MediaType.APPLICATION_PROBLEM_JSON_VALUE)))
        .andExpect(jsonPath("$.status").value(429))
        .andExpect(jsonPath("$.type").value("https://api.coststhismuch.au/problems/rate-limit"));

    // other identities are counted separately
    mockMvc.perform(fromIp(get("/range"), uniqueIp())).andExpect(status().isOk());
  }

  @Test
  void preflightRequestsAreNotCounted() throws Exception {
    String ip = uniqueIp();
    for (int i = 0; i < 5; i++) {
      mockMvc.perform(fromIp(options("/range"), ip)
              .header(HttpHeaders.ORIGIN, ALLOWED_ORIGIN)
              .header(HttpHeaders.ACCESS_CONTROL_REQUEST_METHOD, "GET"))
          .andExpect(status().isOk());
    }

    mockMvc.perform(fromIp(get("/range"), ip)).andExpect(status().isOk());
  }

  @Test
  void sessionsAreCountedSeparately() throws Exception {
    String ip = uniqueIp();
    for (int i = 0; i < 3; i++) {
      mockMvc.perform(fromIp(get("/ping"), ip)).andExpect(status().isOk());
      nextMillisecond();
    }

    mockMvc.perform(fromIp(get("/ping"), ip)
            .cookie(new Cookie("sessionId", "s-1")))
        .andExpect(status().isOk());
    mockMvc.perform(fromIp(get("/ping"), ip)).andExpect(status().isTooManyRequests());
  }

  private static MockHttpServletRequestBuilder fromIp(MockHttpServletRequestBuilder request,
      String ip) {
    return request.header("CF-Connecting-IP", ip);
  }

  // requests are recorded at millisecond resolution, one row per identity and instant
  private static void nextMillisecond() throws InterruptedException {
    Thread.sleep(2);
  }

  private static String uniqueIp() {
    return "203.0.113." + UUID.randomUUID();
  }
}
