package com.ospicorp.pricelogger.web;

import io.swagger.v3.oas.annotations.Hidden;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probes for the load balancer. Readiness, including shard health, is on the actuator.
 */
@Hidden
@RestController
public class RootController {

  private static final Map<String, Object> SERVICE = Map.of(
      "service", "aemo-price-logger",
      "status", "ok");

  @GetMapping("/")
  public Map<String, Object> service() {
    return SERVICE;
  }

  @GetMapping("/ping")
  public Map<String, Boolean> ping() {
    return Map.of("pong", Boolean.TRUE);
  }
}
