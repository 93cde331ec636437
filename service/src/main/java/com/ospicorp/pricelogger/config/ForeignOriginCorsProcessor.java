package com.ospicorp.pricelogger.config;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.springframework.http.HttpHeaders;
import org.springframework.lang.Nullable;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.cors.DefaultCorsProcessor;

/**
 * Serves simple requests from origins outside the allow list without any CORS headers, leaving
 * the browser to withhold the response. Preflights from such origins are still refused.
 */
class ForeignOriginCorsProcessor extends DefaultCorsProcessor {

  @Override
  public boolean processRequest(@Nullable CorsConfiguration config, HttpServletRequest request,
      HttpServletResponse response) throws IOException {
    if (config != null && CorsUtils.isCorsRequest(request)
        && !CorsUtils.isPreFlightRequest(request)
        && config.checkOrigin(request.getHeader(HttpHeaders.ORIGIN)) == null) {
      return true;
    }
    return super.processRequest(config, request, response);
  }
}
