package com.ospicorp.pricelogger.ratelimit;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.util.StringUtils;

/**
 * The tuple requests are counted against. Values are clipped to the tracking table's column
 * widths.
 */
public record ClientIdentity(String ip, String asn, String sessionId) {

  public ClientIdentity {
    ip = clip(ip, 128);
    asn = clip(asn, 128);
    sessionId = clip(sessionId, 256);
  }

  static final String UNKNOWN = "UNKNOWN";
  static final String NO_SESSION = "no-session";
  static final String SESSION_COOKIE = "sessionId";

  public static ClientIdentity from(HttpServletRequest request, String clientIpHeader) {
    return new ClientIdentity(clientIp(request, clientIpHeader), asn(request), session(request));
  }

  public static String clientIp(HttpServletRequest request, String clientIpHeader) {
    String direct = request.getHeader(clientIpHeader);
    if (StringUtils.hasText(direct)) {
      return direct.trim();
    }
    String forwardedHeader = request.getHeader("X-Forwarded-For");
    if (StringUtils.hasText(forwardedHeader)) {
      return forwardedHeader.split(",")[0].trim();
    }
    String remote = request.getRemoteAddr();
    return StringUtils.hasText(remote) ? remote : UNKNOWN;
  }

  private static String asn(HttpServletRequest request) {
    String isp = request.getHeader("CF-ISP");
    if (StringUtils.hasText(isp)) {
      return isp.trim();
    }
    String asn = request.getHeader("CF-ASN");
    return StringUtils.hasText(asn) ? asn.trim() : UNKNOWN;
  }

  private static String session(HttpServletRequest request) {
    Cookie[] cookies = request.getCookies();
    if (cookies != null) {
      for (Cookie cookie : cookies) {
        if (SESSION_COOKIE.equals(cookie.getName()) && StringUtils.hasText(cookie.getValue())) {
          return cookie.getValue();
        }
      }
    }
    return NO_SESSION;
  }

  private static String clip(String value, int max) {
    return value.length() <= max ? value : value.substring(0, max);
  }
}
