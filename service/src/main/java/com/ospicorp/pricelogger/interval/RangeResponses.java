package com.ospicorp.pricelogger.interval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MimeTypeUtils;
import org.springframework.util.StringUtils;

/**
 * Renders an {@link IntervalPage} as a JSON or CSV body plus the paging headers shared by the
 * range routes.
 */
final class RangeResponses {

  static final String TOTAL_COUNT = "X-Total-Count";
  static final String LIMIT = "X-Limit";
  static final String OFFSET = "X-Offset";
  static final String PAGE = "X-Page";
  static final String TOTAL_PAGES = "X-Total-Pages";
  static final String HAS_NEXT_PAGE = "X-Has-Next-Page";

  static final List<String> PAGING_HEADERS =
      List.of(TOTAL_COUNT, LIMIT, OFFSET, PAGE, TOTAL_PAGES, HAS_NEXT_PAGE);

  private RangeResponses() {
  }

  static ResponseEntity<List<IntervalView>> render(IntervalPage page, String format,
      String accept) {
    MediaType contentType = selectMediaType(format, accept);
    List<IntervalView> body = page.rows().stream().map(IntervalView::of).toList();
    return ResponseEntity.ok()
        .header(TOTAL_COUNT, Long.toString(page.totalCount()))
        .header(LIMIT, Integer.toString(page.limit()))
        .header(OFFSET, Long.toString(page.offset()))
        .header(PAGE, Long.toString(page.page()))
        .header(TOTAL_PAGES, Long.toString(page.totalPages()))
        .header(HAS_NEXT_PAGE, Boolean.toString(page.hasNextPage()))
        .header(HttpHeaders.VARY, HttpHeaders.ACCEPT)
        .contentType(contentType)
        .body(body);
  }

  static MediaType selectMediaType(String format, String accept) {
    if (StringUtils.hasText(format)) {
      if ("csv".equalsIgnoreCase(format)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
      if ("json".equalsIgnoreCase(format)) {
        return MediaType.APPLICATION_JSON;
      }
      throw new InvalidParameterException("Invalid format value. Supported values: json,csv.",
          2008);
    }
    if (!StringUtils.hasText(accept)) {
      return MediaType.APPLICATION_JSON;
    }
    List<MediaType> mediaTypes;
    try {
      mediaTypes = new ArrayList<>(MediaType.parseMediaTypes(accept));
    } catch (IllegalArgumentException ex) {
      return MediaType.APPLICATION_JSON;
    }
    mediaTypes.sort(Comparator.comparingDouble(MediaType::getQualityValue).reversed());
    MimeTypeUtils.sortBySpecificity(mediaTypes);
    for (MediaType mediaType : mediaTypes) {
      if (mediaType.isCompatibleWith(MediaType.APPLICATION_JSON)) {
        return MediaType.APPLICATION_JSON;
      }
      if (mediaType.isCompatibleWith(CsvHttpMessageConverter.TEXT_CSV)) {
        return CsvHttpMessageConverter.TEXT_CSV;
      }
    }
    return MediaType.APPLICATION_JSON;
  }
}
