package com.ospicorp.pricelogger.config;

import com.ospicorp.pricelogger.ingest.IngestionProperties;
import com.ospicorp.pricelogger.interval.CsvHttpMessageConverter;
import java.time.Clock;
import java.util.List;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(new CsvHttpMessageConverter());
  }

  @Bean
  RestTemplate upstreamRestTemplate(RestTemplateBuilder builder, IngestionProperties properties) {
    return builder
        .setConnectTimeout(properties.connectTimeout())
        .setReadTimeout(properties.readTimeout())
        .build();
  }

  @Bean
  Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  ShallowEtagHeaderFilter shallowEtagHeaderFilter() {
    return new ShallowEtagHeaderFilter();
  }
}
