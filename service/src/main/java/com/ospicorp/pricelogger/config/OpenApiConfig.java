package com.ospicorp.pricelogger.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.ExternalDocumentation;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

  @Bean
  OpenAPI apiInfo() {
    return new OpenAPI()
        .info(new Info()
            .title("AEMO Price Logger API")
            .version("v1")
            .description("Five-minute NEM price intervals: ingestion, range queries and tokens")
            .contact(new Contact().name("Costs This Much").email("api@coststhismuch.au")))
        .servers(List.of(new Server().url("/")))
        .components(new Components().addSecuritySchemes("bearerAuth", new SecurityScheme()
            .type(SecurityScheme.Type.HTTP)
            .scheme("bearer")
            .bearerFormat("JWT")))
        .externalDocs(new ExternalDocumentation()
            .description("Error codes")
            .url("https://api.coststhismuch.au/docs/errors/"));
  }
}
