package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Token endpoint body. {@code refresh_token} is only present on {@code /token}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
    @JsonProperty("token_type") @Schema(example = "Bearer") String tokenType,
    @JsonProperty("access_token") String accessToken,
    @JsonProperty("expires_in") @Schema(description = "Access token lifetime in seconds",
        example = "900") long expiresIn,
    @JsonProperty("refresh_token") String refreshToken) {

  static final String BEARER = "Bearer";
}
