package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

public record TokenRequest(
    @JsonProperty("client_id") @Schema(description = "Registered client id") String clientId) {
}
