package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One entry of the signing key configuration. Key material is PEM, either raw or base64-wrapped;
 * {@code start} and {@code expire} are unix seconds.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SigningKeyDefinition(
    String id,
    @JsonProperty("private") String privateKey,
    @JsonProperty("public") String publicKey,
    long start,
    long expire,
    boolean revoked) {
}
