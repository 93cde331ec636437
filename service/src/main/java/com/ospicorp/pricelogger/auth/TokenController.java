package com.ospicorp.pricelogger.auth;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@Tag(name = "Auth")
public class TokenController {

  private final TokenService tokens;

  public TokenController(TokenService tokens) {
    this.tokens = tokens;
  }

  @PostMapping(value = "/token", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Issue tokens",
      description = "Exchanges an allowed client id for an access token and a refresh token.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Tokens issued",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TokenResponse.class))),
      @ApiResponse(responseCode = "401", description = "Unknown client id",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public TokenResponse token(@RequestBody TokenRequest request) {
    return tokens.issue(request.clientId());
  }

  @PostMapping(value = "/refresh", consumes = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Refresh access token",
      description = "Exchanges a valid refresh token for a new access token.")
  @ApiResponses({
      @ApiResponse(responseCode = "200", description = "Access token issued",
          content = @Content(mediaType = "application/json",
              schema = @Schema(implementation = TokenResponse.class))),
      @ApiResponse(responseCode = "400", description = "No refresh token supplied",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class))),
      @ApiResponse(responseCode = "401", description = "Invalid or expired refresh token",
          content = @Content(mediaType = "application/problem+json",
              schema = @Schema(implementation = org.springframework.http.ProblemDetail.class)))
  })
  public TokenResponse refresh(@RequestBody RefreshRequest request) {
    if (!StringUtils.hasText(request.refreshToken())) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Missing refresh token");
    }
    return tokens.refresh(request.refreshToken());
  }
}
