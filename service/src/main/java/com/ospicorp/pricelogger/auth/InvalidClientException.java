package com.ospicorp.pricelogger.auth;

import org.springframework.security.core.AuthenticationException;

public class InvalidClientException extends AuthenticationException {

  public InvalidClientException() {
    super("Invalid client_id");
  }
}
