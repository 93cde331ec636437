package com.ospicorp.pricelogger.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;

/**
 * Client ids allowed to request tokens.
 */
public final class ClientAllowList {

  private final Set<String> clientIds;

  public ClientAllowList(Set<String> clientIds) {
    this.clientIds = Set.copyOf(clientIds);
  }

  public boolean allows(String clientId) {
    return clientId != null && clientIds.contains(clientId);
  }

  public int size() {
    return clientIds.size();
  }

  /**
   * A value starting with {@code [} is read as a JSON array of ids; anything else is one id.
   */
  public static ClientAllowList parse(String raw, ObjectMapper mapper) {
    String value = raw == null ? "" : raw.trim();
    if (value.isEmpty()) {
      return new ClientAllowList(Set.of());
    }
    if (!value.startsWith("[")) {
      return new ClientAllowList(Set.of(value));
    }
    try {
      List<String> ids = mapper.readValue(value, new TypeReference<List<String>>() {});
      return new ClientAllowList(Set.copyOf(ids.stream().filter(id -> id != null).toList()));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("Client ids must be a JSON array of strings", ex);
    }
  }
}
