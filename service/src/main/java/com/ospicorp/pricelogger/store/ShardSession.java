package com.ospicorp.pricelogger.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * SQL access handed to {@link ShardWork}. Only valid on the shard's worker thread.
 */
public record ShardSession(JdbcTemplate jdbc, NamedParameterJdbcTemplate named) {}
