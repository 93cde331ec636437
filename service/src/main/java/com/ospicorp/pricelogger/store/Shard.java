package com.ospicorp.pricelogger.store;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * One independently addressed unit of durable storage.
 *
 * <p>A shard owns an embedded database and a single worker thread. Every unit of work runs on that
 * thread, so operations against one shard never overlap and no caller-side locking is needed.
 * Callers block until their work has completed. Work must not call back into the same shard.
 *
 * <p>The schema is migrated from {@code classpath:db/shards/<name>} the first time the shard is
 * used.
 */
public class Shard implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(Shard.class);
  private static final String MIGRATIONS_ROOT = "classpath:db/shards/";

  private final String name;
  private final String jdbcUrl;
  private final String username;
  private final String password;
  private final HikariDataSource dataSource;
  private final ShardSession session;
  private final TransactionTemplate transactions;
  private final ExecutorService worker;

  // only read and written on the worker thread
  private boolean migrated;

  public Shard(String name, String jdbcUrl, String username, String password) {
    this.name = name;
    this.jdbcUrl = jdbcUrl;
    this.username = username;
    this.password = password;
    HikariConfig config = new HikariConfig();
    config.setPoolName("shard-" + name);
    config.setJdbcUrl(jdbcUrl);
    config.setUsername(username);
    config.setPassword(password);
    // the worker thread is the only borrower; migrations connect on their own
    config.setMaximumPoolSize(1);
    this.dataSource = new HikariDataSource(config);
    JdbcTemplate jdbc = new JdbcTemplate(dataSource);
    this.session = new ShardSession(jdbc, new NamedParameterJdbcTemplate(jdbc));
    this.transactions = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
    this.worker = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, "shard-" + name);
      thread.setDaemon(true);
      return thread;
    });
    log.info("Opened shard {} at {}", name, jdbcUrl);
  }

  public String name() {
    return name;
  }

  public <T> T execute(ShardWork<T> work) {
    return submit(() -> work.run(session));
  }

  public <T> T executeInTransaction(ShardWork<T> work) {
    return submit(() -> transactions.execute(status -> work.run(session)));
  }

  private <T> T submit(Callable<T> task) {
    Future<T> future;
    try {
      future = worker.submit(() -> {
        ensureSchema();
        return task.call();
      });
    } catch (RejectedExecutionException ex) {
      throw new ShardException(name, "shard is closed", ex);
    }
    try {
      return future.get();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      future.cancel(true);
      throw new ShardException(name, "interrupted while waiting for shard", ex);
    } catch (ExecutionException ex) {
      throw translate(ex.getCause());
    }
  }

  private RuntimeException translate(Throwable cause) {
    if (cause instanceof ShardException shardException) {
      return shardException;
    }
    if (cause instanceof DataAccessException || !(cause instanceof RuntimeException)) {
      log.debug("Shard {} operation failed", name, cause);
      return new ShardException(name, cause.getMessage(), cause);
    }
    return (RuntimeException) cause;
  }

  private void ensureSchema() {
    if (migrated) {
      return;
    }
    String location = MIGRATIONS_ROOT + name;
    try {
      int applied = Flyway.configure()
          .dataSource(jdbcUrl, username, password)
          .locations(location)
          .load()
          .migrate()
          .migrationsExecuted;
      log.info("Shard {} schema ready ({} migrations applied from {})", name, applied, location);
    } catch (RuntimeException ex) {
      throw new ShardException(name, "schema migration failed", ex);
    }
    migrated = true;
  }

  @Override
  public void close() {
    if (worker.isShutdown()) {
      return;
    }
    worker.shutdown();
    try {
      if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
        log.warn("Shard {} did not drain in time, forcing shutdown", name);
        worker.shutdownNow();
      }
    } catch (InterruptedException ex) {
      worker.shutdownNow();
      Thread.currentThread().interrupt();
    }
    dataSource.close();
    log.info("Closed shard {}", name);
  }
}
