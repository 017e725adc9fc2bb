package dev.clubhub.bot.module.music.player;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Single-threaded command queue owned by one session. Everything that reads or mutates the
 * session's queue and state runs here, in submission order.
 */
@Slf4j
public class SessionMailbox implements Executor {

  private final String name;
  private final ExecutorService executor;

  public SessionMailbox(String name) {
    this(name, Duration.ofSeconds(60));
  }

  /** The worker thread exits after {@code idleTimeout} without work and is recreated on demand. */
  public SessionMailbox(String name, Duration idleTimeout) {
    this.name = name;
    ThreadPoolExecutor pool =
        new ThreadPoolExecutor(
            1,
            1,
            idleTimeout.toMillis(),
            TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(),
            r -> {
              Thread thread = new Thread(r, name);
              thread.setDaemon(true);
              return thread;
            });
    pool.allowCoreThreadTimeOut(true);
    this.executor = pool;
  }

  int liveThreads() {
    return ((ThreadPoolExecutor) executor).getPoolSize();
  }

  /** Fire-and-forget; failures are logged. */
  @Override
  public void execute(Runnable task) {
    executor.execute(
        () -> {
          try {
            task.run();
          } catch (RuntimeException e) {
            log.error("Unhandled error in {}", name, e);
          }
        });
  }

  public <T> CompletableFuture<T> call(Supplier<T> action) {
    return CompletableFuture.supplyAsync(action, executor);
  }

  /** Runs {@code action} in the mailbox and follows the future it starts. */
  public <T> CompletableFuture<T> compose(Supplier<CompletableFuture<T>> action) {
    return call(action).thenCompose(Function.identity());
  }

  public void shutdown() {
    executor.shutdownNow();
  }
}
