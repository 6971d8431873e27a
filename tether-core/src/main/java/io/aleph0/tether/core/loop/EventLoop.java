/*-
 * =================================LICENSE_START==================================
 * tether-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.tether.core.loop;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * A single-threaded, timer-capable executor. Every piece of mutable state belonging to a
 * connection and its manager is confined to one event loop, so no locks are needed, and tasks run
 * in the order they were submitted.
 * 
 * <p>
 * Tasks submitted after the loop has been closed are dropped with a debug log line rather than
 * rejected, because late transport callbacks racing with shutdown are expected.
 */
public class EventLoop implements Executor, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(EventLoop.class);

  private static final AtomicInteger sequence = new AtomicInteger(1);

  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

  public static EventLoop create() {
    return create("tether-loop-" + sequence.getAndIncrement());
  }

  public static EventLoop create(String name) {
    requireNonNull(name, "name");
    final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1,
        new ThreadFactoryBuilder().setNameFormat(name).setDaemon(true).build());
    executor.setRemoveOnCancelPolicy(true);
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    return new EventLoop(name, executor);
  }

  private final String name;
  private final ScheduledExecutorService executor;
  private final Set<DefaultTimer> timers = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile Thread thread;

  EventLoop(String name, ScheduledExecutorService executor) {
    this.name = requireNonNull(name, "name");
    this.executor = requireNonNull(executor, "executor");
  }

  private class DefaultTimer implements Timer {
    private final boolean periodic;
    private volatile ScheduledFuture<?> future;
    private final AtomicBoolean done = new AtomicBoolean(false);

    public DefaultTimer(boolean periodic) {
      this.periodic = periodic;
    }

    private void fire(Runnable task) {
      if (done.get())
        return;
      if (!periodic)
        finish();
      run(task);
    }

    private void finish() {
      done.set(true);
      timers.remove(this);
    }

    @Override
    public boolean isPending() {
      return !done.get();
    }

    @Override
    public void cancel() {
      if (done.getAndSet(true) == false) {
        timers.remove(this);
        final ScheduledFuture<?> f = future;
        if (f != null)
          f.cancel(false);
      }
    }
  }

  public String getName() {
    return name;
  }

  /**
   * @return true if the calling thread is this loop's thread
   */
  public boolean inEventLoop() {
    return Thread.currentThread() == thread;
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void execute(Runnable task) {
    requireNonNull(task, "task");
    try {
      executor.execute(() -> run(task));
    } catch (RejectedExecutionException e) {
      LOGGER.atDebug().addKeyValue("loop", name).log("Event loop closed, dropping task");
    }
  }

  /**
   * Runs the given asynchronous operation on this loop and returns its result. If the caller is
   * already on the loop, the operation starts immediately.
   */
  public <T> CompletableFuture<T> submit(Supplier<CompletableFuture<T>> operation) {
    requireNonNull(operation, "operation");
    if (inEventLoop())
      return invoke(operation);
    final CompletableFuture<T> result = new CompletableFuture<>();
    try {
      executor.execute(() -> run(() -> invoke(operation).whenComplete((value, cause) -> {
        if (cause != null)
          result.completeExceptionally(cause);
        else
          result.complete(value);
      })));
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(new IllegalStateException("event loop " + name + " closed"));
    }
    return result;
  }

  /**
   * Computes a value on this loop.
   */
  public <T> CompletableFuture<T> call(Supplier<T> computation) {
    requireNonNull(computation, "computation");
    return submit(() -> CompletableFuture.completedFuture(computation.get()));
  }

  public Timer schedule(Duration delay, Runnable task) {
    requireNonNull(delay, "delay");
    requireNonNull(task, "task");
    final DefaultTimer timer = new DefaultTimer(false);
    timers.add(timer);
    try {
      timer.future = executor.schedule(() -> timer.fire(task), Math.max(0L, delay.toNanos()),
          TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.atDebug().addKeyValue("loop", name).log("Event loop closed, dropping timer");
      timer.finish();
    }
    return timer;
  }

  public Timer scheduleAtFixedRate(Duration initialDelay, Duration period, Runnable task) {
    requireNonNull(initialDelay, "initialDelay");
    requireNonNull(period, "period");
    requireNonNull(task, "task");
    if (period.isZero() || period.isNegative())
      throw new IllegalArgumentException("period must be positive");
    final DefaultTimer timer = new DefaultTimer(true);
    timers.add(timer);
    try {
      timer.future = executor.scheduleAtFixedRate(() -> timer.fire(task),
          Math.max(0L, initialDelay.toNanos()), period.toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      LOGGER.atDebug().addKeyValue("loop", name).log("Event loop closed, dropping timer");
      timer.finish();
    }
    return timer;
  }

  /**
   * @return the number of timers that have neither fired nor been cancelled
   */
  public int pendingTimers() {
    return timers.size();
  }

  private <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> operation) {
    try {
      return requireNonNull(operation.get(), "operation result");
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  private void run(Runnable task) {
    if (thread == null)
      thread = Thread.currentThread();
    try {
      task.run();
    } catch (RuntimeException e) {
      LOGGER.atError().addKeyValue("loop", name).setCause(e).log("Event loop task failed");
    }
  }

  /**
   * Cancels every pending timer and stops the loop, waiting up to
   * {@link #DEFAULT_SHUTDOWN_TIMEOUT} for running tasks to finish. Called from the loop itself, it
   * stops the loop without waiting.
   */
  @Override
  public void close() {
    if (closed.getAndSet(true) == false) {
      for (DefaultTimer timer : timers)
        timer.cancel();
      if (inEventLoop()) {
        executor.shutdown();
      } else if (!MoreExecutors.shutdownAndAwaitTermination(executor, DEFAULT_SHUTDOWN_TIMEOUT)) {
        LOGGER.atWarn().addKeyValue("loop", name).log("Event loop did not terminate in time");
      }
    }
  }
}
