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
package io.aleph0.tether.core.transport.simulated;

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.tether.core.transport.Frame;
import io.aleph0.tether.core.transport.Transport;
import io.aleph0.tether.core.transport.TransportListener;
import io.aleph0.tether.core.transport.TransportOptions;
import io.aleph0.tether.core.transport.TransportSession;

/**
 * An in-memory {@link Transport} whose behavior is scripted by the caller. Useful for testing
 * reconnection and queuing without a network, and for developing against an endpoint that does
 * not exist yet.
 * 
 * <p>
 * Each call to {@link #open(URI, TransportOptions, TransportListener) open} consumes the next
 * scripted {@link OpenBehavior}, or uses the default behavior when the script is empty. Opens
 * complete after the delay chosen by the {@link Scheduler}. Sessions record every frame sent to
 * them, and the caller can inject inbound frames, remote closes, and errors.
 */
public class SimulatedTransport implements Transport {
  private static final Logger LOGGER = LoggerFactory.getLogger(SimulatedTransport.class);

  public static final int NORMAL_CLOSE = 1000;

  public static final int ABNORMAL_CLOSE = 1006;

  public static enum OpenBehavior {
    /**
     * The open succeeds
     */
    SUCCEED,

    /**
     * The open fails with a {@link ConnectException}
     */
    FAIL,

    /**
     * The open never completes
     */
    HANG;
  }

  private final Scheduler scheduler;
  private final Queue<OpenBehavior> script = new ConcurrentLinkedQueue<>();
  private final List<SimulatedSession> sessions = new CopyOnWriteArrayList<>();
  private final AtomicInteger openAttempts = new AtomicInteger(0);
  private volatile OpenBehavior defaultBehavior = OpenBehavior.SUCCEED;
  private volatile boolean failSends = false;
  private volatile boolean holdSends = false;
  private volatile boolean autoPong = false;
  private volatile boolean headersSupported = true;

  public SimulatedTransport() {
    this(Scheduler.immediate());
  }

  public SimulatedTransport(Scheduler scheduler) {
    this.scheduler = requireNonNull(scheduler, "scheduler");
  }

  public SimulatedTransport setDefaultOpenBehavior(OpenBehavior behavior) {
    this.defaultBehavior = requireNonNull(behavior, "behavior");
    return this;
  }

  /**
   * Appends behaviors for the next opens, in order. Once they are consumed, the default behavior
   * applies again.
   */
  public SimulatedTransport script(OpenBehavior... behaviors) {
    for (OpenBehavior behavior : behaviors)
      script.add(requireNonNull(behavior, "behavior"));
    return this;
  }

  /**
   * When set, every send on every session fails with an {@link IOException}.
   */
  public SimulatedTransport setFailSends(boolean failSends) {
    this.failSends = failSends;
    return this;
  }

  /**
   * When set, sends on every session are accepted but never complete, like a stalled socket.
   * Held frames are not recorded as sent.
   */
  public SimulatedTransport setHoldSends(boolean holdSends) {
    this.holdSends = holdSends;
    return this;
  }

  /**
   * When set, sessions answer a {@code "ping"} text frame with a {@code "pong"} text frame.
   */
  public SimulatedTransport setAutoPong(boolean autoPong) {
    this.autoPong = autoPong;
    return this;
  }

  public SimulatedTransport setHeadersSupported(boolean headersSupported) {
    this.headersSupported = headersSupported;
    return this;
  }

  @Override
  public boolean supportsHeaders() {
    return headersSupported;
  }

  public int getOpenAttempts() {
    return openAttempts.get();
  }

  public List<SimulatedSession> getSessions() {
    return unmodifiableList(new ArrayList<>(sessions));
  }

  /**
   * @return the most recently opened session, or {@code null} if none has opened
   */
  public SimulatedSession getLastSession() {
    final List<SimulatedSession> snapshot = getSessions();
    return snapshot.isEmpty() ? null : snapshot.get(snapshot.size() - 1);
  }

  @Override
  public CompletableFuture<TransportSession> open(URI uri, TransportOptions options,
      TransportListener listener) {
    requireNonNull(uri, "uri");
    requireNonNull(options, "options");
    requireNonNull(listener, "listener");

    final int attempt = openAttempts.incrementAndGet();
    final OpenBehavior next = script.poll();
    final OpenBehavior behavior = next != null ? next : defaultBehavior;

    LOGGER.atDebug().addKeyValue("uri", uri).addKeyValue("attempt", attempt)
        .addKeyValue("behavior", behavior).log("Simulated open");

    final CompletableFuture<TransportSession> result = new CompletableFuture<>();
    if (behavior == OpenBehavior.HANG)
      return result;

    final Duration delay = scheduler.schedule();
    final Executor executor =
        CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS);
    executor.execute(() -> {
      if (behavior == OpenBehavior.FAIL) {
        result.completeExceptionally(new ConnectException("simulated open failure " + attempt));
      } else {
        final SimulatedSession session = new SimulatedSession(uri, options, listener);
        sessions.add(session);
        result.complete(session);
      }
    });

    return result;
  }

  public class SimulatedSession implements TransportSession {
    private final URI uri;
    private final TransportOptions options;
    private final TransportListener listener;
    private final List<Frame> sent = new CopyOnWriteArrayList<>();
    private final List<Frame> held = new CopyOnWriteArrayList<>();
    private final AtomicBoolean open = new AtomicBoolean(true);

    private SimulatedSession(URI uri, TransportOptions options, TransportListener listener) {
      this.uri = uri;
      this.options = options;
      this.listener = listener;
    }

    public URI getUri() {
      return uri;
    }

    public TransportOptions getOptions() {
      return options;
    }

    /**
     * @return every frame successfully sent on this session, in order
     */
    public List<Frame> getSentFrames() {
      return unmodifiableList(new ArrayList<>(sent));
    }

    /**
     * @return every frame accepted while sends were held, in order
     */
    public List<Frame> getHeldFrames() {
      return unmodifiableList(new ArrayList<>(held));
    }

    @Override
    public boolean isOpen() {
      return open.get();
    }

    @Override
    public CompletableFuture<Void> send(Frame frame) {
      requireNonNull(frame, "frame");
      if (!open.get())
        return CompletableFuture.failedFuture(new IOException("session closed"));
      if (failSends)
        return CompletableFuture.failedFuture(new IOException("simulated send failure"));
      if (holdSends) {
        held.add(frame);
        return new CompletableFuture<>();
      }
      sent.add(frame);
      if (autoPong && frame instanceof Frame.Text text && text.text().equals("ping"))
        CompletableFuture.runAsync(() -> deliver(Frame.text("pong")));
      return CompletableFuture.completedFuture(null);
    }

    @Override
    public CompletableFuture<Void> close() {
      if (open.getAndSet(false) == true)
        listener.onClosed(NORMAL_CLOSE, "closed");
      return CompletableFuture.completedFuture(null);
    }

    /**
     * Delivers an inbound frame, as if the peer had sent it.
     */
    public void deliver(Frame frame) {
      requireNonNull(frame, "frame");
      if (open.get())
        listener.onFrame(frame);
    }

    /**
     * Closes the session from the peer's side.
     */
    public void closeRemotely(int statusCode, String reason) {
      if (open.getAndSet(false) == true)
        listener.onClosed(statusCode, reason);
    }

    /**
     * Breaks the session with the given error.
     */
    public void fail(Throwable cause) {
      requireNonNull(cause, "cause");
      if (open.getAndSet(false) == true)
        listener.onError(cause);
    }
  }
}
