/*-
 * =================================LICENSE_START==================================
 * tether-jetty
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
package io.aleph0.tether.jetty;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.net.URI;
import java.nio.ByteBuffer;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.eclipse.jetty.client.HttpClient;
import org.eclipse.jetty.websocket.api.Callback;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.StatusCode;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketOpen;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.eclipse.jetty.websocket.client.ClientUpgradeRequest;
import org.eclipse.jetty.websocket.client.WebSocketClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.tether.core.Measureable;
import io.aleph0.tether.core.transport.Frame;
import io.aleph0.tether.core.transport.Transport;
import io.aleph0.tether.core.transport.TransportListener;
import io.aleph0.tether.core.transport.TransportOptions;
import io.aleph0.tether.core.transport.TransportSession;

/**
 * A {@link Transport} over a Jetty 12 {@link WebSocketClient}.
 * 
 * <p>
 * One client, and its inner {@link HttpClient}, is shared by every session this transport opens.
 * The client is started on the first {@link #open(URI, TransportOptions, TransportListener) open}
 * and stopped by {@link #close()}. The {@link Configurator} may adjust the HTTP client, the
 * WebSocket client, each upgrade request, and each session.
 * 
 * <p>
 * Subprotocols and custom headers from the {@link TransportOptions} are set on the upgrade
 * request before the configurator sees it.
 */
public class JettyTransport implements Transport, Measureable<JettyTransport.Metrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(JettyTransport.class);

  public static record Metrics(long opened, long framesSent, long framesReceived) {
    public Metrics {
      if (opened < 0)
        throw new IllegalArgumentException("opened must be at least zero");
      if (framesSent < 0)
        throw new IllegalArgumentException("framesSent must be at least zero");
      if (framesReceived < 0)
        throw new IllegalArgumentException("framesReceived must be at least zero");
    }
  }

  public static interface Configurator {
    default void configureHttpClient(HttpClient client) {}

    default void configureWebSocketClient(WebSocketClient client) {}

    default void configureClientUpgradeRequest(ClientUpgradeRequest request) {}

    default void configureSession(Session session) {}
  }

  public static Configurator defaultConfigurator() {
    return new Configurator() {};
  }

  private final AtomicLong openedMetric = new AtomicLong(0);
  private final AtomicLong framesSentMetric = new AtomicLong(0);
  private final AtomicLong framesReceivedMetric = new AtomicLong(0);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final Configurator configurator;
  private final WebSocketClient websocket;
  private boolean started = false;

  public JettyTransport() {
    this(defaultConfigurator());
  }

  public JettyTransport(Configurator configurator) {
    this.configurator = requireNonNull(configurator, "configurator");

    // Create the inner HTTP client ourselves so the configurator can reach it. The WebSocketClient
    // would otherwise create its own, with no way to configure it.
    final HttpClient http = new HttpClient();
    configurator.configureHttpClient(http);

    // Sane defaults for the key timeouts. The configurator may override them.
    this.websocket = new WebSocketClient(http);
    this.websocket.setStopTimeout(5000);
    this.websocket.setIdleTimeout(Duration.ofSeconds(30));
    configurator.configureWebSocketClient(websocket);
  }

  private synchronized void ensureStarted() throws IOException {
    if (closed.get())
      throw new IOException("transport closed");
    if (started)
      return;
    try {
      websocket.start();
    } catch (Exception e) {
      LOGGER.atError().setCause(e).log("Failed to start WebSocket client");
      throw new IOException("Failed to start WebSocket client", e);
    }
    started = true;
  }

  @Override
  public CompletableFuture<TransportSession> open(URI uri, TransportOptions options,
      TransportListener listener) {
    requireNonNull(uri, "uri");
    requireNonNull(options, "options");
    requireNonNull(listener, "listener");

    try {
      ensureStarted();

      final ClientUpgradeRequest request = new ClientUpgradeRequest();
      if (!options.protocols().isEmpty())
        request.setSubProtocols(options.protocols());
      for (Map.Entry<String, String> header : options.headers().entrySet())
        request.setHeader(header.getKey(), header.getValue());
      configurator.configureClientUpgradeRequest(request);

      final InternalSocketListener socket = new InternalSocketListener(listener);

      LOGGER.atDebug().addKeyValue("uri", uri).log("Opening WebSocket");

      return websocket.connect(socket, uri, request).thenApply(session -> {
        openedMetric.incrementAndGet();
        return new JettySession(session);
      });
    } catch (IOException e) {
      return CompletableFuture.failedFuture(e);
    }
  }

  /**
   * Stops the shared client. Sessions still open are closed abruptly.
   */
  @Override
  public void close() {
    if (closed.getAndSet(true) == false) {
      synchronized (this) {
        if (!started)
          return;
        try {
          websocket.stop();
        } catch (Exception e) {
          LOGGER.atError().setCause(e).log("Failed to stop WebSocket client");
        }
      }
    }
  }

  private class JettySession implements TransportSession {
    private final Session session;

    public JettySession(Session session) {
      this.session = requireNonNull(session, "session");
    }

    @Override
    public CompletableFuture<Void> send(Frame frame) {
      requireNonNull(frame, "frame");
      if (!session.isOpen())
        return CompletableFuture.failedFuture(new IOException("WebSocket session closed"));

      final CompletableFuture<Void> result = new CompletableFuture<>();
      final Callback callback = new Callback() {
        @Override
        public void succeed() {
          framesSentMetric.incrementAndGet();
          result.complete(null);
        }

        @Override
        public void fail(Throwable x) {
          result.completeExceptionally(x);
        }
      };

      if (frame instanceof Frame.Text text)
        session.sendText(text.text(), callback);
      else if (frame instanceof Frame.Binary binary)
        session.sendBinary(ByteBuffer.wrap(binary.bytes()), callback);
      else
        throw new AssertionError("unknown frame " + frame.getClass());

      return result;
    }

    @Override
    public CompletableFuture<Void> close() {
      final CompletableFuture<Void> result = new CompletableFuture<>();
      if (!session.isOpen()) {
        result.complete(null);
        return result;
      }
      session.close(StatusCode.NORMAL, "Goodbye", new Callback() {
        @Override
        public void succeed() {
          result.complete(null);
        }

        @Override
        public void fail(Throwable x) {
          result.completeExceptionally(x);
        }
      });
      return result;
    }

    @Override
    public boolean isOpen() {
      return session.isOpen();
    }
  }

  /**
   * This class has to be public so Jetty can see it. It is not intended to be used outside of this
   * package.
   * 
   * <p>
   * We let Jetty manage all the complexity of demand, hence the {@code autoDemand = true}.
   */
  @WebSocket(autoDemand = true)
  public class InternalSocketListener {
    private final TransportListener listener;

    public InternalSocketListener(TransportListener listener) {
      this.listener = requireNonNull(listener, "listener");
    }

    @OnWebSocketOpen
    public void onWebSocketOpen(Session session) {
      LOGGER.atInfo().log("WebSocket connected");
      configurator.configureSession(session);
    }

    @OnWebSocketMessage
    public void onWebSocketText(Session session, String text) {
      framesReceivedMetric.incrementAndGet();
      listener.onFrame(Frame.text(text));
    }

    @OnWebSocketMessage
    public void onWebSocketBinary(Session session, ByteBuffer payload, Callback callback) {
      final byte[] bytes = new byte[payload.remaining()];
      payload.get(bytes);
      framesReceivedMetric.incrementAndGet();
      listener.onFrame(Frame.binary(bytes));
      callback.succeed();
    }

    @OnWebSocketError
    public void onWebSocketError(Session session, Throwable cause) {
      LOGGER.atWarn().setCause(cause).log("WebSocket error");
      listener.onError(cause);
    }

    @OnWebSocketClose
    public void onWebSocketClose(Session session, int statusCode, String reason) {
      // Jetty has already answered the close frame; just report it.
      LOGGER.atInfo().addKeyValue("statusCode", statusCode).addKeyValue("reason", reason)
          .log("WebSocket closed");
      listener.onClosed(statusCode, reason);
    }
  }

  @Override
  public Metrics checkMetrics() {
    return new Metrics(openedMetric.get(), framesSentMetric.get(), framesReceivedMetric.get());
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics result = checkMetrics();
    openedMetric.set(0);
    framesSentMetric.set(0);
    framesReceivedMetric.set(0);
    return result;
  }
}
