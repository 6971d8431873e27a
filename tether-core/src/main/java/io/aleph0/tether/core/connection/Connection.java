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
package io.aleph0.tether.core.connection;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.aleph0.tether.core.Config;
import io.aleph0.tether.core.ConnectionFailedException;
import io.aleph0.tether.core.ConnectionState;
import io.aleph0.tether.core.Measureable;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.MessageKind;
import io.aleph0.tether.core.MessageSendFailedException;
import io.aleph0.tether.core.NotConnectedException;
import io.aleph0.tether.core.OperationTimeoutException;
import io.aleph0.tether.core.Payload;
import io.aleph0.tether.core.codec.Json;
import io.aleph0.tether.core.event.DefaultTopic;
import io.aleph0.tether.core.event.Subscribable;
import io.aleph0.tether.core.loop.EventLoop;
import io.aleph0.tether.core.loop.Timer;
import io.aleph0.tether.core.transport.Frame;
import io.aleph0.tether.core.transport.Transport;
import io.aleph0.tether.core.transport.TransportListener;
import io.aleph0.tether.core.transport.TransportOptions;
import io.aleph0.tether.core.transport.TransportSession;

/**
 * One logical connection to a remote endpoint over a single {@link TransportSession}.
 *
 * <p>
 * The connection owns its {@link ConnectionState state}, a connection-timeout timer, and an
 * optional ping heartbeat. It publishes state changes, inbound messages, and
 * {@link ConnectionEvent events} on three independent topics.
 *
 * <p>
 * All mutable state is confined to the given {@link EventLoop}. Public methods may be called from
 * any thread; they hop onto the loop and report their outcome through a
 * {@link CompletableFuture}. Transport callbacks are re-dispatched onto the loop and dropped if
 * they belong to a session this connection no longer owns.
 *
 * <p>
 * A connection does not reconnect by itself. Once it has {@link ConnectionState#FAILED failed} or
 * {@link ConnectionState#CLOSED closed}, it stays there until {@link #connect()} is called again.
 */
public class Connection implements Measureable<Connection.Metrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(Connection.class);

  public static final String HEARTBEAT_TIMEOUT = "Heartbeat timeout - no pong received";

  public static record Metrics(
      /**
       * The state of the connection when the snapshot was taken
       */
      ConnectionState state,

      /**
       * Messages sent successfully, including pings and pongs
       */
      long messagesSent,

      /**
       * Non-control messages received
       */
      long messagesReceived,

      /**
       * Transport errors, send failures, and heartbeat timeouts
       */
      long errors,

      long pingsSent,

      long pongsReceived,

      /**
       * When the current session opened, or null if not connected
       */
      Instant connectedAt,

      /**
       * How long the current session has been open, or null if not connected
       */
      Duration connectionDuration,

      /**
       * When a message was last sent or received, or null
       */
      Instant lastMessageAt,

      Instant lastPingAt,

      Instant lastPongAt,

      /**
       * The time between the last ping and the pong that followed it, or null
       */
      Duration heartbeatLatency,

      /**
       * Pongs received as a percentage of pings sent, or null if either is zero
       */
      Double heartbeatHealth) {

    public Metrics {
      requireNonNull(state, "state");
      if (messagesSent < 0)
        throw new IllegalArgumentException("messagesSent must be at least zero");
      if (messagesReceived < 0)
        throw new IllegalArgumentException("messagesReceived must be at least zero");
      if (errors < 0)
        throw new IllegalArgumentException("errors must be at least zero");
      if (pingsSent < 0)
        throw new IllegalArgumentException("pingsSent must be at least zero");
      if (pongsReceived < 0)
        throw new IllegalArgumentException("pongsReceived must be at least zero");
    }

    /**
     * Returns the snapshot as named counters and timestamps. Absent values are omitted. Durations
     * are in milliseconds and instants are ISO-8601 strings.
     */
    public Map<String, Object> toMap() {
      final Map<String, Object> result = new LinkedHashMap<>();
      result.put("currentState", state.name());
      result.put("messagesSent", messagesSent);
      result.put("messagesReceived", messagesReceived);
      result.put("errorsCount", errors);
      result.put("pingSent", pingsSent);
      result.put("pongReceived", pongsReceived);
      if (connectedAt != null)
        result.put("connectionStartTime", connectedAt.toString());
      if (connectionDuration != null)
        result.put("connectionDuration", connectionDuration.toMillis());
      if (lastMessageAt != null)
        result.put("lastMessageTime", lastMessageAt.toString());
      if (lastPingAt != null)
        result.put("lastPingTime", lastPingAt.toString());
      if (lastPongAt != null)
        result.put("lastPongTime", lastPongAt.toString());
      if (heartbeatLatency != null)
        result.put("heartbeatLatency", heartbeatLatency.toMillis());
      if (heartbeatHealth != null)
        result.put("heartbeatHealth", heartbeatHealth);
      return unmodifiableMap(result);
    }
  }

  private final DefaultTopic<ConnectionState> states;
  private final DefaultTopic<Message> messages;
  private final DefaultTopic<ConnectionEvent> events;
  private final AtomicBoolean disposed = new AtomicBoolean(false);

  private final Config config;
  private final Transport transport;
  private final EventLoop loop;
  private final Clock clock;
  private final ObjectMapper mapper;

  private volatile ConnectionState state = ConnectionState.INITIAL;
  private SessionListener listener;
  private TransportSession session;
  private CompletableFuture<Void> connecting;
  private CompletableFuture<Void> closing;
  private CompletableFuture<Void> disposal;
  private Timer timeoutTimer;
  private Timer heartbeatTimer;
  private final Set<CompletableFuture<Void>> pendingSends = new LinkedHashSet<>();

  private long messagesSent = 0;
  private long messagesReceived = 0;
  private long errors = 0;
  private long pingsSent = 0;
  private long pongsReceived = 0;
  private Instant connectedAt;
  private Instant lastMessageAt;
  private Instant lastPingAt;
  private Instant lastPongAt;
  private Duration heartbeatLatency;

  public Connection(Config config, Transport transport, EventLoop loop) {
    this(config, transport, loop, Clock.systemUTC());
  }

  public Connection(Config config, Transport transport, EventLoop loop, Clock clock) {
    this.config = requireNonNull(config, "config");
    this.transport = requireNonNull(transport, "transport");
    this.loop = requireNonNull(loop, "loop");
    this.clock = requireNonNull(clock, "clock");
    this.mapper = Json.mapper();
    this.states = new DefaultTopic<>("connection-states");
    this.messages = new DefaultTopic<>("connection-messages");
    this.events = new DefaultTopic<>("connection-events");
  }

  /**
   * Receives the callbacks of one open attempt. Each attempt gets a fresh instance, so callbacks
   * from an abandoned session can be recognized and dropped.
   */
  private class SessionListener implements TransportListener {
    @Override
    public void onFrame(Frame frame) {
      loop.execute(() -> handleFrame(this, frame));
    }

    @Override
    public void onClosed(int statusCode, String reason) {
      loop.execute(() -> handleClosed(this, statusCode, reason));
    }

    @Override
    public void onError(Throwable cause) {
      loop.execute(() -> handleError(this, cause));
    }
  }

  public Config getConfig() {
    return config;
  }

  public ConnectionState getState() {
    return state;
  }

  public boolean isConnected() {
    return state == ConnectionState.CONNECTED;
  }

  public boolean isDisposed() {
    return disposed.get();
  }

  /**
   * State transitions, in order, none dropped or coalesced.
   */
  public Subscribable<ConnectionState> states() {
    return states;
  }

  /**
   * Inbound non-control messages.
   */
  public Subscribable<Message> messages() {
    return messages;
  }

  public Subscribable<ConnectionEvent> events() {
    return events;
  }

  /**
   * Opens a session. If an open is already in flight, returns the same future; if already
   * connected, returns a completed future. The future fails with a
   * {@link ConnectionFailedException} if the open fails or times out.
   */
  public CompletableFuture<Void> connect() {
    return loop.submit(this::doConnect);
  }

  /**
   * Closes the session. Does nothing if the connection never connected, or is already closed or
   * failed.
   */
  public CompletableFuture<Void> disconnect() {
    return loop.submit(this::doDisconnect);
  }

  /**
   * Sends a message. The future fails with a {@link NotConnectedException} unless the connection
   * is {@link ConnectionState#canSend() able to send}, and with a
   * {@link MessageSendFailedException} if the transport rejects the frame.
   */
  public CompletableFuture<Void> send(Message message) {
    requireNonNull(message, "message");
    return loop.submit(() -> doSend(message));
  }

  public CompletableFuture<Void> sendText(String text) {
    return send(Message.text(text));
  }

  public CompletableFuture<Void> sendBinary(byte[] bytes) {
    return send(Message.binary(bytes));
  }

  public CompletableFuture<Void> sendStructured(JsonNode document) {
    return send(Message.structured(document));
  }

  public CompletableFuture<Void> sendPing() {
    return send(Message.ping());
  }

  public CompletableFuture<Void> sendPong() {
    return send(Message.pong());
  }

  /**
   * Disconnects, releases all timers, and closes the three topics. Safe to call more than once.
   */
  public CompletableFuture<Void> dispose() {
    return loop.submit(this::doDispose);
  }

  /**
   * Takes a metrics snapshot on the event loop.
   */
  public CompletableFuture<Metrics> getStatistics() {
    return loop.call(this::checkMetrics);
  }

  /**
   * Must be called on the event loop. Use {@link #getStatistics()} from other threads.
   */
  @Override
  public Metrics checkMetrics() {
    final Instant now = clock.instant();
    final Duration connectionDuration =
        connectedAt != null ? Duration.between(connectedAt, now) : null;
    final Double heartbeatHealth = pingsSent > 0 && pongsReceived > 0
        ? Double.valueOf(100.0 * pongsReceived / pingsSent)
        : null;
    return new Metrics(state, messagesSent, messagesReceived, errors, pingsSent, pongsReceived,
        connectedAt, connectionDuration, lastMessageAt, lastPingAt, lastPongAt, heartbeatLatency,
        heartbeatHealth);
  }

  /**
   * Must be called on the event loop. Resets the counters but keeps the timestamps.
   */
  @Override
  public Metrics flushMetrics() {
    final Metrics result = checkMetrics();
    messagesSent = 0;
    messagesReceived = 0;
    errors = 0;
    pingsSent = 0;
    pongsReceived = 0;
    return result;
  }

  private CompletableFuture<Void> doConnect() {
    if (disposed.get())
      return CompletableFuture.failedFuture(new ConnectionFailedException("Connection disposed"));

    switch (state) {
      case CONNECTING:
        return connecting;
      case CONNECTED:
        return CompletableFuture.completedFuture(null);
      case CLOSING:
        return CompletableFuture
            .failedFuture(new ConnectionFailedException("Connection is closing"));
      default:
        break;
    }

    final CompletableFuture<Void> result = new CompletableFuture<>();
    final SessionListener attempt = new SessionListener();
    connecting = result;
    listener = attempt;

    transition(ConnectionState.CONNECTING);

    timeoutTimer = loop.schedule(config.connectionTimeout(), () -> onConnectTimeout(attempt));

    TransportOptions options = new TransportOptions(config.protocols(), config.headers());
    if (!config.headers().isEmpty() && !transport.supportsHeaders()) {
      LOGGER.atWarn().addKeyValue("uri", config.uri())
          .log("Transport does not support custom headers, connecting without them");
      options = options.withoutHeaders();
    }

    LOGGER.atDebug().addKeyValue("uri", config.uri()).log("Connecting");

    CompletableFuture<TransportSession> opening;
    try {
      opening = transport.open(config.uri(), options, attempt);
    } catch (RuntimeException e) {
      opening = CompletableFuture.failedFuture(e);
    }
    opening.whenComplete((s, cause) -> loop.execute(() -> onOpened(attempt, s, cause)));

    return result;
  }

  private void onOpened(SessionListener attempt, TransportSession opened, Throwable cause) {
    if (attempt != listener || disposed.get() || state != ConnectionState.CONNECTING) {
      if (opened != null) {
        LOGGER.atDebug().addKeyValue("uri", config.uri()).log("Closing abandoned session");
        opened.close();
      }
      return;
    }

    if (cause != null) {
      final Throwable problem = unwrap(cause);
      fail("Connection error: " + describe(problem), problem);
      return;
    }

    session = opened;
    cancel(timeoutTimer);
    timeoutTimer = null;

    if (config.enableHeartbeat()) {
      heartbeatTimer = loop.scheduleAtFixedRate(config.heartbeatInterval(),
          config.heartbeatInterval(), this::onHeartbeat);
    }

    connectedAt = clock.instant();
    lastPingAt = null;
    lastPongAt = null;

    LOGGER.atInfo().addKeyValue("uri", config.uri()).log("Connected");

    transition(ConnectionState.CONNECTED);
    emit(events, new ConnectionEvent.Connected());

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.complete(null);
  }

  private void onConnectTimeout(SessionListener attempt) {
    if (attempt != listener || disposed.get() || state != ConnectionState.CONNECTING)
      return;
    LOGGER.atWarn().addKeyValue("uri", config.uri())
        .addKeyValue("timeout", config.connectionTimeout()).log("Connection attempt timed out");
    fail("Connection timeout", new OperationTimeoutException("connect"));
  }

  /**
   * Abandons the current session and moves to {@link ConnectionState#FAILED}.
   */
  private void fail(String reason, Throwable cause) {
    cancelTimers();

    final TransportSession abandoned = session;
    session = null;
    listener = null;
    connectedAt = null;
    if (abandoned != null)
      closeQuietly(abandoned);

    LOGGER.atWarn().addKeyValue("uri", config.uri()).addKeyValue("reason", reason)
        .log("Connection failed");

    transition(ConnectionState.FAILED);
    emit(events, new ConnectionEvent.ConnectionFailed(reason));
    failPendingSends(reason);

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.completeExceptionally(new ConnectionFailedException(reason, cause));
  }

  private CompletableFuture<Void> doDisconnect() {
    if (state == ConnectionState.INITIAL || state == ConnectionState.CLOSED
        || state == ConnectionState.FAILED)
      return CompletableFuture.completedFuture(null);
    if (state == ConnectionState.CLOSING)
      return closing;

    final CompletableFuture<Void> result = new CompletableFuture<>();
    closing = result;

    transition(ConnectionState.CLOSING);
    cancelTimers();

    final TransportSession closed = session;
    session = null;
    listener = null;
    connectedAt = null;

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.completeExceptionally(new ConnectionFailedException("Connection closed by caller"));

    failPendingSends("Connection closed by caller");

    final CompletableFuture<Void> closure =
        closed != null ? closeQuietly(closed) : CompletableFuture.completedFuture(null);
    closure.whenComplete((v, e) -> loop.execute(this::finishDisconnect));

    return result;
  }

  private void finishDisconnect() {
    LOGGER.atInfo().addKeyValue("uri", config.uri()).log("Disconnected");
    transition(ConnectionState.CLOSED);
    emit(events, new ConnectionEvent.Disconnected());
    final CompletableFuture<Void> pending = closing;
    closing = null;
    if (pending != null)
      pending.complete(null);
  }

  private CompletableFuture<Void> doSend(Message message) {
    final TransportSession target = session;
    if (!state.canSend() || target == null)
      return CompletableFuture.failedFuture(new NotConnectedException(state));

    final Frame frame;
    try {
      frame = encode(message);
    } catch (JsonProcessingException e) {
      errors = errors + 1;
      return CompletableFuture.failedFuture(
          new MessageSendFailedException("Failed to encode message " + message.id(), e));
    }

    final CompletableFuture<Void> result = new CompletableFuture<>();
    pendingSends.add(result);
    CompletableFuture<Void> sending;
    try {
      sending = target.send(frame);
    } catch (RuntimeException e) {
      sending = CompletableFuture.failedFuture(e);
    }
    sending.whenComplete((v, cause) -> loop.execute(() -> onSent(message, cause, result)));
    return result;
  }

  private void onSent(Message message, Throwable cause, CompletableFuture<Void> result) {
    if (!pendingSends.remove(result)) {
      LOGGER.atDebug().addKeyValue("id", message.id())
          .log("Send completed after its session was torn down");
      return;
    }

    if (cause != null) {
      final Throwable problem = unwrap(cause);
      errors = errors + 1;
      LOGGER.atDebug().addKeyValue("id", message.id()).setCause(problem)
          .log("Failed to send message");
      emit(events, new ConnectionEvent.Error("Failed to send message: " + describe(problem)));
      result.completeExceptionally(new MessageSendFailedException(
          "Failed to send message " + message.id() + ": " + describe(problem), problem));
      return;
    }

    final Instant now = clock.instant();
    messagesSent = messagesSent + 1;
    lastMessageAt = now;
    if (message.kind() == MessageKind.PING) {
      pingsSent = pingsSent + 1;
      lastPingAt = now;
    }

    emit(events, new ConnectionEvent.MessageSent(message));
    result.complete(null);
  }

  /**
   * Serializes a message into a single frame. Structured documents go through Jackson, control
   * messages become their literal token.
   */
  Frame encode(Message message) throws JsonProcessingException {
    final Payload payload = message.payload();
    if (payload instanceof Payload.Text text)
      return Frame.text(text.text());
    if (payload instanceof Payload.Binary binary)
      return Frame.binary(binary.bytes());
    if (payload instanceof Payload.Structured structured)
      return Frame.text(mapper.writeValueAsString(structured.document()));
    if (payload instanceof Payload.Control control)
      return Frame.text(control.token().getLiteral());
    throw new AssertionError("unknown payload " + payload.getClass());
  }

  /**
   * Turns an inbound frame into a message. Text that parses as a JSON object or array becomes a
   * structured message; anything else stays text.
   */
  Message decode(Frame frame) {
    if (frame instanceof Frame.Binary binary)
      return Message.binary(binary.bytes());

    final String text = ((Frame.Text) frame).text();
    final Payload.Control.Token token = Payload.Control.Token.fromLiteral(text);
    if (token != null)
      return Message.builder(new Payload.Control(token)).build();

    final String trimmed = text.trim();
    if (trimmed.startsWith("{") || trimmed.startsWith("[")) {
      try {
        final JsonNode document = mapper.readTree(text);
        if (document != null && document.isContainerNode())
          return Message.structured(document);
      } catch (JsonProcessingException e) {
        LOGGER.atTrace().setCause(e).log("Inbound text is not JSON, treating as plain text");
      }
    }

    return Message.text(text);
  }

  private void handleFrame(SessionListener attempt, Frame frame) {
    if (attempt != listener || disposed.get() || state != ConnectionState.CONNECTED) {
      LOGGER.atDebug().log("Dropping frame from inactive session");
      return;
    }

    final Message message = decode(frame);
    final Instant now = clock.instant();

    if (message.kind() == MessageKind.PING) {
      doSend(Message.pong()).exceptionally(e -> {
        LOGGER.atDebug().setCause(e).log("Failed to answer ping");
        return null;
      });
      return;
    }

    if (message.kind() == MessageKind.PONG) {
      pongsReceived = pongsReceived + 1;
      lastPongAt = now;
      if (lastPingAt != null)
        heartbeatLatency = Duration.between(lastPingAt, now);
      return;
    }

    messagesReceived = messagesReceived + 1;
    lastMessageAt = now;
    emit(messages, message);
    emit(events, new ConnectionEvent.MessageReceived(message));
  }

  private void handleClosed(SessionListener attempt, int statusCode, String reason) {
    if (attempt != listener || disposed.get()) {
      LOGGER.atDebug().addKeyValue("statusCode", statusCode)
          .log("Dropping close from inactive session");
      return;
    }

    if (state == ConnectionState.CONNECTING) {
      fail("Connection closed during handshake (" + statusCode + ")", null);
      return;
    }

    if (state != ConnectionState.CONNECTED)
      return;

    LOGGER.atInfo().addKeyValue("uri", config.uri()).addKeyValue("statusCode", statusCode)
        .addKeyValue("reason", reason).log("Connection closed by peer");

    cancelTimers();
    session = null;
    listener = null;
    connectedAt = null;

    transition(ConnectionState.CLOSED);
    emit(events, new ConnectionEvent.Disconnected());
    failPendingSends("Connection closed by peer");
  }

  private void handleError(SessionListener attempt, Throwable cause) {
    if (attempt != listener || disposed.get()) {
      LOGGER.atDebug().setCause(cause).log("Dropping error from inactive session");
      return;
    }

    errors = errors + 1;
    emit(events, new ConnectionEvent.Error("Transport error: " + describe(cause)));

    if (state == ConnectionState.CONNECTING || state == ConnectionState.CONNECTED)
      fail("Connection error: " + describe(cause), cause);
  }

  /**
   * Runs on every heartbeat tick.
   */
  void onHeartbeat() {
    if (disposed.get() || state != ConnectionState.CONNECTED)
      return;

    if (lastPingAt != null && lastPongAt != null) {
      final Instant now = clock.instant();
      final Duration limit = config.heartbeatInterval().multipliedBy(2);
      if (Duration.between(lastPingAt, now).compareTo(limit) > 0
          && Duration.between(lastPongAt, now).compareTo(limit) > 0) {
        errors = errors + 1;
        LOGGER.atWarn().addKeyValue("uri", config.uri()).addKeyValue("lastPongAt", lastPongAt)
            .log("Heartbeat timed out");
        emit(events, new ConnectionEvent.Error(HEARTBEAT_TIMEOUT));
      }
    }

    doSend(Message.ping()).exceptionally(e -> {
      LOGGER.atDebug().setCause(e).log("Failed to send heartbeat ping");
      return null;
    });
  }

  private CompletableFuture<Void> doDispose() {
    if (disposal != null)
      return disposal;

    final CompletableFuture<Void> result = new CompletableFuture<>();
    disposal = result;

    doDisconnect().whenComplete((v, e) -> {
      if (e != null)
        LOGGER.atDebug().setCause(e).log("Disconnect during dispose failed");
      cancelTimers();
      disposed.set(true);
      states.close();
      messages.close();
      events.close();
      LOGGER.atDebug().addKeyValue("uri", config.uri()).log("Connection disposed");
      result.complete(null);
    });

    return result;
  }

  /**
   * Fails every send still waiting on the transport. Called whenever the session goes away, so
   * callers never wait on a frame that can no longer be delivered.
   */
  private void failPendingSends(String reason) {
    if (pendingSends.isEmpty())
      return;

    final List<CompletableFuture<Void>> abandoned = new ArrayList<>(pendingSends);
    pendingSends.clear();

    LOGGER.atDebug().addKeyValue("count", abandoned.size()).addKeyValue("reason", reason)
        .log("Failing pending sends");

    for (CompletableFuture<Void> result : abandoned)
      result.completeExceptionally(new NotConnectedException(state));
  }

  private void transition(ConnectionState next) {
    final ConnectionState previous = state;
    if (previous == next)
      return;
    state = next;
    LOGGER.atDebug().addKeyValue("from", previous).addKeyValue("to", next)
        .log("Connection state changed");
    emit(states, next);
  }

  private <T> void emit(DefaultTopic<T> topic, T event) {
    if (!topic.isClosed())
      topic.publish(event);
  }

  private void cancelTimers() {
    cancel(timeoutTimer);
    timeoutTimer = null;
    cancel(heartbeatTimer);
    heartbeatTimer = null;
  }

  private static void cancel(Timer timer) {
    if (timer != null)
      timer.cancel();
  }

  private CompletableFuture<Void> closeQuietly(TransportSession target) {
    CompletableFuture<Void> closure;
    try {
      closure = target.close();
    } catch (RuntimeException e) {
      closure = CompletableFuture.failedFuture(e);
    }
    return closure.exceptionally(e -> {
      LOGGER.atDebug().setCause(e).log("Failed to close session cleanly");
      return null;
    });
  }

  private static Throwable unwrap(Throwable cause) {
    Throwable result = cause;
    while (result instanceof CompletionException && result.getCause() != null)
      result = result.getCause();
    return result;
  }

  private static String describe(Throwable cause) {
    if (cause == null)
      return "unknown";
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  @Override
  public String toString() {
    return "Connection [uri=" + config.uri() + ", state=" + state + "]";
  }
}
