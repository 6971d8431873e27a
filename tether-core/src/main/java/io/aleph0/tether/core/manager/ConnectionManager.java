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
package io.aleph0.tether.core.manager;

import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.aleph0.tether.core.Config;
import io.aleph0.tether.core.ConnectionFailedException;
import io.aleph0.tether.core.ConnectionState;
import io.aleph0.tether.core.Measureable;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.ReconnectionFailedException;
import io.aleph0.tether.core.codec.ConfigCodec;
import io.aleph0.tether.core.codec.Json;
import io.aleph0.tether.core.connection.Connection;
import io.aleph0.tether.core.connection.ConnectionEvent;
import io.aleph0.tether.core.event.DefaultTopic;
import io.aleph0.tether.core.event.Subscribable;
import io.aleph0.tether.core.event.Subscription;
import io.aleph0.tether.core.loop.EventLoop;
import io.aleph0.tether.core.loop.Timer;
import io.aleph0.tether.core.policy.ReconnectionPolicies;
import io.aleph0.tether.core.policy.ReconnectionPolicy;
import io.aleph0.tether.core.queue.EnqueueResult;
import io.aleph0.tether.core.queue.MessageQueue;
import io.aleph0.tether.core.transport.Transport;

/**
 * Keeps a logical connection alive across transport failures.
 *
 * <p>
 * The manager owns at most one {@link Connection} at a time. When that connection fails or is
 * closed by the peer, the manager asks its {@link ReconnectionPolicy} for a delay and then
 * replaces the connection with a fresh one, until the policy or
 * {@link Config#maxReconnectionAttempts()} says to stop. Messages submitted while disconnected
 * are held in a {@link MessageQueue} and drained in priority order once a connection is up.
 *
 * <p>
 * Callers observe the manager through four topics that stay the same across reconnections:
 * {@link #states()}, {@link #events()}, {@link #connectionStates()} and {@link #messages()}.
 *
 * <p>
 * Like {@link Connection}, all mutable state lives on one {@link EventLoop}. If the caller does
 * not supply a loop, the manager creates one and shuts it down on {@link #dispose()}.
 */
public class ConnectionManager implements Measureable<ConnectionManager.Metrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(ConnectionManager.class);

  public static final String MAX_ATTEMPTS_REACHED = "Max reconnection attempts reached";

  public static record Metrics(ManagerState state, ConnectionState connectionState,
      boolean reconnecting, int reconnectionAttempt, MessageQueue.Metrics queue,
      Connection.Metrics connection, Config config) {
    public Metrics {
      requireNonNull(state, "state");
      requireNonNull(connectionState, "connectionState");
      requireNonNull(queue, "queue");
      requireNonNull(config, "config");
      if (reconnectionAttempt < 0)
        throw new IllegalArgumentException("reconnectionAttempt must be at least zero");
    }

    public boolean isConnected() {
      return connectionState == ConnectionState.CONNECTED;
    }

    public Map<String, Object> toMap() {
      final Map<String, Object> result = new LinkedHashMap<>();
      result.put("state", state.name());
      result.put("connectionState", connectionState.name());
      result.put("isConnected", isConnected());
      result.put("isReconnecting", reconnecting);
      result.put("reconnectionAttempt", reconnectionAttempt);
      result.put("queueStatistics", queue.toMap());
      if (connection != null)
        result.put("connectionStatistics", connection.toMap());
      final JsonNode configTree = new ConfigCodec().toTree(config);
      result.put("config",
          Json.mapper().convertValue(configTree, new TypeReference<Map<String, Object>>() {}));
      return unmodifiableMap(result);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private Config config;
    private Transport transport;
    private ReconnectionPolicy reconnectionPolicy;
    private MessageQueue queue;
    private EventLoop eventLoop;
    private Clock clock = Clock.systemUTC();

    public Builder setConfig(Config config) {
      this.config = requireNonNull(config, "config");
      return this;
    }

    public Builder setTransport(Transport transport) {
      this.transport = requireNonNull(transport, "transport");
      return this;
    }

    /**
     * Optional. Defaults to the policy described by the config.
     */
    public Builder setReconnectionPolicy(ReconnectionPolicy reconnectionPolicy) {
      this.reconnectionPolicy = requireNonNull(reconnectionPolicy, "reconnectionPolicy");
      return this;
    }

    /**
     * Optional. Defaults to an empty queue of {@link Config#maxQueueSize()} messages. A queue
     * restored from storage may be passed here; its messages are sent after the first connect.
     */
    public Builder setQueue(MessageQueue queue) {
      this.queue = requireNonNull(queue, "queue");
      return this;
    }

    /**
     * Optional. A supplied loop is not closed when the manager is disposed.
     */
    public Builder setEventLoop(EventLoop eventLoop) {
      this.eventLoop = requireNonNull(eventLoop, "eventLoop");
      return this;
    }

    public Builder setClock(Clock clock) {
      this.clock = requireNonNull(clock, "clock");
      return this;
    }

    public ConnectionManager build() {
      if (config == null)
        throw new IllegalStateException("config is required");
      if (transport == null)
        throw new IllegalStateException("transport is required");
      final ReconnectionPolicy policy =
          reconnectionPolicy != null ? reconnectionPolicy : ReconnectionPolicies.fromConfig(config);
      final MessageQueue q =
          queue != null ? queue : MessageQueue.builder().setMaxSize(config.maxQueueSize()).build();
      final boolean ownsLoop = eventLoop == null;
      final EventLoop loop = ownsLoop ? EventLoop.create() : eventLoop;
      return new ConnectionManager(config, transport, policy, q, loop, ownsLoop, clock);
    }
  }

  private final DefaultTopic<ManagerStatus> states;
  private final DefaultTopic<ManagerEvent> events;
  private final DefaultTopic<ConnectionState> connectionStates;
  private final DefaultTopic<Message> messages;
  private final AtomicBoolean disposed = new AtomicBoolean(false);
  private final AtomicReference<CompletableFuture<Void>> disposal = new AtomicReference<>();

  private final Config config;
  private final Transport transport;
  private final ReconnectionPolicy policy;
  private final MessageQueue queue;
  private final EventLoop loop;
  private final boolean ownsLoop;
  private final Clock clock;

  private volatile ManagerStatus status = ManagerStatus.INITIAL;
  private Connection connection;
  private final List<Subscription> subscriptions = new ArrayList<>();
  private CompletableFuture<Void> connecting;
  private Timer reconnectTimer;
  private Timer drainTimer;
  private boolean reconnecting = false;
  private boolean userDisconnected = false;
  private Connection draining;
  private int attempt = 0;

  ConnectionManager(Config config, Transport transport, ReconnectionPolicy policy,
      MessageQueue queue, EventLoop loop, boolean ownsLoop, Clock clock) {
    this.config = requireNonNull(config, "config");
    this.transport = requireNonNull(transport, "transport");
    this.policy = requireNonNull(policy, "policy");
    this.queue = requireNonNull(queue, "queue");
    this.loop = requireNonNull(loop, "loop");
    this.ownsLoop = ownsLoop;
    this.clock = requireNonNull(clock, "clock");
    this.states = new DefaultTopic<>("manager-states");
    this.events = new DefaultTopic<>("manager-events");
    this.connectionStates = new DefaultTopic<>("manager-connection-states");
    this.messages = new DefaultTopic<>("manager-messages");
  }

  public Config getConfig() {
    return config;
  }

  public EventLoop getEventLoop() {
    return loop;
  }

  public ManagerStatus getStatus() {
    return status;
  }

  public ManagerState getState() {
    return status.state();
  }

  public ConnectionState getConnectionState() {
    return status.connectionState();
  }

  public boolean isConnected() {
    return status.isConnected();
  }

  public Subscribable<ManagerStatus> states() {
    return states;
  }

  public Subscribable<ManagerEvent> events() {
    return events;
  }

  /**
   * The raw states of whichever connection the manager currently owns.
   */
  public Subscribable<ConnectionState> connectionStates() {
    return connectionStates;
  }

  /**
   * Inbound messages from whichever connection the manager currently owns.
   */
  public Subscribable<Message> messages() {
    return messages;
  }

  /**
   * Connects, reconnecting as configured until a connection is established.
   *
   * <p>
   * The future completes when a connection is up. It fails with a
   * {@link ConnectionFailedException} if the attempt fails and reconnection is disabled, with a
   * {@link ReconnectionFailedException} if the reconnection campaign gives up, and with a
   * {@link ConnectionFailedException} if {@link #disconnect()} is called first. If a connection
   * is already active or being established, no new attempt is made.
   */
  public CompletableFuture<Void> connect() {
    return loop.submit(this::doConnect);
  }

  /**
   * Closes the connection and cancels any pending reconnection. A caller-initiated disconnect
   * never triggers a reconnection.
   */
  public CompletableFuture<Void> disconnect() {
    return loop.submit(this::doDisconnect);
  }

  /**
   * Sends a message now if connected, otherwise queues it if queuing is enabled.
   *
   * @return a future that yields true if the message was sent or queued, and false if it was
   *         neither
   */
  public CompletableFuture<Boolean> send(Message message) {
    requireNonNull(message, "message");
    return loop.submit(() -> doSend(message));
  }

  public CompletableFuture<Boolean> sendText(String text) {
    return send(Message.text(text));
  }

  public CompletableFuture<Boolean> sendBinary(byte[] bytes) {
    return send(Message.binary(bytes));
  }

  public CompletableFuture<Boolean> sendStructured(JsonNode document) {
    return send(Message.structured(document));
  }

  public CompletableFuture<Boolean> sendPing() {
    return send(Message.ping());
  }

  public CompletableFuture<Boolean> sendPong() {
    return send(Message.pong());
  }

  /**
   * Takes a consistent snapshot of manager, queue, and connection metrics on the event loop.
   */
  public CompletableFuture<Metrics> getStatistics() {
    return loop.call(this::snapshot);
  }

  /**
   * Blocks until the snapshot is taken. Must not be called on the manager's event loop unless
   * already running there.
   */
  @Override
  public Metrics checkMetrics() {
    if (loop.inEventLoop())
      return snapshot();
    return getStatistics().join();
  }

  @Override
  public Metrics flushMetrics() {
    if (loop.inEventLoop())
      return flush();
    return loop.call(this::flush).join();
  }

  /**
   * Cancels any pending reconnection, disposes the connection, closes the manager's topics and,
   * if the manager created its own event loop, shuts the loop down. Only the first call has any
   * effect; every call returns the same future.
   */
  public CompletableFuture<Void> dispose() {
    final CompletableFuture<Void> result = new CompletableFuture<>();
    if (!disposal.compareAndSet(null, result))
      return disposal.get();

    loop.submit(this::doDispose).whenComplete((v, e) -> {
      if (e != null)
        LOGGER.atWarn().setCause(e).log("Manager dispose failed");
      if (ownsLoop)
        loop.close();
      result.complete(null);
    });

    return result;
  }

  private CompletableFuture<Void> doConnect() {
    if (disposed.get() || disposal.get() != null)
      return CompletableFuture.failedFuture(new ConnectionFailedException("Manager disposed"));

    userDisconnected = false;

    if (connection != null && connection.getState() == ConnectionState.CONNECTED)
      return CompletableFuture.completedFuture(null);

    if (connecting == null)
      connecting = new CompletableFuture<>();
    final CompletableFuture<Void> result = connecting;

    if (connection != null && connection.getState().isActive())
      return result;
    if (reconnectTimer != null && reconnectTimer.isPending())
      return result;

    // A new connect starts a new campaign
    attempt = 0;
    reconnecting = false;
    policy.reset();

    LOGGER.atInfo().addKeyValue("uri", config.uri()).log("Connecting");

    openConnection();

    return result;
  }

  /**
   * Replaces the current connection, if any, with a fresh one and starts connecting it.
   */
  private void openConnection() {
    teardownConnection();

    final Connection fresh = new Connection(config, transport, loop, clock);
    connection = fresh;
    subscriptions.add(fresh.states().subscribe(s -> onConnectionState(fresh, s)));
    subscriptions.add(fresh.events().subscribe(e -> onConnectionEvent(fresh, e)));
    subscriptions.add(fresh.messages().subscribe(m -> onConnectionMessage(fresh, m)));

    emit(events, new ManagerEvent.Connecting());

    fresh.connect().exceptionally(e -> {
      LOGGER.atDebug().setCause(e).log("Connection attempt failed");
      return null;
    });
  }

  private void teardownConnection() {
    for (Subscription subscription : subscriptions)
      subscription.close();
    subscriptions.clear();

    final Connection stale = connection;
    connection = null;
    draining = null;
    if (stale != null) {
      stale.dispose().exceptionally(e -> {
        LOGGER.atDebug().setCause(e).log("Failed to dispose stale connection");
        return null;
      });
    }
  }

  private void onConnectionState(Connection source, ConnectionState state) {
    if (source != connection || disposed.get())
      return;
    emit(connectionStates, state);
    publishStatus();
  }

  private void onConnectionMessage(Connection source, Message message) {
    if (source != connection || disposed.get())
      return;
    emit(messages, message);
  }

  private void onConnectionEvent(Connection source, ConnectionEvent event) {
    if (source != connection || disposed.get())
      return;

    emit(events, new ManagerEvent.ConnectionEventRelay(event));

    if (event instanceof ConnectionEvent.Connected) {
      onConnected();
    } else if (event instanceof ConnectionEvent.ConnectionFailed failed) {
      emit(events, new ManagerEvent.ConnectionFailed(failed.reason()));
      onConnectionLost(failed.reason());
    } else if (event instanceof ConnectionEvent.Disconnected) {
      if (!userDisconnected) {
        emit(events, new ManagerEvent.Disconnected());
        onConnectionLost("Connection closed");
      }
    }
  }

  private void onConnected() {
    if (reconnecting) {
      LOGGER.atInfo().addKeyValue("uri", config.uri()).addKeyValue("attempt", attempt)
          .log("Reconnected");
    }

    attempt = 0;
    reconnecting = false;
    policy.reset();

    emit(events, new ManagerEvent.Connected());
    publishStatus();

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.complete(null);

    drainQueue();
  }

  private void onConnectionLost(String reason) {
    cancel(drainTimer);
    drainTimer = null;
    draining = null;

    if (userDisconnected)
      return;

    if (!config.enableReconnection()) {
      reconnecting = false;
      publishStatus();
      final CompletableFuture<Void> pending = connecting;
      connecting = null;
      if (pending != null)
        pending.completeExceptionally(new ConnectionFailedException(reason));
      return;
    }

    scheduleReconnection();
  }

  private void scheduleReconnection() {
    if (reconnectTimer != null && reconnectTimer.isPending())
      return;

    attempt = attempt + 1;

    if (!policy.shouldRetry(attempt, config.maxReconnectionAttempts())) {
      LOGGER.atWarn().addKeyValue("uri", config.uri()).addKeyValue("attempts", attempt - 1)
          .log("Giving up on reconnection");
      reconnecting = false;
      emit(events, new ManagerEvent.ReconnectionFailed(MAX_ATTEMPTS_REACHED));
      publishStatus();
      final CompletableFuture<Void> pending = connecting;
      connecting = null;
      if (pending != null)
        pending.completeExceptionally(new ReconnectionFailedException(MAX_ATTEMPTS_REACHED));
      return;
    }

    final Duration delay = policy.delay(attempt);

    LOGGER.atInfo().addKeyValue("uri", config.uri()).addKeyValue("attempt", attempt)
        .addKeyValue("delay", delay).log("Scheduling reconnection");

    reconnecting = true;
    emit(events, new ManagerEvent.Reconnecting(attempt));
    publishStatus();

    reconnectTimer = loop.schedule(delay, this::onReconnectTimer);
  }

  private void onReconnectTimer() {
    reconnectTimer = null;
    if (disposed.get() || userDisconnected)
      return;
    openConnection();
  }

  private CompletableFuture<Void> doDisconnect() {
    userDisconnected = true;

    cancel(reconnectTimer);
    reconnectTimer = null;
    cancel(drainTimer);
    drainTimer = null;

    attempt = 0;
    reconnecting = false;
    policy.reset();

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.completeExceptionally(new ConnectionFailedException("Disconnected by caller"));

    final Connection current = connection;
    if (current == null) {
      publishStatus();
      return CompletableFuture.completedFuture(null);
    }

    LOGGER.atInfo().addKeyValue("uri", config.uri()).log("Disconnecting");

    final CompletableFuture<Void> result = new CompletableFuture<>();
    current.disconnect().whenComplete((v, e) -> {
      if (e != null)
        LOGGER.atDebug().setCause(e).log("Disconnect failed");
      emit(events, new ManagerEvent.Disconnected());
      publishStatus();
      result.complete(null);
    });
    return result;
  }

  private CompletableFuture<Boolean> doSend(Message message) {
    if (disposed.get())
      return CompletableFuture.completedFuture(false);

    final Connection current = connection;
    if (current != null && current.isConnected()) {
      final CompletableFuture<Boolean> result = new CompletableFuture<>();
      current.send(message).whenComplete((v, cause) -> {
        if (cause == null) {
          emit(events, new ManagerEvent.MessageSent(message));
          result.complete(true);
        } else {
          LOGGER.atDebug().addKeyValue("id", message.id()).setCause(cause)
              .log("Immediate send failed, falling back to queue");
          emit(events, new ManagerEvent.Error(
              "Failed to send message " + message.id(), message.id()));
          result.complete(enqueue(message));
        }
      });
      return result;
    }

    return CompletableFuture.completedFuture(enqueue(message));
  }

  private boolean enqueue(Message message) {
    if (!config.enableMessageQueue()) {
      LOGGER.atDebug().addKeyValue("id", message.id())
          .log("Not connected and queuing disabled, dropping message");
      return false;
    }

    final EnqueueResult outcome = queue.offer(message);
    if (outcome.isAccepted()) {
      emit(events, new ManagerEvent.MessageQueued(message));
      publishStatus();
      return true;
    }

    final String description = outcome == EnqueueResult.QUEUE_FULL
        ? "Message queue is full, rejected message " + message.id()
        : "Duplicate message " + message.id() + " already queued";
    emit(events, new ManagerEvent.Error(description, message.id()));
    return false;
  }

  /**
   * Sends up to {@link Config#drainBatchSize()} queued messages, then schedules itself again
   * while messages remain and the connection is up.
   */
  private void drainQueue() {
    drainTimer = null;

    if (disposed.get())
      return;

    final Connection current = connection;
    if (current == null || draining == current || !current.isConnected() || queue.isEmpty())
      return;

    draining = current;

    final List<CompletableFuture<Void>> batch = new ArrayList<>();
    for (int i = 0; i < config.drainBatchSize() && !queue.isEmpty(); i++) {
      final Message message = queue.dequeue();
      batch.add(current.send(message).handle((v, cause) -> {
        onDrained(message, cause);
        return null;
      }));
    }

    LOGGER.atDebug().addKeyValue("count", batch.size()).addKeyValue("remaining", queue.size())
        .log("Draining queue");

    CompletableFuture.allOf(batch.toArray(new CompletableFuture<?>[0])).whenComplete((v, e) -> {
      if (draining == current)
        draining = null;
      publishStatus();
      scheduleDrain();
    });
  }

  /**
   * Schedules another drain if the live connection is up, idle and has work. Batches that finish
   * on a replaced connection land here too, so requeued messages still reach its successor.
   */
  private void scheduleDrain() {
    if (disposed.get() || draining != null || queue.isEmpty())
      return;
    if (drainTimer != null && drainTimer.isPending())
      return;
    final Connection active = connection;
    if (active == null || !active.isConnected())
      return;
    drainTimer = loop.schedule(Duration.ZERO, this::drainQueue);
  }

  private void onDrained(Message message, Throwable cause) {
    if (cause == null) {
      emit(events, new ManagerEvent.MessageSent(message));
      return;
    }

    if (message.canRetry()) {
      final Message retry = message.withRetry();
      final EnqueueResult outcome = queue.offer(retry);
      if (outcome.isAccepted()) {
        LOGGER.atDebug().addKeyValue("id", message.id())
            .addKeyValue("retryCount", retry.retryCount()).log("Requeued failed message");
      } else {
        emit(events, new ManagerEvent.Error(
            "Failed to requeue message " + message.id() + ": " + outcome, message.id()));
      }
      return;
    }

    LOGGER.atWarn().addKeyValue("id", message.id())
        .addKeyValue("retryCount", message.retryCount()).log("Dropping message out of retries");
    emit(events, new ManagerEvent.Error(
        "Message " + message.id() + " dropped after " + message.retryCount() + " retries",
        message.id()));
  }

  private CompletableFuture<Void> doDispose() {
    userDisconnected = true;

    cancel(reconnectTimer);
    reconnectTimer = null;
    cancel(drainTimer);
    drainTimer = null;

    final CompletableFuture<Void> pending = connecting;
    connecting = null;
    if (pending != null)
      pending.completeExceptionally(new ConnectionFailedException("Manager disposed"));

    for (Subscription subscription : subscriptions)
      subscription.close();
    subscriptions.clear();

    final Connection current = connection;
    connection = null;

    final CompletableFuture<Void> closing =
        current != null ? current.dispose() : CompletableFuture.completedFuture(null);

    final CompletableFuture<Void> result = new CompletableFuture<>();
    closing.whenComplete((v, e) -> {
      if (e != null)
        LOGGER.atDebug().setCause(e).log("Connection dispose failed");
      disposed.set(true);
      states.close();
      events.close();
      connectionStates.close();
      messages.close();
      LOGGER.atInfo().addKeyValue("uri", config.uri()).log("Manager disposed");
      result.complete(null);
    });
    return result;
  }

  private ManagerState deriveState() {
    final Connection current = connection;
    final ConnectionState connectionState =
        current != null ? current.getState() : ConnectionState.INITIAL;
    if (connectionState == ConnectionState.CONNECTED)
      return ManagerState.CONNECTED;
    if (reconnecting)
      return ManagerState.RECONNECTING;
    if (connectionState == ConnectionState.CONNECTING)
      return ManagerState.CONNECTING;
    if (current == null || connectionState == ConnectionState.INITIAL)
      return status.state() == ManagerState.IDLE ? ManagerState.IDLE
          : ManagerState.DISCONNECTED;
    return ManagerState.DISCONNECTED;
  }

  private void publishStatus() {
    final Connection current = connection;
    final ManagerStatus next = new ManagerStatus(deriveState(),
        current != null ? current.getState() : status.connectionState(), reconnecting, attempt,
        queue.size());
    if (next.equals(status))
      return;
    status = next;
    emit(states, next);
  }

  private Metrics snapshot() {
    final Connection current = connection;
    return new Metrics(status.state(), status.connectionState(), reconnecting, attempt,
        queue.checkMetrics(), current != null ? current.checkMetrics() : null, config);
  }

  private Metrics flush() {
    final Connection current = connection;
    return new Metrics(status.state(), status.connectionState(), reconnecting, attempt,
        queue.flushMetrics(), current != null ? current.flushMetrics() : null, config);
  }

  private <T> void emit(DefaultTopic<T> topic, T event) {
    if (!topic.isClosed())
      topic.publish(event);
  }

  private static void cancel(Timer timer) {
    if (timer != null)
      timer.cancel();
  }

  @Override
  public String toString() {
    return "ConnectionManager [uri=" + config.uri() + ", state=" + status.state() + "]";
  }
}
