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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import io.aleph0.tether.core.Config;
import io.aleph0.tether.core.ConnectionFailedException;
import io.aleph0.tether.core.ConnectionState;
import io.aleph0.tether.core.Eventually;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.Payload;
import io.aleph0.tether.core.ReconnectionFailedException;
import io.aleph0.tether.core.codec.QueueCodec;
import io.aleph0.tether.core.loop.EventLoop;
import io.aleph0.tether.core.policy.FixedDelayPolicy;
import io.aleph0.tether.core.policy.ReconnectionPolicyType;
import io.aleph0.tether.core.queue.MessageQueue;
import io.aleph0.tether.core.transport.Frame;
import io.aleph0.tether.core.transport.simulated.SimulatedTransport;
import io.aleph0.tether.core.transport.simulated.SimulatedTransport.OpenBehavior;

class ConnectionManagerTest {
  private static final URI ENDPOINT = URI.create("ws://simulated/stream");

  private static final Duration RETRY_DELAY = Duration.ofMillis(10);

  private EventLoop loop;
  private SimulatedTransport transport;
  private ConnectionManager manager;
  private final List<ManagerEvent> events = new CopyOnWriteArrayList<>();
  private final List<ConnectionState> connectionStates = new CopyOnWriteArrayList<>();
  private final List<Message> received = new CopyOnWriteArrayList<>();

  @BeforeEach
  void setupConnectionManagerTest() {
    loop = EventLoop.create("manager-test");
    transport = new SimulatedTransport();
  }

  @AfterEach
  void cleanupConnectionManagerTest() throws Exception {
    if (manager != null)
      manager.dispose().get();
    loop.close();
  }

  /**
   * No reconnection, but queuing on.
   */
  private static Config queueing() {
    return Config.testing(ENDPOINT).toBuilder().setEnableMessageQueue(true).setMaxQueueSize(10)
        .build();
  }

  /**
   * Reconnection on, with a short fixed delay and the given number of attempts.
   */
  private static Config reconnecting(int maxAttempts) {
    return queueing().toBuilder().setEnableReconnection(true)
        .setReconnectionPolicy(ReconnectionPolicyType.FIXED)
        .setInitialReconnectionDelay(RETRY_DELAY).setMaxReconnectionAttempts(maxAttempts)
        .build();
  }

  private ConnectionManager newManager(Config config) {
    manager = ConnectionManager.builder().setConfig(config).setTransport(transport)
        .setEventLoop(loop).build();
    manager.events().subscribe(events::add);
    manager.connectionStates().subscribe(connectionStates::add);
    manager.messages().subscribe(received::add);
    return manager;
  }

  private <T extends ManagerEvent> List<T> eventsOfType(Class<T> type) {
    return events.stream().filter(type::isInstance).map(type::cast)
        .collect(Collectors.toList());
  }

  @Test
  @Timeout(5)
  void givenSucceedingTransport_whenConnect_thenConnected() throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());

    // Act
    manager.connect().get();

    // Assert
    assertThat(manager.isConnected()).isTrue();
    assertThat(manager.getState()).isEqualTo(ManagerState.CONNECTED);
    assertThat(manager.getConnectionState()).isEqualTo(ConnectionState.CONNECTED);
    assertThat(events).containsSubsequence(new ManagerEvent.Connecting(),
        new ManagerEvent.Connected());
    assertThat(connectionStates).containsExactly(ConnectionState.CONNECTING,
        ConnectionState.CONNECTED);
  }

  @Test
  @Timeout(5)
  void givenReconnectionDisabledAndFailingTransport_whenConnect_thenFailsOnceWithoutTimers()
      throws Exception {
    // Arrange
    transport.setDefaultOpenBehavior(OpenBehavior.FAIL);
    final ConnectionManager manager = newManager(Config.testing(ENDPOINT));

    // Act
    assertThatThrownBy(() -> manager.connect().get())
        .hasCauseInstanceOf(ConnectionFailedException.class);
    manager.dispose().get();

    // Assert
    assertThat(connectionStates).filteredOn(s -> s == ConnectionState.FAILED).hasSize(1);
    assertThat(eventsOfType(ManagerEvent.ConnectionFailed.class)).hasSize(1);
    assertThat(eventsOfType(ManagerEvent.Reconnecting.class)).isEmpty();
    assertThat(eventsOfType(ManagerEvent.ReconnectionFailed.class)).isEmpty();
    assertThat(transport.getOpenAttempts()).isEqualTo(1);
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenAlwaysFailingTransport_whenConnect_thenGivesUpAfterMaxAttempts() throws Exception {
    // Arrange
    transport.setDefaultOpenBehavior(OpenBehavior.FAIL);
    final ConnectionManager manager = newManager(reconnecting(2));

    // Act
    assertThatThrownBy(() -> manager.connect().get())
        .hasCauseInstanceOf(ReconnectionFailedException.class);

    // Assert
    assertThat(transport.getOpenAttempts()).isEqualTo(3);
    assertThat(eventsOfType(ManagerEvent.Reconnecting.class))
        .containsExactly(new ManagerEvent.Reconnecting(1), new ManagerEvent.Reconnecting(2));
    assertThat(eventsOfType(ManagerEvent.ReconnectionFailed.class)).containsExactly(
        new ManagerEvent.ReconnectionFailed(ConnectionManager.MAX_ATTEMPTS_REACHED));
    assertThat(events).containsSubsequence(new ManagerEvent.ConnectionFailed(
        "Connection error: simulated open failure 1"), new ManagerEvent.Reconnecting(1));
    assertThat(manager.getStatus().reconnecting()).isFalse();
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenTransientFailures_whenConnect_thenReconnectsAndResetsAttempts() throws Exception {
    transport.script(OpenBehavior.FAIL, OpenBehavior.FAIL);
    final ConnectionManager manager = newManager(reconnecting(5));

    manager.connect().get();

    assertThat(manager.isConnected()).isTrue();
    assertThat(transport.getOpenAttempts()).isEqualTo(3);
    assertThat(manager.getStatus().reconnectionAttempt()).isZero();
    assertThat(manager.getStatus().reconnecting()).isFalse();
  }

  @Test
  @Timeout(5)
  void givenConnected_whenPeerCloses_thenReconnects() throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(reconnecting(3));
    manager.connect().get();

    // Act
    transport.getLastSession().closeRemotely(SimulatedTransport.ABNORMAL_CLOSE, "gone");
    Eventually.await(() -> transport.getSessions().size() == 2 && manager.isConnected());

    // Assert
    assertThat(events).containsSubsequence(new ManagerEvent.Connected(),
        new ManagerEvent.Disconnected(), new ManagerEvent.Reconnecting(1),
        new ManagerEvent.Connecting(), new ManagerEvent.Connected());
  }

  @Test
  @Timeout(5)
  void givenConnected_whenUserDisconnects_thenDoesNotReconnect() throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(reconnecting(3));
    manager.connect().get();

    // Act
    manager.disconnect().get();
    Thread.sleep(RETRY_DELAY.multipliedBy(10).toMillis());

    // Assert
    assertThat(transport.getOpenAttempts()).isEqualTo(1);
    assertThat(manager.getState()).isEqualTo(ManagerState.DISCONNECTED);
    assertThat(eventsOfType(ManagerEvent.Reconnecting.class)).isEmpty();
    assertThat(eventsOfType(ManagerEvent.Disconnected.class)).hasSize(1);
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenReconnectPending_whenDisconnect_thenCampaignCancelled() throws Exception {
    transport.setDefaultOpenBehavior(OpenBehavior.FAIL);
    final ConnectionManager manager = newManager(reconnecting(100).toBuilder()
        .setInitialReconnectionDelay(Duration.ofHours(1)).build());
    manager.connect().exceptionally(e -> null);
    Eventually.await(() -> !eventsOfType(ManagerEvent.Reconnecting.class).isEmpty());

    manager.disconnect().get();

    assertThat(loop.pendingTimers()).isZero();
    assertThat(manager.getStatus().reconnecting()).isFalse();
  }

  @Test
  @Timeout(5)
  void givenMessagesQueuedWhileDisconnected_whenConnect_thenDeliveredInPriorityOrder()
      throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());
    final Message plain = Message.text("plain");
    final Message ack =
        Message.builder(new Payload.Text("ack")).setRequiresAck(true).build();
    final Message ping = Message.ping();
    assertThat(manager.send(plain).get()).isTrue();
    assertThat(manager.send(ack).get()).isTrue();
    assertThat(manager.send(ping).get()).isTrue();
    assertThat(manager.getStatus().queueSize()).isEqualTo(3);

    // Act
    manager.connect().get();
    Eventually.await(() -> eventsOfType(ManagerEvent.MessageSent.class).size() == 3);

    // Assert
    assertThat(transport.getLastSession().getSentFrames()).containsExactly(Frame.text("ping"),
        Frame.text("ack"), Frame.text("plain"));
    assertThat(eventsOfType(ManagerEvent.MessageQueued.class)).hasSize(3);
    Eventually.await(() -> manager.getStatus().queueSize() == 0);
  }

  @Test
  @Timeout(5)
  void givenMoreMessagesThanBatch_whenConnect_thenAllDrained() throws Exception {
    final ConnectionManager manager =
        newManager(queueing().toBuilder().setDrainBatchSize(2).build());
    for (int i = 0; i < 7; i++)
      manager.sendText("m" + i).get();

    manager.connect().get();
    Eventually.await(() -> transport.getLastSession().getSentFrames().size() == 7);

    assertThat(transport.getLastSession().getSentFrames()).containsExactly(Frame.text("m0"),
        Frame.text("m1"), Frame.text("m2"), Frame.text("m3"), Frame.text("m4"),
        Frame.text("m5"), Frame.text("m6"));
    Eventually.await(() -> loop.pendingTimers() == 0);
  }

  @Test
  @Timeout(5)
  void givenMessageWithoutRetries_whenDrainFails_thenDroppedWithOneError() throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());
    final Message fragile =
        Message.builder(new Payload.Text("fragile")).setId("fragile").setMaxRetries(0).build();
    manager.send(fragile).get();
    transport.setFailSends(true);

    // Act
    manager.connect().get();
    Eventually.await(() -> !eventsOfType(ManagerEvent.Error.class).isEmpty());
    loop.call(() -> null).get();

    // Assert
    assertThat(eventsOfType(ManagerEvent.Error.class)).containsExactly(
        new ManagerEvent.Error("Message fragile dropped after 0 retries", "fragile"));
    assertThat(manager.getStatus().queueSize()).isZero();
  }

  @Test
  @Timeout(5)
  void givenRetryableMessage_whenDrainKeepsFailing_thenRetriedThenDropped() throws Exception {
    final ConnectionManager manager = newManager(queueing());
    manager.send(Message.builder(new Payload.Text("x")).setId("x").setMaxRetries(2).build())
        .get();
    transport.setFailSends(true);

    manager.connect().get();
    Eventually.await(() -> !eventsOfType(ManagerEvent.Error.class).isEmpty());

    assertThat(eventsOfType(ManagerEvent.Error.class))
        .containsExactly(new ManagerEvent.Error("Message x dropped after 2 retries", "x"));
    assertThat(transport.getLastSession().getSentFrames()).isEmpty();
  }

  @Test
  @Timeout(5)
  void givenStalledBatch_whenPeerClosesAndReconnects_thenBatchResentOnNewSession()
      throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(reconnecting(3));
    manager.send(Message.text("a")).get();
    manager.send(Message.text("b")).get();
    transport.setHoldSends(true);
    manager.connect().get();
    final SimulatedTransport.SimulatedSession stalled = transport.getLastSession();
    Eventually.await(() -> stalled.getHeldFrames().size() == 2);

    // Act
    transport.setHoldSends(false);
    stalled.closeRemotely(SimulatedTransport.ABNORMAL_CLOSE, "gone");
    Eventually.await(() -> transport.getSessions().size() == 2
        && transport.getLastSession().getSentFrames().size() == 2);

    // Assert
    assertThat(transport.getLastSession().getSentFrames())
        .containsExactlyInAnyOrder(Frame.text("a"), Frame.text("b"));
    assertThat(manager.getStatus().queueSize()).isZero();
  }

  @Test
  @Timeout(5)
  void givenStalledBatchWasAbandoned_whenLaterConnect_thenQueueStillDrains() throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());
    manager.send(Message.text("a")).get();
    transport.setHoldSends(true);
    manager.connect().get();
    Eventually.await(() -> transport.getLastSession().getHeldFrames().size() == 1);
    manager.disconnect().get();
    transport.setHoldSends(false);

    // Act
    manager.send(Message.text("c")).get();
    manager.connect().get();
    Eventually.await(() -> transport.getLastSession().getSentFrames().size() == 2);

    // Assert
    assertThat(transport.getSessions()).hasSize(2);
    assertThat(transport.getLastSession().getSentFrames())
        .containsExactlyInAnyOrder(Frame.text("a"), Frame.text("c"));
  }

  @Test
  @Timeout(5)
  void givenImmediateReconnect_whenStalledBatchFails_thenRequeuedMessagesDrained()
      throws Exception {
    // Arrange
    final Config config = reconnecting(3).toBuilder().setInitialReconnectionDelay(Duration.ZERO)
        .build();
    final ConnectionManager manager = newManager(config);
    manager.send(Message.text("a")).get();
    manager.send(Message.text("b")).get();
    transport.setHoldSends(true);
    manager.connect().get();
    final SimulatedTransport.SimulatedSession stalled = transport.getLastSession();
    Eventually.await(() -> stalled.getHeldFrames().size() == 2);

    // Act
    transport.setHoldSends(false);
    stalled.fail(new IOException("reset"));
    Eventually.await(() -> transport.getSessions().size() == 2
        && transport.getLastSession().getSentFrames().size() == 2);

    // Assert
    assertThat(transport.getLastSession().getSentFrames())
        .containsExactlyInAnyOrder(Frame.text("a"), Frame.text("b"));
    Eventually.await(() -> manager.getStatus().queueSize() == 0);
  }

  @Test
  @Timeout(5)
  void givenConnected_whenImmediateSendFails_thenErrorEmittedAndMessageQueued()
      throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());
    manager.connect().get();
    transport.setFailSends(true);
    final Message message = Message.builder(new Payload.Text("late")).setId("late").build();

    // Act
    final boolean accepted = manager.send(message).get();

    // Assert
    assertThat(accepted).isTrue();
    assertThat(eventsOfType(ManagerEvent.Error.class))
        .containsExactly(new ManagerEvent.Error("Failed to send message late", "late"));
    assertThat(eventsOfType(ManagerEvent.MessageQueued.class)).hasSize(1);
    assertThat(manager.getStatus().queueSize()).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenRestoredQueue_whenConnect_thenStoredMessagesSent() throws Exception {
    // Arrange
    final MessageQueue stored = MessageQueue.builder().setMaxSize(10).build();
    stored.enqueue(Message.text("from-last-run"));
    final MessageQueue restored = new QueueCodec().decode(new QueueCodec().encode(stored));
    manager = ConnectionManager.builder().setConfig(queueing()).setTransport(transport)
        .setEventLoop(loop).setQueue(restored).build();

    // Act
    manager.connect().get();
    Eventually.await(() -> !transport.getLastSession().getSentFrames().isEmpty());

    // Assert
    assertThat(transport.getLastSession().getSentFrames())
        .containsExactly(Frame.text("from-last-run"));
  }

  @Test
  @Timeout(5)
  void givenConnected_whenSend_thenSentImmediately() throws Exception {
    final ConnectionManager manager = newManager(queueing());
    manager.connect().get();

    final boolean accepted = manager.sendText("hello").get();

    assertThat(accepted).isTrue();
    assertThat(transport.getLastSession().getSentFrames()).containsExactly(Frame.text("hello"));
    assertThat(eventsOfType(ManagerEvent.MessageSent.class)).hasSize(1);
    assertThat(eventsOfType(ManagerEvent.MessageQueued.class)).isEmpty();
  }

  @Test
  @Timeout(5)
  void givenQueueDisabled_whenSendWhileDisconnected_thenRejected() throws Exception {
    final ConnectionManager manager = newManager(Config.testing(ENDPOINT));

    assertThat(manager.sendText("lost").get()).isFalse();
    assertThat(eventsOfType(ManagerEvent.MessageQueued.class)).isEmpty();
  }

  @Test
  @Timeout(5)
  void givenFullQueue_whenSend_thenErrorNamesMessage() throws Exception {
    final ConnectionManager manager =
        newManager(queueing().toBuilder().setMaxQueueSize(1).build());
    manager.sendText("first").get();
    final Message second = Message.text("second");

    final boolean accepted = manager.send(second).get();

    assertThat(accepted).isFalse();
    assertThat(eventsOfType(ManagerEvent.Error.class)).singleElement()
        .extracting(ManagerEvent.Error::messageId).isEqualTo(second.id());
  }

  @Test
  @Timeout(5)
  void givenConnected_whenMessageArrives_thenRelayed() throws Exception {
    final ConnectionManager manager = newManager(queueing());
    manager.connect().get();

    transport.getLastSession().deliver(Frame.text("hello"));
    Eventually.await(() -> received.size() == 1);

    assertThat(received.get(0).payload()).isEqualTo(new Payload.Text("hello"));
  }

  @Test
  @Timeout(5)
  void givenConnected_whenGetStatistics_thenSnapshotIncludesQueueAndConnection()
      throws Exception {
    // Arrange
    final ConnectionManager manager = newManager(queueing());
    manager.connect().get();
    manager.sendText("hello").get();

    // Act
    final ConnectionManager.Metrics metrics = manager.getStatistics().get();
    final Map<String, Object> map = metrics.toMap();

    // Assert
    assertThat(metrics.isConnected()).isTrue();
    assertThat(metrics.connection().messagesSent()).isEqualTo(1);
    assertThat(metrics.queue().capacity()).isEqualTo(10);
    assertThat(map).containsKeys("state", "connectionState", "isConnected", "isReconnecting",
        "reconnectionAttempt", "queueStatistics", "connectionStatistics", "config");
    assertThat(map.get("config")).isInstanceOf(Map.class);
  }

  @Test
  @Timeout(5)
  void givenNoEventLoop_whenDispose_thenOwnLoopClosed() throws Exception {
    final ConnectionManager owner = ConnectionManager.builder().setConfig(queueing())
        .setTransport(transport).build();
    owner.connect().get();

    owner.dispose().get();

    assertThat(owner.getEventLoop().isClosed()).isTrue();
    assertThat(owner.dispose()).isDone();
  }

  @Test
  @Timeout(5)
  void givenDisposed_whenConnect_thenFails() throws Exception {
    final ConnectionManager manager = newManager(queueing());
    manager.dispose().get();

    assertThatThrownBy(() -> manager.connect().get())
        .hasCauseInstanceOf(ConnectionFailedException.class);
    assertThat(manager.sendText("x").get()).isFalse();
  }

  @Test
  void givenMissingTransport_whenBuild_thenIllegalState() {
    assertThatThrownBy(() -> ConnectionManager.builder().setConfig(queueing()).build())
        .isInstanceOf(IllegalStateException.class);
  }

  @Test
  @Timeout(5)
  void givenCustomPolicy_whenBuild_thenUsed() throws Exception {
    transport.script(OpenBehavior.FAIL);
    manager = ConnectionManager.builder().setConfig(reconnecting(1)).setTransport(transport)
        .setEventLoop(loop).setReconnectionPolicy(new FixedDelayPolicy(Duration.ofMillis(1)))
        .build();

    manager.connect().get();

    assertThat(transport.getOpenAttempts()).isEqualTo(2);
  }
}
