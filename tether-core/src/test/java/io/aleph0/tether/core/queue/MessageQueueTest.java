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
package io.aleph0.tether.core.queue;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.MessageKind;
import io.aleph0.tether.core.Payload;

class MessageQueueTest {
  private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

  private static Message text(String id, int secondsAfterT0) {
    return Message.builder(new Payload.Text(id)).setId(id)
        .setCreatedAt(T0.plusSeconds(secondsAfterT0)).build();
  }

  private static List<String> ids(List<Message> messages) {
    return messages.stream().map(Message::id).collect(Collectors.toList());
  }

  @Test
  void givenFullQueue_whenEnqueue_thenRejectedAndSizeUnchanged() {
    // Arrange
    final MessageQueue queue = MessageQueue.builder().setMaxSize(2).build();
    queue.enqueue(text("a", 0));
    queue.enqueue(text("b", 1));

    // Act
    final EnqueueResult result = queue.offer(text("c", 2));

    // Assert
    assertThat(result).isEqualTo(EnqueueResult.QUEUE_FULL);
    assertThat(queue.enqueue(text("d", 3))).isFalse();
    assertThat(queue.size()).isEqualTo(2);
    assertThat(queue.isFull()).isTrue();
  }

  @Test
  void givenDeduplication_whenEnqueueSameIdTwice_thenSecondRejected() {
    final MessageQueue queue = MessageQueue.builder().build();

    assertThat(queue.offer(text("a", 0))).isEqualTo(EnqueueResult.ACCEPTED);
    assertThat(queue.offer(text("a", 1))).isEqualTo(EnqueueResult.DUPLICATE);
    assertThat(queue.size()).isEqualTo(1);
  }

  @Test
  void givenNoDeduplication_whenEnqueueSameIdTwice_thenBothAccepted() {
    final MessageQueue queue = MessageQueue.builder().setDeduplication(false).build();

    assertThat(queue.enqueue(text("a", 0))).isTrue();
    assertThat(queue.enqueue(text("a", 1))).isTrue();
    assertThat(queue.size()).isEqualTo(2);
  }

  @Test
  void givenDequeuedMessage_whenEnqueueSameIdAgain_thenAccepted() {
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(text("a", 0));

    final Message head = queue.dequeue();

    assertThat(queue.enqueue(head.withRetry())).isTrue();
  }

  @Test
  void givenMixedMessages_whenDequeue_thenControlThenAckThenPlain() {
    // Arrange
    final MessageQueue queue = MessageQueue.builder().build();
    final Message plain = text("plain", 0);
    final Message ack = Message.builder(new Payload.Text("ack")).setId("ack")
        .setRequiresAck(true).setCreatedAt(T0.plusSeconds(1)).build();
    final Message ping = Message.builder(new Payload.Control(Payload.Control.Token.PING))
        .setId("ping").setCreatedAt(T0.plusSeconds(2)).build();

    // Act
    queue.enqueue(plain);
    queue.enqueue(ack);
    queue.enqueue(ping);

    // Assert
    assertThat(queue.dequeue()).isEqualTo(ping);
    assertThat(queue.dequeue()).isEqualTo(ack);
    assertThat(queue.dequeue()).isEqualTo(plain);
    assertThat(queue.dequeue()).isNull();
  }

  @Test
  void givenEqualPriority_whenDequeue_thenOlderFirstAndInsertionOrderOnTies() {
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(text("late", 5));
    queue.enqueue(text("tie1", 1));
    queue.enqueue(text("early", 0));
    queue.enqueue(text("tie2", 1));

    assertThat(ids(queue.messages())).containsExactly("early", "tie1", "tie2", "late");
  }

  @Test
  void givenRetriedMessage_whenSorted_thenFewerRetriesFirst() {
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(text("retried", 0).withRetry());
    queue.enqueue(text("fresh", 1));

    assertThat(queue.peek().id()).isEqualTo("fresh");
  }

  @Test
  void givenPriorityDisabled_whenDequeue_thenInsertionOrder() {
    final MessageQueue queue = MessageQueue.builder().setPriority(false).build();
    queue.enqueue(text("plain", 0));
    queue.enqueue(Message.builder(new Payload.Control(Payload.Control.Token.PING)).setId("ping")
        .build());

    assertThat(queue.dequeue().id()).isEqualTo("plain");
  }

  @Test
  void givenQueuedMessage_whenUpdateRetryCount_thenRetriedUntilExhausted() {
    // Arrange
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(Message.builder(new Payload.Text("x")).setId("x").setMaxRetries(1).build());

    // Act & Assert
    assertThat(queue.updateRetryCount("x")).isTrue();
    assertThat(queue.peek().retryCount()).isEqualTo(1);
    assertThat(queue.updateRetryCount("x")).isFalse();
    assertThat(queue.updateRetryCount("missing")).isFalse();
  }

  @Test
  void givenQueuedMessages_whenRemoveAndClear_thenIdsReleased() {
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(text("a", 0));
    queue.enqueue(text("b", 1));

    assertThat(queue.remove("a")).isTrue();
    assertThat(queue.remove("a")).isFalse();
    assertThat(queue.enqueue(text("a", 2))).isTrue();

    queue.clear();

    assertThat(queue.isEmpty()).isTrue();
    assertThat(queue.enqueue(text("b", 3))).isTrue();
  }

  @Test
  void givenQueuedMessages_whenCheckMetrics_thenReportsBreakdown() {
    // Arrange
    final MessageQueue queue = MessageQueue.builder().setMaxSize(4).build();
    queue.enqueue(text("a", 0));
    queue.enqueue(Message.builder(new Payload.Text("b")).setId("b").setRequiresAck(true)
        .setMaxRetries(0).build());
    queue.enqueue(Message.ping());
    queue.offer(text("a", 1));

    // Act
    final MessageQueue.Metrics metrics = queue.checkMetrics();

    // Assert
    assertThat(metrics.size()).isEqualTo(3);
    assertThat(metrics.capacity()).isEqualTo(4);
    assertThat(metrics.utilization()).isEqualTo(75.0);
    assertThat(metrics.retryable()).isEqualTo(2);
    assertThat(metrics.ackRequired()).isEqualTo(1);
    assertThat(metrics.kinds()).containsEntry(MessageKind.TEXT, 2)
        .containsEntry(MessageKind.PING, 1).doesNotContainKey(MessageKind.BINARY);
    assertThat(metrics.enqueued()).isEqualTo(3);
    assertThat(metrics.rejected()).isEqualTo(1);
    assertThat(metrics.toMap()).containsEntry("isFull", false).containsEntry("size", 3);
  }

  @Test
  void givenCounters_whenFlushMetrics_thenCountersResetButSizeKept() {
    final MessageQueue queue = MessageQueue.builder().build();
    queue.enqueue(text("a", 0));
    queue.enqueue(text("b", 1));
    queue.dequeue();

    final MessageQueue.Metrics flushed = queue.flushMetrics();
    final MessageQueue.Metrics after = queue.checkMetrics();

    assertThat(flushed.enqueued()).isEqualTo(2);
    assertThat(flushed.dequeued()).isEqualTo(1);
    assertThat(after.enqueued()).isZero();
    assertThat(after.dequeued()).isZero();
    assertThat(after.size()).isEqualTo(1);
  }
}
