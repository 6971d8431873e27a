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

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;
import static java.util.Objects.requireNonNull;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.tether.core.Measureable;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.MessageKind;

/**
 * A bounded store of outbound messages waiting for a connection.
 * 
 * <p>
 * The queue is a sorted list rather than a heap. When priority ordering is enabled, the list is
 * re-sorted with {@link MessagePriority#COMPARATOR} after every insertion. The sort is stable, so
 * messages that compare equal keep their insertion order. When deduplication is enabled, no two
 * entries share an ID.
 * 
 * <p>
 * This class is not thread-safe. A {@link io.aleph0.tether.core.manager.ConnectionManager}
 * confines its queue to its event loop.
 */
public class MessageQueue implements Measureable<MessageQueue.Metrics> {
  private static final Logger LOGGER = LoggerFactory.getLogger(MessageQueue.class);

  public static final int DEFAULT_MAX_SIZE = 1000;

  public static record Metrics(
      /**
       * The number of messages currently in the queue
       */
      int size,

      /**
       * The maximum number of messages the queue holds
       */
      int capacity,

      /**
       * The size as a percentage of the capacity
       */
      double utilization,

      /**
       * The number of queued messages that can still be retried
       */
      int retryable,

      /**
       * The number of queued messages that require an acknowledgement
       */
      int ackRequired,

      /**
       * The number of queued messages of each kind
       */
      Map<MessageKind, Integer> kinds,

      /**
       * Whether priority ordering is enabled
       */
      boolean priorityEnabled,

      /**
       * Whether deduplication is enabled
       */
      boolean deduplicationEnabled,

      /**
       * The number of messages accepted
       */
      long enqueued,

      /**
       * The number of messages rejected as full or duplicate
       */
      long rejected,

      /**
       * The number of messages removed by dequeue
       */
      long dequeued) {
    public Metrics {
      requireNonNull(kinds);
      if (size < 0)
        throw new IllegalArgumentException("size must be at least zero");
      if (capacity < 0)
        throw new IllegalArgumentException("capacity must be at least zero");
      if (retryable < 0)
        throw new IllegalArgumentException("retryable must be at least zero");
      if (ackRequired < 0)
        throw new IllegalArgumentException("ackRequired must be at least zero");
      if (enqueued < 0)
        throw new IllegalArgumentException("enqueued must be at least zero");
      if (rejected < 0)
        throw new IllegalArgumentException("rejected must be at least zero");
      if (dequeued < 0)
        throw new IllegalArgumentException("dequeued must be at least zero");
      final Map<MessageKind, Integer> copy = new EnumMap<>(MessageKind.class);
      copy.putAll(kinds);
      kinds = unmodifiableMap(copy);
    }

    public Map<String, Object> toMap() {
      final Map<String, Object> result = new LinkedHashMap<>();
      result.put("size", size);
      result.put("maxSize", capacity);
      result.put("utilization", utilization);
      result.put("isEmpty", size == 0);
      result.put("isFull", size >= capacity);
      result.put("retryableCount", retryable);
      result.put("ackRequiredCount", ackRequired);
      final Map<String, Integer> byKind = new LinkedHashMap<>();
      kinds.forEach((kind, count) -> byKind.put(kind.getWireName(), count));
      result.put("kinds", byKind);
      result.put("enablePriority", priorityEnabled);
      result.put("enableDeduplication", deduplicationEnabled);
      result.put("enqueued", enqueued);
      result.put("rejected", rejected);
      result.put("dequeued", dequeued);
      return unmodifiableMap(result);
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public static class Builder {
    private int maxSize = DEFAULT_MAX_SIZE;
    private boolean priority = true;
    private boolean deduplication = true;

    public Builder setMaxSize(int maxSize) {
      this.maxSize = maxSize;
      return this;
    }

    public Builder setPriority(boolean priority) {
      this.priority = priority;
      return this;
    }

    public Builder setDeduplication(boolean deduplication) {
      this.deduplication = deduplication;
      return this;
    }

    public MessageQueue build() {
      return new MessageQueue(maxSize, priority, deduplication);
    }
  }

  private final List<Message> queue = new ArrayList<>();
  private final Set<String> ids = new HashSet<>();
  private final int maxSize;
  private final boolean priority;
  private final boolean deduplication;

  private long enqueued = 0;
  private long rejected = 0;
  private long dequeued = 0;

  public MessageQueue(int maxSize, boolean priority, boolean deduplication) {
    if (maxSize < 0)
      throw new IllegalArgumentException("maxSize must be at least zero");
    this.maxSize = maxSize;
    this.priority = priority;
    this.deduplication = deduplication;
  }

  /**
   * Adds a message unless the queue is full or, with deduplication enabled, already holds a
   * message with the same ID.
   * 
   * @param message the message
   * @return why the message was or was not accepted
   */
  public EnqueueResult offer(Message message) {
    requireNonNull(message, "message");

    if (queue.size() >= maxSize) {
      rejected = rejected + 1;
      LOGGER.atDebug().addKeyValue("id", message.id()).addKeyValue("size", queue.size())
          .log("Queue full, rejecting message");
      return EnqueueResult.QUEUE_FULL;
    }

    if (deduplication && ids.contains(message.id())) {
      rejected = rejected + 1;
      LOGGER.atDebug().addKeyValue("id", message.id()).log("Duplicate message, rejecting");
      return EnqueueResult.DUPLICATE;
    }

    queue.add(message);
    if (deduplication)
      ids.add(message.id());
    if (priority)
      sort();
    enqueued = enqueued + 1;

    return EnqueueResult.ACCEPTED;
  }

  /**
   * @return true if the message was added
   * @see #offer(Message)
   */
  public boolean enqueue(Message message) {
    return offer(message).isAccepted();
  }

  /**
   * Removes and returns the head of the queue.
   * 
   * @return the highest-priority message, or {@code null} if the queue is empty
   */
  public Message dequeue() {
    if (queue.isEmpty())
      return null;
    final Message result = queue.remove(0);
    ids.remove(result.id());
    dequeued = dequeued + 1;
    return result;
  }

  /**
   * @return the highest-priority message without removing it, or {@code null} if empty
   */
  public Message peek() {
    if (queue.isEmpty())
      return null;
    return queue.get(0);
  }

  /**
   * Removes the message with the given ID.
   * 
   * @return true if a message was removed
   */
  public boolean remove(String id) {
    requireNonNull(id, "id");
    for (Iterator<Message> iterator = queue.iterator(); iterator.hasNext();) {
      if (iterator.next().id().equals(id)) {
        iterator.remove();
        ids.remove(id);
        return true;
      }
    }
    return false;
  }

  public void clear() {
    queue.clear();
    ids.clear();
  }

  /**
   * Replaces the message with the given ID by its {@link Message#withRetry() retried} copy, if it
   * can still be retried.
   * 
   * @return true if the message was found and updated
   */
  public boolean updateRetryCount(String id) {
    requireNonNull(id, "id");
    for (int i = 0; i < queue.size(); i++) {
      final Message message = queue.get(i);
      if (message.id().equals(id)) {
        if (!message.canRetry())
          return false;
        queue.set(i, message.withRetry());
        if (priority)
          sort();
        return true;
      }
    }
    return false;
  }

  public int size() {
    return queue.size();
  }

  public boolean isEmpty() {
    return queue.isEmpty();
  }

  public boolean isFull() {
    return queue.size() >= maxSize;
  }

  public int getMaxSize() {
    return maxSize;
  }

  public boolean isPriorityEnabled() {
    return priority;
  }

  public boolean isDeduplicationEnabled() {
    return deduplication;
  }

  /**
   * @return a snapshot of the queued messages in delivery order
   */
  public List<Message> messages() {
    return unmodifiableList(new ArrayList<>(queue));
  }

  private void sort() {
    queue.sort(MessagePriority.COMPARATOR);
  }

  @Override
  public Metrics checkMetrics() {
    int retryable = 0;
    int ackRequired = 0;
    final Map<MessageKind, Integer> kinds = new EnumMap<>(MessageKind.class);
    for (Message message : queue) {
      if (message.canRetry())
        retryable = retryable + 1;
      if (message.requiresAck())
        ackRequired = ackRequired + 1;
      kinds.merge(message.kind(), 1, Integer::sum);
    }
    final double utilization = maxSize == 0 ? 100.0 : 100.0 * queue.size() / maxSize;
    return new Metrics(queue.size(), maxSize, utilization, retryable, ackRequired, kinds,
        priority, deduplication, enqueued, rejected, dequeued);
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics result = checkMetrics();
    enqueued = 0;
    rejected = 0;
    dequeued = 0;
    return result;
  }

  @Override
  public String toString() {
    return "MessageQueue [size=" + queue.size() + ", maxSize=" + maxSize + ", priority="
        + priority + ", deduplication=" + deduplication + "]";
  }
}
