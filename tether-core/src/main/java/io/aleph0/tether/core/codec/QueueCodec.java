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
package io.aleph0.tether.core.codec;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.queue.EnqueueResult;
import io.aleph0.tether.core.queue.MessageQueue;

/**
 * Persists a {@link MessageQueue}, settings and pending messages, as JSON so that messages
 * survive a process restart. The rebuilt queue can be handed to
 * {@link io.aleph0.tether.core.manager.ConnectionManager.Builder#setQueue(MessageQueue)}.
 */
public class QueueCodec {
  private static final Logger LOGGER = LoggerFactory.getLogger(QueueCodec.class);

  public static final String MAX_SIZE = "maxSize";
  public static final String PRIORITY = "priority";
  public static final String DEDUPLICATION = "deduplication";
  public static final String MESSAGES = "messages";

  private final ObjectMapper mapper;
  private final MessageCodec messageCodec;

  public QueueCodec() {
    this(Json.mapper());
  }

  public QueueCodec(ObjectMapper mapper) {
    this.mapper = requireNonNull(mapper, "mapper");
    this.messageCodec = new MessageCodec(mapper);
  }

  public ObjectNode toTree(MessageQueue queue) {
    requireNonNull(queue, "queue");
    final ObjectNode result = mapper.createObjectNode();
    result.put(MAX_SIZE, queue.getMaxSize());
    result.put(PRIORITY, queue.isPriorityEnabled());
    result.put(DEDUPLICATION, queue.isDeduplicationEnabled());
    final ArrayNode messages = result.putArray(MESSAGES);
    for (Message message : queue.messages())
      messages.add(messageCodec.toTree(message));
    return result;
  }

  /**
   * Rebuilds a queue. Messages the queue rejects, for example because the stored capacity is now
   * exceeded, are logged and skipped.
   */
  public MessageQueue fromTree(JsonNode tree) throws IOException {
    requireNonNull(tree, "tree");
    if (!tree.isObject())
      throw new IOException("queue must be a JSON object");

    final MessageQueue result;
    try {
      result = MessageQueue.builder()
          .setMaxSize(tree.path(MAX_SIZE).asInt(MessageQueue.DEFAULT_MAX_SIZE))
          .setPriority(tree.path(PRIORITY).asBoolean(true))
          .setDeduplication(tree.path(DEDUPLICATION).asBoolean(true)).build();
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid queue settings", e);
    }

    final JsonNode messages = tree.path(MESSAGES);
    if (!messages.isMissingNode() && !messages.isArray())
      throw new IOException("messages must be an array");

    for (JsonNode node : messages) {
      final Message message = messageCodec.fromTree(node);
      final EnqueueResult outcome = result.offer(message);
      if (!outcome.isAccepted()) {
        LOGGER.atWarn().addKeyValue("id", message.id()).addKeyValue("result", outcome)
            .log("Dropping stored message rejected by queue");
      }
    }

    return result;
  }

  public String encode(MessageQueue queue) {
    try {
      return mapper.writeValueAsString(toTree(queue));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  public MessageQueue decode(String json) throws IOException {
    requireNonNull(json, "json");
    return fromTree(mapper.readTree(json));
  }
}
