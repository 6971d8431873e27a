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
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.MessageKind;
import io.aleph0.tether.core.Payload;

/**
 * Converts {@link Message} instances to and from their JSON interchange form:
 * 
 * <pre>
 * {
 *   "id": "...",
 *   "type": "text" | "binary" | "json" | "ping" | "pong",
 *   "data": ...,
 *   "timestamp": "2025-01-01T00:00:00Z",
 *   "requiresAck": false,
 *   "retryCount": 0,
 *   "maxRetries": 3
 * }
 * </pre>
 * 
 * <p>
 * Binary data is base64-encoded. Structured data is embedded as-is. Control messages carry their
 * literal token. When decoding, {@code requiresAck}, {@code retryCount}, {@code maxRetries} and
 * {@code timestamp} are optional.
 */
public class MessageCodec {
  public static final String ID = "id";
  public static final String TYPE = "type";
  public static final String DATA = "data";
  public static final String TIMESTAMP = "timestamp";
  public static final String REQUIRES_ACK = "requiresAck";
  public static final String RETRY_COUNT = "retryCount";
  public static final String MAX_RETRIES = "maxRetries";

  private final ObjectMapper mapper;

  public MessageCodec() {
    this(Json.mapper());
  }

  public MessageCodec(ObjectMapper mapper) {
    this.mapper = requireNonNull(mapper, "mapper");
  }

  public ObjectNode toTree(Message message) {
    requireNonNull(message, "message");

    final ObjectNode result = mapper.createObjectNode();
    result.put(ID, message.id());
    result.put(TYPE, message.kind().getWireName());

    final Payload payload = message.payload();
    if (payload instanceof Payload.Text text) {
      result.put(DATA, text.text());
    } else if (payload instanceof Payload.Binary binary) {
      result.put(DATA, Base64.getEncoder().encodeToString(binary.bytes()));
    } else if (payload instanceof Payload.Structured structured) {
      result.set(DATA, structured.document());
    } else if (payload instanceof Payload.Control control) {
      result.put(DATA, control.token().getLiteral());
    } else {
      throw new AssertionError("unknown payload " + payload.getClass());
    }

    result.put(TIMESTAMP, message.createdAt().toString());
    result.put(REQUIRES_ACK, message.requiresAck());
    result.put(RETRY_COUNT, message.retryCount());
    result.put(MAX_RETRIES, message.maxRetries());

    return result;
  }

  public Message fromTree(JsonNode tree) throws IOException {
    requireNonNull(tree, "tree");
    if (!tree.isObject())
      throw new IOException("message must be a JSON object");

    final String id = requiredText(tree, ID);
    final MessageKind kind;
    try {
      kind = MessageKind.fromWireName(requiredText(tree, TYPE));
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid message type", e);
    }

    final JsonNode data = tree.get(DATA);
    final Payload payload;
    switch (kind) {
      case TEXT:
        if (data == null || !data.isTextual())
          throw new IOException("text message data must be a string");
        payload = new Payload.Text(data.textValue());
        break;
      case BINARY:
        if (data == null || !data.isTextual())
          throw new IOException("binary message data must be a base64 string");
        try {
          payload = new Payload.Binary(Base64.getDecoder().decode(data.textValue()));
        } catch (IllegalArgumentException e) {
          throw new IOException("binary message data must be a base64 string", e);
        }
        break;
      case STRUCTURED:
        if (data == null || !data.isContainerNode())
          throw new IOException("json message data must be an object or array");
        payload = new Payload.Structured(data);
        break;
      case PING:
        payload = new Payload.Control(Payload.Control.Token.PING);
        break;
      case PONG:
        payload = new Payload.Control(Payload.Control.Token.PONG);
        break;
      default:
        throw new AssertionError("unknown kind " + kind);
    }

    final Message.Builder builder = Message.builder(payload).setId(id);

    final JsonNode timestamp = tree.get(TIMESTAMP);
    if (timestamp != null && !timestamp.isNull()) {
      try {
        builder.setCreatedAt(Instant.parse(timestamp.asText()));
      } catch (DateTimeParseException e) {
        throw new IOException("invalid timestamp " + timestamp.asText(), e);
      }
    }

    builder.setRequiresAck(tree.path(REQUIRES_ACK).asBoolean(false));
    builder.setRetryCount(tree.path(RETRY_COUNT).asInt(0));
    builder.setMaxRetries(tree.path(MAX_RETRIES).asInt(Message.DEFAULT_MAX_RETRIES));

    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid message", e);
    }
  }

  public String encode(Message message) {
    try {
      return mapper.writeValueAsString(toTree(message));
    } catch (JsonProcessingException e) {
      // A tree of plain nodes always serializes
      throw new IllegalStateException(e);
    }
  }

  public Message decode(String json) throws IOException {
    requireNonNull(json, "json");
    return fromTree(mapper.readTree(json));
  }

  static String requiredText(JsonNode tree, String field) throws IOException {
    final JsonNode value = tree.get(field);
    if (value == null || !value.isTextual())
      throw new IOException("missing or non-string field " + field);
    return value.textValue();
  }
}
