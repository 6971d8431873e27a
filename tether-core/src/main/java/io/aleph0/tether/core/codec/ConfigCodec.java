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
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aleph0.tether.core.Config;
import io.aleph0.tether.core.policy.ReconnectionPolicyType;

/**
 * Converts {@link Config} instances to and from JSON. Durations are written as whole
 * milliseconds. Every field except {@code uri} is optional when decoding and falls back to the
 * {@code Config.DEFAULT_*} value.
 */
public class ConfigCodec {
  public static final String URI = "uri";
  public static final String CONNECTION_TIMEOUT = "connectionTimeout";
  public static final String ENABLE_RECONNECTION = "enableReconnection";
  public static final String MAX_RECONNECTION_ATTEMPTS = "maxReconnectionAttempts";
  public static final String RECONNECTION_POLICY = "reconnectionPolicy";
  public static final String INITIAL_RECONNECTION_DELAY = "initialReconnectionDelay";
  public static final String MAX_RECONNECTION_DELAY = "maxReconnectionDelay";
  public static final String BACKOFF_MULTIPLIER = "backoffMultiplier";
  public static final String ENABLE_MESSAGE_QUEUE = "enableMessageQueue";
  public static final String MAX_QUEUE_SIZE = "maxQueueSize";
  public static final String DRAIN_BATCH_SIZE = "drainBatchSize";
  public static final String HEARTBEAT_INTERVAL = "heartbeatInterval";
  public static final String ENABLE_HEARTBEAT = "enableHeartbeat";
  public static final String HEADERS = "headers";
  public static final String PROTOCOLS = "protocols";

  private final ObjectMapper mapper;

  public ConfigCodec() {
    this(Json.mapper());
  }

  public ConfigCodec(ObjectMapper mapper) {
    this.mapper = requireNonNull(mapper, "mapper");
  }

  public ObjectNode toTree(Config config) {
    requireNonNull(config, "config");

    final ObjectNode result = mapper.createObjectNode();
    result.put(URI, config.uri().toString());
    result.put(CONNECTION_TIMEOUT, config.connectionTimeout().toMillis());
    result.put(ENABLE_RECONNECTION, config.enableReconnection());
    result.put(MAX_RECONNECTION_ATTEMPTS, config.maxReconnectionAttempts());
    result.put(RECONNECTION_POLICY, config.reconnectionPolicy().name().toLowerCase(Locale.ROOT));
    result.put(INITIAL_RECONNECTION_DELAY, config.initialReconnectionDelay().toMillis());
    result.put(MAX_RECONNECTION_DELAY, config.maxReconnectionDelay().toMillis());
    result.put(BACKOFF_MULTIPLIER, config.backoffMultiplier());
    result.put(ENABLE_MESSAGE_QUEUE, config.enableMessageQueue());
    result.put(MAX_QUEUE_SIZE, config.maxQueueSize());
    result.put(DRAIN_BATCH_SIZE, config.drainBatchSize());
    result.put(HEARTBEAT_INTERVAL, config.heartbeatInterval().toMillis());
    result.put(ENABLE_HEARTBEAT, config.enableHeartbeat());

    final ObjectNode headers = result.putObject(HEADERS);
    for (Map.Entry<String, String> header : config.headers().entrySet())
      headers.put(header.getKey(), header.getValue());

    final ArrayNode protocols = result.putArray(PROTOCOLS);
    for (String protocol : config.protocols())
      protocols.add(protocol);

    return result;
  }

  public Config fromTree(JsonNode tree) throws IOException {
    requireNonNull(tree, "tree");
    if (!tree.isObject())
      throw new IOException("config must be a JSON object");

    final URI uri;
    try {
      uri = new URI(MessageCodec.requiredText(tree, URI));
    } catch (URISyntaxException e) {
      throw new IOException("invalid uri", e);
    }

    final Config.Builder builder = Config.builder(uri)
        .setConnectionTimeout(
            millis(tree, CONNECTION_TIMEOUT, Config.DEFAULT_CONNECTION_TIMEOUT))
        .setEnableReconnection(
            tree.path(ENABLE_RECONNECTION).asBoolean(Config.DEFAULT_ENABLE_RECONNECTION))
        .setMaxReconnectionAttempts(tree.path(MAX_RECONNECTION_ATTEMPTS)
            .asInt(Config.DEFAULT_MAX_RECONNECTION_ATTEMPTS))
        .setInitialReconnectionDelay(millis(tree, INITIAL_RECONNECTION_DELAY,
            Config.DEFAULT_INITIAL_RECONNECTION_DELAY))
        .setMaxReconnectionDelay(
            millis(tree, MAX_RECONNECTION_DELAY, Config.DEFAULT_MAX_RECONNECTION_DELAY))
        .setBackoffMultiplier(
            tree.path(BACKOFF_MULTIPLIER).asDouble(Config.DEFAULT_BACKOFF_MULTIPLIER))
        .setEnableMessageQueue(
            tree.path(ENABLE_MESSAGE_QUEUE).asBoolean(Config.DEFAULT_ENABLE_MESSAGE_QUEUE))
        .setMaxQueueSize(tree.path(MAX_QUEUE_SIZE).asInt(Config.DEFAULT_MAX_QUEUE_SIZE))
        .setDrainBatchSize(tree.path(DRAIN_BATCH_SIZE).asInt(Config.DEFAULT_DRAIN_BATCH_SIZE))
        .setHeartbeatInterval(
            millis(tree, HEARTBEAT_INTERVAL, Config.DEFAULT_HEARTBEAT_INTERVAL))
        .setEnableHeartbeat(
            tree.path(ENABLE_HEARTBEAT).asBoolean(Config.DEFAULT_ENABLE_HEARTBEAT));

    final JsonNode policy = tree.get(RECONNECTION_POLICY);
    if (policy != null && !policy.isNull()) {
      try {
        builder.setReconnectionPolicy(
            ReconnectionPolicyType.valueOf(policy.asText().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException e) {
        throw new IOException("invalid reconnectionPolicy " + policy.asText(), e);
      }
    }

    final JsonNode headers = tree.get(HEADERS);
    if (headers != null && headers.isObject()) {
      final Map<String, String> values = new LinkedHashMap<>();
      final Iterator<Map.Entry<String, JsonNode>> fields = headers.fields();
      while (fields.hasNext()) {
        final Map.Entry<String, JsonNode> field = fields.next();
        values.put(field.getKey(), field.getValue().asText());
      }
      builder.setHeaders(values);
    }

    final JsonNode protocols = tree.get(PROTOCOLS);
    if (protocols != null && protocols.isArray()) {
      final List<String> values = new ArrayList<>();
      for (JsonNode protocol : protocols)
        values.add(protocol.asText());
      builder.setProtocols(values);
    }

    try {
      return builder.build();
    } catch (IllegalArgumentException e) {
      throw new IOException("invalid config", e);
    }
  }

  public String encode(Config config) {
    try {
      return mapper.writeValueAsString(toTree(config));
    } catch (JsonProcessingException e) {
      throw new IllegalStateException(e);
    }
  }

  public Config decode(String json) throws IOException {
    requireNonNull(json, "json");
    return fromTree(mapper.readTree(json));
  }

  private static Duration millis(JsonNode tree, String field, Duration defaultValue) {
    final JsonNode value = tree.get(field);
    if (value == null || value.isNull())
      return defaultValue;
    return Duration.ofMillis(value.asLong());
  }
}
