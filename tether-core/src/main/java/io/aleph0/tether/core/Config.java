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
package io.aleph0.tether.core;

import static java.util.Objects.requireNonNull;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import io.aleph0.tether.core.policy.ReconnectionPolicyType;

/**
 * Immutable configuration of a {@link io.aleph0.tether.core.manager.ConnectionManager} and the
 * connections it creates. Use {@link #builder(URI)} or one of the presets, and
 * {@link #toBuilder()} to derive a modified copy.
 */
public record Config(
    /**
     * The endpoint to connect to
     */
    URI uri,

    /**
     * How long a connection attempt may take before it fails
     */
    Duration connectionTimeout,

    /**
     * Whether the manager reconnects automatically after a failure or remote close
     */
    boolean enableReconnection,

    /**
     * The ceiling on reconnection attempts across one reconnection campaign
     */
    int maxReconnectionAttempts,

    /**
     * The backoff algorithm used between reconnection attempts
     */
    ReconnectionPolicyType reconnectionPolicy,

    /**
     * The delay before the first reconnection attempt
     */
    Duration initialReconnectionDelay,

    /**
     * The cap on the delay between reconnection attempts
     */
    Duration maxReconnectionDelay,

    /**
     * The multiplier for exponential backoff
     */
    double backoffMultiplier,

    /**
     * Whether messages submitted while disconnected are queued for later delivery
     */
    boolean enableMessageQueue,

    /**
     * The capacity of the outbound queue
     */
    int maxQueueSize,

    /**
     * The number of queued messages sent per drain pass
     */
    int drainBatchSize,

    /**
     * The period of the ping heartbeat
     */
    Duration heartbeatInterval,

    /**
     * Whether the connection sends a periodic ping
     */
    boolean enableHeartbeat,

    /**
     * Custom headers for the opening handshake, where the transport supports them
     */
    Map<String, String> headers,

    /**
     * Subprotocols offered in the opening handshake
     */
    List<String> protocols) {

  public static final Duration DEFAULT_CONNECTION_TIMEOUT = Duration.ofSeconds(30);
  public static final boolean DEFAULT_ENABLE_RECONNECTION = true;
  public static final int DEFAULT_MAX_RECONNECTION_ATTEMPTS = 10;
  public static final ReconnectionPolicyType DEFAULT_RECONNECTION_POLICY =
      ReconnectionPolicyType.EXPONENTIAL;
  public static final Duration DEFAULT_INITIAL_RECONNECTION_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_RECONNECTION_DELAY = Duration.ofMinutes(5);
  public static final double DEFAULT_BACKOFF_MULTIPLIER = 2.0;
  public static final boolean DEFAULT_ENABLE_MESSAGE_QUEUE = true;
  public static final int DEFAULT_MAX_QUEUE_SIZE = 1000;
  public static final int DEFAULT_DRAIN_BATCH_SIZE = 50;
  public static final Duration DEFAULT_HEARTBEAT_INTERVAL = Duration.ofSeconds(30);
  public static final boolean DEFAULT_ENABLE_HEARTBEAT = true;

  public Config {
    requireNonNull(uri, "uri");
    requireNonNull(connectionTimeout, "connectionTimeout");
    requireNonNull(reconnectionPolicy, "reconnectionPolicy");
    requireNonNull(initialReconnectionDelay, "initialReconnectionDelay");
    requireNonNull(maxReconnectionDelay, "maxReconnectionDelay");
    requireNonNull(heartbeatInterval, "heartbeatInterval");
    if (connectionTimeout.isNegative() || connectionTimeout.isZero())
      throw new IllegalArgumentException("connectionTimeout must be positive");
    if (maxReconnectionAttempts < 0)
      throw new IllegalArgumentException("maxReconnectionAttempts must be at least zero");
    if (initialReconnectionDelay.isNegative())
      throw new IllegalArgumentException("initialReconnectionDelay must not be negative");
    if (maxReconnectionDelay.isNegative())
      throw new IllegalArgumentException("maxReconnectionDelay must not be negative");
    if (backoffMultiplier < 1.0)
      throw new IllegalArgumentException("backoffMultiplier must be at least 1.0");
    if (maxQueueSize < 0)
      throw new IllegalArgumentException("maxQueueSize must be at least zero");
    if (drainBatchSize < 1)
      throw new IllegalArgumentException("drainBatchSize must be at least one");
    if (heartbeatInterval.isNegative())
      throw new IllegalArgumentException("heartbeatInterval must not be negative");
    if (enableHeartbeat && heartbeatInterval.isZero())
      throw new IllegalArgumentException("heartbeatInterval must be positive when enabled");
    headers = Map.copyOf(requireNonNull(headers, "headers"));
    protocols = List.copyOf(requireNonNull(protocols, "protocols"));
  }

  public static Builder builder(URI uri) {
    return new Builder(uri);
  }

  /**
   * Defaults suitable for long-lived production connections.
   */
  public static Config production(URI uri) {
    return builder(uri).build();
  }

  /**
   * Shorter timeouts, more attempts, and a gentler backoff curve.
   */
  public static Config aggressive(URI uri) {
    return builder(uri).setConnectionTimeout(Duration.ofSeconds(15))
        .setMaxReconnectionAttempts(20).setInitialReconnectionDelay(Duration.ofMillis(500))
        .setMaxReconnectionDelay(Duration.ofMinutes(2)).setBackoffMultiplier(1.5)
        .setMaxQueueSize(2000).setHeartbeatInterval(Duration.ofSeconds(15)).build();
  }

  /**
   * No reconnection, no queue, and no heartbeat.
   */
  public static Config testing(URI uri) {
    return builder(uri).setConnectionTimeout(Duration.ofSeconds(5)).setEnableReconnection(false)
        .setMaxReconnectionAttempts(0).setReconnectionPolicy(ReconnectionPolicyType.NONE)
        .setInitialReconnectionDelay(Duration.ZERO).setMaxReconnectionDelay(Duration.ZERO)
        .setBackoffMultiplier(1.0).setEnableMessageQueue(false).setMaxQueueSize(0)
        .setHeartbeatInterval(Duration.ZERO).setEnableHeartbeat(false).build();
  }

  public Builder toBuilder() {
    return new Builder(uri).setConnectionTimeout(connectionTimeout)
        .setEnableReconnection(enableReconnection)
        .setMaxReconnectionAttempts(maxReconnectionAttempts)
        .setReconnectionPolicy(reconnectionPolicy)
        .setInitialReconnectionDelay(initialReconnectionDelay)
        .setMaxReconnectionDelay(maxReconnectionDelay).setBackoffMultiplier(backoffMultiplier)
        .setEnableMessageQueue(enableMessageQueue).setMaxQueueSize(maxQueueSize)
        .setDrainBatchSize(drainBatchSize).setHeartbeatInterval(heartbeatInterval)
        .setEnableHeartbeat(enableHeartbeat).setHeaders(headers).setProtocols(protocols);
  }

  public static class Builder {
    private URI uri;
    private Duration connectionTimeout = DEFAULT_CONNECTION_TIMEOUT;
    private boolean enableReconnection = DEFAULT_ENABLE_RECONNECTION;
    private int maxReconnectionAttempts = DEFAULT_MAX_RECONNECTION_ATTEMPTS;
    private ReconnectionPolicyType reconnectionPolicy = DEFAULT_RECONNECTION_POLICY;
    private Duration initialReconnectionDelay = DEFAULT_INITIAL_RECONNECTION_DELAY;
    private Duration maxReconnectionDelay = DEFAULT_MAX_RECONNECTION_DELAY;
    private double backoffMultiplier = DEFAULT_BACKOFF_MULTIPLIER;
    private boolean enableMessageQueue = DEFAULT_ENABLE_MESSAGE_QUEUE;
    private int maxQueueSize = DEFAULT_MAX_QUEUE_SIZE;
    private int drainBatchSize = DEFAULT_DRAIN_BATCH_SIZE;
    private Duration heartbeatInterval = DEFAULT_HEARTBEAT_INTERVAL;
    private boolean enableHeartbeat = DEFAULT_ENABLE_HEARTBEAT;
    private Map<String, String> headers = Map.of();
    private List<String> protocols = List.of();

    private Builder(URI uri) {
      this.uri = requireNonNull(uri, "uri");
    }

    public Builder setUri(URI uri) {
      this.uri = requireNonNull(uri, "uri");
      return this;
    }

    public Builder setConnectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = connectionTimeout;
      return this;
    }

    public Builder setEnableReconnection(boolean enableReconnection) {
      this.enableReconnection = enableReconnection;
      return this;
    }

    public Builder setMaxReconnectionAttempts(int maxReconnectionAttempts) {
      this.maxReconnectionAttempts = maxReconnectionAttempts;
      return this;
    }

    public Builder setReconnectionPolicy(ReconnectionPolicyType reconnectionPolicy) {
      this.reconnectionPolicy = reconnectionPolicy;
      return this;
    }

    public Builder setInitialReconnectionDelay(Duration initialReconnectionDelay) {
      this.initialReconnectionDelay = initialReconnectionDelay;
      return this;
    }

    public Builder setMaxReconnectionDelay(Duration maxReconnectionDelay) {
      this.maxReconnectionDelay = maxReconnectionDelay;
      return this;
    }

    public Builder setBackoffMultiplier(double backoffMultiplier) {
      this.backoffMultiplier = backoffMultiplier;
      return this;
    }

    public Builder setEnableMessageQueue(boolean enableMessageQueue) {
      this.enableMessageQueue = enableMessageQueue;
      return this;
    }

    public Builder setMaxQueueSize(int maxQueueSize) {
      this.maxQueueSize = maxQueueSize;
      return this;
    }

    public Builder setDrainBatchSize(int drainBatchSize) {
      this.drainBatchSize = drainBatchSize;
      return this;
    }

    public Builder setHeartbeatInterval(Duration heartbeatInterval) {
      this.heartbeatInterval = heartbeatInterval;
      return this;
    }

    public Builder setEnableHeartbeat(boolean enableHeartbeat) {
      this.enableHeartbeat = enableHeartbeat;
      return this;
    }

    public Builder setHeaders(Map<String, String> headers) {
      this.headers = headers;
      return this;
    }

    public Builder setProtocols(List<String> protocols) {
      this.protocols = protocols;
      return this;
    }

    public Config build() {
      return new Config(uri, connectionTimeout, enableReconnection, maxReconnectionAttempts,
          reconnectionPolicy, initialReconnectionDelay, maxReconnectionDelay, backoffMultiplier,
          enableMessageQueue, maxQueueSize, drainBatchSize, heartbeatInterval, enableHeartbeat,
          headers, protocols);
    }
  }
}
