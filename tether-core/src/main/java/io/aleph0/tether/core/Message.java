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
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * An immutable outbound or inbound message.
 * 
 * <p>
 * The {@link #id() id} is unique per logical message. Re-sending the same message, for example
 * after a failed delivery, keeps the same ID, which is what allows the outbound queue to
 * deduplicate. The {@link #retryCount() retry count} never exceeds {@link #maxRetries() max
 * retries}; {@link #withRetry()} returns a new message and never mutates this one.
 */
public final class Message {
  public static final int DEFAULT_MAX_RETRIES = 3;

  public static Builder builder(Payload payload) {
    return new Builder(payload);
  }

  public static Message text(String text) {
    return builder(new Payload.Text(text)).build();
  }

  public static Message binary(byte[] bytes) {
    return builder(new Payload.Binary(bytes)).build();
  }

  public static Message structured(JsonNode document) {
    return builder(new Payload.Structured(document)).build();
  }

  public static Message ping() {
    return builder(new Payload.Control(Payload.Control.Token.PING)).build();
  }

  public static Message pong() {
    return builder(new Payload.Control(Payload.Control.Token.PONG)).build();
  }

  public static class Builder {
    private final Payload payload;
    private String id;
    private Instant createdAt;
    private boolean requiresAck = false;
    private int retryCount = 0;
    private int maxRetries = DEFAULT_MAX_RETRIES;

    private Builder(Payload payload) {
      this.payload = requireNonNull(payload, "payload");
    }

    public Builder setId(String id) {
      this.id = requireNonNull(id, "id");
      return this;
    }

    public Builder setCreatedAt(Instant createdAt) {
      this.createdAt = requireNonNull(createdAt, "createdAt");
      return this;
    }

    public Builder setRequiresAck(boolean requiresAck) {
      this.requiresAck = requiresAck;
      return this;
    }

    public Builder setRetryCount(int retryCount) {
      this.retryCount = retryCount;
      return this;
    }

    public Builder setMaxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Message build() {
      final String id = this.id != null ? this.id : UUID.randomUUID().toString();
      final Instant createdAt = this.createdAt != null ? this.createdAt : Instant.now();
      return new Message(id, payload, createdAt, requiresAck, retryCount, maxRetries);
    }
  }

  private final String id;
  private final Payload payload;
  private final Instant createdAt;
  private final boolean requiresAck;
  private final int retryCount;
  private final int maxRetries;

  public Message(String id, Payload payload, Instant createdAt, boolean requiresAck,
      int retryCount, int maxRetries) {
    if (maxRetries < 0)
      throw new IllegalArgumentException("maxRetries must be at least zero");
    if (retryCount < 0)
      throw new IllegalArgumentException("retryCount must be at least zero");
    if (retryCount > maxRetries)
      throw new IllegalArgumentException("retryCount must not exceed maxRetries");
    this.id = requireNonNull(id, "id");
    this.payload = requireNonNull(payload, "payload");
    this.createdAt = requireNonNull(createdAt, "createdAt");
    this.requiresAck = requiresAck;
    this.retryCount = retryCount;
    this.maxRetries = maxRetries;
  }

  public String id() {
    return id;
  }

  public Payload payload() {
    return payload;
  }

  public MessageKind kind() {
    return payload.kind();
  }

  public Instant createdAt() {
    return createdAt;
  }

  public boolean requiresAck() {
    return requiresAck;
  }

  public int retryCount() {
    return retryCount;
  }

  public int maxRetries() {
    return maxRetries;
  }

  public boolean canRetry() {
    return retryCount < maxRetries;
  }

  public boolean isControl() {
    return payload.kind().isControl();
  }

  /**
   * Returns a copy of this message with the retry count incremented by one.
   * 
   * @return the new message
   * @throws IllegalStateException if this message has no retries left
   */
  public Message withRetry() {
    if (!canRetry())
      throw new IllegalStateException("message " + id + " has exhausted its retries");
    return new Message(id, payload, createdAt, requiresAck, retryCount + 1, maxRetries);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, payload, createdAt, requiresAck, retryCount, maxRetries);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null)
      return false;
    if (getClass() != obj.getClass())
      return false;
    Message other = (Message) obj;
    return id.equals(other.id) && payload.equals(other.payload)
        && createdAt.equals(other.createdAt) && requiresAck == other.requiresAck
        && retryCount == other.retryCount && maxRetries == other.maxRetries;
  }

  @Override
  public String toString() {
    return "Message [id=" + id + ", kind=" + kind() + ", createdAt=" + createdAt
        + ", requiresAck=" + requiresAck + ", retryCount=" + retryCount + ", maxRetries="
        + maxRetries + "]";
  }
}
