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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

class MessageTest {
  @Test
  void givenFactories_whenCreateMessages_thenKindFollowsPayload() {
    final ObjectNode document = JsonNodeFactory.instance.objectNode().put("key", "value");

    assertThat(Message.text("hello").kind()).isEqualTo(MessageKind.TEXT);
    assertThat(Message.binary(new byte[] {1, 2, 3}).kind()).isEqualTo(MessageKind.BINARY);
    assertThat(Message.structured(document).kind()).isEqualTo(MessageKind.STRUCTURED);
    assertThat(Message.ping().kind()).isEqualTo(MessageKind.PING);
    assertThat(Message.pong().kind()).isEqualTo(MessageKind.PONG);
    assertThat(Message.ping().isControl()).isTrue();
    assertThat(Message.text("hello").isControl()).isFalse();
  }

  @Test
  void givenNoId_whenBuild_thenEachMessageGetsUniqueId() {
    final Message a = Message.text("a");
    final Message b = Message.text("a");

    assertThat(a.id()).isNotBlank();
    assertThat(a.id()).isNotEqualTo(b.id());
    assertThat(a.maxRetries()).isEqualTo(Message.DEFAULT_MAX_RETRIES);
    assertThat(a.retryCount()).isZero();
    assertThat(a.requiresAck()).isFalse();
  }

  @Test
  void givenMessage_whenWithRetry_thenReturnsNewMessageAndKeepsOriginal() {
    // Arrange
    final Message original = Message.builder(new Payload.Text("hello")).setId("m1")
        .setMaxRetries(2).build();

    // Act
    final Message once = original.withRetry();
    final Message twice = once.withRetry();

    // Assert
    assertThat(original.retryCount()).isZero();
    assertThat(once.retryCount()).isEqualTo(1);
    assertThat(once.id()).isEqualTo("m1");
    assertThat(once.createdAt()).isEqualTo(original.createdAt());
    assertThat(twice.retryCount()).isEqualTo(2);
    assertThat(twice.canRetry()).isFalse();
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(twice::withRetry);
  }

  @Test
  void givenRetryCountAboveMax_whenBuild_thenThrowsIllegalArgumentException() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Message.builder(new Payload.Text("x")).setRetryCount(4)
            .setMaxRetries(3).build())
        .withMessageContaining("retryCount");
  }

  @Test
  void givenBinaryPayload_whenSourceArrayModified_thenMessageUnchanged() {
    // Arrange
    final byte[] bytes = "abc".getBytes(StandardCharsets.UTF_8);
    final Message message = Message.binary(bytes);

    // Act
    bytes[0] = 'z';
    ((Payload.Binary) message.payload()).bytes()[1] = 'z';

    // Assert
    assertThat(((Payload.Binary) message.payload()).bytes())
        .isEqualTo("abc".getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void givenStructuredPayload_whenSourceDocumentModified_thenMessageUnchanged() {
    final ObjectNode document = JsonNodeFactory.instance.objectNode().put("key", "value");
    final Message message = Message.structured(document);

    document.put("key", "changed");

    assertThat(((Payload.Structured) message.payload()).document().get("key").asText())
        .isEqualTo("value");
  }

  @Test
  void givenScalarJson_whenCreateStructuredPayload_thenThrowsIllegalArgumentException() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> new Payload.Structured(JsonNodeFactory.instance.textNode("scalar")));
  }

  @Test
  void givenSameFields_whenCompare_thenEqual() {
    final Instant now = Instant.parse("2025-01-01T00:00:00Z");
    final Message a = Message.builder(new Payload.Binary(new byte[] {1, 2})).setId("x")
        .setCreatedAt(now).build();
    final Message b = Message.builder(new Payload.Binary(new byte[] {1, 2})).setId("x")
        .setCreatedAt(now).build();

    assertThat(a).isEqualTo(b);
    assertThat(a.hashCode()).isEqualTo(b.hashCode());
  }

  @Test
  void givenControlLiteral_whenLookUpToken_thenFindsTokenOrNull() {
    assertThat(Payload.Control.Token.fromLiteral("ping")).isEqualTo(Payload.Control.Token.PING);
    assertThat(Payload.Control.Token.fromLiteral("pong")).isEqualTo(Payload.Control.Token.PONG);
    assertThat(Payload.Control.Token.fromLiteral("PING")).isNull();
  }
}
