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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import org.junit.jupiter.api.Test;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.MessageKind;
import io.aleph0.tether.core.Payload;

class MessageCodecTest {
  private final MessageCodec codec = new MessageCodec();

  @Test
  void givenBinaryMessage_whenToTree_thenDataIsBase64() {
    // Arrange
    final Message message = Message.builder(new Payload.Binary("hi".getBytes(StandardCharsets.UTF_8)))
        .setId("m1").setCreatedAt(Instant.parse("2025-01-01T00:00:00Z")).setRequiresAck(true)
        .build();

    // Act
    final ObjectNode tree = codec.toTree(message);

    // Assert
    assertThat(tree.get("id").textValue()).isEqualTo("m1");
    assertThat(tree.get("type").textValue()).isEqualTo("binary");
    assertThat(tree.get("data").textValue()).isEqualTo("aGk=");
    assertThat(tree.get("timestamp").textValue()).isEqualTo("2025-01-01T00:00:00Z");
    assertThat(tree.get("requiresAck").booleanValue()).isTrue();
    assertThat(tree.get("retryCount").intValue()).isZero();
    assertThat(tree.get("maxRetries").intValue()).isEqualTo(3);
  }

  @Test
  void givenStructuredMessage_whenEncodeThenDecode_thenEqual() throws IOException {
    final ObjectNode document = Json.mapper().createObjectNode().put("a", 1);
    document.putArray("b").add("x");
    final Message message = Message.builder(new Payload.Structured(document)).setId("m2")
        .setMaxRetries(5).build().withRetry();

    final Message decoded = codec.decode(codec.encode(message));

    assertThat(decoded).isEqualTo(message);
    assertThat(decoded.kind()).isEqualTo(MessageKind.STRUCTURED);
  }

  @Test
  void givenTextMessage_whenEncodeThenDecode_thenEqual() throws IOException {
    final Message message = Message.builder(new Payload.Text("héllo \"quoted\"\n"))
        .setId("t1").setRequiresAck(true).build();

    final Message decoded = codec.decode(codec.encode(message));

    assertThat(decoded).isEqualTo(message);
    assertThat(decoded.kind()).isEqualTo(MessageKind.TEXT);
  }

  @Test
  void givenBinaryMessage_whenEncodeThenDecode_thenEqual() throws IOException {
    final byte[] bytes = new byte[] {0, 1, (byte) 0x7f, (byte) 0x80, (byte) 0xff};
    final Message message =
        Message.builder(new Payload.Binary(bytes)).setId("b1").setMaxRetries(1).build();

    final Message decoded = codec.decode(codec.encode(message));

    assertThat(decoded).isEqualTo(message);
    assertThat(((Payload.Binary) decoded.payload()).bytes()).isEqualTo(bytes);
  }

  @Test
  void givenEmptyBinaryMessage_whenEncodeThenDecode_thenEqual() throws IOException {
    final Message message = Message.binary(new byte[0]);

    assertThat(codec.decode(codec.encode(message))).isEqualTo(message);
  }

  @Test
  void givenControlMessages_whenEncodeThenDecode_thenEqual() throws IOException {
    final Message ping = Message.ping();
    final Message pong = Message.pong();

    final Message decodedPing = codec.decode(codec.encode(ping));
    final Message decodedPong = codec.decode(codec.encode(pong));

    assertThat(decodedPing).isEqualTo(ping);
    assertThat(decodedPing.kind()).isEqualTo(MessageKind.PING);
    assertThat(decodedPong).isEqualTo(pong);
    assertThat(decodedPong.kind()).isEqualTo(MessageKind.PONG);
  }

  @Test
  void givenMinimalDocument_whenDecode_thenDefaultsApplied() throws IOException {
    final Instant before = Instant.now();

    final Message decoded = codec.decode("{\"id\":\"x\",\"type\":\"text\",\"data\":\"hello\"}");

    assertThat(decoded.id()).isEqualTo("x");
    assertThat(decoded.payload()).isEqualTo(new Payload.Text("hello"));
    assertThat(decoded.requiresAck()).isFalse();
    assertThat(decoded.retryCount()).isZero();
    assertThat(decoded.maxRetries()).isEqualTo(Message.DEFAULT_MAX_RETRIES);
    assertThat(decoded.createdAt()).isAfterOrEqualTo(before);
  }

  @Test
  void givenControlMessage_whenToTree_thenDataIsLiteral() {
    final JsonNode tree = codec.toTree(Message.pong());

    assertThat(tree.get("type").textValue()).isEqualTo("pong");
    assertThat(tree.get("data").textValue()).isEqualTo("pong");
  }

  @Test
  void givenUnknownType_whenDecode_thenIOException() {
    assertThatThrownBy(() -> codec.decode("{\"id\":\"x\",\"type\":\"smoke\",\"data\":\"\"}"))
        .isInstanceOf(IOException.class).hasMessageContaining("type");
  }

  @Test
  void givenMissingId_whenDecode_thenIOException() {
    assertThatThrownBy(() -> codec.decode("{\"type\":\"text\",\"data\":\"\"}"))
        .isInstanceOf(IOException.class).hasMessageContaining("id");
  }

  @Test
  void givenScalarStructuredData_whenDecode_thenIOException() {
    assertThatThrownBy(() -> codec.decode("{\"id\":\"x\",\"type\":\"json\",\"data\":42}"))
        .isInstanceOf(IOException.class);
  }

  @Test
  void givenRetryCountAboveMax_whenDecode_thenIOException() {
    assertThatThrownBy(() -> codec.decode(
        "{\"id\":\"x\",\"type\":\"text\",\"data\":\"\",\"retryCount\":4,\"maxRetries\":3}"))
            .isInstanceOf(IOException.class).hasMessage("invalid message");
  }

  @Test
  void givenInvalidBase64_whenDecode_thenIOException() {
    assertThatThrownBy(
        () -> codec.decode("{\"id\":\"x\",\"type\":\"binary\",\"data\":\"!!not base64\"}"))
            .isInstanceOf(IOException.class);
  }
}
