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
import java.util.Arrays;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * The body of a {@link Message}. Each variant maps to exactly one {@link MessageKind}.
 */
public sealed interface Payload
    permits Payload.Text, Payload.Binary, Payload.Structured, Payload.Control {

  public MessageKind kind();

  public static record Text(String text) implements Payload {
    public Text {
      requireNonNull(text, "text");
    }

    @Override
    public MessageKind kind() {
      return MessageKind.TEXT;
    }
  }

  /**
   * Raw bytes. The array is copied on the way in and on the way out.
   */
  public static record Binary(byte[] bytes) implements Payload {
    public Binary {
      bytes = requireNonNull(bytes, "bytes").clone();
    }

    @Override
    public byte[] bytes() {
      return bytes.clone();
    }

    public int length() {
      return bytes.length;
    }

    @Override
    public MessageKind kind() {
      return MessageKind.BINARY;
    }

    @Override
    public boolean equals(Object other) {
      if (this == other)
        return true;
      if (!(other instanceof Binary that))
        return false;
      return Arrays.equals(bytes, that.bytes);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
      return "Binary[length=" + bytes.length + "]";
    }
  }

  /**
   * A JSON object or array. Object fields keep their insertion order. The document is deep-copied
   * on the way in and on the way out, so a payload never changes after construction.
   */
  public static record Structured(JsonNode document) implements Payload {
    public Structured {
      requireNonNull(document, "document");
      if (!document.isContainerNode())
        throw new IllegalArgumentException("document must be a JSON object or array");
      document = document.deepCopy();
    }

    @Override
    public JsonNode document() {
      return document.deepCopy();
    }

    @Override
    public MessageKind kind() {
      return MessageKind.STRUCTURED;
    }
  }

  public static record Control(Token token) implements Payload {
    public static enum Token {
      PING("ping"), PONG("pong");

      public static Token fromLiteral(String literal) {
        for (Token token : values())
          if (token.literal.equals(literal))
            return token;
        return null;
      }

      private final String literal;

      private Token(String literal) {
        this.literal = literal;
      }

      /**
       * @return the literal sent on the wire for this token
       */
      public String getLiteral() {
        return literal;
      }
    }

    public Control {
      requireNonNull(token, "token");
    }

    @Override
    public MessageKind kind() {
      return token == Token.PING ? MessageKind.PING : MessageKind.PONG;
    }
  }
}
