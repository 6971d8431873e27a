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
package io.aleph0.tether.core.transport;

import static java.util.Objects.requireNonNull;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * A single frame on the wire.
 */
public sealed interface Frame permits Frame.Text, Frame.Binary {
  public static Frame text(String text) {
    return new Text(text);
  }

  public static Frame binary(byte[] bytes) {
    return new Binary(bytes);
  }

  public static record Text(String text) implements Frame {
    public Text {
      requireNonNull(text, "text");
    }
  }

  public static record Binary(byte[] bytes) implements Frame {
    public Binary {
      bytes = requireNonNull(bytes, "bytes").clone();
    }

    @Override
    public byte[] bytes() {
      return bytes.clone();
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
      return "Binary[length=" + bytes.length + ", utf8="
          + new String(bytes, 0, Math.min(bytes.length, 32), StandardCharsets.UTF_8) + "]";
    }
  }
}
