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

import java.util.Locale;

/**
 * The kind tag of a {@link Message}. The wire name is used in the interchange form.
 */
public enum MessageKind {
  TEXT("text"), BINARY("binary"), STRUCTURED("json"), PING("ping"), PONG("pong");

  public static MessageKind fromWireName(String wireName) {
    final String normalized = wireName.toLowerCase(Locale.ROOT);
    for (MessageKind kind : values())
      if (kind.wireName.equals(normalized))
        return kind;
    throw new IllegalArgumentException("unknown message kind " + wireName);
  }

  private final String wireName;

  private MessageKind(String wireName) {
    this.wireName = wireName;
  }

  public String getWireName() {
    return wireName;
  }

  public boolean isControl() {
    return this == PING || this == PONG;
  }
}
