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
package io.aleph0.tether.core.connection;

import static java.util.Objects.requireNonNull;
import io.aleph0.tether.core.Message;

/**
 * Lifecycle and traffic notifications published by a {@link Connection}.
 */
public sealed interface ConnectionEvent permits ConnectionEvent.Connected,
    ConnectionEvent.Disconnected, ConnectionEvent.ConnectionFailed, ConnectionEvent.MessageSent,
    ConnectionEvent.MessageReceived, ConnectionEvent.Error {

  public static record Connected() implements ConnectionEvent {
  }

  public static record Disconnected() implements ConnectionEvent {
  }

  public static record ConnectionFailed(String reason) implements ConnectionEvent {
    public ConnectionFailed {
      requireNonNull(reason, "reason");
    }
  }

  public static record MessageSent(Message message) implements ConnectionEvent {
    public MessageSent {
      requireNonNull(message, "message");
    }
  }

  public static record MessageReceived(Message message) implements ConnectionEvent {
    public MessageReceived {
      requireNonNull(message, "message");
    }
  }

  /**
   * A problem that did not, by itself, end the connection.
   */
  public static record Error(String description) implements ConnectionEvent {
    public Error {
      requireNonNull(description, "description");
    }
  }
}
