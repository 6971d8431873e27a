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
package io.aleph0.tether.core.manager;

import static java.util.Objects.requireNonNull;
import io.aleph0.tether.core.Message;
import io.aleph0.tether.core.connection.ConnectionEvent;

/**
 * Notifications published by a {@link ConnectionManager}. Events of the current connection are
 * relayed as {@link ConnectionEventRelay}.
 */
public sealed interface ManagerEvent permits ManagerEvent.Connecting, ManagerEvent.Connected,
    ManagerEvent.Disconnected, ManagerEvent.ConnectionFailed, ManagerEvent.Reconnecting,
    ManagerEvent.ReconnectionFailed, ManagerEvent.MessageSent, ManagerEvent.MessageQueued,
    ManagerEvent.Error, ManagerEvent.ConnectionEventRelay {

  public static record Connecting() implements ManagerEvent {
  }

  public static record Connected() implements ManagerEvent {
  }

  public static record Disconnected() implements ManagerEvent {
  }

  public static record ConnectionFailed(String reason) implements ManagerEvent {
    public ConnectionFailed {
      requireNonNull(reason, "reason");
    }
  }

  /**
   * A reconnection attempt has been scheduled.
   */
  public static record Reconnecting(int attempt) implements ManagerEvent {
    public Reconnecting {
      if (attempt < 1)
        throw new IllegalArgumentException("attempt must be at least one");
    }
  }

  /**
   * The reconnection campaign has ended without success. No further attempts follow until the
   * next {@link ConnectionManager#connect()}.
   */
  public static record ReconnectionFailed(String reason) implements ManagerEvent {
    public ReconnectionFailed {
      requireNonNull(reason, "reason");
    }
  }

  public static record MessageSent(Message message) implements ManagerEvent {
    public MessageSent {
      requireNonNull(message, "message");
    }
  }

  public static record MessageQueued(Message message) implements ManagerEvent {
    public MessageQueued {
      requireNonNull(message, "message");
    }
  }

  /**
   * @param description what went wrong
   * @param messageId the ID of the message concerned, or null if none
   */
  public static record Error(String description, String messageId) implements ManagerEvent {
    public Error {
      requireNonNull(description, "description");
    }
  }

  public static record ConnectionEventRelay(ConnectionEvent event) implements ManagerEvent {
    public ConnectionEventRelay {
      requireNonNull(event, "event");
    }
  }
}
