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
package io.aleph0.tether.core.queue;

import java.util.Comparator;
import io.aleph0.tether.core.Message;

/**
 * The delivery order of queued messages: control messages first, then messages that require an
 * acknowledgement, then fewer retries before more, then older before newer.
 */
public final class MessagePriority {
  private MessagePriority() {}

  public static final Comparator<Message> COMPARATOR =
      Comparator.comparing((Message m) -> !m.isControl()).thenComparing(m -> !m.requiresAck())
          .thenComparingInt(Message::retryCount).thenComparing(Message::createdAt);
}
