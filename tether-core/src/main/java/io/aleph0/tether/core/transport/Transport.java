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

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * The raw bidirectional frame transport. A transport opens sessions; it does not reconnect,
 * queue, or interpret payloads.
 */
public interface Transport extends AutoCloseable {
  /**
   * Opens a session. The listener receives every inbound frame and the termination of the
   * session.
   * 
   * @param uri the endpoint
   * @param options the handshake options
   * @param listener the inbound listener
   * @return a future that completes when the session is open, or completes exceptionally if the
   *         session could not be opened
   */
  public CompletableFuture<TransportSession> open(URI uri, TransportOptions options,
      TransportListener listener);

  /**
   * Whether this transport can set custom handshake headers. Callers drop headers rather than
   * fail when it cannot.
   */
  default boolean supportsHeaders() {
    return true;
  }

  /**
   * Releases resources shared by all sessions of this transport.
   */
  @Override
  default void close() {}
}
