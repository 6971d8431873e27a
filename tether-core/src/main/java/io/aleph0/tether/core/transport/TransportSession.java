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

import java.util.concurrent.CompletableFuture;

/**
 * An open session on a {@link Transport}.
 */
public interface TransportSession {
  /**
   * Sends a frame. Frames are written in the order this method is called.
   * 
   * @return a future that completes when the frame has been handed to the network
   */
  public CompletableFuture<Void> send(Frame frame);

  /**
   * Closes the session normally. Idempotent.
   * 
   * @return a future that completes when the session is closed
   */
  public CompletableFuture<Void> close();

  public boolean isOpen();
}
