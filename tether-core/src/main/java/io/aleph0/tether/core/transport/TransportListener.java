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

/**
 * Receives the inbound side of a transport session. Transports may call these methods from any
 * thread, but never concurrently for the same session.
 */
public interface TransportListener {
  public void onFrame(Frame frame);

  /**
   * The session closed, either normally or because the peer went away.
   * 
   * @param statusCode the close status code, as defined by the transport
   * @param reason the close reason, possibly {@code null}
   */
  public void onClosed(int statusCode, String reason);

  /**
   * The session failed. No further frames will arrive. A transport may or may not follow this with
   * {@link #onClosed(int, String)}.
   */
  public void onError(Throwable cause);
}
