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

/**
 * The state of a single {@link io.aleph0.tether.core.connection.Connection}.
 * 
 * <pre>
 *                                        
 *     INITIAL ─► CONNECTING ─► CONNECTED ─► CLOSING ─► CLOSED
 *                    │             │                     
 *                    └─────────────┴──────► FAILED       
 * 
 * </pre>
 * 
 * <p>
 * A connection only leaves {@code CLOSED} or {@code FAILED} through an explicit call to
 * {@code connect()}. {@code RECONNECTING} and {@code SUSPENDED} are reserved for transports and
 * managers that report them; the core connection never enters them on its own.
 */
public enum ConnectionState {
  INITIAL, CONNECTING, CONNECTED, CLOSING, CLOSED, FAILED, RECONNECTING, SUSPENDED;

  /**
   * @return true if the connection is connecting, connected, or reconnecting
   */
  public boolean isActive() {
    return this == CONNECTING || this == CONNECTED || this == RECONNECTING;
  }

  /**
   * @return true if the connection is closed or failed
   */
  public boolean isTerminalFailure() {
    return this == CLOSED || this == FAILED;
  }

  /**
   * @return true if messages may be sent in this state
   */
  public boolean canSend() {
    return this == CONNECTED;
  }
}
