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

/**
 * The externally visible state of a {@link ConnectionManager}, derived from the state of its
 * current connection and whether a reconnection campaign is under way.
 */
public enum ManagerState {
  /**
   * No connection has been attempted yet
   */
  IDLE,

  /**
   * The first attempt of a caller-requested connect is in flight
   */
  CONNECTING,

  CONNECTED,

  /**
   * The connection was lost and the manager is waiting for, or performing, a reconnection
   * attempt
   */
  RECONNECTING,

  /**
   * The connection is closed or failed and no reconnection is under way
   */
  DISCONNECTED;
}
