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
import io.aleph0.tether.core.ConnectionState;

/**
 * A point-in-time view of a {@link ConnectionManager}, published on
 * {@link ConnectionManager#states()} whenever any field changes.
 */
public record ManagerStatus(ManagerState state, ConnectionState connectionState,
    boolean reconnecting, int reconnectionAttempt, int queueSize) {

  public static final ManagerStatus INITIAL =
      new ManagerStatus(ManagerState.IDLE, ConnectionState.INITIAL, false, 0, 0);

  public ManagerStatus {
    requireNonNull(state, "state");
    requireNonNull(connectionState, "connectionState");
    if (reconnectionAttempt < 0)
      throw new IllegalArgumentException("reconnectionAttempt must be at least zero");
    if (queueSize < 0)
      throw new IllegalArgumentException("queueSize must be at least zero");
  }

  public boolean isConnected() {
    return connectionState == ConnectionState.CONNECTED;
  }
}
