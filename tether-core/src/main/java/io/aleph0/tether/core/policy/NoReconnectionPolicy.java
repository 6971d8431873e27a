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
package io.aleph0.tether.core.policy;

import java.time.Duration;

/**
 * Never reconnects.
 */
public final class NoReconnectionPolicy implements ReconnectionPolicy {
  public static final NoReconnectionPolicy INSTANCE = new NoReconnectionPolicy();

  private NoReconnectionPolicy() {}

  @Override
  public Duration delay(int attempt) {
    return Duration.ZERO;
  }

  @Override
  public boolean shouldRetry(int attempt, int maxAttempts) {
    return false;
  }

  @Override
  public void reset() {}

  @Override
  public String toString() {
    return "NoReconnectionPolicy";
  }
}
