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
 * Decides whether and when to attempt the next reconnection. Attempt numbers start at one.
 * 
 * <p>
 * The built-in policies are stateless, but the contract allows stateful implementations, which
 * must clear their state in {@link #reset()}. The manager resets its policy after every
 * successful connection and every user disconnect.
 * 
 * @see ReconnectionPolicies
 */
public interface ReconnectionPolicy {
  /**
   * @param attempt the attempt number, starting at one
   * @return the delay before the given attempt, never negative
   */
  public Duration delay(int attempt);

  /**
   * @param attempt the attempt number, starting at one
   * @param maxAttempts the configured ceiling
   * @return true if the attempt should be made
   */
  public boolean shouldRetry(int attempt, int maxAttempts);

  public void reset();
}
