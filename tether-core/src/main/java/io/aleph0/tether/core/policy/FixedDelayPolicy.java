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

import static java.util.Objects.requireNonNull;
import java.time.Duration;

public class FixedDelayPolicy implements ReconnectionPolicy {
  public static final Duration DEFAULT_DELAY = Duration.ofSeconds(5);

  private final Duration delay;

  public FixedDelayPolicy() {
    this(DEFAULT_DELAY);
  }

  public FixedDelayPolicy(Duration delay) {
    this.delay = requireNonNull(delay, "delay");
    if (delay.isNegative())
      throw new IllegalArgumentException("delay must not be negative");
  }

  @Override
  public Duration delay(int attempt) {
    return delay;
  }

  @Override
  public boolean shouldRetry(int attempt, int maxAttempts) {
    return attempt <= maxAttempts;
  }

  @Override
  public void reset() {}

  @Override
  public String toString() {
    return "FixedDelayPolicy [delay=" + delay + "]";
  }
}
