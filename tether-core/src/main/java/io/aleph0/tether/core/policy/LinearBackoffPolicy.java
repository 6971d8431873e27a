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

/**
 * Linear backoff without jitter: {@code min(initialDelay + increment * (n-1), maxDelay)}.
 */
public class LinearBackoffPolicy implements ReconnectionPolicy {
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
  public static final Duration DEFAULT_INCREMENT = Duration.ofSeconds(1);

  private final Duration initialDelay;
  private final Duration maxDelay;
  private final Duration increment;

  public LinearBackoffPolicy() {
    this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_INCREMENT);
  }

  public LinearBackoffPolicy(Duration initialDelay, Duration maxDelay, Duration increment) {
    this.initialDelay = requireNonNull(initialDelay, "initialDelay");
    this.maxDelay = requireNonNull(maxDelay, "maxDelay");
    this.increment = requireNonNull(increment, "increment");
    if (initialDelay.isNegative())
      throw new IllegalArgumentException("initialDelay must not be negative");
    if (maxDelay.isNegative())
      throw new IllegalArgumentException("maxDelay must not be negative");
    if (increment.isNegative())
      throw new IllegalArgumentException("increment must not be negative");
  }

  @Override
  public Duration delay(int attempt) {
    if (attempt < 1)
      throw new IllegalArgumentException("attempt must be at least one");
    final long linear = initialDelay.toMillis() + increment.toMillis() * (attempt - 1L);
    return Duration.ofMillis(Math.max(0L, Math.min(linear, maxDelay.toMillis())));
  }

  @Override
  public boolean shouldRetry(int attempt, int maxAttempts) {
    return attempt <= maxAttempts;
  }

  @Override
  public void reset() {}

  @Override
  public String toString() {
    return "LinearBackoffPolicy [initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
        + ", increment=" + increment + "]";
  }
}
