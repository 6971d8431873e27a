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
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Exponential backoff with jitter. The base delay for attempt {@code n} is
 * {@code initialDelay * multiplier^(n-1)}, capped at {@code maxDelay}. The returned delay is the
 * base delay scaled by a uniform factor in {@code [1 - randomizationFactor, 1 + randomizationFactor]}
 * so that many clients losing the same server do not reconnect in lockstep.
 */
public class ExponentialBackoffPolicy implements ReconnectionPolicy {
  public static final Duration DEFAULT_INITIAL_DELAY = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_DELAY = Duration.ofMinutes(5);
  public static final double DEFAULT_MULTIPLIER = 2.0;
  public static final double DEFAULT_RANDOMIZATION_FACTOR = 0.1;

  private final Duration initialDelay;
  private final Duration maxDelay;
  private final double multiplier;
  private final double randomizationFactor;
  private final Supplier<Random> random;

  public ExponentialBackoffPolicy() {
    this(DEFAULT_INITIAL_DELAY, DEFAULT_MAX_DELAY, DEFAULT_MULTIPLIER,
        DEFAULT_RANDOMIZATION_FACTOR);
  }

  public ExponentialBackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
      double randomizationFactor) {
    this(initialDelay, maxDelay, multiplier, randomizationFactor, ThreadLocalRandom::current);
  }

  public ExponentialBackoffPolicy(Duration initialDelay, Duration maxDelay, double multiplier,
      double randomizationFactor, Supplier<Random> random) {
    this.initialDelay = requireNonNull(initialDelay, "initialDelay");
    this.maxDelay = requireNonNull(maxDelay, "maxDelay");
    this.random = requireNonNull(random, "random");
    if (initialDelay.isNegative())
      throw new IllegalArgumentException("initialDelay must not be negative");
    if (maxDelay.isNegative())
      throw new IllegalArgumentException("maxDelay must not be negative");
    if (multiplier < 1.0)
      throw new IllegalArgumentException("multiplier must be at least 1.0");
    if (randomizationFactor < 0.0 || randomizationFactor > 1.0)
      throw new IllegalArgumentException("randomizationFactor must be between 0.0 and 1.0");
    this.multiplier = multiplier;
    this.randomizationFactor = randomizationFactor;
  }

  /**
   * The delay for the given attempt before jitter is applied.
   */
  public Duration baseDelay(int attempt) {
    if (attempt < 1)
      throw new IllegalArgumentException("attempt must be at least one");
    final double exponential = initialDelay.toMillis() * Math.pow(multiplier, attempt - 1);
    final double capped = Math.max(0.0, Math.min(exponential, maxDelay.toMillis()));
    return Duration.ofMillis(Math.round(capped));
  }

  @Override
  public Duration delay(int attempt) {
    final long base = baseDelay(attempt).toMillis();
    final double factor =
        1.0 + randomizationFactor * (random.get().nextDouble() * 2.0 - 1.0);
    return Duration.ofMillis((long) (base * factor));
  }

  @Override
  public boolean shouldRetry(int attempt, int maxAttempts) {
    return attempt <= maxAttempts;
  }

  @Override
  public void reset() {}

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaxDelay() {
    return maxDelay;
  }

  public double getMultiplier() {
    return multiplier;
  }

  public double getRandomizationFactor() {
    return randomizationFactor;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffPolicy [initialDelay=" + initialDelay + ", maxDelay=" + maxDelay
        + ", multiplier=" + multiplier + ", randomizationFactor=" + randomizationFactor + "]";
  }
}
