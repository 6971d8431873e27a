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
import io.aleph0.tether.core.Config;

/**
 * Creates {@link ReconnectionPolicy} instances from a {@link ReconnectionPolicyType} and optional
 * parameters. Parameters left unset fall back to the defaults of the chosen policy:
 * 
 * <ul>
 * <li>{@code EXPONENTIAL}: initial delay 1s, max delay 5min, multiplier 2.0, randomization 0.1</li>
 * <li>{@code LINEAR}: initial delay 1s, max delay 5min, increment 1s</li>
 * <li>{@code FIXED}: delay 5s, taken from the initial delay when one is given</li>
 * <li>{@code NONE}: no parameters</li>
 * </ul>
 */
public final class ReconnectionPolicies {
  private ReconnectionPolicies() {}

  public static Builder builder(ReconnectionPolicyType type) {
    return new Builder(type);
  }

  public static ReconnectionPolicy create(ReconnectionPolicyType type) {
    return builder(type).build();
  }

  /**
   * The policy a manager uses when none is given explicitly. Reconnection disabled means
   * {@link NoReconnectionPolicy}.
   */
  public static ReconnectionPolicy fromConfig(Config config) {
    requireNonNull(config, "config");
    if (!config.enableReconnection())
      return NoReconnectionPolicy.INSTANCE;
    return builder(config.reconnectionPolicy())
        .setInitialDelay(config.initialReconnectionDelay())
        .setMaxDelay(config.maxReconnectionDelay()).setMultiplier(config.backoffMultiplier())
        .build();
  }

  public static class Builder {
    private final ReconnectionPolicyType type;
    private Duration initialDelay;
    private Duration maxDelay;
    private Double multiplier;
    private Double randomizationFactor;
    private Duration increment;

    private Builder(ReconnectionPolicyType type) {
      this.type = requireNonNull(type, "type");
    }

    public Builder setInitialDelay(Duration initialDelay) {
      this.initialDelay = initialDelay;
      return this;
    }

    public Builder setMaxDelay(Duration maxDelay) {
      this.maxDelay = maxDelay;
      return this;
    }

    public Builder setMultiplier(double multiplier) {
      this.multiplier = multiplier;
      return this;
    }

    public Builder setRandomizationFactor(double randomizationFactor) {
      this.randomizationFactor = randomizationFactor;
      return this;
    }

    public Builder setIncrement(Duration increment) {
      this.increment = increment;
      return this;
    }

    public ReconnectionPolicy build() {
      switch (type) {
        case EXPONENTIAL:
          return new ExponentialBackoffPolicy(
              orElse(initialDelay, ExponentialBackoffPolicy.DEFAULT_INITIAL_DELAY),
              orElse(maxDelay, ExponentialBackoffPolicy.DEFAULT_MAX_DELAY),
              orElse(multiplier, ExponentialBackoffPolicy.DEFAULT_MULTIPLIER),
              orElse(randomizationFactor, ExponentialBackoffPolicy.DEFAULT_RANDOMIZATION_FACTOR));
        case LINEAR:
          return new LinearBackoffPolicy(
              orElse(initialDelay, LinearBackoffPolicy.DEFAULT_INITIAL_DELAY),
              orElse(maxDelay, LinearBackoffPolicy.DEFAULT_MAX_DELAY),
              orElse(increment, LinearBackoffPolicy.DEFAULT_INCREMENT));
        case FIXED:
          return new FixedDelayPolicy(orElse(initialDelay, FixedDelayPolicy.DEFAULT_DELAY));
        case NONE:
          return NoReconnectionPolicy.INSTANCE;
        default:
          throw new AssertionError("unknown policy type " + type);
      }
    }

    private static <T> T orElse(T value, T defaultValue) {
      return value != null ? value : defaultValue;
    }
  }
}
