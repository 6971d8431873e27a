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

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import org.junit.jupiter.api.Test;

class LinearBackoffPolicyTest {
  @Test
  void givenPolicy_whenDelay_thenExactlyInitialPlusIncrementsCappedAtMax() {
    // Arrange
    final Duration initial = Duration.ofMillis(500);
    final Duration increment = Duration.ofMillis(250);
    final Duration max = Duration.ofSeconds(2);
    final LinearBackoffPolicy policy = new LinearBackoffPolicy(initial, max, increment);

    // Act & Assert
    for (int n = 1; n <= 20; n++) {
      final long expected = Math.min(initial.toMillis() + increment.toMillis() * (n - 1),
          max.toMillis());
      assertThat(policy.delay(n)).isEqualTo(Duration.ofMillis(expected));
    }
  }

  @Test
  void givenDefaults_whenDelay_thenOneSecondSteps() {
    final LinearBackoffPolicy policy = new LinearBackoffPolicy();

    assertThat(policy.delay(1)).isEqualTo(Duration.ofSeconds(1));
    assertThat(policy.delay(2)).isEqualTo(Duration.ofSeconds(2));
    assertThat(policy.delay(1000)).isEqualTo(Duration.ofMinutes(5));
  }
}
