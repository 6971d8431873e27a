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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import io.aleph0.tether.core.policy.ReconnectionPolicyType;

class ConfigTest {
  private static final URI ENDPOINT = URI.create("ws://localhost:8080/stream");

  @Test
  void givenBuilder_whenBuildWithoutChanges_thenDefaultsApply() {
    final Config config = Config.builder(ENDPOINT).build();

    assertThat(config.connectionTimeout()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.enableReconnection()).isTrue();
    assertThat(config.maxReconnectionAttempts()).isEqualTo(10);
    assertThat(config.reconnectionPolicy()).isEqualTo(ReconnectionPolicyType.EXPONENTIAL);
    assertThat(config.initialReconnectionDelay()).isEqualTo(Duration.ofSeconds(1));
    assertThat(config.maxReconnectionDelay()).isEqualTo(Duration.ofMinutes(5));
    assertThat(config.backoffMultiplier()).isEqualTo(2.0);
    assertThat(config.enableMessageQueue()).isTrue();
    assertThat(config.maxQueueSize()).isEqualTo(1000);
    assertThat(config.drainBatchSize()).isEqualTo(50);
    assertThat(config.heartbeatInterval()).isEqualTo(Duration.ofSeconds(30));
    assertThat(config.enableHeartbeat()).isTrue();
    assertThat(config.headers()).isEmpty();
    assertThat(config.protocols()).isEmpty();
  }

  @Test
  void givenPresets_whenBuild_thenPresetValuesApply() {
    final Config aggressive = Config.aggressive(ENDPOINT);
    assertThat(aggressive.connectionTimeout()).isEqualTo(Duration.ofSeconds(15));
    assertThat(aggressive.maxReconnectionAttempts()).isEqualTo(20);
    assertThat(aggressive.initialReconnectionDelay()).isEqualTo(Duration.ofMillis(500));
    assertThat(aggressive.backoffMultiplier()).isEqualTo(1.5);
    assertThat(aggressive.maxQueueSize()).isEqualTo(2000);

    final Config testing = Config.testing(ENDPOINT);
    assertThat(testing.enableReconnection()).isFalse();
    assertThat(testing.enableMessageQueue()).isFalse();
    assertThat(testing.enableHeartbeat()).isFalse();

    assertThat(Config.production(ENDPOINT)).isEqualTo(Config.builder(ENDPOINT).build());
  }

  @Test
  void givenConfig_whenToBuilderAndBuild_thenEqual() {
    final Config config = Config.builder(ENDPOINT).setMaxQueueSize(7).setHeaders(Map.of("a", "b"))
        .setProtocols(List.of("chat")).setDrainBatchSize(3).build();

    assertThat(config.toBuilder().build()).isEqualTo(config);
    assertThat(config.toBuilder().setMaxQueueSize(8).build().maxQueueSize()).isEqualTo(8);
  }

  @Test
  void givenInvalidValues_whenBuild_thenThrowsIllegalArgumentException() {
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Config.builder(ENDPOINT).setBackoffMultiplier(0.5).build())
        .withMessageContaining("backoffMultiplier");
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Config.builder(ENDPOINT).setDrainBatchSize(0).build())
        .withMessageContaining("drainBatchSize");
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Config.builder(ENDPOINT).setHeartbeatInterval(Duration.ZERO).build())
        .withMessageContaining("heartbeatInterval");
    assertThatExceptionOfType(IllegalArgumentException.class)
        .isThrownBy(() -> Config.builder(ENDPOINT).setMaxQueueSize(-1).build());
  }
}
