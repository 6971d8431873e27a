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
package io.aleph0.tether.core.loop;

import static org.assertj.core.api.Assertions.assertThat;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

class EventLoopTest {
  private EventLoop loop;

  @BeforeEach
  void setup() {
    loop = EventLoop.create("event-loop-test");
  }

  @AfterEach
  void teardown() {
    loop.close();
  }

  @Test
  @Timeout(5)
  void givenTasks_whenExecute_thenRunInSubmissionOrderOnLoopThread() throws Exception {
    // Arrange
    final List<Integer> order = new CopyOnWriteArrayList<>();
    final List<Boolean> onLoop = new CopyOnWriteArrayList<>();

    // Act
    for (int i = 0; i < 100; i++) {
      final int n = i;
      loop.execute(() -> {
        order.add(n);
        onLoop.add(loop.inEventLoop());
      });
    }
    loop.call(() -> null).get();

    // Assert
    assertThat(order).hasSize(100);
    assertThat(order).isSorted();
    assertThat(onLoop).containsOnly(true);
    assertThat(loop.inEventLoop()).isFalse();
  }

  @Test
  @Timeout(5)
  void givenCallOnLoop_whenSubmitNested_thenRunsInline() throws Exception {
    final Integer result =
        loop.submit(() -> loop.call(() -> loop.inEventLoop() ? 1 : 0)).get();

    assertThat(result).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenThrowingOperation_whenSubmit_thenFutureFails() {
    final CompletableFuture<Object> result = loop.submit(() -> {
      throw new IllegalStateException("boom");
    });

    assertThat(result).failsWithin(Duration.ofSeconds(1));
  }

  @Test
  @Timeout(5)
  void givenScheduledTimer_whenFires_thenNoLongerPending() throws Exception {
    // Arrange
    final CountDownLatch fired = new CountDownLatch(1);

    // Act
    final Timer timer = loop.schedule(Duration.ofMillis(10), fired::countDown);
    fired.await();
    loop.call(() -> null).get();

    // Assert
    assertThat(timer.isPending()).isFalse();
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenScheduledTimer_whenCancelled_thenNeverFires() throws Exception {
    final AtomicInteger fired = new AtomicInteger(0);

    final Timer timer = loop.schedule(Duration.ofMillis(50), fired::incrementAndGet);
    assertThat(loop.pendingTimers()).isEqualTo(1);
    timer.cancel();
    Thread.sleep(100L);

    assertThat(fired.get()).isZero();
    assertThat(timer.isPending()).isFalse();
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenPeriodicTimer_whenRunning_thenFiresRepeatedlyUntilCancelled() throws Exception {
    // Arrange
    final CountDownLatch ticks = new CountDownLatch(3);

    // Act
    final Timer timer =
        loop.scheduleAtFixedRate(Duration.ZERO, Duration.ofMillis(5), ticks::countDown);
    final boolean ticked = ticks.await(2, TimeUnit.SECONDS);
    timer.cancel();

    // Assert
    assertThat(ticked).isTrue();
    assertThat(loop.pendingTimers()).isZero();
  }

  @Test
  @Timeout(5)
  void givenPendingTimers_whenClose_thenAllCancelledAndLaterTasksDropped() throws Exception {
    // Arrange
    final AtomicInteger fired = new AtomicInteger(0);
    loop.schedule(Duration.ofSeconds(10), fired::incrementAndGet);
    loop.scheduleAtFixedRate(Duration.ofSeconds(10), Duration.ofSeconds(10),
        fired::incrementAndGet);

    // Act
    loop.close();
    loop.execute(fired::incrementAndGet);
    final Timer late = loop.schedule(Duration.ZERO, fired::incrementAndGet);

    // Assert
    assertThat(loop.isClosed()).isTrue();
    assertThat(loop.pendingTimers()).isZero();
    assertThat(late.isPending()).isFalse();
    assertThat(fired.get()).isZero();
    assertThat(loop.call(() -> 1)).isCompletedExceptionally();
  }
}
