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
package io.aleph0.tether.core.event;

/**
 * The read side of a {@link Topic}. Callers subscribe here; only the owner of the topic can
 * publish to it.
 */
public interface Subscribable<T> {
  /**
   * Receives the events published to a topic. Events are delivered in publish order, each at
   * most once. Listeners run on the publisher's thread and must not block.
   */
  @FunctionalInterface
  public static interface Listener<T> {
    public void onEvent(T event);

    /**
     * Called once when the topic is closed. No events follow.
     */
    default void onClosed() {}
  }

  /**
   * Registers a listener. Subscribing to a closed topic returns a subscription that is already
   * closed, and the listener's {@link Listener#onClosed()} is called immediately.
   * 
   * @param listener the listener
   * @return the subscription, which the caller closes to stop receiving events
   */
  public Subscription subscribe(Listener<? super T> listener);
}
