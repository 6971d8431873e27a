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

import io.aleph0.tether.core.Measureable;

public interface Topic<T> extends Subscribable<T>, Measureable<Topic.Metrics>, AutoCloseable {
  public static record Metrics(long published, long subscribers, long failures) {
    public Metrics {
      if (published < 0)
        throw new IllegalArgumentException("published must be at least zero");
      if (subscribers < 0)
        throw new IllegalArgumentException("subscribers must be at least zero");
      if (failures < 0)
        throw new IllegalArgumentException("failures must be at least zero");
    }
  }

  /**
   * Delivers the event to every current subscriber, in subscription order.
   * 
   * @param event the event
   * @throws IllegalStateException if the topic is closed
   */
  public void publish(T event);

  public boolean isClosed();

  /**
   * Closes the topic and notifies subscribers. Closing a closed topic does nothing.
   */
  @Override
  public void close();
}
