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

import static java.util.Objects.requireNonNull;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fan-out {@link Topic}. Publishing is synchronous: each subscriber's listener is called on the
 * publishing thread before {@link #publish(Object)} returns. A listener that throws is logged and
 * skipped, so it cannot prevent delivery to the remaining subscribers.
 */
public class DefaultTopic<T> implements Topic<T> {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultTopic.class);

  private final AtomicLong published = new AtomicLong(0);
  private final AtomicLong failures = new AtomicLong(0);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private final String name;
  private final List<DefaultSubscription> subscribers = new CopyOnWriteArrayList<>();

  public DefaultTopic(String name) {
    this.name = requireNonNull(name, "name");
  }

  private class DefaultSubscription implements Subscription {
    private final Listener<? super T> listener;
    private final AtomicBoolean active = new AtomicBoolean(true);

    public DefaultSubscription(Listener<? super T> listener) {
      this.listener = requireNonNull(listener, "listener");
    }

    @Override
    public boolean isActive() {
      return active.get();
    }

    @Override
    public void close() {
      if (active.getAndSet(false) == true)
        subscribers.remove(this);
    }

    private void deliver(T event) {
      if (active.get() == false)
        return;
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        failures.incrementAndGet();
        LOGGER.atError().addKeyValue("topic", name).setCause(e).log("Topic listener failed");
      }
    }

    private void closed() {
      if (active.getAndSet(false) == false)
        return;
      try {
        listener.onClosed();
      } catch (RuntimeException e) {
        failures.incrementAndGet();
        LOGGER.atError().addKeyValue("topic", name).setCause(e)
            .log("Topic listener failed on close");
      }
    }
  }

  @Override
  public Subscription subscribe(Listener<? super T> listener) {
    final DefaultSubscription result = new DefaultSubscription(listener);
    subscribers.add(result);
    if (closed.get()) {
      subscribers.remove(result);
      result.closed();
    }
    return result;
  }

  @Override
  public void publish(T event) {
    requireNonNull(event, "event");
    if (closed.get())
      throw new IllegalStateException("closed");
    for (DefaultSubscription subscriber : subscribers)
      subscriber.deliver(event);
    published.incrementAndGet();
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.getAndSet(true) == false) {
      LOGGER.atDebug().addKeyValue("topic", name).log("Topic closed");
      for (DefaultSubscription subscriber : subscribers)
        subscriber.closed();
      subscribers.clear();
    }
  }

  @Override
  public Metrics checkMetrics() {
    return new Metrics(published.get(), subscribers.size(), failures.get());
  }

  @Override
  public Metrics flushMetrics() {
    final Metrics result = checkMetrics();
    published.set(0L);
    failures.set(0L);
    return result;
  }

  @Override
  public String toString() {
    return "DefaultTopic [name=" + name + "]";
  }
}
