// Copyright (c) 2024 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package io.artemis.amqp.client.impl;

import io.artemis.amqp.client.AmqpException;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

final class Utils {

  private Utils() {}

  private static class NamedThreadFactory implements ThreadFactory {

    private final ThreadFactory backingThreadFactory;

    private final String prefix;

    private final AtomicLong count = new AtomicLong(0);

    private NamedThreadFactory(String prefix) {
      this(Executors.defaultThreadFactory(), prefix);
    }

    private NamedThreadFactory(ThreadFactory backingThreadFactory, String prefix) {
      this.backingThreadFactory = backingThreadFactory;
      this.prefix = prefix;
    }

    @Override
    public Thread newThread(Runnable r) {
      Thread thread = this.backingThreadFactory.newThread(r);
      thread.setName(prefix + count.getAndIncrement());
      thread.setDaemon(true);
      return thread;
    }
  }

  static ThreadFactory threadFactory(String prefix) {
    if (prefix == null) {
      return Executors.defaultThreadFactory();
    } else {
      return new NamedThreadFactory(prefix);
    }
  }

  /**
   * Link name with a short random suffix, e.g. <code>controller-link-3fa9c</code>.
   *
   * @param prefix name prefix
   * @return the link name
   */
  static String linkName(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().replace("-", "").substring(0, 5);
  }

  /**
   * Complete the future with an {@link AmqpException.AmqpOperationCancelledException} if it is
   * not complete after the timeout.
   */
  static <T> CompletableFuture<T> withTimeout(
      CompletableFuture<T> future,
      Duration timeout,
      ScheduledExecutorService scheduler,
      String format,
      Object... args) {
    if (timeout == null || future.isDone()) {
      return future;
    }
    ScheduledFuture<?> timeoutTask =
        scheduler.schedule(
            () -> {
              String operation = String.format(format, args);
              future.completeExceptionally(
                  new AmqpException.AmqpOperationCancelledException(
                      "%s timed out after %d ms", operation, timeout.toMillis()));
            },
            timeout.toMillis(),
            TimeUnit.MILLISECONDS);
    future.whenComplete((r, t) -> timeoutTask.cancel(false));
    return future;
  }

  static class StopWatch {

    private final long start = System.nanoTime();
    private Duration duration;

    Duration stop() {
      this.duration = Duration.ofNanos(System.nanoTime() - start);
      return this.duration;
    }
  }
}
