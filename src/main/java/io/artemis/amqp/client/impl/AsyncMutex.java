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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Mutual exclusion for asynchronous sections.
 *
 * <p>Waiters do not block a thread, they get a future that completes when they own the mutex.
 * Ownership goes to waiters in arrival order.
 */
final class AsyncMutex {

  private final Lock lock = new ReentrantLock();
  private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
  private boolean held = false;

  CompletableFuture<Void> acquire() {
    lock.lock();
    try {
      if (!held) {
        held = true;
        return CompletableFuture.completedFuture(null);
      } else {
        CompletableFuture<Void> waiter = new CompletableFuture<>();
        waiters.add(waiter);
        return waiter;
      }
    } finally {
      lock.unlock();
    }
  }

  void release() {
    while (true) {
      CompletableFuture<Void> next;
      lock.lock();
      try {
        next = waiters.poll();
        if (next == null) {
          held = false;
          return;
        }
      } finally {
        lock.unlock();
      }
      // a cancelled waiter does not take ownership, try the next one
      if (next.complete(null)) {
        return;
      }
    }
  }

  /**
   * Run an asynchronous section once the mutex is owned, release it when the section completes.
   *
   * @param section the section to run
   * @return the result of the section
   */
  <T> CompletableFuture<T> withLock(Supplier<CompletableFuture<T>> section) {
    return acquire()
        .thenCompose(
            ignored -> {
              CompletableFuture<T> result;
              try {
                result = section.get();
              } catch (Exception e) {
                result = CompletableFuture.failedFuture(e);
              }
              return result.whenComplete((r, t) -> release());
            });
  }

  boolean isHeld() {
    lock.lock();
    try {
      return held;
    } finally {
      lock.unlock();
    }
  }
}
