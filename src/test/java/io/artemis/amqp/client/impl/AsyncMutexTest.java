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

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.Test;

public class AsyncMutexTest {

  @Test
  void waitersShouldGetOwnershipInArrivalOrder() {
    AsyncMutex mutex = new AsyncMutex();
    assertThat(mutex.acquire()).isCompleted();
    CompletableFuture<Void> second = mutex.acquire();
    CompletableFuture<Void> third = mutex.acquire();
    assertThat(second).isNotDone();
    assertThat(third).isNotDone();

    mutex.release();
    assertThat(second).isCompleted();
    assertThat(third).isNotDone();

    mutex.release();
    assertThat(third).isCompleted();
    mutex.release();
    assertThat(mutex.isHeld()).isFalse();
  }

  @Test
  void cancelledWaiterShouldBeSkipped() {
    AsyncMutex mutex = new AsyncMutex();
    mutex.acquire();
    CompletableFuture<Void> cancelled = mutex.acquire();
    CompletableFuture<Void> next = mutex.acquire();
    cancelled.cancel(false);
    mutex.release();
    assertThat(next).isCompleted();
    assertThat(mutex.isHeld()).isTrue();
  }

  @Test
  void sectionsShouldNotOverlap() {
    AsyncMutex mutex = new AsyncMutex();
    List<String> events = new CopyOnWriteArrayList<>();
    CompletableFuture<Void> firstSection = new CompletableFuture<>();
    CompletableFuture<String> first =
        mutex.withLock(
            () -> {
              events.add("first-start");
              return firstSection.thenApply(
                  v -> {
                    events.add("first-end");
                    return "first";
                  });
            });
    CompletableFuture<String> second =
        mutex.withLock(
            () -> {
              events.add("second");
              return CompletableFuture.completedFuture("second");
            });
    assertThat(events).containsExactly("first-start");
    assertThat(second).isNotDone();

    firstSection.complete(null);
    assertThat(first).isCompletedWithValue("first");
    assertThat(second).isCompletedWithValue("second");
    assertThat(events).containsExactly("first-start", "first-end", "second");
    assertThat(mutex.isHeld()).isFalse();
  }

  @Test
  void failingSectionShouldReleaseMutex() {
    AsyncMutex mutex = new AsyncMutex();
    CompletableFuture<Object> failed =
        mutex.withLock(
            () -> {
              throw new IllegalStateException();
            });
    assertThat(failed).isCompletedExceptionally();
    assertThat(mutex.isHeld()).isFalse();
  }
}
