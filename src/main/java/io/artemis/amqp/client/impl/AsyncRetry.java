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
import io.artemis.amqp.client.RecoveryPolicy;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs an asynchronous task until it succeeds, waiting between attempts according to a {@link
 * RecoveryPolicy}.
 *
 * <p>Cancelling the returned future stops the retries.
 */
final class AsyncRetry<V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(AsyncRetry.class);

  private final CompletableFuture<V> completableFuture = new CompletableFuture<>();
  private final Supplier<CompletableFuture<V>> task;
  private final String description;
  private final ScheduledExecutorService scheduler;
  private final RecoveryPolicy delayPolicy;
  private final Predicate<Throwable> retry;
  private volatile ScheduledFuture<?> pendingAttempt;

  private AsyncRetry(
      Supplier<CompletableFuture<V>> task,
      String description,
      ScheduledExecutorService scheduler,
      RecoveryPolicy delayPolicy,
      Predicate<Throwable> retry) {
    this.task = task;
    this.description = description;
    this.scheduler = scheduler;
    this.delayPolicy = delayPolicy;
    this.retry = retry;
    this.completableFuture.whenComplete(
        (v, t) -> {
          ScheduledFuture<?> attempt = this.pendingAttempt;
          if (attempt != null) {
            attempt.cancel(false);
          }
        });
  }

  static <V> AsyncRetryBuilder<V> asyncRetry(Supplier<CompletableFuture<V>> task) {
    return new AsyncRetryBuilder<>(task);
  }

  private void attempt(int attempt, Throwable lastFailure) {
    if (this.completableFuture.isDone()) {
      LOGGER.debug("Task '{}' cancelled, no attempt #{}", this.description, attempt);
      return;
    }
    Duration delay = this.delayPolicy.delay(attempt);
    if (RecoveryPolicy.TIMEOUT.equals(delay)) {
      LOGGER.debug("Task '{}' stopped after {} attempt(s)", this.description, attempt);
      this.completableFuture.completeExceptionally(
          lastFailure == null
              ? new AmqpException("Task '%s' not attempted", this.description)
              : lastFailure);
      return;
    }
    Runnable run = () -> this.run(attempt);
    if (delay.isZero()) {
      run.run();
    } else {
      LOGGER.debug(
          "Scheduling attempt #{} of task '{}' in {} ms",
          attempt,
          this.description,
          delay.toMillis());
      this.pendingAttempt = this.scheduler.schedule(run, delay.toMillis(), TimeUnit.MILLISECONDS);
    }
  }

  private void run(int attempt) {
    if (this.completableFuture.isDone()) {
      return;
    }
    LOGGER.debug("Running task '{}', attempt #{}", this.description, attempt);
    CompletableFuture<V> result;
    try {
      result = this.task.get();
    } catch (Exception e) {
      result = CompletableFuture.failedFuture(e);
    }
    result.whenComplete(
        (value, failure) -> {
          if (failure == null) {
            LOGGER.debug("Task '{}' succeeded at attempt #{}", this.description, attempt);
            this.completableFuture.complete(value);
          } else {
            Throwable cause = ExceptionUtils.unwrap(failure);
            if (this.retry.test(cause)) {
              LOGGER.debug(
                  "Attempt #{} of task '{}' failed: {}",
                  attempt,
                  this.description,
                  cause.getMessage());
              this.attempt(attempt + 1, cause);
            } else {
              LOGGER.debug(
                  "Non-retryable failure for task '{}': {}", this.description, cause.getMessage());
              this.completableFuture.completeExceptionally(cause);
            }
          }
        });
  }

  static class AsyncRetryBuilder<V> {

    private final Supplier<CompletableFuture<V>> task;
    private String description = "";
    private ScheduledExecutorService scheduler;
    private RecoveryPolicy delayPolicy = RecoveryPolicy.fixed(Duration.ofSeconds(1));
    private Predicate<Throwable> retry = e -> true;

    AsyncRetryBuilder(Supplier<CompletableFuture<V>> task) {
      this.task = task;
    }

    AsyncRetryBuilder<V> scheduler(ScheduledExecutorService scheduler) {
      this.scheduler = scheduler;
      return this;
    }

    AsyncRetryBuilder<V> delay(Duration delay) {
      this.delayPolicy = RecoveryPolicy.fixedWithInitialDelay(Duration.ZERO, delay);
      return this;
    }

    AsyncRetryBuilder<V> delayPolicy(RecoveryPolicy delayPolicy) {
      this.delayPolicy = delayPolicy;
      return this;
    }

    AsyncRetryBuilder<V> retry(Predicate<Throwable> predicate) {
      this.retry = predicate;
      return this;
    }

    AsyncRetryBuilder<V> description(String description, Object... args) {
      this.description = String.format(description, args);
      return this;
    }

    CompletableFuture<V> build() {
      AsyncRetry<V> asyncRetry =
          new AsyncRetry<>(task, description, scheduler, delayPolicy, retry);
      asyncRetry.attempt(0, null);
      return asyncRetry.completableFuture;
    }
  }
}
