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
package io.artemis.amqp.client;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Contract to determine the delay before each attempt to re-establish a connection.
 *
 * <p>Attempts are numbered from 0: attempt 0 is the first connection attempt after a failure,
 * attempt 1 the first retry, and so on. The count starts over after each successful connection.
 *
 * @see ConnectionBuilder.RecoveryConfiguration#policy(RecoveryPolicy)
 */
public interface RecoveryPolicy {

  /** Delay returned to signal that no more attempts should be made. */
  Duration TIMEOUT = Duration.ofMillis(Long.MAX_VALUE);

  /**
   * Returns the delay to use for a given attempt.
   *
   * <p>The policy can return the {@link #TIMEOUT} constant to indicate that recovery should stop.
   *
   * @param attempt number of the attempt, starting at 0
   * @return the delay, {@link #TIMEOUT} if there should be no more attempts
   */
  Duration delay(int attempt);

  /**
   * Whether a given attempt should be made.
   *
   * @param attempt number of the attempt, starting at 0
   * @return true if the attempt should be made
   */
  default boolean shouldRetry(int attempt) {
    return !TIMEOUT.equals(delay(attempt));
  }

  /**
   * Policy with a fixed delay and no limit of attempts.
   *
   * @param delay the fixed delay
   * @return fixed-delay policy
   */
  static RecoveryPolicy fixed(Duration delay) {
    return new FixedWithInitialDelayRecoveryPolicy(delay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @return fixed-delay policy with initial delay
   */
  static RecoveryPolicy fixedWithInitialDelay(Duration initialDelay, Duration delay) {
    return new FixedWithInitialDelayRecoveryPolicy(initialDelay, delay);
  }

  /**
   * Policy with an initial delay for the first attempt, then a fixed delay, and a timeout.
   *
   * @param initialDelay delay for the first attempt
   * @param delay delay for other attempts than the first one
   * @param timeout timeout
   * @return fixed-delay policy with initial delay and timeout
   */
  static RecoveryPolicy fixedWithInitialDelay(
      Duration initialDelay, Duration delay, Duration timeout) {
    return new FixedWithInitialDelayAndTimeoutRecoveryPolicy(initialDelay, delay, timeout);
  }

  /**
   * Policy with the same delay before every attempt and a bounded number of retries.
   *
   * <p><code>constantBackoff(Duration.ofMillis(10), 1)</code> allows 2 attempts: the first one
   * and a single retry.
   *
   * @param delay the delay before each attempt
   * @param retryCount the number of retries after the first attempt
   * @return constant back-off policy
   */
  static RecoveryPolicy constantBackoff(Duration delay, int retryCount) {
    return new ConstantBackoffRecoveryPolicy(delay, retryCount);
  }

  /**
   * Policy with the same delay before every attempt and no limit of attempts.
   *
   * @param delay the delay before each attempt
   * @return constant back-off policy
   */
  static RecoveryPolicy constantBackoff(Duration delay) {
    return new ConstantBackoffRecoveryPolicy(delay, Integer.MAX_VALUE);
  }

  /**
   * Policy with an exponentially growing delay, capped at a maximum, with random jitter.
   *
   * @param initialDelay delay before the first attempt
   * @param maxDelay maximum delay
   * @param retryCount the number of retries after the first attempt
   * @param jitter jitter factor between 0 and 1, the delay varies by +/- this proportion
   * @return exponential back-off policy
   */
  static RecoveryPolicy exponentialBackoff(
      Duration initialDelay, Duration maxDelay, int retryCount, double jitter) {
    return new ExponentialBackoffRecoveryPolicy(initialDelay, maxDelay, retryCount, jitter);
  }

  /**
   * Exponential back-off policy with no limit of attempts and a 0.2 jitter factor.
   *
   * @param initialDelay delay before the first attempt
   * @param maxDelay maximum delay
   * @return exponential back-off policy
   */
  static RecoveryPolicy exponentialBackoff(Duration initialDelay, Duration maxDelay) {
    return exponentialBackoff(initialDelay, maxDelay, Integer.MAX_VALUE, 0.2);
  }

  /**
   * Policy that allows a single immediate attempt.
   *
   * @return single-attempt policy
   */
  static RecoveryPolicy noRetry() {
    return attempt -> attempt == 0 ? Duration.ZERO : TIMEOUT;
  }

  final class FixedWithInitialDelayRecoveryPolicy implements RecoveryPolicy {

    private final Duration initialDelay;
    private final Duration delay;

    private FixedWithInitialDelayRecoveryPolicy(Duration initialDelay, Duration delay) {
      this.initialDelay = initialDelay;
      this.delay = delay;
    }

    @Override
    public Duration delay(int attempt) {
      return attempt == 0 ? initialDelay : delay;
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayRecoveryPolicy{"
          + "initialDelay="
          + initialDelay
          + ", delay="
          + delay
          + '}';
    }
  }

  final class FixedWithInitialDelayAndTimeoutRecoveryPolicy implements RecoveryPolicy {

    private final int attemptLimitBeforeTimeout;
    private final RecoveryPolicy delegate;

    private FixedWithInitialDelayAndTimeoutRecoveryPolicy(
        Duration initialDelay, Duration delay, Duration timeout) {
      if (timeout.toMillis() < initialDelay.toMillis()) {
        throw new IllegalArgumentException("Timeout must be longer than initial delay");
      }
      if (delay.isZero() || delay.isNegative()) {
        throw new IllegalArgumentException("Delay must be positive");
      }
      this.delegate = fixedWithInitialDelay(initialDelay, delay);
      long timeoutWithInitialDelay = timeout.toMillis() - initialDelay.toMillis();
      this.attemptLimitBeforeTimeout = (int) (timeoutWithInitialDelay / delay.toMillis()) + 1;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt >= attemptLimitBeforeTimeout) {
        return TIMEOUT;
      } else {
        return delegate.delay(attempt);
      }
    }

    @Override
    public String toString() {
      return "FixedWithInitialDelayAndTimeoutRecoveryPolicy{"
          + "attemptLimitBeforeTimeout="
          + attemptLimitBeforeTimeout
          + ", delegate="
          + delegate
          + '}';
    }
  }

  final class ConstantBackoffRecoveryPolicy implements RecoveryPolicy {

    private final Duration delay;
    private final int retryCount;

    private ConstantBackoffRecoveryPolicy(Duration delay, int retryCount) {
      if (delay.isNegative()) {
        throw new IllegalArgumentException("Delay cannot be negative");
      }
      if (retryCount < 0) {
        throw new IllegalArgumentException("Retry count cannot be negative");
      }
      this.delay = delay;
      this.retryCount = retryCount;
    }

    @Override
    public Duration delay(int attempt) {
      return attempt > retryCount ? TIMEOUT : delay;
    }

    @Override
    public String toString() {
      return "ConstantBackoffRecoveryPolicy{" + "delay=" + delay + ", retryCount=" + retryCount + '}';
    }
  }

  final class ExponentialBackoffRecoveryPolicy implements RecoveryPolicy {

    private final long initialDelayMs;
    private final long maxDelayMs;
    private final int retryCount;
    private final double jitter;

    private ExponentialBackoffRecoveryPolicy(
        Duration initialDelay, Duration maxDelay, int retryCount, double jitter) {
      if (initialDelay.isNegative() || maxDelay.compareTo(initialDelay) < 0) {
        throw new IllegalArgumentException(
            "Initial delay must be positive and lower than max delay");
      }
      if (jitter < 0 || jitter > 1) {
        throw new IllegalArgumentException("Jitter must be between 0 and 1");
      }
      if (retryCount < 0) {
        throw new IllegalArgumentException("Retry count cannot be negative");
      }
      this.initialDelayMs = initialDelay.toMillis();
      this.maxDelayMs = maxDelay.toMillis();
      this.retryCount = retryCount;
      this.jitter = jitter;
    }

    @Override
    public Duration delay(int attempt) {
      if (attempt > retryCount) {
        return TIMEOUT;
      }
      long delay = initialDelayMs;
      for (int i = 0; i < attempt && delay > 0 && delay < maxDelayMs; i++) {
        delay = delay * 2;
      }
      delay = Math.min(delay, maxDelayMs);
      if (jitter > 0 && delay > 0) {
        double factor = 1 + ThreadLocalRandom.current().nextDouble(-jitter, jitter);
        delay = Math.min((long) (delay * factor), maxDelayMs);
      }
      return Duration.ofMillis(Math.max(delay, 0));
    }

    @Override
    public String toString() {
      return "ExponentialBackoffRecoveryPolicy{"
          + "initialDelayMs="
          + initialDelayMs
          + ", maxDelayMs="
          + maxDelayMs
          + ", retryCount="
          + retryCount
          + ", jitter="
          + jitter
          + '}';
    }
  }
}
