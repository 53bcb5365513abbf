/*
 * Copyright (C) 2022 Temporal Technologies, Inc. All Rights Reserved.
 *
 * Copyright (C) 2012-2016 Amazon.com, Inc. or its affiliates. All Rights Reserved.
 *
 * Modifications copyright (C) 2017 Uber Technologies, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this material except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.cloudrpc.serviceclient.rpcretry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Exponentially growing delays.
 *
 * <p>The delay returned by the n-th call to {@link #onCompletion()} is:
 *
 * <pre>
 * jitter = random number in the range [-maxJitterCoefficient, +maxJitterCoefficient];
 * current = min(pow(scalingFactor, n - 1) * initialDelay, maximumDelay);
 * delay = min(current * (1 + jitter), maximumDelay);
 * </pre>
 *
 * The progression advances by the non-jittered value, so jitter never compounds. With {@code
 * maxJitterCoefficient == 0} the delays are exact, which is what the three argument constructor
 * gives.
 *
 * <p>Example usage:
 *
 * <pre><code>
 * BackoffPolicy backoff = new ExponentialBackoffPolicy(
 *     Duration.ofMillis(10), Duration.ofMinutes(5), 2.0, 0.1).copy();
 * while (true) {
 *     try {
 *         return call();
 *     } catch (StatusRuntimeException e) {
 *         ...
 *         Thread.sleep(backoff.onCompletion().toMillis());
 *     }
 * }
 * </code></pre>
 */
@NotThreadSafe
public final class ExponentialBackoffPolicy implements BackoffPolicy {

  private final Duration initialDelay;

  private final Duration maximumDelay;

  private final double scalingFactor;

  private final double maxJitterCoefficient;

  private long currentDelayNanos;

  public ExponentialBackoffPolicy(
      Duration initialDelay, Duration maximumDelay, double scalingFactor) {
    this(initialDelay, maximumDelay, scalingFactor, 0.0);
  }

  /**
   * Construct an instance of the policy.
   *
   * @param initialDelay delay returned by the first call to {@link #onCompletion()}
   * @param maximumDelay cap of the delays independently of number of calls
   * @param scalingFactor coefficient used to calculate the next delay
   * @param maxJitterCoefficient maximum jitter coefficient (in the range [0.0, 1.0[) to randomly
   *     add or subtract to the delay
   */
  public ExponentialBackoffPolicy(
      Duration initialDelay,
      Duration maximumDelay,
      double scalingFactor,
      double maxJitterCoefficient) {
    Objects.requireNonNull(initialDelay, "initialDelay");
    Objects.requireNonNull(maximumDelay, "maximumDelay");
    if (initialDelay.isNegative()) {
      throw new IllegalArgumentException("negative initialDelay: " + initialDelay);
    }
    if (maximumDelay.compareTo(initialDelay) < 0) {
      throw new IllegalArgumentException(
          "maximumDelay(" + maximumDelay + ") cannot be smaller than initialDelay(" + initialDelay
              + ")");
    }
    if (!Double.isFinite(scalingFactor) || scalingFactor < 1.0) {
      throw new IllegalArgumentException("scaling factor less than 1.0: " + scalingFactor);
    }
    if (maxJitterCoefficient < 0 || maxJitterCoefficient >= 1.0) {
      throw new IllegalArgumentException(
          "maxJitterCoefficient has to be >= 0 and < 1.0: " + maxJitterCoefficient);
    }
    this.initialDelay = initialDelay;
    this.maximumDelay = maximumDelay;
    this.scalingFactor = scalingFactor;
    this.maxJitterCoefficient = maxJitterCoefficient;
    this.currentDelayNanos = initialDelay.toNanos();
  }

  @Override
  public BackoffPolicy copy() {
    return new ExponentialBackoffPolicy(
        initialDelay, maximumDelay, scalingFactor, maxJitterCoefficient);
  }

  @Override
  public Duration onCompletion() {
    long maximumNanos = maximumDelay.toNanos();
    long delayNanos = currentDelayNanos;
    if (maxJitterCoefficient > 0) {
      double jitter =
          ThreadLocalRandom.current().nextDouble(-maxJitterCoefficient, maxJitterCoefficient);
      delayNanos = Math.min((long) (currentDelayNanos * (1 + jitter)), maximumNanos);
    }
    double next = currentDelayNanos * scalingFactor;
    currentDelayNanos = next >= maximumNanos ? maximumNanos : (long) next;
    return Duration.ofNanos(delayNanos);
  }

  public Duration getInitialDelay() {
    return initialDelay;
  }

  public Duration getMaximumDelay() {
    return maximumDelay;
  }

  public double getScalingFactor() {
    return scalingFactor;
  }

  public double getMaxJitterCoefficient() {
    return maxJitterCoefficient;
  }

  @Override
  public String toString() {
    return "ExponentialBackoffPolicy{"
        + "initialDelay="
        + initialDelay
        + ", maximumDelay="
        + maximumDelay
        + ", scalingFactor="
        + scalingFactor
        + ", maxJitterCoefficient="
        + maxJitterCoefficient
        + '}';
  }
}
