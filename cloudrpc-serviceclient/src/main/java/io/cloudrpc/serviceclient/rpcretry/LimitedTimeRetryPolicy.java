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

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import io.grpc.Status;
import java.time.Duration;
import java.util.function.Predicate;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Allows retries until a fixed amount of time has passed since the policy was created. {@link
 * #copy()} restarts the clock, which is what makes every call get the full {@code
 * maximumDuration}.
 */
@NotThreadSafe
public final class LimitedTimeRetryPolicy extends AbstractRetryPolicy {

  private final Duration maximumDuration;
  private final Ticker ticker;
  private final long deadlineNanos;

  public LimitedTimeRetryPolicy(Duration maximumDuration) {
    this(maximumDuration, defaultIsRetryable());
  }

  public LimitedTimeRetryPolicy(Duration maximumDuration, Predicate<Status> isRetryable) {
    this(maximumDuration, isRetryable, Ticker.systemTicker());
  }

  public LimitedTimeRetryPolicy(
      Duration maximumDuration, Predicate<Status> isRetryable, Ticker ticker) {
    super(isRetryable);
    Preconditions.checkNotNull(maximumDuration, "maximumDuration");
    Preconditions.checkArgument(
        !maximumDuration.isNegative(), "negative maximumDuration: %s", maximumDuration);
    this.maximumDuration = maximumDuration;
    this.ticker = Preconditions.checkNotNull(ticker, "ticker");
    this.deadlineNanos = ticker.read() + maximumDuration.toNanos();
  }

  @Override
  public RetryPolicy copy() {
    return new LimitedTimeRetryPolicy(maximumDuration, isRetryable, ticker);
  }

  @Override
  public boolean isExhausted() {
    return ticker.read() - deadlineNanos >= 0;
  }

  @Override
  protected void recordFailure() {}

  public Duration getMaximumDuration() {
    return maximumDuration;
  }

  @Override
  public String toString() {
    return "LimitedTimeRetryPolicy{maximumDuration=" + maximumDuration + '}';
  }
}
