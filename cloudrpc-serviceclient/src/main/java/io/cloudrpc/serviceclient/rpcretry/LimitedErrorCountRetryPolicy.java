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
import io.grpc.Status;
import java.util.function.Predicate;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Tolerates up to {@code maximumFailures} transient failures. A call under this policy gets at
 * most {@code maximumFailures + 1} attempts.
 */
@NotThreadSafe
public final class LimitedErrorCountRetryPolicy extends AbstractRetryPolicy {

  private final int maximumFailures;
  private int failureCount = 0;

  public LimitedErrorCountRetryPolicy(int maximumFailures) {
    this(maximumFailures, defaultIsRetryable());
  }

  public LimitedErrorCountRetryPolicy(int maximumFailures, Predicate<Status> isRetryable) {
    super(isRetryable);
    Preconditions.checkArgument(
        maximumFailures >= 0, "negative maximumFailures: %s", maximumFailures);
    this.maximumFailures = maximumFailures;
  }

  @Override
  public RetryPolicy copy() {
    return new LimitedErrorCountRetryPolicy(maximumFailures, isRetryable);
  }

  @Override
  public boolean isExhausted() {
    return failureCount > maximumFailures;
  }

  @Override
  protected void recordFailure() {
    // saturate instead of wrapping around, exhaustion must stay monotonic
    if (failureCount <= maximumFailures) {
      failureCount++;
    }
  }

  public int getMaximumFailures() {
    return maximumFailures;
  }

  public int getFailureCount() {
    return failureCount;
  }

  @Override
  public String toString() {
    return "LimitedErrorCountRetryPolicy{maximumFailures=" + maximumFailures + '}';
  }
}
