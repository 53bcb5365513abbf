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
import java.time.Duration;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Polling policy built from a {@link RetryPolicy}, which bounds the total wait, and a {@link
 * BackoffPolicy}, which spaces the polls.
 *
 * <p>A completed round counts against the retry policy like a transient failure, so a {@link
 * LimitedErrorCountRetryPolicy} bounds the number of polls and a {@link LimitedTimeRetryPolicy}
 * bounds their total duration.
 */
@NotThreadSafe
public final class GenericPollingPolicy implements PollingPolicy {

  private final RetryPolicy retryPolicy;
  private final BackoffPolicy backoffPolicy;

  public GenericPollingPolicy(RetryPolicy retryPolicy, BackoffPolicy backoffPolicy) {
    this.retryPolicy = Preconditions.checkNotNull(retryPolicy, "retryPolicy").copy();
    this.backoffPolicy = Preconditions.checkNotNull(backoffPolicy, "backoffPolicy").copy();
  }

  @Override
  public PollingPolicy copy() {
    return new GenericPollingPolicy(retryPolicy, backoffPolicy);
  }

  @Override
  public boolean isPermanentError(Status status) {
    return retryPolicy.isPermanentFailure(status);
  }

  @Override
  public boolean onFailure(Status status) {
    return retryPolicy.onFailure(status);
  }

  @Override
  public boolean exhausted() {
    return !retryPolicy.onFailure(Status.OK);
  }

  @Override
  public Duration waitPeriod() {
    return backoffPolicy.onCompletion();
  }

  @Override
  public String toString() {
    return "GenericPollingPolicy{retryPolicy="
        + retryPolicy
        + ", backoffPolicy="
        + backoffPolicy
        + '}';
  }
}
