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
import io.cloudrpc.serviceclient.StatusUtils;
import io.grpc.Status;
import java.util.function.Predicate;

/** Shared status classification of the stock retry policies. */
abstract class AbstractRetryPolicy implements RetryPolicy {

  protected final Predicate<Status> isRetryable;

  protected AbstractRetryPolicy(Predicate<Status> isRetryable) {
    this.isRetryable = Preconditions.checkNotNull(isRetryable, "isRetryable");
  }

  @Override
  public boolean onFailure(Status status) {
    if (isPermanentFailure(status)) {
      return false;
    }
    recordFailure();
    return !isExhausted();
  }

  @Override
  public boolean isPermanentFailure(Status status) {
    return !status.isOk() && !isRetryable.test(status);
  }

  /** Advances the progress after a failure that is not permanent. */
  protected abstract void recordFailure();

  static Predicate<Status> defaultIsRetryable() {
    return StatusUtils::isTransientFailure;
  }
}
