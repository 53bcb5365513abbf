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

import io.grpc.Status;

/**
 * Decides whether another attempt of a failed call is allowed.
 *
 * <p>Instances carry mutable progress (elapsed time, failure count) and are not thread-safe. The
 * retryers never use a policy they are handed directly: every logical call works on its own
 * {@link #copy()}, so one prototype can be shared by any number of concurrent calls.
 */
public interface RetryPolicy {

  /** Returns a new instance with the same limits and no progress recorded. */
  RetryPolicy copy();

  /**
   * Records a failed attempt.
   *
   * @return true if the caller may try again, false if the status is a permanent failure or the
   *     policy is exhausted
   */
  boolean onFailure(Status status);

  /** Once this returns true, it returns true forever. */
  boolean isExhausted();

  /**
   * Classifies {@code status} independent of the remaining budget. {@link Status#OK} is never a
   * permanent failure.
   */
  boolean isPermanentFailure(Status status);
}
