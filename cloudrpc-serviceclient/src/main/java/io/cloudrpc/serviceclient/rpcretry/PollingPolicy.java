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
import java.time.Duration;

/**
 * Bounds how long to wait for a server side condition (a consistency check, a long running or
 * chunked operation) and spaces the status checks. Not thread-safe, copied per operation.
 */
public interface PollingPolicy {

  /** Returns a new instance with the same limits and no progress recorded. */
  PollingPolicy copy();

  /** A permanent error ends the polling with a hard failure. */
  boolean isPermanentError(Status status);

  /**
   * Records a failed status check.
   *
   * @return true if polling may continue
   */
  boolean onFailure(Status status);

  /**
   * Records one completed polling round that did not reach the awaited state.
   *
   * @return true once the polling budget is spent, which is reported as a timeout rather than as a
   *     failure of the operation
   */
  boolean exhausted();

  /** Returns how long to wait before the next status check. */
  Duration waitPeriod();
}
