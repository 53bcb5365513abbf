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

package io.cloudrpc.serviceclient;

import io.grpc.Status;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * Retries stopped because the retry or polling budget ran out, not because the error itself was
 * final. The same request may succeed later.
 */
public final class RetryPolicyExhaustedException extends RpcFailureException {
  private static final long serialVersionUID = 1L;

  public RetryPolicyExhaustedException(
      String operationName,
      Status lastStatus,
      @Nullable Throwable lastError,
      int attempts,
      Duration elapsed) {
    super("Retry policy exhausted", operationName, lastStatus, lastError, attempts, elapsed);
  }
}
