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
 * The last error is known to be final: retrying the same request would fail the same way, or the
 * request is not idempotent and repeating it risks a duplicate side effect.
 */
public final class PermanentFailureException extends RpcFailureException {
  private static final long serialVersionUID = 1L;

  public PermanentFailureException(
      String operationName,
      Status lastStatus,
      @Nullable Throwable lastError,
      int attempts,
      Duration elapsed) {
    super("Permanent error", operationName, lastStatus, lastError, attempts, elapsed);
  }
}
