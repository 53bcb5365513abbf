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
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import javax.annotation.Nullable;

/**
 * Terminal outcome of a retried call. Keeps the {@link Status} of the last attempt, so code that
 * only knows about {@link StatusRuntimeException} keeps working, and adds the context needed to
 * tell a request that will never succeed from one that may succeed later.
 */
public abstract class RpcFailureException extends StatusRuntimeException {
  private static final long serialVersionUID = 1L;

  private final String operationName;
  private final int attempts;
  private final Duration elapsed;

  protected RpcFailureException(
      String prefix,
      String operationName,
      Status lastStatus,
      @Nullable Throwable lastError,
      int attempts,
      Duration elapsed) {
    super(
        lastStatus
            .withDescription(
                describe(prefix, operationName, lastStatus.getDescription(), attempts, elapsed))
            .withCause(lastError),
        lastError instanceof StatusRuntimeException
            ? ((StatusRuntimeException) lastError).getTrailers()
            : null);
    this.operationName = operationName;
    this.attempts = attempts;
    this.elapsed = elapsed;
  }

  private static String describe(
      String prefix,
      String operationName,
      @Nullable String lastDescription,
      int attempts,
      Duration elapsed) {
    StringBuilder message = new StringBuilder(prefix).append(" in ").append(operationName);
    if (lastDescription != null && !lastDescription.isEmpty()) {
      message.append(": ").append(lastDescription);
    }
    return message
        .append(" (attempts=")
        .append(attempts)
        .append(", elapsed=")
        .append(elapsed.toMillis())
        .append("ms)")
        .toString();
  }

  /** Name of the operation that failed, as passed to the retryer. */
  public String getOperationName() {
    return operationName;
  }

  /** Number of attempts made, including the last failed one. */
  public int getAttempts() {
    return attempts;
  }

  /** Time from the start of the first attempt until the operation gave up. */
  public Duration getElapsed() {
    return elapsed;
  }
}
