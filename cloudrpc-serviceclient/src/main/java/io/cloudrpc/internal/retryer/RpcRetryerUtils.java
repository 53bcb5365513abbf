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

package io.cloudrpc.internal.retryer;

import com.uber.m3.tally.Scope;
import io.cloudrpc.serviceclient.MetricsTag;
import io.cloudrpc.serviceclient.MetricsType;
import io.cloudrpc.serviceclient.PermanentFailureException;
import io.cloudrpc.serviceclient.RetryPolicyExhaustedException;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

class RpcRetryerUtils {
  /**
   * This method encapsulates the decision whether a failed attempt may be followed by another one.
   * It records the failure in {@code retryPolicy} when the failure is retryable.
   *
   * @param currentException failure of the last attempt
   * @param idempotent whether the request is safe to repeat
   * @param retryPolicy per call copy of the retry policy
   * @return null if the call can be retried, a final exception to report to the caller otherwise.
   */
  static @Nullable StatusRuntimeException createFinalExceptionIfNotRetryable(
      @Nonnull String operationName,
      @Nonnull StatusRuntimeException currentException,
      boolean idempotent,
      @Nonnull RetryPolicy retryPolicy,
      int attempts,
      Duration elapsed) {
    Status status = currentException.getStatus();
    if (!idempotent || retryPolicy.isPermanentFailure(status)) {
      // a request that is not idempotent gets exactly one attempt
      return new PermanentFailureException(
          operationName, status, currentException, attempts, elapsed);
    }
    if (!retryPolicy.onFailure(status)) {
      return new RetryPolicyExhaustedException(
          operationName, status, currentException, attempts, elapsed);
    }
    return null;
  }

  static void reportFinalException(Scope scope, StatusRuntimeException finalException) {
    String outcome =
        finalException instanceof RetryPolicyExhaustedException
            ? MetricsTag.OUTCOME_EXHAUSTED
            : MetricsTag.OUTCOME_PERMANENT;
    MetricsTag.failureScope(
            scope, outcome, String.valueOf(finalException.getStatus().getCode()))
        .counter(MetricsType.CLOUDRPC_REQUEST_FAILURE)
        .inc(1);
  }

  static Throwable unwrapCompletionException(Throwable e) {
    return e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
  }
}
