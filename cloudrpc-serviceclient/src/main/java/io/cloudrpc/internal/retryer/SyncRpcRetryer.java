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

import com.google.common.base.Stopwatch;
import com.uber.m3.tally.Scope;
import io.cloudrpc.serviceclient.MetricsTag;
import io.cloudrpc.serviceclient.MetricsType;
import io.cloudrpc.serviceclient.rpcretry.BackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.IdempotencyPolicy;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

class SyncRpcRetryer {
  private static final Logger log = LoggerFactory.getLogger(RpcRetryer.class);

  private final Scope metricsScope;

  SyncRpcRetryer(Scope metricsScope) {
    this.metricsScope = metricsScope;
  }

  public <ReqT, RespT> RespT retry(
      RpcRetryer.RpcRetryerOptions options,
      RpcRetryer.RpcCall<ReqT, RespT> call,
      ReqT request,
      IdempotencyPolicy<? super ReqT> idempotencyPolicy) {
    options.validate();
    String operationName = options.getOperationName();
    RetryPolicy retryPolicy = options.getRetryPolicy().copy();
    BackoffPolicy backoffPolicy = options.getBackoffPolicy().copy();
    boolean idempotent = idempotencyPolicy.isIdempotent(request);
    Scope scope = MetricsTag.tagged(metricsScope, MetricsTag.OPERATION_NAME, operationName);
    Stopwatch stopwatch = Stopwatch.createStarted();

    int attempt = 0;
    StatusRuntimeException lastException = null;
    while (true) {
      attempt++;
      if (lastException != null) {
        log.debug("Retrying {}, attempt {}, after failure", operationName, attempt, lastException);
        scope.counter(MetricsType.CLOUDRPC_REQUEST_RETRY).inc(1);
      }
      scope.counter(MetricsType.CLOUDRPC_REQUEST).inc(1);
      try {
        return call.apply(request);
      } catch (StatusRuntimeException e) {
        StatusRuntimeException finalException =
            RpcRetryerUtils.createFinalExceptionIfNotRetryable(
                operationName,
                e,
                idempotent,
                retryPolicy,
                attempt,
                stopwatch.elapsed());
        if (finalException != null) {
          log.debug("Final exception, throwing", finalException);
          RpcRetryerUtils.reportFinalException(scope, finalException);
          throw finalException;
        }
        lastException = e;
      }
      // No catch block for any other exceptions because we don't retry them, we pass them through.

      Duration delay = backoffPolicy.onCompletion();
      try {
        if (!delay.isZero()) {
          TimeUnit.NANOSECONDS.sleep(delay.toNanos());
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        CancellationException cancellation =
            new CancellationException(operationName + " interrupted while backing off");
        cancellation.initCause(lastException);
        throw cancellation;
      }
    }
  }
}
