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
import io.grpc.Context;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One logical asynchronous call. The instance owns the policy copies, the request and the result
 * future; the scheduled timer and the callbacks of the attempt in flight keep it reachable until
 * the result future is completed.
 *
 * <pre>
 * CREATED -&gt; BACKOFF_PENDING -&gt; ATTEMPT_IN_FLIGHT -&gt; DONE (success, permanent, exhausted)
 *                  ^                   |
 *                  +--- retryable -----+
 * </pre>
 *
 * Cancelling the result future moves any state to DONE and cancels the pending timer or the
 * attempt in flight.
 */
class AsyncRpcRetryer<ReqT, RespT> {
  private static final Logger log = LoggerFactory.getLogger(RpcRetryer.class);

  enum State {
    CREATED,
    BACKOFF_PENDING,
    ATTEMPT_IN_FLIGHT,
    DONE
  }

  private final ScheduledExecutorService executor;
  private final String operationName;
  private final RpcRetryer.AsyncRpcCall<ReqT, RespT> function;
  private final ReqT request;
  private final RetryPolicy retryPolicy;
  private final BackoffPolicy backoffPolicy;
  private final boolean idempotent;
  private final Scope scope;
  private final CompletableFuture<RespT> resultCF = new CompletableFuture<>();
  private final Stopwatch stopwatch = Stopwatch.createUnstarted();

  @GuardedBy("this")
  private State state = State.CREATED;

  @GuardedBy("this")
  private int attempts;

  @GuardedBy("this")
  private @Nullable ScheduledFuture<?> pendingTimer;

  @GuardedBy("this")
  private @Nullable CompletableFuture<RespT> inFlight;

  @GuardedBy("this")
  private @Nullable StatusRuntimeException lastException;

  AsyncRpcRetryer(
      ScheduledExecutorService executor,
      RpcRetryer.RpcRetryerOptions options,
      RpcRetryer.AsyncRpcCall<ReqT, RespT> function,
      ReqT request,
      IdempotencyPolicy<? super ReqT> idempotencyPolicy,
      Scope metricsScope) {
    options.validate();
    this.executor = executor;
    this.operationName = options.getOperationName();
    this.function = function;
    this.request = request;
    this.retryPolicy = options.getRetryPolicy().copy();
    this.backoffPolicy = options.getBackoffPolicy().copy();
    this.idempotent = idempotencyPolicy.isIdempotent(request);
    this.scope = MetricsTag.tagged(metricsScope, MetricsTag.OPERATION_NAME, operationName);
  }

  public CompletableFuture<RespT> retry() {
    synchronized (this) {
      if (state != State.CREATED) {
        throw new IllegalStateException(operationName + " already started");
      }
      stopwatch.start();
    }
    resultCF.whenComplete((r, e) -> onResultCompleted());
    schedule(Duration.ZERO);
    return resultCF;
  }

  synchronized State getState() {
    return state;
  }

  private void schedule(Duration delay) {
    RejectedExecutionException rejected = null;
    synchronized (this) {
      if (resultCF.isDone()) {
        return;
      }
      state = State.BACKOFF_PENDING;
      try {
        pendingTimer =
            executor.schedule(
                // preserving gRPC context between threads
                Context.current().wrap(this::attempt), delay.toNanos(), TimeUnit.NANOSECONDS);
      } catch (RejectedExecutionException e) {
        // thrown if the application already shut the executor down
        rejected = e;
      }
    }
    if (rejected != null) {
      resultCF.completeExceptionally(rejected);
    }
  }

  private void attempt() {
    StatusRuntimeException previousFailure;
    int attempt;
    synchronized (this) {
      if (resultCF.isDone()) {
        return;
      }
      pendingTimer = null;
      state = State.ATTEMPT_IN_FLIGHT;
      attempt = ++attempts;
      previousFailure = lastException;
    }
    if (previousFailure != null) {
      log.debug("Retrying {}, attempt {}, after failure", operationName, attempt, previousFailure);
      scope.counter(MetricsType.CLOUDRPC_REQUEST_RETRY).inc(1);
    }
    scope.counter(MetricsType.CLOUDRPC_REQUEST).inc(1);

    CompletableFuture<RespT> result;
    // try-catch is because apply() call might throw.
    try {
      result = function.apply(request);
      if (result == null) {
        result = CompletableFuture.completedFuture(null);
      }
    } catch (Throwable e) {
      // function isn't supposed to throw exceptions, it should always return a CompletableFuture
      // even if it's a failed one. But if this happens - process the same way as a failed future.
      onAttemptFailed(e, attempt);
      return;
    }

    boolean cancelled;
    synchronized (this) {
      cancelled = resultCF.isDone();
      if (!cancelled) {
        inFlight = result;
      }
    }
    if (cancelled) {
      result.cancel(true);
      return;
    }
    result.whenComplete(
        (r, e) -> {
          synchronized (this) {
            inFlight = null;
          }
          if (e == null) {
            onAttemptSucceeded(r);
          } else {
            onAttemptFailed(e, attempt);
          }
        });
  }

  private void onAttemptSucceeded(RespT response) {
    synchronized (this) {
      if (resultCF.isDone()) {
        return;
      }
      state = State.DONE;
    }
    resultCF.complete(response);
  }

  private void onAttemptFailed(Throwable failure, int attempt) {
    if (resultCF.isDone()) {
      // cancelled by the caller, the failure is the cancellation of the attempt in flight
      return;
    }
    Throwable currentException = RpcRetryerUtils.unwrapCompletionException(failure);

    // Do not retry if it's not StatusRuntimeException
    if (!(currentException instanceof StatusRuntimeException)) {
      finish(currentException);
      return;
    }

    StatusRuntimeException statusRuntimeException = (StatusRuntimeException) currentException;
    StatusRuntimeException finalException =
        RpcRetryerUtils.createFinalExceptionIfNotRetryable(
            operationName,
            statusRuntimeException,
            idempotent,
            retryPolicy,
            attempt,
            stopwatch.elapsed());
    if (finalException != null) {
      log.debug("Final exception, throwing", finalException);
      RpcRetryerUtils.reportFinalException(scope, finalException);
      finish(finalException);
      return;
    }

    synchronized (this) {
      lastException = statusRuntimeException;
    }
    schedule(backoffPolicy.onCompletion());
  }

  private void finish(Throwable failure) {
    synchronized (this) {
      state = State.DONE;
    }
    resultCF.completeExceptionally(failure);
  }

  private void onResultCompleted() {
    ScheduledFuture<?> timer;
    CompletableFuture<RespT> attemptInFlight;
    synchronized (this) {
      state = State.DONE;
      timer = pendingTimer;
      attemptInFlight = inFlight;
      pendingTimer = null;
      inFlight = null;
    }
    if (!resultCF.isCancelled()) {
      return;
    }
    log.debug("{} cancelled by the caller", operationName);
    MetricsTag.failureScope(
            scope, MetricsTag.OUTCOME_CANCELLED, String.valueOf(Status.Code.CANCELLED))
        .counter(MetricsType.CLOUDRPC_REQUEST_FAILURE)
        .inc(1);
    if (timer != null) {
      timer.cancel(false);
    }
    if (attemptInFlight != null) {
      attemptInFlight.cancel(true);
    }
  }
}
