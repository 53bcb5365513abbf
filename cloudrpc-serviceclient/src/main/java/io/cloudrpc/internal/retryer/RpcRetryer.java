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

import com.google.common.base.Preconditions;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.cloudrpc.serviceclient.RpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.BackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.IdempotencyPolicy;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.function.BiConsumer;
import javax.annotation.Nonnull;

/**
 * Runs unary calls under a retry policy, a backoff policy and an idempotency policy.
 *
 * <p>The retryer itself is stateless and thread-safe. Every logical call copies the policy
 * prototypes from its {@link RpcRetryerOptions}, so concurrent calls never share progress.
 */
public final class RpcRetryer {

  /** Blocking unary call. Failures are reported as {@link io.grpc.StatusRuntimeException}. */
  @FunctionalInterface
  public interface RpcCall<ReqT, RespT> {
    RespT apply(ReqT request);
  }

  /**
   * Non-blocking unary call. Failures are reported by completing the returned future
   * exceptionally with a {@link io.grpc.StatusRuntimeException}. Cancelling the returned future
   * should cancel the call.
   */
  @FunctionalInterface
  public interface AsyncRpcCall<ReqT, RespT> {
    CompletableFuture<RespT> apply(ReqT request);
  }

  private final Scope metricsScope;

  public RpcRetryer() {
    this(new NoopScope());
  }

  public RpcRetryer(Scope metricsScope) {
    this.metricsScope = Preconditions.checkNotNull(metricsScope, "metricsScope");
  }

  /**
   * Calls {@code call} until it succeeds, fails permanently, or the retry policy is exhausted,
   * blocking the calling thread during backoff.
   *
   * @throws io.cloudrpc.serviceclient.PermanentFailureException if the last failure was permanent
   *     or the request is not idempotent
   * @throws io.cloudrpc.serviceclient.RetryPolicyExhaustedException if the retry budget ran out
   * @throws java.util.concurrent.CancellationException if the thread was interrupted while backing
   *     off
   */
  public <ReqT, RespT> RespT retry(
      RpcRetryerOptions options,
      RpcCall<ReqT, RespT> call,
      ReqT request,
      IdempotencyPolicy<? super ReqT> idempotencyPolicy) {
    return new SyncRpcRetryer(metricsScope).retry(options, call, request, idempotencyPolicy);
  }

  /**
   * Asynchronous version of {@link #retry}. Attempts and backoff timers run on {@code executor},
   * which is owned by the application; no thread is created by the retryer.
   *
   * <p>Cancelling the returned future stops the retries: the pending backoff timer or the attempt
   * in flight is cancelled and no further attempt is started.
   */
  public <ReqT, RespT> CompletableFuture<RespT> retryAsync(
      ScheduledExecutorService executor,
      RpcRetryerOptions options,
      AsyncRpcCall<ReqT, RespT> call,
      ReqT request,
      IdempotencyPolicy<? super ReqT> idempotencyPolicy) {
    return new AsyncRpcRetryer<>(
            executor, options, call, request, idempotencyPolicy, metricsScope)
        .retry();
  }

  /**
   * Same as {@link #retryAsync(ScheduledExecutorService, RpcRetryerOptions, AsyncRpcCall, Object,
   * IdempotencyPolicy)}, additionally invoking {@code callback} exactly once with either the
   * response or the terminal failure.
   *
   * @return the future of the call, used to cancel it
   */
  public <ReqT, RespT> CompletableFuture<RespT> retryAsync(
      ScheduledExecutorService executor,
      RpcRetryerOptions options,
      AsyncRpcCall<ReqT, RespT> call,
      ReqT request,
      IdempotencyPolicy<? super ReqT> idempotencyPolicy,
      BiConsumer<? super RespT, ? super Throwable> callback) {
    CompletableFuture<RespT> result =
        retryAsync(executor, options, call, request, idempotencyPolicy);
    result.whenComplete(
        (r, e) -> callback.accept(r, RpcRetryerUtils.unwrapCompletionException(e)));
    return result;
  }

  public static class RpcRetryerOptions {
    @Nonnull private final String operationName;
    @Nonnull private final RetryPolicy retryPolicy;
    @Nonnull private final BackoffPolicy backoffPolicy;

    /**
     * @param operationName name reported in failures, logs and metrics
     * @param retryPolicy prototype, copied for every call
     * @param backoffPolicy prototype, copied for every call
     */
    public RpcRetryerOptions(
        @Nonnull String operationName,
        @Nonnull RetryPolicy retryPolicy,
        @Nonnull BackoffPolicy backoffPolicy) {
      this.operationName = operationName;
      this.retryPolicy = retryPolicy;
      this.backoffPolicy = backoffPolicy;
    }

    public RpcRetryerOptions(@Nonnull String operationName, @Nonnull RpcRetryOptions options) {
      this(operationName, options.toRetryPolicy(), options.toBackoffPolicy());
    }

    @Nonnull
    public String getOperationName() {
      return operationName;
    }

    @Nonnull
    public RetryPolicy getRetryPolicy() {
      return retryPolicy;
    }

    @Nonnull
    public BackoffPolicy getBackoffPolicy() {
      return backoffPolicy;
    }

    public void validate() {
      Preconditions.checkState(
          operationName != null && !operationName.isEmpty(), "operationName is required");
      Preconditions.checkState(retryPolicy != null, "retryPolicy is required");
      Preconditions.checkState(backoffPolicy != null, "backoffPolicy is required");
    }
  }
}
