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

package io.cloudrpc.authorization;

import com.google.common.base.Preconditions;
import com.google.common.base.Throwables;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.cloudrpc.internal.retryer.RpcRetryer;
import io.cloudrpc.serviceclient.MetricsType;
import io.cloudrpc.serviceclient.rpcretry.BackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.DefaultStubServiceOperationRpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.IdempotencyPolicy;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import javax.annotation.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Caches the authorization header obtained from an {@link AccessTokenSource} and refreshes it
 * before the server starts rejecting it.
 *
 * <p>While the cached token is valid {@link #supply()} only reads a volatile field. Once it
 * expires, the first caller refreshes the token outside of the lock, retrying transient failures
 * with its own copies of the configured policies; concurrent callers wait for that refresh and
 * observe its outcome, either the new header or the same failure. A failed refresh leaves nothing
 * behind, the next call starts a new one.
 */
public final class RefreshingTokenSupplier implements AuthorizationTokenSupplier {
  private static final Logger log = LoggerFactory.getLogger(RefreshingTokenSupplier.class);

  static final String REFRESH_OPERATION_NAME = "RefreshAccessToken";

  public static final class Options {

    public static Builder newBuilder() {
      return new Builder();
    }

    public static Options getDefaultInstance() {
      return DEFAULT_INSTANCE;
    }

    private static final Options DEFAULT_INSTANCE = newBuilder().build();

    public static final class Builder {
      private Duration expirationSlack = DEFAULT_EXPIRATION_SLACK;
      private Clock clock = Clock.systemUTC();
      private RetryPolicy retryPolicy;
      private BackoffPolicy backoffPolicy;
      private Scope metricsScope;

      private Builder() {}

      /**
       * Refresh starts this long before the server declared expiration of a token. Defaults to 500
       * seconds. Capped at half of the lifetime of each token.
       */
      public Builder setExpirationSlack(Duration expirationSlack) {
        Preconditions.checkArgument(
            expirationSlack != null && !expirationSlack.isNegative(),
            "invalid expirationSlack: %s",
            expirationSlack);
        this.expirationSlack = expirationSlack;
        return this;
      }

      public Builder setClock(Clock clock) {
        this.clock = Preconditions.checkNotNull(clock, "clock");
        return this;
      }

      /** Bounds a single refresh. Defaults to 15 minutes of retries. */
      public Builder setRetryPolicy(RetryPolicy retryPolicy) {
        this.retryPolicy = retryPolicy;
        return this;
      }

      /** Spaces the attempts of a single refresh. Defaults to 10ms growing to 5 minutes. */
      public Builder setBackoffPolicy(BackoffPolicy backoffPolicy) {
        this.backoffPolicy = backoffPolicy;
        return this;
      }

      public Builder setMetricsScope(Scope metricsScope) {
        this.metricsScope = metricsScope;
        return this;
      }

      public Options build() {
        return new Options(
            expirationSlack,
            clock,
            retryPolicy != null
                ? retryPolicy
                : DefaultStubServiceOperationRpcRetryOptions.INSTANCE.toRetryPolicy(),
            backoffPolicy != null
                ? backoffPolicy
                : DefaultStubServiceOperationRpcRetryOptions.INSTANCE.toBackoffPolicy(),
            metricsScope != null ? metricsScope : new NoopScope());
      }
    }

    private final Duration expirationSlack;
    private final Clock clock;
    private final RetryPolicy retryPolicy;
    private final BackoffPolicy backoffPolicy;
    private final Scope metricsScope;

    private Options(
        Duration expirationSlack,
        Clock clock,
        RetryPolicy retryPolicy,
        BackoffPolicy backoffPolicy,
        Scope metricsScope) {
      this.expirationSlack = expirationSlack;
      this.clock = clock;
      this.retryPolicy = retryPolicy;
      this.backoffPolicy = backoffPolicy;
      this.metricsScope = metricsScope;
    }

    public Duration getExpirationSlack() {
      return expirationSlack;
    }

    public Clock getClock() {
      return clock;
    }

    public RetryPolicy getRetryPolicy() {
      return retryPolicy;
    }

    public BackoffPolicy getBackoffPolicy() {
      return backoffPolicy;
    }

    public Scope getMetricsScope() {
      return metricsScope;
    }
  }

  public static final Duration DEFAULT_EXPIRATION_SLACK = Duration.ofSeconds(500);

  private final AccessTokenSource source;
  private final Options options;
  private final RpcRetryer retryer;

  private volatile @Nullable AccessToken current;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition refreshCompleted = lock.newCondition();

  @GuardedBy("lock")
  private boolean refreshing;

  @GuardedBy("lock")
  private long completedRefreshes;

  // number of the last failed refresh and its failure
  @GuardedBy("lock")
  private long failedRefresh;

  @GuardedBy("lock")
  private @Nullable Throwable refreshFailure;

  public RefreshingTokenSupplier(AccessTokenSource source) {
    this(source, Options.getDefaultInstance());
  }

  public RefreshingTokenSupplier(AccessTokenSource source, Options options) {
    this.source = Preconditions.checkNotNull(source, "source");
    this.options = Preconditions.checkNotNull(options, "options");
    this.retryer = new RpcRetryer(options.getMetricsScope());
  }

  /**
   * @return the cached authorization header, refreshed first if it expired
   * @throws io.cloudrpc.serviceclient.RpcFailureException if the refresh failed; callers waiting
   *     on the same refresh get the same exception
   * @throws CancellationException if the thread was interrupted while waiting for a refresh
   */
  @Override
  public String supply() {
    AccessToken token = current;
    if (token != null && token.isValidAt(now())) {
      return token.getAuthorizationHeader();
    }
    return refresh().getAuthorizationHeader();
  }

  /** Cached token, valid or not. */
  @Nullable
  public AccessToken getCachedToken() {
    return current;
  }

  private AccessToken refresh() {
    lock.lock();
    try {
      AccessToken token = current;
      if (token != null && token.isValidAt(now())) {
        return token;
      }
      if (refreshing) {
        return awaitRefresh();
      }
      refreshing = true;
    } finally {
      lock.unlock();
    }

    AccessToken fresh = null;
    Throwable failure = null;
    try {
      fresh = fetchWithRetries();
    } catch (Throwable e) {
      failure = e;
    }

    lock.lock();
    try {
      refreshing = false;
      completedRefreshes++;
      if (fresh != null) {
        current = fresh;
      } else {
        failedRefresh = completedRefreshes;
        refreshFailure = failure;
      }
      refreshCompleted.signalAll();
    } finally {
      lock.unlock();
    }
    if (failure != null) {
      log.warn("Access token refresh failed", failure);
      options
          .getMetricsScope()
          .counter(MetricsType.CLOUDRPC_TOKEN_REFRESH_FAILURE)
          .inc(1);
      Throwables.throwIfUnchecked(failure);
      throw new IllegalStateException(failure);
    }
    return fresh;
  }

  /**
   * Waits for the refresh in progress and returns its token without checking it against the
   * clock, so that every caller of one refresh observes the same header.
   */
  @GuardedBy("lock")
  private AccessToken awaitRefresh() {
    long awaited = completedRefreshes + 1;
    while (completedRefreshes < awaited) {
      try {
        refreshCompleted.await();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new CancellationException("interrupted while waiting for a token refresh");
      }
    }
    if (failedRefresh == awaited) {
      Throwables.throwIfUnchecked(refreshFailure);
      throw new IllegalStateException(refreshFailure);
    }
    return current;
  }

  private AccessToken fetchWithRetries() {
    options.getMetricsScope().counter(MetricsType.CLOUDRPC_TOKEN_REFRESH).inc(1);
    TokenResponse response =
        retryer.retry(
            new RpcRetryer.RpcRetryerOptions(
                REFRESH_OPERATION_NAME, options.getRetryPolicy(), options.getBackoffPolicy()),
            AccessTokenSource::fetchToken,
            source,
            IdempotencyPolicy.always());
    Duration expiresIn = response.getExpiresIn();
    // a short-lived token keeps at least half of its lifetime
    Duration slack = options.getExpirationSlack();
    if (slack.compareTo(expiresIn.dividedBy(2)) > 0) {
      slack = expiresIn.dividedBy(2);
    }
    Instant expiration = now().plus(expiresIn).minus(slack);
    log.debug("Access token refreshed, valid until {}", expiration);
    return new AccessToken(response.toAuthorizationHeader(), expiration);
  }

  private Instant now() {
    return options.getClock().instant();
  }
}
