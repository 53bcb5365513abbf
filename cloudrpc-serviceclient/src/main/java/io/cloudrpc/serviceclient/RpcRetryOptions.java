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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;
import io.cloudrpc.serviceclient.rpcretry.BackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.DefaultStubServiceOperationRpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.ExponentialBackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.GenericPollingPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedErrorCountRetryPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedTimeRetryPolicy;
import io.cloudrpc.serviceclient.rpcretry.PollingPolicy;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import io.grpc.Status;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Declarative description of a retry budget and a backoff schedule. The options are immutable;
 * {@link #toRetryPolicy()}, {@link #toBackoffPolicy()} and {@link #toPollingPolicy()} turn them
 * into policy prototypes for the retryers.
 *
 * <p>A budget is either an expiration or a maximum number of attempts, never both.
 */
public final class RpcRetryOptions {

  private static final RpcRetryOptions DEFAULT_INSTANCE = newBuilder().validateBuildWithDefaults();

  public static Builder newBuilder() {
    return new Builder();
  }

  public static Builder newBuilder(RpcRetryOptions options) {
    Builder builder = new Builder();
    if (options != null) {
      builder.initialInterval = options.initialInterval;
      builder.maximumInterval = options.maximumInterval;
      builder.backoffCoefficient = options.backoffCoefficient;
      builder.expiration = options.expiration;
      builder.maximumAttempts = options.maximumAttempts == 0 ? null : options.maximumAttempts;
      builder.maximumJitterCoefficient = options.maximumJitterCoefficient;
      builder.doNotRetry.addAll(options.doNotRetry);
    }
    return builder;
  }

  /** Options of {@link DefaultStubServiceOperationRpcRetryOptions}. */
  public static RpcRetryOptions getDefaultInstance() {
    return DEFAULT_INSTANCE;
  }

  public static final class Builder {
    // null means "not set, use the default"
    private @Nullable Duration initialInterval;
    private @Nullable Duration maximumInterval;
    private @Nullable Double backoffCoefficient;
    private @Nullable Duration expiration;
    private @Nullable Integer maximumAttempts;
    private @Nullable Double maximumJitterCoefficient;
    private final Set<Status.Code> doNotRetry = EnumSet.noneOf(Status.Code.class);

    private Builder() {}

    /** Delay before the first retry. Defaults to 10ms. */
    public Builder setInitialInterval(Duration initialInterval) {
      this.initialInterval = checkPositive(initialInterval, "initialInterval");
      return this;
    }

    /**
     * Cap of the exponentially growing delay. Defaults to 5 minutes, or to the initial interval
     * when that one is longer.
     */
    public Builder setMaximumInterval(Duration maximumInterval) {
      this.maximumInterval = checkPositive(maximumInterval, "maximumInterval");
      return this;
    }

    /** Multiplier applied to the delay after every retry. Must be at least 1. Defaults to 2. */
    public Builder setBackoffCoefficient(double backoffCoefficient) {
      Preconditions.checkArgument(
          Double.isFinite(backoffCoefficient) && backoffCoefficient >= 1.0,
          "backoffCoefficient must be finite and >= 1.0: %s",
          backoffCoefficient);
      this.backoffCoefficient = backoffCoefficient;
      return this;
    }

    /**
     * Maximum time to retry, measured from the start of the first attempt. Defaults to 15 minutes
     * unless {@link #setMaximumAttempts(int)} is used.
     */
    public Builder setExpiration(Duration expiration) {
      this.expiration = checkPositive(expiration, "expiration");
      return this;
    }

    /** Maximum number of attempts, the first one included. */
    public Builder setMaximumAttempts(int maximumAttempts) {
      Preconditions.checkArgument(
          maximumAttempts > 0, "maximumAttempts must be positive: %s", maximumAttempts);
      this.maximumAttempts = maximumAttempts;
      return this;
    }

    /**
     * Relative jitter applied to every delay: 0.1 makes a delay vary by up to 10% in both
     * directions. 0 disables jitter. Defaults to 0.1.
     */
    public Builder setMaximumJitterCoefficient(double maximumJitterCoefficient) {
      Preconditions.checkArgument(
          maximumJitterCoefficient >= 0.0 && maximumJitterCoefficient < 1.0,
          "maximumJitterCoefficient must be in [0, 1): %s",
          maximumJitterCoefficient);
      this.maximumJitterCoefficient = maximumJitterCoefficient;
      return this;
    }

    /**
     * Makes failures with {@code code} permanent even if the code is normally considered transient,
     * for example {@link Status.Code#INTERNAL} for a service where it means a bug rather than a
     * blip.
     */
    public Builder addDoNotRetry(Status.Code code) {
      doNotRetry.add(Preconditions.checkNotNull(code, "code"));
      return this;
    }

    /**
     * Fills the unset properties from {@link DefaultStubServiceOperationRpcRetryOptions} and
     * builds validated options.
     *
     * @throws IllegalArgumentException if both an expiration and maximum attempts are set
     * @throws IllegalStateException if the maximum interval is shorter than the initial one
     */
    public RpcRetryOptions validateBuildWithDefaults() {
      Preconditions.checkArgument(
          expiration == null || maximumAttempts == null,
          "expiration and maximumAttempts are mutually exclusive, set only one of them");
      Duration initial =
          MoreObjects.firstNonNull(
              initialInterval, DefaultStubServiceOperationRpcRetryOptions.INITIAL_INTERVAL);
      Duration maximum = maximumInterval;
      if (maximum == null) {
        maximum = max(initial, DefaultStubServiceOperationRpcRetryOptions.MAXIMUM_INTERVAL);
      }
      Preconditions.checkState(
          maximum.compareTo(initial) >= 0,
          "maximumInterval(%s) cannot be shorter than initialInterval(%s)",
          maximum,
          initial);
      Duration budget = expiration;
      if (budget == null && maximumAttempts == null) {
        budget = DefaultStubServiceOperationRpcRetryOptions.EXPIRATION_INTERVAL;
      }
      return new RpcRetryOptions(
          initial,
          maximum,
          MoreObjects.firstNonNull(
              backoffCoefficient, DefaultStubServiceOperationRpcRetryOptions.BACKOFF),
          budget,
          maximumAttempts == null ? 0 : maximumAttempts,
          MoreObjects.firstNonNull(
              maximumJitterCoefficient,
              DefaultStubServiceOperationRpcRetryOptions.MAXIMUM_JITTER_COEFFICIENT),
          doNotRetry);
    }

    private static Duration checkPositive(Duration duration, String name) {
      Preconditions.checkArgument(
          duration != null && !duration.isNegative() && !duration.isZero(),
          "%s must be positive: %s",
          name,
          duration);
      return duration;
    }

    private static Duration max(Duration a, Duration b) {
      return a.compareTo(b) >= 0 ? a : b;
    }
  }

  private final Duration initialInterval;
  private final Duration maximumInterval;
  private final double backoffCoefficient;
  private final @Nullable Duration expiration;
  // 0 when the budget is an expiration
  private final int maximumAttempts;
  private final double maximumJitterCoefficient;
  private final @Nonnull Set<Status.Code> doNotRetry;

  private RpcRetryOptions(
      Duration initialInterval,
      Duration maximumInterval,
      double backoffCoefficient,
      @Nullable Duration expiration,
      int maximumAttempts,
      double maximumJitterCoefficient,
      Set<Status.Code> doNotRetry) {
    this.initialInterval = initialInterval;
    this.maximumInterval = maximumInterval;
    this.backoffCoefficient = backoffCoefficient;
    this.expiration = expiration;
    this.maximumAttempts = maximumAttempts;
    this.maximumJitterCoefficient = maximumJitterCoefficient;
    this.doNotRetry =
        doNotRetry.isEmpty()
            ? Collections.emptySet()
            : Collections.unmodifiableSet(Sets.newEnumSet(doNotRetry, Status.Code.class));
  }

  public Duration getInitialInterval() {
    return initialInterval;
  }

  public Duration getMaximumInterval() {
    return maximumInterval;
  }

  public double getBackoffCoefficient() {
    return backoffCoefficient;
  }

  /** Null when the budget is expressed as {@link #getMaximumAttempts()}. */
  @Nullable
  public Duration getExpiration() {
    return expiration;
  }

  public int getMaximumAttempts() {
    return maximumAttempts;
  }

  public double getMaximumJitterCoefficient() {
    return maximumJitterCoefficient;
  }

  public @Nonnull Set<Status.Code> getDoNotRetry() {
    return doNotRetry;
  }

  /** Retry policy prototype: limited by time if an expiration is set, by attempts otherwise. */
  public RetryPolicy toRetryPolicy() {
    Predicate<Status> isRetryable =
        status -> StatusUtils.isTransientFailure(status) && !doNotRetry.contains(status.getCode());
    if (expiration != null) {
      return new LimitedTimeRetryPolicy(expiration, isRetryable);
    }
    return new LimitedErrorCountRetryPolicy(maximumAttempts - 1, isRetryable);
  }

  public BackoffPolicy toBackoffPolicy() {
    return new ExponentialBackoffPolicy(
        initialInterval, maximumInterval, backoffCoefficient, maximumJitterCoefficient);
  }

  public PollingPolicy toPollingPolicy() {
    return new GenericPollingPolicy(toRetryPolicy(), toBackoffPolicy());
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("initialInterval", initialInterval)
        .add("maximumInterval", maximumInterval)
        .add("backoffCoefficient", backoffCoefficient)
        .add("expiration", expiration)
        .add("maximumAttempts", maximumAttempts)
        .add("maximumJitterCoefficient", maximumJitterCoefficient)
        .add("doNotRetry", doNotRetry)
        .omitNullValues()
        .toString();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RpcRetryOptions)) return false;
    RpcRetryOptions that = (RpcRetryOptions) o;
    return initialInterval.equals(that.initialInterval)
        && maximumInterval.equals(that.maximumInterval)
        && Double.compare(backoffCoefficient, that.backoffCoefficient) == 0
        && Objects.equals(expiration, that.expiration)
        && maximumAttempts == that.maximumAttempts
        && Double.compare(maximumJitterCoefficient, that.maximumJitterCoefficient) == 0
        && doNotRetry.equals(that.doNotRetry);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        initialInterval,
        maximumInterval,
        backoffCoefficient,
        expiration,
        maximumAttempts,
        maximumJitterCoefficient,
        doNotRetry);
  }
}
