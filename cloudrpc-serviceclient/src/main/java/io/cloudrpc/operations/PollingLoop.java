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

package io.cloudrpc.operations;

import com.google.common.base.Stopwatch;
import com.uber.m3.tally.Scope;
import io.cloudrpc.serviceclient.MetricsTag;
import io.cloudrpc.serviceclient.MetricsType;
import io.cloudrpc.serviceclient.PermanentFailureException;
import io.cloudrpc.serviceclient.RetryPolicyExhaustedException;
import io.cloudrpc.serviceclient.rpcretry.PollingPolicy;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Progress of one polling operation, shared by the consistency poller and the chunked driver. */
@NotThreadSafe
final class PollingLoop {
  private static final Logger log = LoggerFactory.getLogger(PollingLoop.class);

  private final String operationName;
  private final PollingPolicy policy;
  private final Scope scope;
  private final Stopwatch stopwatch = Stopwatch.createStarted();
  private int attempts;
  private @Nullable StatusRuntimeException lastFailure;

  PollingLoop(String operationName, PollingPolicy prototype, Scope metricsScope) {
    this.operationName = operationName;
    this.policy = prototype.copy();
    this.scope = MetricsTag.tagged(metricsScope, MetricsTag.OPERATION_NAME, operationName);
  }

  void beforeAttempt() {
    attempts++;
    scope.counter(MetricsType.CLOUDRPC_POLL).inc(1);
  }

  /**
   * Classifies a failed status check and backs off if polling may continue.
   *
   * @throws PermanentFailureException if the failure is permanent
   * @throws RetryPolicyExhaustedException if the policy refuses another check
   */
  void onFailure(StatusRuntimeException e) {
    Status status = e.getStatus();
    if (policy.isPermanentError(status)) {
      throw report(
          new PermanentFailureException(operationName, status, e, attempts, stopwatch.elapsed()));
    }
    if (!policy.onFailure(status)) {
      throw report(
          new RetryPolicyExhaustedException(
              operationName, status, e, attempts, stopwatch.elapsed()));
    }
    log.debug("Polling {} failed, attempt {}", operationName, attempts, e);
    lastFailure = e;
    sleep(policy.waitPeriod());
  }

  /**
   * Records a round that did not reach the awaited state.
   *
   * @throws RetryPolicyExhaustedException with {@link Status#DEADLINE_EXCEEDED} once the polling
   *     budget is spent
   */
  void onIncomplete() {
    if (policy.exhausted()) {
      throw report(
          new RetryPolicyExhaustedException(
              operationName,
              Status.DEADLINE_EXCEEDED.withDescription("Polling loop terminated by polling policy"),
              lastFailure,
              attempts,
              stopwatch.elapsed()));
    }
    lastFailure = null;
  }

  void waitBeforeNextRound() {
    sleep(policy.waitPeriod());
  }

  int getAttempts() {
    return attempts;
  }

  private StatusRuntimeException report(StatusRuntimeException finalException) {
    log.debug("Polling {} gave up", operationName, finalException);
    String outcome =
        finalException instanceof RetryPolicyExhaustedException
            ? MetricsTag.OUTCOME_EXHAUSTED
            : MetricsTag.OUTCOME_PERMANENT;
    MetricsTag.failureScope(scope, outcome, String.valueOf(finalException.getStatus().getCode()))
        .counter(MetricsType.CLOUDRPC_REQUEST_FAILURE)
        .inc(1);
    return finalException;
  }

  private void sleep(Duration delay) {
    if (delay.isZero() || delay.isNegative()) {
      return;
    }
    try {
      TimeUnit.NANOSECONDS.sleep(delay.toNanos());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      CancellationException cancellation =
          new CancellationException(operationName + " interrupted while polling");
      cancellation.initCause(lastFailure);
      throw cancellation;
    }
  }
}
