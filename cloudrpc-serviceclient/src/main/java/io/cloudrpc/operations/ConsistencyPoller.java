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

import com.google.common.base.Preconditions;
import com.uber.m3.tally.NoopScope;
import com.uber.m3.tally.Scope;
import io.cloudrpc.serviceclient.rpcretry.DefaultPollingRpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.PollingPolicy;
import io.grpc.StatusRuntimeException;

/**
 * Waits until the service reports that the writes covered by a consistency token are visible
 * everywhere. The poller is thread-safe, every {@link #waitForConsistency} call works on its own
 * copy of the polling policy.
 */
public final class ConsistencyPoller {
  private final PollingPolicy pollingPolicy;
  private final Scope metricsScope;

  public ConsistencyPoller() {
    this(DefaultPollingRpcRetryOptions.INSTANCE.toPollingPolicy());
  }

  public ConsistencyPoller(PollingPolicy pollingPolicy) {
    this(pollingPolicy, new NoopScope());
  }

  public ConsistencyPoller(PollingPolicy pollingPolicy, Scope metricsScope) {
    this.pollingPolicy = Preconditions.checkNotNull(pollingPolicy, "pollingPolicy");
    this.metricsScope = Preconditions.checkNotNull(metricsScope, "metricsScope");
  }

  /**
   * Blocks until {@code check} reports the state as consistent.
   *
   * @throws io.cloudrpc.serviceclient.PermanentFailureException if a check failed permanently
   * @throws io.cloudrpc.serviceclient.RetryPolicyExhaustedException if the polling policy is
   *     exhausted; the status is {@code DEADLINE_EXCEEDED} when the state simply did not converge
   *     in time
   * @throws java.util.concurrent.CancellationException if the thread was interrupted
   */
  public void waitForConsistency(
      String operationName, ConsistencyCheck check, String consistencyToken) {
    Preconditions.checkNotNull(check, "check");
    Preconditions.checkNotNull(consistencyToken, "consistencyToken");
    PollingLoop loop = new PollingLoop(operationName, pollingPolicy, metricsScope);
    while (true) {
      loop.beforeAttempt();
      boolean consistent;
      try {
        consistent = check.isConsistent(consistencyToken);
      } catch (StatusRuntimeException e) {
        loop.onFailure(e);
        continue;
      }
      if (consistent) {
        return;
      }
      loop.onIncomplete();
      loop.waitBeforeNextRound();
    }
  }
}
