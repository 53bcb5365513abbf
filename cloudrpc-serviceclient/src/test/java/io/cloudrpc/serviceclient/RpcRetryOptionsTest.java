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

import static org.junit.Assert.*;

import io.cloudrpc.serviceclient.rpcretry.DefaultPollingRpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.DefaultStubServiceOperationRpcRetryOptions;
import io.cloudrpc.serviceclient.rpcretry.ExponentialBackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedErrorCountRetryPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedTimeRetryPolicy;
import io.cloudrpc.serviceclient.rpcretry.RetryPolicy;
import io.grpc.Status;
import java.time.Duration;
import org.junit.Test;

public class RpcRetryOptionsTest {

  @Test
  public void testDefaults() {
    RpcRetryOptions options = RpcRetryOptions.getDefaultInstance();
    assertEquals(Duration.ofMillis(10), options.getInitialInterval());
    assertEquals(Duration.ofMinutes(5), options.getMaximumInterval());
    assertEquals(Duration.ofMinutes(15), options.getExpiration());
    assertEquals(2.0, options.getBackoffCoefficient(), 0.0);
    assertEquals(0.1, options.getMaximumJitterCoefficient(), 0.0);
    assertEquals(DefaultStubServiceOperationRpcRetryOptions.INSTANCE, options);
  }

  @Test
  public void testPollingDefaults() {
    RpcRetryOptions options = DefaultPollingRpcRetryOptions.INSTANCE;
    assertEquals(Duration.ofSeconds(2), options.getInitialInterval());
    assertEquals(Duration.ofMinutes(30), options.getExpiration());
  }

  @Test
  public void testExpirationMakesTimeLimitedPolicy() {
    RetryPolicy policy = RpcRetryOptions.getDefaultInstance().toRetryPolicy();
    assertTrue(policy instanceof LimitedTimeRetryPolicy);
    assertEquals(
        Duration.ofMinutes(15), ((LimitedTimeRetryPolicy) policy).getMaximumDuration());
  }

  @Test
  public void testMaximumAttemptsMakesErrorCountPolicy() {
    RpcRetryOptions options =
        RpcRetryOptions.newBuilder().setMaximumAttempts(3).validateBuildWithDefaults();
    assertNull(options.getExpiration());
    RetryPolicy policy = options.toRetryPolicy();
    assertTrue(policy instanceof LimitedErrorCountRetryPolicy);
    assertEquals(2, ((LimitedErrorCountRetryPolicy) policy).getMaximumFailures());
  }

  @Test
  public void testExpirationAndMaximumAttemptsAreExclusive() {
    assertThrows(
        IllegalArgumentException.class,
        () ->
            RpcRetryOptions.newBuilder()
                .setMaximumAttempts(3)
                .setExpiration(Duration.ofSeconds(1))
                .validateBuildWithDefaults());
  }

  @Test
  public void testMaximumIntervalBelowInitialIsRejected() {
    assertThrows(
        IllegalStateException.class,
        () ->
            RpcRetryOptions.newBuilder()
                .setInitialInterval(Duration.ofSeconds(10))
                .setMaximumInterval(Duration.ofSeconds(1))
                .validateBuildWithDefaults());
  }

  @Test
  public void testDoNotRetryMakesTransientCodePermanent() {
    RetryPolicy policy =
        RpcRetryOptions.newBuilder()
            .addDoNotRetry(Status.Code.INTERNAL)
            .validateBuildWithDefaults()
            .toRetryPolicy();
    assertTrue(policy.isPermanentFailure(Status.INTERNAL));
    assertFalse(policy.isPermanentFailure(Status.UNAVAILABLE));
  }

  @Test
  public void testBackoffPolicyCarriesJitter() {
    ExponentialBackoffPolicy backoff =
        (ExponentialBackoffPolicy)
            RpcRetryOptions.newBuilder()
                .setMaximumJitterCoefficient(0.3)
                .validateBuildWithDefaults()
                .toBackoffPolicy();
    assertEquals(0.3, backoff.getMaxJitterCoefficient(), 0.0);
  }

  @Test
  public void testNewBuilderCopiesOptions() {
    RpcRetryOptions options =
        RpcRetryOptions.newBuilder()
            .setInitialInterval(Duration.ofMillis(50))
            .addDoNotRetry(Status.Code.ABORTED)
            .validateBuildWithDefaults();
    assertEquals(options, RpcRetryOptions.newBuilder(options).validateBuildWithDefaults());
  }
}
