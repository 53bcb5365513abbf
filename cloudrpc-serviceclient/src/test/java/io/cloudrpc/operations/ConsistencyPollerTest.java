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

import static org.junit.Assert.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import io.cloudrpc.serviceclient.PermanentFailureException;
import io.cloudrpc.serviceclient.RetryPolicyExhaustedException;
import io.cloudrpc.serviceclient.rpcretry.ExponentialBackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.GenericPollingPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedErrorCountRetryPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedTimeRetryPolicy;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import org.junit.Test;

public class ConsistencyPollerTest {

  private static ConsistencyPoller poller(int maximumRounds) {
    return new ConsistencyPoller(
        new GenericPollingPolicy(
            new LimitedErrorCountRetryPolicy(maximumRounds),
            new ExponentialBackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5), 2.0)));
  }

  @Test
  public void testReturnsOnceConsistent() {
    ConsistencyCheck check = mock(ConsistencyCheck.class);
    when(check.isConsistent("token-1")).thenReturn(false, false, true);
    poller(10).waitForConsistency("WaitForConsistency", check, "token-1");
    verify(check, times(3)).isConsistent("token-1");
  }

  @Test
  public void testTransientFailuresAreRetried() {
    ConsistencyCheck check = mock(ConsistencyCheck.class);
    when(check.isConsistent(anyString()))
        .thenThrow(new StatusRuntimeException(Status.UNAVAILABLE))
        .thenReturn(true);
    poller(10).waitForConsistency("WaitForConsistency", check, "token-1");
    verify(check, times(2)).isConsistent("token-1");
  }

  @Test
  public void testPermanentFailureStopsPolling() {
    ConsistencyCheck check = mock(ConsistencyCheck.class);
    when(check.isConsistent(anyString()))
        .thenThrow(Status.NOT_FOUND.withDescription("no such table").asRuntimeException());
    PermanentFailureException e =
        assertThrows(
            PermanentFailureException.class,
            () -> poller(10).waitForConsistency("WaitForConsistency", check, "token-1"));
    assertEquals(Status.Code.NOT_FOUND, e.getStatus().getCode());
    assertEquals("WaitForConsistency", e.getOperationName());
    verify(check, times(1)).isConsistent("token-1");
  }

  @Test
  public void testNeverConsistentTimesOut() {
    ConsistencyCheck check = mock(ConsistencyCheck.class);
    when(check.isConsistent(anyString())).thenReturn(false);
    RetryPolicyExhaustedException e =
        assertThrows(
            RetryPolicyExhaustedException.class,
            () -> poller(3).waitForConsistency("WaitForConsistency", check, "token-1"));
    assertEquals(Status.Code.DEADLINE_EXCEEDED, e.getStatus().getCode());
    assertEquals(4, e.getAttempts());
    verify(check, times(4)).isConsistent("token-1");
  }

  @Test
  public void testTimeLimitedPolling() {
    ConsistencyPoller poller =
        new ConsistencyPoller(
            new GenericPollingPolicy(
                new LimitedTimeRetryPolicy(Duration.ofMillis(200)),
                new ExponentialBackoffPolicy(Duration.ofMillis(10), Duration.ofMillis(20), 2.0)));
    long start = System.currentTimeMillis();
    RetryPolicyExhaustedException e =
        assertThrows(
            RetryPolicyExhaustedException.class,
            () -> poller.waitForConsistency("WaitForConsistency", token -> false, "token-1"));
    assertEquals(Status.Code.DEADLINE_EXCEEDED, e.getStatus().getCode());
    assertTrue(System.currentTimeMillis() - start >= 200);
  }

  @Test
  public void testPollerIsReusable() {
    ConsistencyPoller poller = poller(1);
    for (int i = 0; i < 3; i++) {
      ConsistencyCheck check = mock(ConsistencyCheck.class);
      when(check.isConsistent(anyString())).thenReturn(false, true);
      poller.waitForConsistency("WaitForConsistency", check, "token-" + i);
    }
  }
}
