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

package io.cloudrpc.serviceclient.rpcretry;

import static org.junit.Assert.*;

import com.google.common.base.Ticker;
import io.cloudrpc.serviceclient.StatusUtils;
import io.grpc.Status;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.Test;

public class RetryPolicyTest {

  private static class FakeTicker extends Ticker {
    private final AtomicLong nanos = new AtomicLong();

    @Override
    public long read() {
      return nanos.get();
    }

    void advance(Duration duration) {
      nanos.addAndGet(duration.toNanos());
    }
  }

  @Test
  public void testErrorCountPolicyAllowsMaximumFailures() {
    RetryPolicy policy = new LimitedErrorCountRetryPolicy(3).copy();
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    assertFalse(policy.isExhausted());
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
    assertTrue(policy.isExhausted());
    for (int i = 0; i < 10; i++) {
      assertFalse(policy.onFailure(Status.UNAVAILABLE));
      assertTrue("exhaustion is permanent", policy.isExhausted());
    }
  }

  @Test
  public void testPermanentFailureDoesNotConsumeBudget() {
    LimitedErrorCountRetryPolicy policy = new LimitedErrorCountRetryPolicy(1);
    assertTrue(policy.isPermanentFailure(Status.PERMISSION_DENIED));
    assertFalse(policy.onFailure(Status.PERMISSION_DENIED));
    assertEquals(0, policy.getFailureCount());
    assertFalse(policy.isExhausted());
    assertFalse(policy.isPermanentFailure(Status.OK));
  }

  @Test
  public void testCopyHasIndependentProgress() {
    RetryPolicy prototype = new LimitedErrorCountRetryPolicy(1);
    RetryPolicy first = prototype.copy();
    assertTrue(first.onFailure(Status.ABORTED));
    assertFalse(first.onFailure(Status.ABORTED));
    RetryPolicy second = prototype.copy();
    assertFalse(second.isExhausted());
    assertTrue(second.onFailure(Status.ABORTED));
  }

  @Test
  public void testTimePolicyExhaustsAtDeadline() {
    FakeTicker ticker = new FakeTicker();
    LimitedTimeRetryPolicy policy =
        new LimitedTimeRetryPolicy(
            Duration.ofSeconds(10), StatusUtils::isTransientFailure, ticker);
    assertTrue(policy.onFailure(Status.UNAVAILABLE));
    ticker.advance(Duration.ofSeconds(9));
    assertTrue(policy.onFailure(Status.DEADLINE_EXCEEDED));
    ticker.advance(Duration.ofSeconds(1));
    assertTrue(policy.isExhausted());
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
    ticker.advance(Duration.ofDays(1));
    assertTrue(policy.isExhausted());
  }

  @Test
  public void testTimePolicyCopyRestartsTheClock() {
    FakeTicker ticker = new FakeTicker();
    RetryPolicy prototype =
        new LimitedTimeRetryPolicy(Duration.ofSeconds(10), status -> true, ticker);
    ticker.advance(Duration.ofSeconds(30));
    assertTrue(prototype.isExhausted());
    RetryPolicy copy = prototype.copy();
    assertFalse(copy.isExhausted());
    assertTrue(copy.onFailure(Status.INTERNAL));
  }

  @Test
  public void testCustomRetryablePredicate() {
    RetryPolicy policy =
        new LimitedErrorCountRetryPolicy(5, status -> status.getCode() == Status.Code.NOT_FOUND);
    assertTrue(policy.onFailure(Status.NOT_FOUND));
    assertTrue(policy.isPermanentFailure(Status.UNAVAILABLE));
    assertFalse(policy.onFailure(Status.UNAVAILABLE));
  }
}
