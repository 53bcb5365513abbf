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

import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import org.junit.Test;

public class StatusUtilsTest {

  @Test
  public void testTransientCodes() {
    assertTrue(StatusUtils.isTransientFailure(Status.UNAVAILABLE));
    assertTrue(StatusUtils.isTransientFailure(Status.RESOURCE_EXHAUSTED));
    assertFalse(StatusUtils.isTransientFailure(Status.NOT_FOUND));
    assertFalse(StatusUtils.isTransientFailure(Status.PERMISSION_DENIED));
    assertFalse(StatusUtils.isTransientFailure(Status.OK));
  }

  @Test
  public void testHttpStatusMapping() {
    assertEquals(Status.Code.OK, StatusUtils.fromHttpStatusCode(200));
    assertEquals(Status.Code.UNAUTHENTICATED, StatusUtils.fromHttpStatusCode(401));
    assertEquals(Status.Code.RESOURCE_EXHAUSTED, StatusUtils.fromHttpStatusCode(429));
    assertEquals(Status.Code.UNAVAILABLE, StatusUtils.fromHttpStatusCode(503));
    assertEquals(Status.Code.INTERNAL, StatusUtils.fromHttpStatusCode(502));
    assertEquals(Status.Code.UNKNOWN, StatusUtils.fromHttpStatusCode(302));
  }

  @Test
  public void testFailureExceptionKeepsLastStatus() {
    StatusRuntimeException last =
        Status.UNAVAILABLE.withDescription("backend down").asRuntimeException();
    RetryPolicyExhaustedException e =
        new RetryPolicyExhaustedException(
            "GetTable", last.getStatus(), last, 4, Duration.ofMillis(1500));
    assertEquals(Status.Code.UNAVAILABLE, e.getStatus().getCode());
    assertEquals(
        "Retry policy exhausted in GetTable: backend down (attempts=4, elapsed=1500ms)",
        e.getStatus().getDescription());
    assertSame(last, e.getCause());
    assertEquals("GetTable", e.getOperationName());
    assertEquals(4, e.getAttempts());
  }
}
