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
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

import io.cloudrpc.serviceclient.PermanentFailureException;
import io.cloudrpc.serviceclient.RetryPolicyExhaustedException;
import io.cloudrpc.serviceclient.rpcretry.ExponentialBackoffPolicy;
import io.cloudrpc.serviceclient.rpcretry.GenericPollingPolicy;
import io.cloudrpc.serviceclient.rpcretry.LimitedErrorCountRetryPolicy;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import org.junit.Test;
import org.mockito.InOrder;

public class ChunkedOperationDriverTest {

  private static ChunkedOperationDriver driver(int maximumRounds) {
    return new ChunkedOperationDriver(
        new GenericPollingPolicy(
            new LimitedErrorCountRetryPolicy(maximumRounds),
            new ExponentialBackoffPolicy(Duration.ofMillis(1), Duration.ofMillis(5), 2.0)));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testFeedsContinuationTokensAndReportsProgress() {
    ChunkedOperation<String> copy = mock(ChunkedOperation.class);
    when(copy.next(isNull())).thenReturn(ChunkResult.inProgress("rewrite-token", 40, 100));
    when(copy.next("rewrite-token")).thenReturn(ChunkResult.done("copied-object", 100, 100));
    List<OperationProgress> progress = new ArrayList<>();

    String result = driver(10).run("RewriteObject", copy, progress::add);

    assertEquals("copied-object", result);
    assertEquals(2, progress.size());
    assertEquals(new OperationProgress(40, 100, false), progress.get(0));
    assertEquals(new OperationProgress(100, 100, true), progress.get(1));
    assertTrue(progress.get(0).getBytesDone() < progress.get(1).getBytesDone());
    InOrder inOrder = inOrder(copy);
    inOrder.verify(copy).next(null);
    inOrder.verify(copy).next("rewrite-token");
    verifyNoMoreInteractions(copy);
  }

  @Test
  public void testNullCallbackIsAllowed() {
    int[] calls = {0};
    String result =
        driver(10)
            .run(
                "RewriteObject",
                token -> {
                  calls[0]++;
                  return token == null
                      ? ChunkResult.inProgress("t", 1, 2)
                      : ChunkResult.done("done", 2, 2);
                },
                null);
    assertEquals("done", result);
    assertEquals(2, calls[0]);
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testTransientFailureRepeatsTheSameChunk() {
    ChunkedOperation<String> copy = mock(ChunkedOperation.class);
    when(copy.next(isNull())).thenReturn(ChunkResult.inProgress("t1", 10, 30));
    when(copy.next("t1"))
        .thenThrow(new StatusRuntimeException(Status.UNAVAILABLE))
        .thenReturn(ChunkResult.done("copied", 30, 30));
    assertEquals("copied", driver(10).run("RewriteObject", copy, null));
    verify(copy, times(2)).next("t1");
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testPermanentFailure() {
    ChunkedOperation<String> copy = mock(ChunkedOperation.class);
    when(copy.next(any())).thenThrow(new StatusRuntimeException(Status.PERMISSION_DENIED));
    PermanentFailureException e =
        assertThrows(
            PermanentFailureException.class, () -> driver(10).run("RewriteObject", copy, null));
    assertEquals(Status.Code.PERMISSION_DENIED, e.getStatus().getCode());
  }

  @Test
  public void testBudgetBoundsNumberOfChunks() {
    List<OperationProgress> progress = new ArrayList<>();
    long[] done = {0};
    RetryPolicyExhaustedException e =
        assertThrows(
            RetryPolicyExhaustedException.class,
            () ->
                driver(2)
                    .run(
                        "RewriteObject",
                        token -> ChunkResult.inProgress("t", ++done[0], 1000),
                        progress::add));
    assertEquals(Status.Code.DEADLINE_EXCEEDED, e.getStatus().getCode());
    assertEquals(3, progress.size());
  }

  @Test
  public void testDoneBeforeAllBytesIsRejected() {
    assertThrows(
        IllegalStateException.class,
        () ->
            driver(10)
                .run("RewriteObject", token -> ChunkResult.done("partial", 40, 100), null));
  }

  @Test
  public void testNotDoneAfterAllBytesIsRejected() {
    assertThrows(
        IllegalStateException.class,
        () ->
            driver(10)
                .run("RewriteObject", token -> ChunkResult.inProgress("t", 100, 100), null));
  }

  @Test
  @SuppressWarnings("unchecked")
  public void testProgressOutOfRangeIsRejectedBeforeCallback() {
    ChunkedOperation<String> copy = mock(ChunkedOperation.class);
    when(copy.next(any())).thenReturn(ChunkResult.inProgress("t", 120, 100));
    Consumer<OperationProgress> callback = mock(Consumer.class);
    assertThrows(
        IllegalStateException.class, () -> driver(10).run("RewriteObject", copy, callback));
    verify(callback, never()).accept(any());
    verify(copy).next(eq(null));
  }
}
