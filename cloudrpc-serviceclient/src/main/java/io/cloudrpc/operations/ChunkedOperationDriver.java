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
import java.util.function.Consumer;
import javax.annotation.Nullable;

/**
 * Drives a {@link ChunkedOperation} to completion, feeding the continuation token of every chunk
 * into the next call. A successful chunk is followed by the next one immediately; the polling
 * policy spaces the calls only after failures and bounds the operation as a whole.
 */
public final class ChunkedOperationDriver {
  private final PollingPolicy pollingPolicy;
  private final Scope metricsScope;

  public ChunkedOperationDriver() {
    this(DefaultPollingRpcRetryOptions.INSTANCE.toPollingPolicy());
  }

  public ChunkedOperationDriver(PollingPolicy pollingPolicy) {
    this(pollingPolicy, new NoopScope());
  }

  public ChunkedOperationDriver(PollingPolicy pollingPolicy, Scope metricsScope) {
    this.pollingPolicy = Preconditions.checkNotNull(pollingPolicy, "pollingPolicy");
    this.metricsScope = Preconditions.checkNotNull(metricsScope, "metricsScope");
  }

  /**
   * Runs {@code operation} until it reports completion.
   *
   * @param progressCallback invoked after every chunk, the last one included
   * @return the result of the final chunk
   * @throws IllegalStateException if a chunk reports progress inconsistent with its state
   * @throws io.cloudrpc.serviceclient.PermanentFailureException if a chunk failed permanently
   * @throws io.cloudrpc.serviceclient.RetryPolicyExhaustedException if the polling policy is
   *     exhausted
   * @throws java.util.concurrent.CancellationException if the thread was interrupted
   */
  public <T> T run(
      String operationName,
      ChunkedOperation<T> operation,
      @Nullable Consumer<OperationProgress> progressCallback) {
    Preconditions.checkNotNull(operation, "operation");
    PollingLoop loop = new PollingLoop(operationName, pollingPolicy, metricsScope);
    String continuationToken = null;
    while (true) {
      loop.beforeAttempt();
      ChunkResult<T> chunk;
      try {
        chunk = operation.next(continuationToken);
      } catch (StatusRuntimeException e) {
        loop.onFailure(e);
        continue;
      }
      checkProgress(operationName, chunk);
      if (progressCallback != null) {
        progressCallback.accept(
            new OperationProgress(chunk.getBytesDone(), chunk.getTotalBytes(), chunk.isDone()));
      }
      if (chunk.isDone()) {
        return chunk.getResult();
      }
      continuationToken = chunk.getContinuationToken();
      loop.onIncomplete();
    }
  }

  private static void checkProgress(String operationName, ChunkResult<?> chunk) {
    Preconditions.checkState(chunk != null, "%s returned no chunk", operationName);
    long bytesDone = chunk.getBytesDone();
    long totalBytes = chunk.getTotalBytes();
    Preconditions.checkState(
        bytesDone >= 0 && bytesDone <= totalBytes,
        "%s reported progress out of range: bytesDone=%s totalBytes=%s",
        operationName,
        bytesDone,
        totalBytes);
    // a chunk is done exactly when all the bytes are
    Preconditions.checkState(
        (bytesDone < totalBytes) != chunk.isDone(),
        "%s reported inconsistent progress: bytesDone=%s totalBytes=%s done=%s",
        operationName,
        bytesDone,
        totalBytes,
        chunk.isDone());
  }
}
