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
import javax.annotation.Nullable;

/** Outcome of one {@link ChunkedOperation#next} call. */
public final class ChunkResult<T> {

  /** Operation not finished yet, {@code continuationToken} resumes it. */
  public static <T> ChunkResult<T> inProgress(
      String continuationToken, long bytesDone, long totalBytes) {
    Preconditions.checkNotNull(continuationToken, "continuationToken");
    return new ChunkResult<>(false, continuationToken, bytesDone, totalBytes, null);
  }

  /** Operation finished with {@code result}. */
  public static <T> ChunkResult<T> done(T result, long bytesDone, long totalBytes) {
    return new ChunkResult<>(true, null, bytesDone, totalBytes, result);
  }

  private final boolean done;
  private final @Nullable String continuationToken;
  private final long bytesDone;
  private final long totalBytes;
  private final @Nullable T result;

  private ChunkResult(
      boolean done,
      @Nullable String continuationToken,
      long bytesDone,
      long totalBytes,
      @Nullable T result) {
    this.done = done;
    this.continuationToken = continuationToken;
    this.bytesDone = bytesDone;
    this.totalBytes = totalBytes;
    this.result = result;
  }

  public boolean isDone() {
    return done;
  }

  @Nullable
  public String getContinuationToken() {
    return continuationToken;
  }

  public long getBytesDone() {
    return bytesDone;
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  @Nullable
  public T getResult() {
    return result;
  }

  @Override
  public String toString() {
    return "ChunkResult{"
        + "done="
        + done
        + ", continuationToken="
        + continuationToken
        + ", bytesDone="
        + bytesDone
        + ", totalBytes="
        + totalBytes
        + '}';
  }
}
