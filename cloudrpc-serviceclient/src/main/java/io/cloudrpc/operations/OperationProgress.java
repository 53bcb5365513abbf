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

import java.util.Objects;

/** Progress reported to the callback of {@link ChunkedOperationDriver} after every chunk. */
public final class OperationProgress {
  private final long bytesDone;
  private final long totalBytes;
  private final boolean done;

  public OperationProgress(long bytesDone, long totalBytes, boolean done) {
    this.bytesDone = bytesDone;
    this.totalBytes = totalBytes;
    this.done = done;
  }

  public long getBytesDone() {
    return bytesDone;
  }

  public long getTotalBytes() {
    return totalBytes;
  }

  public boolean isDone() {
    return done;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    OperationProgress that = (OperationProgress) o;
    return bytesDone == that.bytesDone && totalBytes == that.totalBytes && done == that.done;
  }

  @Override
  public int hashCode() {
    return Objects.hash(bytesDone, totalBytes, done);
  }

  @Override
  public String toString() {
    return "OperationProgress{bytesDone="
        + bytesDone
        + ", totalBytes="
        + totalBytes
        + ", done="
        + done
        + '}';
  }
}
