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

package io.cloudrpc.integrity;

import com.google.common.base.Preconditions;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import javax.annotation.Nullable;

/**
 * Feeds every byte read from a download into a {@link HashValidator} and finishes the validator
 * when the end of the stream is reached. A mismatch is thrown from the read that hit the end of the
 * stream, or from {@link #close()} when the caller stopped right after the last byte.
 *
 * <p>A stream closed while data remains is not validated.
 */
public class HashValidatingInputStream extends FilterInputStream {
  private final HashValidator validator;
  private final String context;
  private @Nullable HashValidator.Result result;
  private boolean finished;
  private boolean closed;

  public HashValidatingInputStream(InputStream in, HashValidator validator, String context) {
    super(Preconditions.checkNotNull(in, "in"));
    this.validator = Preconditions.checkNotNull(validator, "validator");
    this.context = Preconditions.checkNotNull(context, "context");
  }

  @Override
  public int read() throws IOException {
    int b = super.read();
    if (b < 0) {
      onEndOfStream();
    } else {
      validator.update(new byte[] {(byte) b}, 0, 1);
    }
    return b;
  }

  @Override
  public int read(byte[] buffer, int offset, int length) throws IOException {
    int count = super.read(buffer, offset, length);
    if (count < 0) {
      onEndOfStream();
    } else if (count > 0) {
      validator.update(buffer, offset, count);
    }
    return count;
  }

  @Override
  public long skip(long n) throws IOException {
    // skipped bytes have to be hashed too
    byte[] buffer = new byte[(int) Math.min(8192, Math.max(n, 0))];
    long skipped = 0;
    while (skipped < n) {
      int count = read(buffer, 0, (int) Math.min(buffer.length, n - skipped));
      if (count < 0) {
        break;
      }
      skipped += count;
    }
    return skipped;
  }

  @Override
  public boolean markSupported() {
    return false;
  }

  @Override
  public synchronized void mark(int readlimit) {}

  @Override
  public synchronized void reset() throws IOException {
    throw new IOException("mark/reset not supported");
  }

  /**
   * Closes the download, validating it first if all of its bytes were read.
   *
   * @throws HashMismatchException if the data does not match the digest declared by the server
   */
  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    try {
      if (!finished && in.read() < 0) {
        onEndOfStream();
      }
    } finally {
      super.close();
    }
  }

  /** Outcome of the validation, null until the end of the stream was reached. */
  @Nullable
  public HashValidator.Result getResult() {
    return result;
  }

  private void onEndOfStream() {
    if (!finished) {
      finished = true;
      result = validator.finish(context);
    }
  }
}
