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

import java.util.Objects;
import javax.annotation.Nullable;

/**
 * Accumulates a digest of the bytes of an upload or a download and compares it with the digest
 * declared by the server once the transfer completes.
 *
 * <p>Validators are single-use and not thread-safe: once {@link #finish(String)} returned or threw,
 * the validator accepts no more bytes.
 */
public interface HashValidator {

  /** Feeds the next chunk of transferred bytes. */
  void update(byte[] buffer, int offset, int length);

  default void update(byte[] buffer) {
    update(buffer, 0, buffer.length);
  }

  /**
   * Records the digest found in the object metadata. An empty or null value never replaces a
   * previously recorded one.
   */
  void processMetadata(@Nullable String serverHash);

  /** Records the digest carried by a response header, other headers are ignored. */
  void processHeader(String key, String value);

  /**
   * Finalizes the local digest.
   *
   * @param context describes the transfer in the mismatch error, usually the object name
   * @throws HashMismatchException if the server declared a digest and it differs from the
   *     computed one
   * @throws IllegalStateException if the validator was already finished
   */
  Result finish(String context);

  /** Digest declared by the server and digest computed locally, both base64 encoded. */
  final class Result {
    private final String received;
    private final String computed;

    public Result(String received, String computed) {
      this.received = Objects.requireNonNull(received);
      this.computed = Objects.requireNonNull(computed);
    }

    /** Empty if the server declared no digest. */
    public String getReceived() {
      return received;
    }

    public String getComputed() {
      return computed;
    }

    public boolean isMismatch() {
      return !received.isEmpty() && !received.equals(computed);
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) return true;
      if (o == null || getClass() != o.getClass()) return false;
      Result result = (Result) o;
      return received.equals(result.received) && computed.equals(result.computed);
    }

    @Override
    public int hashCode() {
      return Objects.hash(received, computed);
    }

    @Override
    public String toString() {
      return "Result{received=" + received + ", computed=" + computed + '}';
    }
  }
}
