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

import io.grpc.Status;
import io.grpc.StatusRuntimeException;

/** The digest of the transferred bytes differs from the one declared by the server. */
public final class HashMismatchException extends StatusRuntimeException {
  private static final long serialVersionUID = 1L;

  private final String received;
  private final String computed;

  public HashMismatchException(String context, String received, String computed) {
    super(
        Status.DATA_LOSS.withDescription(
            "Hash mismatch in "
                + context
                + ": received="
                + received
                + ", computed="
                + computed));
    this.received = received;
    this.computed = computed;
  }

  public String getReceived() {
    return received;
  }

  public String getComputed() {
    return computed;
  }
}
