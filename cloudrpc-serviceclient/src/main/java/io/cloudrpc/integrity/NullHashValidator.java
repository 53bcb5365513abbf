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
import javax.annotation.Nullable;

/** Used when validation is disabled; computes nothing and never reports a mismatch. */
public final class NullHashValidator implements HashValidator {
  private boolean finished;

  @Override
  public void update(byte[] buffer, int offset, int length) {
    Preconditions.checkState(!finished, "update() called on a finished validator");
  }

  @Override
  public void processMetadata(@Nullable String serverHash) {}

  @Override
  public void processHeader(String key, String value) {}

  @Override
  public Result finish(String context) {
    Preconditions.checkState(!finished, "finish() called twice");
    finished = true;
    return new Result("", "");
  }
}
