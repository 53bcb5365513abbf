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

import java.time.Duration;

/**
 * Computes the delay before the next attempt. Stateful and not thread-safe: each logical call works
 * on its own {@link #copy()}.
 */
public interface BackoffPolicy {

  /** Returns a new instance with the same parameters, starting from the initial delay. */
  BackoffPolicy copy();

  /** Returns the delay to wait now and advances the policy to the next delay. */
  Duration onCompletion();
}
