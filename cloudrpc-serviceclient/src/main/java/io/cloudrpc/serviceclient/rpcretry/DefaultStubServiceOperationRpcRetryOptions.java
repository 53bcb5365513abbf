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

import io.cloudrpc.serviceclient.RpcRetryOptions;
import java.time.Duration;

/** Defaults of regular unary calls, and of the credential refresh. */
public class DefaultStubServiceOperationRpcRetryOptions {
  public static final Duration INITIAL_INTERVAL = Duration.ofMillis(10);
  public static final Duration MAXIMUM_INTERVAL = Duration.ofMinutes(5);
  public static final Duration EXPIRATION_INTERVAL = Duration.ofMinutes(15);
  public static final double BACKOFF = 2.0;
  public static final double MAXIMUM_JITTER_COEFFICIENT = 0.1;

  public static final RpcRetryOptions INSTANCE = getBuilder().validateBuildWithDefaults();

  public static RpcRetryOptions.Builder getBuilder() {
    return RpcRetryOptions.newBuilder()
        .setInitialInterval(INITIAL_INTERVAL)
        .setMaximumInterval(MAXIMUM_INTERVAL)
        .setExpiration(EXPIRATION_INTERVAL)
        .setBackoffCoefficient(BACKOFF)
        .setMaximumJitterCoefficient(MAXIMUM_JITTER_COEFFICIENT);
  }

  private DefaultStubServiceOperationRpcRetryOptions() {}
}
