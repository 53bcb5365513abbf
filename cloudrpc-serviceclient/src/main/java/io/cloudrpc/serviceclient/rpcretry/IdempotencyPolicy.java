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

/**
 * Classifies a request as safe to repeat or not, independent of the error it produced. Retryers
 * consult it once per logical call; a request that is not idempotent gets exactly one attempt.
 *
 * @param <ReqT> request type
 */
@FunctionalInterface
public interface IdempotencyPolicy<ReqT> {

  boolean isIdempotent(ReqT request);

  /** Every request is safe to retry: reads, or writes guarded by a server enforced precondition. */
  static <ReqT> IdempotencyPolicy<ReqT> always() {
    return new ConstantIdempotencyPolicy<>(true);
  }

  static <ReqT> IdempotencyPolicy<ReqT> never() {
    return new ConstantIdempotencyPolicy<>(false);
  }
}
