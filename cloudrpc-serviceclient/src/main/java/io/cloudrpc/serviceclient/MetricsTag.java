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

package io.cloudrpc.serviceclient;

import com.uber.m3.tally.Scope;
import com.uber.m3.util.ImmutableMap;
import java.util.Collections;

public class MetricsTag {
  public static final String OPERATION_NAME = "operation";
  public static final String STATUS_CODE = "status_code";
  /** Terminal outcome of a retried call, one of the {@code OUTCOME_*} values. */
  public static final String OUTCOME = "outcome";

  public static final String OUTCOME_PERMANENT = "permanent";
  public static final String OUTCOME_EXHAUSTED = "exhausted";
  public static final String OUTCOME_CANCELLED = "cancelled";

  public static Scope tagged(Scope scope, String tagName, String tagValue) {
    return scope.tagged(Collections.singletonMap(tagName, tagValue));
  }

  /** Scope for a failed terminal state of {@code operationName}. */
  public static Scope failureScope(Scope scope, String outcome, String statusCode) {
    return scope.tagged(
        new ImmutableMap.Builder<String, String>(2)
            .put(OUTCOME, outcome)
            .put(STATUS_CODE, statusCode)
            .build());
  }

  private MetricsTag() {}
}
