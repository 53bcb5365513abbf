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

import com.google.common.base.Preconditions;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;

public class StatusUtils {

  /**
   * Determines if a status describes a failure that may go away on its own: network blips, server
   * side throttling and 5xx-class errors.
   *
   * @return true if an identical request has a chance to succeed later
   */
  public static boolean isTransientFailure(Status status) {
    Preconditions.checkNotNull(status, "status cannot be null");
    switch (status.getCode()) {
      case UNAVAILABLE:
      case DEADLINE_EXCEEDED:
      case ABORTED:
      case RESOURCE_EXHAUSTED:
      case INTERNAL:
      case UNKNOWN:
        return true;
      default:
        return false;
    }
  }

  /**
   * Maps an HTTP response code onto the closest gRPC status code. Used by the HTTP based
   * collaborators (token endpoints) so that the retry policies classify their failures the same
   * way as gRPC failures.
   */
  public static Status.Code fromHttpStatusCode(int httpStatusCode) {
    if (httpStatusCode >= 200 && httpStatusCode < 300) {
      return Status.Code.OK;
    }
    switch (httpStatusCode) {
      case 400:
        return Status.Code.INVALID_ARGUMENT;
      case 401:
        return Status.Code.UNAUTHENTICATED;
      case 403:
        return Status.Code.PERMISSION_DENIED;
      case 404:
        return Status.Code.NOT_FOUND;
      case 408:
        return Status.Code.DEADLINE_EXCEEDED;
      case 409:
        return Status.Code.ABORTED;
      case 412:
        return Status.Code.FAILED_PRECONDITION;
      case 429:
        return Status.Code.RESOURCE_EXHAUSTED;
      case 501:
        return Status.Code.UNIMPLEMENTED;
      case 503:
        return Status.Code.UNAVAILABLE;
      case 504:
        return Status.Code.DEADLINE_EXCEEDED;
      default:
        if (httpStatusCode >= 500) {
          return Status.Code.INTERNAL;
        }
        return Status.Code.UNKNOWN;
    }
  }

  /** Create StatusRuntimeException for a failed HTTP exchange. */
  public static StatusRuntimeException newHttpException(int httpStatusCode, String description) {
    return Status.fromCode(fromHttpStatusCode(httpStatusCode))
        .withDescription("HTTP " + httpStatusCode + ": " + description)
        .asRuntimeException();
  }

  private StatusUtils() {}
}
