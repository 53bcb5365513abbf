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

package io.cloudrpc.authorization;

import com.google.common.base.Preconditions;
import java.time.Instant;
import java.util.Objects;

/** Cached authorization header together with the instant it stops being usable. */
public final class AccessToken {
  private final String authorizationHeader;
  private final Instant expiration;

  public AccessToken(String authorizationHeader, Instant expiration) {
    this.authorizationHeader = Preconditions.checkNotNull(authorizationHeader, "header");
    this.expiration = Preconditions.checkNotNull(expiration, "expiration");
  }

  public String getAuthorizationHeader() {
    return authorizationHeader;
  }

  public Instant getExpiration() {
    return expiration;
  }

  public boolean isValidAt(Instant now) {
    return now.isBefore(expiration);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    AccessToken that = (AccessToken) o;
    return authorizationHeader.equals(that.authorizationHeader)
        && expiration.equals(that.expiration);
  }

  @Override
  public int hashCode() {
    return Objects.hash(authorizationHeader, expiration);
  }

  @Override
  public String toString() {
    // the header is a secret
    return "AccessToken{expiration=" + expiration + '}';
  }
}
