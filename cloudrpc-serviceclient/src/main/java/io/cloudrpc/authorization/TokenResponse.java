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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import java.time.Duration;

/** Body of a successful OAuth2 token response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TokenResponse {
  private final String accessToken;
  private final String tokenType;
  private final Duration expiresIn;

  @JsonCreator
  public TokenResponse(
      @JsonProperty("access_token") String accessToken,
      @JsonProperty("token_type") String tokenType,
      @JsonProperty("expires_in") long expiresInSeconds) {
    this(accessToken, tokenType, Duration.ofSeconds(expiresInSeconds));
  }

  public TokenResponse(String accessToken, String tokenType, Duration expiresIn) {
    Preconditions.checkArgument(
        accessToken != null && !accessToken.isEmpty(), "access_token is missing");
    Preconditions.checkArgument(
        tokenType != null && !tokenType.isEmpty(), "token_type is missing");
    this.accessToken = accessToken;
    this.tokenType = tokenType;
    this.expiresIn = Preconditions.checkNotNull(expiresIn, "expiresIn");
  }

  public String getAccessToken() {
    return accessToken;
  }

  public String getTokenType() {
    return tokenType;
  }

  /** Lifetime of the token declared by the server, counted from the response. */
  public Duration getExpiresIn() {
    return expiresIn;
  }

  /** Value of the authorization header, {@code "<token_type> <access_token>"}. */
  public String toAuthorizationHeader() {
    return tokenType + " " + accessToken;
  }

  @Override
  public String toString() {
    return "TokenResponse{tokenType=" + tokenType + ", expiresIn=" + expiresIn + '}';
  }
}
