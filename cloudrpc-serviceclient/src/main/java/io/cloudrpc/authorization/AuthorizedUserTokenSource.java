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
import com.google.common.collect.ImmutableMap;

/** Exchanges the refresh token of an end user for an access token. */
public final class AuthorizedUserTokenSource implements AccessTokenSource {
  private final OAuth2TokenEndpoint endpoint;
  private final String clientId;
  private final String clientSecret;
  private final String refreshToken;

  public AuthorizedUserTokenSource(
      OAuth2TokenEndpoint endpoint, String clientId, String clientSecret, String refreshToken) {
    this.endpoint = Preconditions.checkNotNull(endpoint, "endpoint");
    this.clientId = Preconditions.checkNotNull(clientId, "clientId");
    this.clientSecret = Preconditions.checkNotNull(clientSecret, "clientSecret");
    this.refreshToken = Preconditions.checkNotNull(refreshToken, "refreshToken");
  }

  @Override
  public TokenResponse fetchToken() {
    return endpoint.requestToken(
        ImmutableMap.of(
            "grant_type", "refresh_token",
            "client_id", clientId,
            "client_secret", clientSecret,
            "refresh_token", refreshToken));
  }

  public String getClientId() {
    return clientId;
  }
}
