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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.cloudrpc.serviceclient.StatusUtils;
import io.grpc.Status;
import java.io.IOException;
import java.util.Map;
import okhttp3.*;

/**
 * Blocking client of an OAuth2 token endpoint. Grant parameters are posted form encoded and the
 * JSON response is parsed into a {@link TokenResponse}.
 *
 * <p>Failures are reported as {@link io.grpc.StatusRuntimeException}: I/O errors as {@code
 * UNAVAILABLE}, HTTP errors mapped by {@link StatusUtils#fromHttpStatusCode(int)}, malformed
 * responses as {@code INTERNAL}. The retry policies of the caller classify them like any RPC
 * failure.
 */
public class OAuth2TokenEndpoint {
  public static final String DEFAULT_TOKEN_URI = "https://oauth2.googleapis.com/token";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient client;
  private final HttpUrl tokenUri;

  public OAuth2TokenEndpoint(OkHttpClient client, String tokenUri) {
    this.client = Preconditions.checkNotNull(client, "client");
    HttpUrl url = HttpUrl.parse(Preconditions.checkNotNull(tokenUri, "tokenUri"));
    Preconditions.checkArgument(url != null, "invalid token URI: %s", tokenUri);
    this.tokenUri = url;
  }

  public HttpUrl getTokenUri() {
    return tokenUri;
  }

  /** Posts {@code grantParameters} and returns the parsed token. */
  public TokenResponse requestToken(Map<String, String> grantParameters) {
    FormBody.Builder form = new FormBody.Builder();
    grantParameters.forEach(form::add);
    Request request = new Request.Builder().url(tokenUri).post(form.build()).build();

    String body;
    int code;
    try (Response response = client.newCall(request).execute()) {
      code = response.code();
      ResponseBody responseBody = response.body();
      body = responseBody != null ? responseBody.string() : "";
    } catch (IOException e) {
      throw Status.UNAVAILABLE
          .withDescription("Token request to " + tokenUri + " failed: " + e.getMessage())
          .withCause(e)
          .asRuntimeException();
    }
    if (code < 200 || code >= 300) {
      throw StatusUtils.newHttpException(code, "token request to " + tokenUri + " failed: " + body);
    }
    try {
      return MAPPER.readValue(body, TokenResponse.class);
    } catch (JsonProcessingException e) {
      throw Status.INTERNAL
          .withDescription(
              "Invalid token response from " + tokenUri + ": " + e.getOriginalMessage())
          .withCause(e)
          .asRuntimeException();
    }
  }
}
