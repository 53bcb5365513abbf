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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import io.cloudrpc.conf.EnvironmentVariableNames;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;
import okhttp3.OkHttpClient;

/**
 * Creates {@link AuthorizationTokenSupplier}s from credential files in the JSON format issued by
 * the cloud console and the gcloud CLI.
 *
 * <p>Supported {@code type}s:
 *
 * <ul>
 *   <li>{@code authorized_user}: {@code client_id}, {@code client_secret}, {@code refresh_token}
 *       and an optional {@code token_uri}
 *   <li>{@code service_account}: {@code client_email}, {@code private_key}, an optional {@code
 *       private_key_id} and an optional {@code token_uri}
 * </ul>
 */
public final class CredentialsLoader {
  public static final String AUTHORIZED_USER = "authorized_user";
  public static final String SERVICE_ACCOUNT = "service_account";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private final OkHttpClient httpClient;
  private final RefreshingTokenSupplier.Options options;

  public CredentialsLoader() {
    this(new OkHttpClient(), RefreshingTokenSupplier.Options.getDefaultInstance());
  }

  public CredentialsLoader(OkHttpClient httpClient, RefreshingTokenSupplier.Options options) {
    this.httpClient = Preconditions.checkNotNull(httpClient, "httpClient");
    this.options = Preconditions.checkNotNull(options, "options");
  }

  public static AuthorizationTokenSupplier anonymous() {
    return AnonymousTokenSupplier.INSTANCE;
  }

  /**
   * Loads the file named by the {@code GOOGLE_APPLICATION_CREDENTIALS} environment variable.
   *
   * @throws IllegalStateException if the variable is not set
   */
  public AuthorizationTokenSupplier getDefault() {
    return getDefault(System::getenv);
  }

  AuthorizationTokenSupplier getDefault(Function<String, String> environment) {
    String path = environment.apply(EnvironmentVariableNames.GOOGLE_APPLICATION_CREDENTIALS);
    if (path == null || path.isEmpty()) {
      throw new IllegalStateException(
          "No eligible credential types were found to use as default credentials, set "
              + EnvironmentVariableNames.GOOGLE_APPLICATION_CREDENTIALS);
    }
    return fromFile(Paths.get(path));
  }

  /**
   * @throws UncheckedIOException if the file cannot be read
   * @throws IllegalArgumentException if the contents are not valid credentials
   */
  public AuthorizationTokenSupplier fromFile(Path path) {
    String contents;
    try {
      contents = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException("Cannot open credentials file " + path, e);
    }
    return fromJson(contents, path.toString());
  }

  /**
   * @param source where the contents came from, used in error messages
   * @throws IllegalArgumentException if the contents are not valid credentials
   */
  public AuthorizationTokenSupplier fromJson(String contents, String source) {
    JsonNode json;
    try {
      json = MAPPER.readTree(contents);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid contents in credentials file " + source, e);
    }
    if (json == null || !json.isObject()) {
      throw new IllegalArgumentException("Invalid contents in credentials file " + source);
    }
    String type = json.path("type").asText("no type given");
    switch (type) {
      case AUTHORIZED_USER:
        return new RefreshingTokenSupplier(
            new AuthorizedUserTokenSource(
                endpoint(json),
                requiredField(json, "client_id", source),
                requiredField(json, "client_secret", source),
                requiredField(json, "refresh_token", source)),
            options);
      case SERVICE_ACCOUNT:
        return new RefreshingTokenSupplier(
            new ServiceAccountTokenSource(
                endpoint(json),
                requiredField(json, "client_email", source),
                json.hasNonNull("private_key_id") ? json.get("private_key_id").asText() : null,
                ServiceAccountTokenSource.parsePrivateKey(
                    requiredField(json, "private_key", source)),
                ServiceAccountTokenSource.DEFAULT_SCOPE,
                options.getClock()),
            options);
      default:
        throw new IllegalArgumentException(
            "Unsupported credential type ("
                + type
                + ") when reading credentials file from "
                + source
                + ".");
    }
  }

  private OAuth2TokenEndpoint endpoint(JsonNode json) {
    String tokenUri =
        json.hasNonNull("token_uri")
            ? json.get("token_uri").asText()
            : OAuth2TokenEndpoint.DEFAULT_TOKEN_URI;
    return new OAuth2TokenEndpoint(httpClient, tokenUri);
  }

  private static String requiredField(JsonNode json, String name, String source) {
    JsonNode value = json.get(name);
    if (value == null || !value.isTextual() || value.asText().isEmpty()) {
      throw new IllegalArgumentException(
          "Invalid credentials file " + source + ": missing field " + name);
    }
    return value.asText();
  }
}
