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
import com.google.common.collect.ImmutableList;
import io.grpc.CallOptions;
import io.grpc.Channel;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptor;
import io.grpc.ForwardingClientCall;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import java.util.Collection;

/**
 * Adds the headers of a fixed list of {@link GrpcMetadataProvider}s to every outgoing call. The
 * providers are consulted when the call starts, so a credential refreshed since the previous call
 * is sent without rebuilding the channel.
 *
 * <p>An exception thrown by a provider propagates from {@link ClientCall#start} and the call is
 * never started.
 */
public class GrpcMetadataProviderInterceptor implements ClientInterceptor {
  private final ImmutableList<GrpcMetadataProvider> providers;

  public GrpcMetadataProviderInterceptor(Collection<GrpcMetadataProvider> providers) {
    this.providers = ImmutableList.copyOf(Preconditions.checkNotNull(providers, "providers"));
  }

  @Override
  public <ReqT, RespT> ClientCall<ReqT, RespT> interceptCall(
      MethodDescriptor<ReqT, RespT> method, CallOptions callOptions, Channel next) {
    ClientCall<ReqT, RespT> call = next.newCall(method, callOptions);
    if (providers.isEmpty()) {
      return call;
    }
    return new ForwardingClientCall.SimpleForwardingClientCall<ReqT, RespT>(call) {
      @Override
      public void start(Listener<RespT> responseListener, Metadata headers) {
        headers.merge(collectHeaders());
        super.start(responseListener, headers);
      }
    };
  }

  private Metadata collectHeaders() {
    Metadata collected = new Metadata();
    for (GrpcMetadataProvider provider : providers) {
      Metadata metadata = provider.getMetadata();
      if (metadata != null) {
        collected.merge(metadata);
      }
    }
    return collected;
  }
}
