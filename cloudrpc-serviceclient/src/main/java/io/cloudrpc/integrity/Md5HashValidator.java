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

package io.cloudrpc.integrity;

import com.google.common.base.Preconditions;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import java.util.Locale;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * Validates transfers against the base64 encoded MD5 digest of the object, found either in its
 * metadata or in the {@code x-goog-hash} response header.
 */
@NotThreadSafe
public final class Md5HashValidator implements HashValidator {
  public static final String HASH_HEADER = "x-goog-hash";
  private static final String MD5_PREFIX = "md5=";

  private final Hasher hasher = newMd5Hasher();
  private String receivedHash = "";
  private boolean finished;

  @SuppressWarnings("deprecation")
  private static Hasher newMd5Hasher() {
    return Hashing.md5().newHasher();
  }

  @Override
  public void update(byte[] buffer, int offset, int length) {
    Preconditions.checkState(!finished, "update() called on a finished validator");
    hasher.putBytes(buffer, offset, length);
  }

  @Override
  public void processMetadata(@Nullable String serverHash) {
    if (serverHash == null || serverHash.isEmpty()) {
      // metadata from the XML API has no hash while its headers do
      return;
    }
    receivedHash = serverHash;
  }

  /** Accepts {@code x-goog-hash: md5=<base64>}, possibly listed among other digests. */
  @Override
  public void processHeader(String key, String value) {
    if (!HASH_HEADER.equals(key.toLowerCase(Locale.ROOT))) {
      return;
    }
    for (String part : value.split(",")) {
      String digest = part.trim();
      if (digest.startsWith(MD5_PREFIX) && digest.length() > MD5_PREFIX.length()) {
        receivedHash = digest.substring(MD5_PREFIX.length());
        return;
      }
    }
  }

  @Override
  public Result finish(String context) {
    Preconditions.checkState(!finished, "finish() called twice");
    finished = true;
    String computed = BaseEncoding.base64().encode(hasher.hash().asBytes());
    Result result = new Result(receivedHash, computed);
    // composed objects legitimately have no MD5, an empty received value is not a mismatch
    if (result.isMismatch()) {
      throw new HashMismatchException(context, receivedHash, computed);
    }
    return result;
  }
}
