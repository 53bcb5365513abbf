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

import static org.junit.Assert.*;

import com.google.common.io.BaseEncoding;
import io.grpc.Status;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.junit.Test;

public class Md5HashValidatorTest {

  private static String md5(String data) throws Exception {
    return BaseEncoding.base64()
        .encode(MessageDigest.getInstance("MD5").digest(data.getBytes(StandardCharsets.UTF_8)));
  }

  private static byte[] bytes(String data) {
    return data.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  public void testMatchingDigest() throws Exception {
    HashValidator validator = new Md5HashValidator();
    validator.update(bytes("abc"));
    validator.update(bytes("def"));
    validator.processMetadata(md5("abcdef"));
    HashValidator.Result result = validator.finish("bucket/object");
    assertEquals(result.getReceived(), result.getComputed());
    assertEquals(md5("abcdef"), result.getComputed());
    assertFalse(result.isMismatch());
  }

  @Test
  public void testEmptyObjectDigest() {
    HashValidator.Result result = new Md5HashValidator().finish("empty");
    assertEquals("1B2M2Y8AsgTpgAmY7PhCfg==", result.getComputed());
  }

  @Test
  public void testMismatch() throws Exception {
    HashValidator validator = new Md5HashValidator();
    validator.update(bytes("abcdef"));
    validator.processHeader("x-goog-hash", "md5=" + md5("something else"));
    HashMismatchException e =
        assertThrows(HashMismatchException.class, () -> validator.finish("bucket/object"));
    assertEquals(md5("something else"), e.getReceived());
    assertEquals(md5("abcdef"), e.getComputed());
    assertEquals(Status.Code.DATA_LOSS, e.getStatus().getCode());
    assertTrue(e.getMessage().contains("bucket/object"));
  }

  @Test
  public void testMissingServerDigestIsNotAMismatch() {
    HashValidator validator = new Md5HashValidator();
    validator.update(bytes("composed object"));
    validator.processMetadata("");
    validator.processMetadata(null);
    HashValidator.Result result = validator.finish("bucket/composed");
    assertEquals("", result.getReceived());
    assertFalse(result.isMismatch());
  }

  @Test
  public void testEmptyMetadataKeepsHeaderDigest() throws Exception {
    HashValidator validator = new Md5HashValidator();
    validator.update(bytes("abcdef"));
    validator.processHeader("X-Goog-Hash", "crc32c=n03x6A==, md5=" + md5("abcdef"));
    validator.processMetadata("");
    assertEquals(md5("abcdef"), validator.finish("bucket/object").getReceived());
  }

  @Test
  public void testOtherHeadersAreIgnored() throws Exception {
    HashValidator validator = new Md5HashValidator();
    validator.processHeader("x-goog-generation", "md5=" + md5("xyz"));
    validator.processHeader("x-goog-hash", "crc32c=n03x6A==");
    assertEquals("", validator.finish("bucket/object").getReceived());
  }

  @Test
  public void testValidatorIsSingleUse() {
    HashValidator validator = new Md5HashValidator();
    validator.finish("bucket/object");
    assertThrows(IllegalStateException.class, () -> validator.update(bytes("late")));
    assertThrows(IllegalStateException.class, () -> validator.finish("bucket/object"));
  }

  @Test
  public void testNullValidator() {
    HashValidator validator = new NullHashValidator();
    validator.update(bytes("abc"));
    validator.processHeader("x-goog-hash", "md5=AAAA");
    HashValidator.Result result = validator.finish("bucket/object");
    assertFalse(result.isMismatch());
    assertThrows(IllegalStateException.class, () -> validator.finish("bucket/object"));
  }
}
