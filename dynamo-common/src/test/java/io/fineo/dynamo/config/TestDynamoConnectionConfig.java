/*
 *    Copyright 2016 Fineo, Inc.
 *
 *    Licensed under the Apache License, Version 2.0 (the "License");
 *    you may not use this file except in compliance with the License.
 *    You may obtain a copy of the License at
 *
 *        http://www.apache.org/licenses/LICENSE-2.0
 *
 *    Unless required by applicable law or agreed to in writing, software
 *    distributed under the License is distributed on an "AS IS" BASIS,
 *    WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *    See the License for the specific language governing permissions and
 *    limitations under the License.
 */

package io.fineo.dynamo.config;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClientBuilder;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class TestDynamoConnectionConfig {

  @Test
  public void testLoadJson() throws Exception {
    String json = "{"
                  + "\"aws\": {\"regionOrUrl\": \"http://localhost:8000\"},"
                  + "\"credentials\": {\"type\": \"static\", \"static\": {\"key\": \"k\", "
                  + "\"secret\": \"s\"}},"
                  + "\"client\": {\"maxErrorRetry\": 3, \"socketTimeout\": 500},"
                  + "\"table-prefix\": \"dev_\","
                  + "\"consistent-read\": false"
                  + "}";
    DynamoConnectionConfig config = load(json);
    assertEquals(new DynamoEndpoint("http://localhost:8000"), config.getEndpoint());
    assertTrue(config.getEndpoint().isUrl());
    assertEquals("dev_", config.getTablePrefix());
    assertFalse(config.isConsistentRead());
    assertEquals(3, config.getClient().getConfiguration().getMaxErrorRetry());
    assertEquals(500, config.getClient().getConfiguration().getSocketTimeout());

    AWSCredentials credentials = config.inflateCredentials().getCredentials();
    assertEquals("k", credentials.getAWSAccessKeyId());
    assertEquals("s", credentials.getAWSSecretKey());
    // only built once
    assertSame(config.inflateCredentials(), config.inflateCredentials());
  }

  @Test
  public void testDefaults() throws Exception {
    DynamoConnectionConfig config = load("{}");
    assertEquals(new DynamoEndpoint(DynamoConnectionConfig.DEFAULT_REGION), config.getEndpoint());
    assertFalse(config.getEndpoint().isUrl());
    assertEquals("", config.getTablePrefix());
    assertTrue(config.isConsistentRead());
    assertNull(config.getCredentials());
    assertTrue(config.inflateCredentials() instanceof DefaultAWSCredentialsProviderChain);
  }

  @Test
  public void testFromEnv() throws Exception {
    Map<String, String> env = ImmutableMap.of(
      DynamoConnectionConfig.ENV_ACCESS_KEY, "key",
      DynamoConnectionConfig.ENV_SECRET_KEY, "secret",
      DynamoConnectionConfig.ENV_REGION, "eu-west-1",
      DynamoConnectionConfig.ENV_TABLE_PREFIX, "test_");
    DynamoConnectionConfig config = DynamoConnectionConfig.fromEnv(env);
    assertEquals(new DynamoEndpoint("eu-west-1"), config.getEndpoint());
    assertEquals("test_", config.getTablePrefix());
    assertTrue(config.isConsistentRead());
    assertEquals("key", config.inflateCredentials().getCredentials().getAWSAccessKeyId());
  }

  @Test
  public void testFromEmptyEnv() throws Exception {
    DynamoConnectionConfig config =
      DynamoConnectionConfig.fromEnv(Collections.<String, String>emptyMap());
    assertEquals(new DynamoEndpoint(DynamoConnectionConfig.DEFAULT_REGION), config.getEndpoint());
    assertNull(config.getCredentials());
    assertEquals("", config.getTablePrefix());
  }

  @Test
  public void testEndpointConfiguresTheBuilder() throws Exception {
    AmazonDynamoDBClientBuilder builder = AmazonDynamoDBClientBuilder.standard();
    new DynamoEndpoint("http://localhost:8000").configure(builder);
    assertEquals("http://localhost:8000", builder.getEndpoint().getServiceEndpoint());
    assertEquals(DynamoEndpoint.DEFAULT_SIGNING_REGION, builder.getEndpoint().getSigningRegion());
    assertNull(builder.getRegion());

    builder = AmazonDynamoDBClientBuilder.standard();
    new DynamoEndpoint("us-west-2").configure(builder);
    assertEquals("us-west-2", builder.getRegion());
    assertNull(builder.getEndpoint());
  }

  private static DynamoConnectionConfig load(String json) throws Exception {
    try (InputStream in = new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8))) {
      return DynamoConnectionConfig.load(in);
    }
  }
}
