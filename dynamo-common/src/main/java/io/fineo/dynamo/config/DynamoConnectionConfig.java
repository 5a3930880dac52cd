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

import com.amazonaws.auth.AWSCredentialsProvider;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Strings;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Everything needed to connect to dynamo. Usually read from json:
 * <pre>
 * {
 *   "aws": {"regionOrUrl": "us-east-1"},
 *   "credentials": {"type": "static", "static": {"key": "...", "secret": "..."}},
 *   "client": {"maxErrorRetry": 3},
 *   "table-prefix": "dev_",
 *   "consistent-read": true
 * }
 * </pre>
 */
public class DynamoConnectionConfig {

  static final String DEFAULT_REGION = "us-east-2";
  static final String ENV_ACCESS_KEY = "AWS_ACCESS_KEY_ID";
  static final String ENV_SECRET_KEY = "AWS_SECRET_ACCESS_KEY";
  static final String ENV_REGION = "AWS_REGION_NAME";
  static final String ENV_TABLE_PREFIX = "AWS_TABLE_PREFIX";

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private AWSCredentialsProvider inflatedCredentials;
  private final DynamoEndpoint endpoint;
  private final ClientProperties client;
  private final Map<String, Object> credentials;
  private final String tablePrefix;
  // consistent is easier for users to reason about, so default to that. Dynamo units are also
  // calculated based on consistent reads (2x inconsistent reads)
  private final boolean consistentRead;

  @JsonCreator
  public DynamoConnectionConfig(
    @JsonProperty("credentials") Map<String, Object> credentials,
    @JsonProperty(DynamoEndpoint.NAME) DynamoEndpoint endpoint,
    @JsonProperty(ClientProperties.NAME) ClientProperties client,
    @JsonProperty("table-prefix") String tablePrefix,
    @JsonProperty("consistent-read") Boolean consistentRead) {
    this.credentials = credentials;
    this.endpoint = endpoint == null ? new DynamoEndpoint(DEFAULT_REGION) : endpoint;
    this.client = client == null ? new ClientProperties() : client;
    this.tablePrefix = Strings.nullToEmpty(tablePrefix);
    this.consistentRead = consistentRead == null || consistentRead;
  }

  public static DynamoConnectionConfig load(InputStream in) throws IOException {
    return MAPPER.readValue(in, DynamoConnectionConfig.class);
  }

  public static DynamoConnectionConfig fromEnv() {
    return fromEnv(System.getenv());
  }

  @VisibleForTesting
  static DynamoConnectionConfig fromEnv(Map<String, String> env) {
    Map<String, Object> credentials = null;
    String key = env.get(ENV_ACCESS_KEY);
    String secret = env.get(ENV_SECRET_KEY);
    if (!Strings.isNullOrEmpty(key) && !Strings.isNullOrEmpty(secret)) {
      credentials = new StaticCredentialsConfig(key, secret).asCredentials();
    }
    String region = env.get(ENV_REGION);
    DynamoEndpoint endpoint =
      new DynamoEndpoint(Strings.isNullOrEmpty(region) ? DEFAULT_REGION : region);
    return new DynamoConnectionConfig(credentials, endpoint, null, env.get(ENV_TABLE_PREFIX),
      null);
  }

  @JsonIgnore
  public AWSCredentialsProvider inflateCredentials() {
    if (this.inflatedCredentials == null) {
      this.inflatedCredentials = CredentialsUtil.getProvider(credentials);
    }
    return inflatedCredentials;
  }

  @JsonProperty("credentials")
  public Map<String, Object> getCredentials() {
    return credentials;
  }

  @JsonProperty(DynamoEndpoint.NAME)
  public DynamoEndpoint getEndpoint() {
    return endpoint;
  }

  @JsonProperty(ClientProperties.NAME)
  public ClientProperties getClient() {
    return client;
  }

  @JsonProperty("table-prefix")
  public String getTablePrefix() {
    return tablePrefix;
  }

  @JsonProperty("consistent-read")
  public boolean isConsistentRead() {
    return consistentRead;
  }

  @Override
  public String toString() {
    return "DynamoConnectionConfig{" +
           "endpoint=" + endpoint +
           ", tablePrefix='" + tablePrefix + '\'' +
           ", consistentRead=" + consistentRead +
           '}';
  }
}
