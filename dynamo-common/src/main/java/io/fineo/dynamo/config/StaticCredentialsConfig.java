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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

import java.util.HashMap;
import java.util.Map;

/**
 * Fixed access key/secret pair. Mostly useful for local instances, which need <i>some</i>
 * credentials but don't care what they are.
 */
@JsonTypeName(StaticCredentialsConfig.NAME)
public class StaticCredentialsConfig {
  public static final String NAME = "static";

  private final String key;
  private final String secret;

  @JsonCreator
  public StaticCredentialsConfig(@JsonProperty("key") String key,
    @JsonProperty("secret") String secret) {
    this.key = key;
    this.secret = secret;
  }

  public String getKey() {
    return key;
  }

  public String getSecret() {
    return secret;
  }

  /**
   * @return the credentials as the generic map {@link CredentialsUtil} understands
   */
  @JsonIgnore
  public Map<String, Object> asCredentials() {
    Map<String, Object> pair = new HashMap<>();
    pair.put("key", key);
    pair.put("secret", secret);

    Map<String, Object> credentials = new HashMap<>();
    credentials.put(CredentialsUtil.CREDENTIALS_TYPE_KEY, NAME);
    credentials.put(NAME, pair);
    return credentials;
  }
}
