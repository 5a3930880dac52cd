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

import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClientBuilder;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonTypeName;

/**
 * Where to find dynamo: either an AWS region name (e.g. <tt>us-east-1</tt>) or a full url (e.g.
 * <tt>http://localhost:8000</tt>) for a local instance.
 */
@JsonTypeName(DynamoEndpoint.NAME)
public class DynamoEndpoint {

  public static final String NAME = "aws";
  // signing region used when we are pointed at a url rather than a region
  static final String DEFAULT_SIGNING_REGION = "us-east-1";

  private final String regionOrUrl;

  @JsonCreator
  public DynamoEndpoint(@JsonProperty("regionOrUrl") String regionOrUrl) {
    this.regionOrUrl = regionOrUrl;
  }

  @JsonIgnore
  public void configure(AmazonDynamoDBClientBuilder builder) {
    // set the region or the url, depending on the format
    if (isUrl()) {
      builder.withEndpointConfiguration(
        new AwsClientBuilder.EndpointConfiguration(regionOrUrl, DEFAULT_SIGNING_REGION));
    } else {
      builder.withRegion(regionOrUrl);
    }
  }

  @JsonIgnore
  public boolean isUrl() {
    return regionOrUrl.contains(":");
  }

  @JsonProperty("regionOrUrl")
  public String getRegionOrUrl() {
    return regionOrUrl;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o)
      return true;
    if (!(o instanceof DynamoEndpoint))
      return false;

    DynamoEndpoint that = (DynamoEndpoint) o;
    return regionOrUrl != null ? regionOrUrl.equals(that.regionOrUrl) : that.regionOrUrl == null;
  }

  @Override
  public int hashCode() {
    return regionOrUrl != null ? regionOrUrl.hashCode() : 0;
  }

  @Override
  public String toString() {
    return "DynamoEndpoint{" + regionOrUrl + '}';
  }
}
