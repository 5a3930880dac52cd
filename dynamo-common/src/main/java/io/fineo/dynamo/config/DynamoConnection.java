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

import com.amazonaws.services.dynamodbv2.AmazonDynamoDB;
import com.amazonaws.services.dynamodbv2.AmazonDynamoDBClientBuilder;
import io.fineo.dynamo.transport.AmazonDynamoTransport;
import io.fineo.dynamo.transport.DynamoTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Function;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Shared handle on dynamo. The client (and the transport wrapping it) is only created the first
 * time it is needed and then reused by every caller; it is safe to share across threads.
 */
public class DynamoConnection {

  private static final Logger LOG = LoggerFactory.getLogger(DynamoConnection.class);

  private final DynamoConnectionConfig config;
  private final Function<DynamoConnectionConfig, AmazonDynamoDB> clientFactory;
  private volatile DynamoTransport transport;
  private AmazonDynamoDB client;

  public DynamoConnection(DynamoConnectionConfig config) {
    this(config, DynamoConnection::createClient);
  }

  public DynamoConnection(DynamoConnectionConfig config,
    Function<DynamoConnectionConfig, AmazonDynamoDB> clientFactory) {
    this.config = checkNotNull(config, "config");
    this.clientFactory = clientFactory;
  }

  public static DynamoConnection fromEnv() {
    return new DynamoConnection(DynamoConnectionConfig.fromEnv());
  }

  public DynamoTransport transport() {
    DynamoTransport current = transport;
    if (current == null) {
      synchronized (this) {
        current = transport;
        if (current == null) {
          this.client = clientFactory.apply(config);
          current = new AmazonDynamoTransport(client);
          transport = current;
        }
      }
    }
    return current;
  }

  public String prefixedTableName(String name) {
    return config.getTablePrefix() + name;
  }

  public boolean isConsistentRead() {
    return config.isConsistentRead();
  }

  public DynamoConnectionConfig getConfig() {
    return config;
  }

  public synchronized void close() {
    if (client != null) {
      client.shutdown();
      client = null;
      transport = null;
    }
  }

  private static AmazonDynamoDB createClient(DynamoConnectionConfig config) {
    LOG.info("Creating dynamo client for {}", config.getEndpoint());
    AmazonDynamoDBClientBuilder builder = AmazonDynamoDBClientBuilder.standard()
      .withCredentials(config.inflateCredentials())
      .withClientConfiguration(config.getClient().getConfiguration());
    config.getEndpoint().configure(builder);
    return builder.build();
  }
}
