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

package io.fineo.dynamo.mapper.exception;

/**
 * A condition or update expression is structurally invalid: wrong number of operands, a key
 * attribute referenced twice, a range key used without its hash key, a non-equality check where
 * equality is required, and so on.
 */
public class ExpressionException extends DynamoMapperException {

  public ExpressionException(String message, Object expression) {
    super("Invalid expression " + expression + ". " + message);
  }

  public ExpressionException(String message) {
    super(message);
  }
}
