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
 * Raised when an <tt>IN</tt> comparison is rendered as a key condition. Dynamo's key condition
 * grammar has no <tt>IN</tt>, so the read has to be turned into a batch get or a scan instead.
 */
public class MultipleKeyLookupException extends ExpressionException {

  public MultipleKeyLookupException(String message, Object expression) {
    super(message, expression);
  }
}
