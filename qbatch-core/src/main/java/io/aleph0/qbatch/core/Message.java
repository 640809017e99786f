/*-
 * =================================LICENSE_START==================================
 * qbatch-core
 * ====================================SECTION=====================================
 * Copyright (C) 2025 aleph0
 * ====================================SECTION=====================================
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * ==================================LICENSE_END===================================
 */
package io.aleph0.qbatch.core;

import java.util.Map;

/**
 * A message retrieved from a queue by a {@link QueueClient}. Messages are immutable values. The
 * core never interprets the body; it only uses the message as a handle to pass back to the queue
 * client when deleting or retrying.
 */
public interface Message {
  /**
   * The message ID. Queue clients use this to address the message when deleting or retrying it.
   * Re-delivery of the same message may or may not result in the same ID, depending on the queue.
   */
  public String id();

  /**
   * Optional key-value metadata associated with the message.
   */
  public Map<String, String> attributes();

  /**
   * The content of the message. Implementations return a copy, so callers are free to modify it.
   */
  public byte[] body();

  /**
   * How many times the queue has delivered this message, including this delivery, or {@code 0} if
   * the queue does not track deliveries.
   */
  public int deliveryAttempt();
}
