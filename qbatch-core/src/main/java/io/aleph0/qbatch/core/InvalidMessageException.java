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

/**
 * Thrown when a {@link BatchFunction} refers to a message that does not belong to the batch it was
 * given. This is always a bug in the function.
 */
public class InvalidMessageException extends IllegalArgumentException {
  private static final long serialVersionUID = 4158726730612391845L;

  private final String messageId;

  public InvalidMessageException(String messageId) {
    super("message does not belong to batch: " + messageId);
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}
