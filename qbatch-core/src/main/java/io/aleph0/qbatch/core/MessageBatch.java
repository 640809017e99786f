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

import java.util.List;

/**
 * The messages retrieved in one polling cycle, as seen by a {@link BatchFunction}.
 *
 * <p>
 * The function marks the messages it handled. What happens next depends on the function's verdict.
 * On success, every marked message is deleted and every unmarked message is retried. On failure,
 * every message is retried, marked or not. So a message the function never marks is never lost.
 *
 * <p>
 * Batches are not thread-safe. A function that fans out work should mark messages from the thread
 * that invoked it, or synchronize externally.
 */
public interface MessageBatch {
  /**
   * The messages in this batch, ordered by retrieval lane and then by retrieval order within the
   * lane. The list is unmodifiable and does not change for the lifetime of the batch.
   */
  public List<Message> messages();

  /**
   * Marks the given message as handled. Marking a message twice has no further effect.
   *
   * @param message a message returned by {@link #messages()}
   * @throws InvalidMessageException if the message does not belong to this batch
   */
  public void markAsProcessed(Message message);

  /**
   * Marks every message in this batch as handled.
   */
  public void markAllAsProcessed();

  /**
   * Returns {@code true} if the given message has been marked as handled.
   *
   * @throws InvalidMessageException if the message does not belong to this batch
   */
  public boolean isProcessed(Message message);

  default int size() {
    return messages().size();
  }

  default boolean isEmpty() {
    return messages().isEmpty();
  }
}
