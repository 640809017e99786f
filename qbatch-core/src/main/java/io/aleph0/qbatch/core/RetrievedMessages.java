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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.util.ArrayList;
import java.util.List;

/**
 * The result of one {@link QueueClient#getMessages(java.time.Duration) retrieval}. Holds the
 * retrieved messages and any lane-local resources the queue client used to fetch them.
 *
 * <p>
 * The {@link io.aleph0.qbatch.core.listener.BatchListener listener} {@link #close() closes} every
 * result exactly once per cycle, as soon as its messages have been merged into the batch,
 * regardless of whether the messages are later deleted or retried and regardless of whether the
 * cycle fails.
 */
public interface RetrievedMessages extends AutoCloseable {
  /**
   * Returns a result with the given messages and nothing to release.
   */
  public static RetrievedMessages of(List<? extends Message> messages) {
    final List<Message> copy = unmodifiableList(new ArrayList<>(requireNonNull(messages)));
    return new RetrievedMessages() {
      @Override
      public List<Message> messages() {
        return copy;
      }

      @Override
      public void close() {}
    };
  }

  /**
   * The retrieved messages, in retrieval order. May be empty, never null.
   */
  public List<Message> messages();

  /**
   * Releases lane-local resources. Must not throw for normal resource cleanup.
   */
  @Override
  public void close();
}
