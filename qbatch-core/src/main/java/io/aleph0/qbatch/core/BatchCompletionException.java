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
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Thrown when one or more deletes or retries failed while completing a batch. The individual
 * failures are attached as {@link #getSuppressed() suppressed} exceptions, and the IDs of the
 * affected messages are available from {@link #getFailedMessageIds()}. Every other message in the
 * batch was still attempted.
 */
public class BatchCompletionException extends IOException {
  private static final long serialVersionUID = -2203716418253395107L;

  private final List<String> failedMessageIds;

  public BatchCompletionException(List<String> failedMessageIds, List<Throwable> failures) {
    super(failures.size() + " of the batch's queue operations failed");
    this.failedMessageIds = unmodifiableList(new ArrayList<>(failedMessageIds));
    for (Throwable failure : failures)
      addSuppressed(failure);
  }

  public List<String> getFailedMessageIds() {
    return failedMessageIds;
  }
}
