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
package io.aleph0.qbatch.core.batch;

/**
 * What completing a batch did.
 */
public record CompletionSummary(
    /**
     * The number of messages deleted
     */
    int deleted,

    /**
     * The number of messages returned to the queue for retry
     */
    int retried) {
  public CompletionSummary {
    if (deleted < 0)
      throw new IllegalArgumentException("deleted must not be negative");
    if (retried < 0)
      throw new IllegalArgumentException("retried must not be negative");
  }
}
