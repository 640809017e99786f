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
 * The user's processing logic. Called by the listener once per non-empty cycle, and once per empty
 * cycle if the listener is configured to run on empty batches.
 */
@FunctionalInterface
public interface BatchFunction {
  /**
   * Processes the given batch.
   *
   * <p>
   * Returning {@code true} means the batch succeeded overall: marked messages are deleted and
   * unmarked messages are retried. Returning {@code false} or throwing means the batch failed: all
   * messages are retried. Exceptions do not stop the listener.
   *
   * @param batch the batch to process
   * @return the verdict
   * @throws Exception if processing failed
   */
  public boolean process(MessageBatch batch) throws Exception;
}
