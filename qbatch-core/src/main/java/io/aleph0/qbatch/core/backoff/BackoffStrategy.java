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
package io.aleph0.qbatch.core.backoff;

import java.time.Duration;

/**
 * Decides how long the listener waits between polling cycles. Implementations are stateful and are
 * only ever called from the listener's polling thread.
 */
@FunctionalInterface
public interface BackoffStrategy {
  /**
   * Returns the delay before the next cycle.
   *
   * @param success {@code true} if the cycle that just ended processed a non-empty batch
   *        successfully, {@code false} if it was empty or failed
   * @return the non-negative delay before the next cycle
   */
  public Duration nextDelay(boolean success);
}
