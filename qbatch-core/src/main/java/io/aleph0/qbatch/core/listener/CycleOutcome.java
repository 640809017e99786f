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
package io.aleph0.qbatch.core.listener;

/**
 * How a polling cycle ended. Only {@link #PROCESSED} counts as a productive cycle for backoff.
 */
public enum CycleOutcome {
  /**
   * The function accepted a non-empty batch and the batch was completed.
   */
  PROCESSED(true),

  /**
   * The function rejected a non-empty batch, either by returning {@code false} or by throwing, and
   * every message was retried.
   */
  REJECTED(false),

  /**
   * No messages were retrieved.
   */
  EMPTY(false),

  /**
   * Retrieval or completion failed.
   */
  FAILED(false);

  private final boolean productive;

  private CycleOutcome(boolean productive) {
    this.productive = productive;
  }

  public boolean isProductive() {
    return productive;
  }
}
