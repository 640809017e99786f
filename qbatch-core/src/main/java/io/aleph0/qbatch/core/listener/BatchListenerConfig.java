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

import static java.util.Objects.requireNonNull;
import java.time.Duration;

/**
 * Settings for a {@link BatchListener}.
 *
 * @param queueName a human-readable name for the queue, used in thread names and log output
 * @param parallelism how many retrievals to issue per cycle
 * @param maxBackoff the longest the listener waits between cycles
 * @param maxRetries the retry ceiling passed to the queue client for poison handling
 * @param retryVisibilityTimeout how long retried messages stay hidden before redelivery
 * @param runOnEmptyBatch whether to call the function when a cycle retrieves nothing
 */
public record BatchListenerConfig(
    String queueName,
    int parallelism,
    Duration maxBackoff,
    int maxRetries,
    Duration retryVisibilityTimeout,
    boolean runOnEmptyBatch) {

  /**
   * The shortest delay between cycles, and the delay after every productive cycle.
   */
  public static final Duration MIN_BACKOFF = Duration.ofMillis(100);

  /**
   * How long messages are leased when retrieved. Long enough that processing finishes before the
   * messages become visible to other consumers.
   */
  public static final Duration RETRIEVAL_VISIBILITY_TIMEOUT = Duration.ofMinutes(10);

  public static final String DEFAULT_QUEUE_NAME = "queue";

  public static final int DEFAULT_PARALLELISM = 4;

  public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofMinutes(1);

  public static final int DEFAULT_MAX_RETRIES = 5;

  public static final Duration DEFAULT_RETRY_VISIBILITY_TIMEOUT = Duration.ofSeconds(1);

  public static BatchListenerConfig defaultConfig() {
    return new BatchListenerConfig(DEFAULT_QUEUE_NAME, DEFAULT_PARALLELISM, DEFAULT_MAX_BACKOFF,
        DEFAULT_MAX_RETRIES, DEFAULT_RETRY_VISIBILITY_TIMEOUT, false);
  }

  public BatchListenerConfig {
    requireNonNull(queueName, "queueName");
    requireNonNull(maxBackoff, "maxBackoff");
    requireNonNull(retryVisibilityTimeout, "retryVisibilityTimeout");
    if (queueName.isBlank())
      throw new IllegalArgumentException("queueName must not be blank");
    if (parallelism <= 0)
      throw new IllegalArgumentException("parallelism must be positive");
    if (maxBackoff.compareTo(MIN_BACKOFF) < 0)
      throw new IllegalArgumentException("maxBackoff must be at least " + MIN_BACKOFF);
    if (maxRetries <= 0)
      throw new IllegalArgumentException("maxRetries must be positive");
    if (retryVisibilityTimeout.isNegative())
      throw new IllegalArgumentException("retryVisibilityTimeout must not be negative");
  }
}
