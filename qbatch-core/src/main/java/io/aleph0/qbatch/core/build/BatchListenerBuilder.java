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
package io.aleph0.qbatch.core.build;

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import io.aleph0.qbatch.core.BatchFunction;
import io.aleph0.qbatch.core.QueueClient;
import io.aleph0.qbatch.core.backoff.BackoffStrategy;
import io.aleph0.qbatch.core.listener.BatchListener;
import io.aleph0.qbatch.core.listener.BatchListenerConfig;

/**
 * Assembles a {@link BatchListener}. The queue client and the function are required. Everything
 * else defaults to the values in {@link BatchListenerConfig#defaultConfig()}.
 *
 * <pre>
 * BatchListener listener = new BatchListenerBuilder().setQueueClient(client)
 *     .setFunction(batch -&gt; {
 *       batch.markAllAsProcessed();
 *       return true;
 *     }).setQueueName("orders").setParallelism(8).build();
 * listener.start();
 * </pre>
 */
public final class BatchListenerBuilder {
  QueueClient queueClient;
  BatchFunction function;
  String queueName = BatchListenerConfig.DEFAULT_QUEUE_NAME;
  int parallelism = BatchListenerConfig.DEFAULT_PARALLELISM;
  Duration maxBackoff = BatchListenerConfig.DEFAULT_MAX_BACKOFF;
  int maxRetries = BatchListenerConfig.DEFAULT_MAX_RETRIES;
  Duration retryVisibilityTimeout = BatchListenerConfig.DEFAULT_RETRY_VISIBILITY_TIMEOUT;
  boolean runOnEmptyBatch = false;
  ExecutorService executor;
  BackoffStrategy backoffStrategy;
  final List<BatchListener.LifecycleListener> lifecycleListeners = new ArrayList<>();

  public BatchListenerBuilder setQueueClient(QueueClient queueClient) {
    this.queueClient = requireNonNull(queueClient);
    return this;
  }

  public BatchListenerBuilder setFunction(BatchFunction function) {
    this.function = requireNonNull(function);
    return this;
  }

  public BatchListenerBuilder setQueueName(String queueName) {
    this.queueName = requireNonNull(queueName);
    return this;
  }

  public BatchListenerBuilder setParallelism(int parallelism) {
    if (parallelism <= 0)
      throw new IllegalArgumentException("parallelism must be positive");
    this.parallelism = parallelism;
    return this;
  }

  public BatchListenerBuilder setMaxBackoff(Duration maxBackoff) {
    requireNonNull(maxBackoff);
    if (maxBackoff.compareTo(BatchListenerConfig.MIN_BACKOFF) < 0)
      throw new IllegalArgumentException(
          "maxBackoff must be at least " + BatchListenerConfig.MIN_BACKOFF);
    this.maxBackoff = maxBackoff;
    return this;
  }

  public BatchListenerBuilder setMaxRetries(int maxRetries) {
    if (maxRetries <= 0)
      throw new IllegalArgumentException("maxRetries must be positive");
    this.maxRetries = maxRetries;
    return this;
  }

  public BatchListenerBuilder setRetryVisibilityTimeout(Duration retryVisibilityTimeout) {
    requireNonNull(retryVisibilityTimeout);
    if (retryVisibilityTimeout.isNegative())
      throw new IllegalArgumentException("retryVisibilityTimeout must not be negative");
    this.retryVisibilityTimeout = retryVisibilityTimeout;
    return this;
  }

  public BatchListenerBuilder setRunOnEmptyBatch(boolean runOnEmptyBatch) {
    this.runOnEmptyBatch = runOnEmptyBatch;
    return this;
  }

  /**
   * Runs retrievals and completions on the given executor instead of the listener's own threads.
   * The listener does not shut down an executor provided here.
   */
  public BatchListenerBuilder setExecutor(ExecutorService executor) {
    this.executor = requireNonNull(executor);
    return this;
  }

  public BatchListenerBuilder setBackoffStrategy(BackoffStrategy backoffStrategy) {
    this.backoffStrategy = requireNonNull(backoffStrategy);
    return this;
  }

  public BatchListenerBuilder addLifecycleListener(BatchListener.LifecycleListener listener) {
    lifecycleListeners.add(requireNonNull(listener));
    return this;
  }

  /**
   * Copies every setting from the given config.
   */
  public BatchListenerBuilder setConfig(BatchListenerConfig config) {
    requireNonNull(config);
    this.queueName = config.queueName();
    this.parallelism = config.parallelism();
    this.maxBackoff = config.maxBackoff();
    this.maxRetries = config.maxRetries();
    this.retryVisibilityTimeout = config.retryVisibilityTimeout();
    this.runOnEmptyBatch = config.runOnEmptyBatch();
    return this;
  }

  public BatchListenerConfig buildConfig() {
    return new BatchListenerConfig(queueName, parallelism, maxBackoff, maxRetries,
        retryVisibilityTimeout, runOnEmptyBatch);
  }

  /**
   * @throws IllegalStateException if the queue client or the function has not been set
   */
  public BatchListener build() {
    if (queueClient == null)
      throw new IllegalStateException("queueClient not set");
    if (function == null)
      throw new IllegalStateException("function not set");

    final BatchListenerConfig config = buildConfig();

    final BatchListener result;
    if (executor == null && backoffStrategy == null) {
      result = new BatchListener(queueClient, function, config);
    } else if (executor == null) {
      result = new BatchListener(queueClient, function, config, backoffStrategy);
    } else {
      final BackoffStrategy backoff =
          backoffStrategy != null ? backoffStrategy : BatchListener.defaultBackoffStrategy(config);
      result = new BatchListener(queueClient, function, config, backoff, executor);
    }

    for (BatchListener.LifecycleListener listener : lifecycleListeners)
      result.addLifecycleListener(listener);

    return result;
  }
}
