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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import io.aleph0.qbatch.core.BatchCompletionException;
import io.aleph0.qbatch.core.InvalidMessageException;
import io.aleph0.qbatch.core.Message;
import io.aleph0.qbatch.core.MessageBatch;
import io.aleph0.qbatch.core.QueueClient;

/**
 * The {@link MessageBatch} the listener hands to the user's function, plus the two ways to resolve
 * it afterwards: {@link #complete(QueueClient, ExecutorService, int, Duration) complete} when the
 * function succeeded and {@link #retryAll(QueueClient, ExecutorService, int, Duration) retryAll}
 * when it failed.
 *
 * <p>
 * Messages are tracked by identity, so the function must pass back the same instances it received
 * from {@link #messages()}.
 */
public class DefaultMessageBatch implements MessageBatch {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultMessageBatch.class);

  /**
   * Messages skipped by a successful function were not failed, so they go back at the first retry
   * and never count toward the poison ceiling.
   */
  private static final int SKIPPED_ATTEMPT = 1;

  private static record QueueOperation(Message message, boolean delete, int attempt) {
  }

  private final List<Message> messages;
  private final Set<Message> members = Collections.newSetFromMap(new IdentityHashMap<>());
  private final Set<Message> processed = Collections.newSetFromMap(new IdentityHashMap<>());

  public DefaultMessageBatch(List<? extends Message> messages) {
    this.messages = unmodifiableList(new ArrayList<>(requireNonNull(messages, "messages")));
    for (Message message : this.messages)
      members.add(requireNonNull(message, "message"));
  }

  @Override
  public List<Message> messages() {
    return messages;
  }

  @Override
  public void markAsProcessed(Message message) {
    checkMember(message);
    processed.add(message);
  }

  @Override
  public void markAllAsProcessed() {
    processed.addAll(messages);
  }

  @Override
  public boolean isProcessed(Message message) {
    checkMember(message);
    return processed.contains(message);
  }

  /**
   * Deletes every message marked as processed and retries every other message. Used when the
   * function reported success.
   *
   * @throws BatchCompletionException if any delete or retry failed. All other operations were still
   *         attempted.
   * @throws InterruptedException if interrupted while waiting for the operations to finish
   */
  public CompletionSummary complete(QueueClient client, ExecutorService executor, int maxRetries,
      Duration visibilityTimeout) throws BatchCompletionException, InterruptedException {
    final List<QueueOperation> operations = new ArrayList<>(messages.size());
    for (Message message : messages) {
      if (processed.contains(message))
        operations.add(new QueueOperation(message, true, 0));
      else
        operations.add(new QueueOperation(message, false, SKIPPED_ATTEMPT));
    }
    return perform(client, executor, maxRetries, visibilityTimeout, operations);
  }

  /**
   * Retries every message in the batch, whether marked or not. Used when the function reported
   * failure. Each message is retried at its own delivery attempt so that the queue can route
   * repeatedly failing messages to its poison destination.
   *
   * @throws BatchCompletionException if any retry failed. All other retries were still attempted.
   * @throws InterruptedException if interrupted while waiting for the retries to finish
   */
  public CompletionSummary retryAll(QueueClient client, ExecutorService executor, int maxRetries,
      Duration visibilityTimeout) throws BatchCompletionException, InterruptedException {
    final List<QueueOperation> operations = new ArrayList<>(messages.size());
    for (Message message : messages)
      operations.add(new QueueOperation(message, false, Math.max(message.deliveryAttempt(), 1)));
    return perform(client, executor, maxRetries, visibilityTimeout, operations);
  }

  private CompletionSummary perform(QueueClient client, ExecutorService executor, int maxRetries,
      Duration visibilityTimeout, List<QueueOperation> operations)
      throws BatchCompletionException, InterruptedException {
    requireNonNull(client, "client");
    requireNonNull(executor, "executor");
    requireNonNull(visibilityTimeout, "visibilityTimeout");

    final List<Future<Void>> futures = new ArrayList<>(operations.size());
    for (QueueOperation operation : operations)
      futures.add(executor.submit(newTask(client, maxRetries, visibilityTimeout, operation)));

    int deleted = 0;
    int retried = 0;
    final List<String> failedMessageIds = new ArrayList<>();
    final List<Throwable> failures = new ArrayList<>();
    try {
      for (int i = 0; i < futures.size(); i++) {
        final QueueOperation operation = operations.get(i);
        try {
          futures.get(i).get();
          if (operation.delete())
            deleted = deleted + 1;
          else
            retried = retried + 1;
        } catch (ExecutionException e) {
          final Throwable cause = e.getCause();
          if (cause instanceof Error x)
            throw x;
          LOGGER.atWarn().addKeyValue("message", operation.message().id())
              .addKeyValue("operation", operation.delete() ? "delete" : "retry").setCause(cause)
              .log("Failed to complete message. Continuing with the rest of the batch...");
          failedMessageIds.add(operation.message().id());
          failures.add(cause);
        }
      }
    } catch (InterruptedException e) {
      for (Future<Void> future : futures)
        future.cancel(true);
      Thread.currentThread().interrupt();
      throw new InterruptedException();
    }

    if (!failures.isEmpty())
      throw new BatchCompletionException(failedMessageIds, failures);

    return new CompletionSummary(deleted, retried);
  }

  private static Callable<Void> newTask(QueueClient client, int maxRetries,
      Duration visibilityTimeout, QueueOperation operation) {
    return () -> {
      if (operation.delete())
        client.delete(operation.message());
      else
        client.retry(operation.message(), operation.attempt(), maxRetries, visibilityTimeout);
      return null;
    };
  }

  private void checkMember(Message message) {
    requireNonNull(message, "message");
    if (!members.contains(message))
      throw new InvalidMessageException(message.id());
  }

  @Override
  public String toString() {
    return "DefaultMessageBatch [size=" + messages.size() + ", processed=" + processed.size() + "]";
  }
}
