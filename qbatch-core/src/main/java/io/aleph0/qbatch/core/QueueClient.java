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

import java.io.IOException;
import java.time.Duration;

/**
 * The queue operations the batch listener needs. Implementations wrap a concrete queue transport.
 *
 * <p>
 * All methods must be safe to call concurrently. The listener issues several
 * {@link #getMessages(Duration) retrievals} at once, and deletes or retries the messages of a batch
 * in parallel.
 *
 * <p>
 * Cancellation is signalled by interrupting the calling thread. Implementations should respond to
 * interruption promptly by throwing {@link InterruptedException} rather than blocking
 * indefinitely. The listener interrupts in-flight retrievals when it is stopped, but never
 * interrupts deletes or retries.
 *
 * <p>
 * If any retrieval in a cycle fails, or the listener is stopped while retrieving, the messages
 * the other retrievals returned are released but neither deleted nor retried. They become visible
 * again only when the visibility timeout passed to {@link #getMessages(Duration)} expires, which
 * for the listener is {@code BatchListenerConfig.RETRIEVAL_VISIBILITY_TIMEOUT}.
 */
public interface QueueClient {
  /**
   * Retrieves zero or more messages, hiding them from other consumers for the given visibility
   * timeout.
   *
   * @param visibilityTimeout how long the retrieved messages stay leased to this consumer
   * @return the retrieved messages, which the caller must {@link RetrievedMessages#close() close}
   * @throws IOException if the queue could not be read
   * @throws InterruptedException if the calling thread was interrupted
   */
  public RetrievedMessages getMessages(Duration visibilityTimeout)
      throws IOException, InterruptedException;

  /**
   * Permanently removes a successfully processed message from the queue.
   *
   * @param message the message to remove
   * @throws IOException if the message could not be removed
   * @throws InterruptedException if the calling thread was interrupted
   */
  public void delete(Message message) throws IOException, InterruptedException;

  /**
   * Returns a message to the queue for redelivery after the given visibility timeout. If
   * {@code attempt} has reached {@code maxRetries}, the implementation may instead route the
   * message to a poison or dead-letter destination. That policy belongs to the implementation.
   *
   * @param message the message to retry
   * @param attempt which retry this is, starting at 1
   * @param maxRetries the retry ceiling configured on the listener
   * @param visibilityTimeout how long to wait before the message becomes visible again
   * @throws IOException if the message could not be returned to the queue
   * @throws InterruptedException if the calling thread was interrupted
   */
  public void retry(Message message, int attempt, int maxRetries, Duration visibilityTimeout)
      throws IOException, InterruptedException;
}
