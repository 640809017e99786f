/*-
 * =================================LICENSE_START==================================
 * qbatch-gcp
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
package io.aleph0.qbatch.gcp;

import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.api.core.ApiFuture;
import com.google.api.gax.rpc.ApiException;
import com.google.cloud.pubsub.v1.PublisherInterface;
import com.google.cloud.pubsub.v1.stub.SubscriberStub;
import com.google.cloud.pubsub.v1.stub.SubscriberStubSettings;
import com.google.pubsub.v1.AcknowledgeRequest;
import com.google.pubsub.v1.ModifyAckDeadlineRequest;
import com.google.pubsub.v1.PubsubMessage;
import com.google.pubsub.v1.PullRequest;
import com.google.pubsub.v1.PullResponse;
import com.google.pubsub.v1.ReceivedMessage;
import io.aleph0.qbatch.core.Measureable;
import io.aleph0.qbatch.core.Message;
import io.aleph0.qbatch.core.QueueClient;
import io.aleph0.qbatch.core.RetrievedMessages;
import io.aleph0.qbatch.core.message.DefaultMessage;

/**
 * A {@link QueueClient} over a Google Pubsub subscription using synchronous pull.
 *
 * <p>
 * Each {@link #getMessages(Duration) retrieval} is one {@code Pull} call. Pulled messages then have
 * their ack deadline extended to the requested visibility timeout, capped at Pubsub's maximum of
 * {@value #MAX_ACK_DEADLINE_SECONDS} seconds. {@link #delete(Message) Deleting} a message
 * acknowledges it, and {@link #retry(Message, int, int, Duration) retrying} a message sets its ack
 * deadline to the retry visibility timeout so that Pubsub redelivers it afterwards.
 *
 * <p>
 * Pubsub only reports a message's {@link Message#deliveryAttempt() delivery attempt} when the
 * subscription has a dead-letter policy. Otherwise the attempt is 0. Subscriptions that need poison
 * handling should either configure a dead-letter policy on the subscription itself or give this
 * client a poison publisher. When a poison publisher is configured, a message retried at or beyond
 * the retry ceiling is published to the poison topic with the
 * {@value #POISON_ATTEMPT_ATTRIBUTE} attribute set to the attempt, and then acknowledged.
 *
 * <p>
 * The client owns the subscriber stub and closes it on {@link #close()}. The poison publisher
 * belongs to the caller.
 */
public class PubsubQueueClient implements QueueClient, Measureable<PubsubQueueClientMetrics>,
    AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(PubsubQueueClient.class);

  public static final String POISON_ATTEMPT_ATTRIBUTE = "qbatch-poison-attempt";

  public static final int MAX_ACK_DEADLINE_SECONDS = 600;

  public static final int DEFAULT_MAX_MESSAGES_PER_PULL = 100;

  /**
   * Creates a client for the given subscription, which must be in the form
   * {@code projects/<project>/subscriptions/<subscription>}.
   *
   * @param subscription the subscription to pull from
   * @param settings the settings used to create the subscriber stub
   * @param poisonPublisher where to publish messages that reach the retry ceiling, or {@code null}
   *        to leave them to the subscription's dead-letter policy
   * @throws IOException if the subscriber stub cannot be created
   */
  public static PubsubQueueClient create(String subscription, SubscriberStubSettings settings,
      PublisherInterface poisonPublisher) throws IOException {
    return new PubsubQueueClient(settings.createStub(), subscription,
        DEFAULT_MAX_MESSAGES_PER_PULL, poisonPublisher);
  }

  /**
   * A message pulled from Pubsub. Carries the ack ID needed to acknowledge it or modify its ack
   * deadline.
   */
  public static class PubsubQueueMessage extends DefaultMessage {
    private final String ackId;
    private final PubsubMessage original;

    public PubsubQueueMessage(ReceivedMessage received) {
      super(received.getMessage().getMessageId(), received.getMessage().getAttributesMap(),
          received.getMessage().getData().toByteArray(), received.getDeliveryAttempt());
      this.ackId = received.getAckId();
      this.original = received.getMessage();
    }

    public String getAckId() {
      return ackId;
    }

    /**
     * The message exactly as Pubsub delivered it.
     */
    public PubsubMessage getOriginal() {
      return original;
    }

    @Override
    public int hashCode() {
      return System.identityHashCode(this);
    }

    @Override
    public boolean equals(Object that) {
      return this == that;
    }
  }

  private final AtomicLong pulledMetric = new AtomicLong(0);
  private final AtomicLong acknowledgedMetric = new AtomicLong(0);
  private final AtomicLong deadlinesModifiedMetric = new AtomicLong(0);
  private final AtomicLong poisonedMetric = new AtomicLong(0);

  private final SubscriberStub stub;
  private final String subscription;
  private final int maxMessagesPerPull;
  private final PublisherInterface poisonPublisher;

  public PubsubQueueClient(SubscriberStub stub, String subscription, int maxMessagesPerPull,
      PublisherInterface poisonPublisher) {
    if (maxMessagesPerPull <= 0)
      throw new IllegalArgumentException("maxMessagesPerPull must be positive");
    this.stub = requireNonNull(stub, "stub");
    this.subscription = requireNonNull(subscription, "subscription");
    this.maxMessagesPerPull = maxMessagesPerPull;
    this.poisonPublisher = poisonPublisher;
  }

  @Override
  public RetrievedMessages getMessages(Duration visibilityTimeout)
      throws IOException, InterruptedException {
    requireNonNull(visibilityTimeout, "visibilityTimeout");

    final PullRequest request = PullRequest.newBuilder().setSubscription(subscription)
        .setMaxMessages(maxMessagesPerPull).build();

    final PullResponse response = await(stub.pullCallable().futureCall(request), "pull");

    final List<Message> messages = new ArrayList<>(response.getReceivedMessagesCount());
    final List<String> ackIds = new ArrayList<>(response.getReceivedMessagesCount());
    for (ReceivedMessage received : response.getReceivedMessagesList()) {
      messages.add(new PubsubQueueMessage(received));
      ackIds.add(received.getAckId());
    }

    pulledMetric.addAndGet(messages.size());

    if (!ackIds.isEmpty()) {
      final ModifyAckDeadlineRequest extend =
          ModifyAckDeadlineRequest.newBuilder().setSubscription(subscription).addAllAckIds(ackIds)
              .setAckDeadlineSeconds(ackDeadlineSeconds(visibilityTimeout)).build();
      await(stub.modifyAckDeadlineCallable().futureCall(extend), "modifyAckDeadline");
    }

    LOGGER.atDebug().addKeyValue("subscription", subscription)
        .addKeyValue("count", messages.size()).log("Pulled messages");

    return RetrievedMessages.of(messages);
  }

  @Override
  public void delete(Message message) throws IOException, InterruptedException {
    final PubsubQueueMessage m = checkMessage(message);
    acknowledge(m);
  }

  @Override
  public void retry(Message message, int attempt, int maxRetries, Duration visibilityTimeout)
      throws IOException, InterruptedException {
    requireNonNull(visibilityTimeout, "visibilityTimeout");
    final PubsubQueueMessage m = checkMessage(message);

    if (attempt >= maxRetries && poisonPublisher != null) {
      final PubsubMessage poison = m.getOriginal().toBuilder()
          .putAttributes(POISON_ATTEMPT_ATTRIBUTE, Integer.toString(attempt)).build();
      await(poisonPublisher.publish(poison), "publish");
      acknowledge(m);
      poisonedMetric.incrementAndGet();
      LOGGER.atWarn().addKeyValue("subscription", subscription).addKeyValue("message", m.id())
          .addKeyValue("attempt", attempt).log("Message moved to poison topic");
      return;
    }

    final ModifyAckDeadlineRequest request = ModifyAckDeadlineRequest.newBuilder()
        .setSubscription(subscription).addAckIds(m.getAckId())
        .setAckDeadlineSeconds(ackDeadlineSeconds(visibilityTimeout)).build();
    await(stub.modifyAckDeadlineCallable().futureCall(request), "modifyAckDeadline");
    deadlinesModifiedMetric.incrementAndGet();
  }

  private void acknowledge(PubsubQueueMessage m) throws IOException, InterruptedException {
    final AcknowledgeRequest request = AcknowledgeRequest.newBuilder()
        .setSubscription(subscription).addAckIds(m.getAckId()).build();
    await(stub.acknowledgeCallable().futureCall(request), "acknowledge");
    acknowledgedMetric.incrementAndGet();
  }

  private static PubsubQueueMessage checkMessage(Message message) {
    requireNonNull(message, "message");
    if (message instanceof PubsubQueueMessage m)
      return m;
    throw new IllegalArgumentException("message did not come from Pubsub");
  }

  /* default */ static int ackDeadlineSeconds(Duration visibilityTimeout) {
    final long seconds = visibilityTimeout.getSeconds();
    return (int) Math.min(Math.max(seconds, 0L), MAX_ACK_DEADLINE_SECONDS);
  }

  private static <T> T await(ApiFuture<T> future, String operation)
      throws IOException, InterruptedException {
    try {
      return future.get();
    } catch (InterruptedException e) {
      future.cancel(true);
      Thread.currentThread().interrupt();
      throw new InterruptedException();
    } catch (ExecutionException e) {
      final Throwable cause = e.getCause();
      if (cause instanceof Error x)
        throw x;
      if (cause instanceof IOException x)
        throw x;
      if (cause instanceof ApiException x)
        throw new IOException("Pubsub " + operation + " failed with " + x.getStatusCode().getCode(),
            x);
      throw new IOException("Pubsub " + operation + " failed", cause);
    }
  }

  @Override
  public PubsubQueueClientMetrics checkMetrics() {
    final long pulled = pulledMetric.get();
    final long acknowledged = acknowledgedMetric.get();
    final long deadlinesModified = deadlinesModifiedMetric.get();
    final long poisoned = poisonedMetric.get();
    return new PubsubQueueClientMetrics(pulled, acknowledged, deadlinesModified, poisoned);
  }

  @Override
  public PubsubQueueClientMetrics flushMetrics() {
    final PubsubQueueClientMetrics metrics = checkMetrics();
    pulledMetric.set(0);
    acknowledgedMetric.set(0);
    deadlinesModifiedMetric.set(0);
    poisonedMetric.set(0);
    return metrics;
  }

  /**
   * Closes the subscriber stub and waits briefly for its calls to finish.
   */
  @Override
  public void close() throws InterruptedException {
    stub.shutdown();
    if (!stub.awaitTermination(30, TimeUnit.SECONDS)) {
      LOGGER.atWarn().addKeyValue("subscription", subscription)
          .log("Subscriber stub did not terminate in time. Forcing shutdown...");
      stub.shutdownNow();
    }
  }
}
