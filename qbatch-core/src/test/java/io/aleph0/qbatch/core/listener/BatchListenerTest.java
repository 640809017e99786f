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

import static java.util.stream.Collectors.toList;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import com.google.common.util.concurrent.MoreExecutors;
import io.aleph0.qbatch.core.BatchFunction;
import io.aleph0.qbatch.core.Message;
import io.aleph0.qbatch.core.MessageBatch;
import io.aleph0.qbatch.core.QueueClient;
import io.aleph0.qbatch.core.RetrievedMessages;
import io.aleph0.qbatch.core.backoff.BackoffStrategy;
import io.aleph0.qbatch.core.backoff.RandomizedExponentialBackoffStrategy;
import io.aleph0.qbatch.core.listener.BatchListener.LifecycleListener;
import io.aleph0.qbatch.core.listener.BatchListener.ListenerState;
import io.aleph0.qbatch.core.message.DefaultMessage;

class BatchListenerTest {
  public static final Duration SHORT_DELAY = Duration.ofMillis(10);

  /**
   * Runs lanes one after another on the polling thread, in lane order, so that the order of
   * retrievals is deterministic.
   */
  public final ExecutorService directExecutor = MoreExecutors.newDirectExecutorService();

  @FunctionalInterface
  public static interface Retrieval {
    public List<Message> retrieve() throws IOException, InterruptedException;
  }

  public static record Retry(String id, int attempt) {
  }

  /**
   * Plays back scripted retrievals in order, then returns nothing. Counts releases and records
   * deletes and retries.
   */
  public static class ScriptedQueueClient implements QueueClient {
    public final Queue<Retrieval> script = new ConcurrentLinkedQueue<>();
    public final AtomicInteger getCalls = new AtomicInteger(0);
    public final AtomicInteger released = new AtomicInteger(0);
    public final List<Duration> visibilityTimeouts = new CopyOnWriteArrayList<>();
    public final List<String> deleted = new CopyOnWriteArrayList<>();
    public final List<Retry> retried = new CopyOnWriteArrayList<>();
    public final Set<String> failingDeletes = ConcurrentHashMap.newKeySet();

    public ScriptedQueueClient then(Retrieval retrieval) {
      script.add(retrieval);
      return this;
    }

    public ScriptedQueueClient then(Message... messages) {
      final List<Message> result = List.of(messages);
      return then(() -> result);
    }

    @Override
    public RetrievedMessages getMessages(Duration visibilityTimeout)
        throws IOException, InterruptedException {
      getCalls.incrementAndGet();
      visibilityTimeouts.add(visibilityTimeout);
      final Retrieval next = script.poll();
      final List<Message> messages = next != null ? next.retrieve() : List.of();
      return new RetrievedMessages() {
        @Override
        public List<Message> messages() {
          return messages;
        }

        @Override
        public void close() {
          released.incrementAndGet();
        }
      };
    }

    @Override
    public void delete(Message message) throws IOException {
      if (failingDeletes.contains(message.id()))
        throw new IOException("simulated delete failure");
      deleted.add(message.id());
    }

    @Override
    public void retry(Message message, int attempt, int maxRetries, Duration visibilityTimeout) {
      retried.add(new Retry(message.id(), attempt));
    }
  }

  /**
   * Returns a fixed delay and records every verdict it is given.
   */
  public static class RecordingBackoffStrategy implements BackoffStrategy {
    public final List<Boolean> verdicts = new CopyOnWriteArrayList<>();
    private final Duration delay;

    public RecordingBackoffStrategy(Duration delay) {
      this.delay = delay;
    }

    @Override
    public Duration nextDelay(boolean success) {
      verdicts.add(success);
      return delay;
    }
  }

  /**
   * Records cycle outcomes and, optionally, requests stop after a given number of cycles. Stopping
   * from inside the callback guarantees the listener runs exactly that many cycles.
   */
  public static class RecordingLifecycleListener implements LifecycleListener {
    public final List<CycleOutcome> outcomes = new CopyOnWriteArrayList<>();
    public final List<String> events = new CopyOnWriteArrayList<>();
    public final CountDownLatch firstCycle = new CountDownLatch(1);
    private final int stopAfter;
    private BatchListener listener;

    public RecordingLifecycleListener(int stopAfter) {
      this.stopAfter = stopAfter;
    }

    public void attach(BatchListener listener) {
      this.listener = listener;
      listener.addLifecycleListener(this);
    }

    @Override
    public void onListenerStarted(String queue) {
      events.add("started");
    }

    @Override
    public void onListenerStopRequested(String queue) {
      events.add("stopRequested");
    }

    @Override
    public void onListenerStopped(String queue) {
      events.add("stopped");
    }

    @Override
    public void onCycleCompleted(String queue, CycleOutcome outcome, Duration nextDelay) {
      outcomes.add(outcome);
      firstCycle.countDown();
      if (stopAfter > 0 && outcomes.size() >= stopAfter)
        listener.requestStop();
    }
  }

  @AfterEach
  public void cleanup() {
    directExecutor.shutdownNow();
  }

  public BatchListenerConfig config(int parallelism, boolean runOnEmptyBatch) {
    return new BatchListenerConfig("test", parallelism, Duration.ofSeconds(60), 5,
        Duration.ofSeconds(1), runOnEmptyBatch);
  }

  @Test
  @Timeout(5)
  void givenTwoLanes_whenSomeMarked_thenMergeInLaneOrderAndCompletePartially() throws Exception {
    final Message a1 = message("a1", 1), a2 = message("a2", 1), a3 = message("a3", 1);
    final Message b1 = message("b1", 1), b2 = message("b2", 1), b3 = message("b3", 1);
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(a1, a2, a3).then(b1, b2, b3);
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final List<List<String>> batches = new CopyOnWriteArrayList<>();
    final BatchFunction function = batch -> {
      batches.add(ids(batch));
      batch.markAsProcessed(a2);
      batch.markAsProcessed(b1);
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(2, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(batches).containsExactly(List.of("a1", "a2", "a3", "b1", "b2", "b3"));
    assertThat(client.deleted).containsExactlyInAnyOrder("a2", "b1");
    assertThat(client.retried).containsExactlyInAnyOrder(new Retry("a1", 1), new Retry("a3", 1),
        new Retry("b2", 1), new Retry("b3", 1));
    assertThat(client.released.get()).isEqualTo(2);
    assertThat(client.visibilityTimeouts)
        .containsOnly(BatchListenerConfig.RETRIEVAL_VISIBILITY_TIMEOUT);
    assertThat(backoff.verdicts).containsExactly(true);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.PROCESSED);
    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);

    final ListenerMetrics metrics = unit.checkMetrics();
    assertThat(metrics.cycles()).isEqualTo(1);
    assertThat(metrics.processedCycles()).isEqualTo(1);
    assertThat(metrics.received()).isEqualTo(6);
    assertThat(metrics.deleted()).isEqualTo(2);
    assertThat(metrics.retried()).isEqualTo(4);
  }

  @Test
  @Timeout(5)
  void givenEmptyLanes_whenRunOnEmptyBatchFalse_thenSkipFunctionAndGrowStreak()
      throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient();
    final RandomizedExponentialBackoffStrategy backoff = new RandomizedExponentialBackoffStrategy(
        BatchListenerConfig.MIN_BACKOFF, Duration.ofSeconds(60));

    final AtomicInteger invocations = new AtomicInteger(0);
    final BatchFunction function = batch -> {
      invocations.incrementAndGet();
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(3, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(invocations.get()).isZero();
    assertThat(backoff.streak()).isEqualTo(1);
    assertThat(client.getCalls.get()).isEqualTo(3);
    assertThat(client.released.get()).isEqualTo(3);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.EMPTY);
    assertThat(unit.checkMetrics().emptyCycles()).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenEmptyLanes_whenRunOnEmptyBatchTrue_thenInvokeFunctionWithEmptyBatch()
      throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient();
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final List<Integer> sizes = new CopyOnWriteArrayList<>();
    final BatchFunction function = batch -> {
      sizes.add(batch.size());
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(2, true), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(sizes).containsExactly(0);
    assertThat(backoff.verdicts).containsExactly(false);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.EMPTY);
  }

  @Test
  @Timeout(5)
  void givenFourMessages_whenFunctionReturnsFalse_thenRetryAllAndDeleteNone() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient().then(message("m1", 1),
        message("m2", 2), message("m3", 3), message("m4", 4));
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final BatchFunction function = batch -> {
      batch.markAllAsProcessed();
      return false;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(1, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.deleted).isEmpty();
    assertThat(client.retried).containsExactlyInAnyOrder(new Retry("m1", 1), new Retry("m2", 2),
        new Retry("m3", 3), new Retry("m4", 4));
    assertThat(backoff.verdicts).containsExactly(false);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.REJECTED);
    assertThat(unit.checkMetrics().rejectedCycles()).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenMessages_whenFunctionThrows_thenRetryAllAndKeepRunning() throws Exception {
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(message("m1", 1), message("m2", 1)).then(message("m3", 1));
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final BatchFunction function = batch -> {
      if (ids(batch).contains("m1"))
        throw new IllegalStateException("simulated function failure");
      batch.markAllAsProcessed();
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(1, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(2);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.retried).containsExactlyInAnyOrder(new Retry("m1", 1), new Retry("m2", 1));
    assertThat(client.deleted).containsExactly("m3");
    assertThat(backoff.verdicts).containsExactly(false, true);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.REJECTED, CycleOutcome.PROCESSED);
  }

  @Test
  @Timeout(5)
  void givenOneLaneFails_whenRetrieve_thenReleaseOtherLanesAndSkipFunction() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient().then(message("a1", 1))
        .then(() -> {
          throw new IOException("simulated retrieval failure");
        }).then(message("c1", 1));
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final AtomicInteger invocations = new AtomicInteger(0);
    final BatchFunction function = batch -> {
      invocations.incrementAndGet();
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(3, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(invocations.get()).isZero();
    assertThat(client.released.get()).isEqualTo(2);
    assertThat(client.deleted).isEmpty();
    assertThat(client.retried).isEmpty();
    assertThat(backoff.verdicts).containsExactly(false);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.FAILED);
    assertThat(unit.checkMetrics().retrievalFailures()).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenDeleteFails_whenComplete_thenCompleteOthersAndFailCycle() throws Exception {
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(message("m1", 1), message("m2", 1), message("m3", 1));
    client.failingDeletes.add("m2");
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final BatchFunction function = batch -> {
      batch.markAllAsProcessed();
      return true;
    };

    final BatchListener unit =
        new BatchListener(client, function, config(1, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.deleted).containsExactlyInAnyOrder("m1", "m3");
    assertThat(backoff.verdicts).containsExactly(false);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.FAILED);
    assertThat(unit.checkMetrics().completionFailures()).isEqualTo(1);
  }

  @Test
  @Timeout(5)
  void givenLongDelay_whenStop_thenTerminatePromptlyWithoutRetrievingAgain() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient();
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(Duration.ofHours(1));

    final BatchListener unit = new BatchListener(client, batch -> true, config(2, false), backoff,
        directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(0);
    lifecycle.attach(unit);

    unit.start();
    assertThat(lifecycle.firstCycle.await(4, TimeUnit.SECONDS)).isTrue();

    final long started = System.nanoTime();
    unit.stop();
    final long elapsed = System.nanoTime() - started;

    assertThat(Duration.ofNanos(elapsed)).isLessThan(Duration.ofSeconds(2));
    assertThat(client.getCalls.get()).isEqualTo(2);
    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);
    assertThat(lifecycle.events).containsExactly("started", "stopRequested", "stopped");
  }

  @Test
  @Timeout(5)
  void givenBlockingRetrieval_whenStop_thenInterruptRetrievalAndNeverCallFunction()
      throws Exception {
    final CountDownLatch retrieving = new CountDownLatch(2);
    final ScriptedQueueClient client = new ScriptedQueueClient();
    final Retrieval blocking = () -> {
      retrieving.countDown();
      Thread.sleep(Duration.ofHours(1).toMillis());
      return List.of();
    };
    client.then(blocking).then(blocking);

    final AtomicInteger invocations = new AtomicInteger(0);
    final BatchFunction function = batch -> {
      invocations.incrementAndGet();
      return true;
    };

    // Uses the listener's own worker threads, so the lanes really run concurrently
    final BatchListener unit = new BatchListener(client, function, config(2, false));
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(0);
    lifecycle.attach(unit);

    unit.start();
    assertThat(retrieving.await(4, TimeUnit.SECONDS)).isTrue();

    unit.stop();

    assertThat(invocations.get()).isZero();
    assertThat(lifecycle.outcomes).isEmpty();
    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);
  }

  @Test
  @Timeout(5)
  void givenFunctionInterrupted_whenRun_thenRetryBatchAndStop() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient().then(message("m1", 2));
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final BatchFunction function = batch -> {
      throw new InterruptedException();
    };

    final BatchListener unit =
        new BatchListener(client, function, config(1, false), backoff, directExecutor);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.retried).containsExactly(new Retry("m1", 2));
    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);
  }

  @Test
  void givenStartedListener_whenStartAgain_thenThrowIllegalStateException() throws Exception {
    final BatchListener unit = new BatchListener(new ScriptedQueueClient(), batch -> true,
        config(1, false), new RecordingBackoffStrategy(SHORT_DELAY), directExecutor);
    try {
      unit.start();
      assertThatExceptionOfType(IllegalStateException.class).isThrownBy(unit::start);
    } finally {
      unit.close();
    }
  }

  @Test
  void givenUnstartedListener_whenStop_thenStoppedAndCannotStart() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient();
    final BatchListener unit = new BatchListener(client, batch -> true, config(1, false),
        new RecordingBackoffStrategy(SHORT_DELAY), directExecutor);

    unit.stop();

    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);
    assertThat(unit.awaitTermination(Duration.ZERO)).isTrue();
    assertThat(client.getCalls.get()).isZero();
    assertThatExceptionOfType(IllegalStateException.class).isThrownBy(unit::start);
  }

  @Test
  @Timeout(5)
  void givenThrowingLifecycleListener_whenRun_thenKeepRunning() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient().then(message("m1", 1));
    final BatchListener unit = new BatchListener(client, batch -> {
      batch.markAllAsProcessed();
      return true;
    }, config(1, false), new RecordingBackoffStrategy(SHORT_DELAY), directExecutor);

    unit.addLifecycleListener(new LifecycleListener() {
      @Override
      public void onCycleCompleted(String queue, CycleOutcome outcome, Duration nextDelay) {
        throw new IllegalStateException("simulated lifecycle listener failure");
      }
    });
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.deleted).containsExactly("m1");
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.PROCESSED);
  }

  @Test
  @Timeout(5)
  void givenCompletedCycles_whenFlushMetrics_thenResetCounters() throws Exception {
    final ScriptedQueueClient client = new ScriptedQueueClient().then(message("m1", 1));
    final BatchListener unit = new BatchListener(client, batch -> {
      batch.markAllAsProcessed();
      return true;
    }, config(1, false), new RecordingBackoffStrategy(SHORT_DELAY), directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(2);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    final ListenerMetrics flushed = unit.flushMetrics();
    assertThat(flushed.cycles()).isEqualTo(2);
    assertThat(flushed.processedCycles()).isEqualTo(1);
    assertThat(flushed.emptyCycles()).isEqualTo(1);
    assertThat(flushed.deleted()).isEqualTo(1);

    assertThat(unit.checkMetrics())
        .isEqualTo(new ListenerMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0));
  }

  @Test
  @Timeout(5)
  void givenLanesShareOneException_whenRetrieve_thenReleaseOtherLanesAndCountRetrievalFailure()
      throws Exception {
    final IOException unavailable = new IOException("simulated queue unavailable");
    final Retrieval failing = () -> {
      throw unavailable;
    };
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(message("a1", 1)).then(failing).then(failing);
    final RecordingBackoffStrategy backoff = new RecordingBackoffStrategy(SHORT_DELAY);

    final BatchListener unit =
        new BatchListener(client, batch -> true, config(3, false), backoff, directExecutor);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.getCalls.get()).isEqualTo(3);
    assertThat(client.released.get()).isEqualTo(1);
    assertThat(client.deleted).isEmpty();
    assertThat(client.retried).isEmpty();
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.FAILED);
    assertThat(unit.checkMetrics().retrievalFailures()).isEqualTo(1);
    assertThat(unavailable.getSuppressed()).isEmpty();
  }

  @Test
  @Timeout(5)
  void givenFunctionCallsStop_whenRun_thenCompleteBatchAndStopWithoutDeadlock() throws Exception {
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(message("m1", 1)).then(message("m2", 1));
    final AtomicReference<BatchListener> self = new AtomicReference<>();

    final BatchFunction function = batch -> {
      batch.markAllAsProcessed();
      self.get().stop();
      return true;
    };

    final BatchListener unit = new BatchListener(client, function, config(1, false),
        new RecordingBackoffStrategy(SHORT_DELAY), directExecutor);
    self.set(unit);
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(0);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(4))).isTrue();

    assertThat(client.deleted).containsExactly("m1");
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.PROCESSED);
    assertThat(lifecycle.events).containsExactly("started", "stopRequested", "stopped");
    assertThat(unit.getState()).isEqualTo(ListenerState.STOPPED);
  }

  @Test
  @Timeout(10)
  void givenDefaultExecutor_whenRetrieve_thenLanesRunConcurrently() throws Exception {
    final int parallelism = 3;
    final CountDownLatch entered = new CountDownLatch(parallelism);
    final List<Boolean> overlapped = new CopyOnWriteArrayList<>();
    final Retrieval rendezvous = () -> {
      entered.countDown();
      overlapped.add(entered.await(4, TimeUnit.SECONDS));
      return List.of();
    };
    final ScriptedQueueClient client =
        new ScriptedQueueClient().then(rendezvous).then(rendezvous).then(rendezvous);

    final BatchListener unit = new BatchListener(client, batch -> true,
        config(parallelism, false), new RecordingBackoffStrategy(SHORT_DELAY));
    final RecordingLifecycleListener lifecycle = new RecordingLifecycleListener(1);
    lifecycle.attach(unit);

    unit.start();
    assertThat(unit.awaitTermination(Duration.ofSeconds(8))).isTrue();

    assertThat(overlapped).containsExactly(true, true, true);
    assertThat(client.released.get()).isEqualTo(parallelism);
    assertThat(lifecycle.outcomes).containsExactly(CycleOutcome.EMPTY);
  }

  private static List<String> ids(MessageBatch batch) {
    return batch.messages().stream().map(Message::id).collect(toList());
  }

  private static Message message(String id, int deliveryAttempt) {
    return new DefaultMessage(id, Map.of(), id.getBytes(), deliveryAttempt);
  }
}
