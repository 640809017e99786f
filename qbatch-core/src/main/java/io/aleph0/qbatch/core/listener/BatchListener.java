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

import static java.util.Collections.unmodifiableList;
import static java.util.Objects.requireNonNull;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.common.util.concurrent.Uninterruptibles;
import io.aleph0.qbatch.core.BatchCompletionException;
import io.aleph0.qbatch.core.BatchFunction;
import io.aleph0.qbatch.core.Measureable;
import io.aleph0.qbatch.core.Message;
import io.aleph0.qbatch.core.QueueClient;
import io.aleph0.qbatch.core.RetrievedMessages;
import io.aleph0.qbatch.core.backoff.BackoffStrategy;
import io.aleph0.qbatch.core.backoff.RandomizedExponentialBackoffStrategy;
import io.aleph0.qbatch.core.batch.CompletionSummary;
import io.aleph0.qbatch.core.batch.DefaultMessageBatch;

/**
 * Continuously polls a queue, hands each cycle's messages to a {@link BatchFunction} as one batch,
 * and then deletes or retries the messages according to the function's verdict.
 *
 * <p>
 * Each cycle:
 *
 * <ol>
 * <li>Issues {@link BatchListenerConfig#parallelism() parallelism} concurrent retrievals, each
 * leasing its messages for {@link BatchListenerConfig#RETRIEVAL_VISIBILITY_TIMEOUT}.</li>
 * <li>Waits for all of them, merges their messages in lane order, and releases every lane's
 * {@link RetrievedMessages}, whatever happens next.</li>
 * <li>Calls the function with the merged batch. Empty batches are skipped unless
 * {@link BatchListenerConfig#runOnEmptyBatch() runOnEmptyBatch} is set.</li>
 * <li>On success, deletes the marked messages and retries the rest. On failure, retries
 * everything.</li>
 * <li>Waits for the delay chosen by the {@link BackoffStrategy}. Only a successful non-empty cycle
 * counts as productive.</li>
 * </ol>
 *
 * <p>
 * Errors inside a cycle never stop the listener. They are logged and the cycle counts as
 * unproductive, so persistent failures show up as growing delays, not crashes.
 *
 * <p>
 * Internally, the listener moves through the following states:
 *
 * <pre>
 *     CREATED ─► RUNNING ─► STOPPING ─► STOPPED
 *        │                                 ▲
 *        └─────────────────────────────────┘
 * </pre>
 *
 * <p>
 * {@link #requestStop() Stopping} wakes the listener from its delay and interrupts any in-flight
 * retrievals, but never interrupts the function. A cycle that already has its messages runs to
 * completion, and then the listener stops without starting another.
 */
public class BatchListener implements Measureable<ListenerMetrics>, AutoCloseable {
  private static final Logger LOGGER = LoggerFactory.getLogger(BatchListener.class);

  public static interface LifecycleListener {
    default void onListenerStarted(String queue) {}

    default void onListenerStopRequested(String queue) {}

    default void onListenerStopped(String queue) {}

    default void onCycleCompleted(String queue, CycleOutcome outcome, Duration nextDelay) {}
  }

  public static enum ListenerState {
    CREATED {
      @Override
      public ListenerState to(ListenerState target) {
        if (target != RUNNING && target != STOPPED)
          throw new IllegalStateException("Invalid transition from CREATED to " + target);
        return target;
      }
    },
    RUNNING {
      @Override
      public ListenerState to(ListenerState target) {
        if (target != STOPPING)
          throw new IllegalStateException("Invalid transition from RUNNING to " + target);
        return target;
      }
    },
    STOPPING {
      @Override
      public ListenerState to(ListenerState target) {
        if (target != STOPPED)
          throw new IllegalStateException("Invalid transition from STOPPING to " + target);
        return target;
      }
    },
    STOPPED {
      @Override
      public ListenerState to(ListenerState target) {
        throw new IllegalStateException("Invalid transition from STOPPED to " + target);
      }
    };

    /**
     * Validates that the transition from this state to the target state is valid.
     *
     * @param target the target state
     * @return the target state
     * @throws IllegalStateException if the transition is invalid
     */
    public abstract ListenerState to(ListenerState target);
  }

  private final AtomicLong cyclesMetric = new AtomicLong(0);
  private final AtomicLong processedCyclesMetric = new AtomicLong(0);
  private final AtomicLong rejectedCyclesMetric = new AtomicLong(0);
  private final AtomicLong emptyCyclesMetric = new AtomicLong(0);
  private final AtomicLong failedCyclesMetric = new AtomicLong(0);
  private final AtomicLong receivedMetric = new AtomicLong(0);
  private final AtomicLong deletedMetric = new AtomicLong(0);
  private final AtomicLong retriedMetric = new AtomicLong(0);
  private final AtomicLong retrievalFailuresMetric = new AtomicLong(0);
  private final AtomicLong completionFailuresMetric = new AtomicLong(0);

  private final QueueClient client;
  private final BatchFunction function;
  private final BatchListenerConfig config;
  private final BackoffStrategy backoff;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final List<LifecycleListener> lifecycleListeners = new CopyOnWriteArrayList<>();

  /**
   * Threads currently blocked in a retrieval. Guarded by itself, so that a lane can never be
   * interrupted after it has finished its retrieval.
   */
  private final Set<Thread> laneThreads = new HashSet<>();

  private final CountDownLatch stopSignal = new CountDownLatch(1);
  private final CountDownLatch terminated = new CountDownLatch(1);
  private final Object lock = new Object();
  private volatile ListenerState state = ListenerState.CREATED;
  private volatile Thread poller;

  /**
   * Creates a listener with the default backoff strategy and its own worker threads, which it shuts
   * down when it stops.
   */
  public BatchListener(QueueClient client, BatchFunction function, BatchListenerConfig config) {
    this(client, function, config, defaultBackoffStrategy(config), defaultExecutor(config), true);
  }

  /**
   * Creates a listener with the given backoff strategy and its own worker threads.
   */
  public BatchListener(QueueClient client, BatchFunction function, BatchListenerConfig config,
      BackoffStrategy backoff) {
    this(client, function, config, backoff, defaultExecutor(config), true);
  }

  /**
   * Creates a listener that runs retrievals and completions on the given executor. The executor is
   * not shut down when the listener stops. Retrievals only overlap if the executor can run
   * {@link BatchListenerConfig#parallelism()} tasks at once.
   */
  public BatchListener(QueueClient client, BatchFunction function, BatchListenerConfig config,
      BackoffStrategy backoff, ExecutorService executor) {
    this(client, function, config, backoff, executor, false);
  }

  private BatchListener(QueueClient client, BatchFunction function, BatchListenerConfig config,
      BackoffStrategy backoff, ExecutorService executor, boolean ownsExecutor) {
    this.client = requireNonNull(client, "client");
    this.function = requireNonNull(function, "function");
    this.config = requireNonNull(config, "config");
    this.backoff = requireNonNull(backoff, "backoff");
    this.executor = requireNonNull(executor, "executor");
    this.ownsExecutor = ownsExecutor;
  }

  public static BackoffStrategy defaultBackoffStrategy(BatchListenerConfig config) {
    return new RandomizedExponentialBackoffStrategy(BatchListenerConfig.MIN_BACKOFF,
        config.maxBackoff());
  }

  private static ExecutorService defaultExecutor(BatchListenerConfig config) {
    return Executors.newCachedThreadPool(
        newThreadFactory("qbatch-" + escape(config.queueName()) + "-worker-%d"));
  }

  private static ThreadFactory newThreadFactory(String nameFormat) {
    return new ThreadFactoryBuilder().setNameFormat(nameFormat).setDaemon(true).build();
  }

  private static String escape(String nameFormatPart) {
    return nameFormatPart.replace("%", "%%");
  }

  public void addLifecycleListener(LifecycleListener listener) {
    if (listener == null)
      throw new NullPointerException();
    lifecycleListeners.add(listener);
  }

  public void removeLifecycleListener(LifecycleListener listener) {
    lifecycleListeners.remove(listener);
  }

  public BatchListenerConfig getConfig() {
    return config;
  }

  public ListenerState getState() {
    return state;
  }

  /**
   * Starts polling on a new background thread.
   *
   * @throws IllegalStateException if the listener has already been started or stopped
   */
  public void start() {
    synchronized (lock) {
      state = state.to(ListenerState.RUNNING);
    }

    poller =
        newThreadFactory("qbatch-" + escape(config.queueName()) + "-poller").newThread(this::run);
    poller.start();

    LOGGER.atInfo().addKeyValue("queue", config.queueName())
        .addKeyValue("parallelism", config.parallelism()).log("Batch listener started");
  }

  /**
   * Asks the listener to stop and returns immediately. The current cycle, if any, finishes first.
   * Calling this method more than once has no further effect.
   */
  public void requestStop() {
    final boolean neverStarted;
    synchronized (lock) {
      if (state == ListenerState.CREATED) {
        state = state.to(ListenerState.STOPPED);
        neverStarted = true;
      } else if (state == ListenerState.RUNNING) {
        state = state.to(ListenerState.STOPPING);
        neverStarted = false;
      } else {
        return;
      }
    }

    stopSignal.countDown();

    if (neverStarted) {
      if (ownsExecutor)
        executor.shutdown();
      notifyLifecycleListeners(l -> l.onListenerStopped(config.queueName()));
      terminated.countDown();
      return;
    }

    LOGGER.atDebug().addKeyValue("queue", config.queueName()).log("Batch listener stop requested");

    synchronized (laneThreads) {
      for (Thread laneThread : laneThreads)
        laneThread.interrupt();
    }

    notifyLifecycleListeners(l -> l.onListenerStopRequested(config.queueName()));
  }

  /**
   * Stops the listener and waits for the background thread to exit.
   *
   * <p>
   * When called on the polling thread, for example from inside the {@link BatchFunction} or a
   * {@link LifecycleListener}, this only requests the stop and returns without waiting, since the
   * listener cannot finish stopping until the caller returns.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void stop() throws InterruptedException {
    requestStop();
    if (Thread.currentThread() == poller)
      return;
    terminated.await();
  }

  /**
   * Waits up to the given timeout for the listener to stop.
   *
   * @return {@code true} if the listener stopped, or {@code false} if the timeout elapsed first
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitTermination(Duration timeout) throws InterruptedException {
    return terminated.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
  }

  /**
   * Same as {@link #stop()}.
   */
  @Override
  public void close() throws InterruptedException {
    stop();
  }

  private boolean isStopRequested() {
    return stopSignal.getCount() == 0;
  }

  private void run() {
    notifyLifecycleListeners(l -> l.onListenerStarted(config.queueName()));
    try {
      while (!isStopRequested()) {
        CycleOutcome outcome;
        try {
          outcome = runCycle();
        } catch (RuntimeException e) {
          LOGGER.atError().addKeyValue("queue", config.queueName()).setCause(e)
              .log("Unexpected failure in polling cycle. Continuing...");
          outcome = CycleOutcome.FAILED;
        }

        if (outcome == null) {
          // Stop was requested while we were retrieving
          break;
        }

        recordCycle(outcome);

        final Duration delay = backoff.nextDelay(outcome.isProductive());

        final CycleOutcome theoutcome = outcome;
        notifyLifecycleListeners(
            l -> l.onCycleCompleted(config.queueName(), theoutcome, delay));

        if (stopSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS))
          break;
      }
      LOGGER.atDebug().addKeyValue("queue", config.queueName()).log("Batch listener stopping");
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOGGER.atWarn().addKeyValue("queue", config.queueName()).setCause(e)
          .log("Batch listener interrupted. Stopping...");
    } catch (Error e) {
      LOGGER.atError().addKeyValue("queue", config.queueName()).setCause(e)
          .log("Batch listener failed. Stopping...");
      throw e;
    } finally {
      synchronized (lock) {
        if (state == ListenerState.RUNNING)
          state = state.to(ListenerState.STOPPING);
        state = state.to(ListenerState.STOPPED);
      }
      stopSignal.countDown();
      if (ownsExecutor)
        executor.shutdown();
      LOGGER.atInfo().addKeyValue("queue", config.queueName()).log("Batch listener stopped");
      notifyLifecycleListeners(l -> l.onListenerStopped(config.queueName()));
      terminated.countDown();
    }
  }

  /**
   * Runs one cycle.
   *
   * @return how the cycle ended, or {@code null} if stop was requested before any messages were
   *         retrieved
   */
  private CycleOutcome runCycle() throws InterruptedException {
    final List<RetrievedMessages> lanes;
    try {
      lanes = retrieve();
    } catch (IOException e) {
      retrievalFailuresMetric.incrementAndGet();
      LOGGER.atError().addKeyValue("queue", config.queueName()).setCause(e)
          .log("Failed to retrieve messages. Backing off...");
      return CycleOutcome.FAILED;
    }
    if (lanes == null)
      return null;

    final List<Message> messages = new ArrayList<>();
    try {
      for (RetrievedMessages lane : lanes)
        messages.addAll(lane.messages());
    } finally {
      release(lanes);
    }

    if (messages.isEmpty()) {
      LOGGER.atDebug().addKeyValue("queue", config.queueName()).log("No messages received");
      if (config.runOnEmptyBatch())
        invoke(new DefaultMessageBatch(List.of()));
      return CycleOutcome.EMPTY;
    }

    receivedMetric.addAndGet(messages.size());

    final DefaultMessageBatch batch = new DefaultMessageBatch(messages);
    final boolean succeeded = invoke(batch);

    try {
      final CompletionSummary summary;
      if (succeeded) {
        summary = batch.complete(client, executor, config.maxRetries(),
            config.retryVisibilityTimeout());
      } else {
        summary = batch.retryAll(client, executor, config.maxRetries(),
            config.retryVisibilityTimeout());
      }
      deletedMetric.addAndGet(summary.deleted());
      retriedMetric.addAndGet(summary.retried());
      LOGGER.atDebug().addKeyValue("queue", config.queueName())
          .addKeyValue("deleted", summary.deleted()).addKeyValue("retried", summary.retried())
          .log("Batch completed");
    } catch (BatchCompletionException e) {
      completionFailuresMetric.incrementAndGet();
      LOGGER.atError().addKeyValue("queue", config.queueName())
          .addKeyValue("failed", e.getFailedMessageIds().size()).setCause(e)
          .log("Exception occurred when completing batch. Backing off...");
      return CycleOutcome.FAILED;
    }

    return succeeded ? CycleOutcome.PROCESSED : CycleOutcome.REJECTED;
  }

  /**
   * Issues one retrieval per lane and waits for all of them.
   *
   * @return every lane's result, in lane order, or {@code null} if stop was requested while
   *         retrieving. In that case, any results that did arrive have already been released.
   * @throws IOException if any lane failed, with the first lane failure as its cause and any other
   *         distinct lane failures suppressed. Results from the other lanes have already been
   *         released.
   */
  private List<RetrievedMessages> retrieve() throws IOException, InterruptedException {
    final int parallelism = config.parallelism();
    final RetrievedMessages[] results = new RetrievedMessages[parallelism];
    final Throwable[] failures = new Throwable[parallelism];
    final CountDownLatch done = new CountDownLatch(parallelism);

    for (int i = 0; i < parallelism; i++) {
      final int lane = i;
      try {
        executor.execute(() -> {
          try {
            enterLane();
            results[lane] = client.getMessages(BatchListenerConfig.RETRIEVAL_VISIBILITY_TIMEOUT);
          } catch (Throwable t) {
            failures[lane] = t;
          } finally {
            exitLane();
            done.countDown();
          }
        });
      } catch (RejectedExecutionException e) {
        failures[lane] = e;
        done.countDown();
      }
    }

    try {
      done.await();
    } catch (InterruptedException e) {
      synchronized (laneThreads) {
        for (Thread laneThread : laneThreads)
          laneThread.interrupt();
      }
      Uninterruptibles.awaitUninterruptibly(done);
      release(collect(results));
      throw e;
    }

    final List<RetrievedMessages> retrieved = collect(results);

    // A client may throw the same exception instance from more than one lane
    final List<Throwable> laneFailures = new ArrayList<>();
    for (Throwable t : failures) {
      if (t != null && !containsInstance(laneFailures, t))
        laneFailures.add(t);
    }

    if (laneFailures.isEmpty())
      return retrieved;

    release(retrieved);

    if (isStopRequested()) {
      LOGGER.atDebug().addKeyValue("queue", config.queueName()).setCause(laneFailures.get(0))
          .log("Retrieval cancelled by stop request");
      return null;
    }

    for (Throwable t : laneFailures)
      if (t instanceof Error x)
        throw x;

    final IOException failure = new IOException("Failed to retrieve messages", laneFailures.get(0));
    for (int i = 1; i < laneFailures.size(); i++)
      failure.addSuppressed(laneFailures.get(i));
    throw failure;
  }

  private static boolean containsInstance(List<Throwable> ts, Throwable t) {
    for (Throwable x : ts)
      if (x == t)
        return true;
    return false;
  }

  private void enterLane() throws InterruptedException {
    synchronized (laneThreads) {
      if (isStopRequested())
        throw new InterruptedException();
      laneThreads.add(Thread.currentThread());
    }
  }

  private void exitLane() {
    synchronized (laneThreads) {
      laneThreads.remove(Thread.currentThread());
      // Don't leak a stop interrupt into the next task this pooled thread runs
      Thread.interrupted();
    }
  }

  private static List<RetrievedMessages> collect(RetrievedMessages[] results) {
    final List<RetrievedMessages> result = new ArrayList<>(results.length);
    for (RetrievedMessages r : results)
      if (r != null)
        result.add(r);
    return unmodifiableList(result);
  }

  private void release(List<RetrievedMessages> lanes) {
    for (RetrievedMessages lane : lanes) {
      try {
        lane.close();
      } catch (RuntimeException e) {
        LOGGER.atWarn().addKeyValue("queue", config.queueName()).setCause(e)
            .log("Failed to release retrieved messages. Ignoring...");
      }
    }
  }

  /**
   * Calls the function and returns its verdict. Exceptions thrown by the function count as a
   * failure verdict.
   */
  private boolean invoke(DefaultMessageBatch batch) {
    try {
      final boolean verdict = function.process(batch);
      if (!verdict) {
        LOGGER.atDebug().addKeyValue("queue", config.queueName())
            .addKeyValue("size", batch.size()).log("Function rejected batch");
      }
      return verdict;
    } catch (InterruptedException e) {
      LOGGER.atWarn().addKeyValue("queue", config.queueName()).setCause(e)
          .log("Function interrupted. Stopping after this batch...");
      requestStop();
      return false;
    } catch (Exception e) {
      LOGGER.atWarn().addKeyValue("queue", config.queueName()).addKeyValue("size", batch.size())
          .setCause(e).log("Function failed. Retrying batch...");
      return false;
    }
  }

  private void recordCycle(CycleOutcome outcome) {
    cyclesMetric.incrementAndGet();
    switch (outcome) {
      case PROCESSED:
        processedCyclesMetric.incrementAndGet();
        break;
      case REJECTED:
        rejectedCyclesMetric.incrementAndGet();
        break;
      case EMPTY:
        emptyCyclesMetric.incrementAndGet();
        break;
      case FAILED:
        failedCyclesMetric.incrementAndGet();
        break;
      default:
        throw new AssertionError("unexpected outcome: " + outcome);
    }
  }

  private void notifyLifecycleListeners(Consumer<LifecycleListener> event) {
    for (LifecycleListener listener : lifecycleListeners) {
      try {
        event.accept(listener);
      } catch (Exception e) {
        LOGGER.atError().addKeyValue("queue", config.queueName()).setCause(e)
            .log("Lifecycle listener threw exception");
      }
    }
  }

  @Override
  public ListenerMetrics checkMetrics() {
    final long cycles = cyclesMetric.get();
    final long processedCycles = processedCyclesMetric.get();
    final long rejectedCycles = rejectedCyclesMetric.get();
    final long emptyCycles = emptyCyclesMetric.get();
    final long failedCycles = failedCyclesMetric.get();
    final long received = receivedMetric.get();
    final long deleted = deletedMetric.get();
    final long retried = retriedMetric.get();
    final long retrievalFailures = retrievalFailuresMetric.get();
    final long completionFailures = completionFailuresMetric.get();
    return new ListenerMetrics(cycles, processedCycles, rejectedCycles, emptyCycles, failedCycles,
        received, deleted, retried, retrievalFailures, completionFailures);
  }

  @Override
  public ListenerMetrics flushMetrics() {
    final ListenerMetrics metrics = checkMetrics();
    cyclesMetric.set(0);
    processedCyclesMetric.set(0);
    rejectedCyclesMetric.set(0);
    emptyCyclesMetric.set(0);
    failedCyclesMetric.set(0);
    receivedMetric.set(0);
    deletedMetric.set(0);
    retriedMetric.set(0);
    retrievalFailuresMetric.set(0);
    completionFailuresMetric.set(0);
    return metrics;
  }
}
