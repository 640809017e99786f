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

import static java.util.Objects.requireNonNull;
import java.time.Duration;
import java.util.Random;

/**
 * Exponential backoff with full jitter.
 *
 * <p>
 * After a successful cycle the streak resets and the delay is {@code base}. After the k-th
 * consecutive unsuccessful cycle the delay is drawn uniformly from {@code [0, ceiling(k)]} and then
 * raised to at least {@code base}, where
 *
 * <pre>
 * ceiling(k) = min(base * 2^k, maxBackoff)
 * </pre>
 *
 * <p>
 * The jitter keeps many listeners polling the same empty queue from synchronizing.
 *
 * <p>
 * Not thread-safe.
 */
public class RandomizedExponentialBackoffStrategy implements BackoffStrategy {
  private final long baseMillis;
  private final long maxMillis;
  private final Random rand;
  private int streak = 0;

  public RandomizedExponentialBackoffStrategy(Duration base, Duration maxBackoff) {
    this(base, maxBackoff, new Random());
  }

  public RandomizedExponentialBackoffStrategy(Duration base, Duration maxBackoff, Random rand) {
    requireNonNull(base, "base");
    requireNonNull(maxBackoff, "maxBackoff");
    if (base.isNegative() || base.isZero())
      throw new IllegalArgumentException("base must be positive");
    if (maxBackoff.compareTo(base) < 0)
      throw new IllegalArgumentException("maxBackoff must be at least base");
    this.baseMillis = base.toMillis();
    this.maxMillis = maxBackoff.toMillis();
    this.rand = requireNonNull(rand, "rand");
  }

  @Override
  public Duration nextDelay(boolean success) {
    if (success) {
      streak = 0;
      return Duration.ofMillis(baseMillis);
    }

    // Stop counting once we're pinned at the max so the streak can't overflow
    if (ceilingMillis(streak) < maxMillis)
      streak = streak + 1;

    final long ceiling = ceilingMillis(streak);
    final long jittered = rand.nextLong(ceiling + 1);

    return Duration.ofMillis(Math.max(jittered, baseMillis));
  }

  /**
   * The unjittered delay for a streak of the given length, i.e., the largest value
   * {@link #nextDelay(boolean)} can return after that many consecutive unsuccessful cycles.
   */
  public Duration ceiling(int streak) {
    if (streak < 0)
      throw new IllegalArgumentException("streak must not be negative");
    return Duration.ofMillis(ceilingMillis(streak));
  }

  /**
   * The current number of consecutive unsuccessful cycles. Once the ceiling reaches
   * {@code maxBackoff}, the streak stops growing.
   */
  public int streak() {
    return streak;
  }

  public Duration getBase() {
    return Duration.ofMillis(baseMillis);
  }

  public Duration getMaxBackoff() {
    return Duration.ofMillis(maxMillis);
  }

  private long ceilingMillis(int k) {
    // 2^62 is the largest shift that stays positive, and base >= 1
    if (k >= 62 || baseMillis > (maxMillis >> Math.min(k, 62)))
      return maxMillis;
    return Math.min(baseMillis << k, maxMillis);
  }
}
