/*
 * Copyright 2026 The Ring Cache Authors. All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.ringcache.cache;

import static java.util.Objects.requireNonNull;

import java.util.function.Supplier;

import org.jspecify.annotations.Nullable;

import com.github.ringcache.cache.stats.CacheStats;
import com.github.ringcache.cache.stats.ConcurrentStatsCounter;
import com.github.ringcache.cache.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.CheckReturnValue;
import com.google.errorprone.annotations.FormatMethod;

/**
 * A builder of {@link Cache} instances having a combination of the following features:
 * <ul>
 *   <li>a fixed number of slots, reused in first-in, first-out order once exhausted
 *   <li>a sentinel value returned on a miss and written to logically delete a key
 *   <li>accumulation of cache access statistics
 * </ul>
 * <p>
 * These features are all optional, except for the capacity and the absent value; caches can be
 * created using all or none of them. Usage example:
 * <pre>{@code
 *   Cache<Integer, Long> fibonacci = RingCache.newBuilder()
 *       .capacity(1_000)
 *       .recordStats()
 *       .build(-1L);
 * }</pre>
 * <p>
 * The returned cache is thread-safe as long as fewer threads write to it concurrently than it has
 * slots, so the capacity should be chosen to exceed the number of writing threads. A larger
 * capacity yields more hits, but a lookup scans the ring linearly, so misses become more expensive
 * as the capacity grows.
 * <p>
 * The absent value should be a value that is never cached for a real key. The keys and values
 * should be immutable, as the cache compares keys with {@link Object#equals} while other threads
 * may be reading them.
 *
 * @param <K> the most general key type this builder will be able to create caches for. The
 *     concrete key type is chosen when calling {@link #build}. Cache keys may not be null.
 * @param <V> the most general value type this builder will be able to create caches for. The
 *     concrete value type is inferred from the absent value given to {@link #build}. Cache values
 *     may not be null.
 */
public final class RingCache<K, V> {
  static final Supplier<StatsCounter> ENABLED_STATS_COUNTER_SUPPLIER = ConcurrentStatsCounter::new;
  static final int UNSET_INT = -1;

  int capacity = UNSET_INT;

  @Nullable Supplier<StatsCounter> statsCounterSupplier;

  private RingCache() {}

  /** Ensures that the argument expression is true. */
  @FormatMethod
  static void requireArgument(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalArgumentException(String.format(template, args));
    }
  }

  /** Ensures that the state expression is true. */
  @FormatMethod
  static void requireState(boolean expression, String template, @Nullable Object... args) {
    if (!expression) {
      throw new IllegalStateException(String.format(template, args));
    }
  }

  /**
   * Constructs a new {@code RingCache} instance with default settings, which has no capacity and
   * does not record statistics.
   * <p>
   * Note that while this return type is {@code RingCache<Object, Object>}, type parameters on the
   * {@link #build} method allow you to create a cache of any key and value type desired.
   *
   * @return a new instance with default settings
   */
  @CheckReturnValue
  public static RingCache<Object, Object> newBuilder() {
    return new RingCache<>();
  }

  /**
   * Constructs a new {@code RingCache} instance with the settings specified in {@code spec}.
   *
   * @param spec the specification to build from
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static RingCache<Object, Object> from(RingCacheSpec spec) {
    return spec.toBuilder();
  }

  /**
   * Constructs a new {@code RingCache} instance with the settings specified in {@code spec}.
   *
   * @param spec a String in the format specified by {@link RingCacheSpec}
   * @return a new instance with the specification's settings
   */
  @CheckReturnValue
  public static RingCache<Object, Object> from(String spec) {
    return from(RingCacheSpec.parse(spec));
  }

  /**
   * Specifies the number of slots in the cache. When every slot has been written once, each
   * further write replaces the entry in the oldest slot.
   * <p>
   * The capacity must be greater than the number of threads that write to the cache concurrently.
   * This is not verified, and a smaller capacity may cause concurrent writers to overwrite each
   * other's entries.
   *
   * @param capacity the fixed number of entries the cache may contain
   * @return this {@code RingCache} instance (for chaining)
   * @throws IllegalArgumentException if {@code capacity} is not positive
   * @throws IllegalStateException if the capacity was already set
   */
  @CanIgnoreReturnValue
  public RingCache<K, V> capacity(int capacity) {
    requireState(this.capacity == UNSET_INT, "capacity was already set to %s", this.capacity);
    requireArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.capacity = capacity;
    return this;
  }

  /**
   * Enables the accumulation of {@link CacheStats} during the operation of the cache. Without this
   * {@link Cache#stats} will return zero for all statistics. Note that recording statistics
   * requires bookkeeping to be performed with each operation, and thus imposes a performance
   * penalty on cache operation.
   *
   * @return this {@code RingCache} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already set
   */
  @CanIgnoreReturnValue
  public RingCache<K, V> recordStats() {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    statsCounterSupplier = ENABLED_STATS_COUNTER_SUPPLIER;
    return this;
  }

  /**
   * Enables the accumulation of {@link CacheStats} during the operation of the cache. Without this
   * {@link Cache#stats} will return zero for all statistics. Note that recording statistics
   * requires bookkeeping to be performed with each operation, and thus imposes a performance
   * penalty on cache operation. Any exception thrown by the supplied {@link StatsCounter} will be
   * suppressed and logged.
   *
   * @param statsCounterSupplier a supplier instance that returns a new {@link StatsCounter}
   * @return this {@code RingCache} instance (for chaining)
   * @throws IllegalStateException if statistics recording was already set
   */
  @CanIgnoreReturnValue
  public RingCache<K, V> recordStats(Supplier<? extends StatsCounter> statsCounterSupplier) {
    requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
    requireNonNull(statsCounterSupplier);
    this.statsCounterSupplier = () -> StatsCounter.guardedStatsCounter(statsCounterSupplier.get());
    return this;
  }

  boolean isRecordingStats() {
    return (statsCounterSupplier != null);
  }

  Supplier<StatsCounter> getStatsCounterSupplier() {
    return (statsCounterSupplier == null)
        ? StatsCounter::disabledStatsCounter
        : statsCounterSupplier;
  }

  /**
   * Builds a cache which returns {@code absentValue} when a key is not found. The returned cache
   * has the configured capacity and allocates all of its slots up front.
   * <p>
   * This method does not alter the state of this {@code RingCache} instance, so it can be invoked
   * again to create multiple independent caches.
   *
   * @param absentValue the sentinel returned on a miss and written to logically delete a key
   * @param <K1> the key type of the cache
   * @param <V1> the value type of the cache
   * @return a cache having the requested features
   * @throws IllegalStateException if the capacity was not set
   * @throws NullPointerException if the absent value is null
   */
  @CheckReturnValue
  public <K1 extends K, V1 extends V> Cache<K1, V1> build(V1 absentValue) {
    requireState(capacity != UNSET_INT, "capacity must be set before building the cache");
    return new BoundedRingCache<>(capacity, absentValue, getStatsCounterSupplier().get());
  }

  /**
   * Returns a string representation for this RingCache instance. The exact form of the returned
   * string is not specified.
   */
  @Override
  public String toString() {
    StringBuilder s = new StringBuilder(40);
    s.append(getClass().getSimpleName()).append('{');
    int baseLength = s.length();
    if (capacity != UNSET_INT) {
      s.append("capacity=").append(capacity).append(", ");
    }
    if (statsCounterSupplier != null) {
      s.append("recordStats, ");
    }
    if (s.length() > baseLength) {
      s.setLength(s.length() - 2);
    }
    return s.append('}').toString();
  }
}
