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

import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.github.ringcache.cache.stats.CacheStats;

/**
 * A fixed-capacity mapping from keys to values with first-in, first-out replacement. Entries are
 * added using {@link #put(Object, Object)} or {@link #get(Object, Function)} and remain in the
 * cache until the ring of slots wraps around and their slot is reused.
 * <p>
 * A lookup that finds no entry returns the {@linkplain #absentValue() absent value} configured when
 * the cache was built. Writing the absent value for a key is the only form of removal.
 * <p>
 * Writing a key that is already present does not replace the existing slot; the newer entry is
 * stored in a fresh slot and shadows the older one until the older slot is overwritten. Workloads
 * that update the same keys frequently therefore waste capacity on stale duplicates.
 * <p>
 * Implementations of this interface are thread-safe, provided that the number of threads writing
 * concurrently is smaller than the {@linkplain #capacity() capacity}. This precondition is not
 * checked; violating it may let two writers claim the same slot within a lap.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
public interface Cache<K, V> {

  /**
   * Returns the value most recently associated with the {@code key}, or the
   * {@linkplain #absentValue() absent value} if there is no such entry in the cache.
   *
   * @param key the key whose associated value is to be returned
   * @return the value to which the specified key is mapped, or the absent value if this cache
   *         contains no live entry for the key
   * @throws NullPointerException if the specified key is null
   */
  V get(K key);

  /**
   * Returns the value associated with the {@code key} in this cache, obtaining that value from the
   * {@code mappingFunction} if necessary.
   * <p>
   * Unlike a {@link java.util.concurrent.ConcurrentMap#computeIfAbsent} this method is not atomic.
   * Concurrent callers that miss on the same key may each invoke the function, and each result is
   * written to the cache. A computed value that is {@code null} or equal to the absent value is
   * returned as the absent value and is not stored.
   *
   * @param key the key with which the specified value is to be associated
   * @param mappingFunction the function to compute a value
   * @return the current (existing or computed) value associated with the specified key, or the
   *         absent value if the computed value is null or absent
   * @throws NullPointerException if the specified key or mappingFunction is null
   * @throws RuntimeException or Error if the mappingFunction does so, in which case nothing is
   *         stored
   */
  V get(K key, Function<? super K, ? extends @Nullable V> mappingFunction);

  /**
   * Associates the {@code value} with the {@code key} in this cache by claiming the next slot of
   * the ring. If the ring is exhausted the oldest slot is overwritten.
   *
   * @param key the key with which the specified value is to be associated
   * @param value value to be associated with the specified key
   * @throws NullPointerException if the specified key or value is null
   */
  void put(K key, V value);

  /**
   * Logically discards the entry for the {@code key} by writing the absent value for it. The
   * superseded entries remain in their slots until overwritten, but are no longer returned.
   *
   * @param key the key whose mapping is to be discarded
   * @throws NullPointerException if the specified key is null
   */
  void invalidate(K key);

  /**
   * Returns the sentinel value returned by lookups that miss. Callers distinguish a hit from a miss
   * by comparing against this value.
   *
   * @return the value representing an absent entry
   */
  V absentValue();

  /**
   * Returns the fixed number of slots in this cache.
   *
   * @return the maximum number of entries that can be held at once
   */
  int capacity();

  /**
   * Returns a current snapshot of this cache's cumulative statistics. All statistics are
   * initialized to zero and are monotonically increasing over the lifetime of the cache.
   * <p>
   * Due to the performance penalty of maintaining statistics, some implementations may not record
   * the usage history immediately or at all.
   *
   * @return the current snapshot of the statistics of this cache
   */
  CacheStats stats();
}
