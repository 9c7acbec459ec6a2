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

import static com.google.common.truth.Truth.assertThat;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.testng.Assert.assertThrows;

import org.mockito.Mockito;
import org.testng.annotations.Test;

import com.github.ringcache.cache.stats.CacheStats;
import com.github.ringcache.cache.stats.ConcurrentStatsCounter;
import com.github.ringcache.cache.stats.StatsCounter;

/**
 * A test for the builder methods.
 */
public final class RingCacheTest {

  @Test
  public void unconfigured() {
    var builder = RingCache.newBuilder();
    assertThat(builder.isRecordingStats()).isFalse();
    assertThat(builder.toString()).isEqualTo("RingCache{}");
    assertThrows(IllegalStateException.class, () -> builder.build(-1));
  }

  @Test
  public void configured() {
    var builder = RingCache.newBuilder().capacity(3).recordStats();
    assertThat(builder.isRecordingStats()).isTrue();
    assertThat(builder.toString()).isEqualTo("RingCache{capacity=3, recordStats}");
  }

  @Test
  public void configured_single() {
    assertThat(RingCache.newBuilder().capacity(3).toString()).isEqualTo("RingCache{capacity=3}");
    assertThat(RingCache.newBuilder().recordStats().toString()).isEqualTo("RingCache{recordStats}");
  }

  @Test
  public void capacity_negative() {
    var builder = RingCache.newBuilder();
    assertThrows(IllegalArgumentException.class, () -> builder.capacity(-1));
  }

  @Test
  public void capacity_zero() {
    var builder = RingCache.newBuilder();
    assertThrows(IllegalArgumentException.class, () -> builder.capacity(0));
  }

  @Test
  public void capacity_twice() {
    var builder = RingCache.newBuilder().capacity(1);
    assertThrows(IllegalStateException.class, () -> builder.capacity(2));
  }

  @Test
  public void build() {
    Cache<Integer, Integer> cache = RingCache.newBuilder().capacity(3).build(-1);
    assertThat(cache.capacity()).isEqualTo(3);
    assertThat(cache.absentValue()).isEqualTo(-1);
    assertThat(cache.stats()).isEqualTo(CacheStats.empty());

    cache.put(1, 10);
    assertThat(cache.get(1)).isEqualTo(10);
    assertThat(cache.get(2)).isEqualTo(-1);
  }

  @Test
  public void build_independentCaches() {
    var builder = RingCache.newBuilder().capacity(3);
    Cache<String, String> first = builder.build("");
    Cache<String, String> second = builder.build("");

    first.put("a", "b");
    assertThat(first.get("a")).isEqualTo("b");
    assertThat(second.get("a")).isEmpty();
  }

  @Test
  @SuppressWarnings("NullAway")
  public void build_nullAbsentValue() {
    var builder = RingCache.newBuilder().capacity(3);
    assertThrows(NullPointerException.class, () -> builder.build(null));
  }

  @Test
  public void recordStats() {
    Cache<Integer, Integer> cache = RingCache.newBuilder().capacity(2).recordStats().build(-1);
    cache.put(1, 10);
    assertThat(cache.get(1)).isEqualTo(10);
    assertThat(cache.get(2)).isEqualTo(-1);
    assertThat(cache.stats()).isEqualTo(CacheStats.of(1, 1, 1, 0));
  }

  @Test
  public void recordStats_twice() {
    var builder = RingCache.newBuilder().recordStats();
    assertThrows(IllegalStateException.class, builder::recordStats);
    assertThrows(IllegalStateException.class, () ->
        builder.recordStats(ConcurrentStatsCounter::new));
  }

  @Test
  @SuppressWarnings("NullAway")
  public void recordStats_nullSupplier() {
    var builder = RingCache.newBuilder();
    assertThrows(NullPointerException.class, () -> builder.recordStats(null));
  }

  @Test
  public void recordStats_custom() {
    var statsCounter = Mockito.mock(StatsCounter.class);
    when(statsCounter.snapshot()).thenReturn(CacheStats.of(7, 0, 0, 0));
    Cache<Integer, Integer> cache = RingCache.newBuilder()
        .capacity(1)
        .recordStats(() -> statsCounter)
        .build(-1);

    cache.put(1, 10);
    assertThat(cache.get(1)).isEqualTo(10);
    assertThat(cache.get(2)).isEqualTo(-1);
    cache.put(2, 20);

    verify(statsCounter, atLeastOnce()).recordPuts(1);
    verify(statsCounter).recordHits(1);
    verify(statsCounter).recordMisses(1);
    verify(statsCounter).recordWrap();
    assertThat(cache.stats()).isEqualTo(CacheStats.of(7, 0, 0, 0));
  }

  @Test
  public void recordStats_customFailing() {
    var statsCounter = Mockito.mock(StatsCounter.class);
    Mockito.doThrow(IllegalStateException.class).when(statsCounter).recordPuts(1);
    Mockito.doThrow(IllegalStateException.class).when(statsCounter).recordHits(1);
    Cache<Integer, Integer> cache = RingCache.newBuilder()
        .capacity(1)
        .recordStats(() -> statsCounter)
        .build(-1);

    cache.put(1, 10);
    assertThat(cache.get(1)).isEqualTo(10);
  }

  @Test
  public void fromSpec() {
    var builder = RingCache.from(RingCacheSpec.parse("capacity=5, recordStats"));
    assertThat(builder.capacity).isEqualTo(5);
    assertThat(builder.isRecordingStats()).isTrue();
  }

  @Test
  public void fromString() {
    Cache<Integer, Integer> cache = RingCache.from("capacity=2").build(-1);
    assertThat(cache.capacity()).isEqualTo(2);
    assertThat(cache.stats()).isEqualTo(CacheStats.empty());
  }

  @Test
  public void fromString_empty() {
    var builder = RingCache.from("");
    assertThat(builder.capacity).isEqualTo(RingCache.UNSET_INT);
    assertThat(builder.isRecordingStats()).isFalse();
  }
}
