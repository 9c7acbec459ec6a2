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
package com.github.ringcache.cache.stats;

import static com.google.common.truth.Truth.assertThat;
import static org.testng.Assert.assertThrows;

import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import com.google.common.testing.EqualsTester;

public final class CacheStatsTest {

  @Test(dataProvider = "badArgs")
  public void invalid(int hitCount, int missCount, int putCount, int wrapCount) {
    assertThrows(IllegalArgumentException.class, () ->
        CacheStats.of(hitCount, missCount, putCount, wrapCount));
  }

  @Test
  public void empty() {
    var stats = CacheStats.of(0, 0, 0, 0);
    checkStats(stats, 0, 0, 1.0, 0, 0.0, 0, 0);

    assertThat(stats).isEqualTo(CacheStats.empty());
    assertThat(stats.toString()).isEqualTo(CacheStats.empty().toString());
  }

  @Test
  public void populated() {
    var stats = CacheStats.of(11, 13, 17, 19);
    checkStats(stats, 24, 11, 11.0 / 24, 13, 13.0 / 24, 17, 19);

    assertThat(stats.minus(CacheStats.empty())).isEqualTo(stats);
    assertThat(stats.plus(CacheStats.empty())).isEqualTo(stats);
    assertThat(stats.toString())
        .isEqualTo("CacheStats{hitCount=11, missCount=13, putCount=17, wrapCount=19}");
  }

  @Test
  public void minus() {
    var one = CacheStats.of(11, 13, 17, 19);
    var two = CacheStats.of(53, 47, 43, 41);
    var diff = two.minus(one);
    checkStats(diff, 76, 42, 42.0 / 76, 34, 34.0 / 76, 26, 22);
    assertThat(one.minus(two)).isEqualTo(CacheStats.empty());
  }

  @Test
  public void plus() {
    var one = CacheStats.of(11, 13, 15, 13);
    var two = CacheStats.of(53, 47, 41, 39);
    var sum = two.plus(one);
    checkStats(sum, 124, 64, 64.0 / 124, 60, 60.0 / 124, 56, 52);
    assertThat(sum).isEqualTo(one.plus(two));
  }

  @Test
  public void overflow() {
    var max = CacheStats.of(Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE, Long.MAX_VALUE);
    checkStats(max.plus(max), Long.MAX_VALUE, Long.MAX_VALUE, 1.0,
        Long.MAX_VALUE, 1.0, Long.MAX_VALUE, Long.MAX_VALUE);
  }

  @Test
  public void equality() {
    new EqualsTester()
        .addEqualityGroup(CacheStats.of(0, 0, 0, 0), CacheStats.empty())
        .addEqualityGroup(CacheStats.of(1, 0, 0, 0), CacheStats.of(1, 0, 0, 0))
        .addEqualityGroup(CacheStats.of(0, 1, 0, 0))
        .addEqualityGroup(CacheStats.of(0, 0, 1, 0))
        .addEqualityGroup(CacheStats.of(0, 0, 0, 1))
        .testEquals();
  }

  private static void checkStats(CacheStats stats, long requestCount, long hitCount,
      double hitRate, long missCount, double missRate, long putCount, long wrapCount) {
    assertThat(stats.requestCount()).isEqualTo(requestCount);
    assertThat(stats.hitCount()).isEqualTo(hitCount);
    assertThat(stats.hitRate()).isEqualTo(hitRate);
    assertThat(stats.missCount()).isEqualTo(missCount);
    assertThat(stats.missRate()).isEqualTo(missRate);
    assertThat(stats.putCount()).isEqualTo(putCount);
    assertThat(stats.wrapCount()).isEqualTo(wrapCount);
  }

  @DataProvider(name = "badArgs")
  public Object[][] providesBadArgs() {
    return new Object[][] {
        { -1,  0,  0,  0 },
        {  0, -1,  0,  0 },
        {  0,  0, -1,  0 },
        {  0,  0,  0, -1 },
    };
  }
}
