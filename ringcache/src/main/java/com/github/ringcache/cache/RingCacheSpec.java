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

import static com.github.ringcache.cache.RingCache.UNSET_INT;
import static com.github.ringcache.cache.RingCache.requireArgument;
import static java.util.Objects.requireNonNull;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

/**
 * A specification of a {@link RingCache} builder configuration.
 * <p>
 * {@code RingCacheSpec} supports parsing configuration off of a string, which makes it especially
 * useful for command-line configuration of a {@code RingCache} builder.
 * <p>
 * The string syntax is a series of comma-separated keys or key-value pairs, each corresponding to a
 * {@code RingCache} builder method.
 * <ul>
 *   <li>{@code capacity=[integer]}: sets {@link RingCache#capacity}.
 *   <li>{@code recordStats}: sets {@link RingCache#recordStats()}.
 * </ul>
 * <p>
 * Whitespace before and after commas and equal signs is ignored. Keys may not be repeated.
 * <p>
 * {@code RingCacheSpec} does not support configuring {@code RingCache} methods with non-value
 * parameters, such as a custom statistics counter, nor the absent value. These must be configured
 * in code.
 * <p>
 * A new {@code RingCache} builder can be instantiated from a {@code RingCacheSpec} using
 * {@link RingCache#from(RingCacheSpec)} or {@link RingCache#from(String)}.
 */
public final class RingCacheSpec {
  static final String SPLIT_OPTIONS = ",";
  static final String SPLIT_KEY_VALUE = "=";

  final String specification;

  int capacity = UNSET_INT;
  boolean recordStats;

  private RingCacheSpec(String specification) {
    this.specification = requireNonNull(specification);
  }

  /**
   * Returns a {@link RingCache} builder configured according to this specification.
   *
   * @return a builder configured to the specification
   */
  RingCache<Object, Object> toBuilder() {
    RingCache<Object, Object> builder = RingCache.newBuilder();
    if (capacity != UNSET_INT) {
      builder.capacity(capacity);
    }
    if (recordStats) {
      builder.recordStats();
    }
    return builder;
  }

  /**
   * Creates a RingCacheSpec from a string.
   *
   * @param specification the string form
   * @return the parsed specification
   * @throws IllegalArgumentException if the specification is malformed
   */
  @SuppressWarnings("StringSplitter")
  public static RingCacheSpec parse(String specification) {
    RingCacheSpec spec = new RingCacheSpec(specification);
    for (String option : specification.split(SPLIT_OPTIONS)) {
      spec.parseOption(option.trim());
    }
    return spec;
  }

  /** Parses and applies the configuration option. */
  void parseOption(String option) {
    if (option.isEmpty()) {
      return;
    }

    @SuppressWarnings("StringSplitter")
    String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
    requireArgument(keyAndValue.length <= 2,
        "key-value pair %s with more than one equals sign", option);

    String key = keyAndValue[0].trim();
    String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();

    configure(key, value);
  }

  /** Configures the setting. */
  void configure(String key, @Nullable String value) {
    switch (key) {
      case "capacity":
        capacity(key, value);
        return;
      case "recordStats":
        recordStats(value);
        return;
      default:
        throw new IllegalArgumentException("Unknown key " + key);
    }
  }

  /** Configures the number of slots. */
  void capacity(String key, @Nullable String value) {
    requireArgument(capacity == UNSET_INT, "capacity was already set to %,d", capacity);
    int parsed = parseInt(key, value);
    requireArgument(parsed > 0, "key %s value was set to %s, must be positive", key, value);
    capacity = parsed;
  }

  /** Configures statistics recording. */
  void recordStats(@Nullable String value) {
    requireArgument(value == null, "record stats does not take a value");
    requireArgument(!recordStats, "record stats was already set");
    recordStats = true;
  }

  /** Returns a parsed int value. */
  static int parseInt(String key, @Nullable String value) {
    requireArgument((value != null) && !value.isEmpty(), "value of key %s was omitted", key);
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(String.format(
          "key %s value was set to %s, must be an integer", key, value), e);
    }
  }

  @Override
  public boolean equals(@Nullable Object o) {
    if (this == o) {
      return true;
    } else if (!(o instanceof RingCacheSpec)) {
      return false;
    }
    RingCacheSpec spec = (RingCacheSpec) o;
    return (capacity == spec.capacity) && (recordStats == spec.recordStats);
  }

  @Override
  public int hashCode() {
    return Objects.hash(capacity, recordStats);
  }

  /**
   * Returns a string that can be used to parse an equivalent {@code RingCacheSpec}. The order and
   * form of this representation is not guaranteed, except that parsing its output will produce a
   * {@code RingCacheSpec} equal to this instance.
   *
   * @return a string representation of this specification
   */
  public String toParsableString() {
    return specification;
  }

  /**
   * Returns a string representation for this {@code RingCacheSpec} instance. The form of this
   * representation is not guaranteed.
   */
  @Override
  public String toString() {
    return getClass().getSimpleName() + '{' + toParsableString() + '}';
  }
}
