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

import static com.github.ringcache.cache.RingCache.requireArgument;
import static java.util.Objects.requireNonNull;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import org.jspecify.annotations.Nullable;

import com.github.ringcache.cache.stats.CacheStats;
import com.github.ringcache.cache.stats.StatsCounter;

/**
 * A fixed-capacity cache that stores entries in a ring of individually locked slots.
 *
 * @param <K> the type of keys maintained by this cache
 * @param <V> the type of mapped values
 */
final class BoundedRingCache<K, V> extends RCHeader.WrapStateRef implements Cache<K, V> {
  /*
   * The keys and values are held in two arrays indexed in lockstep, with a third array holding one
   * lock per slot. A slot's key and value are only written while its lock is held, so a reader
   * that validates the key under the same lock never observes a torn pair.
   *
   * Writers claim slots by atomically decrementing the shared write cursor, so the cursor always
   * refers to the most recently claimed slot and each writer observes a distinct index. When the
   * decrement produces a negative index the ring is exhausted. The writers that observe this
   * serialize on the wrap lock and decrement again: the first to still see a negative index resets
   * the cursor to the top of the ring, claims that slot, and marks the cache as wrapped. The
   * others obtain valid indices of the new lap from their second decrement. The slow path is taken
   * once per lap, so its cost is amortized over the capacity.
   *
   * Because slots are claimed downward, the slot at the cursor is the newest and the slots above
   * it are progressively older. The slots below the cursor belong to the previous lap, where index
   * zero is the newest. A reader scans from the cursor to the top and then, if the ring has
   * wrapped, from the bottom up to the cursor, so the first confirmed match is the most recent
   * completed write for the key. The key is first compared without locking, and only an apparent
   * match pays for the lock and the re-check. If the re-check fails then the slot was overwritten
   * in between and the lookup ends as a miss.
   *
   * A slot that a writer has claimed but not yet filled still holds the previous lap's entry, the
   * oldest in the ring. While that write is in flight a lookup may confirm the stale entry ahead of
   * a newer duplicate below the cursor. Starting the scan one past the cursor would avoid this, but
   * then a thread could not read back its own latest write.
   *
   * The cursor is read by lookups without synchronization, so a lookup may scan from a stale
   * position and miss a slot claimed after it started. Such a write is concurrent with the lookup,
   * so the miss is a valid outcome. Likewise a stale read of the wrapped flag only skips the
   * previous lap's slots before any exist.
   *
   * Writers must be fewer than the slots. Otherwise a writer could lap a slower writer that has
   * claimed but not yet filled its slot, and both would write to the same index within a lap.
   */

  static final Logger logger = System.getLogger(BoundedRingCache.class.getName());
  static final VarHandle SLOT = MethodHandles.arrayElementVarHandle(Object[].class);

  final StatsCounter statsCounter;
  final ReentrantLock[] locks;
  final ReentrantLock wrapLock;
  final @Nullable Object[] keys;
  final Object[] values;
  final V absentValue;
  final int capacity;

  BoundedRingCache(int capacity, V absentValue, StatsCounter statsCounter) {
    requireArgument(capacity > 0, "capacity must be positive: %s", capacity);
    this.absentValue = requireNonNull(absentValue);
    this.statsCounter = requireNonNull(statsCounter);
    this.capacity = capacity;

    keys = new Object[capacity];
    values = new Object[capacity];
    locks = new ReentrantLock[capacity];
    for (int i = 0; i < capacity; i++) {
      values[i] = absentValue;
      locks[i] = new ReentrantLock();
    }
    wrapLock = new ReentrantLock();
    setWriteCursorRelease(capacity);
  }

  @Override
  public V get(K key) {
    requireNonNull(key);
    V value = lookup(key);
    if ((value == null) || isAbsent(value)) {
      statsCounter.recordMisses(1);
      return absentValue;
    }
    statsCounter.recordHits(1);
    return value;
  }

  @Override
  public V get(K key, Function<? super K, ? extends @Nullable V> mappingFunction) {
    requireNonNull(mappingFunction);
    V value = get(key);
    if (!isAbsent(value)) {
      return value;
    }
    V computed = mappingFunction.apply(key);
    if ((computed == null) || isAbsent(computed)) {
      return absentValue;
    }
    put(key, computed);
    return computed;
  }

  @Override
  public void put(K key, V value) {
    requireNonNull(key);
    requireNonNull(value);

    int index = claimSlot();
    var lock = locks[index];
    lock.lock();
    try {
      values[index] = value;
      SLOT.setRelease(keys, index, key);
    } finally {
      lock.unlock();
    }
    statsCounter.recordPuts(1);
  }

  @Override
  public void invalidate(K key) {
    put(key, absentValue);
  }

  @Override
  public V absentValue() {
    return absentValue;
  }

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public CacheStats stats() {
    return statsCounter.snapshot();
  }

  /** Returns if the value is the absent value, or a logical deletion that wrote an equal one. */
  boolean isAbsent(Object value) {
    return (value == absentValue) || absentValue.equals(value);
  }

  /** Returns the index of a slot that is exclusively owned by the caller for the current lap. */
  int claimSlot() {
    int index = decrementWriteCursor();
    return (index >= 0) ? index : wrap();
  }

  /** Claims a slot after the cursor was exhausted, resetting it if no other writer has. */
  int wrap() {
    boolean reset;
    int index;

    wrapLock.lock();
    try {
      index = decrementWriteCursor();
      reset = (index < 0);
      if (reset) {
        index = capacity - 1;
        setWriteCursorRelease(index);
        setWrappedRelease();
      }
    } finally {
      wrapLock.unlock();
    }

    if (reset) {
      statsCounter.recordWrap();
      logger.log(Level.TRACE, "Ring of {0} slots wrapped around", capacity);
    }
    return index;
  }

  /**
   * Returns the most recently written value for the key, or {@code null} if there is no entry or if
   * the first apparent match was overwritten before it could be confirmed.
   */
  @Nullable V lookup(Object key) {
    int head = Math.max(0, writeCursorOpaque());
    for (int i = head; i < capacity; i++) {
      if (key.equals(SLOT.getAcquire(keys, i))) {
        return readSlot(i, key);
      }
    }
    if (!wrappedOpaque()) {
      return null;
    }
    for (int i = 0; i < head; i++) {
      if (key.equals(SLOT.getAcquire(keys, i))) {
        return readSlot(i, key);
      }
    }
    return null;
  }

  /** Returns the slot's value if it still holds the key, else {@code null}. */
  @SuppressWarnings("unchecked")
  @Nullable V readSlot(int index, Object key) {
    var lock = locks[index];
    lock.lock();
    try {
      return key.equals(keys[index]) ? (V) values[index] : null;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return getClass().getSimpleName() + '{'
        + "capacity=" + capacity + ", "
        + "wrapped=" + wrappedOpaque() + ", "
        + "absentValue=" + absentValue
        + '}';
  }
}

/** The namespace for field padding through inheritance. */
final class RCHeader {

  @SuppressWarnings("PMD.AbstractClassWithoutAbstractMethod")
  abstract static class PadWriteCursor {
    byte p000, p001, p002, p003, p004, p005, p006, p007;
    byte p008, p009, p010, p011, p012, p013, p014, p015;
    byte p016, p017, p018, p019, p020, p021, p022, p023;
    byte p024, p025, p026, p027, p028, p029, p030, p031;
    byte p032, p033, p034, p035, p036, p037, p038, p039;
    byte p040, p041, p042, p043, p044, p045, p046, p047;
    byte p048, p049, p050, p051, p052, p053, p054, p055;
    byte p056, p057, p058, p059, p060, p061, p062, p063;
    byte p064, p065, p066, p067, p068, p069, p070, p071;
    byte p072, p073, p074, p075, p076, p077, p078, p079;
    byte p080, p081, p082, p083, p084, p085, p086, p087;
    byte p088, p089, p090, p091, p092, p093, p094, p095;
    byte p096, p097, p098, p099, p100, p101, p102, p103;
    byte p104, p105, p106, p107, p108, p109, p110, p111;
    byte p112, p113, p114, p115, p116, p117, p118, p119;
  }

  /** Enforces a memory layout to avoid false sharing by padding the write cursor. */
  abstract static class WriteCursorRef extends PadWriteCursor {
    volatile int writeCursor;
  }

  abstract static class PadWrapState extends WriteCursorRef {
    byte p120, p121, p122, p123, p124, p125, p126, p127;
    byte p128, p129, p130, p131, p132, p133, p134, p135;
    byte p136, p137, p138, p139, p140, p141, p142, p143;
    byte p144, p145, p146, p147, p148, p149, p150, p151;
    byte p152, p153, p154, p155, p156, p157, p158, p159;
    byte p160, p161, p162, p163, p164, p165, p166, p167;
    byte p168, p169, p170, p171, p172, p173, p174, p175;
    byte p176, p177, p178, p179, p180, p181, p182, p183;
    byte p184, p185, p186, p187, p188, p189, p190, p191;
    byte p192, p193, p194, p195, p196, p197, p198, p199;
    byte p200, p201, p202, p203, p204, p205, p206, p207;
    byte p208, p209, p210, p211, p212, p213, p214, p215;
    byte p216, p217, p218, p219, p220, p221, p222, p223;
    byte p224, p225, p226, p227, p228, p229, p230, p231;
    byte p232, p233, p234, p235, p236, p237, p238, p239;
  }

  /** Keeps the read-mostly wrapped flag off the cursor's cache line. */
  abstract static class WrapStateRef extends PadWrapState {
    static final VarHandle WRITE_CURSOR = findVarHandle(
        WriteCursorRef.class, "writeCursor", int.class);
    static final VarHandle WRAPPED = findVarHandle(WrapStateRef.class, "wrapped", boolean.class);

    volatile boolean wrapped;

    /** Decrements the cursor and returns the claimed index, which may be negative. */
    int decrementWriteCursor() {
      return (int) WRITE_CURSOR.getAndAdd(this, -1) - 1;
    }

    int writeCursorOpaque() {
      return (int) WRITE_CURSOR.getOpaque(this);
    }

    void setWriteCursorRelease(int index) {
      WRITE_CURSOR.setRelease(this, index);
    }

    boolean wrappedOpaque() {
      return (boolean) WRAPPED.getOpaque(this);
    }

    void setWrappedRelease() {
      WRAPPED.setRelease(this, true);
    }

    static VarHandle findVarHandle(Class<?> recv, String name, Class<?> type) {
      try {
        return MethodHandles.lookup().findVarHandle(recv, name, type);
      } catch (ReflectiveOperationException e) {
        throw new ExceptionInInitializerError(e);
      }
    }
  }
}
