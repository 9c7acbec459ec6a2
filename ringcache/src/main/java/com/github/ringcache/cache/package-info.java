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

/**
 * This package contains a fixed-capacity, concurrent cache with first-in, first-out replacement.
 * All caches are configured and created using the {@link com.github.ringcache.cache.RingCache}
 * builder.
 * <p>
 * A {@link com.github.ringcache.cache.Cache} stores its entries in a ring of slots that writers
 * claim by decrementing a shared cursor, so that writes to different keys do not contend on a
 * common lock. When the ring is exhausted the cursor wraps and the oldest slots are overwritten.
 * A lookup that finds nothing returns the cache's configured absent value rather than
 * {@code null}.
 */
@NullMarked
@CheckReturnValue
package com.github.ringcache.cache;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
