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
 * This package contains caching statistic utilities.
 * <p>
 * Statistics are recorded only when enabled through
 * {@link com.github.ringcache.cache.RingCache#recordStats()}, and are read as an immutable
 * {@link com.github.ringcache.cache.stats.CacheStats} snapshot.
 */
@NullMarked
@CheckReturnValue
package com.github.ringcache.cache.stats;

import org.jspecify.annotations.NullMarked;

import com.google.errorprone.annotations.CheckReturnValue;
