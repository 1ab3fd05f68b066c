/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.resampling.cache;

import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.resampling.RequestSignature;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A bounded least-recently-used cache of views with the home view pinned.
///
/// The home view does not count against the capacity and is never evicted.
public class LruViewCache implements ViewCache {

    private static final Logger logger = LogManager.getLogger(LruViewCache.class);

    private final int capacity;
    private final LinkedHashMap<RequestSignature, LabeledArray> recent;
    private RequestSignature homeSignature;
    private LabeledArray homeView;

    /// @param capacity the number of views kept besides the home view, at least one
    public LruViewCache(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
        this.recent = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<RequestSignature, LabeledArray> eldest) {
                boolean evict = size() > LruViewCache.this.capacity;
                if (evict) {
                    logger.trace("evicting view {}", eldest.getKey());
                }
                return evict;
            }
        };
    }

    public int capacity() {
        return capacity;
    }

    @Override
    public Optional<LabeledArray> lookup(RequestSignature signature) {
        LabeledArray view = recent.get(signature);
        if (view != null) {
            return Optional.of(view);
        }
        if (homeSignature != null && homeSignature.equals(signature)) {
            return Optional.of(homeView);
        }
        return Optional.empty();
    }

    @Override
    public void store(RequestSignature signature, LabeledArray view) {
        Objects.requireNonNull(signature, "signature cannot be null");
        Objects.requireNonNull(view, "view cannot be null");
        if (homeSignature == null) {
            homeSignature = signature;
            homeView = view;
            return;
        }
        if (!homeSignature.equals(signature)) {
            recent.put(signature, view);
        }
    }

    @Override
    public Optional<RequestSignature> homeSignature() {
        return Optional.ofNullable(homeSignature);
    }

    @Override
    public int size() {
        return recent.size() + (homeSignature == null ? 0 : 1);
    }

    @Override
    public void clear() {
        recent.clear();
        homeSignature = null;
        homeView = null;
    }
}
