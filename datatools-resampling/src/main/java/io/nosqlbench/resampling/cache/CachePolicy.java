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

import com.google.gson.annotations.SerializedName;

/// Selects the [ViewCache] implementation of a policy.
public enum CachePolicy {
    /// [HomeAndLastViewCache]
    @SerializedName("home_last")
    HOME_LAST,
    /// [LruViewCache]
    @SerializedName("lru")
    LRU;

    /// @param capacity LRU capacity; ignored by [#HOME_LAST]
    public ViewCache create(int capacity) {
        return this == LRU ? new LruViewCache(capacity) : new HomeAndLastViewCache();
    }
}
