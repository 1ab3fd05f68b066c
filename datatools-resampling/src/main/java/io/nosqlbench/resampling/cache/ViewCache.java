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

import java.util.Optional;

/// Computed views keyed by their request signature.
///
/// The first view stored after construction or [#clear()] is the *home* view. Every
/// implementation retains the home view until the next [#clear()].
public interface ViewCache {

    Optional<LabeledArray> lookup(RequestSignature signature);

    /// Stores a freshly computed view. It becomes the home view if there is none.
    void store(RequestSignature signature, LabeledArray view);

    Optional<RequestSignature> homeSignature();

    /// Number of retained views.
    int size();

    void clear();
}
