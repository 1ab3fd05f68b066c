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

import java.util.Objects;
import java.util.Optional;

/// Keeps exactly two views: the home view and the most recent one.
///
/// Panning and zooming always produce a new last view, while returning to the initial
/// view is served from the home slot.
public class HomeAndLastViewCache implements ViewCache {

    private RequestSignature homeSignature;
    private LabeledArray homeView;
    private RequestSignature lastSignature;
    private LabeledArray lastView;

    @Override
    public Optional<LabeledArray> lookup(RequestSignature signature) {
        if (lastSignature != null && lastSignature.equals(signature)) {
            return Optional.of(lastView);
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
        }
        lastSignature = signature;
        lastView = view;
    }

    @Override
    public Optional<RequestSignature> homeSignature() {
        return Optional.ofNullable(homeSignature);
    }

    @Override
    public int size() {
        if (homeSignature == null) {
            return 0;
        }
        return homeSignature.equals(lastSignature) ? 1 : 2;
    }

    @Override
    public void clear() {
        homeSignature = null;
        homeView = null;
        lastSignature = null;
        lastView = null;
    }
}
