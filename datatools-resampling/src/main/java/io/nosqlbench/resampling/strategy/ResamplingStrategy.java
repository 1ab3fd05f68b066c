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

package io.nosqlbench.resampling.strategy;

import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.resampling.ResamplingMode;

import java.util.List;

/// Computes a resampled view of an array for a list of target edges.
///
/// Implementations are stateless apart from their [ArrayEngine] and never modify the
/// array they are given.
public interface ResamplingStrategy {

    /// Resamples `array` onto `edges`.
    ///
    /// @param array the source, already restricted to the requested windows and indices
    /// @param edges one-dimensional target edges, each named by its dimension, in plan order
    /// @param mode the aggregation mode; [ResamplingMode#AUTO] is resolved against the array unit
    /// @return a dense array with the target edges as coordinates of the resampled dimensions
    LabeledArray resample(LabeledArray array, List<Variable> edges, ResamplingMode mode);

    /// Selects the strategy for dense or binned arrays.
    static ResamplingStrategy forArray(LabeledArray array, ArrayEngine engine) {
        return array.isBinned() ? new BinnedResamplingStrategy(engine) : new DenseResamplingStrategy(engine);
    }
}
