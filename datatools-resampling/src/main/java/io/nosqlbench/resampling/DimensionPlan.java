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

package io.nosqlbench.resampling;

import io.nosqlbench.arrays.Unit;

/// What a view does with one dimension, after the request has been resolved against the
/// source coordinates.
///
/// Plans are value objects: two requests that resolve to equal plans for every
/// dimension produce the same view.
public sealed interface DimensionPlan permits DimensionPlan.Select, DimensionPlan.Window, DimensionPlan.Resample {

    /// One index selected, dimension dropped.
    record Select(int index) implements DimensionPlan {
    }

    /// Index window `[start, stop)`, dimension kept as is.
    record Window(int start, int stop) implements DimensionPlan {
    }

    /// Coordinate range `[low, high]` in coordinate direction, resampled into `resolution` bins.
    ///
    /// @param requested the explicitly requested resolution, or `null` when the default applies
    record Resample(double low, double high, Unit unit, Integer requested, int resolution) implements DimensionPlan {

        /// True if the dimension is dropped from the view after resampling.
        public boolean squeezes() {
            return requested == null && resolution == 1;
        }
    }
}
