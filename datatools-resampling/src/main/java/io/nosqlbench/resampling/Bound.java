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

import io.nosqlbench.arrays.Quantity;

import java.util.Objects;

/// The requested extent of one dimension of a view.
///
/// | Bound | Effect on the dimension | Resampled |
/// |-------|-------------------------|-----------|
/// | [#index(int)] | selects one index and drops the dimension | no |
/// | [#indexRange(int, int)] | selects the index window `[start, stop)` | no |
/// | [#full()] | the whole coordinate range | yes |
/// | [#range(Quantity, Quantity)] | the coordinate range between two values | yes |
///
/// A `null` bound in [ResamplingPolicy#bounds()] means [#full()].
public sealed interface Bound permits Bound.Index, Bound.IndexRange, Bound.Full, Bound.ValueRange {

    static Bound index(int index) {
        return new Index(index);
    }

    static Bound indexRange(int start, int stop) {
        return new IndexRange(start, stop);
    }

    static Bound full() {
        return Full.INSTANCE;
    }

    /// A coordinate range; the ends may be given in either order.
    static Bound range(Quantity low, Quantity high) {
        return new ValueRange(low, high);
    }

    record Index(int index) implements Bound {
    }

    record IndexRange(int start, int stop) implements Bound {
    }

    final class Full implements Bound {
        private static final Full INSTANCE = new Full();

        private Full() {
        }

        @Override
        public String toString() {
            return "Full";
        }
    }

    record ValueRange(Quantity low, Quantity high) implements Bound {
        public ValueRange {
            Objects.requireNonNull(low, "low cannot be null");
            Objects.requireNonNull(high, "high cannot be null");
        }
    }
}
