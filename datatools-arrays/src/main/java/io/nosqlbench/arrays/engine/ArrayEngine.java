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

package io.nosqlbench.arrays.engine;

import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Quantity;
import io.nosqlbench.arrays.Variable;

import java.util.List;

/// # ArrayEngine
///
/// Numeric primitives that resampling is built on.
///
/// ## Contract
///
/// | Operation | Input | Output |
/// |-----------|-------|--------|
/// | [#rebin(Variable, String, Variable, Variable)] | dense block, old and new bin edges | dense block, sum aggregated |
/// | [#rebin(Mask, String, Variable, Variable)] | mask, old and new bin edges | mask, OR aggregated |
/// | [#bin] | binned array, ordered edge list | binned array |
/// | [#histogram] | binned array, edges of one event coordinate | dense array |
/// | [#reduceBins] | binned array | dense array |
/// | [#locate] | monotonic edges, value | insertion index |
///
/// Implementations never mutate their inputs. Every call returns freshly allocated
/// results, so earlier results stay valid.
///
/// Wrapping an engine is the intended way to observe or instrument primitive calls.
public interface ArrayEngine {

    /// Side of a [#locate] search, as in a sorted-array insertion search.
    enum Side {
        /// First position whose edge is not before the value.
        LEFT,
        /// First position whose edge is after the value.
        RIGHT
    }

    /// Sum-aggregates `data` from `oldEdges` to `newEdges` along `dim`.
    ///
    /// Each old bin contributes to each new bin in proportion to their overlap. Old
    /// edges may have more dimensions than `dim` (a coordinate varying along another
    /// dimension of the data); new edges are one-dimensional. Both edge sets must be
    /// sorted in the same direction.
    ///
    /// @param data the values to rebin; variances are rebinned the same way
    /// @param dim the dimension to rebin
    /// @param oldEdges edges with extent `data.size(dim) + 1` along `dim`
    /// @param newEdges one-dimensional target edges along `dim`
    /// @return the rebinned values
    /// @throws io.nosqlbench.arrays.ShapeException if the edges are not edge shaped or not sorted
    /// @throws io.nosqlbench.arrays.UnitException if the edge units differ
    /// @throws io.nosqlbench.arrays.DimensionException if `dim` is not a data dimension
    Variable rebin(Variable data, String dim, Variable oldEdges, Variable newEdges);

    /// Rebins a mask: a new bin is masked if any overlapping old bin is masked.
    Mask rebin(Mask mask, String dim, Variable oldEdges, Variable newEdges);

    /// Partitions the events of a binned array into nested bins.
    ///
    /// Edge dimensions form the inner dimensions of the result in list order. Outer
    /// dimensions of the input that have no edges are kept. An event is placed using its
    /// own coordinate for an edge dimension, or the centre of its outer cell when the
    /// event table has no such coordinate. Bins are right-open and events outside the
    /// edges are dropped.
    ///
    /// @param binned a binned array
    /// @param edges one-dimensional edges, each named by its only dimension
    /// @return a binned array over the new cells
    LabeledArray bin(LabeledArray binned, List<Variable> edges);

    /// Sums the event weights of a binned array into bins of one event coordinate.
    ///
    /// @param binned a binned array whose events have a coordinate named like the edges' dimension
    /// @param edges one-dimensional edges
    /// @return a dense array with the edge dimension innermost
    LabeledArray histogram(LabeledArray binned, Variable edges);

    /// Reduces the events of every cell to one dense value.
    LabeledArray reduceBins(LabeledArray binned, BinReduction reduction);

    /// Monotonic search of a value in one-dimensional sorted edges.
    ///
    /// For ascending edges, [Side#LEFT] returns the first index `i` with `edges[i] >= value`
    /// and [Side#RIGHT] the first index with `edges[i] > value`. Descending edges are
    /// searched in mirrored order.
    ///
    /// @return an index in `[0, edges.length]`
    int locate(Variable edges, Quantity value, Side side);
}
