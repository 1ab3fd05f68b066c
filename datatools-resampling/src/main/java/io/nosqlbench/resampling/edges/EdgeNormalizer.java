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

package io.nosqlbench.resampling.edges;

import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.EmptyRangeException;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.ShapeException;
import io.nosqlbench.arrays.Unit;
import io.nosqlbench.arrays.Variable;

import java.util.Objects;

/// Conversions between bin-center and bin-edge coordinates.
///
/// ## Centers to edges
///
/// For centers `c[0..n)` along a dimension, the edges are
///
/// ```
/// e[0] = c[0] - (c[1] - c[0]) / 2
/// e[i] = (c[i - 1] + c[i]) / 2          for 0 < i < n
/// e[n] = c[n - 1] + (c[n - 1] - c[n - 2]) / 2
/// ```
///
/// so interior edges are midpoints and the outer edges are linear extrapolations from
/// the two nearest centers. A single center `c` gets the edges `c - 1` and `c + 1`.
/// [#binCenters] inverts this exactly for evenly spaced centers; for uneven spacing it
/// returns the midpoints of the edges, which keeps the edges monotonic.
///
/// All methods are pure and never modify their inputs.
public final class EdgeNormalizer {

    private EdgeNormalizer() {
    }

    /// Converts a bin-center coordinate into a bin-edge coordinate along `dim`.
    ///
    /// @param coord the center coordinate; may have other dimensions
    /// @param dim the dimension to convert along
    /// @return a coordinate with one more element along `dim`
    /// @throws ShapeException if `dim` is not a dimension of `coord`
    /// @throws EmptyRangeException if the coordinate has no centers along `dim`
    public static Variable centersToEdges(Variable coord, String dim) {
        Objects.requireNonNull(coord, "coord cannot be null");
        Dimensions dims = requireDim(coord, dim);
        int n = dims.size(dim);
        if (n == 0) {
            throw new EmptyRangeException("cannot derive edges from zero centers along '" + dim + "'");
        }
        int outer = dims.outerVolume(dim);
        int inner = dims.innerVolume(dim);
        double[] c = coord.values();
        double[] e = new double[outer * (n + 1) * inner];
        for (int o = 0; o < outer; o++) {
            for (int k = 0; k < inner; k++) {
                int in = o * n * inner + k;
                int out = o * (n + 1) * inner + k;
                if (n == 1) {
                    e[out] = c[in] - 1.0;
                    e[out + inner] = c[in] + 1.0;
                    continue;
                }
                for (int i = 1; i < n; i++) {
                    e[out + i * inner] = 0.5 * (c[in + (i - 1) * inner] + c[in + i * inner]);
                }
                e[out] = c[in] - 0.5 * (c[in + inner] - c[in]);
                double last = c[in + (n - 1) * inner];
                double beforeLast = c[in + (n - 2) * inner];
                e[out + n * inner] = last + 0.5 * (last - beforeLast);
            }
        }
        return Variable.of(dims.withSize(dim, n + 1), coord.unit(), e);
    }

    /// Converts a bin-edge coordinate into bin centers: the mean of adjacent edges.
    ///
    /// @throws ShapeException if `dim` is not a dimension of `edges` or there are fewer than two edges
    public static Variable binCenters(Variable edges, String dim) {
        Objects.requireNonNull(edges, "edges cannot be null");
        Dimensions dims = requireDim(edges, dim);
        int n = dims.size(dim);
        if (n < 2) {
            throw new ShapeException("need at least two edges along '" + dim + "' to compute centers, got " + n);
        }
        double[] lower = edges.slice(dim, 0, n - 1).values();
        double[] upper = edges.slice(dim, 1, n).values();
        double[] centers = new double[lower.length];
        for (int i = 0; i < centers.length; i++) {
            centers[i] = 0.5 * (lower[i] + upper[i]);
        }
        return Variable.of(dims.withSize(dim, n - 1), edges.unit(), centers);
    }

    /// Creates the dimensionless edge coordinate `0, 1, ..., length` for a dimension
    /// without a natural coordinate.
    public static Variable synthesizeFakeCoord(String dim, int length) {
        if (length < 0) {
            throw new IllegalArgumentException("length must be non-negative, got " + length);
        }
        double[] values = new double[length + 1];
        for (int i = 0; i <= length; i++) {
            values[i] = i;
        }
        return Variable.vector(dim, Unit.DIMENSIONLESS, values);
    }

    /// True if `coord` holds one more value than `array` along `dim`.
    public static boolean isEdges(LabeledArray array, Variable coord, String dim) {
        return coord.isEdgesFor(array.dims(), dim);
    }

    /// Returns the coordinate of `dim` in bin-edge form.
    ///
    /// Edge coordinates are returned as they are, center coordinates are converted and a
    /// missing coordinate is synthesized with [#synthesizeFakeCoord].
    ///
    /// @throws ShapeException if the coordinate does not depend on `dim`
    public static Variable edgesFor(LabeledArray array, String dim) {
        int extent = array.dims().size(dim);
        Variable coord = array.findCoord(dim).orElse(null);
        if (coord == null) {
            return synthesizeFakeCoord(dim, extent);
        }
        if (isEdges(array, coord, dim)) {
            return coord;
        }
        if (!coord.dims().contains(dim)) {
            throw new ShapeException("coordinate '" + dim + "' does not depend on its dimension");
        }
        return centersToEdges(coord, dim);
    }

    /// Returns `array` with a bin-edge coordinate for every non-empty dimension.
    ///
    /// Center coordinates are replaced by their edges and dimensions without a coordinate
    /// get a synthesized one. Zero-extent dimensions are left untouched.
    public static LabeledArray withEdgeCoords(LabeledArray array) {
        LabeledArray result = array;
        for (String dim : array.labels()) {
            if (array.dims().size(dim) == 0 || array.isEdgeCoord(dim)) {
                continue;
            }
            Variable coord = array.findCoord(dim).orElse(null);
            if (coord != null && !coord.dims().contains(dim)) {
                continue;
            }
            result = result.withCoord(dim, edgesFor(array, dim));
        }
        return result;
    }

    private static Dimensions requireDim(Variable coord, String dim) {
        if (!coord.dims().contains(dim)) {
            throw new ShapeException("dimension '" + dim + "' is not a dimension of coordinate " + coord.dims());
        }
        return coord.dims();
    }
}
