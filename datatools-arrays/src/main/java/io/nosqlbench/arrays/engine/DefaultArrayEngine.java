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

import io.nosqlbench.arrays.BinnedData;
import io.nosqlbench.arrays.DimensionException;
import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.EventTable;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Quantity;
import io.nosqlbench.arrays.ShapeException;
import io.nosqlbench.arrays.Unit;
import io.nosqlbench.arrays.Variable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Single-threaded reference implementation of [ArrayEngine].
///
/// ## Rebinning
///
/// For every row along the rebinned dimension, each new bin `[lo, hi)` collects the old
/// bins it overlaps. An old bin `[a, b)` contributes `value * overlap / (b - a)`, where
/// `overlap = min(hi, b) - max(lo, a)`. Descending edges are handled by mirroring both
/// edge sets, which leaves overlaps unchanged. Zero-width old bins contribute nothing.
///
/// ## Binning
///
/// Events are assigned to output cells in one pass, counted, and gathered in a second
/// pass so that each output cell owns a contiguous run of a new [EventTable].
public class DefaultArrayEngine implements ArrayEngine {

    private static final Logger logger = LogManager.getLogger(DefaultArrayEngine.class);

    @Override
    public Variable rebin(Variable data, String dim, Variable oldEdges, Variable newEdges) {
        Objects.requireNonNull(data, "data cannot be null");
        RebinLayout layout = RebinLayout.of(data.dims(), dim, oldEdges, newEdges);
        double[] values = data.values();
        double[] variances = data.variances();
        double[] outValues = new double[layout.outDims.volume()];
        double[] outVariances = variances == null ? null : new double[outValues.length];

        int n = layout.oldSize;
        int m = layout.newSize;
        double[] xo = new double[n + 1];
        for (int o = 0; o < layout.outer; o++) {
            for (int k = 0; k < layout.inner; k++) {
                layout.loadOldRow(o, k, xo);
                for (int j = 0; j < m; j++) {
                    double lo = layout.xn[j];
                    double hi = layout.xn[j + 1];
                    int out = (o * m + j) * layout.inner + k;
                    for (int i = firstCandidate(xo, lo); i < n && xo[i] < hi; i++) {
                        double width = xo[i + 1] - xo[i];
                        double overlap = Math.min(hi, xo[i + 1]) - Math.max(lo, xo[i]);
                        if (overlap <= 0 || width <= 0) {
                            continue;
                        }
                        double fraction = overlap / width;
                        int in = (o * n + i) * layout.inner + k;
                        outValues[out] += values[in] * fraction;
                        if (outVariances != null) {
                            outVariances[out] += variances[in] * fraction;
                        }
                    }
                }
            }
        }
        logger.trace("rebinned '{}' from {} to {} bins over {}", dim, n, m, data.dims());
        return Variable.of(layout.outDims, data.unit(), outValues).withVariances(outVariances);
    }

    @Override
    public Mask rebin(Mask mask, String dim, Variable oldEdges, Variable newEdges) {
        Objects.requireNonNull(mask, "mask cannot be null");
        RebinLayout layout = RebinLayout.of(mask.dims(), dim, oldEdges, newEdges);
        boolean[] values = mask.values();
        boolean[] outValues = new boolean[layout.outDims.volume()];

        int n = layout.oldSize;
        int m = layout.newSize;
        double[] xo = new double[n + 1];
        for (int o = 0; o < layout.outer; o++) {
            for (int k = 0; k < layout.inner; k++) {
                layout.loadOldRow(o, k, xo);
                for (int j = 0; j < m; j++) {
                    double lo = layout.xn[j];
                    double hi = layout.xn[j + 1];
                    int out = (o * m + j) * layout.inner + k;
                    for (int i = firstCandidate(xo, lo); i < n && xo[i] < hi && !outValues[out]; i++) {
                        double overlap = Math.min(hi, xo[i + 1]) - Math.max(lo, xo[i]);
                        if (overlap > 0 && values[(o * n + i) * layout.inner + k]) {
                            outValues[out] = true;
                        }
                    }
                }
            }
        }
        return Mask.of(layout.outDims, outValues);
    }

    /// Index of the last old edge not after `lo`, clamped to zero.
    private static int firstCandidate(double[] xo, double lo) {
        return Math.max(0, upperBound(xo, lo) - 1);
    }

    @Override
    public LabeledArray bin(LabeledArray binned, List<Variable> edges) {
        requireBinned(binned);
        BinnedData bins = binned.bins();
        EventTable table = bins.events();
        Dimensions outer = bins.dims();

        List<String> edgeDims = new ArrayList<>();
        List<EdgeSearch> searches = new ArrayList<>();
        for (Variable edge : edges) {
            String dim = requireOneDimensional(edge, "bin edges");
            if (edgeDims.contains(dim)) {
                throw new ShapeException("edges for '" + dim + "' given more than once");
            }
            edgeDims.add(dim);
            searches.add(EdgeSearch.of(edge, dim));
        }

        List<String> keptLabels = new ArrayList<>();
        for (String label : outer.labels()) {
            if (!edgeDims.contains(label)) {
                keptLabels.add(label);
            }
        }
        List<String> outLabels = new ArrayList<>(keptLabels);
        outLabels.addAll(edgeDims);
        int[] outShape = new int[outLabels.size()];
        for (int i = 0; i < keptLabels.size(); i++) {
            outShape[i] = outer.size(keptLabels.get(i));
        }
        for (int i = 0; i < edgeDims.size(); i++) {
            outShape[keptLabels.size() + i] = searches.get(i).bins();
        }
        Dimensions outDims = Dimensions.of(outLabels, outShape);

        // Per edge dim: event column, or the centres of the outer cells along that dim.
        double[][] cellCentres = new double[edgeDims.size()][];
        for (int d = 0; d < edgeDims.size(); d++) {
            String dim = edgeDims.get(d);
            Unit edgeUnit = searches.get(d).unit;
            if (table.hasCoord(dim)) {
                edgeUnit.requireSame(table.coordUnit(dim), "event coordinate '" + dim + "'");
            } else {
                cellCentres[d] = outerCentres(binned, dim, edgeUnit);
            }
        }

        int volume = outer.volume();
        int[] target = new int[table.size()];
        Arrays.fill(target, -1);
        int[] counts = new int[outDims.volume()];
        int[] keptStrides = outDims.strides();
        int[] outerAxisOfKept = new int[keptLabels.size()];
        for (int i = 0; i < keptLabels.size(); i++) {
            outerAxisOfKept[i] = outer.indexOf(keptLabels.get(i));
        }
        int[] order = new int[table.size()];
        int accepted = 0;
        for (int c = 0; c < volume; c++) {
            int[] idx = outer.unravel(c);
            int keptOffset = 0;
            for (int i = 0; i < keptLabels.size(); i++) {
                keptOffset += idx[outerAxisOfKept[i]] * keptStrides[i];
            }
            for (int row = bins.begin(c); row < bins.end(c); row++) {
                int flat = keptOffset;
                boolean inside = true;
                for (int d = 0; d < edgeDims.size() && inside; d++) {
                    double value = cellCentres[d] != null
                        ? cellCentres[d][idx[outer.indexOf(edgeDims.get(d))]]
                        : table.coord(edgeDims.get(d), row);
                    int b = searches.get(d).find(value);
                    if (b < 0) {
                        inside = false;
                    } else {
                        flat += b * keptStrides[keptLabels.size() + d];
                    }
                }
                if (inside) {
                    target[row] = flat;
                    counts[flat]++;
                    order[accepted++] = row;
                }
            }
        }

        int[] offsets = new int[counts.length + 1];
        for (int i = 0; i < counts.length; i++) {
            offsets[i + 1] = offsets[i] + counts[i];
        }
        int[] cursor = Arrays.copyOf(offsets, counts.length);
        int[] rows = new int[offsets[counts.length]];
        for (int a = 0; a < accepted; a++) {
            int row = order[a];
            rows[cursor[target[row]]++] = row;
        }

        LabeledArray result = LabeledArray.binned(BinnedData.fromOffsets(outDims, table.select(rows), offsets))
            .withName(binned.name());
        result = copyCoordsAndMasks(binned, result, new HashSet<>(keptLabels));
        for (int d = 0; d < edgeDims.size(); d++) {
            result = result.withCoord(edgeDims.get(d), edges.get(d));
        }
        logger.trace("binned {} events of {} into {}", rows.length, outer, outDims);
        return result;
    }

    private static double[] outerCentres(LabeledArray binned, String dim, Unit edgeUnit) {
        if (!binned.dims().contains(dim)) {
            throw new DimensionException("events have no coordinate '" + dim + "' and the array has no such dimension");
        }
        Variable coord = binned.coord(dim);
        if (coord.ndim() != 1) {
            throw new ShapeException("binning by the outer coordinate '" + dim + "' requires it to be one-dimensional");
        }
        edgeUnit.requireSame(coord.unit(), "outer coordinate '" + dim + "'");
        double[] values = coord.values();
        if (!coord.isEdgesFor(binned.dims(), dim)) {
            return values;
        }
        double[] centres = new double[values.length - 1];
        for (int i = 0; i < centres.length; i++) {
            centres[i] = 0.5 * (values[i] + values[i + 1]);
        }
        return centres;
    }

    @Override
    public LabeledArray histogram(LabeledArray binned, Variable edges) {
        requireBinned(binned);
        String dim = requireOneDimensional(edges, "histogram edges");
        BinnedData bins = binned.bins();
        EventTable table = bins.events();
        if (!table.hasCoord(dim)) {
            throw new DimensionException("events have no coordinate '" + dim + "' to histogram");
        }
        EdgeSearch search = EdgeSearch.of(edges, dim);
        search.unit.requireSame(table.coordUnit(dim), "event coordinate '" + dim + "'");

        Dimensions outer = bins.dims();
        Dimensions kept = outer.contains(dim) ? outer.without(dim) : outer;
        int m = search.bins();
        Dimensions outDims = kept.append(dim, m);
        int[] keptStrides = kept.strides();
        double[] values = new double[outDims.volume()];
        double[] variances = table.hasVariances() ? new double[values.length] : null;

        for (int c = 0; c < outer.volume(); c++) {
            int[] idx = outer.unravel(c);
            int keptFlat = 0;
            for (int axis = 0, ka = 0; axis < outer.ndim(); axis++) {
                if (!outer.labels().get(axis).equals(dim)) {
                    keptFlat += idx[axis] * keptStrides[ka++];
                }
            }
            for (int row = bins.begin(c); row < bins.end(c); row++) {
                int b = search.find(table.coord(dim, row));
                if (b >= 0) {
                    values[keptFlat * m + b] += table.weight(row);
                    if (variances != null) {
                        variances[keptFlat * m + b] += table.variance(row);
                    }
                }
            }
        }
        LabeledArray result = LabeledArray.dense(Variable.of(outDims, table.unit(), values).withVariances(variances))
            .withName(binned.name());
        result = copyCoordsAndMasks(binned, result, new HashSet<>(kept.labels()));
        return result.withCoord(dim, edges);
    }

    @Override
    public LabeledArray reduceBins(LabeledArray binned, BinReduction reduction) {
        requireBinned(binned);
        BinnedData bins = binned.bins();
        EventTable table = bins.events();
        int volume = bins.dims().volume();
        double[] values = new double[volume];
        double[] variances = table.hasVariances() ? new double[volume] : null;
        for (int c = 0; c < volume; c++) {
            for (int row = bins.begin(c); row < bins.end(c); row++) {
                values[c] += table.weight(row);
                if (variances != null) {
                    variances[c] += table.variance(row);
                }
            }
            if (reduction == BinReduction.MEAN) {
                int count = bins.cellSize(c);
                values[c] = count == 0 ? Double.NaN : values[c] / count;
                if (variances != null) {
                    variances[c] = count == 0 ? Double.NaN : variances[c] / ((double) count * count);
                }
            }
        }
        LabeledArray result = LabeledArray.dense(Variable.of(bins.dims(), table.unit(), values).withVariances(variances))
            .withName(binned.name());
        return copyCoordsAndMasks(binned, result, new HashSet<>(bins.dims().labels()));
    }

    @Override
    public int locate(Variable edges, Quantity value, Side side) {
        String dim = requireOneDimensional(edges, "located edges");
        edges.unit().requireSame(value.unit(), "located value");
        double[] e = edges.values();
        double v = value.value();
        if (!edges.isSortedAscending(dim)) {
            if (!edges.isSortedDescending(dim)) {
                throw new ShapeException("edges of '" + dim + "' are not sorted");
            }
            for (int i = 0; i < e.length; i++) {
                e[i] = -e[i];
            }
            v = -v;
        }
        return side == Side.LEFT ? lowerBound(e, v) : upperBound(e, v);
    }

    private static LabeledArray copyCoordsAndMasks(LabeledArray from, LabeledArray to, Set<String> allowedDims) {
        LabeledArray result = to;
        for (Map.Entry<String, Variable> entry : from.coords().entrySet()) {
            if (allowedDims.containsAll(entry.getValue().labels())) {
                result = result.withCoord(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, Mask> entry : from.masks().entrySet()) {
            if (allowedDims.containsAll(entry.getValue().labels())) {
                result = result.withMask(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private static void requireBinned(LabeledArray array) {
        Objects.requireNonNull(array, "array cannot be null");
        if (!array.isBinned()) {
            throw new IllegalArgumentException("expected binned data but array '" + array.name() + "' is dense");
        }
    }

    private static String requireOneDimensional(Variable edges, String what) {
        Objects.requireNonNull(edges, what + " cannot be null");
        if (edges.ndim() != 1 || edges.dims().size(0) < 2) {
            throw new ShapeException(what + " must be one-dimensional with at least 2 edges, got " + edges.dims());
        }
        return edges.labels().get(0);
    }

    static int lowerBound(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    static int upperBound(double[] sorted, double value) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= value) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /// Right-open bin lookup in one-dimensional edges of either direction.
    private static final class EdgeSearch {
        private final double[] ascending;
        private final boolean mirrored;
        private final Unit unit;

        private EdgeSearch(double[] ascending, boolean mirrored, Unit unit) {
            this.ascending = ascending;
            this.mirrored = mirrored;
            this.unit = unit;
        }

        static EdgeSearch of(Variable edges, String dim) {
            double[] e = edges.values();
            if (edges.isSortedAscending(dim)) {
                return new EdgeSearch(e, false, edges.unit());
            }
            if (!edges.isSortedDescending(dim)) {
                throw new ShapeException("edges of '" + dim + "' are not sorted");
            }
            for (int i = 0; i < e.length; i++) {
                e[i] = -e[i];
            }
            return new EdgeSearch(e, true, edges.unit());
        }

        int bins() {
            return ascending.length - 1;
        }

        /// @return the bin containing `value`, or -1 outside the edges or for NaN
        int find(double value) {
            double v = mirrored ? -value : value;
            if (Double.isNaN(v) || v < ascending[0] || v >= ascending[ascending.length - 1]) {
                return -1;
            }
            return upperBound(ascending, v) - 1;
        }
    }

    /// Geometry shared by dense and mask rebinning.
    private static final class RebinLayout {
        private final Dimensions outDims;
        private final int outer;
        private final int inner;
        private final int oldSize;
        private final int newSize;
        private final double[] xn;
        private final double[] oldValues;
        private final int oldStrideAlongDim;
        private final int[] rowBase;
        private final boolean mirrored;

        private RebinLayout(Dimensions outDims, int outer, int inner, int oldSize, int newSize, double[] xn,
                            double[] oldValues, int oldStrideAlongDim, int[] rowBase, boolean mirrored) {
            this.outDims = outDims;
            this.outer = outer;
            this.inner = inner;
            this.oldSize = oldSize;
            this.newSize = newSize;
            this.xn = xn;
            this.oldValues = oldValues;
            this.oldStrideAlongDim = oldStrideAlongDim;
            this.rowBase = rowBase;
            this.mirrored = mirrored;
        }

        static RebinLayout of(Dimensions dims, String dim, Variable oldEdges, Variable newEdges) {
            Objects.requireNonNull(oldEdges, "old edges cannot be null");
            Objects.requireNonNull(newEdges, "new edges cannot be null");
            if (!dims.contains(dim)) {
                throw new DimensionException("cannot rebin '" + dim + "': not a dimension of " + dims);
            }
            if (!oldEdges.isEdgesFor(dims, dim)) {
                throw new ShapeException("old edges " + oldEdges.dims() + " are not bin edges along '" + dim
                    + "' for data " + dims);
            }
            for (String label : oldEdges.labels()) {
                if (!dims.contains(label)) {
                    throw new DimensionException("old edges depend on '" + label + "' which the data " + dims + " lacks");
                }
                if (!label.equals(dim) && oldEdges.dims().size(label) != dims.size(label)) {
                    throw new ShapeException("old edges extent along '" + label + "' does not match data " + dims);
                }
            }
            if (newEdges.ndim() != 1 || !newEdges.labels().get(0).equals(dim) || newEdges.dims().size(0) < 2) {
                throw new ShapeException("new edges must be one-dimensional along '" + dim + "' with at least 2 edges, got "
                    + newEdges.dims());
            }
            oldEdges.unit().requireSame(newEdges.unit(), "rebin edges of '" + dim + "'");

            boolean ascending = oldEdges.isSortedAscending(dim) && newEdges.isSortedAscending(dim);
            boolean descending = oldEdges.isSortedDescending(dim) && newEdges.isSortedDescending(dim);
            if (!ascending && !descending) {
                throw new ShapeException("old or new bin edges of '" + dim + "' are not sorted in a common direction");
            }
            boolean mirrored = !ascending;
            double[] xn = newEdges.values();
            if (mirrored) {
                for (int i = 0; i < xn.length; i++) {
                    xn[i] = -xn[i];
                }
            }

            Dimensions edgeDims = oldEdges.dims();
            int[] edgeStrides = edgeDims.strides();
            int axis = dims.indexOf(dim);
            int[] strideOf = new int[dims.ndim()];
            for (int a = 0; a < dims.ndim(); a++) {
                int edgeAxis = edgeDims.indexOf(dims.labels().get(a));
                strideOf[a] = edgeAxis < 0 ? 0 : edgeStrides[edgeAxis];
            }
            int[] shape = dims.shape();
            int outer = dims.outerVolume(dim);
            int inner = dims.innerVolume(dim);
            int[] rowBase = new int[outer * inner];
            for (int o = 0; o < outer; o++) {
                int rem = o;
                int baseOuter = 0;
                for (int a = axis - 1; a >= 0; a--) {
                    baseOuter += (rem % shape[a]) * strideOf[a];
                    rem /= shape[a];
                }
                for (int k = 0; k < inner; k++) {
                    int remInner = k;
                    int baseInner = 0;
                    for (int a = dims.ndim() - 1; a > axis; a--) {
                        baseInner += (remInner % shape[a]) * strideOf[a];
                        remInner /= shape[a];
                    }
                    rowBase[o * inner + k] = baseOuter + baseInner;
                }
            }
            int newSize = xn.length - 1;
            return new RebinLayout(dims.withSize(dim, newSize), outer, inner, dims.size(dim), newSize, xn,
                oldEdges.values(), edgeStrides[edgeDims.indexOf(dim)], rowBase, mirrored);
        }

        void loadOldRow(int o, int k, double[] row) {
            int base = rowBase[o * inner + k];
            for (int i = 0; i <= oldSize; i++) {
                double edge = oldValues[base + i * oldStrideAlongDim];
                row[i] = mirrored ? -edge : edge;
            }
        }
    }
}
