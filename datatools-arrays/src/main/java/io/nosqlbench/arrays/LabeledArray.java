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

package io.nosqlbench.arrays;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// A multi-dimensional array with named dimensions, coordinates and masks.
///
/// ## Payload
///
/// The payload is either *dense*, a [Variable] with optional variances, or *binned*, a
/// [BinnedData] whose outer cells each hold a variable-length run of events.
///
/// ## Coordinates
///
/// Coordinates are keyed by name. The coordinate of a dimension is the one named after
/// it. A coordinate's dimensions are a subset of the array's, and along at most one
/// dimension it may have one extra element, making it bin-edge shaped there.
///
/// ## Masks
///
/// Masks are keyed by name, with dimensions that are a subset of the array's.
///
/// ## Slicing
///
/// - `slice(dim, i)` drops `dim`. The coordinate named `dim` and any coordinate that is
///   edge shaped along `dim` are dropped; other coordinates and masks depending on `dim`
///   are sliced, possibly down to zero dimensions.
/// - `slice(dim, lo, hi)` keeps `dim`. Edge-shaped coordinates keep `hi - lo + 1` edges.
///
/// Instances are immutable. The `with*` methods return new arrays sharing the unchanged
/// parts.
public final class LabeledArray {

    private final String name;
    private final Dimensions dims;
    private final Variable data;
    private final BinnedData bins;
    private final Map<String, Variable> coords;
    private final Map<String, Mask> masks;

    private LabeledArray(String name, Dimensions dims, Variable data, BinnedData bins,
                         Map<String, Variable> coords, Map<String, Mask> masks) {
        this.name = name;
        this.dims = dims;
        this.data = data;
        this.bins = bins;
        this.coords = coords;
        this.masks = masks;
    }

    /// Creates a dense array without coordinates or masks.
    public static LabeledArray dense(Variable data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new LabeledArray("", data.dims(), data, null, Map.of(), Map.of());
    }

    /// Creates a binned array without coordinates or masks.
    public static LabeledArray binned(BinnedData bins) {
        Objects.requireNonNull(bins, "bins cannot be null");
        return new LabeledArray("", bins.dims(), null, bins, Map.of(), Map.of());
    }

    public String name() {
        return name;
    }

    public Dimensions dims() {
        return dims;
    }

    public List<String> labels() {
        return dims.labels();
    }

    public boolean isBinned() {
        return bins != null;
    }

    /// @throws IllegalStateException if the array is binned
    public Variable data() {
        if (data == null) {
            throw new IllegalStateException("array '" + name + "' is binned and has no dense data");
        }
        return data;
    }

    /// @throws IllegalStateException if the array is dense
    public BinnedData bins() {
        if (bins == null) {
            throw new IllegalStateException("array '" + name + "' is dense and has no bins");
        }
        return bins;
    }

    /// Unit of the dense values or of the event weights.
    public Unit unit() {
        return data != null ? data.unit() : bins.events().unit();
    }

    public Map<String, Variable> coords() {
        return coords;
    }

    public Map<String, Mask> masks() {
        return masks;
    }

    public boolean hasCoord(String name) {
        return coords.containsKey(name);
    }

    /// @throws DimensionException if there is no such coordinate
    public Variable coord(String name) {
        Variable coord = coords.get(name);
        if (coord == null) {
            throw new DimensionException("array '" + this.name + "' has no coordinate '" + name + "', available: "
                + coords.keySet());
        }
        return coord;
    }

    public Optional<Variable> findCoord(String name) {
        return Optional.ofNullable(coords.get(name));
    }

    /// True if the coordinate named `dim` is bin-edge shaped along `dim`.
    public boolean isEdgeCoord(String dim) {
        Variable coord = coords.get(dim);
        return coord != null && coord.isEdgesFor(dims, dim);
    }

    public LabeledArray withName(String name) {
        return new LabeledArray(Objects.requireNonNull(name), dims, data, bins, coords, masks);
    }

    /// Adds or replaces a coordinate.
    ///
    /// @throws DimensionException if the coordinate has a dimension the array lacks
    /// @throws ShapeException if an extent matches neither the data extent nor the data extent plus one,
    ///     or if the coordinate is edge shaped along more than one dimension
    public LabeledArray withCoord(String name, Variable coord) {
        Objects.requireNonNull(coord, "coord cannot be null");
        int edgeDims = 0;
        for (String label : coord.labels()) {
            if (!dims.contains(label)) {
                throw new DimensionException("coordinate '" + name + "' has dimension '" + label
                    + "' not in array dimensions " + dims.labels());
            }
            int extent = coord.dims().size(label);
            int dataExtent = dims.size(label);
            if (extent == dataExtent + 1) {
                edgeDims++;
            } else if (extent != dataExtent) {
                throw new ShapeException("coordinate '" + name + "' has extent " + extent + " along '" + label
                    + "' but data extent is " + dataExtent);
            }
        }
        if (edgeDims > 1) {
            throw new ShapeException("coordinate '" + name + "' is edge shaped along more than one dimension");
        }
        Map<String, Variable> newCoords = new LinkedHashMap<>(coords);
        newCoords.put(name, coord);
        return new LabeledArray(this.name, dims, data, bins, Collections.unmodifiableMap(newCoords), masks);
    }

    /// Adds or replaces a mask.
    ///
    /// @throws DimensionException if the mask has a dimension the array lacks
    /// @throws ShapeException if a mask extent differs from the data extent
    public LabeledArray withMask(String name, Mask mask) {
        Objects.requireNonNull(mask, "mask cannot be null");
        for (String label : mask.labels()) {
            if (!dims.contains(label)) {
                throw new DimensionException("mask '" + name + "' has dimension '" + label
                    + "' not in array dimensions " + dims.labels());
            }
            if (mask.dims().size(label) != dims.size(label)) {
                throw new ShapeException("mask '" + name + "' has extent " + mask.dims().size(label) + " along '"
                    + label + "' but data extent is " + dims.size(label));
            }
        }
        Map<String, Mask> newMasks = new LinkedHashMap<>(masks);
        newMasks.put(name, mask);
        return new LabeledArray(this.name, dims, data, bins, coords, Collections.unmodifiableMap(newMasks));
    }

    public LabeledArray withoutMasks() {
        if (masks.isEmpty()) {
            return this;
        }
        return new LabeledArray(name, dims, data, bins, coords, Map.of());
    }

    /// Replaces the dense payload, keeping coordinates and masks that still fit.
    ///
    /// Coordinates and masks whose dimensions or extents no longer match are dropped.
    public LabeledArray withData(Variable newData) {
        LabeledArray result = new LabeledArray(name, newData.dims(), newData, null, Map.of(), Map.of());
        return result.copyCompatibleFrom(this);
    }

    private LabeledArray copyCompatibleFrom(LabeledArray other) {
        LabeledArray result = this;
        for (Map.Entry<String, Variable> entry : other.coords.entrySet()) {
            if (fits(entry.getValue().dims(), true)) {
                result = result.withCoord(entry.getKey(), entry.getValue());
            }
        }
        for (Map.Entry<String, Mask> entry : other.masks.entrySet()) {
            if (fits(entry.getValue().dims(), false)) {
                result = result.withMask(entry.getKey(), entry.getValue());
            }
        }
        return result;
    }

    private boolean fits(Dimensions part, boolean allowEdges) {
        for (String label : part.labels()) {
            if (!dims.contains(label)) return false;
            int extent = part.size(label);
            int dataExtent = dims.size(label);
            if (extent != dataExtent && !(allowEdges && extent == dataExtent + 1)) return false;
        }
        return true;
    }

    /// Selects one index along `dim` and drops the dimension.
    ///
    /// @throws DimensionException if the array has no such dimension
    /// @throws IndexOutOfBoundsException if the index is out of range
    public LabeledArray slice(String dim, int index) {
        int size = dims.size(dim);
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for '" + dim + "' of extent " + size);
        }
        Map<String, Variable> newCoords = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> entry : coords.entrySet()) {
            Variable coord = entry.getValue();
            if (!coord.dims().contains(dim)) {
                newCoords.put(entry.getKey(), coord);
            } else if (!entry.getKey().equals(dim) && !coord.isEdgesFor(dims, dim)) {
                newCoords.put(entry.getKey(), coord.slice(dim, index));
            }
        }
        Map<String, Mask> newMasks = new LinkedHashMap<>();
        masks.forEach((maskName, mask) ->
            newMasks.put(maskName, mask.dims().contains(dim) ? mask.slice(dim, index) : mask));
        return new LabeledArray(name, dims.without(dim),
            data != null ? data.slice(dim, index) : null,
            bins != null ? bins.slice(dim, index) : null,
            Collections.unmodifiableMap(newCoords), Collections.unmodifiableMap(newMasks));
    }

    /// Selects the half-open index range `[lo, hi)` along `dim`, keeping the dimension.
    ///
    /// @throws DimensionException if the array has no such dimension
    /// @throws IndexOutOfBoundsException if the range is out of bounds
    public LabeledArray slice(String dim, int lo, int hi) {
        int size = dims.size(dim);
        if (lo < 0 || hi > size || lo > hi) {
            throw new IndexOutOfBoundsException("range [" + lo + ", " + hi + ") out of range for '" + dim + "' of extent " + size);
        }
        Map<String, Variable> newCoords = new LinkedHashMap<>();
        for (Map.Entry<String, Variable> entry : coords.entrySet()) {
            Variable coord = entry.getValue();
            if (!coord.dims().contains(dim)) {
                newCoords.put(entry.getKey(), coord);
            } else if (coord.isEdgesFor(dims, dim)) {
                newCoords.put(entry.getKey(), coord.slice(dim, lo, hi + 1));
            } else {
                newCoords.put(entry.getKey(), coord.slice(dim, lo, hi));
            }
        }
        Map<String, Mask> newMasks = new LinkedHashMap<>();
        masks.forEach((maskName, mask) ->
            newMasks.put(maskName, mask.dims().contains(dim) ? mask.slice(dim, lo, hi) : mask));
        return new LabeledArray(name, dims.withSize(dim, hi - lo),
            data != null ? data.slice(dim, lo, hi) : null,
            bins != null ? bins.slice(dim, lo, hi) : null,
            Collections.unmodifiableMap(newCoords), Collections.unmodifiableMap(newMasks));
    }

    /// Reorders the dimensions of a dense array. Coordinates and masks keep their own order.
    ///
    /// @throws IllegalStateException if the array is binned
    public LabeledArray transpose(List<String> order) {
        if (dims.labels().equals(order)) {
            return this;
        }
        Variable transposed = data().transpose(order);
        return new LabeledArray(name, transposed.dims(), transposed, null, coords, masks);
    }

    /// Drops a dimension of extent one.
    ///
    /// @throws ShapeException if the extent of `dim` is not one
    public LabeledArray squeeze(String dim) {
        if (dims.size(dim) != 1) {
            throw new ShapeException("cannot squeeze '" + dim + "' of extent " + dims.size(dim));
        }
        return slice(dim, 0);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabeledArray that)) return false;
        return name.equals(that.name) && dims.equals(that.dims) && Objects.equals(data, that.data)
            && Objects.equals(bins, that.bins) && coords.equals(that.coords) && masks.equals(that.masks);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dims, data, bins, coords, masks);
    }

    @Override
    public String toString() {
        return "LabeledArray[" + (name.isEmpty() ? "" : name + ", ") + dims + ", "
            + (isBinned() ? bins : data) + ", coords=" + coords.keySet() + ", masks=" + masks.keySet() + "]";
    }
}
