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

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/// A dense boolean block marking data elements as invalid.
///
/// Masks are usually lower-dimensional than the data they belong to: a mask along `x`
/// applies to every element sharing that `x` index, whatever the other indices are.
/// A zero-dimensional mask marks the whole array.
///
/// Instances are immutable.
public final class Mask {

    private final Dimensions dims;
    private final boolean[] values;

    private Mask(Dimensions dims, boolean[] values) {
        this.dims = dims;
        this.values = values;
    }

    /// Creates a mask, copying the values.
    ///
    /// @throws ShapeException if the value count does not match the dimensions' volume
    public static Mask of(Dimensions dims, boolean... values) {
        Objects.requireNonNull(dims, "dims cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length != dims.volume()) {
            throw new ShapeException("expected " + dims.volume() + " mask values for " + dims + " but got " + values.length);
        }
        return new Mask(dims, values.clone());
    }

    public static Mask vector(String dim, boolean... values) {
        return of(Dimensions.of(dim, values.length), values);
    }

    public static Mask scalar(boolean value) {
        return of(Dimensions.scalar(), value);
    }

    /// Creates an all-false mask.
    public static Mask none(Dimensions dims) {
        return new Mask(dims, new boolean[dims.volume()]);
    }

    public Dimensions dims() {
        return dims;
    }

    public List<String> labels() {
        return dims.labels();
    }

    public int ndim() {
        return dims.ndim();
    }

    public boolean[] values() {
        return values.clone();
    }

    public boolean value(int... index) {
        return values[dims.offset(index)];
    }

    public boolean any() {
        for (boolean v : values) {
            if (v) return true;
        }
        return false;
    }

    public Mask slice(String dim, int index) {
        int size = dims.size(dim);
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for '" + dim + "' of extent " + size);
        }
        return new Mask(dims.without(dim), IndexMaps.gather(values, IndexMaps.slice(dims, dim, index, index + 1)));
    }

    public Mask slice(String dim, int lo, int hi) {
        int size = dims.size(dim);
        if (lo < 0 || hi > size || lo > hi) {
            throw new IndexOutOfBoundsException("range [" + lo + ", " + hi + ") out of range for '" + dim + "' of extent " + size);
        }
        return new Mask(dims.withSize(dim, hi - lo), IndexMaps.gather(values, IndexMaps.slice(dims, dim, lo, hi)));
    }

    /// Replicates this mask along the dimensions of `target` that it lacks.
    public Mask broadcast(Dimensions target) {
        if (target.equals(dims)) {
            return this;
        }
        return new Mask(target, IndexMaps.gather(values, IndexMaps.broadcast(dims, target)));
    }

    /// Elementwise OR with a mask of identical dimensions.
    public Mask or(Mask other) {
        if (!dims.equals(other.dims)) {
            throw new ShapeException("cannot combine masks with dimensions " + dims + " and " + other.dims);
        }
        boolean[] combined = new boolean[values.length];
        for (int i = 0; i < values.length; i++) {
            combined[i] = values[i] || other.values[i];
        }
        return new Mask(dims, combined);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Mask mask)) return false;
        return dims.equals(mask.dims) && Arrays.equals(values, mask.values);
    }

    @Override
    public int hashCode() {
        return 31 * dims.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "Mask" + dims + Arrays.toString(values);
    }
}
