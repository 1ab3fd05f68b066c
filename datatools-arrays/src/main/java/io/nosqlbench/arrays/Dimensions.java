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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/// Ordered dimension labels with their extents.
///
/// ## Layout
///
/// Blocks described by a [Dimensions] are stored row-major: the last label varies
/// fastest. Most operations along one dimension only need the product of the extents
/// before it ([#outerVolume]) and after it ([#innerVolume]):
///
/// ```
/// flat = (outer * size(dim) + i) * inner + k
/// ```
///
/// Instances are immutable.
public final class Dimensions {

    private static final Dimensions SCALAR = new Dimensions(List.of(), new int[0]);

    private final List<String> labels;
    private final int[] shape;

    private Dimensions(List<String> labels, int[] shape) {
        this.labels = labels;
        this.shape = shape;
    }

    /// Creates dimensions from labels and matching extents.
    ///
    /// @param labels distinct dimension labels
    /// @param shape extent per label, each non-negative
    /// @return the dimensions
    /// @throws ShapeException if the label and shape lengths differ or a label repeats
    public static Dimensions of(List<String> labels, int... shape) {
        Objects.requireNonNull(labels, "labels cannot be null");
        Objects.requireNonNull(shape, "shape cannot be null");
        if (labels.size() != shape.length) {
            throw new ShapeException("got " + labels.size() + " labels but " + shape.length + " extents");
        }
        if (labels.stream().distinct().count() != labels.size()) {
            throw new ShapeException("duplicate dimension label in " + labels);
        }
        for (int i = 0; i < shape.length; i++) {
            if (shape[i] < 0) {
                throw new ShapeException("negative extent " + shape[i] + " for dimension '" + labels.get(i) + "'");
            }
        }
        return new Dimensions(List.copyOf(labels), shape.clone());
    }

    /// Creates one-dimensional dimensions.
    public static Dimensions of(String label, int size) {
        return of(List.of(label), size);
    }

    /// Returns the zero-dimensional (scalar) dimensions.
    public static Dimensions scalar() {
        return SCALAR;
    }

    public List<String> labels() {
        return labels;
    }

    public int[] shape() {
        return shape.clone();
    }

    public int ndim() {
        return labels.size();
    }

    public boolean contains(String dim) {
        return labels.contains(dim);
    }

    public boolean containsAll(Collection<String> dims) {
        return labels.containsAll(dims);
    }

    /// @return the position of the label, or -1 if absent
    public int indexOf(String dim) {
        return labels.indexOf(dim);
    }

    /// Returns the extent of a dimension.
    ///
    /// @throws DimensionException if the dimension is absent
    public int size(String dim) {
        return shape[require(dim)];
    }

    public int size(int axis) {
        return shape[axis];
    }

    /// Total number of elements.
    public int volume() {
        int volume = 1;
        for (int s : shape) {
            volume *= s;
        }
        return volume;
    }

    /// Product of the extents of all dimensions before `dim`.
    public int outerVolume(String dim) {
        int axis = require(dim);
        int volume = 1;
        for (int i = 0; i < axis; i++) {
            volume *= shape[i];
        }
        return volume;
    }

    /// Product of the extents of all dimensions after `dim`.
    public int innerVolume(String dim) {
        int axis = require(dim);
        int volume = 1;
        for (int i = axis + 1; i < shape.length; i++) {
            volume *= shape[i];
        }
        return volume;
    }

    /// Row-major strides, in elements.
    public int[] strides() {
        int[] strides = new int[shape.length];
        int stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    /// Flat row-major offset of a multi-index.
    public int offset(int... index) {
        if (index.length != shape.length) {
            throw new ShapeException("index of rank " + index.length + " for dimensions " + this);
        }
        int offset = 0;
        for (int i = 0; i < shape.length; i++) {
            if (index[i] < 0 || index[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "index " + index[i] + " out of range for dimension '" + labels.get(i) + "' of extent " + shape[i]);
            }
            offset = offset * shape[i] + index[i];
        }
        return offset;
    }

    /// Decomposes a flat row-major offset into a multi-index.
    public int[] unravel(int offset) {
        int[] index = new int[shape.length];
        for (int i = shape.length - 1; i >= 0; i--) {
            index[i] = offset % shape[i];
            offset /= shape[i];
        }
        return index;
    }

    /// Returns these dimensions without `dim`.
    public Dimensions without(String dim) {
        int axis = require(dim);
        List<String> newLabels = new ArrayList<>(labels);
        newLabels.remove(axis);
        int[] newShape = new int[shape.length - 1];
        for (int i = 0, j = 0; i < shape.length; i++) {
            if (i != axis) {
                newShape[j++] = shape[i];
            }
        }
        return new Dimensions(Collections.unmodifiableList(newLabels), newShape);
    }

    /// Returns these dimensions with a new extent for `dim`.
    public Dimensions withSize(String dim, int size) {
        int axis = require(dim);
        if (size < 0) {
            throw new ShapeException("negative extent " + size + " for dimension '" + dim + "'");
        }
        int[] newShape = shape.clone();
        newShape[axis] = size;
        return new Dimensions(labels, newShape);
    }

    /// Returns these dimensions with `dim` appended as the innermost dimension.
    public Dimensions append(String dim, int size) {
        if (contains(dim)) {
            throw new ShapeException("dimension '" + dim + "' already present in " + this);
        }
        List<String> newLabels = new ArrayList<>(labels);
        newLabels.add(dim);
        int[] newShape = Arrays.copyOf(shape, shape.length + 1);
        newShape[shape.length] = size;
        return of(newLabels, newShape);
    }

    /// Returns the dimensions in a new label order.
    ///
    /// @throws DimensionException if `order` is not a permutation of the labels
    public Dimensions transpose(List<String> order) {
        if (order.size() != labels.size() || !labels.containsAll(order)) {
            throw new DimensionException("cannot transpose " + labels + " to " + order);
        }
        int[] newShape = new int[order.size()];
        for (int i = 0; i < order.size(); i++) {
            newShape[i] = size(order.get(i));
        }
        return new Dimensions(List.copyOf(order), newShape);
    }

    private int require(String dim) {
        int axis = labels.indexOf(dim);
        if (axis < 0) {
            throw new DimensionException("dimension '" + dim + "' not found in " + labels);
        }
        return axis;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Dimensions that)) return false;
        return labels.equals(that.labels) && Arrays.equals(shape, that.shape);
    }

    @Override
    public int hashCode() {
        return 31 * labels.hashCode() + Arrays.hashCode(shape);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (int i = 0; i < shape.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(labels.get(i)).append(": ").append(shape[i]);
        }
        return sb.append('}').toString();
    }
}
