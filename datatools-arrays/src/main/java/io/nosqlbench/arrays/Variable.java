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

/// A dense block of double values with dimension labels, a unit and optional variances.
///
/// ## Purpose
///
/// [Variable] is the numeric payload of a dense [LabeledArray] and the type of all
/// coordinates. Variances, when present, travel alongside the values through slicing,
/// broadcasting and rebinning.
///
/// ## Bin edges
///
/// A coordinate is *edge shaped* along a dimension when its extent there is one more than
/// the data extent: `n` bins are described by `n + 1` boundaries. See [#isEdgesFor].
///
/// ## Usage
///
/// ```java
/// Variable tof = Variable.linspace("tof", Unit.MICROSECOND, 0.0, 100.0, 11);
/// Variable counts = Variable.of(Dimensions.of("tof", 10), Unit.COUNTS, values)
///     .withVariances(values);
/// Variable window = counts.slice("tof", 2, 5);
/// ```
///
/// Instances are immutable; accessors return copies.
public final class Variable {

    private final Dimensions dims;
    private final double[] values;
    private final double[] variances;
    private final Unit unit;

    private Variable(Dimensions dims, double[] values, double[] variances, Unit unit) {
        this.dims = dims;
        this.values = values;
        this.variances = variances;
        this.unit = unit;
    }

    /// Creates a variable, copying the values.
    ///
    /// @throws ShapeException if the value count does not match the dimensions' volume
    public static Variable of(Dimensions dims, Unit unit, double... values) {
        Objects.requireNonNull(dims, "dims cannot be null");
        Objects.requireNonNull(unit, "unit cannot be null");
        Objects.requireNonNull(values, "values cannot be null");
        if (values.length != dims.volume()) {
            throw new ShapeException("expected " + dims.volume() + " values for " + dims + " but got " + values.length);
        }
        return new Variable(dims, values.clone(), null, unit);
    }

    /// Creates a one-dimensional variable.
    public static Variable vector(String dim, Unit unit, double... values) {
        return of(Dimensions.of(dim, values.length), unit, values);
    }

    /// Creates a zero-dimensional variable.
    public static Variable scalar(double value, Unit unit) {
        return of(Dimensions.scalar(), unit, value);
    }

    /// Creates a variable of zeros.
    public static Variable zeros(Dimensions dims, Unit unit) {
        return new Variable(dims, new double[dims.volume()], null, unit);
    }

    /// Creates `num` evenly spaced values from `start` to `stop`, both included.
    ///
    /// @throws IllegalArgumentException if `num` is less than 2
    public static Variable linspace(String dim, Unit unit, double start, double stop, int num) {
        if (num < 2) {
            throw new IllegalArgumentException("linspace needs at least 2 points, got " + num);
        }
        double[] values = new double[num];
        double step = (stop - start) / (num - 1);
        for (int i = 0; i < num; i++) {
            values[i] = start + i * step;
        }
        values[num - 1] = stop;
        return new Variable(Dimensions.of(dim, num), values, null, unit);
    }

    /// Returns a copy carrying the given variances.
    ///
    /// @param variances one variance per value, or null to drop variances
    public Variable withVariances(double[] variances) {
        if (variances != null && variances.length != values.length) {
            throw new ShapeException("expected " + values.length + " variances but got " + variances.length);
        }
        return new Variable(dims, values, variances == null ? null : variances.clone(), unit);
    }

    public Variable withUnit(Unit unit) {
        return new Variable(dims, values, variances, Objects.requireNonNull(unit, "unit cannot be null"));
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

    public Unit unit() {
        return unit;
    }

    public double[] values() {
        return values.clone();
    }

    /// @return a copy of the variances, or null when the variable has none
    public double[] variances() {
        return variances == null ? null : variances.clone();
    }

    public boolean hasVariances() {
        return variances != null;
    }

    public double value(int... index) {
        return values[dims.offset(index)];
    }

    public double variance(int... index) {
        if (variances == null) {
            throw new IllegalStateException("variable has no variances");
        }
        return variances[dims.offset(index)];
    }

    /// The value of a zero-dimensional variable, as a quantity.
    public Quantity toQuantity() {
        if (dims.ndim() != 0) {
            throw new ShapeException("expected a scalar but got " + dims);
        }
        return new Quantity(values[0], unit);
    }

    /// Selects one index along `dim` and drops the dimension.
    public Variable slice(String dim, int index) {
        int size = dims.size(dim);
        if (index < 0 || index >= size) {
            throw new IndexOutOfBoundsException("index " + index + " out of range for '" + dim + "' of extent " + size);
        }
        int[] map = IndexMaps.slice(dims, dim, index, index + 1);
        return gather(dims.without(dim), map);
    }

    /// Selects the half-open index range `[lo, hi)` along `dim`, keeping the dimension.
    public Variable slice(String dim, int lo, int hi) {
        int size = dims.size(dim);
        if (lo < 0 || hi > size || lo > hi) {
            throw new IndexOutOfBoundsException("range [" + lo + ", " + hi + ") out of range for '" + dim + "' of extent " + size);
        }
        int[] map = IndexMaps.slice(dims, dim, lo, hi);
        return gather(dims.withSize(dim, hi - lo), map);
    }

    /// Broadcasts to `target`, which must contain every dimension of this variable with the same extent.
    public Variable broadcast(Dimensions target) {
        if (target.equals(dims)) {
            return this;
        }
        return gather(target, IndexMaps.broadcast(dims, target));
    }

    /// Reorders the dimensions.
    public Variable transpose(List<String> order) {
        return broadcast(dims.transpose(order));
    }

    /// Differences of adjacent values along `dim`; for bin edges these are the bin widths.
    ///
    /// @throws ShapeException if the extent along `dim` is zero
    public Variable diff(String dim) {
        int size = dims.size(dim);
        if (size == 0) {
            throw new ShapeException("cannot take differences along empty dimension '" + dim + "'");
        }
        Variable upper = slice(dim, 1, size);
        Variable lower = slice(dim, 0, size - 1);
        double[] widths = new double[upper.values.length];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = upper.values[i] - lower.values[i];
        }
        return new Variable(upper.dims, widths, null, unit);
    }

    /// Multiplies values by a dimensionless factor broadcast to these dimensions.
    ///
    /// Variances are multiplied by the square of the factor.
    ///
    /// @throws UnitException if `factors` is not dimensionless
    public Variable scaleBy(Variable factors) {
        return scale(factors, false);
    }

    /// Divides values by a dimensionless factor broadcast to these dimensions, and variances by its square.
    public Variable scaleByInverse(Variable factors) {
        return scale(factors, true);
    }

    private Variable scale(Variable factors, boolean inverse) {
        Unit.DIMENSIONLESS.requireSame(factors.unit, "scale factor");
        double[] f = factors.broadcast(dims).values;
        double[] newValues = new double[values.length];
        double[] newVariances = variances == null ? null : new double[values.length];
        for (int i = 0; i < values.length; i++) {
            double factor = inverse ? 1.0 / f[i] : f[i];
            newValues[i] = values[i] * factor;
            if (newVariances != null) {
                newVariances[i] = variances[i] * factor * factor;
            }
        }
        return new Variable(dims, newValues, newVariances, unit);
    }

    public Quantity sum() {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return new Quantity(total, unit);
    }

    /// @throws EmptyRangeException if the variable has no elements
    public Quantity min() {
        requireNonEmpty();
        return new Quantity(Arrays.stream(values).min().orElseThrow(), unit);
    }

    /// @throws EmptyRangeException if the variable has no elements
    public Quantity max() {
        requireNonEmpty();
        return new Quantity(Arrays.stream(values).max().orElseThrow(), unit);
    }

    private void requireNonEmpty() {
        if (values.length == 0) {
            throw new EmptyRangeException("variable with dimensions " + dims + " has no elements");
        }
    }

    /// True if this variable has one more element along `dim` than `data`.
    ///
    /// @param data the dimensions of the data the coordinate belongs to
    /// @param dim the dimension to check
    public boolean isEdgesFor(Dimensions data, String dim) {
        return dims.contains(dim) && data.contains(dim) && dims.size(dim) == data.size(dim) + 1;
    }

    /// True if the values are sorted along `dim` in every row, ascending (non-strict).
    public boolean isSortedAscending(String dim) {
        return isSorted(dim, true);
    }

    /// True if the values are sorted along `dim` in every row, descending (non-strict).
    public boolean isSortedDescending(String dim) {
        return isSorted(dim, false);
    }

    private boolean isSorted(String dim, boolean ascending) {
        int outer = dims.outerVolume(dim);
        int inner = dims.innerVolume(dim);
        int size = dims.size(dim);
        for (int o = 0; o < outer; o++) {
            for (int k = 0; k < inner; k++) {
                for (int i = 1; i < size; i++) {
                    double prev = values[(o * size + i - 1) * inner + k];
                    double cur = values[(o * size + i) * inner + k];
                    if (ascending ? cur < prev : cur > prev) {
                        return false;
                    }
                }
            }
        }
        return true;
    }

    private Variable gather(Dimensions newDims, int[] map) {
        double[] newVariances = variances == null ? null : IndexMaps.gather(variances, map);
        return new Variable(newDims, IndexMaps.gather(values, map), newVariances, unit);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Variable that)) return false;
        return dims.equals(that.dims) && unit.equals(that.unit)
            && Arrays.equals(values, that.values) && Arrays.equals(variances, that.variances);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dims, unit, Arrays.hashCode(values), Arrays.hashCode(variances));
    }

    @Override
    public String toString() {
        String shown = values.length <= 8 ? Arrays.toString(values) : "[" + values.length + " values]";
        return "Variable" + dims + "[" + unit + "]" + shown + (variances != null ? " +variances" : "");
    }
}
