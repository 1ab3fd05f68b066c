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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Columnar table of raw event records.
///
/// Every event has a weight (with optional variance) and zero or more coordinate
/// values, one column per coordinate name. Event coordinates are what binning and
/// histogramming partition on.
///
/// ```java
/// EventTable events = EventTable.builder(Unit.COUNTS)
///     .coord("x", Unit.METER, 0.1, 0.7, 1.3)
///     .weights(1.0, 1.0, 2.0)
///     .build();
/// ```
///
/// Instances are immutable.
public final class EventTable {

    private final int size;
    private final Map<String, double[]> coords;
    private final Map<String, Unit> coordUnits;
    private final double[] weights;
    private final double[] variances;
    private final Unit unit;

    private EventTable(int size, Map<String, double[]> coords, Map<String, Unit> coordUnits,
                       double[] weights, double[] variances, Unit unit) {
        this.size = size;
        this.coords = coords;
        this.coordUnits = coordUnits;
        this.weights = weights;
        this.variances = variances;
        this.unit = unit;
    }

    public static Builder builder(Unit weightUnit) {
        return new Builder(weightUnit);
    }

    public int size() {
        return size;
    }

    public Unit unit() {
        return unit;
    }

    public Set<String> coordNames() {
        return Collections.unmodifiableSet(coords.keySet());
    }

    public boolean hasCoord(String name) {
        return coords.containsKey(name);
    }

    /// @throws DimensionException if the table has no such coordinate column
    public Unit coordUnit(String name) {
        requireCoord(name);
        return coordUnits.get(name);
    }

    /// @throws DimensionException if the table has no such coordinate column
    public double coord(String name, int row) {
        return requireCoord(name)[row];
    }

    public double weight(int row) {
        return weights[row];
    }

    public boolean hasVariances() {
        return variances != null;
    }

    public double variance(int row) {
        if (variances == null) {
            throw new IllegalStateException("event table has no weight variances");
        }
        return variances[row];
    }

    /// Returns a new table made of the given rows, in the given order.
    public EventTable select(int[] rows) {
        Map<String, double[]> selected = new LinkedHashMap<>();
        coords.forEach((name, column) -> selected.put(name, IndexMaps.gather(column, rows)));
        double[] selectedVariances = variances == null ? null : IndexMaps.gather(variances, rows);
        return new EventTable(rows.length, selected, coordUnits, IndexMaps.gather(weights, rows), selectedVariances, unit);
    }

    private double[] requireCoord(String name) {
        double[] column = coords.get(name);
        if (column == null) {
            throw new DimensionException("event table has no coordinate '" + name + "', available: " + coords.keySet());
        }
        return column;
    }

    @Override
    public String toString() {
        return "EventTable[" + size + " events, coords=" + coords.keySet() + ", unit=" + unit + "]";
    }

    /// Builder for [EventTable]. Weights default to 1 when not given.
    public static final class Builder {
        private final Unit unit;
        private final Map<String, double[]> coords = new LinkedHashMap<>();
        private final Map<String, Unit> coordUnits = new LinkedHashMap<>();
        private double[] weights;
        private double[] variances;

        private Builder(Unit unit) {
            this.unit = Objects.requireNonNull(unit, "unit cannot be null");
        }

        public Builder coord(String name, Unit unit, double... values) {
            coords.put(name, values.clone());
            coordUnits.put(name, Objects.requireNonNull(unit, "unit cannot be null"));
            return this;
        }

        public Builder weights(double... weights) {
            this.weights = weights.clone();
            return this;
        }

        public Builder variances(double... variances) {
            this.variances = variances.clone();
            return this;
        }

        /// @throws ShapeException if the columns differ in length
        public EventTable build() {
            int size = weights != null ? weights.length
                : coords.values().stream().findFirst().map(c -> c.length).orElse(0);
            double[] w = weights;
            if (w == null) {
                w = new double[size];
                Arrays.fill(w, 1.0);
            }
            for (Map.Entry<String, double[]> entry : coords.entrySet()) {
                if (entry.getValue().length != size) {
                    throw new ShapeException("coordinate '" + entry.getKey() + "' has " + entry.getValue().length
                        + " events but table has " + size);
                }
            }
            if (variances != null && variances.length != size) {
                throw new ShapeException("got " + variances.length + " variances for " + size + " events");
            }
            return new EventTable(size, new LinkedHashMap<>(coords), new LinkedHashMap<>(coordUnits), w, variances, unit);
        }
    }
}
