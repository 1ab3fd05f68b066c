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

import java.util.Objects;

/// A scalar physical value with a unit.
///
/// Addition, subtraction and comparison require identical units and raise
/// [UnitException] otherwise. Multiplication and division combine units.
///
/// @param value the magnitude
/// @param unit the unit of the magnitude
public record Quantity(double value, Unit unit) implements Comparable<Quantity> {

    public Quantity {
        Objects.requireNonNull(unit, "unit cannot be null");
    }

    public static Quantity of(double value, Unit unit) {
        return new Quantity(value, unit);
    }

    public static Quantity of(double value, String unit) {
        return new Quantity(value, Unit.parse(unit));
    }

    public static Quantity dimensionless(double value) {
        return new Quantity(value, Unit.DIMENSIONLESS);
    }

    public Quantity plus(Quantity other) {
        unit.requireSame(other.unit, "addition");
        return new Quantity(value + other.value, unit);
    }

    public Quantity minus(Quantity other) {
        unit.requireSame(other.unit, "subtraction");
        return new Quantity(value - other.value, unit);
    }

    public Quantity times(Quantity other) {
        return new Quantity(value * other.value, unit.times(other.unit));
    }

    public Quantity times(double factor) {
        return new Quantity(value * factor, unit);
    }

    public Quantity divide(Quantity other) {
        return new Quantity(value / other.value, unit.divide(other.unit));
    }

    public Quantity abs() {
        return new Quantity(Math.abs(value), unit);
    }

    @Override
    public int compareTo(Quantity other) {
        unit.requireSame(other.unit, "comparison");
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return unit.isDimensionless() ? Double.toString(value) : value + " " + unit;
    }
}
