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
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// A physical unit expressed as a product of named base symbols with integer exponents.
///
/// ## Examples
///
/// | Text | Powers |
/// |------|--------|
/// | `counts` | counts¹ |
/// | `counts/us` | counts¹ us⁻¹ |
/// | `m^2` | m² |
/// | `dimensionless` or empty | (none) |
///
/// No scale factors are modeled: `m` and `mm` are distinct, incompatible symbols.
/// Two units are equal when their symbol powers are equal.
public final class Unit {

    public static final Unit DIMENSIONLESS = new Unit(Map.of());
    public static final Unit COUNTS = symbol("counts");
    public static final Unit METER = symbol("m");
    public static final Unit SECOND = symbol("s");
    public static final Unit MICROSECOND = symbol("us");
    public static final Unit ANGSTROM = symbol("angstrom");
    public static final Unit MEV = symbol("meV");

    private final Map<String, Integer> powers;

    private Unit(Map<String, Integer> powers) {
        this.powers = powers;
    }

    /// Creates a unit made of one base symbol.
    public static Unit symbol(String name) {
        Objects.requireNonNull(name, "name cannot be null");
        if (name.isBlank() || !name.chars().allMatch(Character::isLetter)) {
            throw new UnitException("invalid unit symbol '" + name + "'");
        }
        return new Unit(Map.of(name, 1));
    }

    /// Parses a unit expression such as `counts`, `m/s`, `1/angstrom` or `counts*m^2/us`.
    ///
    /// @param text the unit expression
    /// @return the parsed unit
    /// @throws UnitException if the expression cannot be parsed
    public static Unit parse(String text) {
        Objects.requireNonNull(text, "unit text cannot be null");
        String trimmed = text.trim();
        if (trimmed.isEmpty() || trimmed.equals("one") || trimmed.equals("dimensionless") || trimmed.equals("1")) {
            return DIMENSIONLESS;
        }
        Unit result = DIMENSIONLESS;
        String[] fractionParts = trimmed.split("/", -1);
        for (int f = 0; f < fractionParts.length; f++) {
            int sign = f == 0 ? 1 : -1;
            for (String factor : fractionParts[f].split("\\*", -1)) {
                result = result.times(parseFactor(factor.trim(), text).pow(sign));
            }
        }
        return result;
    }

    private static Unit parseFactor(String factor, String text) {
        if (factor.equals("1") && !text.trim().startsWith("/")) {
            return DIMENSIONLESS;
        }
        int caret = factor.indexOf('^');
        try {
            if (caret < 0) {
                return symbol(factor);
            }
            int exponent = Integer.parseInt(factor.substring(caret + 1).trim());
            return symbol(factor.substring(0, caret).trim()).pow(exponent);
        } catch (NumberFormatException | UnitException e) {
            throw new UnitException("cannot parse unit '" + text + "': bad factor '" + factor + "'");
        }
    }

    public Map<String, Integer> powers() {
        return powers;
    }

    public boolean isDimensionless() {
        return powers.isEmpty();
    }

    /// True if values in this unit are counts, which makes sum the natural aggregation.
    public boolean isCountLike() {
        return equals(COUNTS);
    }

    public Unit times(Unit other) {
        Map<String, Integer> combined = new TreeMap<>(powers);
        other.powers.forEach((name, power) -> combined.merge(name, power, Integer::sum));
        combined.values().removeIf(p -> p == 0);
        return new Unit(Collections.unmodifiableMap(combined));
    }

    public Unit divide(Unit other) {
        return times(other.pow(-1));
    }

    public Unit pow(int exponent) {
        if (exponent == 0) {
            return DIMENSIONLESS;
        }
        Map<String, Integer> raised = new TreeMap<>();
        powers.forEach((name, power) -> raised.put(name, power * exponent));
        return new Unit(Collections.unmodifiableMap(raised));
    }

    /// Throws if `other` differs from this unit.
    ///
    /// @param other the unit to compare against
    /// @param context what is being checked, for the error message
    /// @throws UnitException on mismatch
    public void requireSame(Unit other, String context) {
        if (!equals(other)) {
            throw new UnitException(context + ": expected unit '" + this + "' but got '" + other + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Unit unit)) return false;
        return powers.equals(unit.powers);
    }

    @Override
    public int hashCode() {
        return powers.hashCode();
    }

    @Override
    public String toString() {
        if (powers.isEmpty()) {
            return "dimensionless";
        }
        StringBuilder numerator = new StringBuilder();
        StringBuilder denominator = new StringBuilder();
        for (Map.Entry<String, Integer> entry : new TreeMap<>(powers).entrySet()) {
            StringBuilder target = entry.getValue() > 0 ? numerator : denominator;
            int power = Math.abs(entry.getValue());
            if (target.length() > 0) target.append('*');
            target.append(entry.getKey());
            if (power != 1) target.append('^').append(power);
        }
        if (denominator.length() == 0) {
            return numerator.toString();
        }
        return (numerator.length() == 0 ? "1" : numerator) + "/" + denominator;
    }
}
