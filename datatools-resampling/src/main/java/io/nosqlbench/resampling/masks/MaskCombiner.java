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

package io.nosqlbench.resampling.masks;

import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.Mask;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Combines named masks into one mask over a target set of dimensions.
///
/// A mask qualifies when it has at least one dimension and all of its dimensions are
/// target dimensions. Each qualifying mask is broadcast to the target (in the target's
/// dimension order, replicating along the dimensions it lacks) and the results are
/// OR-ed together.
///
/// Zero-dimensional masks never qualify: they flag the whole array, which is the
/// caller's decision to act on.
///
/// ```java
/// // m_x = [F, T] along x, m_y = [F, T, F] along y
/// Mask union = MaskCombiner.combine(Map.of("x", mX, "y", mY), Dimensions.of(List.of("x", "y"), 2, 3))
///     .orElseThrow();
/// // [[F, F, F],
/// //  [T, T, T]]
/// ```
public final class MaskCombiner {

    private MaskCombiner() {
    }

    /// @param masks masks by name
    /// @param target the dimensions to combine over
    /// @return the union, or empty if no mask qualifies
    public static Optional<Mask> combine(Map<String, Mask> masks, Dimensions target) {
        Objects.requireNonNull(masks, "masks cannot be null");
        Objects.requireNonNull(target, "target cannot be null");
        Mask union = null;
        for (Mask mask : masks.values()) {
            if (mask.ndim() == 0 || !target.containsAll(mask.labels())) {
                continue;
            }
            Mask broadcast = mask.broadcast(target);
            union = union == null ? broadcast : union.or(broadcast);
        }
        return Optional.ofNullable(union);
    }
}
