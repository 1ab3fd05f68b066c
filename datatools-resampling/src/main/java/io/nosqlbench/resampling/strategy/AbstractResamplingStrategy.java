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

package io.nosqlbench.resampling.strategy;

import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.resampling.edges.EdgeNormalizer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Plan ordering and mask rebinning shared by the strategies.
public abstract class AbstractResamplingStrategy implements ResamplingStrategy {

    protected final ArrayEngine engine;

    protected AbstractResamplingStrategy(ArrayEngine engine) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
    }

    public ArrayEngine engine() {
        return engine;
    }

    protected static String dimOf(Variable edges) {
        if (edges.ndim() != 1) {
            throw new IllegalArgumentException("target edges must be one-dimensional, got " + edges.dims());
        }
        return edges.labels().get(0);
    }

    /// Moves dimensions whose coordinate has more than one dimension to the front, keeping
    /// the relative order otherwise.
    ///
    /// Such a coordinate depends on other dimensions of the data, which must still have
    /// their source extents when it is rebinned.
    protected List<Variable> rebinOrder(LabeledArray array, List<Variable> edges) {
        List<Variable> multi = new ArrayList<>();
        List<Variable> rest = new ArrayList<>();
        for (Variable target : edges) {
            Variable coord = array.findCoord(dimOf(target)).orElse(null);
            if (coord != null && coord.ndim() > 1) {
                multi.add(target);
            } else {
                rest.add(target);
            }
        }
        multi.addAll(rest);
        return multi;
    }

    /// Rebins every mask that depends on a resampled dimension, with OR semantics.
    ///
    /// A mask is first broadcast along the dimensions the old edges depend on, so a mask
    /// along `x` grows a `y` dimension when the `y` coordinate varies with `x`.
    protected Map<String, Mask> resampleMasks(LabeledArray array, List<Variable> plan) {
        Map<String, Mask> result = new LinkedHashMap<>();
        for (Map.Entry<String, Mask> entry : array.masks().entrySet()) {
            Mask mask = entry.getValue();
            for (Variable target : plan) {
                String dim = dimOf(target);
                if (!array.dims().contains(dim)) {
                    continue;
                }
                Variable oldEdges = EdgeNormalizer.edgesFor(array, dim);
                if (Collections.disjoint(oldEdges.labels(), mask.labels())) {
                    continue;
                }
                mask = engine.rebin(broadcastForEdges(mask, array.dims(), oldEdges, dim), dim, oldEdges, target);
            }
            result.put(entry.getKey(), mask);
        }
        return result;
    }

    private static Mask broadcastForEdges(Mask mask, Dimensions source, Variable oldEdges, String dim) {
        if (mask.dims().containsAll(oldEdges.labels())) {
            return mask;
        }
        List<String> labels = new ArrayList<>();
        List<Integer> sizes = new ArrayList<>();
        for (String label : source.labels()) {
            if (mask.dims().contains(label)) {
                labels.add(label);
                sizes.add(mask.dims().size(label));
            } else if (oldEdges.dims().contains(label)) {
                labels.add(label);
                sizes.add(label.equals(dim) ? source.size(dim) : oldEdges.dims().size(label));
            }
        }
        int[] shape = sizes.stream().mapToInt(Integer::intValue).toArray();
        return mask.broadcast(Dimensions.of(labels, shape));
    }
}
