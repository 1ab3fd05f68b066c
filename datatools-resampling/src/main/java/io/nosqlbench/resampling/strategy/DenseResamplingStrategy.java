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

import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Unit;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.resampling.ResamplingMode;
import io.nosqlbench.resampling.edges.EdgeNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Resamples dense arrays by rebinning one dimension at a time.
///
/// ## Modes
///
/// - [ResamplingMode#SUM]: values are rebinned directly, so the total is conserved over
///   the covered range.
/// - [ResamplingMode#MEAN]: values are multiplied by the old bin widths, rebinned as a
///   sum and divided by the new bin widths. This is exact for quantities that are
///   constant within each source bin.
///
/// Variances follow the values through the same steps.
public class DenseResamplingStrategy extends AbstractResamplingStrategy {

    private static final Logger logger = LogManager.getLogger(DenseResamplingStrategy.class);

    public DenseResamplingStrategy(ArrayEngine engine) {
        super(engine);
    }

    @Override
    public LabeledArray resample(LabeledArray array, List<Variable> edges, ResamplingMode mode) {
        if (array.isBinned()) {
            throw new IllegalArgumentException("dense resampling of binned array '" + array.name() + "'");
        }
        ResamplingMode resolved = mode.resolve(array.unit());
        List<Variable> plan = rebinOrder(array, edges);
        logger.debug("rebinning {} in {} mode along {}", array.dims(), resolved, plan.stream().map(AbstractResamplingStrategy::dimOf).toList());

        Variable data = array.data();
        Set<String> resampled = new HashSet<>();
        for (Variable target : plan) {
            String dim = dimOf(target);
            Variable oldEdges = EdgeNormalizer.edgesFor(array, dim);
            data = resolved == ResamplingMode.MEAN
                ? rebinMean(data, dim, oldEdges, target)
                : engine.rebin(data, dim, oldEdges, target);
            resampled.add(dim);
        }

        LabeledArray result = LabeledArray.dense(data).withName(array.name());
        for (Map.Entry<String, Variable> entry : array.coords().entrySet()) {
            if (!resampled.contains(entry.getKey()) && Collections.disjoint(entry.getValue().labels(), resampled)) {
                result = result.withCoord(entry.getKey(), entry.getValue());
            }
        }
        for (Variable target : plan) {
            result = result.withCoord(dimOf(target), target);
        }
        for (Map.Entry<String, Mask> entry : resampleMasks(array, plan).entrySet()) {
            result = result.withMask(entry.getKey(), entry.getValue());
        }
        return result;
    }

    private Variable rebinMean(Variable data, String dim, Variable oldEdges, Variable newEdges) {
        Variable oldWidths = oldEdges.diff(dim).withUnit(Unit.DIMENSIONLESS);
        Variable newWidths = newEdges.diff(dim).withUnit(Unit.DIMENSIONLESS);
        return engine.rebin(data.scaleBy(oldWidths), dim, oldEdges, newEdges).scaleByInverse(newWidths);
    }
}
