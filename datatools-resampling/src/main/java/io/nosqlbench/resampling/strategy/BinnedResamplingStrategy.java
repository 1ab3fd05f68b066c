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
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.arrays.engine.BinReduction;
import io.nosqlbench.resampling.ResamplingMode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/// Resamples binned (event) arrays into dense views.
///
/// ## Histogram path
///
/// The resampled dimension with the most target bins is the *histogram dimension*. When
/// the events carry a coordinate for it, the events are binned by all other target edges
/// and by the two outer edges of the histogram dimension, then histogrammed along it
/// ([ResamplingMode#SUM]) or binned along it and averaged ([ResamplingMode#MEAN]).
/// Binning on the outer edges first keeps the intermediate binned array small.
/// The histogram dimension is chosen by target bins alone; source extents are not
/// weighed, so the dimension whose events would be cheapest to histogram may be skipped.
///
/// ## Fallback
///
/// Otherwise the events are binned by every target edge set and each bin is reduced to
/// its sum or mean.
///
/// Masks are removed before binning and rebinned densely against the outer coordinates.
/// The result has the source dimension order, followed by dimensions the source lacked.
public class BinnedResamplingStrategy extends AbstractResamplingStrategy {

    private static final Logger logger = LogManager.getLogger(BinnedResamplingStrategy.class);

    public BinnedResamplingStrategy(ArrayEngine engine) {
        super(engine);
    }

    @Override
    public LabeledArray resample(LabeledArray array, List<Variable> edges, ResamplingMode mode) {
        if (!array.isBinned()) {
            throw new IllegalArgumentException("binned resampling of dense array '" + array.name() + "'");
        }
        ResamplingMode resolved = mode.resolve(array.unit());
        BinReduction reduction = resolved == ResamplingMode.MEAN ? BinReduction.MEAN : BinReduction.SUM;
        List<Variable> plan = rebinOrder(array, edges);
        LabeledArray events = array.withoutMasks();

        LabeledArray dense;
        if (plan.isEmpty()) {
            dense = engine.reduceBins(events, reduction);
        } else {
            int histogramIndex = histogramIndex(plan);
            Variable histogramEdges = plan.get(histogramIndex);
            String histogramDim = dimOf(histogramEdges);
            if (array.bins().events().hasCoord(histogramDim)) {
                logger.debug("binning {} events with histogram dimension '{}' in {} mode",
                    array.bins().eventCount(), histogramDim, resolved);
                List<Variable> binEdges = new ArrayList<>(plan);
                binEdges.set(histogramIndex, outerEdges(histogramEdges, histogramDim));
                LabeledArray binned = engine.bin(events, binEdges);
                dense = reduction == BinReduction.MEAN
                    ? engine.reduceBins(engine.bin(binned, List.of(histogramEdges)), BinReduction.MEAN)
                    : engine.histogram(binned, histogramEdges);
            } else {
                logger.debug("events have no coordinate '{}', binning {} events by all edges",
                    histogramDim, array.bins().eventCount());
                dense = engine.reduceBins(engine.bin(events, plan), reduction);
            }
        }

        dense = dense.transpose(sourceOrder(array, dense)).withName(array.name());
        for (Map.Entry<String, Mask> entry : resampleMasks(array, plan).entrySet()) {
            dense = dense.withMask(entry.getKey(), entry.getValue());
        }
        return dense;
    }

    /// Index of the plan entry with the most bins; the last one wins ties.
    static int histogramIndex(List<Variable> plan) {
        int best = 0;
        for (int i = 1; i < plan.size(); i++) {
            if (binCount(plan.get(i)) >= binCount(plan.get(best))) {
                best = i;
            }
        }
        return best;
    }

    private static int binCount(Variable edges) {
        return edges.dims().size(dimOf(edges)) - 1;
    }

    private static Variable outerEdges(Variable edges, String dim) {
        double[] values = edges.values();
        return Variable.vector(dim, edges.unit(), values[0], values[values.length - 1]);
    }

    private static List<String> sourceOrder(LabeledArray source, LabeledArray result) {
        List<String> order = new ArrayList<>();
        for (String label : source.labels()) {
            if (result.dims().contains(label)) {
                order.add(label);
            }
        }
        for (String label : result.labels()) {
            if (!order.contains(label)) {
                order.add(label);
            }
        }
        return order;
    }
}
