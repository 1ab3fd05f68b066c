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

import io.nosqlbench.arrays.BinnedData;
import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.EventTable;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Unit;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.arrays.engine.BinReduction;
import io.nosqlbench.arrays.engine.DefaultArrayEngine;
import io.nosqlbench.resampling.CountingArrayEngine;
import io.nosqlbench.resampling.ResamplingMode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class BinnedResamplingStrategyTest {

    private static final Variable X_EDGES = Variable.vector("x", Unit.METER, 0, 2, 4);
    private static final Variable Y_EDGES = Variable.vector("y", Unit.METER, 0, 1, 2, 3);

    /// Ten weighted events on a single outer cell spanning x in [0, 4) and y in [0, 3).
    static LabeledArray tenEvents() {
        EventTable table = EventTable.builder(Unit.COUNTS)
            .coord("x", Unit.METER, 0.5, 1.5, 2.5, 3.5, 0.2, 1.1, 2.2, 3.3, 1.9, 2.1)
            .coord("y", Unit.METER, 0.5, 1.5, 2.5, 0.2, 1.2, 2.2, 0.8, 1.8, 2.8, 1.0)
            .weights(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)
            .build();
        return LabeledArray.binned(BinnedData.fromOffsets(Dimensions.of(List.of("x", "y"), 1, 1), table, new int[]{0, 10}))
            .withName("events")
            .withCoord("x", Variable.vector("x", Unit.METER, 0, 4))
            .withCoord("y", Variable.vector("y", Unit.METER, 0, 3));
    }

    @Test
    void testMatchesHistogramOfPreBinnedEvents() {
        ArrayEngine engine = new DefaultArrayEngine();
        LabeledArray events = tenEvents();
        LabeledArray result = new BinnedResamplingStrategy(engine)
            .resample(events, List.of(X_EDGES, Y_EDGES), ResamplingMode.SUM);

        LabeledArray expected = engine.histogram(engine.bin(events, List.of(X_EDGES)), Y_EDGES);
        assertThat(result.isBinned()).isFalse();
        assertThat(result.labels()).containsExactly("x", "y");
        assertThat(result.data()).isEqualTo(expected.data());
        assertThat(result.data().values()).containsExactly(1, 7, 15, 11, 18, 3);
        assertThat(result.data().sum().value()).isEqualTo(55);
        assertThat(result.coord("x")).isEqualTo(X_EDGES);
        assertThat(result.coord("y")).isEqualTo(Y_EDGES);
        assertThat(result.name()).isEqualTo("events");
    }

    @Test
    void testHistogramDimensionIsTheFinestOne() {
        CountingArrayEngine engine = new CountingArrayEngine();
        LabeledArray result = new BinnedResamplingStrategy(engine)
            .resample(tenEvents(), List.of(Y_EDGES, X_EDGES), ResamplingMode.SUM);

        assertThat(engine.binCalls).isEqualTo(1);
        assertThat(engine.histogramCalls).isEqualTo(1);
        assertThat(engine.reduceCalls).isZero();
        assertThat(result.labels()).containsExactly("x", "y");
        assertThat(result.data().values()).containsExactly(1, 7, 15, 11, 18, 3);
    }

    @Test
    void testTiesPickTheLastDimension() {
        Variable a = Variable.vector("a", Unit.METER, 0, 1, 2);
        Variable b = Variable.vector("b", Unit.METER, 0, 1, 2);
        Variable c = Variable.vector("c", Unit.METER, 0, 1);
        assertThat(BinnedResamplingStrategy.histogramIndex(List.of(a, b, c))).isEqualTo(1);
        assertThat(BinnedResamplingStrategy.histogramIndex(List.of(c))).isZero();
    }

    @Test
    void testMeanModeAveragesEventsPerBin() {
        ArrayEngine engine = new DefaultArrayEngine();
        LabeledArray events = tenEvents();
        LabeledArray result = new BinnedResamplingStrategy(engine)
            .resample(events, List.of(X_EDGES, Y_EDGES), ResamplingMode.MEAN);
        LabeledArray expected = engine.reduceBins(engine.bin(events, List.of(X_EDGES, Y_EDGES)), BinReduction.MEAN);
        assertThat(result.data().values()).containsExactly(expected.data().values(), within(1e-12));
        assertThat(result.data().values()).containsExactly(new double[]{1, 3.5, 7.5, 5.5, 9, 3}, within(1e-12));
    }

    private static LabeledArray spectra() {
        EventTable table = EventTable.builder(Unit.COUNTS)
            .coord("t", Unit.MICROSECOND, 1, 5, 2, 6, 3, 7, 4, 8)
            .weights(1, 2, 3, 4, 5, 6, 7, 8)
            .build();
        return LabeledArray.binned(BinnedData.fromOffsets(Dimensions.of("spectrum", 4), table, new int[]{0, 2, 4, 6, 8}))
            .withCoord("spectrum", Variable.vector("spectrum", Unit.DIMENSIONLESS, 0, 1, 2, 3, 4))
            .withMask("dead", Mask.vector("spectrum", false, true, false, false));
    }

    @Test
    void testFallbackWhenEventsLackTheCoordinate() {
        CountingArrayEngine engine = new CountingArrayEngine();
        LabeledArray source = spectra();
        LabeledArray result = new BinnedResamplingStrategy(engine).resample(source,
            List.of(Variable.vector("spectrum", Unit.DIMENSIONLESS, 0, 2, 4)), ResamplingMode.SUM);

        assertThat(engine.histogramCalls).isZero();
        assertThat(engine.reduceCalls).isEqualTo(1);
        assertThat(result.data().values()).containsExactly(10, 26);
        assertThat(result.masks().get("dead").values()).containsExactly(true, false);
    }

    @Test
    void testOuterDimensionCombinedWithEventCoordinate() {
        LabeledArray result = new BinnedResamplingStrategy(new DefaultArrayEngine()).resample(spectra(), List.of(
            Variable.vector("spectrum", Unit.DIMENSIONLESS, 0, 2, 4),
            Variable.vector("t", Unit.MICROSECOND, 0, 2, 4, 6, 8, 10)), ResamplingMode.SUM);

        assertThat(result.labels()).containsExactly("spectrum", "t");
        assertThat(result.data().values()).containsExactly(
            1, 3, 2, 4, 0,
            0, 5, 7, 6, 8);
        assertThat(result.masks()).containsOnlyKeys("dead");
    }

    @Test
    void testWithoutEdgesEachCellIsReduced() {
        LabeledArray result = new BinnedResamplingStrategy(new DefaultArrayEngine())
            .resample(spectra(), List.of(), ResamplingMode.SUM);
        assertThat(result.data().values()).containsExactly(3, 7, 11, 15);
        assertThat(result.masks().get("dead")).isEqualTo(spectra().masks().get("dead"));
    }

    @Test
    void testSourceIsNotModified() {
        LabeledArray source = spectra();
        EventTable table = source.bins().events();
        new BinnedResamplingStrategy(new DefaultArrayEngine()).resample(source,
            List.of(Variable.vector("t", Unit.MICROSECOND, 0, 10)), ResamplingMode.MEAN);
        assertThat(source.bins().events()).isSameAs(table);
        assertThat(table.size()).isEqualTo(8);
        assertThat(table.coord("t", 1)).isEqualTo(5);
        assertThat(source.bins().cellSize(0)).isEqualTo(2);
        assertThat(source.masks()).containsOnlyKeys("dead");
    }
}
