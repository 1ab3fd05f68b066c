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

package io.nosqlbench.resampling;

import io.nosqlbench.arrays.BinnedData;
import io.nosqlbench.arrays.DimensionException;
import io.nosqlbench.arrays.Dimensions;
import io.nosqlbench.arrays.EmptyRangeException;
import io.nosqlbench.arrays.EventTable;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Quantity;
import io.nosqlbench.arrays.Unit;
import io.nosqlbench.arrays.UnitException;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.resampling.cache.CachePolicy;
import io.nosqlbench.resampling.cache.LruViewCache;
import io.nosqlbench.resampling.strategy.BinnedResamplingStrategy;
import io.nosqlbench.resampling.strategy.DenseResamplingStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class ResamplingPolicyTest {

    private CountingArrayEngine engine;

    @BeforeEach
    void setUp() {
        engine = new CountingArrayEngine();
    }

    private ResamplingPolicy policy(LabeledArray source) {
        return new ResamplingPolicy(source, ResamplingConfig.defaults(), engine);
    }

    /// 100 bins of unit width over x in [0, 100] m; bin i holds i counts.
    private static LabeledArray hundred() {
        double[] values = new double[100];
        double[] edges = new double[101];
        for (int i = 0; i <= 100; i++) {
            edges[i] = i;
            if (i < 100) {
                values[i] = i;
            }
        }
        return LabeledArray.dense(Variable.vector("x", Unit.COUNTS, values))
            .withCoord("x", Variable.vector("x", Unit.METER, edges));
    }

    /// Ten unit bins over x in [0, 10] m holding 1 to 10 counts.
    private static LabeledArray ten() {
        return LabeledArray.dense(Variable.vector("x", Unit.COUNTS, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10))
            .withCoord("x", Variable.linspace("x", Unit.METER, 0, 10, 11));
    }

    /// A 4 x 3 grid of counts with edge coordinates.
    private static LabeledArray grid() {
        return LabeledArray.dense(Variable.of(Dimensions.of(List.of("x", "y"), 4, 3), Unit.COUNTS,
                1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12))
            .withCoord("x", Variable.vector("x", Unit.METER, 0, 1, 2, 3, 4))
            .withCoord("y", Variable.vector("y", Unit.SECOND, 0, 1, 2, 3));
    }

    @Test
    void testHundredValuesIntoTenBins() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", null);
        policy.resolution().put("x", 10);

        LabeledArray view = policy.data();
        assertThat(view.dims()).isEqualTo(Dimensions.of("x", 10));
        for (int j = 0; j < 10; j++) {
            assertThat(view.data().value(j)).isCloseTo(100.0 * j + 45, within(1e-9));
        }
        assertThat(view.data().sum().value()).isCloseTo(4950, within(1e-9));
        assertThat(view.coord("x").values()).containsExactly(
            new double[]{0, 10, 20, 30, 40, 50, 60, 70, 80, 90, 100}, within(1e-12));
        assertThat(view.unit()).isEqualTo(Unit.COUNTS);
    }

    @Test
    void testRepeatedRequestIsServedFromCache() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", Bound.full());
        policy.resolution().put("x", 10);

        LabeledArray first = policy.data();
        int calls = engine.computeCalls();
        LabeledArray second = policy.compute();

        assertThat(calls).isEqualTo(1);
        assertThat(engine.computeCalls()).isEqualTo(calls);
        assertThat(second).isEqualTo(first);
        assertThat(second.masks()).isEqualTo(first.masks());
    }

    @Test
    void testCacheHitDoesNotSliceSource() {
        SelectionCountingPolicy policy = new SelectionCountingPolicy(grid(), engine);
        policy.bounds().put("y", Bound.indexRange(0, 2));
        policy.bounds().put("x", Bound.range(Quantity.of(1, Unit.METER), Quantity.of(3, Unit.METER)));
        policy.resolution().put("x", 2);

        LabeledArray first = policy.data();
        assertThat(first.dims()).isEqualTo(Dimensions.of(List.of("x", "y"), 2, 2));
        assertThat(first.data().values()).containsExactly(new double[]{4, 5, 7, 8}, within(1e-9));
        assertThat(policy.selections).isEqualTo(1);

        for (int i = 0; i < 5; i++) {
            assertThat(policy.data()).isSameAs(first);
            policy.mask();
        }
        assertThat(policy.selections).isEqualTo(1);
        assertThat(engine.rebinCalls).isEqualTo(1);

        policy.bounds().put("y", Bound.indexRange(0, 5));
        assertThatThrownBy(policy::data).isInstanceOf(IndexOutOfBoundsException.class);
        assertThat(policy.selections).isEqualTo(1);
    }

    @Test
    void testHomeAndLastViewsAreReused() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", null);

        policy.resolution().put("x", 10);
        LabeledArray home = policy.data();
        policy.resolution().put("x", 5);
        policy.data();
        assertThat(engine.rebinCalls).isEqualTo(2);

        policy.resolution().put("x", 10);
        assertThat(policy.data()).isSameAs(home);
        policy.resolution().put("x", 5);
        policy.data();
        assertThat(engine.rebinCalls).isEqualTo(2);

        policy.resolution().put("x", 4);
        policy.data();
        policy.resolution().put("x", 5);
        policy.data();
        assertThat(engine.rebinCalls).isEqualTo(4);
        policy.resolution().put("x", 10);
        assertThat(policy.data()).isSameAs(home);
        assertThat(engine.rebinCalls).isEqualTo(4);
    }

    @Test
    void testResetForcesRecomputation() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", null);
        policy.resolution().put("x", 10);
        policy.data();
        policy.reset();
        assertThat(policy.cache().size()).isZero();
        policy.data();
        assertThat(engine.rebinCalls).isEqualTo(2);
    }

    @Test
    void testFailedComputeLeavesCacheUntouched() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", null);
        policy.resolution().put("x", 10);

        engine.failNextRebin = true;
        assertThatThrownBy(policy::data).isInstanceOf(IllegalStateException.class);
        assertThat(policy.cache().size()).isZero();
        assertThat(policy.cache().homeSignature()).isEmpty();

        LabeledArray home = policy.data();
        policy.resolution().put("x", 5);
        engine.failNextRebin = true;
        assertThatThrownBy(policy::data).isInstanceOf(IllegalStateException.class);
        assertThat(policy.cache().size()).isEqualTo(1);

        LabeledArray retried = policy.data();
        assertThat(retried.dims().size("x")).isEqualTo(5);
        policy.resolution().put("x", 10);
        assertThat(policy.data()).isSameAs(home);
    }

    @Test
    void testSingleBinWithoutResolutionIsSqueezed() {
        ResamplingPolicy squeezed = policy(grid());
        squeezed.bounds().put("x", null);
        LabeledArray view = squeezed.data();
        assertThat(view.labels()).containsExactly("y");
        assertThat(view.data().values()).containsExactly(new double[]{22, 26, 30}, within(1e-9));
        assertThat(view.hasCoord("x")).isFalse();

        ResamplingPolicy kept = policy(grid());
        kept.bounds().put("x", null);
        kept.resolution().put("x", 1);
        LabeledArray single = kept.data();
        assertThat(single.dims()).isEqualTo(Dimensions.of(List.of("x", "y"), 1, 3));
        assertThat(single.slice("x", 0).data()).isEqualTo(view.data());
    }

    @Test
    void testIndexOnSingleBinMatchesSqueezedResample() {
        LabeledArray single = LabeledArray.dense(Variable.of(Dimensions.of(List.of("x", "y"), 1, 3), Unit.COUNTS,
                2, 5, 11))
            .withCoord("x", Variable.vector("x", Unit.METER, 0, 1))
            .withCoord("y", Variable.vector("y", Unit.SECOND, 0, 1, 2, 3));

        ResamplingPolicy indexed = policy(single);
        indexed.bounds().put("x", Bound.index(0));
        ResamplingPolicy squeezed = policy(single);
        squeezed.bounds().put("x", null);

        LabeledArray byIndex = indexed.data();
        LabeledArray byResample = squeezed.data();
        assertThat(byResample.dims()).isEqualTo(byIndex.dims());
        assertThat(byResample.data()).isEqualTo(byIndex.data());
        assertThat(byResample.coords()).isEqualTo(byIndex.coords());
        assertThat(byIndex.data().values()).containsExactly(2, 5, 11);
    }

    @Test
    void testSingleBinDimensionsArePlannedFirst() {
        ResamplingPolicy policy = policy(grid());
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        policy.bounds().put("y", null);

        LabeledArray view = policy.data();
        assertThat(policy.edges()).hasSize(2);
        assertThat(policy.edges().get(0).labels()).containsExactly("y");
        assertThat(policy.edges().get(1).labels()).containsExactly("x");
        assertThat(view.labels()).containsExactly("x");
        assertThat(view.data().values()).containsExactly(new double[]{21, 57}, within(1e-9));
    }

    @Test
    void testConfiguredDefaultResolution() {
        ResamplingConfig config = new ResamplingConfig().setDefaultResolution(4);
        ResamplingPolicy policy = new ResamplingPolicy(hundred(), config, engine);
        policy.bounds().put("x", null);
        LabeledArray view = policy.data();
        assertThat(view.dims()).isEqualTo(Dimensions.of("x", 4));
        assertThat(view.data().value(0)).isCloseTo(300, within(1e-9));
    }

    @Test
    void testIndexBoundSelectsWithoutResampling() {
        ResamplingPolicy policy = policy(grid());
        policy.bounds().put("x", Bound.index(2));
        LabeledArray view = policy.data();
        assertThat(view.labels()).containsExactly("y");
        assertThat(view.data().values()).containsExactly(7, 8, 9);
        assertThat(engine.computeCalls()).isZero();
        assertThat(policy.edges()).isEmpty();
    }

    @Test
    void testIndexRangeKeepsWindow() {
        ResamplingPolicy policy = policy(grid());
        policy.bounds().put("x", Bound.indexRange(1, 3));
        LabeledArray view = policy.data();
        assertThat(view.dims()).isEqualTo(Dimensions.of(List.of("x", "y"), 2, 3));
        assertThat(view.coord("x").values()).containsExactly(1, 2, 3);
        assertThat(view.data().values()).containsExactly(4, 5, 6, 7, 8, 9);
    }

    @Test
    void testIndexAndResampleCombined() {
        ResamplingPolicy policy = policy(grid());
        policy.bounds().put("y", Bound.index(0));
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        LabeledArray view = policy.data();
        assertThat(view.labels()).containsExactly("x");
        assertThat(view.data().values()).containsExactly(new double[]{5, 17}, within(1e-9));
    }

    @Test
    void testValueRangeNarrowsSourceFirst() {
        ResamplingPolicy policy = policy(ten());
        policy.bounds().put("x", Bound.range(Quantity.of(2.5, Unit.METER), Quantity.of(5.5, Unit.METER)));
        policy.resolution().put("x", 3);

        LabeledArray view = policy.data();
        assertThat(engine.lastRebinInput).isEqualTo(Dimensions.of("x", 4));
        assertThat(view.data().values()).containsExactly(new double[]{3.5, 4.5, 5.5}, within(1e-9));
        assertThat(view.coord("x").values()).containsExactly(new double[]{2.5, 3.5, 4.5, 5.5}, within(1e-12));
    }

    @Test
    void testInvertedRangeIsNormalized() {
        ResamplingPolicy policy = policy(ten());
        policy.resolution().put("x", 3);
        policy.bounds().put("x", Bound.range(Quantity.of(2.5, Unit.METER), Quantity.of(5.5, Unit.METER)));
        LabeledArray forward = policy.data();

        policy.bounds().put("x", Bound.range(Quantity.of(5.5, Unit.METER), Quantity.of(2.5, Unit.METER)));
        LabeledArray inverted = policy.data();
        assertThat(inverted).isEqualTo(forward);
        assertThat(engine.rebinCalls).isEqualTo(1);
    }

    @Test
    void testDescendingCoordinate() {
        LabeledArray source = LabeledArray.dense(Variable.vector("x", Unit.COUNTS, 1, 2, 3, 4, 5, 6, 7, 8, 9, 10))
            .withCoord("x", Variable.linspace("x", Unit.METER, 10, 0, 11));
        ResamplingPolicy policy = policy(source);
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        LabeledArray full = policy.data();
        assertThat(policy.edges().get(0).values()).containsExactly(10, 5, 0);
        assertThat(full.data().values()).containsExactly(new double[]{15, 40}, within(1e-9));

        policy.resolution().put("x", 3);
        policy.bounds().put("x", Bound.range(Quantity.of(2, Unit.METER), Quantity.of(8, Unit.METER)));
        LabeledArray zoomed = policy.data();
        assertThat(engine.lastRebinInput).isEqualTo(Dimensions.of("x", 6));
        assertThat(policy.edges().get(0).values()).containsExactly(new double[]{8, 6, 4, 2}, within(1e-12));
        assertThat(zoomed.data().values()).containsExactly(new double[]{7, 11, 15}, within(1e-9));
    }

    @Test
    void testCenterCoordinatesBecomeEdges() {
        LabeledArray source = LabeledArray.dense(Variable.vector("x", Unit.COUNTS, 1, 2, 3, 4))
            .withCoord("x", Variable.vector("x", Unit.METER, 0.5, 1.5, 2.5, 3.5));
        ResamplingPolicy policy = policy(source);
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        LabeledArray view = policy.data();
        assertThat(view.coord("x").values()).containsExactly(0, 2, 4);
        assertThat(view.data().values()).containsExactly(new double[]{3, 7}, within(1e-12));
        assertThat(policy.source()).isSameAs(source);
    }

    @Test
    void testMissingCoordinateUsesIndices() {
        ResamplingPolicy policy = policy(LabeledArray.dense(Variable.vector("x", Unit.COUNTS, 1, 2, 3, 4)));
        policy.bounds().put("x", Bound.range(Quantity.dimensionless(1), Quantity.dimensionless(3)));
        policy.resolution().put("x", 1);
        assertThat(policy.data().data().values()).containsExactly(new double[]{5}, within(1e-12));
    }

    @Test
    void testRequestErrors() {
        ResamplingPolicy policy = policy(ten());

        policy.bounds().put("z", null);
        assertThatThrownBy(policy::data).isInstanceOf(DimensionException.class);
        policy.bounds().clear();

        policy.bounds().put("x", Bound.range(Quantity.of(20, Unit.METER), Quantity.of(30, Unit.METER)));
        assertThatThrownBy(policy::data).isInstanceOf(EmptyRangeException.class);

        policy.bounds().put("x", Bound.range(Quantity.of(3, Unit.METER), Quantity.of(3, Unit.METER)));
        assertThatThrownBy(policy::data).isInstanceOf(EmptyRangeException.class);

        policy.bounds().put("x", Bound.range(Quantity.of(2, Unit.SECOND), Quantity.of(5, Unit.SECOND)));
        assertThatThrownBy(policy::data).isInstanceOf(UnitException.class);

        policy.bounds().put("x", Bound.index(10));
        assertThatThrownBy(policy::data).isInstanceOf(IndexOutOfBoundsException.class);

        policy.bounds().put("x", Bound.indexRange(5, 12));
        assertThatThrownBy(policy::data).isInstanceOf(IndexOutOfBoundsException.class);

        policy.bounds().put("x", null);
        policy.resolution().put("x", 0);
        assertThatThrownBy(policy::data).isInstanceOf(IllegalArgumentException.class);

        assertThat(policy.cache().size()).isZero();
        assertThat(engine.computeCalls()).isZero();
    }

    @Test
    void testEmptySourceDimension() {
        LabeledArray empty = LabeledArray.dense(Variable.vector("x", Unit.COUNTS));
        ResamplingPolicy policy = policy(empty);
        policy.bounds().put("x", null);
        assertThatThrownBy(policy::data).isInstanceOf(EmptyRangeException.class);
    }

    @Test
    void testAutoModeAveragesNonCounts() {
        LabeledArray temperature = LabeledArray.dense(Variable.vector("x", Unit.parse("K"), 2, 2, 2, 2, 2, 2, 2, 2, 2, 2))
            .withCoord("x", Variable.linspace("x", Unit.METER, 0, 10, 11));
        ResamplingPolicy policy = policy(temperature);
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        assertThat(policy.mode()).isEqualTo(ResamplingMode.AUTO);
        assertThat(policy.data().data().values()).containsExactly(new double[]{2, 2}, within(1e-12));

        policy.setMode(ResamplingMode.SUM);
        assertThat(policy.cache().size()).isZero();
        assertThat(policy.data().data().values()).containsExactly(new double[]{10, 10}, within(1e-12));
        assertThat(engine.rebinCalls).isEqualTo(2);

        policy.setMode(ResamplingMode.SUM);
        assertThat(policy.cache().size()).isEqualTo(1);
    }

    @Test
    void testUpdateArrayKeepsCachedViews() {
        ResamplingPolicy policy = policy(hundred());
        policy.bounds().put("x", null);
        policy.resolution().put("x", 10);
        LabeledArray before = policy.data();

        LabeledArray doubled = hundred().withData(hundred().data().scaleBy(
            Variable.scalar(2, Unit.DIMENSIONLESS)));
        policy.updateArray(doubled);
        assertThat(policy.source()).isSameAs(doubled);
        assertThat(policy.data()).isSameAs(before);

        policy.reset();
        assertThat(policy.data().data().value(0)).isCloseTo(90, within(1e-9));
        assertThat(policy.strategy()).isInstanceOf(DenseResamplingStrategy.class);
    }

    @Test
    void testMaskOfView() {
        LabeledArray source = LabeledArray.dense(Variable.vector("x", Unit.COUNTS, 1, 2, 3, 4))
            .withCoord("x", Variable.vector("x", Unit.METER, 0, 1, 2, 3, 4))
            .withMask("dead", Mask.vector("x", false, true, false, false));
        ResamplingPolicy policy = policy(source);
        policy.bounds().put("x", null);
        policy.resolution().put("x", 2);
        assertThat(policy.mask()).contains(Mask.vector("x", true, false));

        policy.bounds().put("x", Bound.index(1));
        assertThat(policy.data().masks().get("dead").ndim()).isZero();
        assertThat(policy.mask()).isEmpty();
    }

    @Test
    void testBinnedSourceUsesBinnedStrategy() {
        EventTable table = EventTable.builder(Unit.COUNTS)
            .coord("x", Unit.METER, 0.5, 1.5, 2.5, 3.5, 0.2, 1.1, 2.2, 3.3, 1.9, 2.1)
            .coord("y", Unit.METER, 0.5, 1.5, 2.5, 0.2, 1.2, 2.2, 0.8, 1.8, 2.8, 1.0)
            .weights(1, 2, 3, 4, 5, 6, 7, 8, 9, 10)
            .build();
        LabeledArray events = LabeledArray.binned(
                BinnedData.fromOffsets(Dimensions.of(List.of("x", "y"), 1, 1), table, new int[]{0, 10}))
            .withCoord("x", Variable.vector("x", Unit.METER, 0, 4))
            .withCoord("y", Variable.vector("y", Unit.METER, 0, 3));

        ResamplingPolicy policy = policy(events);
        policy.bounds().put("x", null);
        policy.bounds().put("y", null);
        policy.resolution().put("x", 2);
        policy.resolution().put("y", 3);

        LabeledArray view = policy.data();
        assertThat(policy.strategy()).isInstanceOf(BinnedResamplingStrategy.class);
        assertThat(view.isBinned()).isFalse();
        assertThat(view.data().values()).containsExactly(1, 7, 15, 11, 18, 3);

        policy.bounds().put("x", Bound.range(Quantity.of(0, Unit.METER), Quantity.of(2, Unit.METER)));
        policy.resolution().put("x", 1);
        LabeledArray left = policy.data();
        assertThat(left.dims()).isEqualTo(Dimensions.of(List.of("x", "y"), 1, 3));
        assertThat(left.data().values()).containsExactly(1, 7, 15);
    }

    @Test
    void testLruCachePolicy() {
        ResamplingConfig config = new ResamplingConfig().setCache(CachePolicy.LRU).setCacheCapacity(2);
        ResamplingPolicy policy = new ResamplingPolicy(hundred(), config, engine);
        assertThat(policy.cache()).isInstanceOf(LruViewCache.class);
        policy.bounds().put("x", null);
        for (int resolution : new int[]{10, 5, 4, 5, 4, 10}) {
            policy.resolution().put("x", resolution);
            policy.data();
        }
        assertThat(engine.rebinCalls).isEqualTo(3);
    }

    private static class SelectionCountingPolicy extends ResamplingPolicy {

        int selections;

        SelectionCountingPolicy(LabeledArray source, CountingArrayEngine engine) {
            super(source, ResamplingConfig.defaults(), engine);
        }

        @Override
        LabeledArray select(LabeledArray array, List<Selection> pending) {
            selections++;
            return super.select(array, pending);
        }
    }
}
