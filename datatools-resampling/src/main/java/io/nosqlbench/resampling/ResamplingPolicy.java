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

import io.nosqlbench.arrays.DimensionException;
import io.nosqlbench.arrays.EmptyRangeException;
import io.nosqlbench.arrays.LabeledArray;
import io.nosqlbench.arrays.Mask;
import io.nosqlbench.arrays.Quantity;
import io.nosqlbench.arrays.Variable;
import io.nosqlbench.arrays.engine.ArrayEngine;
import io.nosqlbench.arrays.engine.DefaultArrayEngine;
import io.nosqlbench.resampling.cache.ViewCache;
import io.nosqlbench.resampling.edges.EdgeNormalizer;
import io.nosqlbench.resampling.masks.MaskCombiner;
import io.nosqlbench.resampling.strategy.ResamplingStrategy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// # ResamplingPolicy
///
/// Derives bounded-resolution views of a labeled array and caches them.
///
/// ## Usage
///
/// ```java
/// ResamplingPolicy policy = new ResamplingPolicy(array);
/// policy.bounds().put("x", Bound.full());
/// policy.resolution().put("x", 10);
/// LabeledArray view = policy.data();
///
/// policy.bounds().put("x", Bound.range(Quantity.of(2, "m"), Quantity.of(4, "m")));
/// LabeledArray zoomed = policy.data();
/// ```
///
/// ## Request resolution
///
/// Only dimensions named in [#bounds()] are touched. In map order, each dimension is
///
/// - selected and dropped for [Bound#index(int)],
/// - windowed for [Bound#indexRange(int, int)],
/// - resampled over its whole coordinate range for [Bound#full()] or a `null` bound,
/// - resampled between two coordinate values for [Bound#range(Quantity, Quantity)].
///   The values are put into coordinate order, and a one-dimensional coordinate first
///   narrows the source to the bins touching the range.
///
/// A resampled dimension gets `resolution().get(dim)` bins, or the configured default
/// when unset. It is dropped from the view when it ends up with one bin and no explicit
/// resolution.
///
/// ## Views
///
/// Views carry bin-edge coordinates for all their dimensions: center coordinates of the
/// source are converted and missing ones synthesized when the source is set.
///
/// ## Caching
///
/// Each request is reduced to a [RequestSignature]. A request whose signature is cached
/// is answered without calling the strategy or slicing the source; selections and
/// range narrowing are only applied on a miss. A failing request leaves the cache as it
/// was. [#updateArray] keeps cached views; call [#reset()] when the new source has
/// different values.
///
/// Instances are not thread safe.
public class ResamplingPolicy {

    private static final Logger logger = LogManager.getLogger(ResamplingPolicy.class);

    private final ArrayEngine engine;
    private final ResamplingConfig config;
    private final ViewCache cache;
    private final Map<String, Integer> resolution = new LinkedHashMap<>();
    private final Map<String, Bound> bounds = new LinkedHashMap<>();

    private ResamplingMode mode;
    private LabeledArray source;
    private LabeledArray prepared;
    private ResamplingStrategy strategy;
    private List<Variable> edges = List.of();

    public ResamplingPolicy(LabeledArray source) {
        this(source, ResamplingConfig.defaults());
    }

    public ResamplingPolicy(LabeledArray source, ResamplingConfig config) {
        this(source, config, new DefaultArrayEngine());
    }

    public ResamplingPolicy(LabeledArray source, ResamplingConfig config, ArrayEngine engine) {
        this.config = Objects.requireNonNull(config, "config cannot be null").validate();
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.cache = config.newCache();
        this.mode = config.getMode();
        updateArray(source);
    }

    /// Requested number of bins per dimension, mutable. A missing or `null` entry selects
    /// the configured default.
    public Map<String, Integer> resolution() {
        return resolution;
    }

    /// Requested bound per dimension, mutable. A `null` entry means [Bound#full()].
    public Map<String, Bound> bounds() {
        return bounds;
    }

    public ResamplingMode mode() {
        return mode;
    }

    /// Changes the aggregation mode, clearing the cache if it differs.
    public void setMode(ResamplingMode mode) {
        Objects.requireNonNull(mode, "mode cannot be null");
        if (mode != this.mode) {
            this.mode = mode;
            reset();
        }
    }

    public LabeledArray source() {
        return source;
    }

    public ResamplingStrategy strategy() {
        return strategy;
    }

    public ResamplingConfig config() {
        return config;
    }

    public ViewCache cache() {
        return cache;
    }

    /// Target edges of the most recent successful request, in plan order.
    public List<Variable> edges() {
        return edges;
    }

    /// The view for the current resolution and bounds.
    public LabeledArray data() {
        return compute();
    }

    /// Union of the view's masks that cover only view dimensions.
    public Optional<Mask> mask() {
        LabeledArray view = data();
        return MaskCombiner.combine(view.masks(), view.dims());
    }

    /// Replaces the source and selects the strategy for it. Cached views are kept.
    public void updateArray(LabeledArray newSource) {
        Objects.requireNonNull(newSource, "source cannot be null");
        this.source = newSource;
        this.prepared = EdgeNormalizer.withEdgeCoords(newSource);
        this.strategy = ResamplingStrategy.forArray(prepared, engine);
        logger.debug("source set to {} using {}", newSource.dims(), strategy.getClass().getSimpleName());
    }

    /// Discards all cached views; the next request becomes the new home view.
    public void reset() {
        logger.debug("clearing {} cached views", cache.size());
        cache.clear();
    }

    /// Resolves the current request and returns its view, from the cache when possible.
    ///
    /// @throws DimensionException if a bounded dimension is not a source dimension
    /// @throws EmptyRangeException if a resampled range is empty or misses the coordinate
    /// @throws io.nosqlbench.arrays.UnitException if range units differ from the coordinate unit
    /// @throws IndexOutOfBoundsException if an index or window is out of range
    public LabeledArray compute() {
        Map<String, DimensionPlan> plans = new LinkedHashMap<>();
        List<Selection> selections = new ArrayList<>();
        for (Map.Entry<String, Bound> entry : bounds.entrySet()) {
            String dim = entry.getKey();
            if (!prepared.dims().contains(dim)) {
                throw new DimensionException("cannot bound '" + dim + "': source dimensions are " + prepared.labels());
            }
            int extent = prepared.dims().size(dim);
            Bound bound = entry.getValue() == null ? Bound.full() : entry.getValue();
            if (bound instanceof Bound.Index index) {
                Objects.checkIndex(index.index(), extent);
                selections.add(new Selection(dim, index.index(), index.index() + 1, true));
                plans.put(dim, new DimensionPlan.Select(index.index()));
            } else if (bound instanceof Bound.IndexRange window) {
                Objects.checkFromToIndex(window.start(), window.stop(), extent);
                selections.add(new Selection(dim, window.start(), window.stop(), false));
                plans.put(dim, new DimensionPlan.Window(window.start(), window.stop()));
            } else {
                Variable coord = EdgeNormalizer.edgesFor(prepared, dim);
                DimensionPlan.Resample plan = resamplePlan(dim, bound, coord);
                if (bound instanceof Bound.ValueRange && coord.ndim() == 1) {
                    selections.add(bracket(dim, extent, coord, plan));
                }
                plans.put(dim, plan);
            }
        }

        List<Variable> targets = targetEdges(plans);
        RequestSignature signature = new RequestSignature(plans);
        Optional<LabeledArray> cached = cache.lookup(signature);
        LabeledArray result;
        if (cached.isPresent()) {
            logger.trace("cache hit for {}", signature);
            result = cached.get();
        } else {
            logger.debug("computing view for {}", signature);
            LabeledArray view = select(prepared, selections);
            result = squeeze(strategy.resample(view, targets, mode), plans);
            cache.store(signature, result);
        }
        this.edges = targets;
        return result;
    }

    /// Applies the index selections of a request, in request order.
    LabeledArray select(LabeledArray array, List<Selection> selections) {
        LabeledArray view = array;
        for (Selection selection : selections) {
            view = selection.applyTo(view);
        }
        return view;
    }

    private DimensionPlan.Resample resamplePlan(String dim, Bound bound, Variable coord) {
        if (coord.dims().volume() == 0) {
            throw new EmptyRangeException("coordinate of '" + dim + "' is empty");
        }
        boolean descending = !coord.isSortedAscending(dim) && coord.isSortedDescending(dim);
        double first;
        double second;
        if (bound instanceof Bound.ValueRange range) {
            coord.unit().requireSame(range.low().unit(), "lower bound of '" + dim + "'");
            coord.unit().requireSame(range.high().unit(), "upper bound of '" + dim + "'");
            first = range.low().value();
            second = range.high().value();
        } else {
            first = coord.min().value();
            second = coord.max().value();
        }
        double low = descending ? Math.max(first, second) : Math.min(first, second);
        double high = descending ? Math.min(first, second) : Math.max(first, second);
        if (low == high || Double.isNaN(low) || Double.isNaN(high)) {
            throw new EmptyRangeException("range of '" + dim + "' is empty: [" + low + ", " + high + "]");
        }
        Integer requested = resolution.get(dim);
        if (requested != null && requested < 1) {
            throw new IllegalArgumentException("resolution of '" + dim + "' must be at least 1, got " + requested);
        }
        int bins = requested != null ? requested : config.getDefaultResolution();
        return new DimensionPlan.Resample(low, high, coord.unit(), requested, bins);
    }

    /// The window of source bins that overlap the planned range.
    private Selection bracket(String dim, int extent, Variable coord, DimensionPlan.Resample plan) {
        int start = Math.max(0, engine.locate(coord, Quantity.of(plan.low(), plan.unit()), ArrayEngine.Side.RIGHT) - 1);
        int stop = Math.min(extent, engine.locate(coord, Quantity.of(plan.high(), plan.unit()), ArrayEngine.Side.LEFT));
        if (start >= stop) {
            throw new EmptyRangeException("no bins of '" + dim + "' between " + plan.low() + " and " + plan.high()
                + " " + plan.unit());
        }
        return new Selection(dim, start, stop, false);
    }

    /// One-bin dimensions first, then the others in request order.
    private static List<Variable> targetEdges(Map<String, DimensionPlan> plans) {
        List<Variable> single = new ArrayList<>();
        List<Variable> rest = new ArrayList<>();
        for (Map.Entry<String, DimensionPlan> entry : plans.entrySet()) {
            if (entry.getValue() instanceof DimensionPlan.Resample plan) {
                Variable target = Variable.linspace(entry.getKey(), plan.unit(), plan.low(), plan.high(),
                    plan.resolution() + 1);
                if (plan.resolution() == 1) {
                    single.add(target);
                } else {
                    rest.add(target);
                }
            }
        }
        single.addAll(rest);
        return List.copyOf(single);
    }

    private static LabeledArray squeeze(LabeledArray view, Map<String, DimensionPlan> plans) {
        LabeledArray result = view;
        for (Map.Entry<String, DimensionPlan> entry : plans.entrySet()) {
            if (entry.getValue() instanceof DimensionPlan.Resample plan && plan.squeezes()
                && result.dims().contains(entry.getKey())) {
                result = result.squeeze(entry.getKey());
            }
        }
        return result;
    }

    /// An index selection along one dimension. `drop` selects the single index `start`
    /// and removes the dimension; otherwise `[start, stop)` is kept as a window.
    record Selection(String dim, int start, int stop, boolean drop) {

        LabeledArray applyTo(LabeledArray array) {
            return drop ? array.slice(dim, start) : array.slice(dim, start, stop);
        }
    }
}
