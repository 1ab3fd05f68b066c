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

/// Binned (ragged) payload: every outer cell owns a contiguous range of rows of a shared
/// [EventTable].
///
/// Cells are laid out row-major over the outer [Dimensions]. Slicing the outer
/// dimensions selects cell ranges and never copies the events, so a slice stays a cheap
/// view on the same table.
public final class BinnedData {

    private final Dimensions dims;
    private final EventTable events;
    private final int[] begin;
    private final int[] end;

    private BinnedData(Dimensions dims, EventTable events, int[] begin, int[] end) {
        this.dims = dims;
        this.events = events;
        this.begin = begin;
        this.end = end;
    }

    /// Creates binned data from explicit per-cell row ranges.
    ///
    /// @throws ShapeException if the ranges do not match the outer volume or fall outside the table
    public static BinnedData of(Dimensions dims, EventTable events, int[] begin, int[] end) {
        Objects.requireNonNull(dims, "dims cannot be null");
        Objects.requireNonNull(events, "events cannot be null");
        if (begin.length != dims.volume() || end.length != dims.volume()) {
            throw new ShapeException("expected " + dims.volume() + " bin ranges for " + dims);
        }
        for (int c = 0; c < begin.length; c++) {
            if (begin[c] < 0 || end[c] < begin[c] || end[c] > events.size()) {
                throw new ShapeException("bin " + c + " has invalid event range [" + begin[c] + ", " + end[c] + ")");
            }
        }
        return new BinnedData(dims, events, begin.clone(), end.clone());
    }

    /// Creates binned data from cumulative offsets: cell `c` owns rows `[offsets[c], offsets[c + 1])`.
    public static BinnedData fromOffsets(Dimensions dims, EventTable events, int[] offsets) {
        if (offsets.length != dims.volume() + 1) {
            throw new ShapeException("expected " + (dims.volume() + 1) + " offsets for " + dims);
        }
        int[] begin = new int[dims.volume()];
        int[] end = new int[dims.volume()];
        for (int c = 0; c < begin.length; c++) {
            begin[c] = offsets[c];
            end[c] = offsets[c + 1];
        }
        return of(dims, events, begin, end);
    }

    public Dimensions dims() {
        return dims;
    }

    public EventTable events() {
        return events;
    }

    public int begin(int cell) {
        return begin[cell];
    }

    public int end(int cell) {
        return end[cell];
    }

    public int cellSize(int cell) {
        return end[cell] - begin[cell];
    }

    /// Total number of events referenced by the cells.
    public long eventCount() {
        long total = 0;
        for (int c = 0; c < begin.length; c++) {
            total += end[c] - begin[c];
        }
        return total;
    }

    public BinnedData slice(String dim, int index) {
        int[] map = IndexMaps.slice(dims, dim, index, index + 1);
        return new BinnedData(dims.without(dim), events, gather(begin, map), gather(end, map));
    }

    public BinnedData slice(String dim, int lo, int hi) {
        int[] map = IndexMaps.slice(dims, dim, lo, hi);
        return new BinnedData(dims.withSize(dim, hi - lo), events, gather(begin, map), gather(end, map));
    }

    private static int[] gather(int[] source, int[] map) {
        int[] out = new int[map.length];
        for (int i = 0; i < map.length; i++) {
            out[i] = source[map[i]];
        }
        return out;
    }

    @Override
    public String toString() {
        return "BinnedData" + dims + "[" + eventCount() + " events]";
    }
}
