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

/// Flat index maps shared by the dense block types.
///
/// Each method returns, for every element of the result in row-major order, the flat
/// offset of the element to gather from the source block.
final class IndexMaps {

    private IndexMaps() {
    }

    static int[] slice(Dimensions dims, String dim, int lo, int hi) {
        int outer = dims.outerVolume(dim);
        int inner = dims.innerVolume(dim);
        int size = dims.size(dim);
        int[] map = new int[outer * (hi - lo) * inner];
        int p = 0;
        for (int o = 0; o < outer; o++) {
            for (int i = lo; i < hi; i++) {
                int base = (o * size + i) * inner;
                for (int k = 0; k < inner; k++) {
                    map[p++] = base + k;
                }
            }
        }
        return map;
    }

    static int[] broadcast(Dimensions from, Dimensions to) {
        int[] sourceStrides = from.strides();
        int[] strideInTarget = new int[to.ndim()];
        for (int axis = 0; axis < from.ndim(); axis++) {
            String label = from.labels().get(axis);
            int targetAxis = to.indexOf(label);
            if (targetAxis < 0) {
                throw new DimensionException("cannot broadcast " + from + " to " + to + ": '" + label + "' missing");
            }
            if (to.size(targetAxis) != from.size(axis)) {
                throw new ShapeException("cannot broadcast " + from + " to " + to + ": extent of '" + label + "' differs");
            }
            strideInTarget[targetAxis] = sourceStrides[axis];
        }
        int volume = to.volume();
        int[] map = new int[volume];
        int[] index = new int[to.ndim()];
        int offset = 0;
        for (int p = 0; p < volume; p++) {
            map[p] = offset;
            for (int axis = to.ndim() - 1; axis >= 0; axis--) {
                index[axis]++;
                offset += strideInTarget[axis];
                if (index[axis] < to.size(axis)) {
                    break;
                }
                offset -= strideInTarget[axis] * index[axis];
                index[axis] = 0;
            }
        }
        return map;
    }

    static double[] gather(double[] source, int[] map) {
        double[] out = new double[map.length];
        for (int i = 0; i < map.length; i++) {
            out[i] = source[map[i]];
        }
        return out;
    }

    static boolean[] gather(boolean[] source, int[] map) {
        boolean[] out = new boolean[map.length];
        for (int i = 0; i < map.length; i++) {
            out[i] = source[map[i]];
        }
        return out;
    }
}
