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

package io.nosqlbench.arrays.engine;

/// How [ArrayEngine#reduceBins] turns the events of a cell into one value.
public enum BinReduction {
    /// Sum of weights; variances add.
    SUM,
    /// Mean of weights; the variance of the mean is the summed variance over the squared count.
    /// Empty cells yield NaN.
    MEAN
}
