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

import com.google.gson.annotations.SerializedName;
import io.nosqlbench.arrays.Unit;

/// How values are aggregated when bins are merged or split.
public enum ResamplingMode {
    /// [#SUM] for count-like units, [#MEAN] for everything else.
    @SerializedName("auto")
    AUTO,
    /// Values are extensive: merged bins add up.
    @SerializedName("sum")
    SUM,
    /// Values are densities: merged bins are averaged, weighted by bin width.
    @SerializedName("mean")
    MEAN;

    /// Resolves [#AUTO] against the unit of the data; the other modes resolve to themselves.
    public ResamplingMode resolve(Unit unit) {
        if (this != AUTO) {
            return this;
        }
        return unit.isCountLike() ? SUM : MEAN;
    }
}
