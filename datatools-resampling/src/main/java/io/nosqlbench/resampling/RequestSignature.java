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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/// Structural key of a view: the resolved plan of every bounded dimension.
///
/// Equal signatures always produce equal views of the same source.
public record RequestSignature(Map<String, DimensionPlan> plans) {

    public RequestSignature {
        plans = Collections.unmodifiableMap(new LinkedHashMap<>(plans));
    }

    @Override
    public String toString() {
        return "RequestSignature" + plans;
    }
}
