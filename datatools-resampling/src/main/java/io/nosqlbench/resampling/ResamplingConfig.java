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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import io.nosqlbench.resampling.cache.CachePolicy;
import io.nosqlbench.resampling.cache.ViewCache;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON-serializable settings of a {@link ResamplingPolicy}.
 *
 * <h2>JSON Schema</h2>
 *
 * <pre>{@code
 * {
 *   "default_resolution": 1,   // bins of a resampled dimension without explicit resolution
 *   "mode": "auto",            // auto | sum | mean
 *   "cache": "home_last",      // home_last | lru
 *   "cache_capacity": 8        // views kept besides the home view, lru only
 * }
 * }</pre>
 *
 * <p>Every field is optional; missing fields keep the defaults shown above. Loaded
 * configurations are validated before they are returned.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * ResamplingConfig config = ResamplingConfig.load(Path.of("resampling.json"));
 * ResamplingPolicy policy = new ResamplingPolicy(array, config);
 * }</pre>
 */
public class ResamplingConfig {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    @SerializedName("default_resolution")
    private int defaultResolution = 1;

    @SerializedName("mode")
    private ResamplingMode mode = ResamplingMode.AUTO;

    @SerializedName("cache")
    private CachePolicy cache = CachePolicy.HOME_LAST;

    @SerializedName("cache_capacity")
    private int cacheCapacity = 8;

    public ResamplingConfig() {
    }

    /**
     * @return the configuration with all defaults
     */
    public static ResamplingConfig defaults() {
        return new ResamplingConfig();
    }

    public int getDefaultResolution() {
        return defaultResolution;
    }

    public ResamplingConfig setDefaultResolution(int defaultResolution) {
        this.defaultResolution = defaultResolution;
        return this;
    }

    public ResamplingMode getMode() {
        return mode;
    }

    public ResamplingConfig setMode(ResamplingMode mode) {
        this.mode = mode;
        return this;
    }

    public CachePolicy getCache() {
        return cache;
    }

    public ResamplingConfig setCache(CachePolicy cache) {
        this.cache = cache;
        return this;
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public ResamplingConfig setCacheCapacity(int cacheCapacity) {
        this.cacheCapacity = cacheCapacity;
        return this;
    }

    /**
     * Creates the view cache selected by this configuration.
     */
    public ViewCache newCache() {
        return cache.create(cacheCapacity);
    }

    /**
     * Checks the settings.
     *
     * @return this configuration
     * @throws IllegalArgumentException if a setting is missing or out of range
     */
    public ResamplingConfig validate() {
        if (defaultResolution < 1) {
            throw new IllegalArgumentException("default_resolution must be at least 1, got " + defaultResolution);
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must be one of auto, sum, mean");
        }
        if (cache == null) {
            throw new IllegalArgumentException("cache must be one of home_last, lru");
        }
        if (cacheCapacity < 1) {
            throw new IllegalArgumentException("cache_capacity must be at least 1, got " + cacheCapacity);
        }
        return this;
    }

    /**
     * Parses and validates a configuration.
     *
     * @param json the JSON string
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or a setting is invalid
     */
    public static ResamplingConfig fromJson(String json) {
        try {
            return orDefaults(GSON.fromJson(json, ResamplingConfig.class)).validate();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed resampling configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Parses and validates a configuration from a Reader.
     *
     * @param reader the reader providing JSON
     * @return the validated configuration
     * @throws IllegalArgumentException if the JSON is malformed or a setting is invalid
     */
    public static ResamplingConfig fromJson(Reader reader) {
        try {
            return orDefaults(GSON.fromJson(reader, ResamplingConfig.class)).validate();
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("malformed resampling configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Loads a configuration from a JSON file.
     *
     * @param path the path to the JSON file
     * @return the validated configuration
     * @throws IOException if the file cannot be read
     */
    public static ResamplingConfig load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path)) {
            return fromJson(reader);
        }
    }

    // Gson returns null for empty input
    private static ResamplingConfig orDefaults(ResamplingConfig parsed) {
        return parsed != null ? parsed : new ResamplingConfig();
    }

    public String toJson() {
        return GSON.toJson(this);
    }

    public void toJson(Writer writer) {
        GSON.toJson(this, writer);
    }

    @Override
    public String toString() {
        return "ResamplingConfig{default_resolution=" + defaultResolution + ", mode=" + mode + ", cache=" + cache
            + ", cache_capacity=" + cacheCapacity + "}";
    }
}
