/*
 * Copyright 2014 Ran Meng
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *         http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.github.totyumengr.pivotcubes.core;

import org.springframework.util.Assert;

/**
 * Tunables of a {@link PivotEngine}.
 *
 * @author mengran
 *
 */
public class EngineSettings {

    public static final int DEFAULT_CACHE_CAPACITY = 16;

    private final int cacheCapacity;

    private final boolean bitmapIndexEnabled;

    /**
     * @param cacheCapacity how many tables are memoized per engine, 0 disables memoization
     * @param bitmapIndexEnabled drill down through bitmap index instead of scanning
     */
    public EngineSettings(int cacheCapacity, boolean bitmapIndexEnabled) {
        super();
        Assert.isTrue(cacheCapacity >= 0, "Cache capacity can not negative.");
        this.cacheCapacity = cacheCapacity;
        this.bitmapIndexEnabled = bitmapIndexEnabled;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(DEFAULT_CACHE_CAPACITY, true);
    }

    public int getCacheCapacity() {
        return cacheCapacity;
    }

    public boolean isBitmapIndexEnabled() {
        return bitmapIndexEnabled;
    }

    @Override
    public String toString() {
        return "EngineSettings [cacheCapacity=" + cacheCapacity + ", bitmapIndexEnabled=" + bitmapIndexEnabled + "]";
    }

}
