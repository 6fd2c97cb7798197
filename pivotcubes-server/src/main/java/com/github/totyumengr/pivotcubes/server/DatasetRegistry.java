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
package com.github.totyumengr.pivotcubes.server;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.pivotcubes.core.EngineSettings;
import com.github.totyumengr.pivotcubes.core.PivotEngine;
import com.github.totyumengr.pivotcubes.core.SourceTable;
import com.github.totyumengr.pivotcubes.core.SourceTable.Builder;

/**
 * Holds one {@link PivotEngine} per dataset name, in memory only.
 * @author mengran
 *
 */
@Service
public class DatasetRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(DatasetRegistry.class);

    private final Map<String, PivotEngine> engines = new ConcurrentHashMap<String, PivotEngine>();

    private final EngineSettings settings;

    public DatasetRegistry(@Value("${pivotcubes.cache.capacity:16}") int cacheCapacity,
            @Value("${pivotcubes.bitmap-index.enabled:true}") boolean bitmapIndexEnabled) {
        super();
        this.settings = new EngineSettings(cacheCapacity, bitmapIndexEnabled);
        LOGGER.info("Dataset registry uses {}", settings);
    }

    /**
     * Register or replace a dataset. The previous engine, its cache and its last table are dropped.
     * @param name dataset name
     * @param headers column names in order
     * @param rows records
     * @return engine of the dataset
     * @throws IllegalArgumentException if headers or rows are missing
     */
    public PivotEngine register(String name, List<String> headers, List<Map<String, Object>> rows) {

        Assert.notNull(headers, "Headers of dataset " + name + " can not null.");
        Assert.notNull(rows, "Rows of dataset " + name + " can not null.");

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        SourceTable table = new Builder().build(name).addColumns(headers).addRecords(rows).done();
        PivotEngine engine = new PivotEngine(table, settings);
        stopWatch.stop();

        PivotEngine previous = engines.put(name, engine);
        LOGGER.info("{} dataset {} with {} records using {} ms.", previous == null ? "Registered" : "Replaced", name,
                table.size(), stopWatch.getTotalTimeMillis());
        return engine;
    }

    /**
     * @param name dataset name
     * @return engine of the dataset
     * @throws DatasetNotFoundException if no such dataset
     */
    public PivotEngine engine(String name) {

        PivotEngine engine = engines.get(name);
        if (engine == null) {
            throw new DatasetNotFoundException(name);
        }
        return engine;
    }

    public Collection<String> names() {
        return engines.keySet();
    }

}
