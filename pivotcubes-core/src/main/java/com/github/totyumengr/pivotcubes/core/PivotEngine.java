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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.pivotcubes.core.PivotNode.Branch;
import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * In-memory pivot engine over one {@link SourceTable}. Every configuration is a full recomputation from the
 * source records; results are memoized by configuration so that repeated requests for the same layout are free.
 *
 * <p>Pipeline: filter, {@link RowKeyBuilder}, {@link AggregationMatrix}, {@link HierarchyBuilder},
 * {@link SubtotalRoller}, {@link TableFlattener}. {@link DrillDownResolver} answers the reverse query against the
 * source records.
 *
 * @author mengran
 *
 */
public class PivotEngine implements Aggregations {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotEngine.class);

    private final SourceTable sourceTable;

    private final EngineSettings settings;

    private final Map<PivotConfiguration, PivotTable> cache;

    private volatile PivotTable current;

    public PivotEngine(SourceTable sourceTable) {
        this(sourceTable, EngineSettings.defaults());
    }

    public PivotEngine(SourceTable sourceTable, EngineSettings settings) {
        super();
        Assert.notNull(sourceTable, "Source table can not null.");
        Assert.notNull(settings, "Engine settings can not null.");
        this.sourceTable = sourceTable;
        this.settings = settings;
        final int capacity = settings.getCacheCapacity();
        this.cache = new LinkedHashMap<PivotConfiguration, PivotTable>(16, 0.75f, true) {

            private static final long serialVersionUID = 1L;

            @Override
            protected boolean removeEldestEntry(Map.Entry<PivotConfiguration, PivotTable> eldest) {
                return size() > capacity;
            }
        };
        if (settings.isBitmapIndexEnabled()) {
            sourceTable.buildBitmapIndex();
        }
    }

    // ---------------------------- Aggregation API ----------------------------

    @Override
    public synchronized PivotTable pivot(PivotConfiguration configuration) {

        PivotTable table = lookup(configuration);
        current = table;
        return table;
    }

    /**
     * Drill into a table of the configuration. Unlike {@link #pivot(PivotConfiguration)} it leaves
     * {@link #current()} untouched.
     */
    @Override
    public DrillDown drillDown(PivotConfiguration configuration, String sectionKey, String columnValue) {
        return lookup(configuration).drillDown(sectionKey, columnValue);
    }

    private synchronized PivotTable lookup(PivotConfiguration configuration) {

        Assert.notNull(configuration, "Configuration can not null.");
        List<String> problems = configuration.validate(sourceTable.getHeaders());
        if (!problems.isEmpty()) {
            LOGGER.warn("Reject configuration {} of {}: {}", configuration, sourceTable.getName(), problems);
            throw new PivotConfigurationException(problems);
        }

        PivotTable table = cache.get(configuration);
        if (table != null) {
            LOGGER.debug("Hit cached pivot {}", configuration);
        } else {
            table = compute(configuration);
            if (settings.getCacheCapacity() > 0) {
                cache.put(configuration, table);
            }
        }
        return table;
    }

    /**
     * @return last table successfully returned by {@link #pivot(PivotConfiguration)}
     */
    public Optional<PivotTable> current() {
        return Optional.ofNullable(current);
    }

    public SourceTable getSourceTable() {
        return sourceTable;
    }

    public EngineSettings getSettings() {
        return settings;
    }

    /**
     * @param column column name
     * @return filter value choices of the column
     */
    public List<String> filterValues(String column) {
        return sourceTable.filterValues(column);
    }

    private PivotTable compute(PivotConfiguration configuration) {

        StopWatch stopWatch = new StopWatch(sourceTable.getName());
        DrillDownResolver resolver = new DrillDownResolver(sourceTable, configuration);
        resolver.setUseBitmapIndex(settings.isBitmapIndexEnabled());

        stopWatch.start("filter");
        List<Record> filtered = sourceTable.getRecords().stream()
                .filter(configuration::accepts).collect(Collectors.toList());
        stopWatch.stop();
        if (!configuration.isComplete() || filtered.isEmpty()) {
            LOGGER.info("Pivot {} of {} is empty, {} records passed filter.", configuration.summary(),
                    sourceTable.getName(), filtered.size());
            return PivotTable.empty(configuration, resolver);
        }

        stopWatch.start("aggregate");
        RowKeyBuilder keys = new RowKeyBuilder(configuration.getRowDimensions());
        AggregationMatrix matrix = AggregationMatrix.aggregate(filtered, keys, configuration.getColumnDimension(),
                configuration.getValueColumn(), configuration.getCalculationMode());
        stopWatch.stop();

        stopWatch.start("rollup");
        Branch root = HierarchyBuilder.build(matrix.keys());
        SubtotalRoller roller = new SubtotalRoller(root, matrix, configuration.getCalculationMode());
        stopWatch.stop();

        stopWatch.start("flatten");
        List<PivotRow> rows = new TableFlattener(roller, matrix.columnValues())
                .flatten(root, configuration.isShowSubtotals(), configuration.isShowGrandTotal());
        PivotTable table = new PivotTable(configuration, matrix.columnValues(), rows, HierarchyBuilder.index(root),
                matrix.recordCount(), roller.getGrandRawSum(), resolver);
        stopWatch.stop();

        LOGGER.info("Pivot {} of {} result {} rows x {} columns from {} records using {} ms.",
                configuration.summary(), sourceTable.getName(), rows.size(), matrix.columnValues().size(),
                filtered.size(), stopWatch.getTotalTimeMillis());
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug(stopWatch.prettyPrint());
        }
        return table;
    }

    @Override
    public String toString() {
        return "PivotEngine [sourceTable=" + sourceTable + ", settings=" + settings + "]";
    }

}
