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

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * Reverse query of a pivot cell: which source records produced it. Works directly on the {@link SourceTable}
 * with the same filter and key derivation as the aggregation, so re-aggregating the result reproduces the
 * displayed value.
 *
 * <p>Dispatches to the bitmap index when the table has one, otherwise scans.
 *
 * @author mengran
 *
 */
public class DrillDownResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(DrillDownResolver.class);

    private final SourceTable table;

    private final PivotConfiguration configuration;

    private final RowKeyBuilder keys;

    private volatile boolean useBitmapIndex;

    public DrillDownResolver(SourceTable table, PivotConfiguration configuration) {
        super();
        Assert.notNull(table, "Source table can not null.");
        Assert.notNull(configuration, "Configuration can not null.");
        this.table = table;
        this.configuration = configuration;
        this.keys = new RowKeyBuilder(configuration.getRowDimensions());
        this.useBitmapIndex = table.hasBitmapIndex();
    }

    /**
     * @param useBitmapIndex false forces scanning even when the table has a bitmap index
     */
    public void setUseBitmapIndex(boolean useBitmapIndex) {
        this.useBitmapIndex = useBitmapIndex && table.hasBitmapIndex();
    }

    /**
     * @param path hierarchy path of a node, a full composite key for a data row, empty for the grand total
     * @param columnValue column value of the cell, <code>null</code> for the whole section
     * @return matched records in source order
     */
    public List<Record> resolve(List<String> path, String columnValue) {

        Assert.notNull(path, "Path can not null.");
        if (path.size() > keys.getDimensions().size() || configuration.getColumnDimension() == null) {
            return new ArrayList<Record>(0);
        }

        StopWatch stopWatch = new StopWatch();
        stopWatch.start();
        List<Record> records = useBitmapIndex ? bitmapResolve(path, columnValue) : scanResolve(path, columnValue);
        stopWatch.stop();
        LOGGER.info("Drill down {} column {} matched {} records using {} ms, bitmap {}.",
                RowKeyBuilder.sectionKey(path), columnValue, records.size(), stopWatch.getTotalTimeMillis(),
                useBitmapIndex);
        return records;
    }

    private List<Record> scanResolve(List<String> path, String columnValue) {

        Predicate<Record> predicate = configuration::accepts;
        predicate = predicate.and(r -> keys.compositeKey(r).subList(0, path.size()).equals(path));
        if (columnValue != null) {
            String columnDimension = configuration.getColumnDimension();
            predicate = predicate.and(r -> Values.normalize(r.get(columnDimension)).equals(columnValue));
        }
        return table.getRecords().stream().filter(predicate).collect(Collectors.toList());
    }

    private List<Record> bitmapResolve(List<String> path, String columnValue) {

        RoaringBitmap ands = new RoaringBitmap();
        ands.add(0L, (long) table.size());
        if (configuration.isFilterActive()) {
            ands.and(table.bitmap(configuration.getFilterColumn(), configuration.getFilterValue()));
        }
        List<String> dimensions = keys.getDimensions();
        for (int i = 0; i < path.size(); i++) {
            ands.and(table.bitmap(dimensions.get(i), path.get(i)));
        }
        if (columnValue != null) {
            ands.and(table.bitmap(configuration.getColumnDimension(), columnValue));
        }

        int[] ids = ands.toArray();
        List<Record> records = new ArrayList<Record>(ids.length);
        for (int id : ids) {
            records.add(table.getRecord(id));
        }
        return records;
    }

}
