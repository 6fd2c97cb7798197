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
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.TreeSet;

import org.roaringbitmap.RoaringBitmap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.Assert;
import org.springframework.util.StopWatch;

/**
 * Flat tabular input of a pivot: ordered headers and immutable records. It is the source of truth for every
 * {@link PivotTable} and {@link DrillDown} and is never mutated after {@link Builder#done()}.
 *
 * <p>Add bitmap index for speed up drill-down, use <a href="https://github.com/lemire/RoaringBitmap">RoaringBitmap</a>.
 * Key is column name + ":" + {@link Values#normalize(Object) normalized value}, bit is {@link Record#getId()}.
 *
 * @author mengran
 *
 */
public class SourceTable {

    private static final Logger LOGGER = LoggerFactory.getLogger(SourceTable.class);

    private final String name;

    private final LinkedHashMap<String, Integer> columnNames = new LinkedHashMap<String, Integer>();

    private final List<Record> records = new ArrayList<Record>();

    /**
     * Bitmap index for speed up drill-down. Key is columnName + ":" + normalized value
     */
    private final Map<String, RoaringBitmap> bitmapIndex = new HashMap<String, RoaringBitmap>();

    /**
     * 0 not built, 1 building, 2 ready.
     */
    private volatile int bitmapIndexStatus = 0;

    /**
     * One row of input, a mapping from column name to scalar (string, number or nothing).
     * @author mengran
     *
     */
    public static final class Record {

        private final int id;     // Ordinal in table, bit of the bitmap index.

        private final Map<String, Object> values;

        private Record(int id, Map<String, Object> values) {
            super();
            this.id = id;
            this.values = Collections.unmodifiableMap(values);
        }

        public int getId() {
            return id;
        }

        /**
         * @param column column name
         * @return raw value, <code>null</code> when absent
         */
        public Object get(String column) {
            return values.get(column);
        }

        public Map<String, Object> getValues() {
            return values;
        }

        @Override
        public String toString() {
            return "Record [id=" + id + ", values=" + values + "]";
        }

    }

    private SourceTable(String name) {
        Assert.hasText(name, "Source-table name can not empty.");
        this.name = name;
    }

    /**
     * Builder pattern class for {@link SourceTable}, chain model begin with {@link #build(String)}
     * and end with {@link #done()}.
     *
     * @author mengran
     *
     */
    public static class Builder {

        private SourceTable current;

        public Builder build(String name) {

            if (current != null) {
                throw new IllegalStateException("Previous building " + current + " is doing, call #done to finish it.");
            }
            current = new SourceTable(name);
            return this;
        }

        public Builder addColumns(List<String> columnNames) {

            SourceTable table = inBuilding();
            for (String columnName : columnNames) {
                Assert.hasText(columnName, "Column name can not empty.");
                if (table.columnNames.containsKey(columnName)) {
                    throw new IllegalStateException("Column " + columnName + " has exists.");
                }
                table.columnNames.put(columnName, table.columnNames.size());
            }
            return this;
        }

        public Builder addRecord(Map<String, ?> values) {

            SourceTable table = inBuilding();
            Assert.notNull(values, "Record values can not null.");
            Assert.isTrue(table.columnNames.size() > 0, "Source-table must have a column at least.");

            table.records.add(new Record(table.records.size(), new LinkedHashMap<String, Object>(values)));
            return this;
        }

        public Builder addRecords(List<? extends Map<String, ?>> rows) {

            for (Map<String, ?> row : rows) {
                addRecord(row);
            }
            return this;
        }

        public SourceTable done() {

            SourceTable table = inBuilding();
            current = null;
            LOGGER.info("Build completed: name {} with {} columns and {} records.",
                    table.name, table.columnNames.size(), table.records.size());
            return table;
        }

        private SourceTable inBuilding() {
            if (current == null) {
                throw new IllegalStateException("Current building is not started, call #build first.");
            }
            return current;
        }
    }

    // ---------------------------- Bitmap API ----------------------------

    /**
     * Build bitmap index of every column, only once.
     * @return index status after call, <code>2</code> means ready.
     */
    public synchronized int buildBitmapIndex() {

        if (bitmapIndexStatus == 0) {
            // Means not have index, set building status
            bitmapIndexStatus = 1;

            StopWatch stopWatch = new StopWatch();
            stopWatch.start();
            for (Record record : records) {
                for (String column : columnNames.keySet()) {
                    String bitmapKey = bitmapKey(column, Values.normalize(record.get(column)));
                    RoaringBitmap bitmap = bitmapIndex.get(bitmapKey);
                    if (bitmap == null) {
                        bitmap = new RoaringBitmap();
                        bitmapIndex.put(bitmapKey, bitmap);
                    }
                    bitmap.add(record.getId());
                }
            }
            long usedBytes = 0;
            for (Entry<String, RoaringBitmap> e : bitmapIndex.entrySet()) {
                e.getValue().runOptimize();
                usedBytes = usedBytes + e.getValue().getSizeInBytes();
            }
            stopWatch.stop();
            LOGGER.info("Builded bitmap index of {}: {} indexes used {} kb in {} ms",
                    name, bitmapIndex.size(), usedBytes / 1024, stopWatch.getTotalTimeMillis());
            // Build successfully
            bitmapIndexStatus = 2;
        }

        return bitmapIndexStatus;
    }

    public boolean hasBitmapIndex() {
        return bitmapIndexStatus == 2;
    }

    /**
     * @param column column name
     * @param normalizedValue value after {@link Values#normalize(Object)}
     * @return copy of matched record IDs, empty bitmap if none
     * @throws IllegalStateException if bitmap index is not ready
     */
    RoaringBitmap bitmap(String column, String normalizedValue) {

        if (bitmapIndexStatus != 2) {
            throw new IllegalStateException("Bitmap index of " + name + " is not ready, call #buildBitmapIndex first.");
        }
        RoaringBitmap bitmap = bitmapIndex.get(bitmapKey(column, normalizedValue));
        return bitmap == null ? new RoaringBitmap() : bitmap.clone();
    }

    private static String bitmapKey(String column, String normalizedValue) {
        return column + ":" + normalizedValue;
    }

    // ---------------------------- Meta API ----------------------------

    public String getName() {
        return name;
    }

    public List<String> getHeaders() {
        return Collections.unmodifiableList(new ArrayList<String>(columnNames.keySet()));
    }

    public boolean hasColumn(String column) {
        return column != null && columnNames.containsKey(column);
    }

    public List<Record> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public Record getRecord(int id) {
        return records.get(id);
    }

    public int size() {
        return records.size();
    }

    /**
     * Choices for a filter value: distinct, trimmed, non-blank values of the column in lexicographic order.
     * @param column column name
     * @return sorted values, empty if column is unknown
     */
    public List<String> filterValues(String column) {

        if (!hasColumn(column)) {
            return Collections.emptyList();
        }
        TreeSet<String> values = new TreeSet<String>();
        for (Record record : records) {
            Object value = record.get(column);
            if (!Values.isBlank(value)) {
                values.add(value.toString().trim());
            }
        }
        return new ArrayList<String>(values);
    }

    /**
     * @param column column name
     * @return distinct normalized values including {@link Values#EMPTY}, sorted
     */
    public List<String> distinctValues(String column) {

        if (!hasColumn(column)) {
            return Collections.emptyList();
        }
        TreeSet<String> values = new TreeSet<String>();
        for (Record record : records) {
            values.add(Values.normalize(record.get(column)));
        }
        return new ArrayList<String>(values);
    }

    @Override
    public String toString() {
        return "SourceTable [name=" + name + ", columns=" + columnNames.keySet() + ", records=" + records.size() + "]";
    }

}
