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

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * Raw cross tab of (composite key, column value) to an additive {@link Cell}, built in one pass over the
 * filtered records.
 *
 * <p>Only additive quantities live here: a sum of contributions and a count of contributing records. Averages
 * and percentages are presentations of these, see {@link CalculationMode#present(BigDecimal, long, BigDecimal)}.
 *
 * @author mengran
 *
 */
public final class AggregationMatrix {

    private static final Logger LOGGER = LoggerFactory.getLogger(AggregationMatrix.class);

    private final Map<List<String>, Map<String, Cell>> cells;

    private final List<String> columnValues;

    private final int recordCount;

    /**
     * Additive accumulator of one cell.
     * @author mengran
     *
     */
    public static final class Cell {

        static final Cell EMPTY = new Cell(BigDecimal.ZERO, 0);

        private final BigDecimal sum;
        private final long count;

        private Cell(BigDecimal sum, long count) {
            this.sum = sum;
            this.count = count;
        }

        static Cell of(BigDecimal contribution) {
            return new Cell(contribution, 1);
        }

        Cell plus(Cell other) {
            return new Cell(sum.add(other.sum), count + other.count);
        }

        /**
         * @return sum of contributions
         */
        public BigDecimal getSum() {
            return sum;
        }

        /**
         * @return number of contributing records
         */
        public long getCount() {
            return count;
        }

        @Override
        public String toString() {
            return "Cell [sum=" + sum + ", count=" + count + "]";
        }
    }

    private AggregationMatrix(Map<List<String>, Map<String, Cell>> cells, List<String> columnValues,
            int recordCount) {
        this.cells = cells;
        this.columnValues = columnValues;
        this.recordCount = recordCount;
    }

    /**
     * @param filteredRecords records that passed the global filter
     * @param keys composite key function
     * @param columnDimension column whose values become the output columns
     * @param valueColumn numeric column, <code>null</code> for unit counting
     * @param mode decides what one record contributes
     * @return populated matrix
     */
    public static AggregationMatrix aggregate(Collection<Record> filteredRecords, RowKeyBuilder keys,
            String columnDimension, String valueColumn, CalculationMode mode) {

        Map<List<String>, Map<String, Cell>> cells = new HashMap<List<String>, Map<String, Cell>>();
        Set<String> columnValues = new TreeSet<String>();
        for (Record record : filteredRecords) {
            List<String> key = keys.compositeKey(record);
            String columnValue = Values.normalize(record.get(columnDimension));
            BigDecimal parsed = valueColumn == null ? null : Values.parseNumber(record.get(valueColumn));

            cells.computeIfAbsent(key, k -> new HashMap<String, Cell>())
                .merge(columnValue, Cell.of(mode.contribution(parsed)), Cell::plus);
            columnValues.add(columnValue);
        }
        LOGGER.debug("Aggregated {} records into {} keys and {} columns.", filteredRecords.size(), cells.size(),
                columnValues.size());

        return new AggregationMatrix(cells, Collections.unmodifiableList(new ArrayList<String>(columnValues)),
                filteredRecords.size());
    }

    /**
     * @return distinct composite keys
     */
    public Set<List<String>> keys() {
        return Collections.unmodifiableSet(cells.keySet());
    }

    /**
     * @param key composite key
     * @return cells of the key by column value, empty if key is unknown
     */
    public Map<String, Cell> row(List<String> key) {

        Map<String, Cell> row = cells.get(key);
        return row == null ? Collections.<String, Cell>emptyMap() : Collections.unmodifiableMap(row);
    }

    /**
     * @return sorted distinct column values, shared by every output row
     */
    public List<String> columnValues() {
        return columnValues;
    }

    /**
     * @return number of filtered records aggregated
     */
    public int recordCount() {
        return recordCount;
    }

    /**
     * Sum of the whole matrix. Computed once per table and shared by every percentage cell.
     * @return grand raw sum
     */
    public BigDecimal grandRawSum() {

        BigDecimal sum = BigDecimal.ZERO;
        for (Map<String, Cell> row : cells.values()) {
            for (Cell cell : row.values()) {
                sum = sum.add(cell.getSum());
            }
        }
        return sum;
    }

}
