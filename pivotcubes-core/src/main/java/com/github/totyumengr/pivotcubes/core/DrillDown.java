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
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * Records behind one pivot cell, with the query that selected them.
 *
 * @author mengran
 *
 */
public final class DrillDown {

    private final String sectionKey;

    private final String columnValue;

    private final List<Record> records;

    public DrillDown(String sectionKey, String columnValue, List<Record> records) {
        super();
        this.sectionKey = sectionKey;
        this.columnValue = columnValue;
        this.records = Collections.unmodifiableList(new ArrayList<Record>(records));
    }

    public static DrillDown empty(String sectionKey, String columnValue) {
        return new DrillDown(sectionKey, columnValue, Collections.<Record>emptyList());
    }

    public String getSectionKey() {
        return sectionKey;
    }

    /**
     * @return column value of the cell, <code>null</code> when the whole section was asked for
     */
    public String getColumnValue() {
        return columnValue;
    }

    /**
     * @return records in source order
     */
    public List<Record> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /**
     * Stable sort by the numeric value of a column, unparsable values count as zero.
     * @param column column to sort on
     * @param descending largest first when true
     * @return sorted copy
     */
    public DrillDown sortedBy(String column, boolean descending) {

        Comparator<Record> comparator = Comparator.comparing(r -> Values.numberOrZero(r.get(column)));
        if (descending) {
            comparator = comparator.reversed();
        }
        List<Record> sorted = new ArrayList<Record>(records);
        sorted.sort(comparator);
        return new DrillDown(sectionKey, columnValue, sorted);
    }

    /**
     * @param valueColumn numeric column, unparsable values count as zero
     * @return count, total, average, min and max of the column over the records
     */
    public DrillDownSummary summarize(String valueColumn) {

        if (records.isEmpty()) {
            return DrillDownSummary.EMPTY;
        }
        BigDecimal total = BigDecimal.ZERO;
        BigDecimal min = null;
        BigDecimal max = null;
        for (Record record : records) {
            BigDecimal value = valueColumn == null ? BigDecimal.ZERO : Values.numberOrZero(record.get(valueColumn));
            total = total.add(value);
            min = min == null || value.compareTo(min) < 0 ? value : min;
            max = max == null || value.compareTo(max) > 0 ? value : max;
        }
        BigDecimal average = total.divide(BigDecimal.valueOf(records.size()), Aggregations.IND_SCALE,
                RoundingMode.HALF_UP);
        return new DrillDownSummary(records.size(), scale(total), average, scale(min), scale(max));
    }

    /**
     * Apply a calculation mode to these records alone. For a drill-down of a displayed cell this gives back the
     * displayed value.
     * @param mode calculation mode of the table
     * @param valueColumn value column of the table, <code>null</code> for unit counting
     * @param grandRawSum grand raw sum of the table, read by {@link CalculationMode#PERCENTAGE}
     * @return value in units of the mode
     */
    public BigDecimal reaggregate(CalculationMode mode, String valueColumn, BigDecimal grandRawSum) {

        BigDecimal sum = BigDecimal.ZERO;
        for (Record record : records) {
            BigDecimal parsed = valueColumn == null ? null : Values.parseNumber(record.get(valueColumn));
            sum = sum.add(mode.contribution(parsed));
        }
        return mode.present(sum, records.size(), grandRawSum);
    }

    private static BigDecimal scale(BigDecimal value) {
        return value.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }

    @Override
    public String toString() {
        return "DrillDown [sectionKey=" + sectionKey + ", columnValue=" + columnValue + ", records="
                + records.size() + "]";
    }

}
