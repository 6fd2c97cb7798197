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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flattened result of one pivot computation, immutable. Drill-downs issued through it use the very same records
 * and configuration the rows were computed from.
 *
 * @author mengran
 *
 */
public final class PivotTable {

    /**
     * Key of the label column in {@link #displayRows()}.
     */
    public static final String LABEL = "row";

    /**
     * Key of the row total in {@link #displayRows()}.
     */
    public static final String TOTAL = "total";

    private final PivotConfiguration configuration;

    private final List<String> columnValues;

    private final List<PivotRow> rows;

    private final Map<String, List<String>> sections;

    private final int recordCount;

    private final BigDecimal grandRawSum;

    private final DrillDownResolver resolver;

    PivotTable(PivotConfiguration configuration, List<String> columnValues, List<PivotRow> rows,
            Map<String, PivotNode> sections, int recordCount, BigDecimal grandRawSum, DrillDownResolver resolver) {
        this.configuration = configuration;
        this.columnValues = Collections.unmodifiableList(new ArrayList<String>(columnValues));
        this.rows = Collections.unmodifiableList(new ArrayList<PivotRow>(rows));
        Map<String, List<String>> paths = new LinkedHashMap<String, List<String>>();
        for (Map.Entry<String, PivotNode> e : sections.entrySet()) {
            paths.put(e.getKey(), e.getValue().getPath());
        }
        this.sections = Collections.unmodifiableMap(paths);
        this.recordCount = recordCount;
        this.grandRawSum = grandRawSum;
        this.resolver = resolver;
    }

    static PivotTable empty(PivotConfiguration configuration, DrillDownResolver resolver) {
        return new PivotTable(configuration, Collections.<String>emptyList(), Collections.<PivotRow>emptyList(),
                Collections.<String, PivotNode>emptyMap(), 0, BigDecimal.ZERO, resolver);
    }

    public PivotConfiguration getConfiguration() {
        return configuration;
    }

    /**
     * @return sorted distinct values of the column dimension
     */
    public List<String> getColumnValues() {
        return columnValues;
    }

    /**
     * @return rows in display order
     */
    public List<PivotRow> getRows() {
        return rows;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * @return number of records that passed the filter
     */
    public int getRecordCount() {
        return recordCount;
    }

    /**
     * @return raw sum of every cell, the denominator of percentages
     */
    public BigDecimal getGrandRawSum() {
        return grandRawSum;
    }

    /**
     * @param sectionKey section key
     * @return emitted row with the section key, <code>null</code> if none
     */
    public PivotRow row(String sectionKey) {

        for (PivotRow row : rows) {
            if (row.getSectionKey().equals(sectionKey)) {
                return row;
            }
        }
        return null;
    }

    /**
     * @return every section key of the hierarchy, internal nodes included even when subtotals are hidden
     */
    public Map<String, List<String>> getSections() {
        return sections;
    }

    /**
     * @return label, one entry per column value and the total per row, bookkeeping left out
     */
    public List<Map<String, Object>> displayRows() {

        List<Map<String, Object>> display = new ArrayList<Map<String, Object>>(rows.size());
        for (PivotRow row : rows) {
            Map<String, Object> values = new LinkedHashMap<String, Object>();
            values.put(LABEL, row.getLabel());
            values.putAll(row.getCells().getValues());
            values.put(TOTAL, row.getTotal());
            display.add(values);
        }
        return display;
    }

    /**
     * @param sectionKey section key of a data, subtotal or grand-total row
     * @param columnValue column value of the cell, <code>null</code> for the whole section
     * @return contributing records, empty if section key is unknown
     */
    public DrillDown drillDown(String sectionKey, String columnValue) {

        List<String> path = sections.get(sectionKey);
        if (path == null) {
            return DrillDown.empty(sectionKey, columnValue);
        }
        return new DrillDown(sectionKey, columnValue, resolver.resolve(path, columnValue));
    }

    @Override
    public String toString() {
        return "PivotTable [" + configuration.summary() + ", columns=" + columnValues.size() + ", rows="
                + rows.size() + ", records=" + recordCount + "]";
    }

}
