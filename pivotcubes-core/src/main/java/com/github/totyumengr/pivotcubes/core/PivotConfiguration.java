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
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.springframework.util.Assert;
import org.springframework.util.StringUtils;

import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * Immutable pivot configuration. Row dimension slots may be unset (<code>null</code> or empty), meaning
 * "not chosen yet", and are skipped when grouping.
 *
 * <p>Every mutator returns a new instance, so a configuration can be used as a cache key.
 *
 * @author mengran
 *
 */
public final class PivotConfiguration {

    private final List<String> rowDimensions;
    private final String columnDimension;
    private final String valueColumn;
    private final CalculationMode calculationMode;
    private final String filterColumn;
    private final String filterValue;
    private final boolean showSubtotals;
    private final boolean showGrandTotal;

    private PivotConfiguration(Builder builder) {
        this.rowDimensions = Collections.unmodifiableList(new ArrayList<String>(builder.rowDimensions));
        this.columnDimension = trimToNull(builder.columnDimension);
        this.valueColumn = trimToNull(builder.valueColumn);
        this.calculationMode = builder.calculationMode;
        this.filterColumn = trimToNull(builder.filterColumn);
        this.filterValue = builder.filterValue;
        this.showSubtotals = builder.showSubtotals;
        this.showGrandTotal = builder.showGrandTotal;
    }

    /**
     * @return one unset row slot, sum, subtotals and grand total on.
     */
    public static PivotConfiguration defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {

        Builder builder = new Builder();
        builder.rowDimensions = new ArrayList<String>(rowDimensions);
        builder.columnDimension = columnDimension;
        builder.valueColumn = valueColumn;
        builder.calculationMode = calculationMode;
        builder.filterColumn = filterColumn;
        builder.filterValue = filterValue;
        builder.showSubtotals = showSubtotals;
        builder.showGrandTotal = showGrandTotal;
        return builder;
    }

    /**
     * Fluent builder of {@link PivotConfiguration}.
     * @author mengran
     *
     */
    public static final class Builder {

        private List<String> rowDimensions = new ArrayList<String>(Collections.singletonList((String) null));
        private String columnDimension;
        private String valueColumn;
        private CalculationMode calculationMode = CalculationMode.SUM;
        private String filterColumn;
        private String filterValue;
        private boolean showSubtotals = true;
        private boolean showGrandTotal = true;

        private Builder() {
            super();
        }

        public Builder rowDimensions(String... names) {
            return rowDimensions(names == null ? Collections.<String>emptyList() : Arrays.asList(names));
        }

        public Builder rowDimensions(List<String> names) {
            this.rowDimensions = new ArrayList<String>();
            if (names != null) {
                for (String name : names) {
                    this.rowDimensions.add(trimToNull(name));
                }
            }
            return this;
        }

        public Builder columnDimension(String name) {
            this.columnDimension = name;
            return this;
        }

        public Builder valueColumn(String name) {
            this.valueColumn = name;
            return this;
        }

        public Builder calculationMode(CalculationMode mode) {
            Assert.notNull(mode, "Calculation mode can not null.");
            this.calculationMode = mode;
            return this;
        }

        public Builder filter(String column, String value) {
            this.filterColumn = column;
            this.filterValue = value;
            return this;
        }

        public Builder showSubtotals(boolean show) {
            this.showSubtotals = show;
            return this;
        }

        public Builder showGrandTotal(boolean show) {
            this.showGrandTotal = show;
            return this;
        }

        public PivotConfiguration build() {
            return new PivotConfiguration(this);
        }
    }

    // ---------------------------- Mutators ----------------------------

    public PivotConfiguration withRowDimension(int index, String name) {

        Assert.isTrue(index >= 0 && index < rowDimensions.size(), "Row dimension slot " + index + " out of range.");
        List<String> dims = new ArrayList<String>(rowDimensions);
        dims.set(index, trimToNull(name));
        return toBuilder().rowDimensions(dims).build();
    }

    /**
     * @return a copy with one more, unset, row dimension slot at the end
     */
    public PivotConfiguration addRowDimension() {

        List<String> dims = new ArrayList<String>(rowDimensions);
        dims.add(null);
        return toBuilder().rowDimensions(dims).build();
    }

    /**
     * The last remaining slot is cleared instead of removed, there is always one slot.
     */
    public PivotConfiguration removeRowDimension(int index) {

        Assert.isTrue(index >= 0 && index < rowDimensions.size(), "Row dimension slot " + index + " out of range.");
        List<String> dims = new ArrayList<String>(rowDimensions);
        if (dims.size() == 1) {
            dims.set(0, null);
        } else {
            dims.remove(index);
        }
        return toBuilder().rowDimensions(dims).build();
    }

    public PivotConfiguration withColumnDimension(String name) {
        return toBuilder().columnDimension(name).build();
    }

    public PivotConfiguration withValueColumn(String name) {
        return toBuilder().valueColumn(name).build();
    }

    public PivotConfiguration withCalculationMode(CalculationMode mode) {
        return toBuilder().calculationMode(mode).build();
    }

    public PivotConfiguration withFilter(String column, String value) {
        return toBuilder().filter(column, value).build();
    }

    public PivotConfiguration withoutFilter() {
        return toBuilder().filter(null, null).build();
    }

    public PivotConfiguration withSubtotals(boolean show) {
        return toBuilder().showSubtotals(show).build();
    }

    public PivotConfiguration withGrandTotal(boolean show) {
        return toBuilder().showGrandTotal(show).build();
    }

    /**
     * @return configuration with every option back to {@link #defaults()}
     */
    public PivotConfiguration reset() {
        return defaults();
    }

    // ---------------------------- Queries ----------------------------

    /**
     * @return all slots in order, unset ones as <code>null</code>
     */
    public List<String> getRowDimensions() {
        return rowDimensions;
    }

    /**
     * @return chosen row dimensions in order, unset slots skipped
     */
    public List<String> activeRowDimensions() {

        List<String> active = new ArrayList<String>(rowDimensions.size());
        for (String dim : rowDimensions) {
            if (dim != null) {
                active.add(dim);
            }
        }
        return active;
    }

    public String getColumnDimension() {
        return columnDimension;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public boolean hasValueColumn() {
        return valueColumn != null;
    }

    public CalculationMode getCalculationMode() {
        return calculationMode;
    }

    public String getFilterColumn() {
        return filterColumn;
    }

    public String getFilterValue() {
        return filterValue;
    }

    /**
     * @return true when both filter column and filter value are set
     */
    public boolean isFilterActive() {
        return filterColumn != null && StringUtils.hasLength(filterValue);
    }

    public boolean isShowSubtotals() {
        return showSubtotals;
    }

    public boolean isShowGrandTotal() {
        return showGrandTotal;
    }

    /**
     * @return true if at least one row dimension and the column dimension are chosen
     */
    public boolean isComplete() {
        return columnDimension != null && !activeRowDimensions().isEmpty();
    }

    /**
     * Global filter, applied before every aggregation and every drill-down.
     * @param record source record
     * @return true if record passes
     */
    public boolean accepts(Record record) {
        return !isFilterActive() || Values.normalize(record.get(filterColumn)).equals(filterValue);
    }

    /**
     * @param headers column names of the source table
     * @return problems found, empty when configuration is consistent
     */
    public List<String> validate(Collection<String> headers) {

        List<String> problems = new ArrayList<String>();
        for (String dim : activeRowDimensions()) {
            if (!headers.contains(dim)) {
                problems.add("Row dimension " + dim + " is not a column of the source table.");
            }
        }
        if (columnDimension != null && !headers.contains(columnDimension)) {
            problems.add("Column dimension " + columnDimension + " is not a column of the source table.");
        }
        if (valueColumn != null && !headers.contains(valueColumn)) {
            problems.add("Value column " + valueColumn + " is not a column of the source table.");
        }
        if (filterColumn != null && !headers.contains(filterColumn)) {
            problems.add("Filter column " + filterColumn + " is not a column of the source table.");
        }
        return problems;
    }

    /**
     * @return e.g. <code>Rows: Region &gt; Product | Columns: Quarter | Values: Sales (sum) | Filter: Channel = Web</code>
     */
    public String summary() {

        StringBuilder sb = new StringBuilder();
        sb.append("Rows: ").append(String.join(" > ", activeRowDimensions()));
        sb.append(" | Columns: ").append(columnDimension == null ? "" : columnDimension);
        sb.append(" | Values: ");
        if (valueColumn == null || calculationMode == CalculationMode.COUNT) {
            sb.append("Count");
        } else {
            sb.append(valueColumn).append(" (").append(calculationMode.name().toLowerCase()).append(")");
        }
        if (isFilterActive()) {
            sb.append(" | Filter: ").append(filterColumn).append(" = ").append(filterValue);
        }
        return sb.toString();
    }

    private static String trimToNull(String s) {
        return StringUtils.hasText(s) ? s.trim() : null;
    }

    @Override
    public boolean equals(Object obj) {

        if (this == obj) {
            return true;
        }
        if (!(obj instanceof PivotConfiguration)) {
            return false;
        }
        PivotConfiguration other = (PivotConfiguration) obj;
        return showSubtotals == other.showSubtotals && showGrandTotal == other.showGrandTotal
                && rowDimensions.equals(other.rowDimensions)
                && Objects.equals(columnDimension, other.columnDimension)
                && Objects.equals(valueColumn, other.valueColumn)
                && calculationMode == other.calculationMode
                && Objects.equals(filterColumn, other.filterColumn)
                && Objects.equals(filterValue, other.filterValue);
    }

    @Override
    public int hashCode() {
        return Objects.hash(rowDimensions, columnDimension, valueColumn, calculationMode, filterColumn, filterValue,
                showSubtotals, showGrandTotal);
    }

    @Override
    public String toString() {
        return "PivotConfiguration [rowDimensions=" + rowDimensions + ", columnDimension=" + columnDimension
                + ", valueColumn=" + valueColumn + ", calculationMode=" + calculationMode + ", filterColumn="
                + filterColumn + ", filterValue=" + filterValue + ", showSubtotals=" + showSubtotals
                + ", showGrandTotal=" + showGrandTotal + "]";
    }

}
