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

import java.util.ArrayList;
import java.util.List;

import com.github.totyumengr.pivotcubes.core.CalculationMode;
import com.github.totyumengr.pivotcubes.core.PivotConfiguration;

/**
 * JSON form of a {@link PivotConfiguration}. Absent fields fall back to {@link PivotConfiguration#defaults()}.
 * @author mengran
 *
 */
public class PivotRequest {

    private List<String> rowDimensions = new ArrayList<String>();
    private String columnDimension;
    private String valueColumn;
    private String calculationMode;
    private String filterColumn;
    private String filterValue;
    private Boolean showSubtotals;
    private Boolean showGrandTotal;

    /**
     * @return configuration of this request
     * @throws IllegalArgumentException if calculation mode is unknown
     */
    public PivotConfiguration toConfiguration() {

        PivotConfiguration.Builder builder = PivotConfiguration.builder()
                .columnDimension(columnDimension)
                .valueColumn(valueColumn)
                .filter(filterColumn, filterValue);
        if (rowDimensions != null && !rowDimensions.isEmpty()) {
            builder.rowDimensions(rowDimensions);
        }
        if (calculationMode != null) {
            builder.calculationMode(CalculationMode.of(calculationMode));
        }
        if (showSubtotals != null) {
            builder.showSubtotals(showSubtotals);
        }
        if (showGrandTotal != null) {
            builder.showGrandTotal(showGrandTotal);
        }
        return builder.build();
    }

    public List<String> getRowDimensions() {
        return rowDimensions;
    }

    public void setRowDimensions(List<String> rowDimensions) {
        this.rowDimensions = rowDimensions;
    }

    public String getColumnDimension() {
        return columnDimension;
    }

    public void setColumnDimension(String columnDimension) {
        this.columnDimension = columnDimension;
    }

    public String getValueColumn() {
        return valueColumn;
    }

    public void setValueColumn(String valueColumn) {
        this.valueColumn = valueColumn;
    }

    public String getCalculationMode() {
        return calculationMode;
    }

    public void setCalculationMode(String calculationMode) {
        this.calculationMode = calculationMode;
    }

    public String getFilterColumn() {
        return filterColumn;
    }

    public void setFilterColumn(String filterColumn) {
        this.filterColumn = filterColumn;
    }

    public String getFilterValue() {
        return filterValue;
    }

    public void setFilterValue(String filterValue) {
        this.filterValue = filterValue;
    }

    public Boolean getShowSubtotals() {
        return showSubtotals;
    }

    public void setShowSubtotals(Boolean showSubtotals) {
        this.showSubtotals = showSubtotals;
    }

    public Boolean getShowGrandTotal() {
        return showGrandTotal;
    }

    public void setShowGrandTotal(Boolean showGrandTotal) {
        this.showGrandTotal = showGrandTotal;
    }

}
