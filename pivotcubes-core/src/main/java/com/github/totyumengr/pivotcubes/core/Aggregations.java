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

/**
 * Define supported pivot operations over one {@link SourceTable}.
 *
 * @author mengran
 *
 */
public interface Aggregations {

    /**
     * Calculation scale
     */
    int IND_SCALE = 8;

    /**
     * Build the flattened pivot table. It equal to "SELECT {rows}, {column}, SUM({value}) FROM {source table}
     * WHERE {filter} GROUP BY ROLLUP({rows}), {column}" laid out as a cross tab.
     * @param configuration pivot configuration
     * @return flattened table, empty if configuration is not complete
     * @throws PivotConfigurationException if configuration references columns that the table does not have
     */
    PivotTable pivot(PivotConfiguration configuration);

    /**
     * Source records behind a displayed cell.
     * @param configuration configuration used for the displayed table
     * @param sectionKey section key of a data, subtotal or grand-total row
     * @param columnValue column value of the cell, <code>null</code> for the whole row
     * @return contributing records, empty if nothing matched
     */
    DrillDown drillDown(PivotConfiguration configuration, String sectionKey, String columnValue);

}
