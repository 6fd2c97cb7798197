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
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import com.github.totyumengr.pivotcubes.core.AggregationMatrix.Cell;
import com.github.totyumengr.pivotcubes.core.PivotNode.Branch;
import com.github.totyumengr.pivotcubes.core.PivotNode.Leaf;

/**
 * Roll the raw matrix up the hierarchy. Every node gets a {@link Rollup} that is a pure function of its
 * children's rollups (leaves read the matrix), so a subtotal is always the additive merge of its descendant
 * leaves and never a mean of means.
 *
 * <p>The grand raw sum for percentages is taken once, up front, from the matrix.
 *
 * @author mengran
 *
 */
public final class SubtotalRoller {

    private final AggregationMatrix matrix;

    private final CalculationMode mode;

    private final BigDecimal grandRawSum;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final Map<String, Rollup> rollups = new HashMap<String, Rollup>();

    /**
     * Additive sums and counts of one node, per column value and across the row.
     * @author mengran
     *
     */
    public static final class Rollup {

        private final Map<String, Cell> byColumn;

        private final Cell total;

        private Rollup(Map<String, Cell> byColumn, Cell total) {
            this.byColumn = Collections.unmodifiableMap(byColumn);
            this.total = total;
        }

        static Rollup of(Map<String, Cell> row) {

            Cell total = Cell.EMPTY;
            for (Cell cell : row.values()) {
                total = total.plus(cell);
            }
            return new Rollup(new TreeMap<String, Cell>(row), total);
        }

        Rollup plus(Rollup other) {

            Map<String, Cell> merged = new TreeMap<String, Cell>(byColumn);
            for (Map.Entry<String, Cell> e : other.byColumn.entrySet()) {
                merged.merge(e.getKey(), e.getValue(), Cell::plus);
            }
            return new Rollup(merged, total.plus(other.total));
        }

        /**
         * @param columnValue column value
         * @return cell of the column, empty cell if nothing contributed
         */
        public Cell cell(String columnValue) {

            Cell cell = byColumn.get(columnValue);
            return cell == null ? Cell.EMPTY : cell;
        }

        public Cell getTotal() {
            return total;
        }

        @Override
        public String toString() {
            return "Rollup [byColumn=" + byColumn + ", total=" + total + "]";
        }
    }

    /**
     * @param root hierarchy root
     * @param matrix raw matrix the hierarchy was built from
     * @param mode calculation mode for presenting rollups
     */
    public SubtotalRoller(Branch root, AggregationMatrix matrix, CalculationMode mode) {
        super();
        this.matrix = matrix;
        this.mode = mode;
        this.grandRawSum = matrix.grandRawSum();
        roll(root);
    }

    private Rollup roll(PivotNode node) {

        Rollup rollup;
        if (node.isLeaf()) {
            rollup = Rollup.of(matrix.row(((Leaf) node).getCompositeKey()));
        } else {
            rollup = Rollup.of(Collections.<String, Cell>emptyMap());
            for (PivotNode child : ((Branch) node).getChildren()) {
                rollup = rollup.plus(roll(child));
            }
        }
        rollups.put(node.getSectionKey(), rollup);
        return rollup;
    }

    /**
     * @param node any node of the rolled hierarchy
     * @return additive rollup of the node
     * @throws IllegalArgumentException if node is not part of the rolled hierarchy
     */
    public Rollup rollup(PivotNode node) {

        Rollup rollup = rollups.get(node.getSectionKey());
        if (rollup == null) {
            throw new IllegalArgumentException("Node " + node + " is not rolled up.");
        }
        return rollup;
    }

    /**
     * @param node any node of the rolled hierarchy
     * @param columnValues output columns in order
     * @return displayed values of the node per column, in units of the calculation mode
     */
    public Map<String, BigDecimal> cells(PivotNode node, List<String> columnValues) {

        Rollup rollup = rollup(node);
        Map<String, BigDecimal> cells = new LinkedHashMap<String, BigDecimal>();
        for (String columnValue : columnValues) {
            Cell cell = rollup.cell(columnValue);
            cells.put(columnValue, mode.present(cell.getSum(), cell.getCount(), grandRawSum));
        }
        return cells;
    }

    /**
     * Displayed values of the grand total row. In {@link CalculationMode#PERCENTAGE} the shares are rounded by
     * largest remainder, so they add up to exactly 100 like the row total does.
     * @param root hierarchy root
     * @param columnValues output columns in order
     * @return displayed values of the root per column
     */
    public Map<String, BigDecimal> grandCells(Branch root, List<String> columnValues) {

        if (mode != CalculationMode.PERCENTAGE || grandRawSum.signum() == 0) {
            return cells(root, columnValues);
        }

        Rollup rollup = rollup(root);
        BigDecimal unit = BigDecimal.ONE.movePointLeft(Aggregations.IND_SCALE);
        Map<String, BigDecimal> cells = new LinkedHashMap<String, BigDecimal>();
        final Map<String, BigDecimal> remainders = new HashMap<String, BigDecimal>();
        BigDecimal rest = HUNDRED.setScale(Aggregations.IND_SCALE);
        for (String columnValue : columnValues) {
            BigDecimal share = rollup.cell(columnValue).getSum().multiply(HUNDRED)
                    .divide(grandRawSum, Aggregations.IND_SCALE * 2, RoundingMode.FLOOR);
            BigDecimal floor = share.setScale(Aggregations.IND_SCALE, RoundingMode.FLOOR);
            cells.put(columnValue, floor);
            remainders.put(columnValue, share.subtract(floor));
            rest = rest.subtract(floor);
        }

        // Hand out the rounding residue one unit at a time, largest remainder first, ties in column order
        List<String> order = new ArrayList<String>(columnValues);
        order.sort(Comparator.comparing((String c) -> remainders.get(c)).reversed());
        for (String columnValue : order) {
            if (rest.compareTo(unit) < 0) {
                break;
            }
            cells.put(columnValue, cells.get(columnValue).add(unit));
            rest = rest.subtract(unit);
        }
        return cells;
    }

    /**
     * Row total applies the same rule across all columns of the row: for average that is the row's raw sum
     * over the row's contributing record count.
     * @param node any node of the rolled hierarchy
     * @return displayed row total
     */
    public BigDecimal total(PivotNode node) {

        Cell total = rollup(node).getTotal();
        return mode.present(total.getSum(), total.getCount(), grandRawSum);
    }

    public BigDecimal getGrandRawSum() {
        return grandRawSum;
    }

    public CalculationMode getMode() {
        return mode;
    }

}
