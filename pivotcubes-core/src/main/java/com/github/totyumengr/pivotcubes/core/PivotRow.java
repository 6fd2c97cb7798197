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
 * One row of a flattened {@link PivotTable}: a {@link DataRow}, a {@link SubtotalRow} or the {@link GrandTotalRow}.
 *
 * <p>Bookkeeping ({@link Meta}: kind, depth, path, section key) and displayed values ({@link Cells}: label, one
 * number per column value, row total) are kept apart. Consumers that only display drop the former themselves.
 *
 * @author mengran
 *
 */
public abstract class PivotRow {

    public static final String SUBTOTAL_SUFFIX = " Subtotal";

    public static final String GRAND_TOTAL_LABEL = "GRAND TOTAL";

    public enum Kind {
        DATA, SUBTOTAL, GRAND_TOTAL
    }

    private final Meta meta;

    private final Cells cells;

    PivotRow(Meta meta, Cells cells) {
        this.meta = meta;
        this.cells = cells;
    }

    public Meta getMeta() {
        return meta;
    }

    public Cells getCells() {
        return cells;
    }

    public Kind getKind() {
        return meta.kind;
    }

    public String getSectionKey() {
        return meta.sectionKey;
    }

    public String getLabel() {
        return cells.label;
    }

    /**
     * @param columnValue column value
     * @return displayed value, <code>null</code> if the table has no such column
     */
    public BigDecimal get(String columnValue) {
        return cells.values.get(columnValue);
    }

    public BigDecimal getTotal() {
        return cells.total;
    }

    /**
     * Hierarchy bookkeeping of a row.
     */
    public static final class Meta {

        private final Kind kind;
        private final int depth;
        private final List<String> path;
        private final String sectionKey;

        Meta(Kind kind, int depth, List<String> path) {
            this.kind = kind;
            this.depth = depth;
            this.path = Collections.unmodifiableList(new ArrayList<String>(path));
            this.sectionKey = RowKeyBuilder.sectionKey(this.path);
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * @return indentation level, 0 for first level rows and for the grand total
         */
        public int getDepth() {
            return depth;
        }

        public List<String> getPath() {
            return path;
        }

        public String getSectionKey() {
            return sectionKey;
        }

        @Override
        public String toString() {
            return "Meta [kind=" + kind + ", depth=" + depth + ", sectionKey=" + sectionKey + "]";
        }
    }

    /**
     * Displayed part of a row.
     */
    public static final class Cells {

        private final String label;
        private final Map<String, BigDecimal> values;
        private final BigDecimal total;

        Cells(String label, Map<String, BigDecimal> values, BigDecimal total) {
            this.label = label;
            this.values = Collections.unmodifiableMap(new LinkedHashMap<String, BigDecimal>(values));
            this.total = total;
        }

        public String getLabel() {
            return label;
        }

        /**
         * @return value per column value, in column order
         */
        public Map<String, BigDecimal> getValues() {
            return values;
        }

        public BigDecimal getTotal() {
            return total;
        }

        @Override
        public String toString() {
            return label + " " + values + " total=" + total;
        }
    }

    /**
     * Row of one composite key.
     */
    public static final class DataRow extends PivotRow {

        DataRow(PivotNode.Leaf leaf, Map<String, BigDecimal> values, BigDecimal total) {
            super(new Meta(Kind.DATA, leaf.getDepth(), leaf.getPath()), new Cells(leaf.getValue(), values, total));
        }
    }

    /**
     * Row summarizing every leaf below one internal node, emitted right after that node's subtree.
     */
    public static final class SubtotalRow extends PivotRow {

        SubtotalRow(PivotNode.Branch branch, Map<String, BigDecimal> values, BigDecimal total) {
            super(new Meta(Kind.SUBTOTAL, branch.getDepth(), branch.getPath()),
                    new Cells(branch.getValue() + SUBTOTAL_SUFFIX, values, total));
        }
    }

    /**
     * Row summarizing the whole filtered record set. Its section key is <code>""</code>.
     */
    public static final class GrandTotalRow extends PivotRow {

        GrandTotalRow(Map<String, BigDecimal> values, BigDecimal total) {
            super(new Meta(Kind.GRAND_TOTAL, 0, Collections.<String>emptyList()),
                    new Cells(GRAND_TOTAL_LABEL, values, total));
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [" + meta + ", " + cells + "]";
    }

}
