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

import com.github.totyumengr.pivotcubes.core.PivotNode.Branch;
import com.github.totyumengr.pivotcubes.core.PivotNode.Leaf;
import com.github.totyumengr.pivotcubes.core.PivotRow.DataRow;
import com.github.totyumengr.pivotcubes.core.PivotRow.GrandTotalRow;
import com.github.totyumengr.pivotcubes.core.PivotRow.SubtotalRow;

/**
 * Depth-first flattening of a rolled hierarchy into display order: data rows in key order, each subtotal right
 * after the subtree it summarizes, and the grand total last.
 *
 * @author mengran
 *
 */
public final class TableFlattener {

    private final SubtotalRoller roller;

    private final List<String> columnValues;

    public TableFlattener(SubtotalRoller roller, List<String> columnValues) {
        super();
        this.roller = roller;
        this.columnValues = columnValues;
    }

    /**
     * @param root hierarchy root
     * @param showSubtotals emit a subtotal row per internal node
     * @param showGrandTotal append the grand total row
     * @return rows in display order
     */
    public List<PivotRow> flatten(Branch root, boolean showSubtotals, boolean showGrandTotal) {

        List<PivotRow> rows = flattenChildren(root, showSubtotals);
        if (showGrandTotal) {
            rows.add(new GrandTotalRow(roller.grandCells(root, columnValues), roller.total(root)));
        }
        return rows;
    }

    private List<PivotRow> flattenChildren(Branch branch, boolean showSubtotals) {

        List<PivotRow> rows = new ArrayList<PivotRow>();
        for (PivotNode child : branch.getChildren()) {
            if (child.isLeaf()) {
                rows.add(new DataRow((Leaf) child, roller.cells(child, columnValues), roller.total(child)));
            } else {
                Branch sub = (Branch) child;
                rows.addAll(flattenChildren(sub, showSubtotals));
                if (showSubtotals && sub.hasChildren()) {
                    rows.add(new SubtotalRow(sub, roller.cells(sub, columnValues), roller.total(sub)));
                }
            }
        }
        return rows;
    }

}
