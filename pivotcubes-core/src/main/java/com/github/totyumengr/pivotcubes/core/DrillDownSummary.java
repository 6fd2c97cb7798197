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

/**
 * Descriptive statistics of a {@link DrillDown} over one value column.
 *
 * @author mengran
 *
 */
public final class DrillDownSummary {

    static final DrillDownSummary EMPTY = new DrillDownSummary(0, CalculationMode.zero(), CalculationMode.zero(),
            CalculationMode.zero(), CalculationMode.zero());

    private final int count;
    private final BigDecimal total;
    private final BigDecimal average;
    private final BigDecimal min;
    private final BigDecimal max;

    DrillDownSummary(int count, BigDecimal total, BigDecimal average, BigDecimal min, BigDecimal max) {
        super();
        this.count = count;
        this.total = total;
        this.average = average;
        this.min = min;
        this.max = max;
    }

    public int getCount() {
        return count;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public BigDecimal getAverage() {
        return average;
    }

    public BigDecimal getMin() {
        return min;
    }

    public BigDecimal getMax() {
        return max;
    }

    @Override
    public String toString() {
        return "DrillDownSummary [count=" + count + ", total=" + total + ", average=" + average + ", min=" + min
                + ", max=" + max + "]";
    }

}
