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

/**
 * How a cell turns its accumulated contributions into a displayed number.
 *
 * <p>The aggregation pass always accumulates an additive raw sum and a contributing record count per cell; a mode
 * only decides what one record contributes and how the pair is presented. Averages are therefore rolled up as
 * (sum of sums) / (sum of counts) and percentages share a single grand raw sum.
 *
 * @author mengran
 *
 */
public enum CalculationMode {

    SUM,

    /**
     * Raw sum divided by contributing record count, zero when nothing contributed.
     */
    AVERAGE {
        @Override
        public BigDecimal present(BigDecimal rawSum, long count, BigDecimal grandRawSum) {
            if (count == 0) {
                return zero();
            }
            return rawSum.divide(BigDecimal.valueOf(count), Aggregations.IND_SCALE, RoundingMode.HALF_UP);
        }
    },

    /**
     * Every record contributes one, the value column is ignored.
     */
    COUNT {
        @Override
        public BigDecimal contribution(BigDecimal parsedValue) {
            return BigDecimal.ONE;
        }
    },

    /**
     * Share of the grand raw sum, times 100. Zero when the grand raw sum is zero.
     */
    PERCENTAGE {
        @Override
        public BigDecimal present(BigDecimal rawSum, long count, BigDecimal grandRawSum) {
            if (grandRawSum == null || grandRawSum.signum() == 0) {
                return zero();
            }
            return rawSum.multiply(HUNDRED).divide(grandRawSum, Aggregations.IND_SCALE, RoundingMode.HALF_UP);
        }
    };

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /**
     * @param parsedValue numeric value of the value column, <code>null</code> if unset or not numeric
     * @return amount one record adds to its cell's raw sum
     */
    public BigDecimal contribution(BigDecimal parsedValue) {
        return parsedValue == null ? BigDecimal.ONE : parsedValue;
    }

    /**
     * @param rawSum additive sum of contributions
     * @param count number of contributing records
     * @param grandRawSum raw sum of the whole filtered table, only read by {@link #PERCENTAGE}
     * @return displayed value formatted using {@value Aggregations#IND_SCALE}
     */
    public BigDecimal present(BigDecimal rawSum, long count, BigDecimal grandRawSum) {
        return rawSum.setScale(Aggregations.IND_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * @param name mode name in any case, e.g. "sum" or "Percentage"
     * @return matched mode
     * @throws IllegalArgumentException if name is unknown
     */
    public static CalculationMode of(String name) {

        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Calculation mode can not empty.");
        }
        for (CalculationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name.trim())) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown calculation mode " + name);
    }

    static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(Aggregations.IND_SCALE);
    }

}
