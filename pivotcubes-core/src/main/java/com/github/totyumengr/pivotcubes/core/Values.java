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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scalar helpers shared by grouping, aggregation and drill-down. Everything that turns a raw cell of a
 * {@link SourceTable.Record} into a key or a number goes through here, so the table and its drill-downs
 * always agree.
 *
 * @author mengran
 *
 */
public final class Values {

    /**
     * Sentinel for null, absent and blank values. Take care this value, it is a legal group.
     */
    public static final String EMPTY = "Empty/Null";

    /**
     * Leading decimal literal, the way a browser's <code>parseFloat</code> reads it.
     */
    private static final Pattern LEADING_NUMBER = Pattern.compile(
            "^[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private Values() {
        super();
    }

    /**
     * @param value raw cell value, may be null
     * @return trimmed string form, or {@link #EMPTY} when null or blank
     */
    public static String normalize(Object value) {

        if (value == null) {
            return EMPTY;
        }
        String s = value.toString().trim();
        return s.isEmpty() ? EMPTY : s;
    }

    /**
     * @param value raw cell value, may be null
     * @return true if null or blank after trimming
     */
    public static boolean isBlank(Object value) {
        return value == null || value.toString().trim().isEmpty();
    }

    /**
     * Parse a number using the longest leading decimal literal.
     * @param value raw cell value
     * @return parsed number, <code>null</code> if not numeric (including NaN, infinities and out of range exponents)
     */
    public static BigDecimal parseNumber(Object value) {

        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal) {
            return (BigDecimal) value;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return null;
            }
            return new BigDecimal(value.toString());
        }
        if (value instanceof Number) {
            return new BigDecimal(value.toString());
        }

        Matcher matcher = LEADING_NUMBER.matcher(value.toString().trim());
        if (!matcher.find()) {
            return null;
        }
        try {
            return new BigDecimal(matcher.group());
        } catch (NumberFormatException e) {
            // Exponent out of range, not a finite number
            return null;
        }
    }

    /**
     * @param value raw cell value
     * @return parsed number, zero if not numeric
     */
    public static BigDecimal numberOrZero(Object value) {

        BigDecimal n = parseNumber(value);
        return n == null ? BigDecimal.ZERO : n;
    }

}
