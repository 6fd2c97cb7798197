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

import java.util.Arrays;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;

/**
 * @author mengran
 *
 */
public class PivotConfigurationTest {

    @Test
    public void testDefaults() {

        PivotConfiguration defaults = PivotConfiguration.defaults();
        Assert.assertEquals(1, defaults.getRowDimensions().size());
        Assert.assertNull(defaults.getRowDimensions().get(0));
        Assert.assertEquals(CalculationMode.SUM, defaults.getCalculationMode());
        Assert.assertTrue(defaults.isShowSubtotals());
        Assert.assertTrue(defaults.isShowGrandTotal());
        Assert.assertFalse(defaults.isComplete());
        Assert.assertFalse(defaults.hasValueColumn());
    }

    @Test
    public void testRowDimensionSlots() {

        PivotConfiguration configuration = PivotConfiguration.defaults()
                .withRowDimension(0, "Region").addRowDimension().withRowDimension(1, "Product").addRowDimension();
        Assert.assertEquals(Arrays.asList("Region", "Product", null), configuration.getRowDimensions());
        Assert.assertEquals(Arrays.asList("Region", "Product"), configuration.activeRowDimensions());

        configuration = configuration.removeRowDimension(0);
        Assert.assertEquals(Arrays.asList("Product", null), configuration.getRowDimensions());

        PivotConfiguration single = PivotConfiguration.defaults().withRowDimension(0, "Region").removeRowDimension(0);
        Assert.assertEquals(1, single.getRowDimensions().size());
        Assert.assertTrue(single.activeRowDimensions().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRowDimensionSlotOutOfRange() {
        PivotConfiguration.defaults().withRowDimension(3, "Region");
    }

    @Test
    public void testFilterNeedsColumnAndValue() {

        PivotConfiguration configuration = PivotConfiguration.defaults();
        Assert.assertFalse(configuration.withFilter("Channel", "").isFilterActive());
        Assert.assertFalse(configuration.withFilter(" ", "Web").isFilterActive());
        Assert.assertTrue(configuration.withFilter("Channel", "Web").isFilterActive());
        Assert.assertFalse(configuration.withFilter("Channel", "Web").withoutFilter().isFilterActive());
    }

    @Test
    public void testValidateCollectsEveryProblem() {

        List<String> headers = Arrays.asList("Region", "Product", "Sales");
        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Country")
                .columnDimension("Quarter").valueColumn("Revenue").filter("Channel", "Web").build();

        List<String> problems = configuration.validate(headers);
        Assert.assertEquals(4, problems.size());
        Assert.assertTrue(problems.get(0).contains("Country"));
        Assert.assertTrue(problems.get(1).contains("Quarter"));
        Assert.assertTrue(problems.get(2).contains("Revenue"));
        Assert.assertTrue(problems.get(3).contains("Channel"));

        Assert.assertTrue(PivotConfiguration.defaults().validate(headers).isEmpty());
    }

    @Test
    public void testEqualsForCaching() {

        PivotConfiguration a = PivotConfiguration.builder().rowDimensions("Region").columnDimension("Product").build();
        PivotConfiguration b = PivotConfiguration.builder().rowDimensions(" Region ").columnDimension("Product ").build();
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, a.withCalculationMode(CalculationMode.AVERAGE));
        Assert.assertEquals(a, a.withGrandTotal(false).withGrandTotal(true));
    }

    @Test
    public void testSummary() {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                .columnDimension("Quarter").valueColumn("Sales").filter("Channel", "Web").build();
        Assert.assertEquals("Rows: Region > Product | Columns: Quarter | Values: Sales (sum) | Filter: Channel = Web",
                configuration.summary());
        Assert.assertEquals("Rows: Region > Product | Columns: Quarter | Values: Count",
                configuration.withoutFilter().withValueColumn(null).summary());
    }

    @Test
    public void testReset() {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region")
                .columnDimension("Quarter").calculationMode(CalculationMode.PERCENTAGE).showSubtotals(false).build();
        Assert.assertEquals(PivotConfiguration.defaults(), configuration.reset());
    }

}
