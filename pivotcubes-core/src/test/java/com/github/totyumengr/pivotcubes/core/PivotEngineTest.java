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

import static com.github.totyumengr.pivotcubes.core.Fixtures.assertNumber;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.junit.BeforeClass;
import org.junit.FixMethodOrder;
import org.junit.Test;
import org.junit.runners.MethodSorters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.totyumengr.pivotcubes.core.PivotRow.Kind;

/**
 * @author mengran
 *
 */
@FixMethodOrder(MethodSorters.NAME_ASCENDING)
public class PivotEngineTest {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotEngineTest.class);

    private static PivotEngine examples;

    private static PivotEngine sales;

    @BeforeClass
    public static void prepare() throws Throwable {

        examples = new PivotEngine(Fixtures.regionSales());
        sales = new PivotEngine(Fixtures.load("sales.json"));
    }

    private static PivotConfiguration byRegion(CalculationMode mode) {
        return PivotConfiguration.builder().rowDimensions("Region").columnDimension("Product")
                .valueColumn("Sales").calculationMode(mode).showSubtotals(false).showGrandTotal(true).build();
    }

    @Test
    public void test_1_1_Example_sum() throws Throwable {

        PivotTable table = examples.pivot(byRegion(CalculationMode.SUM));
        LOGGER.info("{}", table.displayRows());

        Assert.assertEquals(Arrays.asList("A", "B"), table.getColumnValues());
        List<PivotRow> rows = table.getRows();
        Assert.assertEquals(3, rows.size());

        Assert.assertEquals("East", rows.get(0).getLabel());
        assertNumber("10", rows.get(0).get("A"));
        assertNumber("20", rows.get(0).get("B"));
        assertNumber("30", rows.get(0).getTotal());

        Assert.assertEquals("West", rows.get(1).getLabel());
        assertNumber("30", rows.get(1).get("A"));
        assertNumber("40", rows.get(1).get("B"));
        assertNumber("70", rows.get(1).getTotal());

        Assert.assertEquals(Kind.GRAND_TOTAL, rows.get(2).getKind());
        Assert.assertEquals(PivotRow.GRAND_TOTAL_LABEL, rows.get(2).getLabel());
        assertNumber("40", rows.get(2).get("A"));
        assertNumber("60", rows.get(2).get("B"));
        assertNumber("100", rows.get(2).getTotal());
        Assert.assertEquals("100.00000000", rows.get(2).getTotal().toString());
    }

    @Test
    public void test_1_2_Example_percentage_is_relative_to_global_sum() throws Throwable {

        PivotTable table = examples.pivot(byRegion(CalculationMode.PERCENTAGE));
        List<PivotRow> rows = table.getRows();

        assertNumber("10", rows.get(0).get("A"));
        assertNumber("20", rows.get(0).get("B"));
        assertNumber("30", rows.get(1).get("A"));
        assertNumber("40", rows.get(1).get("B"));
        assertNumber("40", rows.get(2).get("A"));
        assertNumber("60", rows.get(2).get("B"));
        Assert.assertEquals("100.00000000", rows.get(2).getTotal().toString());
    }

    @Test
    public void test_1_3_Example_two_levels_with_subtotals() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                .columnDimension("Product").valueColumn("Sales").build();
        List<PivotRow> rows = examples.pivot(configuration).getRows();

        Assert.assertEquals(7, rows.size());
        Assert.assertEquals("East | A", rows.get(0).getSectionKey());
        Assert.assertEquals("East | B", rows.get(1).getSectionKey());
        Assert.assertEquals(Kind.SUBTOTAL, rows.get(2).getKind());
        Assert.assertEquals("East", rows.get(2).getSectionKey());
        Assert.assertEquals("East" + PivotRow.SUBTOTAL_SUFFIX, rows.get(2).getLabel());
        assertNumber("30", rows.get(2).getTotal());
        Assert.assertEquals("West | A", rows.get(3).getSectionKey());
        Assert.assertEquals("West | B", rows.get(4).getSectionKey());
        Assert.assertEquals("West", rows.get(5).getSectionKey());
        assertNumber("70", rows.get(5).getTotal());
        Assert.assertEquals(Kind.GRAND_TOTAL, rows.get(6).getKind());
    }

    @Test
    public void test_2_1_Hierarchy_order_and_subtotals() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                .columnDimension("Quarter").valueColumn("Sales").build();
        PivotTable table = sales.pivot(configuration);
        List<PivotRow> rows = table.getRows();

        Assert.assertEquals(Arrays.asList("Q1", "Q2"), table.getColumnValues());
        Assert.assertEquals(12, rows.size());
        String[] expectedKeys = {"East | A", "East | B", "East", "Empty/Null | A", "Empty/Null", "North | B", "North",
            "West | A", "West | B", "West | C", "West", ""};
        for (int i = 0; i < expectedKeys.length; i++) {
            Assert.assertEquals(expectedKeys[i], rows.get(i).getSectionKey());
        }

        // East | A carries the trimmed " East " record
        assertNumber("12", rows.get(0).get("Q1"));
        assertNumber("15", rows.get(0).get("Q2"));
        // "n/a" counts one
        assertNumber("1", rows.get(1).get("Q2"));
        assertNumber("32", rows.get(2).get("Q1"));
        assertNumber("16", rows.get(2).get("Q2"));
        assertNumber("48", rows.get(2).getTotal());
        // "12.5kg" reads as 12.5
        assertNumber("12.5", rows.get(5).get("Q1"));
        assertNumber("0", rows.get(7).get("Q2"));
        assertNumber("76", rows.get(10).getTotal());
        assertNumber("80.5", rows.get(11).get("Q1"));
        assertNumber("71.5", rows.get(11).get("Q2"));
        assertNumber("152", rows.get(11).getTotal());

        Assert.assertEquals(1, rows.get(0).getMeta().getDepth());
        Assert.assertEquals(0, rows.get(2).getMeta().getDepth());
        Assert.assertEquals(Arrays.asList("East", "A"), rows.get(0).getMeta().getPath());
    }

    @Test
    public void test_2_2_Additive_rollup() throws Throwable {

        for (CalculationMode mode : Arrays.asList(CalculationMode.SUM, CalculationMode.COUNT)) {
            PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                    .columnDimension("Quarter").valueColumn("Sales").calculationMode(mode).build();
            PivotTable table = sales.pivot(configuration);

            for (PivotRow row : table.getRows()) {
                if (row.getKind() == Kind.DATA) {
                    continue;
                }
                for (String column : table.getColumnValues()) {
                    BigDecimal leaves = BigDecimal.ZERO;
                    for (PivotRow leaf : table.getRows()) {
                        if (leaf.getKind() == Kind.DATA && isUnder(leaf, row)) {
                            leaves = leaves.add(leaf.get(column));
                        }
                    }
                    Assert.assertEquals(mode + " " + row.getSectionKey() + " " + column, 0,
                            leaves.compareTo(row.get(column)));
                }
            }
        }
    }

    private static boolean isUnder(PivotRow leaf, PivotRow section) {
        List<String> path = section.getMeta().getPath();
        return leaf.getMeta().getPath().subList(0, path.size()).equals(path);
    }

    @Test
    public void test_2_3_Average_is_not_mean_of_means() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region")
                .columnDimension("Quarter").valueColumn("Sales").calculationMode(CalculationMode.AVERAGE).build();
        PivotTable table = sales.pivot(configuration);

        PivotRow east = table.row("East");
        Assert.assertEquals("10.66666667", east.get("Q1").toString());
        assertNumber("8", east.get("Q2"));
        // 48 over 5 records, not the mean of 10.67 and 8
        assertNumber("9.6", east.getTotal());

        PivotRow grand = table.row("");
        assertNumber("11.5", grand.get("Q1"));
        assertNumber("14.3", grand.get("Q2"));
        Assert.assertEquals("12.66666667", grand.getTotal().toString());
    }

    @Test
    public void test_2_4_Average_subtotal_uses_leaf_counts() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                .columnDimension("Quarter").valueColumn("Sales").calculationMode(CalculationMode.AVERAGE).build();
        PivotTable table = sales.pivot(configuration);

        // West | A: 30 and 5 in Q1, West | C: 1 in Q1 -> 36 / 3, mean of means would be 9.25
        assertNumber("17.5", table.row("West | A").get("Q1"));
        assertNumber("1", table.row("West | C").get("Q1"));
        assertNumber("12", table.row("West").get("Q1"));
        assertNumber("0", table.row("West | C").get("Q2"));
    }

    @Test
    public void test_2_5_Percentage_normalization() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region", "Product")
                .columnDimension("Quarter").valueColumn("Sales").calculationMode(CalculationMode.PERCENTAGE).build();
        PivotTable table = sales.pivot(configuration);

        PivotRow grand = table.row("");
        Assert.assertEquals("100.00000000", grand.getTotal().toString());
        BigDecimal sum = BigDecimal.ZERO;
        for (String column : table.getColumnValues()) {
            sum = sum.add(grand.get(column));
        }
        assertNumber("100", sum);

        for (PivotRow row : table.getRows()) {
            for (BigDecimal value : row.getCells().getValues().values()) {
                Assert.assertTrue(value.signum() >= 0 && value.compareTo(BigDecimal.valueOf(100)) <= 0);
            }
        }
    }

    @Test
    public void test_2_6_Count_matches_filtered_records() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Region")
                .columnDimension("Product").valueColumn("Sales").calculationMode(CalculationMode.COUNT)
                .filter("Channel", "Web").build();
        PivotTable table = sales.pivot(configuration);

        Assert.assertEquals(7, table.getRecordCount());
        assertNumber("7", table.row("").getTotal());

        PivotTable unfiltered = sales.pivot(configuration.withoutFilter());
        Assert.assertEquals(12, unfiltered.getRecordCount());
        assertNumber("12", unfiltered.row("").getTotal());
    }

    @Test
    public void test_2_7_Count_without_value_column() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Channel")
                .columnDimension("Region").build();
        PivotTable table = sales.pivot(configuration);

        Assert.assertEquals(Arrays.asList("East", "Empty/Null", "North", "West"), table.getColumnValues());
        assertNumber("2", table.row("Store").get("East"));
        assertNumber("2", table.row("Store").get("West"));
        assertNumber("5", table.row("Store").getTotal());
        assertNumber("7", table.row("Web").getTotal());
    }

    @Test
    public void test_2_8_Percentage_grand_total_adds_up_to_hundred() throws Throwable {

        List<String> headers = Arrays.asList("R", "C", "V");
        PivotEngine thirds = new PivotEngine(Fixtures.table("thirds", headers,
                new Object[] {"x", "a", 1}, new Object[] {"x", "b", 1}, new Object[] {"x", "c", 1}));
        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("R").columnDimension("C")
                .valueColumn("V").calculationMode(CalculationMode.PERCENTAGE).build();
        PivotRow grand = thirds.pivot(configuration).row("");

        Assert.assertEquals("33.33333334", grand.get("a").toString());
        Assert.assertEquals("33.33333333", grand.get("b").toString());
        Assert.assertEquals("33.33333333", grand.get("c").toString());
        Assert.assertEquals("100.00000000", grand.get("a").add(grand.get("b")).add(grand.get("c")).toString());
        Assert.assertEquals("100.00000000", grand.getTotal().toString());
        // Data cells keep their own rounding
        Assert.assertEquals("33.33333333", thirds.pivot(configuration).row("x").get("a").toString());

        Object[][] rows = new Object[7][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = new Object[] {"x", "c" + i, 1};
        }
        PivotTable sevenths = new PivotEngine(Fixtures.table("sevenths", headers, rows)).pivot(configuration);
        BigDecimal sum = BigDecimal.ZERO;
        for (String column : sevenths.getColumnValues()) {
            sum = sum.add(sevenths.row("").get(column));
        }
        Assert.assertEquals("100.00000000", sum.toString());
        Assert.assertEquals("14.28571429", sevenths.row("").get("c0").toString());
        Assert.assertEquals("14.28571428", sevenths.row("").get("c6").toString());
    }

    @Test
    public void test_2_9_Unrepresentable_number_counts_as_non_numeric() throws Throwable {

        PivotEngine engine = new PivotEngine(Fixtures.table("overflow", Arrays.asList("R", "C", "V"),
                new Object[] {"x", "a", "1e9999999999"}, new Object[] {"x", "a", 2}));
        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("R").columnDimension("C")
                .valueColumn("V").build();
        PivotTable table = engine.pivot(configuration);

        assertNumber("3", table.row("x").get("a"));
        DrillDown drillDown = table.drillDown("x", "a");
        assertNumber("2", drillDown.summarize("V").getTotal());
        Assert.assertEquals(2, drillDown.sortedBy("V", true).size());
    }

    @Test
    public void test_3_1_Determinism() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions("Product", "Region")
                .columnDimension("Channel").valueColumn("Sales").calculationMode(CalculationMode.PERCENTAGE).build();
        PivotEngine first = new PivotEngine(Fixtures.load("sales.json"), new EngineSettings(0, false));
        PivotEngine second = new PivotEngine(Fixtures.load("sales.json"), new EngineSettings(0, true));

        Assert.assertEquals(first.pivot(configuration).displayRows(), second.pivot(configuration).displayRows());
        Assert.assertEquals(first.pivot(configuration).displayRows(), first.pivot(configuration).displayRows());
        Assert.assertNotSame(first.pivot(configuration), first.pivot(configuration));
    }

    @Test
    public void test_3_2_Memoized_by_configuration() throws Throwable {

        PivotConfiguration configuration = byRegion(CalculationMode.SUM);
        PivotTable table = examples.pivot(configuration);
        Assert.assertSame(table, examples.pivot(byRegion(CalculationMode.SUM)));
        Assert.assertNotSame(table, examples.pivot(configuration.withSubtotals(true)));
    }

    @Test
    public void test_4_1_Incomplete_configuration_is_empty() throws Throwable {

        PivotTable noColumn = sales.pivot(PivotConfiguration.builder().rowDimensions("Region").build());
        Assert.assertTrue(noColumn.isEmpty());

        PivotTable noRows = sales.pivot(PivotConfiguration.defaults().withColumnDimension("Quarter"));
        Assert.assertTrue(noRows.isEmpty());
        Assert.assertTrue(noRows.drillDown("", null).isEmpty());

        PivotTable nothingPasses = sales.pivot(byRegion(CalculationMode.SUM).withFilter("Channel", "Phone"));
        Assert.assertTrue(nothingPasses.isEmpty());
    }

    @Test
    public void test_4_2_Invalid_configuration_keeps_previous_table() throws Throwable {

        PivotEngine engine = new PivotEngine(Fixtures.regionSales());
        PivotTable valid = engine.pivot(byRegion(CalculationMode.SUM));

        PivotConfiguration invalid = byRegion(CalculationMode.SUM).withColumnDimension("Quarter")
                .withFilter("Channel", "Web");
        try {
            engine.pivot(invalid);
            Assert.fail("Expect PivotConfigurationException");
        } catch (PivotConfigurationException e) {
            Assert.assertEquals(2, e.getProblems().size());
            LOGGER.info(e.getMessage());
        }
        Assert.assertSame(valid, engine.current().get());
    }

    @Test
    public void test_4_5_Drill_down_keeps_current_table() throws Throwable {

        PivotEngine engine = new PivotEngine(Fixtures.regionSales());
        PivotTable shown = engine.pivot(byRegion(CalculationMode.SUM));

        DrillDown drillDown = engine.drillDown(byRegion(CalculationMode.COUNT), "East", "A");
        Assert.assertEquals(1, drillDown.size());
        Assert.assertSame(shown, engine.current().get());
    }

    @Test
    public void test_4_3_Unset_row_slots_are_ignored() throws Throwable {

        PivotConfiguration configuration = PivotConfiguration.builder().rowDimensions(null, "Region", "")
                .columnDimension("Product").valueColumn("Sales").showSubtotals(true).build();
        PivotTable table = examples.pivot(configuration);

        Assert.assertEquals(Arrays.asList("Region"), configuration.activeRowDimensions());
        Assert.assertEquals(3, table.getRows().size());
        Assert.assertEquals(0, table.row("East").getMeta().getDepth());
    }

    @Test
    public void test_4_4_Display_rows_hide_bookkeeping() throws Throwable {

        List<Map<String, Object>> display = examples.pivot(byRegion(CalculationMode.SUM)).displayRows();
        Assert.assertEquals(Arrays.asList(PivotTable.LABEL, "A", "B", PivotTable.TOTAL),
                Arrays.asList(display.get(0).keySet().toArray()));
        Assert.assertEquals("East", display.get(0).get(PivotTable.LABEL));
    }

}
