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

import java.io.InputStream;
import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.Assert;
import org.springframework.core.io.ClassPathResource;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.totyumengr.pivotcubes.core.SourceTable.Builder;

/**
 * Shared test data.
 * @author mengran
 *
 */
final class Fixtures {

    static final List<String> SALES_HEADERS = Arrays.asList("Region", "Product", "Sales");

    private Fixtures() {
        super();
    }

    /**
     * The four record Region/Product/Sales table used by the examples.
     */
    static SourceTable regionSales() {
        return table("regionSales", SALES_HEADERS,
                new Object[] {"East", "A", 10},
                new Object[] {"East", "B", 20},
                new Object[] {"West", "A", 30},
                new Object[] {"West", "B", 40});
    }

    static SourceTable table(String name, List<String> headers, Object[]... rows) {

        Builder builder = new Builder().build(name).addColumns(headers);
        for (Object[] row : rows) {
            Map<String, Object> values = new LinkedHashMap<String, Object>();
            for (int i = 0; i < headers.size(); i++) {
                values.put(headers.get(i), row[i]);
            }
            builder.addRecord(values);
        }
        return builder.done();
    }

    /**
     * @param resource JSON file on classpath with "name", "headers" and "rows"
     */
    static SourceTable load(String resource) throws Exception {

        ObjectMapper objectMapper = new ObjectMapper();
        JsonNode json;
        try (InputStream in = new ClassPathResource(resource).getInputStream()) {
            json = objectMapper.readTree(in);
        }
        List<String> headers = objectMapper.convertValue(json.get("headers"), new TypeReference<List<String>>() {});
        List<Map<String, Object>> rows = objectMapper.convertValue(json.get("rows"),
                new TypeReference<List<Map<String, Object>>>() {});
        return new Builder().build(json.get("name").asText()).addColumns(headers).addRecords(rows).done();
    }

    static void assertNumber(String expected, BigDecimal actual) {
        Assert.assertNotNull("Expected " + expected + " but was null", actual);
        Assert.assertTrue("Expected " + expected + " but was " + actual, new BigDecimal(expected).compareTo(actual) == 0);
    }

}
