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
package com.github.totyumengr.pivotcubes.server;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestMethod;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

import com.github.totyumengr.pivotcubes.core.DrillDown;
import com.github.totyumengr.pivotcubes.core.DrillDownSummary;
import com.github.totyumengr.pivotcubes.core.PivotConfiguration;
import com.github.totyumengr.pivotcubes.core.PivotConfigurationException;
import com.github.totyumengr.pivotcubes.core.PivotEngine;
import com.github.totyumengr.pivotcubes.core.PivotRow;
import com.github.totyumengr.pivotcubes.core.PivotTable;
import com.github.totyumengr.pivotcubes.core.SourceTable;
import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * HTTP surface of the pivot engine, JSON in and out.
 * @author mengran
 *
 */
@Controller
@RequestMapping("/datasets")
public class PivotController {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotController.class);

    private final DatasetRegistry registry;

    @Autowired
    public PivotController(DatasetRegistry registry) {
        super();
        this.registry = registry;
    }

    @RequestMapping(value="/{name}", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> register(@PathVariable String name, @RequestBody DatasetRequest dataset) {

        LOGGER.info("Try to register dataset {}.", name);
        SourceTable table = registry.register(name, dataset.getHeaders(), dataset.getRows()).getSourceTable();

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("name", table.getName());
        result.put("headers", table.getHeaders());
        result.put("records", table.size());
        return result;
    }

    @RequestMapping(value="/{name}/filter-values", method=RequestMethod.GET)
    public @ResponseBody List<String> filterValues(@PathVariable String name, @RequestParam String column) {
        return registry.engine(name).filterValues(column);
    }

    @RequestMapping(value="/{name}/pivot", method=RequestMethod.POST)
    public ResponseEntity<Map<String, Object>> pivot(@PathVariable String name, @RequestBody PivotRequest request) {

        PivotEngine engine = registry.engine(name);
        PivotConfiguration configuration = request.toConfiguration();
        LOGGER.info("Try to pivot {} with {}.", name, configuration.summary());
        try {
            return ResponseEntity.ok(table(engine.pivot(configuration)));
        } catch (PivotConfigurationException e) {
            LOGGER.warn("Invalid configuration of {}: {}", name, e.getProblems());
            Map<String, Object> error = PivotExceptionHandler.error(e.getMessage());
            error.put("problems", e.getProblems());
            Optional<PivotTable> previous = engine.current();
            if (previous.isPresent()) {
                error.put("previous", table(previous.get()));
            }
            return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
        }
    }

    @RequestMapping(value="/{name}/drilldown", method=RequestMethod.POST)
    public @ResponseBody Map<String, Object> drillDown(@PathVariable String name,
            @RequestParam(defaultValue="") String sectionKey,
            @RequestParam(required=false) String column,
            @RequestBody PivotRequest request) {

        PivotConfiguration configuration = request.toConfiguration();
        LOGGER.info("Try to drill down {} section [{}] column {} with {}.", name, sectionKey, column,
                configuration.summary());
        DrillDown drillDown = registry.engine(name).drillDown(configuration, sectionKey, column);

        List<Map<String, Object>> records = new ArrayList<Map<String, Object>>(drillDown.size());
        for (Record record : drillDown.getRecords()) {
            records.add(record.getValues());
        }
        DrillDownSummary summary = drillDown.summarize(configuration.getValueColumn());

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("sectionKey", drillDown.getSectionKey());
        result.put("column", drillDown.getColumnValue());
        result.put("records", records);
        Map<String, Object> stats = new LinkedHashMap<String, Object>();
        stats.put("count", summary.getCount());
        stats.put("total", number(summary.getTotal()));
        stats.put("average", number(summary.getAverage()));
        stats.put("min", number(summary.getMin()));
        stats.put("max", number(summary.getMax()));
        result.put("summary", stats);
        return result;
    }

    private static Map<String, Object> table(PivotTable table) {

        Map<String, Object> result = new LinkedHashMap<String, Object>();
        result.put("summary", table.getConfiguration().summary());
        result.put("columns", table.getColumnValues());
        result.put("records", table.getRecordCount());

        List<Map<String, Object>> rows = new ArrayList<Map<String, Object>>(table.getRows().size());
        for (PivotRow row : table.getRows()) {
            Map<String, Object> meta = new LinkedHashMap<String, Object>();
            meta.put("kind", row.getKind().name());
            meta.put("depth", row.getMeta().getDepth());
            meta.put("path", row.getMeta().getPath());
            meta.put("sectionKey", row.getSectionKey());

            Map<String, Object> cells = new LinkedHashMap<String, Object>();
            for (Map.Entry<String, BigDecimal> e : row.getCells().getValues().entrySet()) {
                cells.put(e.getKey(), number(e.getValue()));
            }
            Map<String, Object> values = new LinkedHashMap<String, Object>();
            values.put("label", row.getLabel());
            values.put("cells", cells);
            values.put("total", number(row.getTotal()));

            Map<String, Object> view = new LinkedHashMap<String, Object>();
            view.put("meta", meta);
            view.put("values", values);
            rows.add(view);
        }
        result.put("rows", rows);
        return result;
    }

    private static double number(BigDecimal value) {
        return value.doubleValue();
    }

}
