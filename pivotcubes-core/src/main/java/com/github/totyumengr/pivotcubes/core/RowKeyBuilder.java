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
import java.util.Collections;
import java.util.List;

import org.springframework.util.StringUtils;

import com.github.totyumengr.pivotcubes.core.SourceTable.Record;

/**
 * Derive the composite grouping key of a record from the active row dimensions. Pure and total: a column that
 * is absent from a record yields {@link Values#EMPTY}, never an error.
 *
 * @author mengran
 *
 */
public final class RowKeyBuilder {

    /**
     * Joins a hierarchy path into a section key.
     */
    public static final String SECTION_SEPARATOR = " | ";

    private final List<String> dimensions;

    /**
     * @param rowDimensions row dimension slots, unset ones are skipped
     */
    public RowKeyBuilder(List<String> rowDimensions) {
        super();
        List<String> active = new ArrayList<String>(rowDimensions.size());
        for (String dim : rowDimensions) {
            if (StringUtils.hasText(dim)) {
                active.add(dim);
            }
        }
        this.dimensions = Collections.unmodifiableList(active);
    }

    public List<String> getDimensions() {
        return dimensions;
    }

    /**
     * @param record source record
     * @return normalized values of the active row dimensions, in order
     */
    public List<String> compositeKey(Record record) {

        List<String> key = new ArrayList<String>(dimensions.size());
        for (String dim : dimensions) {
            key.add(Values.normalize(record.get(dim)));
        }
        return Collections.unmodifiableList(key);
    }

    /**
     * @param path hierarchy path, empty for the whole table
     * @return section key of the path, <code>""</code> for the empty path
     */
    public static String sectionKey(List<String> path) {
        return String.join(SECTION_SEPARATOR, path);
    }

}
