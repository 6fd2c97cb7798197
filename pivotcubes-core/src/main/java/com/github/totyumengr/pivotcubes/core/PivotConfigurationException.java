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

/**
 * Raised when a {@link PivotConfiguration} names columns the {@link SourceTable} does not have. It is recoverable:
 * the engine keeps its previous table, see {@link PivotEngine#current()}.
 *
 * @author mengran
 *
 */
public class PivotConfigurationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final List<String> problems;

    public PivotConfigurationException(List<String> problems) {
        super("Invalid pivot configuration: " + String.join(" ", problems));
        this.problems = Collections.unmodifiableList(new ArrayList<String>(problems));
    }

    public List<String> getProblems() {
        return problems;
    }

}
