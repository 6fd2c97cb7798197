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

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import com.github.totyumengr.pivotcubes.core.PivotConfigurationException;

/**
 * Maps engine errors to JSON error bodies.
 * @author mengran
 *
 */
@ControllerAdvice
public class PivotExceptionHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(PivotExceptionHandler.class);

    @ExceptionHandler(DatasetNotFoundException.class)
    public ResponseEntity<Map<String, Object>> notFound(DatasetNotFoundException e) {

        LOGGER.info(e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error(e.getMessage()));
    }

    @ExceptionHandler(PivotConfigurationException.class)
    public ResponseEntity<Map<String, Object>> invalidConfiguration(PivotConfigurationException e) {

        LOGGER.info(e.getMessage());
        Map<String, Object> body = error(e.getMessage());
        body.put("problems", e.getProblems());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }

    @ExceptionHandler({IllegalArgumentException.class, IllegalStateException.class})
    public ResponseEntity<Map<String, Object>> badRequest(RuntimeException e) {

        LOGGER.info("Bad request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error(e.getMessage()));
    }

    static Map<String, Object> error(String message) {

        Map<String, Object> body = new LinkedHashMap<String, Object>();
        body.put("message", message);
        return body;
    }

}
